package com.cdm.modelgraph.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decision taken for one Group claimed by several Parts. The counts are kept so the
 * majority choice can be reviewed afterwards.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GroupPartResolution {

    private String groupName;
    private String chosenPart;

    @Builder.Default
    private List<String> removedParts = new ArrayList<>();

    @Builder.Default
    private Map<String, Long> variableCounts = new LinkedHashMap<>();

    /** True when the winner shares the top count and was picked by name */
    private boolean tieBroken;

    private int edgesRemoved;
    private boolean applied;
}
