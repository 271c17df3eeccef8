package com.cdm.modelgraph.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TierStructureResult {

    private String listId;

    /** Tier List ids ordered by level, index 0 is HAS_TIER_1 */
    @Builder.Default
    private List<String> tierListIds = new ArrayList<>();

    private int tierEdgesCreated;
    private int tierEdgesRemoved;
    private int chainEdgesRemoved;
    private int orphanValuesRemoved;
    /** Driver edges given to tier Lists so they match the parent */
    private int driverEdgesCreated;

    @Builder.Default
    private List<String> removedTierListIds = new ArrayList<>();
}
