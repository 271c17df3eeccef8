package com.cdm.modelgraph.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WildcardPurgeResult {

    @Builder.Default
    private Map<String, Integer> deletedByLabel = new LinkedHashMap<>();

    private int total;
}
