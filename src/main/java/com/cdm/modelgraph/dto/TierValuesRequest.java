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
 * Tier 1 value mapped to its downstream chains; each chain lists one value per
 * level starting at tier 2, e.g. {"CA": [["Los Angeles"], ["San Francisco"]]}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TierValuesRequest {

    /** Optional, read from the parent's HAS_TIER_n edges when empty */
    @Builder.Default
    private List<String> tierListIds = new ArrayList<>();

    @Builder.Default
    private Map<String, List<List<String>>> values = new LinkedHashMap<>();
}
