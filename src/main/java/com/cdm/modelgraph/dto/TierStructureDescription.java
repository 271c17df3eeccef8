package com.cdm.modelgraph.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only view of a tiered List: its tier Lists and how well their values are chained.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TierStructureDescription {

    private String listId;
    private String listName;
    private String listType;

    @Builder.Default
    private List<TierInfo> tiers = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TierInfo {
        private int level;
        private String listId;
        private String name;
        private String chainEdgeType;
        private int valueCount;

        /** Values at level 2 and below without an inbound chain edge */
        private int unlinkedValueCount;
    }
}
