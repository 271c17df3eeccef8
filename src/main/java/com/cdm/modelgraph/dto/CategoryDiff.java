package com.cdm.modelgraph.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Driver edges added and removed for one category of one entity.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CategoryDiff {

    private String category;

    @Builder.Default
    private List<String> added = new ArrayList<>();

    @Builder.Default
    private List<String> removed = new ArrayList<>();

    /** Edges deleted beyond one per driver name, when a driver was linked more than once */
    private int duplicatesRemoved;

    public int getEdgesDeleted() {
        return removed.size() + duplicatesRemoved;
    }

    public boolean isUnchanged() {
        return added.isEmpty() && removed.isEmpty() && duplicatesRemoved == 0;
    }
}
