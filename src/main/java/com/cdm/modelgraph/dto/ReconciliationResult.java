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
public class ReconciliationResult {

    private String entityId;
    private String entityKind;
    private String driver;
    private int created;
    private int deleted;

    @Builder.Default
    private List<CategoryDiff> categories = new ArrayList<>();

    /** Tier Lists of a reconciled List, given the same driver string */
    @Builder.Default
    private List<ReconciliationResult> tierLists = new ArrayList<>();

    public boolean isUnchanged() {
        return created == 0 && deleted == 0 && tierLists.stream().allMatch(ReconciliationResult::isUnchanged);
    }
}
