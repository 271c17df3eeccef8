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
public class GroupPartAuditReport {

    private boolean dryRun;
    private int groupsChecked;
    private int conflictsFound;
    private int edgesRemoved;

    @Builder.Default
    private List<GroupPartResolution> resolutions = new ArrayList<>();

    private IntegritySummary integrity;

    @Builder.Default
    private List<ItemFailure> errors = new ArrayList<>();

    private long durationMs;

    public int getRemoved() {
        return edgesRemoved;
    }
}
