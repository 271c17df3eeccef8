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
public class DriverNormalizationResult {

    private String entityKind;
    private boolean dryRun;
    private int checked;
    private int changed;

    @Builder.Default
    private List<Change> changes = new ArrayList<>();

    @Builder.Default
    private List<ItemFailure> errors = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Change {
        private String entityId;
        private String before;
        private String after;
    }
}
