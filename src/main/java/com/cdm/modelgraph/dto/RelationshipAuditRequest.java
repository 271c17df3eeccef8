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
public class RelationshipAuditRequest {

    /** Source Objects to audit, empty means every Object */
    @Builder.Default
    private List<String> objectIds = new ArrayList<>();

    private boolean dryRun;

    /** Overrides cdm.reconcile.prune-non-default-roles when set */
    private Boolean pruneNonDefault;
}
