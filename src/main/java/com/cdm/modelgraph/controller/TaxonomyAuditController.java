package com.cdm.modelgraph.controller;

import com.cdm.modelgraph.dto.GroupPartAuditReport;
import com.cdm.modelgraph.service.GroupPartExclusivityAuditor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/admin/taxonomy")
@RequiredArgsConstructor
@Tag(name = "Taxonomy Audit API")
public class TaxonomyAuditController {

    private final GroupPartExclusivityAuditor groupPartAuditor;

    @PostMapping("/group-part/audit")
    @Operation(summary = "Make every Group belong to at most one Part")
    public GroupPartAuditReport auditGroupPart(
            @RequestParam(defaultValue = "false") boolean dryRun,
            @RequestParam(defaultValue = "false") boolean requireMajority) {
        return groupPartAuditor.auditGroupPartExclusivity(dryRun, requireMajority);
    }
}
