package com.cdm.modelgraph.controller;

import com.cdm.modelgraph.dto.BatchReconciliationResult;
import com.cdm.modelgraph.dto.DriverNormalizationResult;
import com.cdm.modelgraph.dto.EntityDeletionResult;
import com.cdm.modelgraph.dto.ReconcileRequest;
import com.cdm.modelgraph.dto.ReconciliationResult;
import com.cdm.modelgraph.dto.WildcardPurgeResult;
import com.cdm.modelgraph.model.DriverResolutionPolicy;
import com.cdm.modelgraph.model.EntityKind;
import com.cdm.modelgraph.service.DriverReconciliationService;
import com.cdm.modelgraph.service.ModelEntityService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

/**
 * Admin endpoints for driver edges of Objects, Variables and Lists
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Driver Admin API", description = "Reconcile, backfill and repair driver edges")
public class DriverAdminController {

    private final DriverReconciliationService driverReconciliationService;
    private final ModelEntityService modelEntityService;

    @PostMapping("/drivers/reconcile")
    @Operation(summary = "Reconcile the driver edges of one entity with a driver string")
    public ReconciliationResult reconcile(@Valid @RequestBody ReconcileRequest request) {
        log.info("Reconcile request for {} {}", request.getEntityKind(), request.getEntityId());
        return driverReconciliationService.reconcileDriverEdges(
                request.getEntityId(),
                EntityKind.fromPath(request.getEntityKind()),
                request.getDriver(),
                request.getPolicy());
    }

    /**
     * Re-run reconciliation for every entity of a kind from its stored driver string.
     * Missing driver names fail the entity unless policy=UPSERT is given.
     */
    @PostMapping("/drivers/backfill/{kind}")
    @Operation(summary = "Backfill driver edges for every entity of a kind")
    public BatchReconciliationResult backfill(
            @PathVariable String kind,
            @RequestParam(required = false) DriverResolutionPolicy policy,
            @RequestParam(defaultValue = "false") boolean requireComplete) {
        BatchReconciliationResult result = driverReconciliationService.reconcileAll(EntityKind.fromPath(kind), policy);
        return requireComplete ? result.throwIfIncomplete() : result;
    }

    @PostMapping("/drivers/normalize/{kind}")
    @Operation(summary = "Rewrite stored driver strings from realized edges")
    public DriverNormalizationResult normalize(
            @PathVariable String kind,
            @RequestParam(defaultValue = "true") boolean dryRun) {
        return driverReconciliationService.normalizeDriverStrings(EntityKind.fromPath(kind), dryRun);
    }

    @PostMapping("/drivers/purge-wildcards")
    @Operation(summary = "Delete driver nodes literally named ALL")
    public WildcardPurgeResult purgeWildcards() {
        return driverReconciliationService.purgeWildcardNodes();
    }

    @DeleteMapping("/entities/{kind}/{entityId}")
    @Operation(summary = "Delete an Object, Variable or List and detach it from the graph")
    public EntityDeletionResult deleteEntity(@PathVariable String kind, @PathVariable String entityId) {
        return modelEntityService.deleteEntity(entityId, EntityKind.fromPath(kind));
    }
}
