package com.cdm.modelgraph.controller;

import com.cdm.modelgraph.dto.AllPairsReport;
import com.cdm.modelgraph.dto.AllPairsResult;
import com.cdm.modelgraph.dto.BulkRelationshipUpdateRequest;
import com.cdm.modelgraph.dto.RelationshipAuditRequest;
import com.cdm.modelgraph.dto.RelationshipRequest;
import com.cdm.modelgraph.dto.RelationshipUpdateResult;
import com.cdm.modelgraph.service.AllPairsRelationshipEnforcer;
import com.cdm.modelgraph.service.ObjectRelationshipService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Admin endpoints for Object-to-Object relationships
 */
@RestController
@RequestMapping("/api/admin/relationships")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Relationship Admin API", description = "Default and manual Object relationships")
public class RelationshipAdminController {

    private final AllPairsRelationshipEnforcer allPairsEnforcer;
    private final ObjectRelationshipService relationshipService;

    @PostMapping("/ensure/{objectId}")
    @Operation(summary = "Create the missing default relationships of an Object in both directions")
    public AllPairsResult ensure(@PathVariable String objectId,
                                 @RequestParam(required = false) String objectName) {
        return allPairsEnforcer.ensureAllPairsRelationships(objectId, objectName);
    }

    @PostMapping("/audit")
    @Operation(summary = "Audit and repair default relationships across all Object pairs")
    public AllPairsReport audit(@RequestBody(required = false) RelationshipAuditRequest request) {
        return allPairsEnforcer.auditAllPairsRelationships(
                request != null ? request : RelationshipAuditRequest.builder().build());
    }

    @PostMapping("/{sourceId}")
    @Operation(summary = "Create a manual relationship")
    public ResponseEntity<Map<String, Object>> create(@PathVariable String sourceId,
                                                      @Valid @RequestBody RelationshipRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(relationshipService.createRelationship(sourceId, request));
    }

    @PutMapping("/{sourceId}")
    @Operation(summary = "Update type and frequency of relationships to the given targets, default edges excluded")
    public RelationshipUpdateResult update(@PathVariable String sourceId,
                                           @Valid @RequestBody BulkRelationshipUpdateRequest request) {
        return relationshipService.updateRelationshipsToTarget(sourceId, request);
    }

    @DeleteMapping("/{sourceId}")
    @Operation(summary = "Delete every relationship of the source with a given role")
    public RelationshipUpdateResult deleteByRole(@PathVariable String sourceId, @RequestParam String role) {
        return relationshipService.deleteRelationshipsWithRole(sourceId, role);
    }
}
