package com.cdm.modelgraph.controller;

import com.cdm.modelgraph.dto.BatchReconciliationResult;
import com.cdm.modelgraph.dto.ListTypeChangeResult;
import com.cdm.modelgraph.dto.TierStructureDescription;
import com.cdm.modelgraph.dto.TierStructureRequest;
import com.cdm.modelgraph.dto.TierStructureResult;
import com.cdm.modelgraph.dto.TierValuesRequest;
import com.cdm.modelgraph.dto.TierValuesResult;
import com.cdm.modelgraph.model.ListType;
import com.cdm.modelgraph.service.TierChainBuilder;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/admin/lists/{listId}")
@RequiredArgsConstructor
@Tag(name = "List Tier API", description = "Multi-level List structure and value chains")
public class ListTierController {

    private final TierChainBuilder tierChainBuilder;

    @PutMapping("/tiers")
    @Operation(summary = "Set the ordered tier Lists of a List")
    public TierStructureResult setStructure(@PathVariable String listId,
                                            @Valid @RequestBody TierStructureRequest request) {
        return tierChainBuilder.setTierStructure(listId, request.getTierNames());
    }

    @PostMapping("/tiers/values")
    @Operation(summary = "Add tier values, keyed by tier 1 value")
    public TierValuesResult setValues(@PathVariable String listId, @RequestBody TierValuesRequest request) {
        return tierChainBuilder.setTierValues(listId, request.getTierListIds(), request.getValues());
    }

    @GetMapping("/tiers")
    @Operation(summary = "Describe tiers, value counts and unlinked values")
    public TierStructureDescription describe(@PathVariable String listId) {
        return tierChainBuilder.describeTierStructure(listId);
    }

    @PutMapping("/type")
    @Operation(summary = "Switch between Single and Multi-Level")
    public ListTypeChangeResult changeType(@PathVariable String listId, @RequestParam String listType) {
        return tierChainBuilder.changeListType(listId, ListType.fromLabel(listType));
    }

    @PostMapping("/cascade")
    @Operation(summary = "Copy metadata and drivers of a List onto its tier Lists")
    public BatchReconciliationResult cascade(@PathVariable String listId) {
        return tierChainBuilder.cascadeToChildren(listId);
    }
}
