package com.cdm.modelgraph.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EntityDeletionResult {

    private String entityId;
    private String entityKind;
    private int tierListsRemoved;
    private int valuesRemoved;
    /** Other Objects whose relationships count changed */
    private int relationshipCountsUpdated;
}
