package com.cdm.modelgraph.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IntegritySummary {

    private int variablesWithMultipleGroups;
    private int groupsWithMultipleParts;
    private int groupsWithoutPart;
    private int orphanedVariables;
}
