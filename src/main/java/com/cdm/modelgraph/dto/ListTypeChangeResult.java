package com.cdm.modelgraph.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ListTypeChangeResult {

    private String listId;
    private String listType;
    private int tierListsRemoved;
    private int tierValuesRemoved;
    private int tierEdgesRemoved;
}
