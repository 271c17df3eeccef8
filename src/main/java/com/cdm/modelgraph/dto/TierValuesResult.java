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
public class TierValuesResult {

    private String listId;
    private int created;
    private int existing;

    @Builder.Default
    private List<ItemFailure> errors = new ArrayList<>();
}
