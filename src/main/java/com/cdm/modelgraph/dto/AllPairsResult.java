package com.cdm.modelgraph.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of ensuring the default relationships of a newly created Object.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AllPairsResult {

    private String objectId;
    private String role;
    private int created;
    private int existing;

    @Builder.Default
    private List<ItemFailure> errors = new ArrayList<>();
}
