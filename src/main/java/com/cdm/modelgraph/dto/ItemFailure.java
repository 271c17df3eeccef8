package com.cdm.modelgraph.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One failed item of a batch: the entity, pair or value it concerned and why it failed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ItemFailure {

    private String itemId;
    private String cause;

    public static ItemFailure of(String itemId, Exception e) {
        String cause = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return new ItemFailure(itemId, cause);
    }
}
