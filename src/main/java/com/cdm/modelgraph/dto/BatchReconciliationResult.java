package com.cdm.modelgraph.dto;

import com.cdm.modelgraph.exception.PartialReconciliationException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Summary of a best-effort batch: totals over the items that succeeded plus one
 * failure entry per item that did not.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchReconciliationResult {

    private String operation;
    private int processed;
    private int succeeded;
    private int created;
    private int deleted;
    private long durationMs;

    @Builder.Default
    private List<ItemFailure> errors = new ArrayList<>();

    public boolean isComplete() {
        return errors.isEmpty();
    }

    public BatchReconciliationResult throwIfIncomplete() {
        if (!isComplete()) {
            throw new PartialReconciliationException(operation, errors);
        }
        return this;
    }
}
