package com.cdm.modelgraph.exception;

import com.cdm.modelgraph.dto.ItemFailure;
import lombok.Getter;

import java.util.List;

/**
 * Batch in which some items failed. Only raised for callers that ask for a
 * complete run; batch results otherwise carry the same failures as data.
 */
@Getter
public class PartialReconciliationException extends ModelGraphException {

    private final List<ItemFailure> failures;

    public PartialReconciliationException(String operation, List<ItemFailure> failures) {
        super(operation + " finished with " + failures.size() + " failed item(s)");
        this.failures = List.copyOf(failures);
    }
}
