package com.cdm.modelgraph.exception;

/**
 * A structural rule of the graph would be broken, or a conflict cannot be
 * resolved without a person deciding.
 */
public class InvariantViolationException extends ModelGraphException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
