package com.cdm.modelgraph.exception;

/**
 * Base class of every failure raised by the reconciliation engine.
 */
public class ModelGraphException extends RuntimeException {

    public ModelGraphException(String message) {
        super(message);
    }

    public ModelGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
