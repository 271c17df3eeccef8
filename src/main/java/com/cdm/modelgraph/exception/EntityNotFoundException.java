package com.cdm.modelgraph.exception;

public class EntityNotFoundException extends ModelGraphException {

    public EntityNotFoundException(String label, String id) {
        super(label + " not found: " + id);
    }
}
