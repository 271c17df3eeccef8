package com.cdm.modelgraph.exception;

import lombok.Getter;

/**
 * A RELATES_TO edge with the same source, target and role already exists.
 */
@Getter
public class DuplicateRelationshipException extends ModelGraphException {

    private final String sourceId;
    private final String targetId;
    private final String role;

    public DuplicateRelationshipException(String sourceId, String targetId, String role) {
        super("Relationship already exists: " + sourceId + " -> " + targetId + " (role=" + role + ")");
        this.sourceId = sourceId;
        this.targetId = targetId;
        this.role = role;
    }
}
