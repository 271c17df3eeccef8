package com.cdm.modelgraph.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Objects;

/**
 * Value of the {@code type} property on Object-to-Object RELATES_TO edges.
 */
@Getter
@RequiredArgsConstructor
public enum RelationshipKind {
    INTER_TABLE("Inter-Table"),
    INTRA_TABLE("Intra-Table"),
    BLOOD("Blood");

    private final String label;

    public static RelationshipKind fromLabel(String label) {
        for (RelationshipKind kind : values()) {
            if (kind.label.equalsIgnoreCase(label) || kind.name().equalsIgnoreCase(label)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown relationship type: " + label);
    }

    /**
     * Kind of the default edge between two Objects, identified by their graph element ids.
     */
    public static RelationshipKind defaultFor(String sourceElementId, String targetElementId) {
        return Objects.equals(sourceElementId, targetElementId) ? INTRA_TABLE : INTER_TABLE;
    }
}
