package com.cdm.modelgraph.model;

import com.cdm.modelgraph.graph.EdgeTypes;
import com.cdm.modelgraph.graph.GraphLabels;
import lombok.Getter;

import java.util.List;
import java.util.Locale;

/**
 * Entity types that carry a driver selector, with the edge type and the
 * categories their driver edges use. Driver edges always point from the
 * driver node to the entity.
 */
@Getter
public enum EntityKind {
    OBJECT(GraphLabels.OBJECT, EdgeTypes.RELEVANT_TO, "object",
            List.of(DriverCategory.SECTOR, DriverCategory.DOMAIN, DriverCategory.COUNTRY,
                    DriverCategory.OBJECT_CLARIFIER)),
    VARIABLE(GraphLabels.VARIABLE, EdgeTypes.IS_RELEVANT_TO, "name",
            List.of(DriverCategory.SECTOR, DriverCategory.DOMAIN, DriverCategory.COUNTRY,
                    DriverCategory.VARIABLE_CLARIFIER)),
    LIST(GraphLabels.LIST, EdgeTypes.IS_RELEVANT_TO, "name",
            List.of(DriverCategory.SECTOR, DriverCategory.DOMAIN, DriverCategory.COUNTRY));

    private final String label;
    private final String driverEdgeType;
    /** Property holding the entity's display name. */
    private final String nameProperty;
    private final List<DriverCategory> categories;

    EntityKind(String label, String driverEdgeType, String nameProperty, List<DriverCategory> categories) {
        this.label = label;
        this.driverEdgeType = driverEdgeType;
        this.nameProperty = nameProperty;
        this.categories = categories;
    }

    /**
     * Accepts "object", "objects", "Variable", "LIST" and similar path forms.
     */
    public static EntityKind fromPath(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Entity kind is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (normalized.endsWith("S")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        for (EntityKind kind : values()) {
            if (kind.name().equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown entity kind: " + value);
    }
}
