package com.cdm.modelgraph.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ListType {
    SINGLE("Single"),
    MULTI_LEVEL("Multi-Level");

    private final String label;

    public static ListType fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return SINGLE;
        }
        for (ListType type : values()) {
            if (type.label.equalsIgnoreCase(label.trim()) || type.name().equalsIgnoreCase(label.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown list type: " + label);
    }
}
