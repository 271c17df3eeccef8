package com.cdm.modelgraph.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum DriverCategory {
    SECTOR("Sector", false),
    DOMAIN("Domain", false),
    COUNTRY("Country", false),
    OBJECT_CLARIFIER("ObjectClarifier", true),
    VARIABLE_CLARIFIER("VariableClarifier", true);

    /** Node label of the driver nodes in this category. */
    private final String label;
    private final boolean clarifier;
}
