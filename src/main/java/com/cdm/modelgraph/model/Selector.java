package com.cdm.modelgraph.model;

import lombok.Builder;
import lombok.Value;

/**
 * Parsed driver string. Sector, domain and country are multi-valued or the
 * wildcard; the clarifier is single-valued, {@code null} when absent.
 */
@Value
@Builder(toBuilder = true)
public class Selector {

    /** Selects no driver in any category; used for entities without a driver string. */
    public static final Selector EMPTY = Selector.builder().build();

    @Builder.Default
    FieldSelection sector = FieldSelection.NONE;
    @Builder.Default
    FieldSelection domain = FieldSelection.NONE;
    @Builder.Default
    FieldSelection country = FieldSelection.NONE;
    String clarifier;

    public FieldSelection field(DriverCategory category) {
        return switch (category) {
            case SECTOR -> sector;
            case DOMAIN -> domain;
            case COUNTRY -> country;
            default -> clarifier == null ? FieldSelection.NONE : FieldSelection.of(clarifier);
        };
    }

    public boolean hasClarifier() {
        return clarifier != null;
    }
}
