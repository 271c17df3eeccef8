package com.cdm.modelgraph.service;

import com.cdm.modelgraph.exception.SelectorParseException;
import com.cdm.modelgraph.model.FieldSelection;
import com.cdm.modelgraph.model.Selector;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Parses driver strings of the form {@code "<sector>, <domain>, <country>, <clarifier>"}.
 *
 * <p>Top-level fields are separated by comma-space. Within a field, values are separated
 * by commas. When the string has more than four top-level segments the split is
 * right-anchored: clarifier, country and domain are taken from the end and the rest is
 * rejoined as the sector. A string whose domain or country also contains ", " is
 * therefore read with the extra segments folded into the sector;
 * {@link SelectorFormatter} never produces such strings.
 */
@Component
public class SelectorParser {

    public static final String WILDCARD = "ALL";
    public static final String NONE = "None";
    static final String FIELD_SEPARATOR = ", ";

    public Selector parse(String driverString) {
        if (driverString == null) {
            throw new SelectorParseException(null, "driver string is missing");
        }
        String trimmed = driverString.trim();
        if (trimmed.isEmpty()) {
            throw new SelectorParseException(driverString, "driver string is empty");
        }

        String[] parts = trimmed.split(FIELD_SEPARATOR, -1);
        String sector;
        String domain;
        String country;
        String clarifier;

        if (parts.length >= 4) {
            int n = parts.length;
            sector = String.join(FIELD_SEPARATOR, Arrays.copyOfRange(parts, 0, n - 3));
            domain = parts[n - 3];
            country = parts[n - 2];
            clarifier = parts[n - 1];
        } else if (parts.length >= 2) {
            // Legacy strings: missing country means every country, missing clarifier means none
            sector = parts[0];
            domain = parts[1];
            country = parts.length == 3 ? parts[2] : WILDCARD;
            clarifier = NONE;
        } else {
            throw new SelectorParseException(driverString,
                    "expected sector, domain, country and clarifier separated by ', '");
        }

        return Selector.builder()
                .sector(parseField(sector))
                .domain(parseField(domain))
                .country(parseField(country))
                .clarifier(parseClarifier(driverString, clarifier))
                .build();
    }

    /**
     * Splits one field on commas. Blanks and "None" are dropped; a single "ALL" anywhere
     * turns the whole field into the wildcard.
     */
    public FieldSelection parseField(String field) {
        if (field == null) {
            return FieldSelection.NONE;
        }
        String text = field.trim();
        Set<String> values = new LinkedHashSet<>();
        boolean wildcard = false;
        for (String raw : text.split(",")) {
            String value = raw.trim();
            if (value.isEmpty() || NONE.equals(value)) {
                continue;
            }
            if (WILDCARD.equals(value)) {
                wildcard = true;
            }
            values.add(value);
        }
        return FieldSelection.parsed(text, wildcard, values);
    }

    private String parseClarifier(String input, String field) {
        String value = field == null ? "" : field.trim();
        if (value.isEmpty() || NONE.equals(value)) {
            return null;
        }
        if (WILDCARD.equals(value)) {
            throw new SelectorParseException(input, "the clarifier is single-valued and cannot be ALL");
        }
        return value;
    }
}
