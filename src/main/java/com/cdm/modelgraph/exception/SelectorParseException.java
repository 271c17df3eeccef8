package com.cdm.modelgraph.exception;

import lombok.Getter;

/**
 * Driver string that does not resolve to the sector, domain, country, clarifier structure.
 * Raised before anything is written.
 */
@Getter
public class SelectorParseException extends ModelGraphException {

    private final String input;

    public SelectorParseException(String input, String reason) {
        super("Invalid driver string '" + input + "': " + reason);
        this.input = input;
    }
}
