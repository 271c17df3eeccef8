package com.cdm.modelgraph.service;

import com.cdm.modelgraph.model.DriverCategory;
import com.cdm.modelgraph.model.FieldSelection;
import com.cdm.modelgraph.model.Selector;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

/**
 * Renders selectors back into driver strings.
 *
 * <p>Sector values are joined with ", " (the parser folds every extra leading segment
 * into the sector). Domain and country values are joined with a bare "," so the
 * output always has exactly four top-level segments after the sector and parses back
 * to the same selector.
 */
@Component
public class SelectorFormatter {

    public String format(Selector selector) {
        return formatField(selector.getSector(), SelectorParser.FIELD_SEPARATOR)
                + SelectorParser.FIELD_SEPARATOR + formatField(selector.getDomain(), ",")
                + SelectorParser.FIELD_SEPARATOR + formatField(selector.getCountry(), ",")
                + SelectorParser.FIELD_SEPARATOR + (selector.hasClarifier() ? selector.getClarifier() : SelectorParser.NONE);
    }

    /**
     * Collapses every field whose explicit values cover the whole current universe of
     * its category into the wildcard. An empty universe never collapses.
     */
    public Selector normalize(Selector selector, Map<DriverCategory, Set<String>> universes) {
        return selector.toBuilder()
                .sector(collapse(selector.getSector(), universes.get(DriverCategory.SECTOR)))
                .domain(collapse(selector.getDomain(), universes.get(DriverCategory.DOMAIN)))
                .country(collapse(selector.getCountry(), universes.get(DriverCategory.COUNTRY)))
                .build();
    }

    private FieldSelection collapse(FieldSelection field, Set<String> universe) {
        if (field.isWildcard() || universe == null || universe.isEmpty()) {
            return field;
        }
        return field.getValues().equals(universe) ? FieldSelection.ALL : field;
    }

    private String formatField(FieldSelection field, String separator) {
        if (field.isWildcard()) {
            return SelectorParser.WILDCARD;
        }
        if (field.getValues().isEmpty()) {
            return SelectorParser.NONE;
        }
        return String.join(separator, field.getValues());
    }
}
