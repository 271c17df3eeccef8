package com.cdm.modelgraph.graph;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Relationship types of the CDM metadata graph.
 */
public final class EdgeTypes {

    public static final String RELEVANT_TO = "RELEVANT_TO";
    public static final String IS_RELEVANT_TO = "IS_RELEVANT_TO";
    public static final String RELATES_TO = "RELATES_TO";
    public static final String HAS_GROUP = "HAS_GROUP";
    public static final String HAS_VARIABLE = "HAS_VARIABLE";
    public static final String HAS_LIST_VALUE = "HAS_LIST_VALUE";

    public static final int MAX_TIER = 10;

    private static final String TIER_PREFIX = "HAS_TIER_";

    private EdgeTypes() {
    }

    /**
     * HAS_TIER_n, parent List to its level-n tier List.
     */
    public static String tier(int level) {
        if (level < 1 || level > MAX_TIER) {
            throw new IllegalArgumentException("Tier level must be between 1 and " + MAX_TIER + ": " + level);
        }
        return TIER_PREFIX + level;
    }

    public static Set<String> allTiers() {
        Set<String> types = new LinkedHashSet<>();
        for (int level = 1; level <= MAX_TIER; level++) {
            types.add(tier(level));
        }
        return types;
    }

    /**
     * Level encoded in a HAS_TIER_n type, or -1 for any other type.
     */
    public static int tierLevel(String type) {
        if (type == null || !type.startsWith(TIER_PREFIX)) {
            return -1;
        }
        try {
            return Integer.parseInt(type.substring(TIER_PREFIX.length()));
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    /**
     * Chain edge from a tier k-1 value to a tier k value, named after the tier k List:
     * "City" becomes HAS_CITY_VALUE, "Sub-Region 2" becomes HAS_SUB_REGION_2_VALUE.
     */
    public static String chainValue(String tierListName) {
        String token = tierListName == null ? "" : tierListName.trim()
                .toUpperCase(Locale.ROOT)
                .replaceAll("[^A-Z0-9]+", "_")
                .replaceAll("^_+|_+$", "");
        if (token.isEmpty()) {
            throw new IllegalArgumentException("Tier list name has no usable characters: '" + tierListName + "'");
        }
        return "HAS_" + token + "_VALUE";
    }
}
