package com.cdm.modelgraph.graph;

/**
 * Node labels of the CDM metadata graph.
 */
public final class GraphLabels {

    public static final String OBJECT = "Object";
    public static final String VARIABLE = "Variable";
    public static final String LIST = "List";
    public static final String LIST_VALUE = "ListValue";
    public static final String PART = "Part";
    public static final String GROUP = "Group";

    private GraphLabels() {
    }
}
