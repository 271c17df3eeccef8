package com.cdm.modelgraph.graph;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Set;

/**
 * Directed edge pattern. Every null or empty criterion matches anything;
 * {@code properties} are matched by equality on the edge.
 */
@Value
@Builder
public class EdgePattern {

    String fromLabel;
    NodeRef fromNode;
    @Singular
    Set<String> types;
    String toLabel;
    NodeRef toNode;
    @Singular
    Map<String, Object> properties;

    public static EdgePattern between(NodeRef from, String type, NodeRef to) {
        return EdgePattern.builder().fromNode(from).type(type).toNode(to).build();
    }

    public static EdgePattern outgoing(NodeRef from, String type, String toLabel) {
        return EdgePattern.builder().fromNode(from).type(type).toLabel(toLabel).build();
    }

    public static EdgePattern incoming(String fromLabel, String type, NodeRef to) {
        return EdgePattern.builder().fromLabel(fromLabel).type(type).toNode(to).build();
    }
}
