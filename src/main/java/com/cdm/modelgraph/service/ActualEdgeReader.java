package com.cdm.modelgraph.service;

import com.cdm.modelgraph.graph.EdgePattern;
import com.cdm.modelgraph.graph.EdgeRef;
import com.cdm.modelgraph.graph.GraphStore;
import com.cdm.modelgraph.graph.NodeRef;
import com.cdm.modelgraph.model.DriverCategory;
import com.cdm.modelgraph.model.EntityKind;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads the driver edges that currently point at an entity, grouped by driver name.
 * More than one edge under a name means the pair was linked twice.
 */
@Component
@RequiredArgsConstructor
public class ActualEdgeReader {

    private final GraphStore graphStore;

    public Map<String, List<EdgeRef>> read(NodeRef entity, EntityKind kind, DriverCategory category) {
        List<EdgeRef> edges = graphStore.matchEdges(
                EdgePattern.incoming(category.getLabel(), kind.getDriverEdgeType(), entity));
        Map<String, List<EdgeRef>> byName = new TreeMap<>();
        for (EdgeRef edge : edges) {
            String name = edge.getFrom().getName();
            byName.computeIfAbsent(name == null ? "" : name, k -> new ArrayList<>()).add(edge);
        }
        return byName;
    }
}
