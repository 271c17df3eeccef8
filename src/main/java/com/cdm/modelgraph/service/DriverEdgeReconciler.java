package com.cdm.modelgraph.service;

import com.cdm.modelgraph.dto.CategoryDiff;
import com.cdm.modelgraph.graph.EdgeRef;
import com.cdm.modelgraph.graph.GraphStore;
import com.cdm.modelgraph.graph.NodeRef;
import com.cdm.modelgraph.model.DriverCategory;
import com.cdm.modelgraph.model.EntityKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Brings the driver edges of one entity and category in line with an expected name set:
 * removes what is linked but not expected, links what is expected but missing.
 * Shared by Objects, Variables and Lists; only the edge type and categories differ.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DriverEdgeReconciler {

    private final GraphStore graphStore;
    private final ActualEdgeReader actualEdgeReader;

    public CategoryDiff apply(NodeRef entity, EntityKind kind, DriverCategory category, Set<String> expected) {
        Map<String, List<EdgeRef>> actual = actualEdgeReader.read(entity, kind, category);
        CategoryDiff diff = CategoryDiff.builder().category(category.getLabel()).build();

        for (Map.Entry<String, List<EdgeRef>> entry : actual.entrySet()) {
            String name = entry.getKey();
            List<EdgeRef> edges = entry.getValue();
            if (!expected.contains(name)) {
                edges.forEach(graphStore::deleteEdge);
                diff.getRemoved().add(name);
                diff.setDuplicatesRemoved(diff.getDuplicatesRemoved() + edges.size() - 1);
                log.debug("Unlinked {} '{}' from {} {}", category.getLabel(), name, kind.getLabel(), entity.getId());
            } else if (edges.size() > 1) {
                edges.subList(1, edges.size()).forEach(graphStore::deleteEdge);
                diff.setDuplicatesRemoved(diff.getDuplicatesRemoved() + edges.size() - 1);
            }
        }

        for (String name : expected) {
            if (actual.containsKey(name)) {
                continue;
            }
            NodeRef driver = graphStore.upsertNode(category.getLabel(), "name", name);
            graphStore.createEdge(driver, entity, kind.getDriverEdgeType(), Map.of());
            diff.getAdded().add(name);
            log.debug("Linked {} '{}' to {} {}", category.getLabel(), name, kind.getLabel(), entity.getId());
        }
        return diff;
    }
}
