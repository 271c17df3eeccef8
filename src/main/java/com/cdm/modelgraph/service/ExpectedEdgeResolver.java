package com.cdm.modelgraph.service;

import com.cdm.modelgraph.exception.DriverNotFoundException;
import com.cdm.modelgraph.graph.GraphStore;
import com.cdm.modelgraph.graph.NodeRef;
import com.cdm.modelgraph.model.DriverCategory;
import com.cdm.modelgraph.model.DriverResolutionPolicy;
import com.cdm.modelgraph.model.FieldSelection;
import com.cdm.modelgraph.model.Selector;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Computes the driver names an entity must be linked to for one category.
 *
 * <p>The wildcard is expanded against the driver nodes that exist at the moment of the
 * call. Nothing is cached between calls, so a driver added later is only picked up by
 * the next reconciliation.
 */
@Component
@RequiredArgsConstructor
public class ExpectedEdgeResolver {

    private final GraphStore graphStore;

    public Set<String> resolve(Selector selector, DriverCategory category, DriverResolutionPolicy policy) {
        FieldSelection field = selector.field(category);
        if (field.isWildcard()) {
            return universe(category);
        }
        Set<String> expected = new TreeSet<>(field.getValues());
        if (policy == DriverResolutionPolicy.REQUIRE_EXISTING) {
            for (String name : expected) {
                if (graphStore.findNode(category.getLabel(), "name", name).isEmpty()) {
                    throw new DriverNotFoundException(category, name);
                }
            }
        }
        return expected;
    }

    /**
     * Names of every driver node currently in the category. A node literally named ALL
     * is a leftover of an older data model and is never part of the universe.
     */
    public Set<String> universe(DriverCategory category) {
        Set<String> names = new TreeSet<>();
        for (NodeRef node : graphStore.matchNodes(category.getLabel(), Map.of())) {
            String name = node.getName();
            if (name != null && !SelectorParser.WILDCARD.equals(name)) {
                names.add(name);
            }
        }
        return names;
    }
}
