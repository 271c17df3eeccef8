package com.cdm.modelgraph.graph;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Minimal set of graph primitives the reconciliation engine is written against.
 *
 * <p>Each call is atomic on its own. Callers that need several calls to be
 * atomic run them inside one transaction of the surrounding transaction manager.
 */
public interface GraphStore {

    /**
     * Find the node with {@code label} whose {@code keyProperty} equals {@code keyValue},
     * creating it when absent.
     */
    NodeRef upsertNode(String label, String keyProperty, Object keyValue);

    NodeRef createNode(String label, Map<String, Object> properties);

    Optional<NodeRef> findNode(String label, String keyProperty, Object keyValue);

    /**
     * All nodes with {@code label} whose properties equal every entry of {@code propertyFilter}.
     * An empty filter returns the whole label.
     */
    List<NodeRef> matchNodes(String label, Map<String, Object> propertyFilter);

    /**
     * Merge {@code properties} into the node; a null value removes the property.
     */
    void setNodeProperties(NodeRef node, Map<String, Object> properties);

    /**
     * Delete the node together with all of its edges.
     */
    void deleteNode(NodeRef node);

    EdgeRef createEdge(NodeRef from, NodeRef to, String type, Map<String, Object> properties);

    List<EdgeRef> matchEdges(EdgePattern pattern);

    void setEdgeProperties(EdgeRef edge, Map<String, Object> properties);

    void deleteEdge(EdgeRef edge);

    /**
     * @return number of edges deleted
     */
    int deleteEdges(EdgePattern pattern);
}
