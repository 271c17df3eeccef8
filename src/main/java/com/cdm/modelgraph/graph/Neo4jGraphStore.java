package com.cdm.modelgraph.graph;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Record;
import org.neo4j.driver.types.Node;
import org.neo4j.driver.types.Relationship;
import org.springframework.data.neo4j.core.Neo4jClient;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * GraphStore backed by Spring Data Neo4j's {@link Neo4jClient}, so every call
 * joins the transaction opened by the neo4jTransactionManager when one is active.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class Neo4jGraphStore implements GraphStore {

    // Labels, types and property keys are spliced into Cypher, so they are restricted to plain identifiers.
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final Neo4jClient neo4jClient;

    @Override
    public NodeRef upsertNode(String label, String keyProperty, Object keyValue) {
        String cypher = "MERGE (n:" + identifier(label) + " {" + identifier(keyProperty) + ": $value}) RETURN n";
        return neo4jClient.query(cypher)
                .bind(keyValue).to("value")
                .fetchAs(NodeRef.class)
                .mappedBy((typeSystem, record) -> toNodeRef(record.get("n").asNode()))
                .one()
                .orElseThrow(() -> new IllegalStateException("MERGE returned no node for " + label));
    }

    @Override
    public NodeRef createNode(String label, Map<String, Object> properties) {
        String cypher = "CREATE (n:" + identifier(label) + ") SET n = $props RETURN n";
        return neo4jClient.query(cypher)
                .bind(properties).to("props")
                .fetchAs(NodeRef.class)
                .mappedBy((typeSystem, record) -> toNodeRef(record.get("n").asNode()))
                .one()
                .orElseThrow(() -> new IllegalStateException("CREATE returned no node for " + label));
    }

    @Override
    public Optional<NodeRef> findNode(String label, String keyProperty, Object keyValue) {
        String cypher = "MATCH (n:" + identifier(label) + " {" + identifier(keyProperty) + ": $value}) " +
                "RETURN n LIMIT 1";
        return neo4jClient.query(cypher)
                .bind(keyValue).to("value")
                .fetchAs(NodeRef.class)
                .mappedBy((typeSystem, record) -> toNodeRef(record.get("n").asNode()))
                .one();
    }

    @Override
    public List<NodeRef> matchNodes(String label, Map<String, Object> propertyFilter) {
        StringBuilder cypher = new StringBuilder("MATCH (n:").append(identifier(label)).append(")");
        Map<String, Object> params = new HashMap<>();
        appendPropertyPredicates(cypher, "n", propertyFilter, params, true);
        cypher.append(" RETURN n");
        return new ArrayList<>(neo4jClient.query(cypher.toString())
                .bindAll(params)
                .fetchAs(NodeRef.class)
                .mappedBy((typeSystem, record) -> toNodeRef(record.get("n").asNode()))
                .all());
    }

    @Override
    public void setNodeProperties(NodeRef node, Map<String, Object> properties) {
        neo4jClient.query("MATCH (n) WHERE elementId(n) = $id SET n += $props")
                .bind(node.getElementId()).to("id")
                .bind(properties).to("props")
                .run();
    }

    @Override
    public void deleteNode(NodeRef node) {
        neo4jClient.query("MATCH (n) WHERE elementId(n) = $id DETACH DELETE n")
                .bind(node.getElementId()).to("id")
                .run();
    }

    @Override
    public EdgeRef createEdge(NodeRef from, NodeRef to, String type, Map<String, Object> properties) {
        String cypher = "MATCH (a), (b) WHERE elementId(a) = $from AND elementId(b) = $to " +
                "CREATE (a)-[r:" + identifier(type) + "]->(b) SET r = $props RETURN a, r, b";
        return neo4jClient.query(cypher)
                .bind(from.getElementId()).to("from")
                .bind(to.getElementId()).to("to")
                .bind(properties == null ? Map.of() : properties).to("props")
                .fetchAs(EdgeRef.class)
                .mappedBy((typeSystem, record) -> toEdgeRef(record))
                .one()
                .orElseThrow(() -> new IllegalStateException(
                        "Cannot create " + type + ": endpoint missing (" + from.getElementId() + " -> " + to.getElementId() + ")"));
    }

    @Override
    public List<EdgeRef> matchEdges(EdgePattern pattern) {
        Map<String, Object> params = new HashMap<>();
        String cypher = matchClause(pattern, params) + " RETURN a, r, b";
        return new ArrayList<>(neo4jClient.query(cypher)
                .bindAll(params)
                .fetchAs(EdgeRef.class)
                .mappedBy((typeSystem, record) -> toEdgeRef(record))
                .all());
    }

    @Override
    public void setEdgeProperties(EdgeRef edge, Map<String, Object> properties) {
        neo4jClient.query("MATCH ()-[r]->() WHERE elementId(r) = $id SET r += $props")
                .bind(edge.getElementId()).to("id")
                .bind(properties).to("props")
                .run();
    }

    @Override
    public void deleteEdge(EdgeRef edge) {
        neo4jClient.query("MATCH ()-[r]->() WHERE elementId(r) = $id DELETE r")
                .bind(edge.getElementId()).to("id")
                .run();
    }

    @Override
    public int deleteEdges(EdgePattern pattern) {
        Map<String, Object> params = new HashMap<>();
        String cypher = matchClause(pattern, params) + " DELETE r RETURN count(r) AS deleted";
        Long deleted = neo4jClient.query(cypher)
                .bindAll(params)
                .fetchAs(Long.class)
                .one()
                .orElse(0L);
        log.debug("Deleted {} edges matching {}", deleted, pattern);
        return deleted.intValue();
    }

    private String matchClause(EdgePattern pattern, Map<String, Object> params) {
        StringBuilder cypher = new StringBuilder("MATCH (a");
        if (pattern.getFromLabel() != null) {
            cypher.append(':').append(identifier(pattern.getFromLabel()));
        }
        cypher.append(")-[r");
        if (!pattern.getTypes().isEmpty()) {
            cypher.append(':');
            Iterator<String> types = pattern.getTypes().iterator();
            while (types.hasNext()) {
                cypher.append(identifier(types.next()));
                if (types.hasNext()) {
                    cypher.append('|');
                }
            }
        }
        cypher.append("]->(b");
        if (pattern.getToLabel() != null) {
            cypher.append(':').append(identifier(pattern.getToLabel()));
        }
        cypher.append(") WHERE true");
        if (pattern.getFromNode() != null) {
            cypher.append(" AND elementId(a) = $fromId");
            params.put("fromId", pattern.getFromNode().getElementId());
        }
        if (pattern.getToNode() != null) {
            cypher.append(" AND elementId(b) = $toId");
            params.put("toId", pattern.getToNode().getElementId());
        }
        appendPropertyPredicates(cypher, "r", pattern.getProperties(), params, false);
        return cypher.toString();
    }

    private void appendPropertyPredicates(StringBuilder cypher, String variable, Map<String, Object> filter,
                                          Map<String, Object> params, boolean openWhere) {
        if (filter == null || filter.isEmpty()) {
            return;
        }
        boolean first = openWhere;
        int index = 0;
        for (Map.Entry<String, Object> entry : filter.entrySet()) {
            String param = variable + "p" + index++;
            cypher.append(first ? " WHERE " : " AND ")
                    .append(variable).append('.').append(identifier(entry.getKey()))
                    .append(" = $").append(param);
            params.put(param, entry.getValue());
            first = false;
        }
    }

    private static NodeRef toNodeRef(Node node) {
        Iterator<String> labels = node.labels().iterator();
        String label = labels.hasNext() ? labels.next() : null;
        return new NodeRef(node.elementId(), label, node.asMap());
    }

    private static EdgeRef toEdgeRef(Record record) {
        Relationship relationship = record.get("r").asRelationship();
        return new EdgeRef(
                relationship.elementId(),
                relationship.type(),
                toNodeRef(record.get("a").asNode()),
                toNodeRef(record.get("b").asNode()),
                relationship.asMap());
    }

    private static String identifier(String value) {
        if (value == null || !IDENTIFIER.matcher(value).matches()) {
            throw new IllegalArgumentException("Not a valid graph identifier: '" + value + "'");
        }
        return "`" + value + "`";
    }
}
