package com.cdm.modelgraph.service;

import com.cdm.modelgraph.config.ReconciliationProperties;
import com.cdm.modelgraph.dto.BulkRelationshipUpdateRequest;
import com.cdm.modelgraph.dto.RelationshipRequest;
import com.cdm.modelgraph.dto.RelationshipUpdateResult;
import com.cdm.modelgraph.exception.DuplicateRelationshipException;
import com.cdm.modelgraph.exception.EntityNotFoundException;
import com.cdm.modelgraph.exception.InvariantViolationException;
import com.cdm.modelgraph.graph.EdgePattern;
import com.cdm.modelgraph.graph.EdgeRef;
import com.cdm.modelgraph.graph.EdgeTypes;
import com.cdm.modelgraph.graph.GraphLabels;
import com.cdm.modelgraph.graph.GraphStore;
import com.cdm.modelgraph.graph.NodeRef;
import com.cdm.modelgraph.model.RelationshipKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.util.StringUtils;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Manually managed Object-to-Object RELATES_TO edges.
 *
 * <p>The default edge of a pair (role equal to the source Object's name) belongs to
 * {@link AllPairsRelationshipEnforcer}; nothing here modifies or deletes it.
 */
@Service
@Slf4j
public class ObjectRelationshipService {

    static final String OBJECT_NAME = "object";
    static final String RELATIONSHIP_COUNT = "relationships";

    private final GraphStore graphStore;
    private final EntityLockRegistry lockRegistry;
    private final TransactionOperations transactionOperations;
    private final ReconciliationProperties properties;

    public ObjectRelationshipService(
            GraphStore graphStore,
            EntityLockRegistry lockRegistry,
            @Qualifier("neo4jTransactionOperations") TransactionOperations transactionOperations,
            ReconciliationProperties properties) {
        this.graphStore = graphStore;
        this.lockRegistry = lockRegistry;
        this.transactionOperations = transactionOperations;
        this.properties = properties;
    }

    /**
     * Create one RELATES_TO edge. Type defaults to Intra-Table for a self pair and
     * Inter-Table otherwise; frequency defaults to the configured default frequency.
     *
     * @throws DuplicateRelationshipException when the (source, target, role) edge exists
     */
    public Map<String, Object> createRelationship(String sourceId, RelationshipRequest request) {
        return lockRegistry.withLock(EntityLockRegistry.key(GraphLabels.OBJECT, sourceId),
                () -> transactionOperations.execute(status -> {
                    NodeRef source = findObject(sourceId);
                    NodeRef target = findObject(request.getTargetId());
                    String role = request.getRole().trim();

                    if (!findEdges(source, target, role).isEmpty()) {
                        throw new DuplicateRelationshipException(sourceId, request.getTargetId(), role);
                    }

                    String type = StringUtils.hasText(request.getType())
                            ? RelationshipKind.fromLabel(request.getType()).getLabel()
                            : RelationshipKind.defaultFor(source.getElementId(), target.getElementId()).getLabel();
                    String frequency = StringUtils.hasText(request.getFrequency())
                            ? request.getFrequency()
                            : properties.getDefaultFrequency();

                    Map<String, Object> props = edgeProperties(target, type, role, frequency);
                    graphStore.createEdge(source, target, EdgeTypes.RELATES_TO, props);
                    refreshRelationshipCount(source);

                    log.info("Created relationship {} -> {} (role={}, type={})", sourceId,
                            request.getTargetId(), role, type);
                    return props;
                }));
    }

    /**
     * Set type and frequency on every edge from the source to the given targets, leaving
     * the source's default edges untouched even when their target is in the list.
     */
    public RelationshipUpdateResult updateRelationshipsToTarget(String sourceId, BulkRelationshipUpdateRequest request) {
        String type = StringUtils.hasText(request.getType())
                ? RelationshipKind.fromLabel(request.getType()).getLabel()
                : null;
        String frequency = StringUtils.hasText(request.getFrequency()) ? request.getFrequency() : null;

        return lockRegistry.withLock(EntityLockRegistry.key(GraphLabels.OBJECT, sourceId),
                () -> transactionOperations.execute(status -> {
                    NodeRef source = findObject(sourceId);
                    String defaultRole = source.getString(OBJECT_NAME);
                    RelationshipUpdateResult result = RelationshipUpdateResult.builder()
                            .sourceId(sourceId)
                            .targetIds(request.getTargetIds())
                            .build();

                    Map<String, Object> changes = new HashMap<>();
                    if (type != null) {
                        changes.put("type", type);
                    }
                    if (frequency != null) {
                        changes.put("frequency", frequency);
                    }

                    for (String targetId : request.getTargetIds()) {
                        NodeRef target = findObject(targetId);
                        for (EdgeRef edge : findEdges(source, target, null)) {
                            if (Objects.equals(edge.getString("role"), defaultRole)) {
                                result.setProtectedDefaults(result.getProtectedDefaults() + 1);
                                continue;
                            }
                            if (!changes.isEmpty()) {
                                graphStore.setEdgeProperties(edge, changes);
                                result.setUpdated(result.getUpdated() + 1);
                            }
                        }
                    }
                    log.info("Updated {} relationship(s) of {} ({} default edge(s) left unchanged)",
                            result.getUpdated(), sourceId, result.getProtectedDefaults());
                    return result;
                }));
    }

    /**
     * Delete every outgoing edge of the source with the given role.
     *
     * @throws InvariantViolationException when the role is the source's default role
     */
    public RelationshipUpdateResult deleteRelationshipsWithRole(String sourceId, String role) {
        return lockRegistry.withLock(EntityLockRegistry.key(GraphLabels.OBJECT, sourceId),
                () -> transactionOperations.execute(status -> {
                    NodeRef source = findObject(sourceId);
                    if (Objects.equals(source.getString(OBJECT_NAME), role)) {
                        throw new InvariantViolationException("Role '" + role + "' is the default role of "
                                + sourceId + "; default relationships cannot be deleted");
                    }
                    int deleted = graphStore.deleteEdges(EdgePattern.builder()
                            .fromNode(source)
                            .type(EdgeTypes.RELATES_TO)
                            .toLabel(GraphLabels.OBJECT)
                            .property("role", role)
                            .build());
                    refreshRelationshipCount(source);
                    log.info("Deleted {} relationship(s) of {} with role '{}'", deleted, sourceId, role);
                    return RelationshipUpdateResult.builder()
                            .sourceId(sourceId)
                            .deleted(deleted)
                            .build();
                }));
    }

    /**
     * Number of outgoing RELATES_TO edges whose role is not the source's own name.
     */
    public int countNonDefaultRelationships(NodeRef source) {
        String defaultRole = source.getString(OBJECT_NAME);
        int count = 0;
        for (EdgeRef edge : graphStore.matchEdges(EdgePattern.outgoing(source, EdgeTypes.RELATES_TO, GraphLabels.OBJECT))) {
            if (!Objects.equals(edge.getString("role"), defaultRole)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Store the current non-default relationship count on the Object.
     *
     * @return true when the stored value changed
     */
    public boolean refreshRelationshipCount(NodeRef source) {
        int count = countNonDefaultRelationships(source);
        Integer stored = source.getInt(RELATIONSHIP_COUNT);
        if (stored != null && stored == count) {
            return false;
        }
        graphStore.setNodeProperties(source, Map.of(RELATIONSHIP_COUNT, count));
        return true;
    }

    /**
     * Properties of a RELATES_TO edge, including the target snapshot fields.
     */
    Map<String, Object> edgeProperties(NodeRef target, String type, String role, String frequency) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("id", UUID.randomUUID().toString());
        props.put("type", type);
        props.put("role", role);
        props.put("frequency", frequency);
        props.put("toObject", target.getString(OBJECT_NAME, ""));
        props.put("toBeing", target.getString("being", SelectorParser.WILDCARD));
        props.put("toAvatar", target.getString("avatar", SelectorParser.WILDCARD));
        return props;
    }

    List<EdgeRef> findEdges(NodeRef source, NodeRef target, String role) {
        EdgePattern.EdgePatternBuilder pattern = EdgePattern.builder()
                .fromNode(source)
                .type(EdgeTypes.RELATES_TO)
                .toNode(target);
        if (role != null) {
            pattern.property("role", role);
        }
        return graphStore.matchEdges(pattern.build());
    }

    NodeRef findObject(String objectId) {
        return graphStore.findNode(GraphLabels.OBJECT, "id", objectId)
                .orElseThrow(() -> new EntityNotFoundException(GraphLabels.OBJECT, objectId));
    }
}
