package com.cdm.modelgraph.service;

import com.cdm.modelgraph.config.ReconciliationProperties;
import com.cdm.modelgraph.dto.AllPairsReport;
import com.cdm.modelgraph.dto.AllPairsResult;
import com.cdm.modelgraph.dto.ItemFailure;
import com.cdm.modelgraph.dto.RelationshipAuditRequest;
import com.cdm.modelgraph.exception.InvariantViolationException;
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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Keeps exactly one default RELATES_TO edge for every ordered pair of Objects, self pairs
 * included. The default edge has role = source name, type Intra-Table for a self pair
 * and Inter-Table otherwise, and the configured default frequency.
 *
 * <p>Each pair is handled in its own transaction; a failing pair is reported and the
 * run moves on.
 */
@Service
@Slf4j
public class AllPairsRelationshipEnforcer {

    private final GraphStore graphStore;
    private final ObjectRelationshipService relationshipService;
    private final EntityLockRegistry lockRegistry;
    private final TransactionOperations transactionOperations;
    private final ReconciliationProperties properties;

    public AllPairsRelationshipEnforcer(
            GraphStore graphStore,
            ObjectRelationshipService relationshipService,
            EntityLockRegistry lockRegistry,
            @Qualifier("neo4jTransactionOperations") TransactionOperations transactionOperations,
            ReconciliationProperties properties) {
        this.graphStore = graphStore;
        this.relationshipService = relationshipService;
        this.lockRegistry = lockRegistry;
        this.transactionOperations = transactionOperations;
        this.properties = properties;
    }

    /**
     * Called once an Object has been created: links it to every Object (itself included)
     * and every existing Object back to it. Existing default edges are left as they are.
     *
     * @param objectName role of the new Object's default edges; read from the node when null
     */
    public AllPairsResult ensureAllPairsRelationships(String objectId, String objectName) {
        return lockRegistry.withLock(EntityLockRegistry.key(GraphLabels.OBJECT, objectId), () -> {
            NodeRef created = relationshipService.findObject(objectId);
            String role = objectName != null ? objectName : created.getString(ObjectRelationshipService.OBJECT_NAME);
            if (role == null) {
                throw new InvariantViolationException("Object " + objectId + " has no name to use as default role");
            }

            AllPairsResult result = AllPairsResult.builder().objectId(objectId).role(role).build();
            List<NodeRef> objects = graphStore.matchNodes(GraphLabels.OBJECT, Map.of());
            log.info("Ensuring default relationships for {} '{}' against {} object(s)", objectId, role, objects.size());

            for (NodeRef other : objects) {
                ensurePair(created, role, other, result);
                if (!created.getElementId().equals(other.getElementId())) {
                    String otherRole = other.getString(ObjectRelationshipService.OBJECT_NAME);
                    if (otherRole == null) {
                        result.getErrors().add(new ItemFailure(pairId(other, created), "source Object has no name"));
                        continue;
                    }
                    ensurePair(other, otherRole, created, result);
                }
            }

            log.info("Default relationships for {}: {} created, {} already present, {} failed",
                    objectId, result.getCreated(), result.getExisting(), result.getErrors().size());
            return result;
        });
    }

    private void ensurePair(NodeRef source, String role, NodeRef target, AllPairsResult result) {
        try {
            Boolean createdEdge = transactionOperations.execute(status -> {
                if (!relationshipService.findEdges(source, target, role).isEmpty()) {
                    return false;
                }
                graphStore.createEdge(source, target, EdgeTypes.RELATES_TO,
                        defaultEdgeProperties(source, target, role));
                return true;
            });
            if (Boolean.TRUE.equals(createdEdge)) {
                result.setCreated(result.getCreated() + 1);
            } else {
                result.setExisting(result.getExisting() + 1);
            }
        } catch (RuntimeException e) {
            log.warn("Could not ensure default relationship {}: {}", pairId(source, target), e.getMessage());
            result.getErrors().add(ItemFailure.of(pairId(source, target), e));
        }
    }

    /**
     * Sweep over the requested source Objects (all when none given) against every Object.
     * Missing defaults are created, duplicate defaults removed keeping the lowest edge id,
     * and type and frequency of the kept edge reset. Edges with another role are only
     * deleted when pruning is enabled.
     */
    public AllPairsReport auditAllPairsRelationships(RelationshipAuditRequest request) {
        long start = System.currentTimeMillis();
        boolean dryRun = request.isDryRun();
        boolean prune = request.getPruneNonDefault() != null
                ? request.getPruneNonDefault()
                : properties.isPruneNonDefaultRoles();

        List<NodeRef> objects = graphStore.matchNodes(GraphLabels.OBJECT, Map.of());
        AllPairsReport report = AllPairsReport.builder()
                .dryRun(dryRun)
                .pruneNonDefault(prune)
                .build();
        List<NodeRef> sources = selectSources(objects, request.getObjectIds(), report);

        int chunkSize = Math.max(1, properties.getSweepChunkSize());
        log.info("Auditing default relationships: {} source(s) x {} object(s){}{}", sources.size(), objects.size(),
                dryRun ? ", dry run" : "", prune ? ", pruning other roles" : "");

        for (int i = 0; i < sources.size(); i++) {
            NodeRef source = sources.get(i);
            report.setObjectsChecked(report.getObjectsChecked() + 1);
            String role = source.getString(ObjectRelationshipService.OBJECT_NAME);
            if (role == null) {
                report.getErrors().add(new ItemFailure(itemId(source), "source Object has no name"));
                continue;
            }
            for (NodeRef target : objects) {
                report.setPairsChecked(report.getPairsChecked() + 1);
                try {
                    PairOutcome outcome = transactionOperations.execute(
                            status -> auditPair(source, role, target, dryRun, prune));
                    if (outcome != null) {
                        outcome.addTo(report);
                    }
                } catch (RuntimeException e) {
                    log.warn("Audit failed for {}: {}", pairId(source, target), e.getMessage());
                    report.getErrors().add(ItemFailure.of(pairId(source, target), e));
                }
            }
            updateCount(source, dryRun, report);

            if ((i + 1) % chunkSize == 0 || i + 1 == sources.size()) {
                log.info("Relationship audit: {}/{} sources, {} created, {} duplicates removed so far",
                        i + 1, sources.size(), report.getCreated(), report.getDuplicatesRemoved());
            }
        }

        report.setDurationMs(System.currentTimeMillis() - start);
        log.info("Relationship audit finished in {}ms: {} pairs, {} created, {} duplicates, {} normalized, " +
                        "{} other roles removed, {} errors", report.getDurationMs(), report.getPairsChecked(),
                report.getCreated(), report.getDuplicatesRemoved(), report.getNormalized(),
                report.getNonDefaultRemoved(), report.getErrors().size());
        return report;
    }

    private List<NodeRef> selectSources(List<NodeRef> objects, List<String> objectIds, AllPairsReport report) {
        if (objectIds == null || objectIds.isEmpty()) {
            return objects;
        }
        Map<String, NodeRef> byId = new HashMap<>();
        for (NodeRef object : objects) {
            byId.put(object.getId(), object);
        }
        List<NodeRef> sources = new ArrayList<>();
        for (String id : objectIds) {
            NodeRef source = byId.get(id);
            if (source == null) {
                report.getErrors().add(new ItemFailure(id, GraphLabels.OBJECT + " not found: " + id));
            } else {
                sources.add(source);
            }
        }
        return sources;
    }

    private PairOutcome auditPair(NodeRef source, String role, NodeRef target, boolean dryRun, boolean prune) {
        PairOutcome outcome = new PairOutcome();
        List<EdgeRef> defaults = new ArrayList<>();
        List<EdgeRef> others = new ArrayList<>();
        for (EdgeRef edge : relationshipService.findEdges(source, target, null)) {
            if (Objects.equals(edge.getString("role"), role)) {
                defaults.add(edge);
            } else {
                others.add(edge);
            }
        }

        if (defaults.isEmpty()) {
            if (!dryRun) {
                graphStore.createEdge(source, target, EdgeTypes.RELATES_TO,
                        defaultEdgeProperties(source, target, role));
            }
            outcome.created = 1;
        } else {
            defaults.sort(Comparator.comparing((EdgeRef edge) -> edge.getString("id"),
                    Comparator.nullsLast(Comparator.naturalOrder())));
            EdgeRef kept = defaults.get(0);
            for (EdgeRef duplicate : defaults.subList(1, defaults.size())) {
                if (!dryRun) {
                    graphStore.deleteEdge(duplicate);
                }
                outcome.duplicatesRemoved++;
            }

            String expectedType = RelationshipKind.defaultFor(source.getElementId(), target.getElementId()).getLabel();
            Map<String, Object> fixes = new LinkedHashMap<>();
            if (!expectedType.equals(kept.getString("type"))) {
                fixes.put("type", expectedType);
            }
            if (!properties.getDefaultFrequency().equals(kept.getString("frequency"))) {
                fixes.put("frequency", properties.getDefaultFrequency());
            }
            if (!fixes.isEmpty()) {
                if (!dryRun) {
                    graphStore.setEdgeProperties(kept, fixes);
                }
                outcome.normalized = 1;
            }
        }

        if (prune) {
            for (EdgeRef other : others) {
                if (!dryRun) {
                    graphStore.deleteEdge(other);
                }
                outcome.nonDefaultRemoved++;
            }
        }
        return outcome;
    }

    private void updateCount(NodeRef source, boolean dryRun, AllPairsReport report) {
        try {
            Boolean changed = transactionOperations.execute(status -> {
                if (dryRun) {
                    Integer stored = source.getInt(ObjectRelationshipService.RELATIONSHIP_COUNT);
                    return stored == null || stored != relationshipService.countNonDefaultRelationships(source);
                }
                return relationshipService.refreshRelationshipCount(source);
            });
            if (Boolean.TRUE.equals(changed)) {
                report.setCountsUpdated(report.getCountsUpdated() + 1);
            }
        } catch (RuntimeException e) {
            log.warn("Could not update relationship count of {}: {}", itemId(source), e.getMessage());
            report.getErrors().add(ItemFailure.of(itemId(source), e));
        }
    }

    Map<String, Object> defaultEdgeProperties(NodeRef source, NodeRef target, String role) {
        String type = RelationshipKind.defaultFor(source.getElementId(), target.getElementId()).getLabel();
        return relationshipService.edgeProperties(target, type, role, properties.getDefaultFrequency());
    }

    private static String pairId(NodeRef source, NodeRef target) {
        return itemId(source) + "->" + itemId(target);
    }

    private static String itemId(NodeRef object) {
        return object.getId() != null ? object.getId() : object.getElementId();
    }

    /** Counts for one pair, added to the report only once its transaction committed. */
    private static final class PairOutcome {
        int created;
        int duplicatesRemoved;
        int normalized;
        int nonDefaultRemoved;

        void addTo(AllPairsReport report) {
            report.setCreated(report.getCreated() + created);
            report.setDuplicatesRemoved(report.getDuplicatesRemoved() + duplicatesRemoved);
            report.setNormalized(report.getNormalized() + normalized);
            report.setNonDefaultRemoved(report.getNonDefaultRemoved() + nonDefaultRemoved);
        }
    }
}
