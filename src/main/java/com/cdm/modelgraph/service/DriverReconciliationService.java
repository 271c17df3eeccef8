package com.cdm.modelgraph.service;

import com.cdm.modelgraph.config.ReconciliationProperties;
import com.cdm.modelgraph.dto.BatchReconciliationResult;
import com.cdm.modelgraph.dto.CategoryDiff;
import com.cdm.modelgraph.dto.DriverNormalizationResult;
import com.cdm.modelgraph.dto.ItemFailure;
import com.cdm.modelgraph.dto.ReconciliationResult;
import com.cdm.modelgraph.dto.WildcardPurgeResult;
import com.cdm.modelgraph.exception.EntityNotFoundException;
import com.cdm.modelgraph.graph.EdgePattern;
import com.cdm.modelgraph.graph.EdgeRef;
import com.cdm.modelgraph.graph.EdgeTypes;
import com.cdm.modelgraph.graph.GraphLabels;
import com.cdm.modelgraph.graph.GraphStore;
import com.cdm.modelgraph.graph.NodeRef;
import com.cdm.modelgraph.model.DriverCategory;
import com.cdm.modelgraph.model.DriverResolutionPolicy;
import com.cdm.modelgraph.model.EntityKind;
import com.cdm.modelgraph.model.FieldSelection;
import com.cdm.modelgraph.model.Selector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Entry point for driver edges of Objects, Variables and Lists.
 *
 * <p>Every reconciliation of one entity runs under that entity's lock and inside a single
 * Neo4j transaction, so all categories are applied together or not at all.
 */
@Service
@Slf4j
public class DriverReconciliationService {

    static final String DRIVER_PROPERTY = "driver";

    private final GraphStore graphStore;
    private final SelectorParser selectorParser;
    private final SelectorFormatter selectorFormatter;
    private final ExpectedEdgeResolver expectedEdgeResolver;
    private final ActualEdgeReader actualEdgeReader;
    private final DriverEdgeReconciler driverEdgeReconciler;
    private final EntityLockRegistry lockRegistry;
    private final TransactionOperations transactionOperations;
    private final ReconciliationProperties properties;

    public DriverReconciliationService(
            GraphStore graphStore,
            SelectorParser selectorParser,
            SelectorFormatter selectorFormatter,
            ExpectedEdgeResolver expectedEdgeResolver,
            ActualEdgeReader actualEdgeReader,
            DriverEdgeReconciler driverEdgeReconciler,
            EntityLockRegistry lockRegistry,
            @Qualifier("neo4jTransactionOperations") TransactionOperations transactionOperations,
            ReconciliationProperties properties) {
        this.graphStore = graphStore;
        this.selectorParser = selectorParser;
        this.selectorFormatter = selectorFormatter;
        this.expectedEdgeResolver = expectedEdgeResolver;
        this.actualEdgeReader = actualEdgeReader;
        this.driverEdgeReconciler = driverEdgeReconciler;
        this.lockRegistry = lockRegistry;
        this.transactionOperations = transactionOperations;
        this.properties = properties;
    }

    public ReconciliationResult reconcileDriverEdges(String entityId, EntityKind kind, String driverString) {
        return reconcileDriverEdges(entityId, kind, driverString, properties.getDefaultPolicy());
    }

    /**
     * Make the driver edges of one entity match its driver string and store the string
     * on the entity. A null driver string removes every driver edge. A List passes the
     * same driver string on to its tier Lists in the same transaction.
     *
     * @throws com.cdm.modelgraph.exception.SelectorParseException before anything is written
     * @throws com.cdm.modelgraph.exception.DriverNotFoundException under REQUIRE_EXISTING,
     *         before anything is written
     */
    public ReconciliationResult reconcileDriverEdges(String entityId, EntityKind kind, String driverString,
                                                     DriverResolutionPolicy policy) {
        Selector selector = driverString == null ? Selector.EMPTY : selectorParser.parse(driverString);
        DriverResolutionPolicy effectivePolicy = policy != null ? policy : properties.getDefaultPolicy();

        return lockRegistry.withLock(EntityLockRegistry.key(kind.getLabel(), entityId),
                () -> transactionOperations.execute(status ->
                        reconcileInTransaction(entityId, kind, driverString, selector, effectivePolicy)));
    }

    private ReconciliationResult reconcileInTransaction(String entityId, EntityKind kind, String driverString,
                                                        Selector selector, DriverResolutionPolicy policy) {
        NodeRef entity = findEntity(kind, entityId);

        // Resolve every category first so a missing driver fails the call before the first write
        Map<DriverCategory, Set<String>> expected = new EnumMap<>(DriverCategory.class);
        for (DriverCategory category : kind.getCategories()) {
            expected.put(category, expectedEdgeResolver.resolve(selector, category, policy));
        }

        ReconciliationResult result = ReconciliationResult.builder()
                .entityId(entityId)
                .entityKind(kind.getLabel())
                .driver(driverString)
                .build();
        for (Map.Entry<DriverCategory, Set<String>> entry : expected.entrySet()) {
            CategoryDiff diff = driverEdgeReconciler.apply(entity, kind, entry.getKey(), entry.getValue());
            result.getCategories().add(diff);
            result.setCreated(result.getCreated() + diff.getAdded().size());
            result.setDeleted(result.getDeleted() + diff.getEdgesDeleted());
        }

        if (!Objects.equals(entity.getString(DRIVER_PROPERTY), driverString)) {
            graphStore.setNodeProperties(entity, Collections.singletonMap(DRIVER_PROPERTY, driverString));
        }

        if (kind == EntityKind.LIST) {
            for (NodeRef tierList : tierLists(entity)) {
                result.getTierLists().add(reconcileDriverEdges(tierList.getId(), kind, driverString, policy));
            }
        }

        if (result.isUnchanged()) {
            log.debug("{} {} drivers already up to date", kind.getLabel(), entityId);
        } else {
            log.info("Reconciled {} {} drivers: {} created, {} deleted",
                    kind.getLabel(), entityId, result.getCreated(), result.getDeleted());
        }
        return result;
    }

    private List<NodeRef> tierLists(NodeRef list) {
        List<NodeRef> tiers = new ArrayList<>();
        for (EdgeRef edge : graphStore.matchEdges(EdgePattern.builder()
                .fromNode(list)
                .types(EdgeTypes.allTiers())
                .toLabel(GraphLabels.LIST)
                .build())) {
            tiers.add(edge.getTo());
        }
        return tiers;
    }

    /**
     * Re-run reconciliation for every entity of a kind from its stored driver string.
     * Best-effort: a failing entity is recorded and the run continues.
     *
     * @param policy REQUIRE_EXISTING when null, so a repair run never invents driver nodes
     */
    public BatchReconciliationResult reconcileAll(EntityKind kind, DriverResolutionPolicy policy) {
        long start = System.currentTimeMillis();
        DriverResolutionPolicy effectivePolicy = policy != null ? policy : DriverResolutionPolicy.REQUIRE_EXISTING;
        List<NodeRef> entities = graphStore.matchNodes(kind.getLabel(), Map.of());
        log.info("Backfilling driver edges for {} {} node(s)", entities.size(), kind.getLabel());

        BatchReconciliationResult batch = BatchReconciliationResult.builder()
                .operation("backfill " + kind.getLabel())
                .build();
        int chunkSize = Math.max(1, properties.getSweepChunkSize());
        for (NodeRef entity : entities) {
            batch.setProcessed(batch.getProcessed() + 1);
            String entityId = entity.getId();
            try {
                if (entityId == null) {
                    throw new EntityNotFoundException(kind.getLabel(), "<node " + entity.getElementId() + " has no id>");
                }
                String stored = entity.getString(DRIVER_PROPERTY);
                ReconciliationResult result = reconcileDriverEdges(entityId, kind,
                        StringUtils.hasText(stored) ? stored : null, effectivePolicy);
                batch.setSucceeded(batch.getSucceeded() + 1);
                batch.setCreated(batch.getCreated() + result.getCreated());
                batch.setDeleted(batch.getDeleted() + result.getDeleted());
            } catch (RuntimeException e) {
                log.warn("Backfill failed for {} {}: {}", kind.getLabel(), entityId, e.getMessage());
                batch.getErrors().add(ItemFailure.of(entityId != null ? entityId : entity.getElementId(), e));
            }
            if (batch.getProcessed() % chunkSize == 0) {
                log.info("Backfill {}: {}/{} processed", kind.getLabel(), batch.getProcessed(), entities.size());
            }
        }

        batch.setDurationMs(System.currentTimeMillis() - start);
        log.info("Backfill {} finished: {} ok, {} failed, {} created, {} deleted in {}ms",
                kind.getLabel(), batch.getSucceeded(), batch.getErrors().size(),
                batch.getCreated(), batch.getDeleted(), batch.getDurationMs());
        return batch;
    }

    /**
     * Rewrite each entity's stored driver string from the edges it actually has, collapsing
     * fields that cover a whole category to ALL. Edges are never touched. Each entity is
     * read and written under its lock, so a concurrent reconcile is never overwritten with
     * a string built from edges it has since replaced.
     */
    public DriverNormalizationResult normalizeDriverStrings(EntityKind kind, boolean dryRun) {
        Map<DriverCategory, Set<String>> universes = new EnumMap<>(DriverCategory.class);
        for (DriverCategory category : kind.getCategories()) {
            universes.put(category, expectedEdgeResolver.universe(category));
        }

        DriverNormalizationResult result = DriverNormalizationResult.builder()
                .entityKind(kind.getLabel())
                .dryRun(dryRun)
                .build();
        for (NodeRef entity : graphStore.matchNodes(kind.getLabel(), Map.of())) {
            result.setChecked(result.getChecked() + 1);
            String entityId = entity.getId() != null ? entity.getId() : entity.getElementId();
            try {
                if (entity.getId() == null) {
                    throw new EntityNotFoundException(kind.getLabel(), "<node " + entity.getElementId() + " has no id>");
                }
                DriverNormalizationResult.Change change = lockRegistry.withLock(
                        EntityLockRegistry.key(kind.getLabel(), entityId),
                        () -> transactionOperations.execute(status -> {
                            NodeRef current = findEntity(kind, entityId);
                            String before = current.getString(DRIVER_PROPERTY);
                            String after = selectorFormatter.format(
                                    selectorFormatter.normalize(realizedSelector(current, kind), universes));
                            if (after.equals(before)) {
                                return null;
                            }
                            if (!dryRun) {
                                graphStore.setNodeProperties(current, Map.of(DRIVER_PROPERTY, after));
                            }
                            return new DriverNormalizationResult.Change(entityId, before, after);
                        }));
                if (change != null) {
                    result.getChanges().add(change);
                    result.setChanged(result.getChanged() + 1);
                }
            } catch (RuntimeException e) {
                log.warn("Could not normalize driver of {} {}: {}", kind.getLabel(), entityId, e.getMessage());
                result.getErrors().add(ItemFailure.of(entityId, e));
            }
        }
        log.info("Normalized {} driver strings: {} of {} changed{}", kind.getLabel(),
                result.getChanged(), result.getChecked(), dryRun ? " (dry run)" : "");
        return result;
    }

    private Selector realizedSelector(NodeRef entity, EntityKind kind) {
        Selector.SelectorBuilder builder = Selector.builder();
        for (DriverCategory category : kind.getCategories()) {
            Map<String, List<EdgeRef>> actual = actualEdgeReader.read(entity, kind, category);
            Set<String> names = actual.keySet();
            switch (category) {
                case SECTOR -> builder.sector(FieldSelection.of(names));
                case DOMAIN -> builder.domain(FieldSelection.of(names));
                case COUNTRY -> builder.country(FieldSelection.of(names));
                default -> {
                    if (names.size() > 1) {
                        log.warn("{} {} is linked to {} clarifiers, keeping '{}'", kind.getLabel(),
                                entity.getId(), names.size(), names.iterator().next());
                    }
                    builder.clarifier(names.isEmpty() ? null : names.iterator().next());
                }
            }
        }
        return builder.build();
    }

    /**
     * Delete driver nodes literally named ALL, left over from when the wildcard was
     * stored as a node. Their edges go with them.
     */
    public WildcardPurgeResult purgeWildcardNodes() {
        return transactionOperations.execute(status -> {
            WildcardPurgeResult result = WildcardPurgeResult.builder().build();
            Map<String, Integer> deleted = new LinkedHashMap<>();
            for (DriverCategory category : DriverCategory.values()) {
                List<NodeRef> nodes = graphStore.matchNodes(category.getLabel(),
                        Map.of("name", SelectorParser.WILDCARD));
                nodes.forEach(graphStore::deleteNode);
                if (!nodes.isEmpty()) {
                    deleted.put(category.getLabel(), nodes.size());
                    log.info("Deleted {} '{}' node(s) labelled {}", nodes.size(), SelectorParser.WILDCARD,
                            category.getLabel());
                }
                result.setTotal(result.getTotal() + nodes.size());
            }
            result.setDeletedByLabel(deleted);
            return result;
        });
    }

    NodeRef findEntity(EntityKind kind, String entityId) {
        return graphStore.findNode(kind.getLabel(), "id", entityId)
                .orElseThrow(() -> new EntityNotFoundException(kind.getLabel(), entityId));
    }
}
