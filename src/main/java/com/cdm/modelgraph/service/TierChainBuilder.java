package com.cdm.modelgraph.service;

import com.cdm.modelgraph.config.ReconciliationProperties;
import com.cdm.modelgraph.dto.BatchReconciliationResult;
import com.cdm.modelgraph.dto.ItemFailure;
import com.cdm.modelgraph.dto.ListTypeChangeResult;
import com.cdm.modelgraph.dto.ReconciliationResult;
import com.cdm.modelgraph.dto.TierStructureDescription;
import com.cdm.modelgraph.dto.TierStructureResult;
import com.cdm.modelgraph.dto.TierValuesResult;
import com.cdm.modelgraph.exception.EntityNotFoundException;
import com.cdm.modelgraph.exception.InvariantViolationException;
import com.cdm.modelgraph.graph.EdgePattern;
import com.cdm.modelgraph.graph.EdgeRef;
import com.cdm.modelgraph.graph.EdgeTypes;
import com.cdm.modelgraph.graph.GraphLabels;
import com.cdm.modelgraph.graph.GraphStore;
import com.cdm.modelgraph.graph.NodeRef;
import com.cdm.modelgraph.model.EntityKind;
import com.cdm.modelgraph.model.ListType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Builds and repairs multi-level Lists.
 *
 * <p>A parent List points at its tier Lists with HAS_TIER_1..HAS_TIER_n. Every tier List
 * holds its ListValues through HAS_LIST_VALUE, and every value at tier k &gt; 1 hangs off
 * exactly one tier k-1 value through a chain edge named after the tier k List
 * (see {@link EdgeTypes#chainValue(String)}).
 */
@Service
@Slf4j
public class TierChainBuilder {

    static final String LIST_TYPE = "listType";
    static final String TIER = "tier";
    static final String PARENT_LIST_ID = "parentListId";
    static final String VALUE = "value";

    /** List properties a tier List always shares with its parent. */
    static final List<String> INHERITED_PROPERTIES = List.of(
            "set", "grouping", "format", "source", "upkeep", "graph", "origin", "status");

    private final GraphStore graphStore;
    private final DriverReconciliationService driverReconciliationService;
    private final EntityLockRegistry lockRegistry;
    private final TransactionOperations transactionOperations;
    private final ReconciliationProperties properties;

    public TierChainBuilder(
            GraphStore graphStore,
            DriverReconciliationService driverReconciliationService,
            EntityLockRegistry lockRegistry,
            @Qualifier("neo4jTransactionOperations") TransactionOperations transactionOperations,
            ReconciliationProperties properties) {
        this.graphStore = graphStore;
        this.driverReconciliationService = driverReconciliationService;
        this.lockRegistry = lockRegistry;
        this.transactionOperations = transactionOperations;
        this.properties = properties;
    }

    /**
     * Make the List multi-level with exactly the given tiers, in order. Tier Lists that are
     * no longer named are deleted with their values; chain edges that no longer match the
     * new order are removed, and so are values at tier 2 and below left without a parent.
     */
    public TierStructureResult setTierStructure(String listId, List<String> tierNames) {
        List<String> names = validateTierNames(tierNames);

        return lockRegistry.withLock(EntityLockRegistry.key(GraphLabels.LIST, listId),
                () -> transactionOperations.execute(status -> {
                    NodeRef parent = findList(listId);
                    TierStructureResult result = TierStructureResult.builder().listId(listId).build();

                    List<EdgeRef> existingEdges = tierEdges(parent);
                    Map<String, NodeRef> previousTiers = new LinkedHashMap<>();
                    for (EdgeRef edge : existingEdges) {
                        previousTiers.put(edge.getTo().getElementId(), edge.getTo());
                    }

                    List<NodeRef> tiers = new ArrayList<>();
                    for (int i = 0; i < names.size(); i++) {
                        tiers.add(findOrCreateTierList(parent, names.get(i), i + 1));
                    }

                    // Keep an edge only when it already joins the right level to the right List
                    Set<String> kept = new HashSet<>();
                    for (EdgeRef edge : existingEdges) {
                        int level = EdgeTypes.tierLevel(edge.getType());
                        boolean valid = level >= 1 && level <= tiers.size()
                                && tiers.get(level - 1).getElementId().equals(edge.getTo().getElementId())
                                && kept.add(edge.getType());
                        if (!valid) {
                            graphStore.deleteEdge(edge);
                            result.setTierEdgesRemoved(result.getTierEdgesRemoved() + 1);
                        }
                    }
                    for (int i = 0; i < tiers.size(); i++) {
                        String type = EdgeTypes.tier(i + 1);
                        if (!kept.contains(type)) {
                            graphStore.createEdge(parent, tiers.get(i), type, Map.of());
                            result.setTierEdgesCreated(result.getTierEdgesCreated() + 1);
                        }
                        result.getTierListIds().add(tiers.get(i).getId());
                        previousTiers.remove(tiers.get(i).getElementId());
                    }

                    for (NodeRef removed : previousTiers.values()) {
                        deleteListWithValues(removed);
                        result.getRemovedTierListIds().add(removed.getId());
                    }

                    repairChains(tiers, result);
                    mirrorParentDrivers(parent, tiers, result);

                    if (!ListType.MULTI_LEVEL.getLabel().equals(parent.getString(LIST_TYPE))) {
                        graphStore.setNodeProperties(parent, Map.of(LIST_TYPE, ListType.MULTI_LEVEL.getLabel()));
                    }

                    log.info("Tier structure of List {} set to {}: {} tier edge(s) created, {} removed, " +
                                    "{} tier List(s) deleted, {} chain edge(s) and {} orphan value(s) removed, " +
                                    "{} driver edge(s) mirrored",
                            listId, names, result.getTierEdgesCreated(), result.getTierEdgesRemoved(),
                            result.getRemovedTierListIds().size(), result.getChainEdgesRemoved(),
                            result.getOrphanValuesRemoved(), result.getDriverEdgesCreated());
                    return result;
                }));
    }

    private List<String> validateTierNames(List<String> tierNames) {
        if (tierNames == null || tierNames.isEmpty()) {
            throw new IllegalArgumentException("At least one tier name is required");
        }
        int maxDepth = Math.min(properties.getMaxTierDepth(), EdgeTypes.MAX_TIER);
        if (tierNames.size() > maxDepth) {
            throw new IllegalArgumentException("A List supports at most " + maxDepth + " tiers, got " + tierNames.size());
        }
        List<String> names = new ArrayList<>();
        Set<String> chainTypes = new HashSet<>();
        for (String name : tierNames) {
            if (!StringUtils.hasText(name)) {
                throw new IllegalArgumentException("Tier names must not be blank");
            }
            String trimmed = name.trim();
            if (!chainTypes.add(EdgeTypes.chainValue(trimmed))) {
                throw new IllegalArgumentException("Tier name '" + trimmed + "' clashes with another tier name");
            }
            names.add(trimmed);
        }
        return names;
    }

    private NodeRef findOrCreateTierList(NodeRef parent, String name, int level) {
        Map<String, Object> filter = new HashMap<>();
        filter.put("name", name);
        filter.put(PARENT_LIST_ID, parent.getId());
        Map<String, Object> shared = inheritedProperties(parent);
        // Tier Lists belong to one Set and Grouping context
        for (String key : List.of("set", "grouping")) {
            if (shared.containsKey(key)) {
                filter.put(key, shared.get(key));
            }
        }

        List<NodeRef> matches = graphStore.matchNodes(GraphLabels.LIST, filter);
        if (!matches.isEmpty()) {
            NodeRef tierList = matches.get(0);
            Map<String, Object> changes = new HashMap<>();
            for (String key : INHERITED_PROPERTIES) {
                if (!Objects.equals(tierList.getProperties().get(key), shared.get(key))) {
                    changes.put(key, shared.get(key));
                }
            }
            if (!Objects.equals(tierList.getInt(TIER), level)) {
                changes.put(TIER, level);
            }
            if (!changes.isEmpty()) {
                graphStore.setNodeProperties(tierList, changes);
            }
            return tierList;
        }

        Map<String, Object> props = new LinkedHashMap<>(shared);
        props.put("id", UUID.randomUUID().toString());
        props.put("name", name);
        props.put(TIER, level);
        props.put(PARENT_LIST_ID, parent.getId());
        log.debug("Creating tier List '{}' at level {} under {}", name, level, parent.getId());
        return graphStore.createNode(GraphLabels.LIST, props);
    }

    /**
     * Give every tier List the parent's driver string and driver edges. Joins the caller's
     * transaction.
     */
    private void mirrorParentDrivers(NodeRef parent, List<NodeRef> tiers, TierStructureResult result) {
        String driver = parent.getString(DriverReconciliationService.DRIVER_PROPERTY);
        for (NodeRef tierList : tiers) {
            ReconciliationResult mirrored = driverReconciliationService.reconcileDriverEdges(
                    tierList.getId(), EntityKind.LIST, StringUtils.hasText(driver) ? driver : null);
            result.setDriverEdgesCreated(result.getDriverEdgesCreated() + mirrored.getCreated());
        }
    }

    private void repairChains(List<NodeRef> tiers, TierStructureResult result) {
        Set<String> previousLevelValues = new HashSet<>();
        for (int i = 0; i < tiers.size(); i++) {
            String expectedType = i == 0 ? null : EdgeTypes.chainValue(tiers.get(i).getName());
            Set<String> levelValues = new HashSet<>();

            for (NodeRef value : values(tiers.get(i))) {
                int validParents = 0;
                for (EdgeRef inbound : inboundChainEdges(value)) {
                    boolean valid = inbound.getType().equals(expectedType)
                            && previousLevelValues.contains(inbound.getFrom().getElementId())
                            && validParents == 0;
                    if (valid) {
                        validParents++;
                    } else {
                        graphStore.deleteEdge(inbound);
                        result.setChainEdgesRemoved(result.getChainEdgesRemoved() + 1);
                    }
                }
                if (i > 0 && validParents == 0) {
                    graphStore.deleteNode(value);
                    result.setOrphanValuesRemoved(result.getOrphanValuesRemoved() + 1);
                } else {
                    levelValues.add(value.getElementId());
                }
            }
            previousLevelValues = levelValues;
        }
    }

    /**
     * Attach values to the tier Lists. Each tier 1 value is merged into the tier 1 List; each
     * chain then walks down one level per entry, reusing a child that already hangs off the
     * previous value and creating it otherwise. A chain with a gap or with more entries than
     * there are tiers is rejected as a whole and reported.
     */
    public TierValuesResult setTierValues(String listId, List<String> tierListIds,
                                          Map<String, List<List<String>>> valuesByTier1) {
        return lockRegistry.withLock(EntityLockRegistry.key(GraphLabels.LIST, listId), () -> {
            List<NodeRef> tiers = transactionOperations.execute(status -> resolveTiers(listId, tierListIds));
            TierValuesResult result = TierValuesResult.builder().listId(listId).build();
            if (valuesByTier1 == null) {
                return result;
            }

            for (Map.Entry<String, List<List<String>>> entry : valuesByTier1.entrySet()) {
                String tier1Value = entry.getKey() == null ? "" : entry.getKey().trim();
                if (tier1Value.isEmpty()) {
                    result.getErrors().add(new ItemFailure(String.valueOf(entry.getKey()), "tier 1 value is blank"));
                    continue;
                }

                List<List<String>> chains = new ArrayList<>();
                List<List<String>> rawChains = entry.getValue() == null ? List.of() : entry.getValue();
                for (List<String> chain : rawChains) {
                    String problem = checkChain(chain, tiers.size());
                    if (problem != null) {
                        result.getErrors().add(new ItemFailure(tier1Value + " -> " + chain, problem));
                    } else {
                        chains.add(chain);
                    }
                }

                try {
                    int[] counts = transactionOperations.execute(status -> writeValues(tiers, tier1Value, chains));
                    if (counts != null) {
                        result.setCreated(result.getCreated() + counts[0]);
                        result.setExisting(result.getExisting() + counts[1]);
                    }
                } catch (RuntimeException e) {
                    log.warn("Could not write tier values under '{}' in List {}: {}", tier1Value, listId, e.getMessage());
                    result.getErrors().add(ItemFailure.of(tier1Value, e));
                }
            }

            log.info("Tier values of List {}: {} created, {} already present, {} rejected",
                    listId, result.getCreated(), result.getExisting(), result.getErrors().size());
            return result;
        });
    }

    private List<NodeRef> resolveTiers(String listId, List<String> tierListIds) {
        NodeRef parent = findList(listId);
        List<NodeRef> tiers = new ArrayList<>();
        if (tierListIds == null || tierListIds.isEmpty()) {
            for (EdgeRef edge : tierEdges(parent)) {
                tiers.add(edge.getTo());
            }
        } else {
            for (String tierListId : tierListIds) {
                NodeRef tierList = findList(tierListId);
                if (!listId.equals(tierList.getString(PARENT_LIST_ID))) {
                    throw new InvariantViolationException("List " + tierListId + " is not a tier of List " + listId);
                }
                tiers.add(tierList);
            }
        }
        if (tiers.isEmpty()) {
            throw new InvariantViolationException("List " + listId + " has no tier structure");
        }
        return tiers;
    }

    /**
     * @return null when the chain is usable, otherwise why it is not
     */
    static String checkChain(List<String> chain, int tierCount) {
        if (chain == null) {
            return "chain is missing";
        }
        int last = -1;
        for (int i = 0; i < chain.size(); i++) {
            if (StringUtils.hasText(chain.get(i))) {
                if (last != i - 1) {
                    return "value '" + chain.get(i).trim() + "' at tier " + (i + 2) + " has no value at tier " + (i + 1);
                }
                last = i;
            }
        }
        if (last + 2 > tierCount) {
            return "chain reaches tier " + (last + 2) + " but the List has " + tierCount + " tier(s)";
        }
        return null;
    }

    private int[] writeValues(List<NodeRef> tiers, String tier1Value, List<List<String>> chains) {
        int[] counts = new int[2];
        NodeRef tier1 = tiers.get(0);

        Optional<NodeRef> existingRoot = memberValue(tier1, tier1Value);
        NodeRef root = existingRoot.orElseGet(() -> createValue(tier1, tier1Value));
        counts[existingRoot.isPresent() ? 1 : 0]++;

        for (List<String> chain : chains) {
            NodeRef previous = root;
            for (int i = 0; i < chain.size() && StringUtils.hasText(chain.get(i)); i++) {
                NodeRef tierList = tiers.get(i + 1);
                String value = chain.get(i).trim();
                String chainType = EdgeTypes.chainValue(tierList.getName());

                Optional<NodeRef> child = graphStore.matchEdges(EdgePattern.outgoing(previous, chainType, GraphLabels.LIST_VALUE))
                        .stream()
                        .map(EdgeRef::getTo)
                        .filter(node -> value.equals(node.getString(VALUE)))
                        .findFirst();
                if (child.isPresent()) {
                    if (graphStore.matchEdges(EdgePattern.between(tierList, EdgeTypes.HAS_LIST_VALUE, child.get())).isEmpty()) {
                        graphStore.createEdge(tierList, child.get(), EdgeTypes.HAS_LIST_VALUE, Map.of());
                    }
                    counts[1]++;
                    previous = child.get();
                } else {
                    NodeRef created = createValue(tierList, value);
                    graphStore.createEdge(previous, created, chainType, Map.of());
                    counts[0]++;
                    previous = created;
                }
            }
        }
        return counts;
    }

    private NodeRef createValue(NodeRef list, String value) {
        NodeRef node = graphStore.createNode(GraphLabels.LIST_VALUE,
                Map.of("id", UUID.randomUUID().toString(), VALUE, value));
        graphStore.createEdge(list, node, EdgeTypes.HAS_LIST_VALUE, Map.of());
        return node;
    }

    private Optional<NodeRef> memberValue(NodeRef list, String value) {
        return values(list).stream()
                .filter(node -> value.equals(node.getString(VALUE)))
                .findFirst();
    }

    /**
     * Copy the parent's shared metadata onto every tier List and give each tier List the
     * parent's driver edges.
     */
    public BatchReconciliationResult cascadeToChildren(String listId) {
        long start = System.currentTimeMillis();
        NodeRef parent = transactionOperations.execute(status -> findList(listId));
        List<NodeRef> children = transactionOperations.execute(status -> {
            List<NodeRef> tiers = new ArrayList<>();
            for (EdgeRef edge : tierEdges(parent)) {
                tiers.add(edge.getTo());
            }
            return tiers;
        });

        BatchReconciliationResult batch = BatchReconciliationResult.builder()
                .operation("cascade List " + listId)
                .build();
        String driver = parent.getString(DriverReconciliationService.DRIVER_PROPERTY);
        Map<String, Object> shared = new HashMap<>();
        for (String key : INHERITED_PROPERTIES) {
            shared.put(key, parent.getProperties().get(key));
        }

        for (NodeRef child : children) {
            batch.setProcessed(batch.getProcessed() + 1);
            try {
                transactionOperations.execute(status -> {
                    graphStore.setNodeProperties(child, shared);
                    return null;
                });
                ReconciliationResult result = driverReconciliationService.reconcileDriverEdges(
                        child.getId(), EntityKind.LIST, StringUtils.hasText(driver) ? driver : null);
                batch.setSucceeded(batch.getSucceeded() + 1);
                batch.setCreated(batch.getCreated() + result.getCreated());
                batch.setDeleted(batch.getDeleted() + result.getDeleted());
            } catch (RuntimeException e) {
                log.warn("Cascade from List {} to tier List {} failed: {}", listId, child.getId(), e.getMessage());
                batch.getErrors().add(ItemFailure.of(child.getId(), e));
            }
        }

        batch.setDurationMs(System.currentTimeMillis() - start);
        log.info("Cascaded List {} to {} tier List(s): {} driver edge(s) created, {} deleted, {} failed",
                listId, children.size(), batch.getCreated(), batch.getDeleted(), batch.getErrors().size());
        return batch;
    }

    /**
     * Switching to Single removes every tier List with its values and chain edges;
     * the List's own values stay. Switching to Multi-Level only records the type, tiers are
     * added with {@link #setTierStructure}.
     */
    public ListTypeChangeResult changeListType(String listId, ListType listType) {
        return lockRegistry.withLock(EntityLockRegistry.key(GraphLabels.LIST, listId),
                () -> transactionOperations.execute(status -> {
                    NodeRef list = findList(listId);
                    ListTypeChangeResult result = ListTypeChangeResult.builder()
                            .listId(listId)
                            .listType(listType.getLabel())
                            .build();
                    if (listType == ListType.SINGLE) {
                        removeTierStructure(list, result);
                    }
                    graphStore.setNodeProperties(list, Map.of(LIST_TYPE, listType.getLabel()));
                    log.info("List {} is now {} ({} tier List(s), {} value(s) removed)", listId,
                            listType.getLabel(), result.getTierListsRemoved(), result.getTierValuesRemoved());
                    return result;
                }));
    }

    /**
     * Delete every tier List of the parent together with their values. Runs inside the
     * caller's transaction.
     */
    void removeTierStructure(NodeRef parent, ListTypeChangeResult result) {
        for (EdgeRef edge : tierEdges(parent)) {
            graphStore.deleteEdge(edge);
            result.setTierEdgesRemoved(result.getTierEdgesRemoved() + 1);
            result.setTierValuesRemoved(result.getTierValuesRemoved() + deleteListWithValues(edge.getTo()));
            result.setTierListsRemoved(result.getTierListsRemoved() + 1);
        }
    }

    public TierStructureDescription describeTierStructure(String listId) {
        return transactionOperations.execute(status -> {
            NodeRef list = findList(listId);
            TierStructureDescription description = TierStructureDescription.builder()
                    .listId(listId)
                    .listName(list.getName())
                    .listType(ListType.fromLabel(list.getString(LIST_TYPE)).getLabel())
                    .build();

            for (EdgeRef edge : tierEdges(list)) {
                NodeRef tierList = edge.getTo();
                int level = EdgeTypes.tierLevel(edge.getType());
                String chainType = level > 1 ? EdgeTypes.chainValue(tierList.getName()) : null;
                List<NodeRef> values = values(tierList);
                int unlinked = 0;
                if (chainType != null) {
                    for (NodeRef value : values) {
                        boolean linked = inboundChainEdges(value).stream()
                                .anyMatch(inbound -> inbound.getType().equals(chainType));
                        if (!linked) {
                            unlinked++;
                        }
                    }
                }
                description.getTiers().add(TierStructureDescription.TierInfo.builder()
                        .level(level)
                        .listId(tierList.getId())
                        .name(tierList.getName())
                        .chainEdgeType(chainType)
                        .valueCount(values.size())
                        .unlinkedValueCount(unlinked)
                        .build());
            }
            return description;
        });
    }

    private int deleteListWithValues(NodeRef list) {
        List<NodeRef> values = values(list);
        values.forEach(graphStore::deleteNode);
        graphStore.deleteNode(list);
        return values.size();
    }

    /** HAS_TIER_n edges of a List, ordered by level. */
    List<EdgeRef> tierEdges(NodeRef list) {
        List<EdgeRef> edges = new ArrayList<>(graphStore.matchEdges(EdgePattern.builder()
                .fromNode(list)
                .types(EdgeTypes.allTiers())
                .toLabel(GraphLabels.LIST)
                .build()));
        edges.sort(Comparator.comparingInt(edge -> EdgeTypes.tierLevel(edge.getType())));
        return edges;
    }

    List<NodeRef> values(NodeRef list) {
        List<NodeRef> values = new ArrayList<>();
        for (EdgeRef edge : graphStore.matchEdges(EdgePattern.outgoing(list, EdgeTypes.HAS_LIST_VALUE, GraphLabels.LIST_VALUE))) {
            values.add(edge.getTo());
        }
        return values;
    }

    private List<EdgeRef> inboundChainEdges(NodeRef value) {
        return graphStore.matchEdges(EdgePattern.builder()
                .fromLabel(GraphLabels.LIST_VALUE)
                .toNode(value)
                .build());
    }

    private Map<String, Object> inheritedProperties(NodeRef parent) {
        Map<String, Object> shared = new LinkedHashMap<>();
        for (String key : INHERITED_PROPERTIES) {
            Object value = parent.getProperties().get(key);
            if (value != null) {
                shared.put(key, value);
            }
        }
        return shared;
    }

    NodeRef findList(String listId) {
        return graphStore.findNode(GraphLabels.LIST, "id", listId)
                .orElseThrow(() -> new EntityNotFoundException(GraphLabels.LIST, listId));
    }
}
