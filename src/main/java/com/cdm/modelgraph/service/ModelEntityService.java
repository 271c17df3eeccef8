package com.cdm.modelgraph.service;

import com.cdm.modelgraph.dto.EntityDeletionResult;
import com.cdm.modelgraph.dto.ListTypeChangeResult;
import com.cdm.modelgraph.graph.EdgePattern;
import com.cdm.modelgraph.graph.EdgeRef;
import com.cdm.modelgraph.graph.EdgeTypes;
import com.cdm.modelgraph.graph.GraphLabels;
import com.cdm.modelgraph.graph.GraphStore;
import com.cdm.modelgraph.graph.NodeRef;
import com.cdm.modelgraph.model.EntityKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deletion of Objects, Variables and Lists. The entity loses all of its edges; driver
 * nodes, Parts, Groups and other Objects are never deleted with it.
 */
@Service
@Slf4j
public class ModelEntityService {

    private final GraphStore graphStore;
    private final DriverReconciliationService driverReconciliationService;
    private final ObjectRelationshipService relationshipService;
    private final TierChainBuilder tierChainBuilder;
    private final EntityLockRegistry lockRegistry;
    private final TransactionOperations transactionOperations;

    public ModelEntityService(
            GraphStore graphStore,
            DriverReconciliationService driverReconciliationService,
            ObjectRelationshipService relationshipService,
            TierChainBuilder tierChainBuilder,
            EntityLockRegistry lockRegistry,
            @Qualifier("neo4jTransactionOperations") TransactionOperations transactionOperations) {
        this.graphStore = graphStore;
        this.driverReconciliationService = driverReconciliationService;
        this.relationshipService = relationshipService;
        this.tierChainBuilder = tierChainBuilder;
        this.lockRegistry = lockRegistry;
        this.transactionOperations = transactionOperations;
    }

    /**
     * Delete an entity. A List takes its tier Lists and all their values with it; deleting
     * an Object refreshes the relationships count of Objects that pointed at it.
     */
    public EntityDeletionResult deleteEntity(String entityId, EntityKind kind) {
        return lockRegistry.withLock(EntityLockRegistry.key(kind.getLabel(), entityId),
                () -> transactionOperations.execute(status -> {
                    NodeRef entity = driverReconciliationService.findEntity(kind, entityId);
                    EntityDeletionResult result = EntityDeletionResult.builder()
                            .entityId(entityId)
                            .entityKind(kind.getLabel())
                            .build();

                    switch (kind) {
                        case LIST -> deleteList(entity, result);
                        case OBJECT -> deleteObject(entity, result);
                        default -> graphStore.deleteNode(entity);
                    }

                    log.info("Deleted {} {} ({} tier List(s), {} value(s) removed)", kind.getLabel(), entityId,
                            result.getTierListsRemoved(), result.getValuesRemoved());
                    return result;
                }));
    }

    private void deleteList(NodeRef list, EntityDeletionResult result) {
        ListTypeChangeResult tiers = ListTypeChangeResult.builder().build();
        tierChainBuilder.removeTierStructure(list, tiers);
        List<NodeRef> values = tierChainBuilder.values(list);
        values.forEach(graphStore::deleteNode);
        graphStore.deleteNode(list);
        result.setTierListsRemoved(tiers.getTierListsRemoved());
        result.setValuesRemoved(tiers.getTierValuesRemoved() + values.size());
    }

    private void deleteObject(NodeRef object, EntityDeletionResult result) {
        Map<String, NodeRef> sources = new LinkedHashMap<>();
        for (EdgeRef edge : graphStore.matchEdges(EdgePattern.incoming(GraphLabels.OBJECT, EdgeTypes.RELATES_TO, object))) {
            if (!edge.getFrom().getElementId().equals(object.getElementId())) {
                sources.put(edge.getFrom().getElementId(), edge.getFrom());
            }
        }
        graphStore.deleteNode(object);
        for (NodeRef source : sources.values()) {
            if (relationshipService.refreshRelationshipCount(source)) {
                result.setRelationshipCountsUpdated(result.getRelationshipCountsUpdated() + 1);
            }
        }
    }
}
