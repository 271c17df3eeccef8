package com.cdm.modelgraph.service;

import com.cdm.modelgraph.dto.EntityDeletionResult;
import com.cdm.modelgraph.dto.RelationshipRequest;
import com.cdm.modelgraph.exception.EntityNotFoundException;
import com.cdm.modelgraph.graph.EdgeTypes;
import com.cdm.modelgraph.graph.GraphLabels;
import com.cdm.modelgraph.graph.InMemoryGraphStore;
import com.cdm.modelgraph.graph.NodeRef;
import com.cdm.modelgraph.model.EntityKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelEntityServiceTest {

    private EngineFixture fixture;
    private InMemoryGraphStore store;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        store = fixture.store;
    }

    @Test
    void testDeleteListTakesTiersAndValues() {
        store.addNode(GraphLabels.LIST, "id", "l1", "name", "Location");
        fixture.drivers.reconcileDriverEdges("l1", EntityKind.LIST, "A, None, US, None");
        fixture.tiers.setTierStructure("l1", List.of("State", "City"));
        fixture.tiers.setTierValues("l1", List.of(), Map.of("CA", List.of(List.of("Los Angeles"))));

        EntityDeletionResult result = fixture.entities.deleteEntity("l1", EntityKind.LIST);

        assertEquals(2, result.getTierListsRemoved());
        assertEquals(2, result.getValuesRemoved());
        assertEquals(0, store.nodeCount(GraphLabels.LIST));
        assertEquals(0, store.nodeCount(GraphLabels.LIST_VALUE));
        assertTrue(store.findNode("Sector", "name", "A").isPresent());
        assertTrue(store.edgesOfType(EdgeTypes.IS_RELEVANT_TO).isEmpty());
    }

    @Test
    void testDeleteObjectRefreshesCountsOfOthers() {
        NodeRef customer = store.addNode(GraphLabels.OBJECT, "id", "o1", "object", "Customer");
        store.addNode(GraphLabels.OBJECT, "id", "o2", "object", "Account");
        fixture.allPairs.ensureAllPairsRelationships("o1", null);
        fixture.allPairs.ensureAllPairsRelationships("o2", null);
        fixture.relationships.createRelationship("o1",
                RelationshipRequest.builder().targetId("o2").role("Owner").build());

        EntityDeletionResult result = fixture.entities.deleteEntity("o2", EntityKind.OBJECT);

        assertEquals(1, result.getRelationshipCountsUpdated());
        assertEquals(0, store.refresh(customer).getInt("relationships"));
        assertEquals(1, store.edgesOfType(EdgeTypes.RELATES_TO).size());
        assertEquals(1, store.nodeCount(GraphLabels.OBJECT));
    }

    @Test
    void testDeleteVariableKeepsGroupAndDrivers() {
        NodeRef group = store.addNode(GraphLabels.GROUP, "name", "G");
        NodeRef variable = store.addNode(GraphLabels.VARIABLE, "id", "v1", "name", "Balance");
        store.addEdge(group, variable, EdgeTypes.HAS_VARIABLE);
        fixture.drivers.reconcileDriverEdges("v1", EntityKind.VARIABLE, "A, None, None, None");

        fixture.entities.deleteEntity("v1", EntityKind.VARIABLE);

        assertNotNull(store.refresh(group));
        assertEquals(1, store.nodeCount("Sector"));
        assertEquals(0, store.nodeCount(GraphLabels.VARIABLE));
        assertThrows(EntityNotFoundException.class, () -> fixture.entities.deleteEntity("v1", EntityKind.VARIABLE));
    }
}
