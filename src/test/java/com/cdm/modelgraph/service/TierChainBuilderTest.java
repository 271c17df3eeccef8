package com.cdm.modelgraph.service;

import com.cdm.modelgraph.dto.BatchReconciliationResult;
import com.cdm.modelgraph.dto.ListTypeChangeResult;
import com.cdm.modelgraph.dto.ReconciliationResult;
import com.cdm.modelgraph.dto.TierStructureDescription;
import com.cdm.modelgraph.dto.TierStructureResult;
import com.cdm.modelgraph.dto.TierValuesResult;
import com.cdm.modelgraph.graph.EdgePattern;
import com.cdm.modelgraph.graph.EdgeRef;
import com.cdm.modelgraph.graph.EdgeTypes;
import com.cdm.modelgraph.graph.GraphLabels;
import com.cdm.modelgraph.graph.InMemoryGraphStore;
import com.cdm.modelgraph.graph.NodeRef;
import com.cdm.modelgraph.model.EntityKind;
import com.cdm.modelgraph.model.ListType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TierChainBuilderTest {

    private EngineFixture fixture;
    private InMemoryGraphStore store;
    private TierChainBuilder builder;
    private NodeRef location;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        store = fixture.store;
        builder = fixture.tiers;
        location = store.addNode(GraphLabels.LIST, "id", "l1", "name", "Location", "set", "Geo", "grouping", "Address");
    }

    private Map<String, List<List<String>>> californiaCities() {
        return Map.of("CA", List.of(List.of("Los Angeles"), List.of("San Francisco")));
    }

    private List<NodeRef> valuesOf(String tierListId) {
        return builder.values(store.node(GraphLabels.LIST, "id", tierListId));
    }

    @Test
    void testSetTierStructureCreatesTierLists() {
        TierStructureResult result = builder.setTierStructure("l1", List.of("State", "City"));

        assertEquals(2, result.getTierListIds().size());
        assertEquals(2, result.getTierEdgesCreated());
        NodeRef city = store.node(GraphLabels.LIST, "id", result.getTierListIds().get(1));
        assertEquals("City", city.getName());
        assertEquals(2, city.getInt("tier"));
        assertEquals("l1", city.getString("parentListId"));
        assertEquals("Geo", city.getString("set"));
        assertEquals(1, store.edgesOfType(EdgeTypes.tier(2)).size());
        assertEquals("Multi-Level", store.refresh(location).getString("listType"));
    }

    @Test
    void testSetTierStructureTwiceReusesTierLists() {
        TierStructureResult first = builder.setTierStructure("l1", List.of("State", "City"));
        store.resetWrites();

        TierStructureResult second = builder.setTierStructure("l1", List.of("State", "City"));

        assertEquals(first.getTierListIds(), second.getTierListIds());
        assertEquals(0, second.getTierEdgesCreated());
        assertEquals(0, store.getWrites());
    }

    @Test
    void testCaliforniaChain() {
        TierStructureResult structure = builder.setTierStructure("l1", List.of("State", "City"));

        TierValuesResult result = builder.setTierValues("l1", List.of(), californiaCities());

        assertEquals(3, result.getCreated());
        assertTrue(result.getErrors().isEmpty());

        List<NodeRef> states = valuesOf(structure.getTierListIds().get(0));
        assertEquals(1, states.size());
        assertEquals("CA", states.get(0).getString("value"));

        List<NodeRef> cities = valuesOf(structure.getTierListIds().get(1));
        assertEquals(2, cities.size());
        for (NodeRef city : cities) {
            List<EdgeRef> inbound = store.matchEdges(EdgePattern.builder()
                    .fromLabel(GraphLabels.LIST_VALUE).toNode(city).build());
            assertEquals(1, inbound.size());
            assertEquals("HAS_CITY_VALUE", inbound.get(0).getType());
            assertEquals("CA", inbound.get(0).getFrom().getString("value"));
        }

        TierStructureDescription description = builder.describeTierStructure("l1");
        assertEquals(0, description.getTiers().get(1).getUnlinkedValueCount());
        assertEquals(2, description.getTiers().get(1).getValueCount());
    }

    @Test
    void testRepeatedValuesAreMerged() {
        builder.setTierStructure("l1", List.of("State", "City"));
        builder.setTierValues("l1", List.of(), californiaCities());

        TierValuesResult again = builder.setTierValues("l1", List.of(),
                Map.of("CA", List.of(List.of("Los Angeles"), List.of("San Diego"))));

        assertEquals(1, again.getCreated());
        assertEquals(2, again.getExisting());
        assertEquals(4, store.nodeCount(GraphLabels.LIST_VALUE));
    }

    @Test
    void testChainWithGapOrTooManyLevelsIsRejected() {
        builder.setTierStructure("l1", List.of("Country", "State", "City"));

        TierValuesResult result = builder.setTierValues("l1", List.of(), Map.of("US", List.of(
                List.of("", "Springfield"),
                List.of("CA", "Los Angeles", "Venice"),
                List.of("NY", "New York"))));

        assertEquals(2, result.getErrors().size());
        assertEquals(3, result.getCreated());
        assertEquals(3, store.nodeCount(GraphLabels.LIST_VALUE));
    }

    @Test
    void testExplicitTierListIdsMustBelongToList() {
        NodeRef other = store.addNode(GraphLabels.LIST, "id", "l2", "name", "Other");
        builder.setTierStructure("l2", List.of("Level"));
        String foreignTier = builder.tierEdges(other).get(0).getTo().getId();

        assertThrows(RuntimeException.class, () -> builder.setTierValues("l1", List.of(foreignTier), californiaCities()));
    }

    @Test
    void testRemovingTierDeletesItsValues() {
        builder.setTierStructure("l1", List.of("State", "City"));
        builder.setTierValues("l1", List.of(), californiaCities());

        TierStructureResult result = builder.setTierStructure("l1", List.of("State"));

        assertEquals(1, result.getRemovedTierListIds().size());
        assertEquals(1, result.getTierEdgesRemoved());
        assertEquals(1, store.nodeCount(GraphLabels.LIST_VALUE));
        assertTrue(store.edgesOfType("HAS_CITY_VALUE").isEmpty());
    }

    @Test
    void testReorderingPrunesBrokenChains() {
        builder.setTierStructure("l1", List.of("State", "City"));
        builder.setTierValues("l1", List.of(), californiaCities());

        TierStructureResult result = builder.setTierStructure("l1", List.of("City", "State"));

        assertEquals(2, result.getTierEdgesRemoved());
        assertEquals(2, result.getTierEdgesCreated());
        assertEquals(2, result.getChainEdgesRemoved());
        assertEquals(1, result.getOrphanValuesRemoved());

        TierStructureDescription description = builder.describeTierStructure("l1");
        assertEquals("City", description.getTiers().get(0).getName());
        for (TierStructureDescription.TierInfo tier : description.getTiers()) {
            assertEquals(0, tier.getUnlinkedValueCount());
        }
    }

    @Test
    void testTooManyOrClashingTierNames() {
        List<String> eleven = new ArrayList<>(Collections.nCopies(11, "x"));
        for (int i = 0; i < eleven.size(); i++) {
            eleven.set(i, "Level " + i);
        }
        assertThrows(IllegalArgumentException.class, () -> builder.setTierStructure("l1", eleven));
        assertThrows(IllegalArgumentException.class, () -> builder.setTierStructure("l1", List.of("Sub Region", "Sub-Region")));
        assertThrows(IllegalArgumentException.class, () -> builder.setTierStructure("l1", List.of("State", " ")));
    }

    @Test
    void testSwitchToSingleKeepsPlainValues() {
        NodeRef plain = store.addNode(GraphLabels.LIST_VALUE, "id", "pv", "value", "Other");
        store.addEdge(location, plain, EdgeTypes.HAS_LIST_VALUE);
        builder.setTierStructure("l1", List.of("State", "City"));
        builder.setTierValues("l1", List.of(), californiaCities());

        ListTypeChangeResult result = builder.changeListType("l1", ListType.SINGLE);

        assertEquals(2, result.getTierListsRemoved());
        assertEquals(3, result.getTierValuesRemoved());
        assertEquals(2, result.getTierEdgesRemoved());
        assertEquals(1, store.nodeCount(GraphLabels.LIST));
        assertEquals(1, store.nodeCount(GraphLabels.LIST_VALUE));
        assertNotNull(store.refresh(plain));
        assertEquals("Single", store.refresh(location).getString("listType"));
        assertTrue(store.edgesOfType("HAS_CITY_VALUE").isEmpty());
    }

    @Test
    void testCascadeCopiesMetadataAndDrivers() {
        TierStructureResult structure = builder.setTierStructure("l1", List.of("State", "City"));
        store.setNodeProperties(location, Map.of("set", "Geo 2", "status", "Active", "driver", "A, None, None, None"));

        BatchReconciliationResult result = builder.cascadeToChildren("l1");

        assertEquals(2, result.getSucceeded());
        assertEquals(2, result.getCreated());
        for (String tierListId : structure.getTierListIds()) {
            NodeRef tierList = store.node(GraphLabels.LIST, "id", tierListId);
            assertEquals("Geo 2", tierList.getString("set"));
            assertEquals("Active", tierList.getString("status"));
            Set<String> sectors = store.matchEdges(EdgePattern.incoming("Sector", EdgeTypes.IS_RELEVANT_TO, tierList))
                    .stream().map(edge -> edge.getFrom().getName()).collect(Collectors.toSet());
            assertEquals(Set.of("A"), sectors);
        }
    }

    private Set<String> sectorsOf(NodeRef list) {
        return store.matchEdges(EdgePattern.incoming("Sector", EdgeTypes.IS_RELEVANT_TO, list))
                .stream().map(edge -> edge.getFrom().getName()).collect(Collectors.toSet());
    }

    @Test
    void testNewTierListsTakeParentDrivers() {
        fixture.drivers.reconcileDriverEdges("l1", EntityKind.LIST, "A, None, None");

        TierStructureResult structure = builder.setTierStructure("l1", List.of("State", "City"));

        assertEquals(2, structure.getDriverEdgesCreated());
        for (String tierListId : structure.getTierListIds()) {
            NodeRef tierList = store.node(GraphLabels.LIST, "id", tierListId);
            assertEquals("A, None, None", tierList.getString("driver"));
            assertEquals(Set.of("A"), sectorsOf(tierList));
        }
    }

    @Test
    void testReusedTierListFollowsParentMetadata() {
        TierStructureResult first = builder.setTierStructure("l1", List.of("State"));
        store.setNodeProperties(location, Map.of("format", "Text", "driver", "B, None, None, None"));

        builder.setTierStructure("l1", List.of("State"));

        NodeRef state = store.node(GraphLabels.LIST, "id", first.getTierListIds().get(0));
        assertEquals("Text", state.getString("format"));
        assertEquals(Set.of("B"), sectorsOf(state));
    }

    @Test
    void testReconcilingParentListReachesTierLists() {
        TierStructureResult structure = builder.setTierStructure("l1", List.of("State"));
        NodeRef state = store.node(GraphLabels.LIST, "id", structure.getTierListIds().get(0));

        ReconciliationResult result = fixture.drivers.reconcileDriverEdges("l1", EntityKind.LIST, "A,B, None, None");

        assertEquals(1, result.getTierLists().size());
        assertEquals(2, result.getTierLists().get(0).getCreated());
        assertEquals(Set.of("A", "B"), sectorsOf(store.refresh(state)));
        assertEquals("A,B, None, None", store.refresh(state).getString("driver"));

        ReconciliationResult cleared = fixture.drivers.reconcileDriverEdges("l1", EntityKind.LIST, null);

        assertFalse(cleared.isUnchanged());
        assertTrue(sectorsOf(state).isEmpty());
        assertTrue(sectorsOf(location).isEmpty());
    }
}
