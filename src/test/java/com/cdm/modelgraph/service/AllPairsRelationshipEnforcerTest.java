package com.cdm.modelgraph.service;

import com.cdm.modelgraph.dto.AllPairsReport;
import com.cdm.modelgraph.dto.AllPairsResult;
import com.cdm.modelgraph.dto.RelationshipAuditRequest;
import com.cdm.modelgraph.graph.EdgePattern;
import com.cdm.modelgraph.graph.EdgeRef;
import com.cdm.modelgraph.graph.EdgeTypes;
import com.cdm.modelgraph.graph.GraphLabels;
import com.cdm.modelgraph.graph.InMemoryGraphStore;
import com.cdm.modelgraph.graph.NodeRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AllPairsRelationshipEnforcerTest {

    private InMemoryGraphStore store;
    private AllPairsRelationshipEnforcer enforcer;

    @BeforeEach
    void setUp() {
        EngineFixture fixture = new EngineFixture();
        store = fixture.store;
        enforcer = fixture.allPairs;
    }

    private NodeRef createObject(String id, String name) {
        NodeRef object = store.addNode(GraphLabels.OBJECT, "id", id, "object", name, "being", "Master");
        enforcer.ensureAllPairsRelationships(id, name);
        return object;
    }

    @Test
    void testEveryOrderedPairGetsOneDefaultEdge() {
        createObject("o1", "Customer");
        createObject("o2", "Account");
        createObject("o3", "Branch");

        List<EdgeRef> edges = store.edgesOfType(EdgeTypes.RELATES_TO);
        assertEquals(9, edges.size());

        Set<String> pairs = new HashSet<>();
        int intra = 0;
        for (EdgeRef edge : edges) {
            assertTrue(pairs.add(edge.getFrom().getId() + "->" + edge.getTo().getId()));
            assertEquals(edge.getFrom().getString("object"), edge.getString("role"));
            assertEquals("Possible", edge.getString("frequency"));
            boolean self = edge.getFrom().getId().equals(edge.getTo().getId());
            assertEquals(self ? "Intra-Table" : "Inter-Table", edge.getString("type"));
            if (self) {
                intra++;
            }
        }
        assertEquals(3, intra);
    }

    @Test
    void testDefaultEdgeCarriesTargetSnapshot() {
        createObject("o1", "Customer");
        store.addNode(GraphLabels.OBJECT, "id", "o2", "object", "Account");

        enforcer.ensureAllPairsRelationships("o2", null);

        NodeRef o1 = store.node(GraphLabels.OBJECT, "id", "o1");
        NodeRef o2 = store.node(GraphLabels.OBJECT, "id", "o2");
        EdgeRef toAccount = store.matchEdges(EdgePattern.between(o1, EdgeTypes.RELATES_TO, o2)).get(0);
        assertEquals("Account", toAccount.getString("toObject"));
        assertEquals("ALL", toAccount.getString("toBeing"));
        assertEquals("ALL", toAccount.getString("toAvatar"));
        assertNotNull(toAccount.getString("id"));
    }

    @Test
    void testEnsureIsIdempotent() {
        createObject("o1", "Customer");
        createObject("o2", "Account");
        store.resetWrites();

        AllPairsResult again = enforcer.ensureAllPairsRelationships("o2", "Account");

        assertEquals(0, again.getCreated());
        assertEquals(3, again.getExisting());
        assertEquals(0, store.getWrites());
    }

    @Test
    void testFailingPairDoesNotStopTheOthers() {
        createObject("o1", "Customer");
        store.addNode(GraphLabels.OBJECT, "id", "o2", "object", "Account");
        store.failEdgeCreationWhen((from, to) -> "o2".equals(from.getId()) && "o1".equals(to.getId()));

        AllPairsResult result = enforcer.ensureAllPairsRelationships("o2", "Account");

        assertEquals(2, result.getCreated());
        assertEquals(1, result.getErrors().size());
        assertEquals("o2->o1", result.getErrors().get(0).getItemId());
    }

    @Test
    void testAuditCreatesMissingDefaults() {
        store.addNode(GraphLabels.OBJECT, "id", "o1", "object", "Customer");
        store.addNode(GraphLabels.OBJECT, "id", "o2", "object", "Account");

        AllPairsReport report = enforcer.auditAllPairsRelationships(RelationshipAuditRequest.builder().build());

        assertEquals(2, report.getObjectsChecked());
        assertEquals(4, report.getPairsChecked());
        assertEquals(4, report.getCreated());
        assertEquals(4, store.edgesOfType(EdgeTypes.RELATES_TO).size());
    }

    @Test
    void testAuditKeepsLowestIdAndNormalizes() {
        NodeRef o1 = store.addNode(GraphLabels.OBJECT, "id", "o1", "object", "Customer");
        NodeRef o2 = store.addNode(GraphLabels.OBJECT, "id", "o2", "object", "Account");
        store.addEdge(o1, o2, EdgeTypes.RELATES_TO, "id", "b", "role", "Customer", "type", "Inter-Table", "frequency", "Possible");
        store.addEdge(o1, o2, EdgeTypes.RELATES_TO, "id", "a", "role", "Customer", "type", "Blood", "frequency", "Critical");
        store.addEdge(o1, o2, EdgeTypes.RELATES_TO, "id", "c", "role", "Owner", "type", "Inter-Table", "frequency", "Critical");

        AllPairsReport report = enforcer.auditAllPairsRelationships(
                RelationshipAuditRequest.builder().objectIds(List.of("o1")).build());

        assertEquals(1, report.getDuplicatesRemoved());
        assertEquals(1, report.getNormalized());
        assertEquals(0, report.getNonDefaultRemoved());
        assertEquals(1, report.getCreated());

        List<EdgeRef> defaults = store.matchEdges(EdgePattern.builder()
                .fromNode(o1).type(EdgeTypes.RELATES_TO).toNode(o2).property("role", "Customer").build());
        assertEquals(1, defaults.size());
        assertEquals("a", defaults.get(0).getString("id"));
        assertEquals("Inter-Table", defaults.get(0).getString("type"));
        assertEquals("Possible", defaults.get(0).getString("frequency"));
        assertEquals(1, store.refresh(o1).getInt("relationships"));
    }

    @Test
    void testAuditPrunesOtherRolesOnlyWhenAsked() {
        NodeRef o1 = store.addNode(GraphLabels.OBJECT, "id", "o1", "object", "Customer");
        store.addEdge(o1, o1, EdgeTypes.RELATES_TO, "id", "a", "role", "Customer", "type", "Intra-Table", "frequency", "Possible");
        store.addEdge(o1, o1, EdgeTypes.RELATES_TO, "id", "b", "role", "Parent", "type", "Blood", "frequency", "Critical");

        AllPairsReport report = enforcer.auditAllPairsRelationships(
                RelationshipAuditRequest.builder().pruneNonDefault(true).build());

        assertEquals(1, report.getNonDefaultRemoved());
        assertEquals(1, store.edgesOfType(EdgeTypes.RELATES_TO).size());
        assertEquals("Customer", store.edgesOfType(EdgeTypes.RELATES_TO).get(0).getString("role"));
    }

    @Test
    void testAuditDryRunWritesNothing() {
        store.addNode(GraphLabels.OBJECT, "id", "o1", "object", "Customer");
        store.addNode(GraphLabels.OBJECT, "id", "o2", "object", "Account");
        store.resetWrites();

        AllPairsReport report = enforcer.auditAllPairsRelationships(
                RelationshipAuditRequest.builder().dryRun(true).build());

        assertEquals(4, report.getCreated());
        assertEquals(2, report.getCountsUpdated());
        assertEquals(0, store.getWrites());
        assertTrue(store.edgesOfType(EdgeTypes.RELATES_TO).isEmpty());
    }

    @Test
    void testAuditReportsUnknownSource() {
        store.addNode(GraphLabels.OBJECT, "id", "o1", "object", "Customer");

        AllPairsReport report = enforcer.auditAllPairsRelationships(
                RelationshipAuditRequest.builder().objectIds(List.of("o1", "nope")).build());

        assertEquals(1, report.getObjectsChecked());
        assertEquals(1, report.getErrors().size());
        assertEquals("nope", report.getErrors().get(0).getItemId());
    }

    @Test
    void testAuditHandlesObjectWithoutId() {
        store.addNode(GraphLabels.OBJECT, "id", "o1", "object", "Customer");
        NodeRef legacy = store.addNode(GraphLabels.OBJECT, "object", "Legacy");

        AllPairsReport report = enforcer.auditAllPairsRelationships(RelationshipAuditRequest.builder().build());

        assertTrue(report.getErrors().isEmpty());
        assertEquals(4, report.getCreated());
        List<EdgeRef> self = store.matchEdges(EdgePattern.between(legacy, EdgeTypes.RELATES_TO, legacy));
        assertEquals(1, self.size());
        assertEquals("Intra-Table", self.get(0).getString("type"));
        NodeRef customer = store.node(GraphLabels.OBJECT, "id", "o1");
        assertEquals("Inter-Table", store.matchEdges(EdgePattern.between(legacy, EdgeTypes.RELATES_TO, customer))
                .get(0).getString("type"));
    }
}
