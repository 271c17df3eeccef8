package com.cdm.modelgraph.service;

import com.cdm.modelgraph.dto.GroupPartAuditReport;
import com.cdm.modelgraph.dto.GroupPartResolution;
import com.cdm.modelgraph.graph.EdgePattern;
import com.cdm.modelgraph.graph.EdgeTypes;
import com.cdm.modelgraph.graph.GraphLabels;
import com.cdm.modelgraph.graph.InMemoryGraphStore;
import com.cdm.modelgraph.graph.NodeRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GroupPartExclusivityAuditorTest {

    private InMemoryGraphStore store;
    private GroupPartExclusivityAuditor auditor;
    private NodeRef partX;
    private NodeRef partY;
    private NodeRef group;

    @BeforeEach
    void setUp() {
        EngineFixture fixture = new EngineFixture();
        store = fixture.store;
        auditor = fixture.groupAuditor;
        partX = store.addNode(GraphLabels.PART, "name", "X");
        partY = store.addNode(GraphLabels.PART, "name", "Y");
        group = store.addNode(GraphLabels.GROUP, "name", "G");
        store.addEdge(partX, group, EdgeTypes.HAS_GROUP);
        store.addEdge(partY, group, EdgeTypes.HAS_GROUP);
    }

    private void addVariable(String id, String part) {
        NodeRef variable = store.addNode(GraphLabels.VARIABLE, "id", id, "name", id, "part", part);
        store.addEdge(group, variable, EdgeTypes.HAS_VARIABLE);
    }

    private int incomingParts() {
        return store.matchEdges(EdgePattern.incoming(GraphLabels.PART, EdgeTypes.HAS_GROUP, group)).size();
    }

    @Test
    void testMajorityPartKeepsGroup() {
        addVariable("v1", "X");
        addVariable("v2", "X");
        addVariable("v3", "X");
        addVariable("v4", "Y");

        GroupPartAuditReport report = auditor.auditGroupPartExclusivity();

        assertEquals(1, report.getConflictsFound());
        assertEquals(1, report.getRemoved());
        GroupPartResolution resolution = report.getResolutions().get(0);
        assertEquals("X", resolution.getChosenPart());
        assertEquals(List.of("Y"), resolution.getRemovedParts());
        assertEquals(3L, resolution.getVariableCounts().get("X"));
        assertEquals(1L, resolution.getVariableCounts().get("Y"));
        assertTrue(store.matchEdges(EdgePattern.between(partY, EdgeTypes.HAS_GROUP, group)).isEmpty());
        assertEquals(1, incomingParts());
        assertEquals(4, store.edgesOfType(EdgeTypes.HAS_VARIABLE).size());
        assertEquals(0, report.getIntegrity().getGroupsWithMultipleParts());
    }

    @Test
    void testTieIsBrokenByName() {
        addVariable("v1", "X");
        addVariable("v2", "Y");

        GroupPartResolution resolution = auditor.auditGroupPartExclusivity().getResolutions().get(0);

        assertEquals("X", resolution.getChosenPart());
        assertTrue(resolution.isTieBroken());
        assertTrue(resolution.isApplied());
    }

    @Test
    void testRequireMajorityLeavesUndecidableGroup() {
        GroupPartAuditReport report = auditor.auditGroupPartExclusivity(false, true);

        assertEquals(0, report.getRemoved());
        assertEquals(1, report.getErrors().size());
        assertTrue(report.getErrors().get(0).getCause().contains("G"));
        assertEquals(2, incomingParts());
        assertEquals(1, report.getIntegrity().getGroupsWithMultipleParts());
    }

    @Test
    void testDryRunOnlyReports() {
        addVariable("v1", "Y");
        store.resetWrites();

        GroupPartAuditReport report = auditor.auditGroupPartExclusivity(true, false);

        assertEquals(1, report.getRemoved());
        assertEquals("Y", report.getResolutions().get(0).getChosenPart());
        assertFalse(report.getResolutions().get(0).isApplied());
        assertEquals(0, store.getWrites());
        assertEquals(2, incomingParts());
    }

    @Test
    void testDuplicateEdgesFromOnePartAreCollapsed() {
        NodeRef other = store.addNode(GraphLabels.GROUP, "name", "H");
        store.addEdge(partX, other, EdgeTypes.HAS_GROUP);
        store.addEdge(partX, other, EdgeTypes.HAS_GROUP);
        addVariable("v1", "X");

        GroupPartAuditReport report = auditor.auditGroupPartExclusivity();

        assertEquals(1, report.getConflictsFound());
        assertEquals(2, report.getRemoved());
        assertEquals(1, store.matchEdges(EdgePattern.incoming(GraphLabels.PART, EdgeTypes.HAS_GROUP, other)).size());
    }

    @Test
    void testIntegritySummary() {
        addVariable("v1", "X");
        store.addNode(GraphLabels.VARIABLE, "id", "loose", "name", "loose");
        NodeRef second = store.addNode(GraphLabels.GROUP, "name", "Second");
        store.addEdge(second, store.node(GraphLabels.VARIABLE, "id", "v1"), EdgeTypes.HAS_VARIABLE);

        GroupPartAuditReport report = auditor.auditGroupPartExclusivity();

        assertEquals(1, report.getIntegrity().getOrphanedVariables());
        assertEquals(1, report.getIntegrity().getVariablesWithMultipleGroups());
        assertEquals(1, report.getIntegrity().getGroupsWithoutPart());
        assertEquals(0, report.getIntegrity().getGroupsWithMultipleParts());
    }
}
