package com.cdm.modelgraph.service;

import com.cdm.modelgraph.dto.GroupPartAuditReport;
import com.cdm.modelgraph.dto.GroupPartResolution;
import com.cdm.modelgraph.dto.IntegritySummary;
import com.cdm.modelgraph.dto.ItemFailure;
import com.cdm.modelgraph.exception.InvariantViolationException;
import com.cdm.modelgraph.graph.EdgePattern;
import com.cdm.modelgraph.graph.EdgeRef;
import com.cdm.modelgraph.graph.EdgeTypes;
import com.cdm.modelgraph.graph.GraphLabels;
import com.cdm.modelgraph.graph.GraphStore;
import com.cdm.modelgraph.graph.NodeRef;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Repairs Groups linked from more than one Part so that every Group has at most one
 * incoming HAS_GROUP edge. Variables are never moved; only HAS_GROUP edges are removed.
 */
@Service
@Slf4j
public class GroupPartExclusivityAuditor {

    static final String PART_PROPERTY = "part";

    private final GraphStore graphStore;
    private final GroupOwnerChooser ownerChooser;
    private final TransactionOperations transactionOperations;

    public GroupPartExclusivityAuditor(
            GraphStore graphStore,
            GroupOwnerChooser ownerChooser,
            @Qualifier("neo4jTransactionOperations") TransactionOperations transactionOperations) {
        this.graphStore = graphStore;
        this.ownerChooser = ownerChooser;
        this.transactionOperations = transactionOperations;
    }

    public GroupPartAuditReport auditGroupPartExclusivity() {
        return auditGroupPartExclusivity(false, false);
    }

    /**
     * @param dryRun          report the decisions without removing anything
     * @param requireMajority leave a Group alone and record an invariant violation when its
     *                        top candidates tie with no Variable reachable through any of them
     */
    public GroupPartAuditReport auditGroupPartExclusivity(boolean dryRun, boolean requireMajority) {
        long start = System.currentTimeMillis();
        GroupPartAuditReport report = GroupPartAuditReport.builder().dryRun(dryRun).build();

        List<NodeRef> groups = graphStore.matchNodes(GraphLabels.GROUP, Map.of());
        Map<String, List<EdgeRef>> partEdgesByGroup = byTarget(graphStore.matchEdges(EdgePattern.builder()
                .fromLabel(GraphLabels.PART).type(EdgeTypes.HAS_GROUP).toLabel(GraphLabels.GROUP).build()));
        log.info("Auditing Part ownership of {} Group(s){}", groups.size(), dryRun ? " (dry run)" : "");

        for (NodeRef group : groups) {
            report.setGroupsChecked(report.getGroupsChecked() + 1);
            List<EdgeRef> inbound = partEdgesByGroup.getOrDefault(group.getElementId(), List.of());
            Map<String, List<EdgeRef>> edgesByPart = new TreeMap<>();
            for (EdgeRef edge : inbound) {
                edgesByPart.computeIfAbsent(Objects.toString(edge.getFrom().getName(), ""), k -> new ArrayList<>()).add(edge);
            }
            if (inbound.size() <= 1) {
                continue;
            }

            try {
                GroupPartResolution resolution = edgesByPart.size() > 1
                        ? resolveConflict(group, edgesByPart, dryRun, requireMajority, report)
                        : removeDuplicates(group, edgesByPart, dryRun);
                if (resolution != null) {
                    report.getResolutions().add(resolution);
                    report.setEdgesRemoved(report.getEdgesRemoved() + resolution.getEdgesRemoved());
                }
            } catch (RuntimeException e) {
                log.warn("Could not resolve Part ownership of Group '{}': {}", group.getName(), e.getMessage());
                report.getErrors().add(ItemFailure.of(group.getName(), e));
            }
        }

        report.setIntegrity(transactionOperations.execute(status -> integritySummary()));
        report.setDurationMs(System.currentTimeMillis() - start);
        log.info("Group-Part audit finished in {}ms: {} conflict(s), {} HAS_GROUP edge(s) {}, {} error(s)",
                report.getDurationMs(), report.getConflictsFound(), report.getEdgesRemoved(),
                dryRun ? "to remove" : "removed", report.getErrors().size());
        return report;
    }

    private GroupPartResolution resolveConflict(NodeRef group, Map<String, List<EdgeRef>> edgesByPart,
                                                boolean dryRun, boolean requireMajority,
                                                GroupPartAuditReport report) {
        report.setConflictsFound(report.getConflictsFound() + 1);
        Map<String, Long> counts = reachableVariableCounts(group, edgesByPart.keySet());
        GroupOwnerChooser.Choice choice = ownerChooser.choose(counts);

        GroupPartResolution resolution = GroupPartResolution.builder()
                .groupName(group.getName())
                .chosenPart(choice.getOwner())
                .removedParts(new ArrayList<>(choice.getOthers()))
                .variableCounts(counts)
                .tieBroken(choice.isTieBroken())
                .build();

        if (requireMajority && choice.isTieBroken() && choice.getOwnerCount() == 0) {
            InvariantViolationException violation = new InvariantViolationException("Group '" + group.getName()
                    + "' is claimed by " + edgesByPart.keySet() + " with no Variables to decide between them");
            log.warn(violation.getMessage());
            report.getErrors().add(ItemFailure.of(group.getName(), violation));
            resolution.setRemovedParts(new ArrayList<>());
            return resolution;
        }

        List<EdgeRef> toRemove = new ArrayList<>();
        for (String part : choice.getOthers()) {
            toRemove.addAll(edgesByPart.get(part));
        }
        List<EdgeRef> ownerEdges = edgesByPart.get(choice.getOwner());
        toRemove.addAll(ownerEdges.subList(1, ownerEdges.size()));

        applyRemoval(toRemove, dryRun);
        resolution.setEdgesRemoved(toRemove.size());
        resolution.setApplied(!dryRun);
        log.info("Group '{}' kept by Part '{}' (counts {}{}), removed from {}", group.getName(), choice.getOwner(),
                counts, choice.isTieBroken() ? ", tie broken by name" : "", choice.getOthers());
        return resolution;
    }

    private GroupPartResolution removeDuplicates(NodeRef group, Map<String, List<EdgeRef>> edgesByPart, boolean dryRun) {
        Map.Entry<String, List<EdgeRef>> only = edgesByPart.entrySet().iterator().next();
        List<EdgeRef> duplicates = only.getValue().subList(1, only.getValue().size());
        applyRemoval(duplicates, dryRun);
        log.info("Group '{}' had {} duplicate HAS_GROUP edge(s) from Part '{}'",
                group.getName(), duplicates.size(), only.getKey());
        return GroupPartResolution.builder()
                .groupName(group.getName())
                .chosenPart(only.getKey())
                .edgesRemoved(duplicates.size())
                .applied(!dryRun)
                .build();
    }

    private void applyRemoval(List<EdgeRef> edges, boolean dryRun) {
        if (dryRun || edges.isEmpty()) {
            return;
        }
        transactionOperations.execute(status -> {
            edges.forEach(graphStore::deleteEdge);
            return null;
        });
    }

    /**
     * Variables of the Group that belong to each candidate Part, judged by the
     * Variable's own part property.
     */
    Map<String, Long> reachableVariableCounts(NodeRef group, Set<String> partNames) {
        Map<String, Long> counts = new TreeMap<>();
        partNames.forEach(part -> counts.put(part, 0L));
        Set<String> seen = new HashSet<>();
        for (EdgeRef edge : graphStore.matchEdges(EdgePattern.outgoing(group, EdgeTypes.HAS_VARIABLE, GraphLabels.VARIABLE))) {
            NodeRef variable = edge.getTo();
            String part = variable.getString(PART_PROPERTY);
            if (part != null && counts.containsKey(part) && seen.add(variable.getElementId())) {
                counts.merge(part, 1L, Long::sum);
            }
        }
        return counts;
    }

    IntegritySummary integritySummary() {
        Map<String, List<EdgeRef>> partEdges = byTarget(graphStore.matchEdges(EdgePattern.builder()
                .fromLabel(GraphLabels.PART).type(EdgeTypes.HAS_GROUP).toLabel(GraphLabels.GROUP).build()));
        Map<String, List<EdgeRef>> groupEdges = byTarget(graphStore.matchEdges(EdgePattern.builder()
                .fromLabel(GraphLabels.GROUP).type(EdgeTypes.HAS_VARIABLE).toLabel(GraphLabels.VARIABLE).build()));

        IntegritySummary summary = IntegritySummary.builder().build();
        for (NodeRef group : graphStore.matchNodes(GraphLabels.GROUP, Map.of())) {
            int parts = distinctSources(partEdges.get(group.getElementId()));
            if (parts > 1) {
                summary.setGroupsWithMultipleParts(summary.getGroupsWithMultipleParts() + 1);
            } else if (parts == 0) {
                summary.setGroupsWithoutPart(summary.getGroupsWithoutPart() + 1);
            }
        }
        for (NodeRef variable : graphStore.matchNodes(GraphLabels.VARIABLE, Map.of())) {
            int owners = distinctSources(groupEdges.get(variable.getElementId()));
            if (owners > 1) {
                summary.setVariablesWithMultipleGroups(summary.getVariablesWithMultipleGroups() + 1);
            } else if (owners == 0) {
                summary.setOrphanedVariables(summary.getOrphanedVariables() + 1);
            }
        }
        return summary;
    }

    private static int distinctSources(List<EdgeRef> edges) {
        if (edges == null) {
            return 0;
        }
        Set<String> sources = new HashSet<>();
        edges.forEach(edge -> sources.add(edge.getFrom().getElementId()));
        return sources.size();
    }

    private static Map<String, List<EdgeRef>> byTarget(List<EdgeRef> edges) {
        Map<String, List<EdgeRef>> byTarget = new HashMap<>();
        for (EdgeRef edge : edges) {
            byTarget.computeIfAbsent(edge.getTo().getElementId(), k -> new ArrayList<>()).add(edge);
        }
        return byTarget;
    }
}
