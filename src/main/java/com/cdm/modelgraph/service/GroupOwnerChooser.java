package com.cdm.modelgraph.service;

import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Picks the Part that keeps a Group claimed by several Parts: the one with the most
 * Variables reachable through it, ties going to the name that sorts first.
 *
 * <p>This is a heuristic, not a statement of user intent, which is why callers report
 * the counts alongside the choice.
 */
@Component
public class GroupOwnerChooser {

    public Choice choose(Map<String, Long> variableCounts) {
        if (variableCounts == null || variableCounts.isEmpty()) {
            throw new IllegalArgumentException("At least one candidate Part is required");
        }
        List<Map.Entry<String, Long>> ranked = new ArrayList<>(variableCounts.entrySet());
        ranked.sort(Comparator.<Map.Entry<String, Long>>comparingLong(Map.Entry::getValue).reversed()
                .thenComparing(Map.Entry::getKey));

        Map.Entry<String, Long> winner = ranked.get(0);
        boolean tie = ranked.size() > 1 && ranked.get(1).getValue().equals(winner.getValue());
        List<String> losers = new ArrayList<>();
        for (Map.Entry<String, Long> entry : ranked.subList(1, ranked.size())) {
            losers.add(entry.getKey());
        }
        return new Choice(winner.getKey(), winner.getValue(), losers, tie);
    }

    @Value
    public static class Choice {
        String owner;
        long ownerCount;
        /** Every other candidate, best first */
        List<String> others;
        boolean tieBroken;
    }
}
