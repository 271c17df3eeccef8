package com.cdm.modelgraph.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of an all-pairs default relationship audit.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AllPairsReport {

    private boolean dryRun;
    private boolean pruneNonDefault;
    private int objectsChecked;
    private int pairsChecked;

    /** Missing default edges created */
    private int created;

    /** Extra default-role edges removed, one edge per pair is kept */
    private int duplicatesRemoved;

    /** Default edges whose type or frequency was reset */
    private int normalized;

    /** Edges with another role removed, only when pruning */
    private int nonDefaultRemoved;

    /** Objects whose relationships count property changed */
    private int countsUpdated;

    private long durationMs;

    @Builder.Default
    private List<ItemFailure> errors = new ArrayList<>();
}
