package com.cdm.modelgraph.model;

/**
 * How a concrete driver name without a matching node is handled.
 */
public enum DriverResolutionPolicy {
    /** Create the missing driver node by name. Used by Object, Variable and List creation. */
    UPSERT,
    /** Reject the whole call with a DriverNotFoundException. Used by repair sweeps. */
    REQUIRE_EXISTING
}
