package com.refgraph.core.model;

/**
 * Whether an occurrence counts as a live reference.
 */
public enum Activity {
    /** Entirely in code: contributes an edge to the reachability graph */
    ACTIVE,
    /** Inside, or partly inside, a comment */
    INACTIVE
}
