package com.refgraph.core.model;

/**
 * Classification of an artifact in the reachability graph.
 */
public enum NodeState {
    /** Not yet reached; only left behind by a closure that did not converge */
    UNVISITED,
    /** Reached from a root through active references */
    REACHABLE,
    /** Actively referenced but no document backs the key */
    MISSING,
    /** Present in the document set but never reached */
    ORPHAN
}
