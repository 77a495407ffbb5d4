package org.citylink.search;

/**
 * Path reconstruction strategy used once the closure has confirmed reachability.
 */
public enum PathStrategy {
    /**
     * First viable base edge in list order wins; no backtracking. May stall at a dead end.
     */
    GREEDY,
    /**
     * Breadth-first search over base edges; always yields a shortest path for reachable pairs.
     */
    BREADTH_FIRST
}
