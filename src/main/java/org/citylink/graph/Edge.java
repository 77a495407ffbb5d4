package org.citylink.graph;

import lombok.Value;

/**
 * Directed edge {@code source -> destination} between two node indices.
 */
@Value
public class Edge {
    /** Origin node index. */
    int source;
    /** Target node index. */
    int destination;

    /**
     * Packs a pair into one long key: source in the high 32 bits, destination in the low 32 bits.
     */
    public static long pack(int source, int destination) {
        return ((long) source << 32) | (destination & 0xFFFFFFFFL);
    }

    @Override
    public String toString() {
        return source + " -> " + destination;
    }
}
