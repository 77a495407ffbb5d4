package org.citylink.graph;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Ordered, duplicate-free, growable list of directed edges.
 * <p>
 * Layout is two parallel primitive columns (sources / destinations) in insertion
 * order, plus a hash index of packed pairs for O(1) membership checks. The order
 * never changes once an edge is appended, so index {@code i} always names the
 * same edge.
 * </p>
 * <p>
 * <strong>Thread Safety:</strong> NOT thread-safe. A list can be {@link #freeze() frozen}
 * once it is complete; a frozen list rejects further appends.
 * </p>
 */
public final class EdgeList implements Iterable<Edge> {

    @Getter
    @Accessors(fluent = true)
    private final int nodeCount;

    private final IntArrayList sources;
    private final IntArrayList destinations;
    private final LongOpenHashSet index;

    @Getter
    @Accessors(fluent = true)
    private boolean frozen;

    /**
     * Creates an empty list for nodes in [0, nodeCount).
     */
    public EdgeList(int nodeCount) {
        this(nodeCount, 0);
    }

    /**
     * Creates an empty list with pre-sized storage.
     *
     * @param nodeCount number of nodes; valid indices are [0, nodeCount).
     * @param expectedEdges initial capacity hint.
     */
    public EdgeList(int nodeCount, int expectedEdges) {
        if (nodeCount < 0) {
            throw new IllegalArgumentException("nodeCount must be non-negative, found " + nodeCount);
        }
        if (expectedEdges < 0) {
            throw new IllegalArgumentException("expectedEdges must be non-negative, found " + expectedEdges);
        }
        this.nodeCount = nodeCount;
        this.sources = new IntArrayList(expectedEdges);
        this.destinations = new IntArrayList(expectedEdges);
        this.index = new LongOpenHashSet(expectedEdges);
    }

    /**
     * Appends {@code source -> destination} unless the pair is already present.
     *
     * @return {@code true} if the edge was appended, {@code false} if it was a duplicate.
     * @throws IllegalArgumentException if a node index is outside [0, nodeCount).
     * @throws IllegalStateException if the list is frozen.
     */
    public boolean add(int source, int destination) {
        if (frozen) {
            throw new IllegalStateException("edge list is frozen; " + source + " -> " + destination + " rejected");
        }
        checkNode(source, "source");
        checkNode(destination, "destination");
        if (!index.add(Edge.pack(source, destination))) {
            return false;
        }
        sources.add(source);
        destinations.add(destination);
        return true;
    }

    /**
     * Checks membership of {@code source -> destination} against the full list.
     */
    public boolean contains(int source, int destination) {
        return index.contains(Edge.pack(source, destination));
    }

    public int size() {
        return sources.size();
    }

    public boolean isEmpty() {
        return sources.isEmpty();
    }

    /**
     * UNCHECKED beyond the backing list's own bounds check.
     */
    public int source(int edgeIndex) {
        return sources.getInt(edgeIndex);
    }

    public int destination(int edgeIndex) {
        return destinations.getInt(edgeIndex);
    }

    public Edge get(int edgeIndex) {
        return new Edge(sources.getInt(edgeIndex), destinations.getInt(edgeIndex));
    }

    /**
     * Marks the list read-only. Idempotent.
     */
    public EdgeList freeze() {
        this.frozen = true;
        return this;
    }

    /**
     * Returns a mutable copy of the first {@code length} edges, preserving order.
     */
    public EdgeList prefix(int length) {
        if (length < 0 || length > size()) {
            throw new IndexOutOfBoundsException("prefix length " + length + " out of bounds [0, " + size() + "]");
        }
        EdgeList copy = new EdgeList(nodeCount, length);
        for (int i = 0; i < length; i++) {
            copy.add(sources.getInt(i), destinations.getInt(i));
        }
        return copy;
    }

    /**
     * Returns a mutable copy of the whole list.
     */
    public EdgeList copy() {
        return prefix(size());
    }

    /**
     * Returns an unmodifiable snapshot of the edges in insertion order.
     */
    public List<Edge> toList() {
        List<Edge> edges = new ArrayList<>(size());
        for (Edge edge : this) {
            edges.add(edge);
        }
        return Collections.unmodifiableList(edges);
    }

    @Override
    public Iterator<Edge> iterator() {
        return new Iterator<>() {
            private int cursor = 0;

            @Override
            public boolean hasNext() {
                return cursor < size();
            }

            @Override
            public Edge next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return get(cursor++);
            }
        };
    }

    @Override
    public String toString() {
        return "EdgeList{nodeCount=" + nodeCount + ", size=" + size() + ", frozen=" + frozen + "}";
    }

    private void checkNode(int node, String role) {
        if (node < 0 || node >= nodeCount) {
            throw new IllegalArgumentException(
                    role + " node " + node + " out of bounds [0, " + nodeCount + ")"
            );
        }
    }
}
