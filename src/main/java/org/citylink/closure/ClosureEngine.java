package org.citylink.closure;

import lombok.extern.log4j.Log4j2;
import org.citylink.graph.EdgeList;

import java.util.Objects;

/**
 * Expands an edge list into its transitive closure by naive fixed-point composition.
 * <p>
 * Each pass composes every ordered pair of edges {@code (u,v)}, {@code (v,w)} found in
 * the snapshot taken at the start of the pass and appends {@code (u,w)} when it is
 * missing. Edges appended during a pass only become operands in the next pass. The
 * loop stops after the first pass that appends nothing.
 * </p>
 * <ul>
 * <li>Compositions that would produce a self-loop ({@code u == w}) are skipped.</li>
 * <li>An edge is never composed with itself.</li>
 * <li>Duplicate checks run against the full current list, not the snapshot.</li>
 * </ul>
 * <p>
 * Cost is O(E^2) comparisons per pass, which bounds the intended use to small graphs.
 * </p>
 */
@Log4j2
public final class ClosureEngine {

    private final ClosureBudget budget;

    public ClosureEngine() {
        this(ClosureBudget.unbounded());
    }

    public ClosureEngine(ClosureBudget budget) {
        this.budget = Objects.requireNonNull(budget, "budget");
    }

    /**
     * Grows {@code edges} in place until it is transitively closed, then freezes it.
     *
     * @param edges mutable base edge list.
     * @return closure view over the same (now frozen) list.
     * @throws IllegalStateException if {@code edges} is already frozen.
     * @throws ClosureBudget.BudgetExceededException if the base edges alone exceed the
     * edge budget, or the budget runs out while growing; the list must then be discarded.
     */
    public TransitiveClosure close(EdgeList edges) {
        Objects.requireNonNull(edges, "edges");
        if (edges.frozen()) {
            throw new IllegalStateException("cannot close a frozen edge list; close a copy instead");
        }

        int baseEdgeCount = edges.size();
        budget.checkEdgeCount(baseEdgeCount);
        int passes = 0;
        boolean changed = true;
        while (changed) {
            passes++;
            budget.checkPassCount(passes);
            int added = runPass(edges);
            changed = added > 0;
            log.debug("closure pass {}: +{} edges (total {})", passes, added, edges.size());
        }

        log.debug("closure reached fixed point after {} passes: {} base edges -> {} edges",
                passes, baseEdgeCount, edges.size());
        return new TransitiveClosure(edges, baseEdgeCount, passes);
    }

    /**
     * Runs one composition pass over the snapshot {@code [0, size)} taken on entry.
     *
     * @return number of edges appended.
     */
    private int runPass(EdgeList edges) {
        int snapshot = edges.size();
        int added = 0;
        for (int i = 0; i < snapshot; i++) {
            int u = edges.source(i);
            int v = edges.destination(i);
            for (int j = 0; j < snapshot; j++) {
                if (i == j) {
                    continue;
                }
                int y = edges.source(j);
                if (y != v) {
                    continue;
                }
                int w = edges.destination(j);
                if (u == w || edges.contains(u, w)) {
                    continue;
                }
                budget.checkEdgeCount(edges.size() + 1);
                edges.add(u, w);
                added++;
            }
        }
        return added;
    }
}
