package org.citylink.closure;

import org.citylink.graph.Edge;
import org.citylink.graph.EdgeList;
import org.citylink.testutil.GraphFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ClosureEngine Tests")
class ClosureEngineTest {

    @Nested
    @DisplayName("1. Reference scenarios")
    class ScenarioTests {

        @Test
        @DisplayName("Chain 0 -> 1 -> 2 gains the composed edge 0 -> 2")
        void testChain() {
            TransitiveClosure closure = GraphFixtures.closureOf(GraphFixtures.CHAIN_3);

            assertEquals(List.of(new Edge(0, 1), new Edge(1, 2), new Edge(0, 2)), closure.pairs());
            assertEquals(2, closure.baseEdgeCount());
            assertEquals(1, closure.addedEdgeCount());
            assertEquals(2, closure.passCount(), "one productive pass plus the confirming pass");
        }

        @Test
        @DisplayName("Empty graph closes to an empty closure")
        void testEmptyGraph() {
            TransitiveClosure closure = GraphFixtures.closureOf(GraphFixtures.EMPTY_2);

            assertEquals(0, closure.size());
            assertEquals(1, closure.passCount());
            assertFalse(closure.contains(0, 1));
        }

        @Test
        @DisplayName("2-cycle does not produce composed self-loops")
        void testTwoCycleHasNoSelfLoops() {
            TransitiveClosure closure = GraphFixtures.closureOf(GraphFixtures.TWO_CYCLE_3);

            assertEquals(List.of(new Edge(0, 1), new Edge(1, 0)), closure.pairs());
            assertFalse(closure.contains(0, 0));
            assertFalse(closure.contains(1, 1));
        }

        @Test
        @DisplayName("Complete graph is already closed")
        void testCompleteGraphUnchanged() {
            EdgeList base = GraphFixtures.baseEdges(GraphFixtures.COMPLETE_3);
            List<Edge> before = base.toList();

            TransitiveClosure closure = new ClosureEngine().close(base);

            assertEquals(before, closure.pairs());
            assertEquals(0, closure.addedEdgeCount());
            assertEquals(1, closure.passCount());
        }

        @Test
        @DisplayName("Disconnected components never gain cross-component edges")
        void testNoCrossComponentEdges() {
            TransitiveClosure closure = GraphFixtures.closureOf(GraphFixtures.TWO_COMPONENTS_5);

            for (Edge edge : closure.edges()) {
                boolean sourceInFirst = edge.getSource() <= 2;
                boolean destinationInFirst = edge.getDestination() <= 2;
                assertEquals(sourceInFirst, destinationInFirst, "cross-component edge " + edge);
            }
            assertTrue(closure.contains(0, 2));
            assertTrue(closure.contains(3, 4));
        }

        @Test
        @DisplayName("Direct self-loops from the diagonal survive")
        void testDirectSelfLoopKept() {
            TransitiveClosure closure = GraphFixtures.closureOf(new int[][]{
                    {1, 1},
                    {0, 0}
            });

            assertEquals(List.of(new Edge(0, 0), new Edge(0, 1)), closure.pairs());
        }

        @Test
        @DisplayName("Long chain needs several passes; snapshot edges are not reused within a pass")
        void testLongChainPasses() {
            int n = 6;
            int[][] rows = new int[n][n];
            for (int i = 0; i + 1 < n; i++) {
                rows[i][i + 1] = 1;
            }

            TransitiveClosure closure = GraphFixtures.closureOf(rows);

            assertEquals(n * (n - 1) / 2, closure.size());
            assertTrue(closure.contains(0, n - 1));
            assertTrue(closure.passCount() > 2);
        }
    }

    @Nested
    @DisplayName("2. Closure invariants")
    class InvariantTests {

        @ParameterizedTest(name = "seed {0}")
        @ValueSource(longs = {1L, 7L, 42L, 1234L, 98765L})
        @DisplayName("Closure matches reference reachability on random graphs")
        void testMatchesReference(long seed) {
            Random random = new Random(seed);
            for (int round = 0; round < 20; round++) {
                int n = 1 + random.nextInt(8);
                int[][] rows = GraphFixtures.randomMatrix(random, n, 0.1 + random.nextDouble() * 0.4);

                EdgeList base = GraphFixtures.baseEdges(rows);
                Set<Edge> baseSet = GraphFixtures.edgeSet(base);
                TransitiveClosure closure = new ClosureEngine().close(base);
                List<Edge> pairs = closure.pairs();

                assertEquals(pairs.size(), new HashSet<>(pairs).size(), "no duplicates");
                assertTrue(new HashSet<>(pairs).containsAll(baseSet), "superset of base edges");
                assertEquals(GraphFixtures.referenceClosure(rows), new HashSet<>(pairs));
            }
        }

        @Test
        @DisplayName("Completeness: every two-step composition without self-loop is present")
        void testCompleteness() {
            Random random = new Random(2024L);
            int[][] rows = GraphFixtures.randomMatrix(random, 7, 0.3);
            TransitiveClosure closure = GraphFixtures.closureOf(rows);

            for (Edge first : closure.edges()) {
                for (Edge second : closure.edges()) {
                    if (first.getDestination() == second.getSource()
                            && first.getSource() != second.getDestination()) {
                        assertTrue(closure.contains(first.getSource(), second.getDestination()),
                                first + " then " + second);
                    }
                }
            }
        }

        @Test
        @DisplayName("Base edges stay as the closure prefix in original order")
        void testBaseEdgesArePrefix() {
            EdgeList base = GraphFixtures.baseEdges(GraphFixtures.SHORTCUT_3);
            List<Edge> original = base.toList();

            TransitiveClosure closure = new ClosureEngine().close(base);

            assertEquals(original, closure.baseEdges().toList());
            assertTrue(closure.baseEdges().frozen());
        }

        @Test
        @DisplayName("Idempotence: closing a copy of a closure adds nothing")
        void testIdempotence() {
            TransitiveClosure closure = GraphFixtures.closureOf(GraphFixtures.TWO_COMPONENTS_5);

            TransitiveClosure again = new ClosureEngine().close(closure.edges().copy());

            assertEquals(0, again.addedEdgeCount());
            assertEquals(1, again.passCount());
            assertEquals(closure.pairs(), again.pairs());
        }
    }

    @Nested
    @DisplayName("3. Lifecycle and budget")
    class LifecycleTests {

        @Test
        @DisplayName("Closing freezes the list in place")
        void testCloseFreezesInPlace() {
            EdgeList base = GraphFixtures.baseEdges(GraphFixtures.CHAIN_3);
            TransitiveClosure closure = new ClosureEngine().close(base);

            assertSame(base, closure.edges());
            assertTrue(base.frozen());
            assertThrows(IllegalStateException.class, () -> base.add(2, 0));
        }

        @Test
        @DisplayName("Frozen input is rejected")
        void testFrozenInputRejected() {
            EdgeList frozen = GraphFixtures.baseEdges(GraphFixtures.CHAIN_3).freeze();
            assertThrows(IllegalStateException.class, () -> new ClosureEngine().close(frozen));
        }

        @Test
        @DisplayName("Edge budget aborts closure growth")
        void testEdgeBudgetExceeded() {
            ClosureEngine engine = new ClosureEngine(ClosureBudget.of(2, 0));

            ClosureBudget.BudgetExceededException ex = assertThrows(
                    ClosureBudget.BudgetExceededException.class,
                    () -> engine.close(GraphFixtures.baseEdges(GraphFixtures.CHAIN_3))
            );
            assertEquals(ClosureBudget.REASON_EDGES_EXCEEDED, ex.reasonCode());
        }

        @Test
        @DisplayName("Edge budget smaller than the base edge count fails before any pass")
        void testEdgeBudgetBelowBaseEdges() {
            ClosureEngine engine = new ClosureEngine(ClosureBudget.of(2, 0));
            EdgeList base = GraphFixtures.baseEdges(GraphFixtures.COMPLETE_3);

            ClosureBudget.BudgetExceededException ex = assertThrows(
                    ClosureBudget.BudgetExceededException.class,
                    () -> engine.close(base)
            );
            assertEquals(ClosureBudget.REASON_EDGES_EXCEEDED, ex.reasonCode());
            assertEquals(6, base.size(), "no composition runs once the base edges are over budget");
        }

        @Test
        @DisplayName("Pass budget aborts a closure that needs more passes")
        void testPassBudgetExceeded() {
            ClosureEngine engine = new ClosureEngine(ClosureBudget.of(0, 1));

            ClosureBudget.BudgetExceededException ex = assertThrows(
                    ClosureBudget.BudgetExceededException.class,
                    () -> engine.close(GraphFixtures.baseEdges(GraphFixtures.CHAIN_3))
            );
            assertEquals(ClosureBudget.REASON_PASSES_EXCEEDED, ex.reasonCode());
        }

        @Test
        @DisplayName("Budget exactly at the closure size is enough")
        void testBudgetAtLimit() {
            TransitiveClosure closure = new ClosureEngine(ClosureBudget.of(3, 2))
                    .close(GraphFixtures.baseEdges(GraphFixtures.CHAIN_3));
            assertEquals(3, closure.size());
        }
    }
}
