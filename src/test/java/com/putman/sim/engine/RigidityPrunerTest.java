package com.putman.sim.engine;

import com.putman.sim.model.Edge;
import com.putman.sim.model.GeneratedGraph;
import com.putman.sim.model.Graph;
import com.putman.sim.model.Node;
import com.putman.sim.model.PruneResult;
import org.junit.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.Assert.*;

public class RigidityPrunerTest {

    private static Graph sample() {
        return new Graph(
                List.of(new Node("A", true, false), new Node("B", true, false), new Node("C", false, true),
                        new Node("D", false, true)),
                List.of(new Edge("A->B", "A", "B", 0.9, true),
                        new Edge("B->C", "B", "C", 0.35, false),
                        new Edge("C->D", "C", "D", 0.8, false),
                        new Edge("A->C", "A", "C", 0.4, false)));
    }

    @Test
    public void testThresholds() {
        Map<String, Double> scores = Map.of("A", 0.8, "B", 0.6, "C", 0.3, "D", 0.1);
        // retention = 0.5 * 0.4 = 0.2
        PruneResult result = RigidityPruner.prune(sample(), scores, 0.5, 0.4);

        assertEquals(List.of("A", "B"), result.activeSet());
        assertEquals(List.of("A", "B", "C"), result.keptGraph().nodeIds());
        assertEquals(List.of("D"), result.prunedNodes());
        // B->C below rigidity, C->D loses its endpoint, A->C kept at exactly rigidity
        assertEquals(List.of("A->B", "A->C"), result.keptGraph().edgeIds());
        assertEquals(List.of("B->C", "C->D"), result.prunedEdges());
    }

    @Test
    public void testNothingActive() {
        Map<String, Double> scores = Map.of("A", 0.3, "B", 0.3, "C", 0.3, "D", 0.3);
        PruneResult result = RigidityPruner.prune(sample(), scores, 0.5, 0.5);
        assertTrue(result.activeSet().isEmpty());
        assertEquals(4, result.keptGraph().nodeCount());
    }

    @Test
    public void testActiveSubsetOfKeptAndEdgesValid() {
        GeneratedGraph g = GraphGenerator.generate(5, 45, 0.3, 0.4);
        Map<String, Double> scores = ActivationScorer.score(g.graph(), g.context(), 0.5);
        for (double rigidity : new double[] { 0.1, 0.3, 0.5, 0.7, 1.0 }) {
            PruneResult result = RigidityPruner.prune(g.graph(), scores, 0.55, rigidity);
            Set<String> kept = new HashSet<>(result.keptGraph().nodeIds());
            assertTrue(kept.containsAll(result.activeSet()));

            Set<String> edgeIds = new HashSet<>();
            for (Edge e : result.keptGraph().edges()) {
                assertTrue(kept.contains(e.source()) && kept.contains(e.target()));
                assertTrue(e.weight() >= rigidity);
                assertTrue(edgeIds.add(e.id()));
            }
            assertEquals(g.graph().nodeCount(), kept.size() + result.prunedNodes().size());
            assertEquals(g.graph().edgeCount(), result.keptGraph().edgeCount() + result.prunedEdges().size());
        }
    }
}
