package com.putman.sim.engine;

import com.putman.sim.model.ContextVector;
import com.putman.sim.model.Edge;
import com.putman.sim.model.Graph;
import com.putman.sim.model.Node;
import org.junit.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class ActivationScorerTest {

    private static ContextVector context(Object... pairs) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2)
            values.put((String) pairs[i], (Double) pairs[i + 1]);
        return new ContextVector(values);
    }

    @Test
    public void testBlendOfContextAndStructure() {
        // A - B (0.6), C isolated and novel
        Graph graph = new Graph(
                List.of(new Node("A", true, false), new Node("B", true, false), new Node("C", false, true)),
                List.of(new Edge("A->B", "A", "B", 0.6, true)));
        Map<String, Double> scores = ActivationScorer.score(graph, context("A", 0.5, "B", 0.7, "C", 0.4), 0.5);

        // raw A = 0.25 + 0.30 = 0.55 -> sigmoid(0.2)
        assertEquals(0.55, scores.get("A"), 0.0);
        // raw B = 0.35 + 0.30 = 0.65 -> sigmoid(0.6)
        assertEquals(0.646, scores.get("B"), 0.0);
        // raw C = 0.20 + 0 + 0.08 novelty
        assertEquals(0.293, scores.get("C"), 0.0);
        assertEquals(List.of("A", "B", "C"), List.copyOf(scores.keySet()));
    }

    @Test
    public void testIsolatedNodeUsesContextOnly() {
        Graph graph = new Graph(List.of(new Node("n000", true, false)), List.of());
        Map<String, Double> scores = ActivationScorer.score(graph, context("n000", 0.6), 0.55);
        // raw = 0.55 * 0.6 = 0.33
        assertEquals(0.336, scores.get("n000"), 0.0);
    }

    @Test
    public void testNeutralInputScoresOneHalf() {
        Graph graph = new Graph(List.of(new Node("X", false, false)), List.of());
        assertEquals(0.5, ActivationScorer.score(graph, context("X", 0.5), 1.0).get("X"), 0.0);
    }

    @Test
    public void testScoresStayInOpenUnitInterval() {
        Graph graph = GraphGenerator.generate(17, 40, 0.4, 0.5).graph();
        ContextVector ctx = GraphGenerator.generate(17, 40, 0.4, 0.5).context();
        for (double blend : new double[] { 0.0, 0.3, 1.0 })
            for (double s : ActivationScorer.score(graph, ctx, blend).values())
                assertTrue(s > 0.0 && s < 1.0);
    }

    @Test
    public void testMissingContextCountsAsZero() {
        Graph graph = new Graph(List.of(new Node("A", false, false)), List.of());
        // raw = 0 -> sigmoid(-2) = 0.119
        assertEquals(0.119, ActivationScorer.score(graph, context(), 1.0).get("A"), 0.0);
    }
}
