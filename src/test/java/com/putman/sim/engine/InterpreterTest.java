package com.putman.sim.engine;

import com.putman.sim.model.BeamCandidate;
import com.putman.sim.model.Graph;
import com.putman.sim.model.InterpretationSummary;
import com.putman.sim.model.Node;
import com.putman.sim.model.RankedItem;
import org.junit.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class InterpreterTest {

    @Test
    public void testTopNodesRankedWithIdTieBreak() {
        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put("F", 0.1);
        scores.put("E", 0.6);
        scores.put("D", 0.4);
        scores.put("C", 0.5);
        scores.put("B", 0.6);
        scores.put("A", 0.7);
        scores.put("G", 0.9);

        InterpretationSummary summary = Interpreter.interpret(List.of(), scores, Graph.empty());
        assertEquals(List.of(
                new RankedItem("G", 0.9),
                new RankedItem("A", 0.7),
                new RankedItem("B", 0.6),
                new RankedItem("E", 0.6),
                new RankedItem("C", 0.5)), summary.topNodes());
        assertTrue(summary.topEdges().isEmpty());
        assertTrue(summary.centroid().isEmpty());
    }

    @Test
    public void testTopEdgesAccumulateBeamScores() {
        List<BeamCandidate> beams = List.of(
                new BeamCandidate(List.of("A", "B", "C", "D"), List.of("A->B", "B->C", "C->D"), 4.4),
                new BeamCandidate(List.of("B", "A", "C", "D"), List.of("A->B", "A->C", "C->D"), 4.3));
        Map<String, Double> scores = Map.of("A", 0.7, "B", 0.6, "C", 0.5, "D", 0.4);

        InterpretationSummary summary = Interpreter.interpret(beams, scores, Graph.empty());
        assertEquals(List.of(
                new RankedItem("A->B", 8.7),
                new RankedItem("C->D", 8.7),
                new RankedItem("B->C", 4.4),
                new RankedItem("A->C", 4.3)), summary.topEdges());
    }

    @Test
    public void testCentroidCoversKeptNodesOnly() {
        Graph kept = new Graph(List.of(new Node("B", true, false), new Node("A", true, false)), List.of());
        Map<String, Double> scores = new HashMap<>(Map.of("A", 0.7, "B", 0.6, "C", 0.5));

        InterpretationSummary summary = Interpreter.interpret(List.of(), scores, kept);
        assertEquals(Map.of("A", 0.7, "B", 0.6), summary.centroid());
        assertEquals(List.of("B", "A"), List.copyOf(summary.centroid().keySet()));
        // scores map left untouched
        assertEquals(3, scores.size());
    }

    @Test
    public void testAtMostFiveItems() {
        Map<String, Double> scores = new HashMap<>();
        for (int i = 0; i < 20; i++)
            scores.put("n" + i, i / 20.0);
        assertEquals(Interpreter.TOP_N, Interpreter.interpret(List.of(), scores, Graph.empty()).topNodes().size());
    }
}
