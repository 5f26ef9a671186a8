package com.putman.sim.engine;

import com.putman.sim.model.BeamCandidate;
import com.putman.sim.model.Graph;
import com.putman.sim.model.InterpretationSummary;
import com.putman.sim.model.Node;
import com.putman.sim.model.RankedItem;
import com.putman.sim.util.Rounding;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summarizes a step. Pure: inputs are only read.
 *
 * <ul>
 * <li>top nodes: the {@value #TOP_N} highest activations over the full score
 * map</li>
 * <li>top edges: the {@value #TOP_N} edges with the highest summed score of the
 * beam candidates traversing them</li>
 * <li>centroid: the activation of every node in the kept graph</li>
 * </ul>
 * Ties are broken by id ascending.
 */
public final class Interpreter {
    public static final int TOP_N = 5;

    private static final Comparator<Map.Entry<String, Double>> BY_SCORE_THEN_ID = Map.Entry
            .<String, Double>comparingByValue().reversed()
            .thenComparing(Map.Entry.comparingByKey());

    private Interpreter() {
        // Utility class
    }

    public static InterpretationSummary interpret(List<BeamCandidate> beams, Map<String, Double> scores,
            Graph keptGraph) {
        List<RankedItem> topNodes = top(scores);

        Map<String, Double> edgeContribution = new LinkedHashMap<>();
        for (BeamCandidate beam : beams)
            for (String edgeId : beam.edgePath())
                edgeContribution.merge(edgeId, beam.score(), Double::sum);
        List<RankedItem> topEdges = top(edgeContribution);

        Map<String, Double> centroid = new LinkedHashMap<>(keptGraph.nodeCount() * 2);
        for (Node node : keptGraph.nodes())
            centroid.put(node.id(), scores.getOrDefault(node.id(), 0.0));

        return new InterpretationSummary(topNodes, topEdges, centroid);
    }

    private static List<RankedItem> top(Map<String, Double> values) {
        List<Map.Entry<String, Double>> entries = new ArrayList<>(values.entrySet());
        entries.sort(BY_SCORE_THEN_ID);
        List<RankedItem> out = new ArrayList<>(TOP_N);
        for (int i = 0; i < Math.min(TOP_N, entries.size()); i++) {
            Map.Entry<String, Double> e = entries.get(i);
            out.add(new RankedItem(e.getKey(), Rounding.round3(e.getValue())));
        }
        return out;
    }
}
