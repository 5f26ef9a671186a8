package com.putman.sim.engine;

import com.putman.sim.model.ContextVector;
import com.putman.sim.model.Graph;
import com.putman.sim.model.Node;
import com.putman.sim.util.Rounding;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Computes per-node activation from context and local structure.
 *
 * <p>
 * Formula:
 * {@code raw = blend * context + (1 - blend) * meanIncidentWeight + (novel ? 0.08 : 0)},
 * {@code score = round3(sigmoid((raw - 0.5) * 4))}.
 *
 * <p>
 * Stateless and order-independent; the returned map is keyed in node order.
 */
public final class ActivationScorer {
    static final double NOVELTY_BONUS = 0.08;
    static final double SIGMOID_GAIN = 4.0;

    private ActivationScorer() {
        // Utility class
    }

    public static Map<String, Double> score(Graph graph, ContextVector context, double contextBlend) {
        Adjacency adjacency = Adjacency.of(graph);
        Map<String, Double> scores = new LinkedHashMap<>(graph.nodeCount() * 2);
        for (Node node : graph.nodes()) {
            double degreeScore = adjacency.meanIncidentWeight(node.id());
            double contextScore = context.valueOf(node.id());
            double noveltyBonus = node.novel() ? NOVELTY_BONUS : 0.0;
            double raw = contextBlend * contextScore + (1.0 - contextBlend) * degreeScore + noveltyBonus;
            scores.put(node.id(), Rounding.round3(Rounding.sigmoid((raw - 0.5) * SIGMOID_GAIN)));
        }
        return Collections.unmodifiableMap(scores);
    }
}
