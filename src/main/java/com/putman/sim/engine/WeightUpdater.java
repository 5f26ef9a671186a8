package com.putman.sim.engine;

import com.putman.sim.api.RandomSource;
import com.putman.sim.model.ContextVector;
import com.putman.sim.model.Edge;
import com.putman.sim.model.Graph;
import com.putman.sim.util.Rounding;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drifts edge weights and context values between steps.
 *
 * <p>
 * Edge weights (one fresh draw per edge, from an RNG seeded with the step
 * seed):
 * {@code w' = round3(clamp01(w * (1 - lr) + meanEndpointActivation * lr + noveltyPush * 0.05 + (draw - 0.5) * 0.02))}
 * where {@code noveltyPush} is the drift bias on non-prior edges and 0 on prior
 * ones.
 *
 * <p>
 * Context values use no RNG: entry {@code i} (in key order) moves by
 * {@code sin((step + 1) * (i + 1)) * 0.005 + driftBias * 0.01}, then is clamped
 * and rounded.
 */
public final class WeightUpdater {
    static final double NOVELTY_PUSH_GAIN = 0.05;
    static final double NOISE_SPAN = 0.02;
    static final double CONTEXT_WAVE_AMPLITUDE = 0.005;
    static final double CONTEXT_DRIFT_GAIN = 0.01;

    private WeightUpdater() {
        // Utility class
    }

    public static Graph updateWeights(Graph graph, Map<String, Double> scores, double learningRate,
            double driftBias, long stepSeed) {
        RandomSource rng = new HashRng(stepSeed);
        List<Edge> edges = new ArrayList<>(graph.edgeCount());
        for (Edge edge : graph.edges()) {
            double meanActivation = (scores.getOrDefault(edge.source(), 0.0)
                    + scores.getOrDefault(edge.target(), 0.0)) / 2.0;
            double noveltyPush = edge.prior() ? 0.0 : driftBias;
            double stochastic = (rng.next() - 0.5) * NOISE_SPAN;
            double next = Rounding.clamp01(edge.weight() * (1.0 - learningRate)
                    + meanActivation * learningRate
                    + noveltyPush * NOVELTY_PUSH_GAIN
                    + stochastic);
            edges.add(edge.withWeight(Rounding.round3(next)));
        }
        return graph.withEdges(edges);
    }

    public static ContextVector updateContext(ContextVector context, int step, double driftBias) {
        Map<String, Double> next = new LinkedHashMap<>(context.size() * 2);
        int index = 0;
        for (Map.Entry<String, Double> e : context.values().entrySet()) {
            double perturb = Math.sin((double) (step + 1) * (index + 1)) * CONTEXT_WAVE_AMPLITUDE;
            next.put(e.getKey(), Rounding.round3(Rounding.clamp01(e.getValue() + perturb + driftBias * CONTEXT_DRIFT_GAIN)));
            index++;
        }
        return new ContextVector(next);
    }
}
