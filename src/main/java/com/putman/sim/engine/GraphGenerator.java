package com.putman.sim.engine;

import com.putman.sim.api.RandomSource;
import com.putman.sim.model.ContextVector;
import com.putman.sim.model.Edge;
import com.putman.sim.model.GeneratedGraph;
import com.putman.sim.model.Graph;
import com.putman.sim.model.Node;
import com.putman.sim.util.Rounding;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the synthetic graph and initial context of a run.
 *
 * <p>
 * The first {@code priorCount} nodes form the prior population. Nodes from
 * {@code priorCount - overlapCount} onwards are novel, so a band of
 * {@code overlapCount} nodes belongs to both. Every unordered pair (i &lt; j)
 * draws once to decide whether an edge exists and, when it does, once more for
 * its weight. Context values are drawn last, in node order.
 *
 * <p>
 * All draws come from one RNG seeded with the run seed, in that fixed
 * traversal order, so the result is a pure function of the four inputs.
 */
public final class GraphGenerator {
    private static final double PRIOR_FRACTION = 0.6;

    private GraphGenerator() {
        // Utility class
    }

    public static String nodeId(int index) {
        return String.format(Locale.ROOT, "n%03d", index);
    }

    public static GeneratedGraph generate(long seed, int nodeCount, double edgeDensity, double overlapPercent) {
        RandomSource rng = new HashRng(seed);

        int overlapCount = Math.max(1, (int) Math.floor(nodeCount * overlapPercent));
        int priorCount = Math.max(overlapCount + 1, (int) Math.floor(nodeCount * PRIOR_FRACTION));

        List<Node> nodes = new ArrayList<>(nodeCount);
        for (int i = 0; i < nodeCount; i++)
            nodes.add(new Node(nodeId(i), i < priorCount, i >= priorCount - overlapCount));

        List<Edge> edges = new ArrayList<>();
        for (int i = 0; i < nodeCount; i++) {
            for (int j = i + 1; j < nodeCount; j++) {
                if (rng.next() <= edgeDensity) {
                    Node a = nodes.get(i), b = nodes.get(j);
                    double weight = Rounding.round3(0.2 + rng.next() * 0.8);
                    edges.add(new Edge(Edge.idOf(a.id(), b.id()), a.id(), b.id(), weight, a.prior() && b.prior()));
                }
            }
        }

        Map<String, Double> context = new LinkedHashMap<>(nodeCount * 2);
        for (Node n : nodes) {
            double base = n.prior() ? 0.45 : 0.35;
            double noveltyLift = n.novel() ? 0.20 : 0.0;
            context.put(n.id(), Rounding.round3(base + noveltyLift + rng.next() * 0.25));
        }

        return new GeneratedGraph(new Graph(nodes, edges), new ContextVector(context));
    }
}
