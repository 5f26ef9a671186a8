package com.putman.sim.engine;

import com.putman.sim.model.Edge;
import com.putman.sim.model.Graph;
import com.putman.sim.model.Node;
import com.putman.sim.model.PruneResult;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Filters the graph by activation and edge weight.
 *
 * <ul>
 * <li>active: score &ge; activationThreshold</li>
 * <li>kept node: score &ge; activationThreshold * rigidity</li>
 * <li>kept edge: both endpoints kept and weight &ge; rigidity</li>
 * </ul>
 * With rigidity &le; 1 the retention threshold is never above the activation
 * threshold, so the active set is always contained in the kept nodes.
 */
public final class RigidityPruner {
    private RigidityPruner() {
        // Utility class
    }

    public static PruneResult prune(Graph graph, Map<String, Double> scores, double activationThreshold,
            double rigidity) {
        double retention = activationThreshold * rigidity;

        List<String> activeSet = new ArrayList<>();
        List<Node> keptNodes = new ArrayList<>();
        List<String> prunedNodes = new ArrayList<>();
        Set<String> keptIds = new HashSet<>();
        for (Node node : graph.nodes()) {
            double s = scores.getOrDefault(node.id(), 0.0);
            if (s >= activationThreshold)
                activeSet.add(node.id());
            if (s >= retention) {
                keptNodes.add(node);
                keptIds.add(node.id());
            } else {
                prunedNodes.add(node.id());
            }
        }

        List<Edge> keptEdges = new ArrayList<>();
        List<String> prunedEdges = new ArrayList<>();
        for (Edge edge : graph.edges()) {
            if (keptIds.contains(edge.source()) && keptIds.contains(edge.target()) && edge.weight() >= rigidity)
                keptEdges.add(edge);
            else
                prunedEdges.add(edge.id());
        }

        return new PruneResult(new Graph(keptNodes, keptEdges), activeSet, prunedNodes, prunedEdges);
    }
}
