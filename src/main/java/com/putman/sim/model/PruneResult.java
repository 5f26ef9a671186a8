package com.putman.sim.model;

import java.util.List;

/**
 * Output of rigidity pruning.
 *
 * The id lists are kept in graph order here, since the active set seeds beam
 * reconstruction in that order. They are sorted only when written to the
 * step log.
 *
 * @param keptGraph   nodes and edges that survived pruning.
 * @param activeSet   ids of nodes scoring at or above the activation threshold.
 * @param prunedNodes ids of nodes outside the kept graph.
 * @param prunedEdges ids of edges outside the kept graph.
 */
public record PruneResult(Graph keptGraph, List<String> activeSet, List<String> prunedNodes,
        List<String> prunedEdges) {

    public PruneResult {
        activeSet = List.copyOf(activeSet);
        prunedNodes = List.copyOf(prunedNodes);
        prunedEdges = List.copyOf(prunedEdges);
    }
}
