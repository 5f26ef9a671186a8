package com.putman.sim.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of one step: the strongest nodes, the edges carrying the most beam
 * score, and the activation of every kept node.
 */
public record InterpretationSummary(List<RankedItem> topNodes, List<RankedItem> topEdges,
        Map<String, Double> centroid) {

    public InterpretationSummary {
        topNodes = List.copyOf(topNodes);
        topEdges = List.copyOf(topEdges);
        centroid = Collections.unmodifiableMap(new LinkedHashMap<>(centroid));
    }
}
