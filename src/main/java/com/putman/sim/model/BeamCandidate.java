package com.putman.sim.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A reconstructed path: node ids without repeats, the edges joining them, and
 * the cumulative score.
 */
public record BeamCandidate(List<String> nodePath, List<String> edgePath, double score) {

    public BeamCandidate {
        nodePath = List.copyOf(nodePath);
        edgePath = List.copyOf(edgePath);
        if (nodePath.isEmpty())
            throw new IllegalArgumentException("nodePath must not be empty");
        if (edgePath.size() != nodePath.size() - 1)
            throw new IllegalArgumentException(
                    "edgePath length " + edgePath.size() + " does not match nodePath length " + nodePath.size());
    }

    public static BeamCandidate seed(String nodeId, double score) {
        return new BeamCandidate(List.of(nodeId), List.of(), score);
    }

    public String tail() {
        return nodePath.get(nodePath.size() - 1);
    }

    public boolean visits(String nodeId) {
        return nodePath.contains(nodeId);
    }

    /** Concatenated node ids, used as the tie-break key when ranking. */
    public String pathKey() {
        return String.join("", nodePath);
    }

    public BeamCandidate extend(String nodeId, String edgeId, double newScore) {
        List<String> nodes = new ArrayList<>(nodePath.size() + 1);
        nodes.addAll(nodePath);
        nodes.add(nodeId);
        List<String> edges = new ArrayList<>(edgePath.size() + 1);
        edges.addAll(edgePath);
        edges.add(edgeId);
        return new BeamCandidate(nodes, edges, newScore);
    }
}
