package com.putman.sim.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The record of a single recursion step. A self-contained snapshot: it holds
 * no reference to live engine state.
 *
 * @param step             zero-based step index.
 * @param seed             base seed of the run.
 * @param params           parameter snapshot.
 * @param activeSet        active node ids, sorted.
 * @param prunedNodes      pruned node ids, sorted.
 * @param prunedEdges      pruned edge ids, sorted.
 * @param beamCandidates   surviving beam candidates, best first.
 * @param interpretation   interpretation summary.
 * @param activationVector activation score of every node.
 * @param edgeWeights      weights of the graph this step scored.
 * @param delta            L2 shift from the previous step, 0 on step 0.
 */
public record StepRunLog(
        int step,
        long seed,
        SimulationParams params,
        List<String> activeSet,
        List<String> prunedNodes,
        List<String> prunedEdges,
        List<BeamCandidate> beamCandidates,
        InterpretationSummary interpretation,
        Map<String, Double> activationVector,
        Map<String, Double> edgeWeights,
        double delta) {

    public StepRunLog {
        activeSet = List.copyOf(activeSet);
        prunedNodes = List.copyOf(prunedNodes);
        prunedEdges = List.copyOf(prunedEdges);
        beamCandidates = List.copyOf(beamCandidates);
        activationVector = Collections.unmodifiableMap(new LinkedHashMap<>(activationVector));
        edgeWeights = Collections.unmodifiableMap(new LinkedHashMap<>(edgeWeights));
    }
}
