package com.putman.sim;

import com.putman.sim.engine.PipelineEngine;
import com.putman.sim.io.RunLogHasher;
import com.putman.sim.model.RunLog;
import com.putman.sim.model.SimulationOutput;
import com.putman.sim.model.SimulationParams;

/**
 * PUTMAN pipeline simulator -- deterministic activation, pruning,
 * reconstruction and interpretation over a seeded random graph.
 *
 * <h2>Pipeline</h2>
 * <p>
 * A run generates a synthetic graph and context vector from the seed, then
 * repeats for {@code recursionDepth} steps:
 * <ul>
 * <li><b>Score</b> every node from context and incident edge weights.</li>
 * <li><b>Prune</b> weak nodes and edges according to rigidity.</li>
 * <li><b>Reconstruct</b> strong paths by beam search.</li>
 * <li><b>Interpret</b> the step as top nodes, top edges and a centroid.</li>
 * <li><b>Drift</b> weights and context before the next step.</li>
 * </ul>
 *
 * <h3>Key Properties</h3>
 * <ul>
 * <li><b>Deterministic:</b> equal parameters always produce equal RunLogs and
 * equal hashes.</li>
 * <li><b>Replayable:</b> every random stream is seeded from the run seed and the
 * step index, so any step can be reproduced from its inputs.</li>
 * <li><b>Self-contained:</b> a run performs no I/O and shares no state with
 * other runs.</li>
 * </ul>
 */
public final class PutmanSim {

    private PutmanSim() {
        // Prevent instantiation of utility class
    }

    /**
     * Entry point: runs the pipeline once.
     *
     * @param params validated parameters.
     * @return final graph, final context and the RunLog.
     */
    public static SimulationOutput run(SimulationParams params) {
        return new PipelineEngine().run(params);
    }

    /**
     * Canonical 8-hex-digit hash of a RunLog, independent of map ordering.
     */
    public static String hash(RunLog runLog) {
        return RunLogHasher.hash(runLog);
    }
}
