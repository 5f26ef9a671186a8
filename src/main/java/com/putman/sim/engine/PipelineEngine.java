package com.putman.sim.engine;

import com.putman.sim.api.StepListener;
import com.putman.sim.model.BeamCandidate;
import com.putman.sim.model.ContextVector;
import com.putman.sim.model.GeneratedGraph;
import com.putman.sim.model.Graph;
import com.putman.sim.model.InterpretationSummary;
import com.putman.sim.model.PruneResult;
import com.putman.sim.model.RunLog;
import com.putman.sim.model.SimulationOutput;
import com.putman.sim.model.SimulationParams;
import com.putman.sim.model.StepRunLog;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The engine that drives a simulation run.
 *
 * <p>
 * A run generates the graph and context once, then performs
 * {@code recursionDepth} steps. Each step:
 * <ol>
 * <li>Score: activation per node from context and incident weights.</li>
 * <li>Prune: derive the active set and the kept graph.</li>
 * <li>Reconstruct: beam search over the kept graph.</li>
 * <li>Interpret: top nodes, top edges and centroid.</li>
 * <li>Delta: L2 shift against the previous step's activation.</li>
 * <li>Record: append an immutable StepRunLog.</li>
 * <li>Update (all but the last step): replace the graph with drifted weights,
 * drawn from an RNG seeded with {@code seed + step + 1}, and drift the
 * context.</li>
 * </ol>
 *
 * <p>
 * Determinism: a run touches no I/O, clock or shared state. Graph, context and
 * RNG instances are created per run and per step, so runs with equal parameters
 * produce equal RunLogs, and distinct runs may execute concurrently on separate
 * engine instances. A single instance is not reentrant.
 *
 * <p>
 * Fail Fast: if a step throws, the listener is notified, the error is logged
 * and a {@link SimulationException} carrying the step index is thrown. No
 * partial RunLog escapes.
 */
public final class PipelineEngine {
    private static final Logger log = LogManager.getLogger(PipelineEngine.class);

    private StepListener listener;
    private long runCount;

    public void setListener(StepListener listener) {
        this.listener = listener;
    }

    /** Number of runs this engine has completed. */
    public long runCount() {
        return runCount;
    }

    /**
     * Executes one complete run.
     *
     * @param params validated parameters.
     * @return the final graph, final context and RunLog.
     * @throws SimulationException if a step fails.
     */
    public SimulationOutput run(SimulationParams params) {
        final StepListener l = this.listener;
        final boolean hasListener = l != null;

        log.info("Starting run: seed={}, nodes={}, depth={}, beamWidth={}",
                params.seed(), params.nodeCount(), params.recursionDepth(), params.beamWidth());
        if (hasListener)
            l.onRunStart(params);

        GeneratedGraph generated = GraphGenerator.generate(params.seed(), params.nodeCount(),
                params.edgeDensity(), params.overlapPercent());
        Graph graph = generated.graph();
        ContextVector context = generated.context();
        log.debug("Generated graph with {} nodes and {} edges", graph.nodeCount(), graph.edgeCount());

        List<StepRunLog> steps = new ArrayList<>(params.recursionDepth());
        Map<String, Double> previousActivation = null;

        for (int step = 0; step < params.recursionDepth(); step++) {
            try {
                StepRunLog record = runStep(step, graph, context, previousActivation, params);
                steps.add(record);
                previousActivation = record.activationVector();
                log.debug("Step {}: active={}, pruned={}, beams={}, delta={}", step, record.activeSet().size(),
                        record.prunedNodes().size(), record.beamCandidates().size(), record.delta());
                if (hasListener)
                    l.onStepComplete(record);

                if (step < params.recursionDepth() - 1) {
                    graph = WeightUpdater.updateWeights(graph, record.activationVector(),
                            params.weightLearningRate(), params.driftBias(), params.seed() + step + 1);
                    context = WeightUpdater.updateContext(context, step, params.driftBias());
                }
            } catch (RuntimeException e) {
                log.error("Step {} failed", step, e);
                if (hasListener)
                    l.onStepError(step, e);
                throw new SimulationException(step, e);
            }
        }

        RunLog runLog = RunLog.of(params, steps);
        runCount++;
        log.info("Completed run: {} steps", steps.size());
        if (hasListener)
            l.onRunEnd(runLog);

        return new SimulationOutput(graph, context, runLog);
    }

    private static StepRunLog runStep(int step, Graph graph, ContextVector context,
            Map<String, Double> previousActivation, SimulationParams params) {
        Map<String, Double> scores = ActivationScorer.score(graph, context, params.contextBlend());
        PruneResult pruned = RigidityPruner.prune(graph, scores, params.activationThreshold(), params.rigidity());
        List<BeamCandidate> beams = BeamReconstructor.reconstruct(pruned.keptGraph(), scores, pruned.activeSet(),
                params.beamWidth());
        InterpretationSummary interpretation = Interpreter.interpret(beams, scores, pruned.keptGraph());
        double delta = ShiftMetric.delta(previousActivation, scores);

        return new StepRunLog(
                step,
                params.seed(),
                params,
                sorted(pruned.activeSet()),
                sorted(pruned.prunedNodes()),
                sorted(pruned.prunedEdges()),
                beams,
                interpretation,
                scores,
                graph.edgeWeights(),
                delta);
    }

    private static List<String> sorted(List<String> ids) {
        List<String> copy = new ArrayList<>(ids);
        copy.sort(null);
        return copy;
    }
}
