package com.putman.sim.api;

import com.putman.sim.model.RunLog;
import com.putman.sim.model.SimulationParams;
import com.putman.sim.model.StepRunLog;

/**
 * Observability interface for monitoring a simulation run.
 *
 * Implementations can be registered with the PipelineEngine to receive
 * callbacks while a run progresses. Typical uses are tracing which nodes enter
 * or leave the active set, collecting per-step timings outside the runlog, or
 * streaming steps to a consumer as they are produced.
 *
 * Callbacks run synchronously on the engine's thread. They receive immutable
 * values and cannot influence the run; anything they record must stay outside
 * the RunLog so its hash remains a pure function of the parameters.
 */
public interface StepListener {

    /**
     * Called once the parameters have been accepted and before the graph is
     * generated.
     *
     * @param params the validated parameters of the run.
     */
    void onRunStart(SimulationParams params);

    /**
     * Called after a recursion step has been fully recorded.
     *
     * @param step the immutable record of the step.
     */
    void onStepComplete(StepRunLog step);

    /**
     * Called when a step fails with an exception. The run is abandoned right
     * after this callback.
     *
     * @param stepIndex the index of the failing step.
     * @param error     the exception that occurred.
     */
    void onStepError(int stepIndex, Throwable error);

    /**
     * Called when the run has completed and its RunLog is assembled.
     *
     * @param runLog the complete RunLog.
     */
    void onRunEnd(RunLog runLog);
}
