package com.putman.sim.util;

import com.putman.sim.api.StepListener;
import com.putman.sim.model.BeamCandidate;
import com.putman.sim.model.RunLog;
import com.putman.sim.model.SimulationParams;
import com.putman.sim.model.StepRunLog;

import lombok.extern.log4j.Log4j2;

/**
 * Traces a run through Log4j 2: parameters and completion at INFO, one line
 * per step at DEBUG.
 */
@Log4j2
public class LoggingStepListener implements StepListener {
    private StepRunLog previous;

    @Override
    public void onRunStart(SimulationParams params) {
        previous = null;
        log.info("Run parameters: {}", params);
    }

    @Override
    public void onStepComplete(StepRunLog step) {
        if (log.isDebugEnabled()) {
            StepDiff diff = StepDiff.between(previous, step);
            String winner = step.beamCandidates().isEmpty() ? "-"
                    : String.join(">", step.beamCandidates().get(0).nodePath());
            log.debug("step={} active={} newlyActive={} dropped={} winner={} delta={}", step.step(),
                    step.activeSet().size(), diff.newlyActive(), diff.dropped(), winner, step.delta());
        }
        previous = step;
    }

    @Override
    public void onStepError(int stepIndex, Throwable error) {
        log.error("Step {} failed", stepIndex, error);
    }

    @Override
    public void onRunEnd(RunLog runLog) {
        StepRunLog last = runLog.steps().isEmpty() ? null : runLog.step(runLog.stepCount() - 1);
        BeamCandidate best = last == null || last.beamCandidates().isEmpty() ? null : last.beamCandidates().get(0);
        log.info("Run finished after {} steps; final delta={}, best path score={}", runLog.stepCount(),
                last == null ? 0.0 : last.delta(), best == null ? 0.0 : best.score());
    }
}
