package com.putman.sim.util;

import com.putman.sim.model.BeamCandidate;
import com.putman.sim.model.RankedItem;
import com.putman.sim.model.RunLog;
import com.putman.sim.model.StepRunLog;

import java.util.Locale;

/**
 * Diagnostic utility for inspecting a finished run.
 *
 * <p>
 * Generates human-readable text from a RunLog: one line per step, a full run
 * table and delta statistics.
 *
 * <p>
 * <b>Usage:</b> Intended for logging and debugging sessions. Reads only the
 * RunLog, never engine state.
 */
public final class RunExplain {
    private final RunLog runLog;

    public RunExplain(RunLog runLog) {
        this.runLog = runLog;
    }

    /**
     * Summary of a single step.
     */
    public String explainStep(int index) {
        StepRunLog step = runLog.step(index);
        StepDiff diff = StepDiff.at(runLog, index);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Step ").append(step.step())
                .append(": active=").append(step.activeSet().size())
                .append(", prunedNodes=").append(step.prunedNodes().size())
                .append(", prunedEdges=").append(step.prunedEdges().size())
                .append(", beams=").append(step.beamCandidates().size())
                .append(", newActive=").append(diff.newlyActive().size())
                .append(", dropped=").append(diff.dropped().size())
                .append(", delta=").append(format(step.delta()));
        if (!step.beamCandidates().isEmpty()) {
            BeamCandidate winner = step.beamCandidates().get(0);
            sb.append(", winner=").append(String.join(" > ", winner.nodePath()))
                    .append(" (").append(format(winner.score())).append(')');
        }
        return sb.toString();
    }

    /**
     * Dumps every step plus the top nodes of each.
     */
    public String explainRun() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append(runLog.model()).append(" (seed ").append(runLog.params().seed()).append(", ")
                .append(runLog.stepCount()).append(" steps)\n");
        for (int i = 0; i < runLog.stepCount(); i++) {
            sb.append("  ").append(explainStep(i)).append('\n');
            sb.append("    top nodes: ");
            boolean first = true;
            for (RankedItem item : runLog.step(i).interpretation().topNodes()) {
                if (!first)
                    sb.append(", ");
                sb.append(item.id()).append('=').append(format(item.score()));
                first = false;
            }
            sb.append('\n');
        }
        sb.append("  ").append(deltaSummary()).append('\n');
        return sb.toString();
    }

    public double maxDelta() {
        double max = 0.0;
        for (StepRunLog step : runLog.steps())
            max = Math.max(max, step.delta());
        return max;
    }

    public double meanDelta() {
        if (runLog.stepCount() == 0)
            return 0.0;
        double sum = 0.0;
        for (StepRunLog step : runLog.steps())
            sum += step.delta();
        return sum / runLog.stepCount();
    }

    public String deltaSummary() {
        return "Delta: max=" + format(maxDelta()) + ", mean=" + format(meanDelta());
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }
}
