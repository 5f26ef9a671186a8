package com.putman.sim.util;

import com.putman.sim.api.StepListener;
import com.putman.sim.model.RunLog;
import com.putman.sim.model.SimulationParams;
import com.putman.sim.model.StepRunLog;

import java.util.Arrays;

/**
 * Aggregates multiple {@link StepListener} instances.
 */
public class CompositeStepListener implements StepListener {
    private StepListener[] listeners = new StepListener[0];

    public CompositeStepListener add(StepListener listener) {
        StepListener[] old = listeners;
        StepListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onRunStart(SimulationParams params) {
        for (StepListener l : listeners)
            l.onRunStart(params);
    }

    @Override
    public void onStepComplete(StepRunLog step) {
        for (StepListener l : listeners)
            l.onStepComplete(step);
    }

    @Override
    public void onStepError(int stepIndex, Throwable error) {
        for (StepListener l : listeners)
            l.onStepError(stepIndex, error);
    }

    @Override
    public void onRunEnd(RunLog runLog) {
        for (StepListener l : listeners)
            l.onRunEnd(runLog);
    }
}
