package com.putman.sim.util;

import com.putman.sim.model.RunLog;
import com.putman.sim.model.StepRunLog;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Node-level changes between two consecutive steps.
 *
 * <ul>
 * <li>{@code newlyActive}: ids active now and not active in the previous
 * step.</li>
 * <li>{@code dropped}: nothing on the first step. Otherwise, when either step
 * pruned any node, the ids pruned now that were not pruned before; when
 * neither did, the ids that were active before and no longer are.</li>
 * </ul>
 * Both lists keep the sorted order of the step log.
 */
public record StepDiff(List<String> newlyActive, List<String> dropped) {

    public StepDiff {
        newlyActive = List.copyOf(newlyActive);
        dropped = List.copyOf(dropped);
    }

    /**
     * @param previous the preceding step, or null for the first step.
     * @param current  the step to describe.
     */
    public static StepDiff between(StepRunLog previous, StepRunLog current) {
        List<String> previousActive = previous == null ? List.of() : previous.activeSet();
        List<String> newlyActive = minus(current.activeSet(), previousActive);

        List<String> dropped;
        if (previous == null) {
            dropped = List.of();
        } else if (!current.prunedNodes().isEmpty() || !previous.prunedNodes().isEmpty()) {
            dropped = minus(current.prunedNodes(), previous.prunedNodes());
        } else {
            dropped = minus(previous.activeSet(), current.activeSet());
        }
        return new StepDiff(newlyActive, dropped);
    }

    /** Diff of step {@code index} of a run against its predecessor. */
    public static StepDiff at(RunLog runLog, int index) {
        StepRunLog previous = index > 0 ? runLog.step(index - 1) : null;
        return between(previous, runLog.step(index));
    }

    private static List<String> minus(List<String> from, List<String> remove) {
        Set<String> excluded = new HashSet<>(remove);
        List<String> out = new ArrayList<>();
        for (String id : from)
            if (!excluded.contains(id))
                out.add(id);
        return out;
    }
}
