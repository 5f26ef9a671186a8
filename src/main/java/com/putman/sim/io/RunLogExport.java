package com.putman.sim.io;

import com.putman.sim.model.RunLog;
import com.putman.sim.model.SimulationParams;

import java.util.List;

/**
 * The JSON export payload: the RunLog plus the context a consumer had when
 * exporting it. Only {@code runlog} takes part in hashing.
 *
 * @param exportedAt        ISO-8601 instant of the export.
 * @param selectedStepIndex the step the consumer was inspecting.
 * @param selectedDelta     that step's delta.
 * @param diff              node changes of that step against its predecessor.
 * @param paramsRequested   parameters before clamping.
 * @param paramsApplied     parameters the run used.
 * @param clampedFields     fields that differed between the two.
 */
public record RunLogExport(
        String exportedAt,
        int selectedStepIndex,
        double selectedDelta,
        Diff diff,
        PresetDefinition.Params paramsRequested,
        SimulationParams paramsApplied,
        List<String> clampedFields,
        RunLog runlog) {

    public RunLogExport {
        clampedFields = List.copyOf(clampedFields);
    }

    /** Counts of nodes entering and leaving the selected step. */
    public record Diff(int newlyActiveCount, int droppedCount) {
    }
}
