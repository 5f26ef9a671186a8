package com.putman.sim.model;

import java.util.List;

/**
 * The complete, ordered record of a run. A pure value: two runs with the same
 * parameters produce equal RunLogs.
 *
 * {@code createdAt} is a constant placeholder rather than a wall-clock time so
 * the content, and therefore the hash, depends on the parameters alone.
 */
public record RunLog(String model, String createdAt, SimulationParams params, List<StepRunLog> steps) {

    public static final String MODEL_NAME = "PUTMAN Pipeline Visual Simulator";
    public static final String CREATED_AT = "deterministic";

    public RunLog {
        steps = List.copyOf(steps);
    }

    public static RunLog of(SimulationParams params, List<StepRunLog> steps) {
        return new RunLog(MODEL_NAME, CREATED_AT, params, steps);
    }

    public StepRunLog step(int index) {
        return steps.get(index);
    }

    public int stepCount() {
        return steps.size();
    }
}
