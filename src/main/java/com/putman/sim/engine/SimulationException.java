package com.putman.sim.engine;

/**
 * Thrown when a recursion step fails. The run is abandoned and no partial
 * RunLog is produced.
 */
public class SimulationException extends RuntimeException {
    private final int stepIndex;

    public SimulationException(int stepIndex, Throwable cause) {
        super("Simulation failed at step " + stepIndex + ": " + cause.getMessage(), cause);
        this.stepIndex = stepIndex;
    }

    public int stepIndex() {
        return stepIndex;
    }
}
