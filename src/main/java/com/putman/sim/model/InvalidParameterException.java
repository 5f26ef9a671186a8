package com.putman.sim.model;

/**
 * Thrown when a simulation parameter lies outside its documented range.
 *
 * Raised from the {@link SimulationParams} constructor, so a run fails before
 * any graph, context or RNG state is built.
 */
public class InvalidParameterException extends IllegalArgumentException {
    private final String field;

    public InvalidParameterException(String field, Object value, String range) {
        super("Invalid parameter '" + field + "': " + value + " (expected " + range + ")");
        this.field = field;
    }

    /** The name of the offending field, e.g. {@code "rigidity"}. */
    public String field() {
        return field;
    }
}
