package com.putman.sim.util;

/**
 * Numeric helpers shared by the pipeline stages.
 *
 * All stored reals are rounded half-up to 3 decimals so runlogs compare and
 * hash identically across runs.
 */
public final class Rounding {
    private Rounding() {
        // Utility class
    }

    public static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }

    public static double clamp01(double value) {
        return Math.min(1.0, Math.max(0.0, value));
    }

    public static double sigmoid(double x) {
        return 1.0 / (1.0 + Math.exp(-x));
    }
}
