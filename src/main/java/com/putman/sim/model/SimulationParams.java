package com.putman.sim.model;

import lombok.With;

/**
 * The validated parameter record of a simulation run.
 *
 * <p>
 * Every field carries its declared range as an invariant, checked once in the
 * canonical constructor. An out-of-range value raises
 * {@link InvalidParameterException} naming the field.
 *
 * <ul>
 * <li>{@code seed}: unsigned 32-bit value, [0, 2^32-1]</li>
 * <li>{@code nodeCount}: &ge; 1</li>
 * <li>{@code edgeDensity}: (0, 1]</li>
 * <li>{@code overlapPercent}: [0, 1]</li>
 * <li>{@code recursionDepth}: &ge; 1</li>
 * <li>{@code rigidity}: (0, 1]</li>
 * <li>{@code beamWidth}: &ge; 1</li>
 * <li>{@code activationThreshold}: (0, 1)</li>
 * <li>{@code contextBlend}, {@code weightLearningRate}, {@code driftBias}: [0, 1]</li>
 * </ul>
 */
@With
public record SimulationParams(
        long seed,
        int nodeCount,
        double edgeDensity,
        double overlapPercent,
        int recursionDepth,
        double rigidity,
        int beamWidth,
        double activationThreshold,
        double contextBlend,
        double weightLearningRate,
        double driftBias) {

    public static final long MAX_SEED = 0xFFFF_FFFFL;

    public SimulationParams {
        if (seed < 0 || seed > MAX_SEED)
            throw new InvalidParameterException("seed", seed, "[0, " + MAX_SEED + "]");
        if (nodeCount < 1)
            throw new InvalidParameterException("nodeCount", nodeCount, ">= 1");
        requireRange("edgeDensity", edgeDensity, false, true);
        requireRange("overlapPercent", overlapPercent, true, true);
        if (recursionDepth < 1)
            throw new InvalidParameterException("recursionDepth", recursionDepth, ">= 1");
        requireRange("rigidity", rigidity, false, true);
        if (beamWidth < 1)
            throw new InvalidParameterException("beamWidth", beamWidth, ">= 1");
        requireRange("activationThreshold", activationThreshold, false, false);
        requireRange("contextBlend", contextBlend, true, true);
        requireRange("weightLearningRate", weightLearningRate, true, true);
        requireRange("driftBias", driftBias, true, true);
    }

    private static void requireRange(String field, double value, boolean includeZero, boolean includeOne) {
        boolean lowOk = includeZero ? value >= 0.0 : value > 0.0;
        boolean highOk = includeOne ? value <= 1.0 : value < 1.0;
        if (Double.isNaN(value) || !lowOk || !highOk) {
            String range = (includeZero ? "[" : "(") + "0, 1" + (includeOne ? "]" : ")");
            throw new InvalidParameterException(field, value, range);
        }
    }
}
