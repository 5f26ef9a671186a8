package com.putman.sim.io;

import com.putman.sim.model.InvalidParameterException;

import java.util.function.ObjDoubleConsumer;
import java.util.function.ToDoubleFunction;

/**
 * The recognized parameter fields, with the bounds an interactive consumer
 * offers for each. These bounds are narrower than the engine's validation
 * ranges; {@link ParameterClamp} applies them.
 */
public enum ParameterField {
    SEED("seed", 0, 9999, true, PresetDefinition.Params::getSeed, PresetDefinition.Params::setSeed),
    NODE_COUNT("nodeCount", 12, 60, true, PresetDefinition.Params::getNodeCount, PresetDefinition.Params::setNodeCount),
    EDGE_DENSITY("edgeDensity", 0.08, 0.45, false, PresetDefinition.Params::getEdgeDensity,
            PresetDefinition.Params::setEdgeDensity),
    OVERLAP_PERCENT("overlapPercent", 0.05, 0.8, false, PresetDefinition.Params::getOverlapPercent,
            PresetDefinition.Params::setOverlapPercent),
    RECURSION_DEPTH("recursionDepth", 2, 16, true, PresetDefinition.Params::getRecursionDepth,
            PresetDefinition.Params::setRecursionDepth),
    RIGIDITY("rigidity", 0.1, 0.7, false, PresetDefinition.Params::getRigidity, PresetDefinition.Params::setRigidity),
    BEAM_WIDTH("beamWidth", 1, 10, true, PresetDefinition.Params::getBeamWidth, PresetDefinition.Params::setBeamWidth),
    ACTIVATION_THRESHOLD("activationThreshold", 0.3, 0.8, false, PresetDefinition.Params::getActivationThreshold,
            PresetDefinition.Params::setActivationThreshold),
    CONTEXT_BLEND("contextBlend", 0.1, 0.9, false, PresetDefinition.Params::getContextBlend,
            PresetDefinition.Params::setContextBlend),
    WEIGHT_LEARNING_RATE("weightLearningRate", 0.05, 0.5, false, PresetDefinition.Params::getWeightLearningRate,
            PresetDefinition.Params::setWeightLearningRate),
    DRIFT_BIAS("driftBias", 0, 0.4, false, PresetDefinition.Params::getDriftBias,
            PresetDefinition.Params::setDriftBias);

    private final String jsonName;
    private final double min;
    private final double max;
    private final boolean integer;
    private final ToDoubleFunction<PresetDefinition.Params> reader;
    private final ObjDoubleConsumer<PresetDefinition.Params> writer;

    ParameterField(String jsonName, double min, double max, boolean integer,
            ToDoubleFunction<PresetDefinition.Params> reader, ObjDoubleConsumer<PresetDefinition.Params> writer) {
        this.jsonName = jsonName;
        this.min = min;
        this.max = max;
        this.integer = integer;
        this.reader = reader;
        this.writer = writer;
    }

    public String jsonName() {
        return jsonName;
    }

    public double min() {
        return min;
    }

    public double max() {
        return max;
    }

    public boolean isInteger() {
        return integer;
    }

    public double read(PresetDefinition.Params params) {
        return reader.applyAsDouble(params);
    }

    public void write(PresetDefinition.Params params, double value) {
        writer.accept(params, value);
    }

    /** Clamps into [min, max], rounding integer fields to the nearest whole number. */
    public double clamp(double value) {
        double clamped = Math.min(max, Math.max(min, value));
        return integer ? Math.round(clamped) : clamped;
    }

    /**
     * Reads an integer field, rejecting fractional values.
     *
     * @throws InvalidParameterException if the value is not a whole number.
     */
    double wholeValue(PresetDefinition.Params params) {
        double v = read(params);
        if (Double.isNaN(v) || v != Math.rint(v))
            throw new InvalidParameterException(jsonName, v, "a whole number");
        return v;
    }

    public static ParameterField fromJsonName(String name) {
        for (ParameterField f : values())
            if (f.jsonName.equals(name))
                return f;
        throw new IllegalArgumentException("Unknown parameter field: " + name);
    }
}
