package com.putman.sim.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.putman.sim.model.SimulationParams;

import lombok.Data;

/**
 * POJO representation of a named parameter preset.
 *
 * <pre>
 * { "name": "stable", "description": "...", "params": { "seed": 42, ... } }
 * </pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PresetDefinition {
    private String name, description;
    private Params params;

    /**
     * Raw parameter values as requested, before clamping or validation. All
     * fields are reals so out-of-range and fractional inputs survive until
     * {@link ParameterClamp} reports them.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Params {
        private double seed;
        private double nodeCount;
        private double edgeDensity;
        private double overlapPercent;
        private double recursionDepth;
        private double rigidity;
        private double beamWidth;
        private double activationThreshold;
        private double contextBlend;
        private double weightLearningRate;
        private double driftBias;

        public static Params copyOf(Params other) {
            Params copy = new Params();
            for (ParameterField f : ParameterField.values())
                f.write(copy, f.read(other));
            return copy;
        }

        public static Params from(SimulationParams p) {
            Params raw = new Params();
            raw.setSeed(p.seed());
            raw.setNodeCount(p.nodeCount());
            raw.setEdgeDensity(p.edgeDensity());
            raw.setOverlapPercent(p.overlapPercent());
            raw.setRecursionDepth(p.recursionDepth());
            raw.setRigidity(p.rigidity());
            raw.setBeamWidth(p.beamWidth());
            raw.setActivationThreshold(p.activationThreshold());
            raw.setContextBlend(p.contextBlend());
            raw.setWeightLearningRate(p.weightLearningRate());
            raw.setDriftBias(p.driftBias());
            return raw;
        }

        /**
         * Converts without clamping. Integer fields must hold whole numbers.
         *
         * @throws com.putman.sim.model.InvalidParameterException if a value is
         *                                                         out of range.
         */
        public SimulationParams toParams() {
            return new SimulationParams(
                    (long) ParameterField.SEED.wholeValue(this),
                    (int) ParameterField.NODE_COUNT.wholeValue(this),
                    edgeDensity,
                    overlapPercent,
                    (int) ParameterField.RECURSION_DEPTH.wholeValue(this),
                    rigidity,
                    (int) ParameterField.BEAM_WIDTH.wholeValue(this),
                    activationThreshold,
                    contextBlend,
                    weightLearningRate,
                    driftBias);
        }
    }
}
