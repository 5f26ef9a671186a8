package com.putman.sim.io;

import com.putman.sim.model.SimulationParams;

import java.util.ArrayList;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Clamps requested parameter values into the interactive bounds of
 * {@link ParameterField} and records which fields had to move.
 */
@Log4j2
public final class ParameterClamp {
    private ParameterClamp() {
        // Utility class
    }

    /**
     * @param requested  the values as requested; never modified.
     * @param applied    the validated parameters the engine will run with.
     * @param clampedFields JSON names of the fields whose value changed, in
     *                   field order.
     */
    public record ClampResult(PresetDefinition.Params requested, SimulationParams applied,
            List<String> clampedFields) {
        public ClampResult {
            requested = PresetDefinition.Params.copyOf(requested);
            clampedFields = List.copyOf(clampedFields);
        }

        public boolean anyClamped() {
            return !clampedFields.isEmpty();
        }
    }

    public static ClampResult apply(PresetDefinition.Params requested) {
        PresetDefinition.Params applied = PresetDefinition.Params.copyOf(requested);
        List<String> clamped = new ArrayList<>();
        for (ParameterField f : ParameterField.values()) {
            double before = f.read(requested);
            double after = f.clamp(before);
            if (Double.compare(before, after) != 0) {
                clamped.add(f.jsonName());
                f.write(applied, after);
            }
        }
        if (!clamped.isEmpty())
            log.info("Clamped parameter fields: {}", clamped);
        return new ClampResult(requested, applied.toParams(), clamped);
    }

    public static ClampResult apply(SimulationParams params) {
        return apply(PresetDefinition.Params.from(params));
    }
}
