package com.putman.sim.io;

import com.putman.sim.model.InvalidParameterException;
import com.putman.sim.model.SimulationParams;
import org.junit.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.Assert.*;

public class ParameterClampTest {

    private static final SimulationParams STABLE = new SimulationParams(42, 24, 0.22, 0.3, 6, 0.3, 4, 0.5, 0.55,
            0.2, 0.08);

    @Test
    public void testInRangeParamsUnchanged() {
        ParameterClamp.ClampResult result = ParameterClamp.apply(STABLE);
        assertFalse(result.anyClamped());
        assertEquals(STABLE, result.applied());
    }

    @Test
    public void testCollapsePresetClampsRigidity() throws IOException {
        PresetDefinition.Params requested = PresetLoader.builtIn("collapse").getParams();
        ParameterClamp.ClampResult result = ParameterClamp.apply(requested);

        assertEquals(List.of("rigidity"), result.clampedFields());
        assertEquals(0.7, result.applied().rigidity(), 0.0);
        assertEquals(0.75, result.requested().getRigidity(), 0.0);
        assertEquals(0.75, requested.getRigidity(), 0.0);
    }

    @Test
    public void testIntegerFieldsRoundAndBound() {
        PresetDefinition.Params raw = PresetDefinition.Params.from(STABLE);
        raw.setSeed(12345);
        raw.setNodeCount(5);
        raw.setBeamWidth(3.6);
        raw.setDriftBias(-0.2);

        ParameterClamp.ClampResult result = ParameterClamp.apply(raw);
        assertEquals(List.of("seed", "nodeCount", "beamWidth", "driftBias"), result.clampedFields());
        assertEquals(9999, result.applied().seed());
        assertEquals(12, result.applied().nodeCount());
        assertEquals(4, result.applied().beamWidth());
        assertEquals(0.0, result.applied().driftBias(), 0.0);
        assertEquals(STABLE.edgeDensity(), result.applied().edgeDensity(), 0.0);
    }

    @Test
    public void testFieldBounds() {
        assertEquals(0.45, ParameterField.EDGE_DENSITY.clamp(0.9), 0.0);
        assertEquals(0.08, ParameterField.EDGE_DENSITY.clamp(0.01), 0.0);
        assertEquals(16, ParameterField.RECURSION_DEPTH.clamp(40), 0.0);
        assertEquals(3, ParameterField.RECURSION_DEPTH.clamp(2.5), 0.0);
        assertEquals(ParameterField.ACTIVATION_THRESHOLD, ParameterField.fromJsonName("activationThreshold"));
    }

    @Test
    public void testConversionRejectsFractionalInteger() {
        PresetDefinition.Params raw = PresetDefinition.Params.from(STABLE);
        raw.setNodeCount(12.5);
        try {
            raw.toParams();
            fail("Expected InvalidParameterException");
        } catch (InvalidParameterException e) {
            assertEquals("nodeCount", e.field());
        }
    }
}
