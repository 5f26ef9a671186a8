package com.putman.sim.io;

import com.putman.sim.PutmanSim;
import com.putman.sim.model.RunLog;
import com.putman.sim.model.SimulationParams;
import com.putman.sim.model.StepRunLog;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class RunLogHasherTest {

    private static final SimulationParams PARAMS = new SimulationParams(42, 24, 0.22, 0.3, 4, 0.3, 4, 0.5, 0.55,
            0.2, 0.08);

    @Test
    public void testFnv1aReferenceValues() {
        assertEquals("811c9dc5", RunLogHasher.fnv1a(""));
        assertEquals("e40c292c", RunLogHasher.fnv1a("a"));
        assertEquals("8b9e4511", RunLogHasher.fnv1a("{\"a\":1}"));
    }

    @Test
    public void testRealFormatting() {
        assertEquals("1", real(1.0));
        assertEquals("0", real(0.0));
        assertEquals("0.08", real(0.08));
        assertEquals("0.336", real(0.336));
        assertEquals("-2.5", real(-2.5));
        assertEquals("0.0001", real(1.0E-4));
        assertEquals("null", real(Double.NaN));
    }

    @Test
    public void testCanonicalFormSortsKeysAndKeepsArrays() {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("b", 1.0);
        value.put("a", List.of(0.08, 3, "x\"y"));
        value.put("c", true);
        assertEquals("{\"a\":[0.08,3,\"x\\\"y\"],\"b\":1,\"c\":true}", RunLogHasher.canonicalize(value));
    }

    @Test
    public void testMapInsertionOrderDoesNotChangeHash() {
        RunLog runLog = PutmanSim.run(PARAMS).runlog();

        List<StepRunLog> permuted = new ArrayList<>();
        for (StepRunLog s : runLog.steps())
            permuted.add(new StepRunLog(s.step(), s.seed(), s.params(), s.activeSet(), s.prunedNodes(),
                    s.prunedEdges(), s.beamCandidates(), s.interpretation(), reversed(s.activationVector()),
                    reversed(s.edgeWeights()), s.delta()));
        RunLog reordered = RunLog.of(runLog.params(), permuted);

        assertEquals(runLog, reordered);
        assertEquals(RunLogHasher.hash(runLog), RunLogHasher.hash(reordered));
    }

    @Test
    public void testContentChangeChangesHash() {
        RunLog runLog = PutmanSim.run(PARAMS).runlog();
        RunLog other = new RunLog(runLog.model(), "2026-10-18", runLog.params(), runLog.steps());
        assertNotEquals(RunLogHasher.hash(runLog), RunLogHasher.hash(other));
    }

    private static String real(double d) {
        StringBuilder sb = new StringBuilder();
        RunLogHasher.appendReal(d, sb);
        return sb.toString();
    }

    private static Map<String, Double> reversed(Map<String, Double> in) {
        List<String> keys = new ArrayList<>(in.keySet());
        Collections.reverse(keys);
        Map<String, Double> out = new LinkedHashMap<>();
        for (String k : keys)
            out.put(k, in.get(k));
        return out;
    }
}
