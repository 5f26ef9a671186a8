package com.putman.sim.util;

import com.putman.sim.PutmanSim;
import com.putman.sim.model.InterpretationSummary;
import com.putman.sim.model.RunLog;
import com.putman.sim.model.SimulationParams;
import com.putman.sim.model.StepRunLog;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class RunExplainTest {

    private static final SimulationParams PARAMS = new SimulationParams(42, 24, 0.22, 0.3, 6, 0.3, 4, 0.5, 0.55,
            0.2, 0.08);

    @Test
    public void testDeltaStatistics() {
        List<StepRunLog> steps = new ArrayList<>();
        double[] deltas = { 0.0, 0.3, 0.1, 0.2 };
        for (int i = 0; i < deltas.length; i++)
            steps.add(new StepRunLog(i, PARAMS.seed(), PARAMS, List.of(), List.of(), List.of(), List.of(),
                    new InterpretationSummary(List.of(), List.of(), Map.of()), Map.of(), Map.of(), deltas[i]));
        RunExplain explain = new RunExplain(RunLog.of(PARAMS, steps));

        assertEquals(0.3, explain.maxDelta(), 0.0);
        assertEquals(0.15, explain.meanDelta(), 1e-12);
        assertEquals("Delta: max=0.300, mean=0.150", explain.deltaSummary());
    }

    @Test
    public void testEmptyRunStatistics() {
        RunExplain explain = new RunExplain(RunLog.of(PARAMS, List.of()));
        assertEquals(0.0, explain.maxDelta(), 0.0);
        assertEquals(0.0, explain.meanDelta(), 0.0);
    }

    @Test
    public void testExplainRun() {
        RunLog runLog = PutmanSim.run(PARAMS).runlog();
        RunExplain explain = new RunExplain(runLog);

        String step0 = explain.explainStep(0);
        assertTrue(step0, step0.startsWith("Step 0: active=" + runLog.step(0).activeSet().size()));
        assertTrue(step0.contains("delta=0.000"));

        String text = explain.explainRun();
        assertTrue(text.startsWith(RunLog.MODEL_NAME + " (seed 42, 6 steps)"));
        for (int i = 0; i < runLog.stepCount(); i++)
            assertTrue(text.contains("Step " + i + ":"));
        assertTrue(text.contains(explain.deltaSummary()));
    }
}
