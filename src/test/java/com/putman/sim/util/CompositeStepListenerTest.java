package com.putman.sim.util;

import com.putman.sim.api.StepListener;
import com.putman.sim.engine.PipelineEngine;
import com.putman.sim.model.RunLog;
import com.putman.sim.model.SimulationParams;
import com.putman.sim.model.StepRunLog;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class CompositeStepListenerTest {

    @Test
    public void testFansOutInRegistrationOrder() {
        List<String> calls = new ArrayList<>();
        CompositeStepListener composite = new CompositeStepListener()
                .add(new Tracing("first", calls))
                .add(new Tracing("second", calls))
                .add(new LoggingStepListener());
        assertEquals(3, composite.size());

        PipelineEngine engine = new PipelineEngine();
        engine.setListener(composite);
        engine.run(new SimulationParams(3, 12, 0.3, 0.3, 2, 0.3, 2, 0.5, 0.5, 0.2, 0.1));

        assertEquals(List.of(
                "first:start", "second:start",
                "first:step0", "second:step0",
                "first:step1", "second:step1",
                "first:end", "second:end"), calls);
    }

    @Test
    public void testEmptyCompositeIsNoop() {
        CompositeStepListener composite = new CompositeStepListener();
        composite.onStepError(0, new IllegalStateException("ignored"));
        assertEquals(0, composite.size());
    }

    private static final class Tracing implements StepListener {
        private final String name;
        private final List<String> calls;

        Tracing(String name, List<String> calls) {
            this.name = name;
            this.calls = calls;
        }

        @Override
        public void onRunStart(SimulationParams params) {
            calls.add(name + ":start");
        }

        @Override
        public void onStepComplete(StepRunLog step) {
            calls.add(name + ":step" + step.step());
        }

        @Override
        public void onStepError(int stepIndex, Throwable error) {
            calls.add(name + ":error" + stepIndex);
        }

        @Override
        public void onRunEnd(RunLog runLog) {
            calls.add(name + ":end");
        }
    }
}
