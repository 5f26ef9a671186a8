package com.putman.sim;

import com.putman.sim.engine.PipelineEngine;
import com.putman.sim.io.ParameterClamp;
import com.putman.sim.io.PresetDefinition;
import com.putman.sim.io.PresetLoader;
import com.putman.sim.io.RunLogExporter;
import com.putman.sim.model.SimulationOutput;
import com.putman.sim.util.LoggingStepListener;
import com.putman.sim.util.RunExplain;

import java.nio.file.Path;

import lombok.extern.log4j.Log4j2;

/**
 * Runs a built-in preset from the command line.
 *
 * <pre>
 * PutmanSimDemo [presetName] [exportPath]
 * </pre>
 *
 * The preset defaults to {@code stable}. With an export path, the JSON export
 * payload for the last step is written there.
 */
@Log4j2
public class PutmanSimDemo {

    public static void main(String[] args) throws Exception {
        String presetName = args.length > 0 ? args[0] : "stable";
        PresetDefinition preset = PresetLoader.builtIn(presetName);
        log.info("Preset '{}': {}", preset.getName(), preset.getDescription());

        ParameterClamp.ClampResult clamp = ParameterClamp.apply(preset.getParams());
        if (clamp.anyClamped())
            log.warn("Preset clamped: {}", clamp.clampedFields());

        PipelineEngine engine = new PipelineEngine();
        engine.setListener(new LoggingStepListener());
        SimulationOutput output = engine.run(clamp.applied());

        log.info("\n{}", new RunExplain(output.runlog()).explainRun());
        log.info("Runlog hash: {}", PutmanSim.hash(output.runlog()));

        if (args.length > 1) {
            RunLogExporter exporter = new RunLogExporter();
            int last = output.runlog().stepCount() - 1;
            exporter.exportToFile(Path.of(args[1]), exporter.export(output.runlog(), last, clamp));
        }
    }
}
