package com.putman.sim.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.putman.sim.model.RunLog;
import com.putman.sim.model.StepRunLog;
import com.putman.sim.util.StepDiff;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;

import lombok.extern.log4j.Log4j2;

/**
 * JSON export of runs, backed by Jackson.
 *
 * <p>
 * A RunLog written with {@link #writeRunLog(RunLog)} reads back through
 * {@link #readRunLog(String)} as an equal value with an equal hash. The export
 * payload adds a timestamp from the injected {@link Clock}; it sits outside the
 * RunLog and never affects the hash.
 */
@Log4j2
public final class RunLogExporter {
    private final ObjectMapper mapper = new ObjectMapper();
    private final ObjectWriter writer = mapper.writerWithDefaultPrettyPrinter();
    private final Clock clock;

    public RunLogExporter() {
        this(Clock.systemUTC());
    }

    public RunLogExporter(Clock clock) {
        this.clock = clock;
    }

    public String writeRunLog(RunLog runLog) {
        try {
            return writer.writeValueAsString(runLog);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize runlog", e);
        }
    }

    public RunLog readRunLog(String json) {
        try {
            return mapper.readValue(json, RunLog.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Malformed runlog JSON", e);
        }
    }

    /**
     * Builds the export payload for a run.
     *
     * @param runLog            the run to export.
     * @param selectedStepIndex the step under inspection, within the run.
     * @param clamp             the clamping that produced the run's parameters.
     */
    public RunLogExport export(RunLog runLog, int selectedStepIndex, ParameterClamp.ClampResult clamp) {
        if (selectedStepIndex < 0 || selectedStepIndex >= runLog.stepCount())
            throw new IllegalArgumentException("Step index " + selectedStepIndex + " outside run of "
                    + runLog.stepCount() + " steps");
        StepRunLog selected = runLog.step(selectedStepIndex);
        StepDiff diff = StepDiff.at(runLog, selectedStepIndex);
        return new RunLogExport(
                Instant.now(clock).toString(),
                selectedStepIndex,
                selected.delta(),
                new RunLogExport.Diff(diff.newlyActive().size(), diff.dropped().size()),
                clamp.requested(),
                clamp.applied(),
                clamp.clampedFields(),
                runLog);
    }

    public String toJson(RunLogExport export) {
        try {
            return writer.writeValueAsString(export);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize export", e);
        }
    }

    public RunLogExport readExport(String json) {
        try {
            return mapper.readValue(json, RunLogExport.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Malformed export JSON", e);
        }
    }

    /** Writes the payload to {@code path}, replacing any existing file. */
    public void exportToFile(Path path, RunLogExport export) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null)
            Files.createDirectories(parent);
        Files.writeString(path, toJson(export));
        log.info("Exported runlog ({} steps) to {}", export.runlog().stepCount(), path);
    }
}
