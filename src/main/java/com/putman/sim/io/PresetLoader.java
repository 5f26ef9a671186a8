package com.putman.sim.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Loads parameter presets from JSON.
 *
 * <p>
 * Beyond JSON binding the only check is on the field set: the {@code params}
 * object must contain exactly the fields of {@link ParameterField}. Range
 * handling is left to {@link ParameterClamp} and the engine's validation.
 *
 * <p>
 * Built-in presets are classpath resources under {@code /presets/}.
 */
@Log4j2
public final class PresetLoader {
    public static final List<String> BUILT_IN_NAMES = List.of("stable", "drift", "collapse");

    private static final String RESOURCE_DIR = "/presets/";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private PresetLoader() {
        // Utility class
    }

    /** Loads a built-in preset by name. */
    public static PresetDefinition builtIn(String name) throws IOException {
        if (!BUILT_IN_NAMES.contains(name))
            throw new IllegalArgumentException("Unknown preset: " + name + " (known: " + BUILT_IN_NAMES + ")");
        try (InputStream in = PresetLoader.class.getResourceAsStream(RESOURCE_DIR + name + ".json")) {
            if (in == null)
                throw new IOException("Preset resource missing from classpath: " + name);
            return bind(MAPPER.readTree(in));
        }
    }

    /** Parses a preset file. */
    public static PresetDefinition load(Path path) throws IOException {
        log.debug("Loading preset from {}", path);
        return bind(MAPPER.readTree(Files.readString(path)));
    }

    /** Parses a preset JSON string. */
    public static PresetDefinition parse(String json) {
        try {
            return bind(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Malformed preset JSON", e);
        }
    }

    private static PresetDefinition bind(JsonNode root) throws JsonProcessingException {
        if (root == null || !root.isObject())
            throw new IllegalArgumentException("Preset must be a JSON object");
        JsonNode params = root.get("params");
        if (params == null || !params.isObject())
            throw new IllegalArgumentException("Missing 'params' key");

        Set<ParameterField> seen = EnumSet.noneOf(ParameterField.class);
        for (Iterator<String> it = params.fieldNames(); it.hasNext();) {
            String field = it.next();
            if (!params.get(field).isNumber())
                throw new IllegalArgumentException("Parameter '" + field + "' must be a number");
            seen.add(ParameterField.fromJsonName(field));
        }
        Set<ParameterField> missing = EnumSet.complementOf(EnumSet.copyOf(seen));
        if (!missing.isEmpty()) {
            List<String> names = missing.stream().map(ParameterField::jsonName).toList();
            throw new IllegalArgumentException("Missing parameter fields: " + names);
        }

        return MAPPER.treeToValue(root, PresetDefinition.class);
    }
}
