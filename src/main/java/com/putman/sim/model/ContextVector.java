package com.putman.sim.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-node context values in [0, 1], one entry per node, keyed in node order.
 *
 * The key order is fixed for the whole run; the context updater relies on it
 * to assign each entry its position index.
 */
public record ContextVector(Map<String, Double> values) {

    public ContextVector {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /** Returns the context value of {@code nodeId}, or 0 when absent. */
    public double valueOf(String nodeId) {
        Double v = values.get(nodeId);
        return v == null ? 0.0 : v;
    }

    public int size() {
        return values.size();
    }
}
