package com.putman.sim.engine;

import com.putman.sim.util.Rounding;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Delta between consecutive activation vectors: the L2 distance, treating a key
 * missing on either side as 0.
 */
public final class ShiftMetric {
    private ShiftMetric() {
        // Utility class
    }

    public static double l2(Map<String, Double> a, Map<String, Double> b) {
        Set<String> keys = new LinkedHashSet<>(a.keySet());
        keys.addAll(b.keySet());
        double sum = 0.0;
        for (String key : keys) {
            double diff = a.getOrDefault(key, 0.0) - b.getOrDefault(key, 0.0);
            sum += diff * diff;
        }
        return Math.sqrt(sum);
    }

    /**
     * Stored delta of a step: exactly 0 without a previous vector, otherwise the
     * L2 distance rounded to 3 decimals.
     */
    public static double delta(Map<String, Double> previous, Map<String, Double> current) {
        if (previous == null)
            return 0.0;
        return Rounding.round3(l2(previous, current));
    }
}
