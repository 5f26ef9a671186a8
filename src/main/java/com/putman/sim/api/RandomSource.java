package com.putman.sim.api;

import java.util.List;

/**
 * A reproducible stream of pseudo-random values.
 *
 * Implementations must be pure functions of (seed, call index): two instances
 * built from the same seed and driven through the same call sequence yield the
 * same values. No state may be shared between independently seeded instances,
 * which is what lets every step of a run be replayed on its own.
 */
public interface RandomSource {

    /**
     * Returns the next value of the stream.
     *
     * @return a double in [0, 1).
     */
    double next();

    /**
     * Returns an integer in [0, bound), derived from a single call to
     * {@link #next()}.
     *
     * @param bound exclusive upper bound, must be positive.
     */
    default int intBelow(int bound) {
        if (bound <= 0)
            throw new IllegalArgumentException("bound must be positive: " + bound);
        return (int) Math.floor(next() * bound);
    }

    /**
     * Picks one element of a non-empty list using {@link #intBelow(int)}.
     */
    default <T> T pick(List<T> items) {
        if (items.isEmpty())
            throw new IllegalArgumentException("Cannot pick from an empty list");
        return items.get(intBelow(items.size()));
    }
}
