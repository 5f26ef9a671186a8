package com.putman.sim.engine;

import com.putman.sim.api.RandomSource;

/**
 * Counter-based mix-and-avalanche generator over 32-bit state.
 *
 * <p>
 * Each draw adds a fixed odd increment to the running state and runs two
 * multiply/xor-shift avalanche rounds over it. The output is a pure function of
 * (seed, call index), which lets each consumer seed its own instance from a
 * derived value ({@code seed}, {@code seed + step + 1}) and replay any step in
 * isolation.
 *
 * <p>
 * Not thread-safe; instances are never shared between runs.
 */
public final class HashRng implements RandomSource {
    private static final int INCREMENT = 0x6D2B79F5;
    private static final double TWO_POW_32 = 4294967296.0;

    private int state;

    /**
     * @param seed interpreted as an unsigned 32-bit value; higher bits are
     *             dropped so derived seeds wrap modulo 2^32.
     */
    public HashRng(long seed) {
        this.state = (int) seed;
    }

    @Override
    public double next() {
        state += INCREMENT;
        int t = state;
        t = (t ^ (t >>> 15)) * (t | 1);
        t ^= t + (t ^ (t >>> 7)) * (t | 61);
        return Integer.toUnsignedLong(t ^ (t >>> 14)) / TWO_POW_32;
    }
}
