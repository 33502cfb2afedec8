package org.calista.unglish.random.impl;

import org.calista.unglish.random.RandomSource;

/**
 * Mulberry32: tiny 32-bit state PRNG. Same seed, same stream, on every platform.
 * Not thread-safe; one instance per generation call.
 */
public final class Mulberry32 implements RandomSource {

    private static final double TWO_POW_32 = 4294967296.0;

    private int state;

    public Mulberry32(int seed) {
        this.state = seed;
    }

    /** Seeds wider than 32 bits are folded, so {@code seed + index} stays usable for long batch seeds. */
    public static Mulberry32 of(long seed) {
        return new Mulberry32((int) (seed ^ (seed >>> 32)));
    }

    @Override
    public double nextDouble() {
        state += 0x6D2B79F5;
        int r = (state ^ (state >>> 15)) * (1 | state);
        r = (r + ((r ^ (r >>> 7)) * (61 | r))) ^ r;
        return Integer.toUnsignedLong(r ^ (r >>> 14)) / TWO_POW_32;
    }

    @Override
    public String toString() {
        return "Mulberry32{state=" + Integer.toHexString(state) + '}';
    }
}
