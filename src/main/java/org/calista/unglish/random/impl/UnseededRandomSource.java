package org.calista.unglish.random.impl;

import org.calista.unglish.random.RandomSource;

import java.util.SplittableRandom;

/**
 * Fallback when the caller supplies no seed. Output is not reproducible.
 * Each instance owns its own generator, so there is no shared mutable state between calls.
 */
public final class UnseededRandomSource implements RandomSource {

    private final SplittableRandom random;

    public UnseededRandomSource() {
        this.random = new SplittableRandom();
    }

    @Override
    public double nextDouble() {
        return random.nextDouble();
    }
}
