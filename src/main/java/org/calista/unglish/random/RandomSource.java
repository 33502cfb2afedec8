package org.calista.unglish.random;

/**
 * Single source of randomness for one generation call.
 * Every stage draws through the instance held by the generation context, never through a global.
 */
public interface RandomSource {

    /** @return a value in [0, 1) */
    double nextDouble();

    /**
     * Percent chance helper. Equivalent to a weighted draw over {true: percent, false: 100 - percent}.
     */
    default boolean chance(double percent) {
        return nextDouble() * 100.0 < percent;
    }
}
