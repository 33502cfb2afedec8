package org.calista.unglish.random;

import java.util.List;
import java.util.Objects;

/**
 * Linear-scan weighted draw for ad-hoc call sites.
 * Weights are relative and need not sum to 1.
 */
public final class WeightedChoice {

    private WeightedChoice() {
    }

    public static <T> T pick(List<Weighted<T>> options, RandomSource rng) {
        return draw(options, rng).item;
    }

    /**
     * Draws one option and reports the raw roll so trace recorders can show it.
     */
    public static <T> Draw<T> draw(List<Weighted<T>> options, RandomSource rng) {
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(rng, "rng");

        double total = totalWeight(options);
        double roll = rng.nextDouble();
        double target = roll * total;

        double cumulative = 0.0;
        for (int i = 0; i < options.size(); i++) {
            cumulative += options.get(i).weight;
            if (target < cumulative) return new Draw<>(options.get(i).item, i, roll);
        }
        // floating point slack: the last positive option absorbs it
        for (int i = options.size() - 1; i >= 0; i--) {
            if (options.get(i).weight > 0) return new Draw<>(options.get(i).item, i, roll);
        }
        throw new IllegalStateException("unreachable: total weight " + total);
    }

    static double totalWeight(List<? extends Weighted<?>> options) {
        if (options.isEmpty()) throw new IllegalArgumentException("weighted choice over an empty list");
        double total = 0.0;
        for (Weighted<?> w : options) {
            if (!(w.weight >= 0.0) || !Double.isFinite(w.weight)) {
                throw new IllegalArgumentException("invalid weight " + w.weight + " for " + w.item);
            }
            total += w.weight;
        }
        if (!(total > 0.0)) throw new IllegalArgumentException("total weight must be > 0 (options=" + options + ")");
        return total;
    }

    /** Result of one draw: chosen value, its index and the uniform roll that selected it. */
    public static final class Draw<T> {
        public final T item;
        public final int index;
        public final double roll;

        Draw(T item, int index, double roll) {
            this.item = item;
            this.index = index;
            this.roll = roll;
        }
    }
}
