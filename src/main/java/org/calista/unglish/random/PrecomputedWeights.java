package org.calista.unglish.random;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Weight table with cumulative sums built once; each draw is a binary search.
 * Immutable after construction and safe to share across threads (the random source is per call).
 *
 * <p>Draw outcomes are identical to {@link WeightedChoice} for the same roll.</p>
 */
public final class PrecomputedWeights<T> {

    private final List<T> items;
    private final double[] cumulative;
    private final double total;

    private PrecomputedWeights(List<T> items, double[] cumulative, double total) {
        this.items = items;
        this.cumulative = cumulative;
        this.total = total;
    }

    public static <T> PrecomputedWeights<T> of(List<Weighted<T>> options) {
        Objects.requireNonNull(options, "options");
        double total = WeightedChoice.totalWeight(options);

        List<T> items = new ArrayList<>(options.size());
        double[] cumulative = new double[options.size()];
        double acc = 0.0;
        for (int i = 0; i < options.size(); i++) {
            acc += options.get(i).weight;
            cumulative[i] = acc;
            items.add(options.get(i).item);
        }
        return new PrecomputedWeights<>(Collections.unmodifiableList(items), cumulative, total);
    }

    /** Boolean branch table: {true: percent, false: 100 - percent}. */
    public static PrecomputedWeights<Boolean> chance(double percent) {
        double p = Math.max(0.0, Math.min(100.0, percent));
        return of(List.of(Weighted.of(Boolean.TRUE, p), Weighted.of(Boolean.FALSE, 100.0 - p)));
    }

    public T pick(RandomSource rng) {
        Objects.requireNonNull(rng, "rng");
        double target = rng.nextDouble() * total;

        // first index whose cumulative weight is strictly greater than target
        int low = 0;
        int high = cumulative.length - 1;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (cumulative[mid] <= target) low = mid + 1;
            else high = mid;
        }
        return items.get(low);
    }

    public List<T> items() {
        return items;
    }

    public double total() {
        return total;
    }

    public int size() {
        return items.size();
    }
}
