package org.calista.unglish.random;

import java.util.Objects;

/**
 * Small immutable (value, weight) pair used by weighted draws and weight tables.
 */
public final class Weighted<T> {
    public final T item;
    public final double weight;

    public Weighted(T item, double weight) {
        this.item = item;
        this.weight = weight;
    }

    public static <T> Weighted<T> of(T item, double weight) {
        return new Weighted<>(item, weight);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Weighted<?> w)) return false;
        return Double.doubleToLongBits(weight) == Double.doubleToLongBits(w.weight)
                && Objects.equals(item, w.item);
    }

    @Override
    public int hashCode() {
        return Objects.hash(item, Double.doubleToLongBits(weight));
    }

    @Override
    public String toString() {
        return "Weighted{" + item + "=" + weight + '}';
    }
}
