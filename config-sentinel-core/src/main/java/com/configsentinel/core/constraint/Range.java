package com.configsentinel.core.constraint;

import java.util.Objects;

/**
 * Inclusive {@code [low, high]} domain for value constraints.
 *
 * @param low lower bound, inclusive
 * @param high upper bound, inclusive
 * @param <T> comparable bound type
 */
public record Range<T extends Comparable<? super T>>(
    T low,
    T high
) {
    /**
     * Compact constructor with validation.
     */
    public Range {
        Objects.requireNonNull(low, "low must not be null");
        Objects.requireNonNull(high, "high must not be null");
        if (low.compareTo(high) > 0) {
            throw new IllegalArgumentException(
                "Range lower bound must be less than or equal to upper bound. Passed low: " + low + " high: " + high);
        }
    }

    public static <T extends Comparable<? super T>> Range<T> of(T low, T high) {
        return new Range<>(low, high);
    }

    /**
     * Checks whether a value lies in this range, both ends inclusive.
     *
     * @param value value to check
     * @return true if {@code low <= value <= high}
     */
    public boolean contains(T value) {
        return value.compareTo(low) >= 0 && value.compareTo(high) <= 0;
    }

    @Override
    public String toString() {
        return "[" + low + ", " + high + "]";
    }
}
