package org.drwfalls.runtime.model;

import java.util.Optional;

/**
 * A bounded index into one dimension of a field.
 * <p>
 * Implementations are immutable value types. Stepping beyond the field's bounds yields
 * an empty {@link Optional} rather than an exception, which lets callers treat grid edges
 * as ordinary outcomes.
 *
 * @param <I> the concrete index type
 */
public interface IFieldIndex<I extends IFieldIndex<I>> extends Comparable<I> {

    /**
     * Returns the plain integer value of this index.
     *
     * @return the value, {@code 0} for the top row or leftmost column
     */
    int value();

    /**
     * Returns the index {@code count} steps further (down or to the right).
     *
     * @param count number of steps, must be non-negative
     * @return the resulting index, or empty if it would lie outside the field
     */
    Optional<I> forwardChecked(int count);

    /**
     * Returns the index {@code count} steps back (up or to the left).
     *
     * @param count number of steps, must be non-negative
     * @return the resulting index, or empty if it would lie outside the field
     */
    Optional<I> backwardChecked(int count);

    /**
     * Returns the number of forward steps from {@code start} to {@code end}.
     *
     * @param start the first index
     * @param end the last index
     * @return the step count, or empty if {@code end} precedes {@code start}
     */
    static <I extends IFieldIndex<I>> Optional<Integer> stepsBetween(I start, I end) {
        int steps = end.value() - start.value();
        return steps >= 0 ? Optional.of(steps) : Optional.empty();
    }

    @Override
    default int compareTo(I other) {
        return Integer.compare(value(), other.value());
    }
}
