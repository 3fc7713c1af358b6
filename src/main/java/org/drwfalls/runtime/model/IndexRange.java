package org.drwfalls.runtime.model;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * An inclusive range of field indices.
 * <p>
 * The range is empty if {@code last} precedes {@code first}. Iteration is ascending,
 * {@link #descending()} provides the reverse order.
 *
 * @param first the first index, inclusive
 * @param last the last index, inclusive
 * @param <I> the index type
 */
public record IndexRange<I extends IFieldIndex<I>>(I first, I last) implements Iterable<I> {

    public IndexRange {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(last, "last");
    }

    /**
     * Returns the number of indices in this range.
     *
     * @return the length, {@code 0} for an empty range
     */
    public int size() {
        return Math.max(0, last.value() - first.value() + 1);
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Checks whether the given index lies within this range.
     *
     * @param index the index to check
     * @return true if {@code first <= index <= last}
     */
    public boolean contains(I index) {
        return first.compareTo(index) <= 0 && index.compareTo(last) <= 0;
    }

    @Override
    public Iterator<I> iterator() {
        return new Cursor<>(isEmpty() ? null : first, last, true);
    }

    /**
     * Returns the indices of this range from {@code last} down to {@code first}.
     *
     * @return a reversed view of this range
     */
    public Iterable<I> descending() {
        return () -> new Cursor<>(isEmpty() ? null : last, first, false);
    }

    public Stream<I> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    private static final class Cursor<I extends IFieldIndex<I>> implements Iterator<I> {
        private I next;
        private final I end;
        private final boolean forward;

        Cursor(I start, I end, boolean forward) {
            this.next = start;
            this.end = end;
            this.forward = forward;
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public I next() {
            if (next == null) {
                throw new NoSuchElementException();
            }
            I current = next;
            if (current.equals(end)) {
                next = null;
            } else {
                Optional<I> step = forward ? current.forwardChecked(1) : current.backwardChecked(1);
                next = step.orElse(null);
            }
            return current;
        }
    }
}
