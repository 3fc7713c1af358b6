package org.drwfalls.runtime.model;

import org.drwfalls.runtime.Config;

import java.util.Optional;

/**
 * Index of a column in a field, from {@code 0} (leftmost) to {@code FIELD_WIDTH - 1} (rightmost).
 *
 * @param value the column number
 */
public record ColumnIndex(int value) implements IFieldIndex<ColumnIndex> {

    public static final ColumnIndex LEFTMOST_COLUMN = new ColumnIndex(0);

    public static final ColumnIndex RIGHTMOST_COLUMN = new ColumnIndex(Config.FIELD_WIDTH - 1);

    /**
     * All columns, left to right.
     */
    public static final IndexRange<ColumnIndex> COLUMNS = new IndexRange<>(LEFTMOST_COLUMN, RIGHTMOST_COLUMN);

    public ColumnIndex {
        if (value < 0 || value >= Config.FIELD_WIDTH) {
            throw new IndexOutOfBoundsException("Column index out of range: " + value);
        }
    }

    /**
     * Creates a column index.
     *
     * @param value the column number
     * @return the index
     * @throws IndexOutOfBoundsException if {@code value} is not a valid column
     */
    public static ColumnIndex of(int value) {
        return new ColumnIndex(value);
    }

    /**
     * Creates a column index if the value is in range.
     *
     * @param value the column number
     * @return the index, or empty if {@code value} is not a valid column
     */
    public static Optional<ColumnIndex> tryFrom(int value) {
        return value >= 0 && value < Config.FIELD_WIDTH ? Optional.of(new ColumnIndex(value)) : Optional.empty();
    }

    @Override
    public Optional<ColumnIndex> forwardChecked(int count) {
        return tryFrom(value + count);
    }

    @Override
    public Optional<ColumnIndex> backwardChecked(int count) {
        return tryFrom(value - count);
    }

    @Override
    public String toString() {
        return "column " + value;
    }
}
