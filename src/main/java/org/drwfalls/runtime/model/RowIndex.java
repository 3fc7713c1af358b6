package org.drwfalls.runtime.model;

import org.drwfalls.runtime.Config;

import java.util.Optional;

/**
 * Index of a row in a field, from {@code 0} (top row) to {@code FIELD_HEIGHT - 1} (bottom row).
 *
 * @param value the row number
 */
public record RowIndex(int value) implements IFieldIndex<RowIndex> {

    /**
     * Index of the top row.
     */
    public static final RowIndex TOP_ROW = new RowIndex(0);

    /**
     * Index of the bottom row.
     */
    public static final RowIndex BOTTOM_ROW = new RowIndex(Config.FIELD_HEIGHT - 1);

    /**
     * All rows, top to bottom.
     */
    public static final IndexRange<RowIndex> ROWS = new IndexRange<>(TOP_ROW, BOTTOM_ROW);

    public RowIndex {
        if (value < 0 || value >= Config.FIELD_HEIGHT) {
            throw new IndexOutOfBoundsException("Row index out of range: " + value);
        }
    }

    /**
     * Creates a row index.
     *
     * @param value the row number
     * @return the index
     * @throws IndexOutOfBoundsException if {@code value} is not a valid row
     */
    public static RowIndex of(int value) {
        return new RowIndex(value);
    }

    /**
     * Creates a row index if the value is in range.
     *
     * @param value the row number
     * @return the index, or empty if {@code value} is not a valid row
     */
    public static Optional<RowIndex> tryFrom(int value) {
        return value >= 0 && value < Config.FIELD_HEIGHT ? Optional.of(new RowIndex(value)) : Optional.empty();
    }

    @Override
    public Optional<RowIndex> forwardChecked(int count) {
        return tryFrom(value + count);
    }

    @Override
    public Optional<RowIndex> backwardChecked(int count) {
        return tryFrom(value - count);
    }

    @Override
    public String toString() {
        return "row " + value;
    }
}
