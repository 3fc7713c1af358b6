package org.drwfalls.runtime.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Position of a single tile in a field.
 *
 * @param row the tile's row
 * @param column the tile's column
 */
public record Position(RowIndex row, ColumnIndex column) {

    public Position {
        Objects.requireNonNull(row, "row");
        Objects.requireNonNull(column, "column");
    }

    /**
     * Convenience factory for plain integer coordinates.
     *
     * @param row the row number
     * @param column the column number
     * @return the position
     * @throws IndexOutOfBoundsException if either coordinate is outside the field
     */
    public static Position of(int row, int column) {
        return new Position(RowIndex.of(row), ColumnIndex.of(column));
    }

    /**
     * Returns the position of the neighbouring tile in the given direction.
     *
     * @param direction the direction to step in
     * @return the neighbour, or empty at the edge of the field
     */
    public Optional<Position> neighbour(Direction direction) {
        return RowIndex.tryFrom(row.value() + direction.rowDelta())
                .flatMap(r -> ColumnIndex.tryFrom(column.value() + direction.columnDelta())
                        .map(c -> new Position(r, c)));
    }

    /**
     * Returns all positions of a row, left to right.
     *
     * @param row the row
     * @return the positions of the row
     */
    public static List<Position> completeRow(RowIndex row) {
        List<Position> positions = new ArrayList<>(ColumnIndex.COLUMNS.size());
        for (ColumnIndex column : ColumnIndex.COLUMNS) {
            positions.add(new Position(row, column));
        }
        return positions;
    }

    /**
     * Returns all positions of the given rows, row by row in the order of {@code rows}.
     *
     * @param rows the rows to cover
     * @return the positions
     */
    public static List<Position> completeRows(Iterable<RowIndex> rows) {
        List<Position> positions = new ArrayList<>();
        for (RowIndex row : rows) {
            positions.addAll(completeRow(row));
        }
        return positions;
    }

    @Override
    public String toString() {
        return "(" + row.value() + ", " + column.value() + ")";
    }
}
