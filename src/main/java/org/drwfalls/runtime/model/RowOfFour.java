package org.drwfalls.runtime.model;

import org.drwfalls.runtime.Config;

import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;

/**
 * A horizontal or vertical run of tiles, as found by {@link #find(IFieldReader, Position)}.
 * <p>
 * Runs are value types: two runs covering the same tiles are equal regardless of which
 * hint they were found from.
 */
public sealed interface RowOfFour extends Iterable<Position> permits RowOfFour.Horizontal, RowOfFour.Vertical {

    /**
     * Returns the number of tiles in this run.
     *
     * @return the run length
     */
    int length();

    /**
     * Checks whether the given position is part of this run.
     *
     * @param position the position to check
     * @return true if the run covers the position
     */
    boolean covers(Position position);

    /**
     * A run within a single row.
     *
     * @param row the row
     * @param columns the covered columns
     */
    record Horizontal(RowIndex row, IndexRange<ColumnIndex> columns) implements RowOfFour {

        public Horizontal {
            Objects.requireNonNull(row, "row");
            Objects.requireNonNull(columns, "columns");
        }

        @Override
        public int length() {
            return columns.size();
        }

        @Override
        public boolean covers(Position position) {
            return position.row().equals(row) && columns.contains(position.column());
        }

        @Override
        public Iterator<Position> iterator() {
            return columns.stream().map(c -> new Position(row, c)).iterator();
        }
    }

    /**
     * A run within a single column.
     *
     * @param column the column
     * @param rows the covered rows
     */
    record Vertical(ColumnIndex column, IndexRange<RowIndex> rows) implements RowOfFour {

        public Vertical {
            Objects.requireNonNull(column, "column");
            Objects.requireNonNull(rows, "rows");
        }

        @Override
        public int length() {
            return rows.size();
        }

        @Override
        public boolean covers(Position position) {
            return position.column().equals(column) && rows.contains(position.row());
        }

        @Override
        public Iterator<Position> iterator() {
            return rows.stream().map(r -> new Position(r, column)).iterator();
        }
    }

    /**
     * Finds a row of four or more tiles of the same colour which includes the hint.
     * <p>
     * The maximal horizontal run through the hint is considered first. Only if it is
     * shorter than {@link Config#ROW_OF_FOUR_LENGTH} the maximal vertical run is considered.
     *
     * @param field the field to inspect
     * @param hint the position the run must include
     * @return the run and its colour, or empty if there is none or the hint shows no colour
     */
    static Optional<ColouredRun> find(IFieldReader field, Position hint) {
        return field.colourAt(hint).flatMap(colour -> {
            Position left = extent(field, hint, colour, Direction.LEFT);
            Position right = extent(field, hint, colour, Direction.RIGHT);
            RowOfFour horizontal = new Horizontal(hint.row(), new IndexRange<>(left.column(), right.column()));
            if (horizontal.length() >= Config.ROW_OF_FOUR_LENGTH) {
                return Optional.of(new ColouredRun(colour, horizontal));
            }

            Position top = extent(field, hint, colour, Direction.ABOVE);
            Position bottom = extent(field, hint, colour, Direction.BELOW);
            RowOfFour vertical = new Vertical(hint.column(), new IndexRange<>(top.row(), bottom.row()));
            if (vertical.length() >= Config.ROW_OF_FOUR_LENGTH) {
                return Optional.of(new ColouredRun(colour, vertical));
            }
            return Optional.empty();
        });
    }

    /**
     * Walks from {@code start} towards {@code direction} while the colour matches.
     *
     * @return the last matching position
     */
    private static Position extent(IFieldReader field, Position start, Colour colour, Direction direction) {
        Position current = start;
        Optional<Position> next = current.neighbour(direction);
        while (next.isPresent() && next.flatMap(field::colourAt).filter(colour::equals).isPresent()) {
            current = next.get();
            next = current.neighbour(direction);
        }
        return current;
    }
}
