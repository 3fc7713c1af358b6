package org.drwfalls.runtime.model;

import org.drwfalls.runtime.Config;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Field of unsettled, falling capsule elements.
 * <p>
 * Rows are kept in a ring: a {@link #tick()} only shifts the offset which maps logical
 * rows to physical rows, so moving every element down one row costs O(1). The former
 * bottom row becomes the new top row. Callers always address tiles by logical
 * {@link Position} and never observe the remapping.
 */
public class MovingField implements IFieldReader {

    private final CapsuleElement[][] rows;
    private int offset;

    /**
     * Creates an empty field.
     */
    public MovingField() {
        this.rows = new CapsuleElement[Config.FIELD_HEIGHT][Config.FIELD_WIDTH];
        this.offset = 0;
    }

    /**
     * Moves all elements down one position.
     * <p>
     * The returned updates reflect the new state, bottom row first: every element is
     * drawn at its new position and every tile vacated by an element is cleared.
     * The caller is responsible for settling elements beforehand; an element left in the
     * bottom row would wrap around to the top.
     *
     * @return the updates, to be applied in order
     */
    public List<Update> tick() {
        offset = offset == 0 ? rows.length - 1 : offset - 1;

        List<Update> updates = new ArrayList<>();
        for (RowIndex row : RowIndex.ROWS.descending()) {
            for (Position position : Position.completeRow(row)) {
                CapsuleElement element = getRaw(position);
                if (element != null) {
                    updates.add(Update.draw(position, element.colour()));
                } else if (position.neighbour(Direction.BELOW).map(this::isOccupied).orElse(false)) {
                    updates.add(Update.clear(position));
                }
            }
        }
        return updates;
    }

    /**
     * Spawns single, unbound capsule elements in the current top row.
     *
     * @param capsules the columns and colours of the new elements
     * @return one update per spawned element
     */
    public List<Update> spawnSingleCapsules(List<SingleCapsule> capsules) {
        List<Update> updates = new ArrayList<>(capsules.size());
        for (SingleCapsule capsule : capsules) {
            Position position = new Position(RowIndex.TOP_ROW, capsule.column());
            set(position, CapsuleElement.single(capsule.colour()));
            updates.add(Update.draw(position, capsule.colour()));
        }
        return updates;
    }

    public Optional<CapsuleElement> get(Position position) {
        return Optional.ofNullable(getRaw(position));
    }

    public void set(Position position, CapsuleElement element) {
        rows[transform(position.row())][position.column().value()] = Objects.requireNonNull(element, "element");
    }

    /**
     * Takes the element at the given position, leaving the tile unoccupied.
     *
     * @param position the tile
     * @return the element, or empty if there was none
     */
    public Optional<CapsuleElement> take(Position position) {
        int slot = transform(position.row());
        CapsuleElement element = rows[slot][position.column().value()];
        rows[slot][position.column().value()] = null;
        return Optional.ofNullable(element);
    }

    public boolean isOccupied(Position position) {
        return getRaw(position) != null;
    }

    /**
     * Checks whether any tile of the given row holds an element.
     *
     * @param row the row
     * @return true if the row is not empty
     */
    public boolean isRowOccupied(RowIndex row) {
        for (CapsuleElement element : rows[transform(row)]) {
            if (element != null) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Optional<Colour> colourAt(Position position) {
        return get(position).map(CapsuleElement::colour);
    }

    /**
     * Creates a {@link MovingRowIndex} for the row currently at the given logical row.
     *
     * @param row the logical row
     * @return an index tracking that row across ticks
     */
    public MovingRowIndex movingRowIndex(RowIndex row) {
        return new MovingRowIndex(transform(row));
    }

    /**
     * Converts a {@link MovingRowIndex} back to the logical row it currently occupies.
     *
     * @param index the moving index
     * @return the logical row
     * @throws IllegalStateException if the index does not map to a valid row
     */
    public RowIndex rowIndexFromMoving(MovingRowIndex index) {
        int row = (index.slot() + rows.length - offset) % rows.length;
        return RowIndex.tryFrom(row).orElseThrow(() -> new IllegalStateException(
                "Failed to transform " + index + " to a plain row index (offset " + offset + ")"));
    }

    /**
     * Counts the elements in the field.
     *
     * @return the number of falling elements
     */
    public int elementCount() {
        int count = 0;
        for (CapsuleElement[] row : rows) {
            for (CapsuleElement element : row) {
                if (element != null) {
                    count++;
                }
            }
        }
        return count;
    }

    private CapsuleElement getRaw(Position position) {
        return rows[transform(position.row())][position.column().value()];
    }

    private int transform(RowIndex row) {
        return (row.value() + offset) % rows.length;
    }
}
