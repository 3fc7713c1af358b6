package org.drwfalls.runtime.model;

import org.drwfalls.runtime.Config;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Field of settled elements: viruses and capsule elements which currently do not move.
 */
public class StaticField implements IFieldReader {

    private final TileContents[][] tiles;

    /**
     * Creates an empty field.
     */
    public StaticField() {
        this.tiles = new TileContents[Config.FIELD_HEIGHT][Config.FIELD_WIDTH];
        for (TileContents[] row : tiles) {
            Arrays.fill(row, TileContents.EMPTY);
        }
    }

    /**
     * Creates a field holding a virus for each placement.
     *
     * @param placements where to put which virus
     * @return the new field
     */
    public static StaticField fromViruses(Iterable<VirusPlacement> placements) {
        StaticField field = new StaticField();
        for (VirusPlacement placement : placements) {
            field.set(placement.position(), new Virus(placement.colour()));
        }
        return field;
    }

    public TileContents get(Position position) {
        return tiles[position.row().value()][position.column().value()];
    }

    public void set(Position position, TileContents contents) {
        tiles[position.row().value()][position.column().value()] = Objects.requireNonNull(contents, "contents");
    }

    /**
     * Takes the tile's contents, leaving it unoccupied.
     *
     * @param position the tile
     * @return the previous contents
     */
    public TileContents take(Position position) {
        TileContents contents = get(position);
        set(position, TileContents.EMPTY);
        return contents;
    }

    public boolean isOccupied(Position position) {
        return get(position).isOccupied();
    }

    /**
     * Returns the capsule element at the given position, if any.
     *
     * @param position the tile
     * @return the element, or empty if the tile is unoccupied or holds a virus
     */
    public Optional<CapsuleElement> elementAt(Position position) {
        return get(position).asElement();
    }

    @Override
    public Optional<Colour> colourAt(Position position) {
        return get(position).tileColour();
    }

    /**
     * Checks whether the player owning this field is defeated, i.e. whether any tile in the top row is occupied.
     *
     * @return true if the top row holds anything
     */
    public boolean isDefeated() {
        return Position.completeRow(RowIndex.TOP_ROW).stream().anyMatch(this::isOccupied);
    }

    /**
     * Counts the occupied tiles.
     *
     * @return the number of viruses and capsule elements in the field
     */
    public int occupiedCount() {
        int count = 0;
        for (TileContents[] row : tiles) {
            for (TileContents tile : row) {
                if (tile.isOccupied()) {
                    count++;
                }
            }
        }
        return count;
    }
}
