package org.drwfalls.runtime.model;

import java.util.Optional;

/**
 * Contents of a single tile of a {@link StaticField}: nothing, a capsule element or a virus.
 */
public sealed interface TileContents extends IColoured permits TileContents.Empty, CapsuleElement, Virus {

    /**
     * The contents of an unoccupied tile.
     */
    TileContents EMPTY = Empty.INSTANCE;

    /**
     * Checks whether the tile is occupied.
     *
     * @return false only for {@link #EMPTY}
     */
    default boolean isOccupied() {
        return this != EMPTY;
    }

    /**
     * Returns the capsule element held by the tile, if any.
     *
     * @return the element, or empty for viruses and unoccupied tiles
     */
    default Optional<CapsuleElement> asElement() {
        return this instanceof CapsuleElement element ? Optional.of(element) : Optional.empty();
    }

    /**
     * Returns the virus held by the tile, if any.
     *
     * @return the virus, or empty for capsule elements and unoccupied tiles
     */
    default Optional<Virus> asVirus() {
        return this instanceof Virus virus ? Optional.of(virus) : Optional.empty();
    }

    /**
     * Marker for an unoccupied tile.
     */
    enum Empty implements TileContents {
        INSTANCE;

        @Override
        public Optional<Colour> tileColour() {
            return Optional.empty();
        }
    }
}
