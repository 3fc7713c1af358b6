package org.drwfalls.runtime.model;

import java.util.Optional;

/**
 * Interface for reading tile colours from the different field implementations.
 * This allows the row-of-four detection to run on settled fields as well as on
 * the scratch fields used during preparation.
 */
public interface IFieldReader {

    /**
     * Reads the colour shown at the given position.
     *
     * @param position the position to read from
     * @return the colour, or empty if the tile shows none
     */
    Optional<Colour> colourAt(Position position);
}
