package org.drwfalls.runtime.model;

import java.util.Optional;

/**
 * Something that occupies a tile and may show a colour there.
 */
public interface IColoured {

    /**
     * Returns the colour shown on the tile.
     *
     * @return the colour, or empty if nothing is shown
     */
    Optional<Colour> tileColour();
}
