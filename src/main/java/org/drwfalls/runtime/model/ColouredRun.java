package org.drwfalls.runtime.model;

import java.util.Objects;

/**
 * A run of tiles together with the colour they share.
 *
 * @param colour the shared colour
 * @param row the tiles
 */
public record ColouredRun(Colour colour, RowOfFour row) {

    public ColouredRun {
        Objects.requireNonNull(colour, "colour");
        Objects.requireNonNull(row, "row");
    }
}
