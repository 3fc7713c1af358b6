package org.drwfalls.runtime.model;

import java.util.Objects;

/**
 * A virus to be placed on a field before a round starts.
 *
 * @param position where the virus goes
 * @param colour the virus' colour
 */
public record VirusPlacement(Position position, Colour colour) {

    public VirusPlacement {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(colour, "colour");
    }

    public Update toUpdate() {
        return Update.draw(position, colour);
    }
}
