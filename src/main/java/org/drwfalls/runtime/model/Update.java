package org.drwfalls.runtime.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A single change to be rendered: draw a colour at a position, or clear it.
 * Lists of updates must be applied in order.
 *
 * @param position the affected tile
 * @param colour the colour to draw, or {@code null} to clear the tile
 */
public record Update(Position position, Colour colour) {

    public Update {
        Objects.requireNonNull(position, "position");
    }

    public static Update draw(Position position, Colour colour) {
        return new Update(position, Objects.requireNonNull(colour, "colour"));
    }

    public static Update clear(Position position) {
        return new Update(position, null);
    }

    public Optional<Colour> drawnColour() {
        return Optional.ofNullable(colour);
    }

    public boolean isClear() {
        return colour == null;
    }
}
