package org.drwfalls.runtime.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A virus. Viruses only ever live in the {@link StaticField} and are only removed by elimination.
 *
 * @param colour the virus' colour
 */
public record Virus(Colour colour) implements TileContents {

    public Virus {
        Objects.requireNonNull(colour, "colour");
    }

    @Override
    public Optional<Colour> tileColour() {
        return Optional.of(colour);
    }
}
