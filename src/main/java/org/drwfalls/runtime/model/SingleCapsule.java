package org.drwfalls.runtime.model;

import java.util.Objects;

/**
 * A single, unbound capsule element to be dropped into a field's top row.
 *
 * @param column the column to drop it in
 * @param colour its colour
 */
public record SingleCapsule(ColumnIndex column, Colour colour) {

    public SingleCapsule {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(colour, "colour");
    }
}
