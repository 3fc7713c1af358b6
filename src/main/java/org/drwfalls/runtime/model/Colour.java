package org.drwfalls.runtime.model;

import org.drwfalls.runtime.spi.IRandomProvider;

/**
 * Colour of a capsule element or a virus.
 */
public enum Colour {
    RED,
    YELLOW,
    BLUE;

    private static final Colour[] VALUES = values();

    /**
     * Returns the next colour in a fixed three-cycle.
     * Three rotations in the same direction return the original colour; the two
     * intermediate results differ from it and from each other.
     *
     * @param forward the direction of the cycle
     * @return the rotated colour
     */
    public Colour rotate(boolean forward) {
        int step = forward ? 1 : VALUES.length - 1;
        return VALUES[(ordinal() + step) % VALUES.length];
    }

    /**
     * Samples a colour uniformly.
     *
     * @param random the source of randomness
     * @return a random colour
     */
    public static Colour random(IRandomProvider random) {
        return VALUES[random.nextInt(VALUES.length)];
    }
}
