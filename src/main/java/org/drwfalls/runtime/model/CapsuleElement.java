package org.drwfalls.runtime.model;

import java.util.Objects;
import java.util.Optional;

/**
 * One half of a capsule.
 * <p>
 * An element may be bound to a partner in a neighbouring tile. The partner's own
 * direction always points back to this element. An element whose partner was eliminated
 * is unbound and falls on its own.
 */
public final class CapsuleElement implements TileContents {

    private final Colour colour;
    private Direction partner;

    /**
     * Creates a capsule element.
     *
     * @param colour the element's colour
     * @param partner direction of the bound partner, or {@code null} for a single element
     */
    public CapsuleElement(Colour colour, Direction partner) {
        this.colour = Objects.requireNonNull(colour, "colour");
        this.partner = partner;
    }

    /**
     * Creates an unbound capsule element.
     *
     * @param colour the element's colour
     * @return the new element
     */
    public static CapsuleElement single(Colour colour) {
        return new CapsuleElement(colour, null);
    }

    public Colour colour() {
        return colour;
    }

    /**
     * Returns the direction of the bound partner.
     *
     * @return the direction, or empty if the element is unbound
     */
    public Optional<Direction> partner() {
        return Optional.ofNullable(partner);
    }

    public boolean isBound() {
        return partner != null;
    }

    /**
     * Rebinds this element to a partner in the given direction.
     *
     * @param direction the partner's direction, must not be null
     */
    public void bindTo(Direction direction) {
        this.partner = Objects.requireNonNull(direction, "direction");
    }

    /**
     * Releases the element from its partner.
     */
    public void unbind() {
        this.partner = null;
    }

    @Override
    public Optional<Colour> tileColour() {
        return Optional.of(colour);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CapsuleElement that)) return false;
        return colour == that.colour && partner == that.partner;
    }

    @Override
    public int hashCode() {
        return Objects.hash(colour, partner);
    }

    @Override
    public String toString() {
        return "CapsuleElement[" + colour + (partner != null ? ", partner=" + partner : "") + "]";
    }
}
