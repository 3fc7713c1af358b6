package org.drwfalls.runtime.model;

/**
 * Index of a row in a {@link MovingField} which follows the row as it moves down.
 * <p>
 * The index refers to a physical row of the field's backing storage, so it stays valid
 * across invocations of {@link MovingField#tick()}. Use
 * {@link MovingField#rowIndexFromMoving(MovingRowIndex)} to find out where the row currently is.
 */
public final class MovingRowIndex {

    private final int slot;

    MovingRowIndex(int slot) {
        this.slot = slot;
    }

    int slot() {
        return slot;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof MovingRowIndex that && slot == that.slot;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(slot);
    }

    @Override
    public String toString() {
        return "MovingRowIndex[slot=" + slot + "]";
    }
}
