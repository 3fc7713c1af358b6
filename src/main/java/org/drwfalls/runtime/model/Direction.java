package org.drwfalls.runtime.model;

/**
 * One of the four directions to a neighbouring tile.
 * Rotation follows the screen orientation, i.e. clockwise goes from {@link #ABOVE} to {@link #RIGHT}.
 */
public enum Direction {
    LEFT(0, -1),
    RIGHT(0, 1),
    ABOVE(-1, 0),
    BELOW(1, 0);

    private final int rowDelta;
    private final int columnDelta;

    Direction(int rowDelta, int columnDelta) {
        this.rowDelta = rowDelta;
        this.columnDelta = columnDelta;
    }

    public int rowDelta() {
        return rowDelta;
    }

    public int columnDelta() {
        return columnDelta;
    }

    /**
     * Returns the direction rotated by 90 degrees clockwise.
     *
     * @return the rotated direction
     */
    public Direction rotatedCw() {
        return switch (this) {
            case ABOVE -> RIGHT;
            case RIGHT -> BELOW;
            case BELOW -> LEFT;
            case LEFT -> ABOVE;
        };
    }

    /**
     * Returns the direction rotated by 90 degrees counter-clockwise.
     *
     * @return the rotated direction
     */
    public Direction rotatedCcw() {
        return switch (this) {
            case ABOVE -> LEFT;
            case LEFT -> BELOW;
            case BELOW -> RIGHT;
            case RIGHT -> ABOVE;
        };
    }

    public Direction opposite() {
        return rotatedCw().rotatedCw();
    }
}
