package org.drwfalls.runtime.capsule;

/**
 * A player's request to move the controlled capsule.
 */
public enum Movement {
    LEFT,
    RIGHT,
    ROTATE_CW,
    ROTATE_CCW
}
