package org.drwfalls.runtime;

/**
 * Provides the fixed geometry and rule constants of a playing field.
 * This final class contains static constants only. It is not meant to be instantiated.
 * Tunable round parameters (virus count, cascade cap, seed) are loaded at runtime,
 * see {@link FieldSettings}.
 */
public final class Config {

    /**
     * Private constructor to prevent instantiation of this utility class.
     */
    private Config() {}

    /**
     * The number of columns of a field.
     */
    public static final int FIELD_WIDTH = 8;

    /**
     * The number of rows of a field.
     */
    public static final int FIELD_HEIGHT = 16;

    /**
     * The minimum number of same-coloured tiles in a row or column which are eliminated.
     */
    public static final int ROW_OF_FOUR_LENGTH = 4;
}
