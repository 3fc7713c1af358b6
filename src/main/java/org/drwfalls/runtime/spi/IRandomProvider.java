package org.drwfalls.runtime.spi;

/**
 * Provides deterministic randomness for field preparation and capsule colours.
 * Implementations should be pure with respect to the provided seed and
 * support derivation of child providers for independent sub-streams.
 */
public interface IRandomProvider {

    /**
     * Returns a random integer in the range [0, bound).
     *
     * @param bound exclusive upper bound, must be > 0
     * @return the random int
     */
    int nextInt(int bound);

    /**
     * Returns a random boolean.
     *
     * @return the random boolean
     */
    boolean nextBoolean();

    /**
     * Returns a random double in the range [0.0, 1.0).
     *
     * @return the random double
     */
    double nextDouble();

    /**
     * Creates a derived provider that is deterministically based on this provider and the given scope/key.
     * Use this to create independent sub-streams (e.g., one per player field).
     *
     * @param scope a stable, descriptive scope name (e.g., "player", "preparation")
     * @param key a stable numeric key (e.g., player number)
     * @return a derived random provider
     */
    IRandomProvider deriveFor(String scope, long key);
}
