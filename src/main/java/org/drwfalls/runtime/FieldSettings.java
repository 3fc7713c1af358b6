package org.drwfalls.runtime;

import org.drwfalls.config.ConfigLoader;
import org.drwfalls.runtime.model.RowIndex;

import java.io.File;

/**
 * Round parameters of a player field.
 *
 * @param virusCount number of viruses placed at the start of a round
 * @param clearTopRows number of rows at the top kept free of viruses
 * @param maxCascadeTicks upper bound of ticks for {@link PlayerField#resolveCascade()}
 * @param seed seed of the random provider the round derives its streams from
 */
public record FieldSettings(int virusCount, int clearTopRows, int maxCascadeTicks, long seed) {

    /**
     * The configuration path holding the field settings.
     */
    public static final String CONFIG_PATH = "drwfalls.field";

    public FieldSettings {
        if (clearTopRows < 0 || clearTopRows >= Config.FIELD_HEIGHT) {
            throw new IllegalArgumentException("clearTopRows must be between 0 and " + (Config.FIELD_HEIGHT - 1) + ": " + clearTopRows);
        }
        int area = (Config.FIELD_HEIGHT - clearTopRows) * Config.FIELD_WIDTH;
        if (virusCount < 0 || virusCount > area) {
            throw new IllegalArgumentException("virusCount must be between 0 and " + area + ": " + virusCount);
        }
        if (maxCascadeTicks < 1) {
            throw new IllegalArgumentException("maxCascadeTicks must be positive: " + maxCascadeTicks);
        }
    }

    /**
     * Config-based factory.
     * @param config Configuration object containing the field parameters, e.g. {@code drwfalls.field}.
     * @return the validated settings
     */
    public static FieldSettings fromConfig(com.typesafe.config.Config config) {
        return new FieldSettings(
            config.getInt("virusCount"),
            config.getInt("clearTopRows"),
            config.getInt("maxCascadeTicks"),
            config.getLong("seed")
        );
    }

    /**
     * Loads the settings from {@code drwfalls.conf} in the working directory, system
     * properties and the bundled defaults.
     *
     * @return the validated settings
     */
    public static FieldSettings load() {
        return fromConfig(ConfigLoader.load().getConfig(CONFIG_PATH));
    }

    /**
     * Loads the settings with the given file as configuration file.
     *
     * @param file the HOCON file, skipped if missing
     * @return the validated settings
     */
    public static FieldSettings load(File file) {
        return fromConfig(ConfigLoader.load(file).getConfig(CONFIG_PATH));
    }

    /**
     * Returns the highest row which may receive a virus.
     *
     * @return the first row below the cleared rows
     */
    public RowIndex virusTopRow() {
        return RowIndex.of(clearTopRows);
    }
}
