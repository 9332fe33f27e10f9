package de.dreamcube.treasuremaze.planning;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Properties;

/**
 * Tuning parameters for maze construction, treasure generation and collection.
 */
public final class ExpeditionConfig {

    private static final Logger LOG = LoggerFactory.getLogger(ExpeditionConfig.class);

    /** Classpath resource read by {@link #load()}. */
    public static final String RESOURCE = "treasure-maze.properties";

    /** Default tuning values. */
    public static final ExpeditionConfig DEFAULT = new ExpeditionConfig(
            64,      // maxRows
            64,      // maxCols
            20,      // backpackCapacity
            1,       // minWeight
            10,      // maxWeight
            1,       // minValue
            50,      // maxValue
            3,       // minTreasures
            8,       // maxTreasures
            0,       // maxTakePerVisit (0 = unlimited)
            CollectionMode.DURING_SEARCH,
            42L      // seed
    );

    private final int maxRows;
    private final int maxCols;
    private final int backpackCapacity;
    private final int minWeight;
    private final int maxWeight;
    private final int minValue;
    private final int maxValue;
    private final int minTreasures;
    private final int maxTreasures;
    private final int maxTakePerVisit;
    private final CollectionMode collectionMode;
    private final long seed;

    /**
     * Creates a new expedition config.
     *
     * @throws IllegalArgumentException if a bound is not positive or a range is inverted
     */
    public ExpeditionConfig(int maxRows,
                            int maxCols,
                            int backpackCapacity,
                            int minWeight,
                            int maxWeight,
                            int minValue,
                            int maxValue,
                            int minTreasures,
                            int maxTreasures,
                            int maxTakePerVisit,
                            @NotNull CollectionMode collectionMode,
                            long seed) {
        requirePositive("maze.maxRows", maxRows);
        requirePositive("maze.maxCols", maxCols);
        requireNonNegative("backpack.capacity", backpackCapacity);
        requirePositive("treasure.minWeight", minWeight);
        requireRange("treasure.minWeight", minWeight, "treasure.maxWeight", maxWeight);
        requirePositive("treasure.minValue", minValue);
        requireRange("treasure.minValue", minValue, "treasure.maxValue", maxValue);
        requireNonNegative("hollow.minTreasures", minTreasures);
        requireRange("hollow.minTreasures", minTreasures, "hollow.maxTreasures", maxTreasures);
        requireNonNegative("hollow.maxTakePerVisit", maxTakePerVisit);
        if (collectionMode == null) {
            throw new IllegalArgumentException("collection.mode must not be null");
        }

        this.maxRows = maxRows;
        this.maxCols = maxCols;
        this.backpackCapacity = backpackCapacity;
        this.minWeight = minWeight;
        this.maxWeight = maxWeight;
        this.minValue = minValue;
        this.maxValue = maxValue;
        this.minTreasures = minTreasures;
        this.maxTreasures = maxTreasures;
        this.maxTakePerVisit = maxTakePerVisit;
        this.collectionMode = collectionMode;
        this.seed = seed;
    }

    /**
     * Loads the config from {@value #RESOURCE} on the classpath, falling back to {@link #DEFAULT}
     * when the resource is absent.
     */
    public static @NotNull ExpeditionConfig load() {
        try (InputStream in = ExpeditionConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                LOG.debug("No {} on classpath, using defaults", RESOURCE);
                return DEFAULT;
            }
            Properties properties = new Properties();
            properties.load(in);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }

    /**
     * Builds a config from properties; missing keys keep their {@link #DEFAULT} value.
     *
     * @throws IllegalArgumentException naming the key when a value cannot be parsed
     */
    public static @NotNull ExpeditionConfig fromProperties(@NotNull Properties properties) {
        ExpeditionConfig d = DEFAULT;
        return new ExpeditionConfig(
                intValue(properties, "maze.maxRows", d.maxRows),
                intValue(properties, "maze.maxCols", d.maxCols),
                intValue(properties, "backpack.capacity", d.backpackCapacity),
                intValue(properties, "treasure.minWeight", d.minWeight),
                intValue(properties, "treasure.maxWeight", d.maxWeight),
                intValue(properties, "treasure.minValue", d.minValue),
                intValue(properties, "treasure.maxValue", d.maxValue),
                intValue(properties, "hollow.minTreasures", d.minTreasures),
                intValue(properties, "hollow.maxTreasures", d.maxTreasures),
                intValue(properties, "hollow.maxTakePerVisit", d.maxTakePerVisit),
                modeValue(properties, d.collectionMode),
                longValue(properties, "random.seed", d.seed)
        );
    }

    /**
     * Returns a copy with a different backpack capacity.
     */
    public @NotNull ExpeditionConfig withBackpackCapacity(int capacity) {
        return new ExpeditionConfig(maxRows, maxCols, capacity, minWeight, maxWeight, minValue, maxValue,
                minTreasures, maxTreasures, maxTakePerVisit, collectionMode, seed);
    }

    /**
     * Returns a copy with a different collection mode.
     */
    public @NotNull ExpeditionConfig withCollectionMode(@NotNull CollectionMode mode) {
        return new ExpeditionConfig(maxRows, maxCols, backpackCapacity, minWeight, maxWeight, minValue, maxValue,
                minTreasures, maxTreasures, maxTakePerVisit, mode, seed);
    }

    /**
     * Returns a copy with a different per-visit limit.
     */
    public @NotNull ExpeditionConfig withMaxTakePerVisit(int limit) {
        return new ExpeditionConfig(maxRows, maxCols, backpackCapacity, minWeight, maxWeight, minValue, maxValue,
                minTreasures, maxTreasures, limit, collectionMode, seed);
    }

    /**
     * Returns the maximum number of maze rows.
     */
    public int maxRows() {
        return maxRows;
    }

    /**
     * Returns the maximum number of maze columns.
     */
    public int maxCols() {
        return maxCols;
    }

    /**
     * Returns the backpack weight capacity at the start of each run.
     */
    public int backpackCapacity() {
        return backpackCapacity;
    }

    /**
     * Returns the smallest generated treasure weight.
     */
    public int minWeight() {
        return minWeight;
    }

    /**
     * Returns the largest generated treasure weight.
     */
    public int maxWeight() {
        return maxWeight;
    }

    /**
     * Returns the smallest generated treasure value.
     */
    public int minValue() {
        return minValue;
    }

    /**
     * Returns the largest generated treasure value.
     */
    public int maxValue() {
        return maxValue;
    }

    /**
     * Returns the fewest treasures placed in a new hollow.
     */
    public int minTreasures() {
        return minTreasures;
    }

    /**
     * Returns the most treasures placed in a new hollow.
     */
    public int maxTreasures() {
        return maxTreasures;
    }

    /**
     * Returns how many treasures may be taken per hollow visit, 0 for no limit.
     */
    public int maxTakePerVisit() {
        return maxTakePerVisit;
    }

    /**
     * Returns when treasures are collected.
     */
    public @NotNull CollectionMode collectionMode() {
        return collectionMode;
    }

    /**
     * Returns the random seed for treasure generation.
     */
    public long seed() {
        return seed;
    }

    private static int intValue(Properties properties, String key, int fallback) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not an integer: " + raw, e);
        }
    }

    private static long longValue(Properties properties, String key, long fallback) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not an integer: " + raw, e);
        }
    }

    private static CollectionMode modeValue(Properties properties, CollectionMode fallback) {
        String raw = properties.getProperty("collection.mode");
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return CollectionMode.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("collection.mode is not one of DURING_SEARCH, ALONG_PATH: " + raw, e);
        }
    }

    private static void requirePositive(String key, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be positive: " + value);
        }
    }

    private static void requireNonNegative(String key, int value) {
        if (value < 0) {
            throw new IllegalArgumentException(key + " must not be negative: " + value);
        }
    }

    private static void requireRange(String minKey, int min, String maxKey, int max) {
        if (min > max) {
            throw new IllegalArgumentException(minKey + " (" + min + ") exceeds " + maxKey + " (" + max + ")");
        }
    }
}
