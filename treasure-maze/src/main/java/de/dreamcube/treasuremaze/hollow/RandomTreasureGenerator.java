package de.dreamcube.treasuremaze.hollow;

import de.dreamcube.treasuremaze.planning.ExpeditionConfig;
import org.jetbrains.annotations.NotNull;

import java.util.Random;

/**
 * Seeded treasure generator drawing weights, values and batch sizes uniformly from inclusive ranges.
 *
 * <p>Ids are handed out sequentially starting at 1, so ids also reflect creation order.</p>
 */
public final class RandomTreasureGenerator implements TreasureGenerator {

    private final Random random;
    private final int minWeight;
    private final int maxWeight;
    private final int minValue;
    private final int maxValue;
    private final int minTreasures;
    private final int maxTreasures;

    private int nextId = 1;

    /**
     * Creates a generator using the ranges and seed of the given config.
     */
    public RandomTreasureGenerator(@NotNull ExpeditionConfig config) {
        this(new Random(config.seed()),
                config.minWeight(), config.maxWeight(),
                config.minValue(), config.maxValue(),
                config.minTreasures(), config.maxTreasures());
    }

    /**
     * Creates a generator with explicit ranges.
     */
    public RandomTreasureGenerator(@NotNull Random random,
                                   int minWeight, int maxWeight,
                                   int minValue, int maxValue,
                                   int minTreasures, int maxTreasures) {
        if (minWeight <= 0 || minWeight > maxWeight) {
            throw new IllegalArgumentException("invalid weight range [" + minWeight + ", " + maxWeight + "]");
        }
        if (minValue <= 0 || minValue > maxValue) {
            throw new IllegalArgumentException("invalid value range [" + minValue + ", " + maxValue + "]");
        }
        if (minTreasures < 0 || minTreasures > maxTreasures) {
            throw new IllegalArgumentException("invalid batch range [" + minTreasures + ", " + maxTreasures + "]");
        }
        this.random = random;
        this.minWeight = minWeight;
        this.maxWeight = maxWeight;
        this.minValue = minValue;
        this.maxValue = maxValue;
        this.minTreasures = minTreasures;
        this.maxTreasures = maxTreasures;
    }

    @Override
    public @NotNull Treasure generate() {
        int weight = between(minWeight, maxWeight);
        int value = between(minValue, maxValue);
        return new Treasure(nextId++, weight, value);
    }

    @Override
    public int nextBatchSize() {
        return between(minTreasures, maxTreasures);
    }

    private int between(int low, int high) {
        long span = (long) high - low + 1;
        if (span <= Integer.MAX_VALUE) {
            return low + random.nextInt((int) span);
        }
        return (int) random.nextLong(low, (long) high + 1);
    }
}
