package de.dreamcube.treasuremaze.hollow;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Source of fresh treasures for filling hollows at construction time.
 */
public interface TreasureGenerator {

    /**
     * Creates one new treasure with a unique id.
     */
    @NotNull Treasure generate();

    /**
     * Returns how many treasures a newly built hollow should receive.
     */
    int nextBatchSize();

    /**
     * Creates the initial content for one hollow.
     */
    default @NotNull List<Treasure> generateBatch() {
        int count = nextBatchSize();
        List<Treasure> batch = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            batch.add(generate());
        }
        return batch;
    }
}
