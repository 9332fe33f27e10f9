package de.dreamcube.treasuremaze.runtime;

import de.dreamcube.treasuremaze.hollow.Treasure;
import org.jetbrains.annotations.NotNull;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Weight-bounded loot store for one run.
 */
public final class Backpack {

    private final int capacity;
    private final LinkedHashMap<Integer, Treasure> loot = new LinkedHashMap<>();
    private int remaining;

    /**
     * Creates an empty backpack.
     */
    public Backpack(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must not be negative: " + capacity);
        }
        this.capacity = capacity;
        this.remaining = capacity;
    }

    /**
     * Adds a treasure and reduces the remaining capacity.
     *
     * @throws IllegalStateException if the treasure does not fit or is already stowed
     */
    public void stow(@NotNull Treasure treasure) {
        if (treasure.weight() > remaining) {
            throw new IllegalStateException(treasure + " exceeds remaining capacity " + remaining);
        }
        if (loot.putIfAbsent(treasure.id(), treasure) != null) {
            throw new IllegalStateException(treasure + " is already stowed");
        }
        remaining -= treasure.weight();
    }

    /**
     * Returns the capacity this backpack started with.
     */
    public int capacity() {
        return capacity;
    }

    /**
     * Returns the weight that can still be added.
     */
    public int remaining() {
        return remaining;
    }

    /**
     * Returns the stowed treasures by id in the order they were added.
     */
    public @NotNull Map<Integer, Treasure> loot() {
        return new LinkedHashMap<>(loot);
    }
}
