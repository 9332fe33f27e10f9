package de.dreamcube.treasuremaze.runtime;

import de.dreamcube.treasuremaze.hollow.Treasure;
import de.dreamcube.treasuremaze.model.Position;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one expedition: the escape path, if any, and everything collected on the way.
 */
public final class ExpeditionReport {

    private final List<Position> path;
    private final Map<Integer, Treasure> loot;
    private final int startingCapacity;
    private final int remainingCapacity;

    /**
     * Creates a new report.
     *
     * @param path the escape path, empty when no exit was reachable
     * @param loot committed treasures by id, in commit order
     */
    public ExpeditionReport(@NotNull List<Position> path,
                            @NotNull Map<Integer, Treasure> loot,
                            int startingCapacity,
                            int remainingCapacity) {
        this.path = List.copyOf(path);
        this.loot = Collections.unmodifiableMap(new LinkedHashMap<>(loot));
        this.startingCapacity = startingCapacity;
        this.remainingCapacity = remainingCapacity;
    }

    /**
     * Returns true if an exit was reached.
     */
    public boolean escaped() {
        return !path.isEmpty();
    }

    /**
     * Returns the cells from the entrance to the exit, or an empty list when no path was found.
     */
    public @NotNull List<Position> path() {
        return path;
    }

    /**
     * Returns the committed treasures keyed by id, in commit order.
     */
    public @NotNull Map<Integer, Treasure> loot() {
        return loot;
    }

    /**
     * Returns the committed treasures in commit order.
     */
    public @NotNull List<Treasure> collected() {
        return List.copyOf(loot.values());
    }

    /**
     * Returns the backpack capacity at the start of the run.
     */
    public int startingCapacity() {
        return startingCapacity;
    }

    /**
     * Returns the backpack capacity left at the end of the run.
     */
    public int remainingCapacity() {
        return remainingCapacity;
    }

    /**
     * Returns the summed weight of all collected treasures.
     */
    public int totalWeight() {
        int total = 0;
        for (Treasure treasure : loot.values()) {
            total += treasure.weight();
        }
        return total;
    }

    /**
     * Returns the summed value of all collected treasures.
     */
    public int totalValue() {
        int total = 0;
        for (Treasure treasure : loot.values()) {
            total += treasure.value();
        }
        return total;
    }

    @Override
    public @NotNull String toString() {
        return (escaped() ? "escaped in " + path.size() + " cells" : "no path found")
                + ", " + loot.size() + " treasures, value " + totalValue()
                + ", weight " + totalWeight() + "/" + startingCapacity
                + " (" + remainingCapacity + " left)";
    }
}
