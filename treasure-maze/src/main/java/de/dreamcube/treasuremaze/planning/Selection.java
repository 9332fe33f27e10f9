package de.dreamcube.treasuremaze.planning;

import de.dreamcube.treasuremaze.hollow.Treasure;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Outcome of one greedy selection round.
 */
public final class Selection {

    private final List<Treasure> accepted;
    private final List<Treasure> rejected;
    private final int remainingCapacity;

    /**
     * Creates a new selection result.
     */
    public Selection(@NotNull List<Treasure> accepted, @NotNull List<Treasure> rejected, int remainingCapacity) {
        this.accepted = List.copyOf(accepted);
        this.rejected = List.copyOf(rejected);
        this.remainingCapacity = remainingCapacity;
    }

    /**
     * Returns an empty selection that leaves the capacity untouched.
     */
    public static @NotNull Selection none(int capacity) {
        return new Selection(List.of(), List.of(), capacity);
    }

    /**
     * Returns the accepted treasures in the order they were offered.
     */
    public @NotNull List<Treasure> accepted() {
        return accepted;
    }

    /**
     * Returns the treasures that were offered but did not fit.
     */
    public @NotNull List<Treasure> rejected() {
        return rejected;
    }

    /**
     * Returns the capacity left after all accepted treasures.
     */
    public int remainingCapacity() {
        return remainingCapacity;
    }

    /**
     * Returns the summed weight of the accepted treasures.
     */
    public int acceptedWeight() {
        int total = 0;
        for (Treasure treasure : accepted) {
            total += treasure.weight();
        }
        return total;
    }

    /**
     * Returns the summed value of the accepted treasures.
     */
    public int acceptedValue() {
        int total = 0;
        for (Treasure treasure : accepted) {
            total += treasure.value();
        }
        return total;
    }

    /**
     * Returns true when nothing was accepted.
     */
    public boolean isEmpty() {
        return accepted.isEmpty();
    }
}
