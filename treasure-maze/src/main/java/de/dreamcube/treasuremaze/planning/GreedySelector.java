package de.dreamcube.treasuremaze.planning;

import de.dreamcube.treasuremaze.hollow.Treasure;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy knapsack approximation by value-to-weight ratio.
 *
 * <p>Candidates are expected in descending ratio order. Each one is taken if its weight fits the
 * remaining capacity; a candidate that does not fit is skipped for good. This is exact for the
 * fractional relaxation only. For indivisible treasures it is a heuristic and can miss the best
 * subset (for example one heavy high-ratio item blocking two lighter items worth more together).</p>
 *
 * <p>The selector is stateless and does not touch any container. Candidates are pulled one at a
 * time and none is pulled after the limit is reached, so a lazily produced sequence is only consumed
 * as far as needed.</p>
 */
public final class GreedySelector {

    /**
     * Selects without a per-call count limit.
     *
     * @see #select(Iterable, int, int)
     */
    public @NotNull Selection select(@NotNull Iterable<Treasure> candidates, int capacity) {
        return select(candidates, capacity, 0);
    }

    /**
     * Offers each candidate in turn and accepts those that fit.
     *
     * @param candidates treasures in descending ratio order
     * @param capacity the weight still available
     * @param limit the most treasures to accept, or 0 for no limit
     * @return accepted and rejected treasures with the capacity left over
     * @throws IllegalArgumentException if capacity or limit is negative
     */
    public @NotNull Selection select(@NotNull Iterable<Treasure> candidates, int capacity, int limit) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must not be negative: " + capacity);
        }
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }

        List<Treasure> accepted = new ArrayList<>();
        List<Treasure> rejected = new ArrayList<>();
        int remaining = capacity;

        for (Treasure candidate : candidates) {
            if (candidate.weight() <= remaining) {
                accepted.add(candidate);
                remaining -= candidate.weight();
                if (accepted.size() == limit) break;
            } else {
                rejected.add(candidate);
            }
        }

        return new Selection(accepted, rejected, remaining);
    }
}
