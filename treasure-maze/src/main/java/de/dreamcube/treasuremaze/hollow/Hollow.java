package de.dreamcube.treasuremaze.hollow;

import de.dreamcube.treasuremaze.model.Position;
import de.dreamcube.treasuremaze.model.Tile;
import de.dreamcube.treasuremaze.planning.GreedySelector;
import de.dreamcube.treasuremaze.planning.Selection;
import de.dreamcube.treasuremaze.structures.KeyNotFoundException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A store of treasures attached to one or more maze cells.
 *
 * <p>Hollows are filled once when they are built and afterwards only shrink. Subclasses decide the
 * backing container and whether several cells may share the same instance.</p>
 *
 * <p>Collection follows a fixed protocol, see {@link #collect(GreedySelector, int, int)}: offer the
 * available treasures best ratio first, let the selector pick, and keep exactly the picked
 * treasures out of the container. Everything the selector passes over stays available.</p>
 */
public abstract class Hollow {

    private static final Logger LOG = LoggerFactory.getLogger(Hollow.class);

    private final Set<Position> linkedCells = new LinkedHashSet<>();

    /**
     * Returns the tile used for cells holding this hollow.
     */
    public abstract @NotNull Tile tile();

    /**
     * Returns the number of treasures still available.
     */
    public abstract int size();

    /**
     * Returns true when no treasure is left.
     */
    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Returns every available treasure ordered by {@link Treasure#BY_RATIO} without removing anything.
     */
    public abstract @NotNull List<Treasure> rankedTreasures();

    /**
     * Returns the available treasure with the best ratio without removing it.
     *
     * @return the best treasure, or null when empty
     */
    public abstract @Nullable Treasure bestTreasure();

    /**
     * Removes one specific treasure from the backing container.
     *
     * @throws KeyNotFoundException if the treasure is no longer present
     */
    protected abstract void removeTreasure(@NotNull Treasure treasure);

    /**
     * Returns true when several cells may reference this hollow.
     */
    protected abstract boolean isShared();

    /**
     * Checks that this hollow may be referenced from all the given cells, on top of those already
     * linked, without linking anything.
     *
     * @throws IllegalStateException if this hollow is exclusive and would end up at more than one cell
     */
    public void checkLinkable(@NotNull Collection<Position> positions) {
        if (isShared()) {
            return;
        }
        Set<Position> placed = new LinkedHashSet<>(linkedCells);
        placed.addAll(positions);
        if (placed.size() > 1) {
            throw new IllegalStateException(getClass().getSimpleName() + " cannot be placed at more than one cell: "
                    + placed);
        }
    }

    /**
     * Records that a maze cell references this hollow.
     *
     * @throws IllegalStateException if this hollow is exclusive and already placed elsewhere
     */
    public void link(@NotNull Position position) {
        checkLinkable(List.of(position));
        linkedCells.add(position);
    }

    /**
     * Returns the cells that reference this hollow, in the order they were linked.
     */
    public @NotNull Set<Position> linkedCells() {
        return Collections.unmodifiableSet(linkedCells);
    }

    /**
     * Takes treasures from this hollow for a backpack with the given remaining capacity.
     *
     * <p>The selector is offered the available treasures best ratio first. By default the treasures
     * it accepts are then removed from the container one by one. If a removal reports that the
     * treasure is already gone, the treasure is dropped from the result and its weight is returned to
     * the capacity.</p>
     *
     * @param selector decides which treasures to take
     * @param capacity the remaining backpack capacity
     * @param limit the most treasures to take in this visit, or 0 for no limit
     * @return the committed selection
     */
    public final @NotNull Selection collect(@NotNull GreedySelector selector, int capacity, int limit) {
        if (isEmpty()) {
            return Selection.none(capacity);
        }
        return takeSelected(selector, capacity, limit);
    }

    /**
     * Lets the selector choose from {@link #rankedTreasures()} and removes the accepted treasures.
     *
     * <p>Containers that can hand out their best treasure cheaply override this to feed the selector
     * lazily. Overrides must leave every treasure the selector did not accept in the container.</p>
     */
    protected @NotNull Selection takeSelected(@NotNull GreedySelector selector, int capacity, int limit) {
        Selection proposal = selector.select(rankedTreasures(), capacity, limit);
        if (proposal.isEmpty()) {
            return proposal;
        }

        List<Treasure> committed = new ArrayList<>(proposal.accepted().size());
        int remaining = proposal.remainingCapacity();
        for (Treasure treasure : proposal.accepted()) {
            try {
                removeTreasure(treasure);
                committed.add(treasure);
            } catch (KeyNotFoundException e) {
                LOG.warn("{} at {} no longer holds {}, skipping", tile(), linkedCells, treasure);
                remaining += treasure.weight();
            }
        }

        if (committed.size() == proposal.accepted().size()) {
            return proposal;
        }
        return new Selection(committed, proposal.rejected(), remaining);
    }

    /**
     * Takes the single best-ratio treasure that fits the capacity.
     *
     * @return the removed treasure, or null if none fits or the hollow is empty
     */
    public @Nullable Treasure takeOptimal(@NotNull GreedySelector selector, int capacity) {
        Selection selection = collect(selector, capacity, 1);
        return selection.isEmpty() ? null : selection.accepted().get(0);
    }

    @Override
    public @NotNull String toString() {
        return String.valueOf(tile().symbol());
    }
}
