package de.dreamcube.treasuremaze.hollow;

import de.dreamcube.treasuremaze.model.Tile;
import de.dreamcube.treasuremaze.planning.GreedySelector;
import de.dreamcube.treasuremaze.planning.Selection;
import de.dreamcube.treasuremaze.structures.KeyNotFoundException;
import de.dreamcube.treasuremaze.structures.MaxHeap;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Hollow whose treasure pool is shared by every cell linked to it.
 *
 * <p>All linked cells reference this one instance, so a treasure taken through any cell is gone
 * for all of them. The pool is a {@link MaxHeap} ranked by {@link Treasure#RANK}, which makes the
 * best ratio available in {@code O(1)}.</p>
 *
 * <p>Collection pulls candidates straight off the heap top. A visit that takes the best treasure
 * costs one extraction; only treasures too heavy for the backpack are set aside and pushed back.</p>
 */
public final class MysticalHollow extends Hollow {

    private final MaxHeap<Treasure> pool;

    /**
     * Creates a pool holding the given treasures.
     */
    public MysticalHollow(@NotNull Collection<Treasure> initial) {
        this.pool = MaxHeap.heapify(Treasure.RANK, initial);
    }

    /**
     * Creates a pool filled by the generator.
     */
    public static @NotNull MysticalHollow generate(@NotNull TreasureGenerator generator) {
        return new MysticalHollow(generator.generateBatch());
    }

    @Override
    public @NotNull Tile tile() {
        return Tile.MYSTICAL_HOLLOW;
    }

    @Override
    public int size() {
        return pool.size();
    }

    @Override
    public @NotNull List<Treasure> rankedTreasures() {
        return pool.drainedCopy();
    }

    @Override
    public @Nullable Treasure bestTreasure() {
        return pool.peekMax();
    }

    @Override
    protected @NotNull Selection takeSelected(@NotNull GreedySelector selector, int capacity, int limit) {
        List<Treasure> pulled = new ArrayList<>();
        Iterable<Treasure> fromTop = () -> new Iterator<>() {
            @Override
            public boolean hasNext() {
                return !pool.isEmpty();
            }

            @Override
            public Treasure next() {
                Treasure top = pool.extractMax();
                pulled.add(top);
                return top;
            }
        };

        Selection selection = selector.select(fromTop, capacity, limit);

        Set<Treasure> taken = new HashSet<>(selection.accepted());
        for (Treasure treasure : pulled) {
            if (!taken.contains(treasure)) {
                pool.insert(treasure);
            }
        }
        return selection;
    }

    /**
     * Extracts from the top until the wanted treasure comes out, then puts the others back.
     */
    @Override
    protected void removeTreasure(@NotNull Treasure treasure) {
        List<Treasure> setAside = new ArrayList<>();
        boolean found = false;
        while (!pool.isEmpty()) {
            Treasure top = pool.extractMax();
            if (top.equals(treasure)) {
                found = true;
                break;
            }
            setAside.add(top);
        }
        for (Treasure held : setAside) {
            pool.insert(held);
        }
        if (!found) {
            throw new KeyNotFoundException(treasure.id());
        }
    }

    @Override
    protected boolean isShared() {
        return true;
    }
}
