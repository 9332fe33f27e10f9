package de.dreamcube.treasuremaze.hollow;

import de.dreamcube.treasuremaze.model.Tile;
import de.dreamcube.treasuremaze.structures.OrderedTree;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.List;

/**
 * Hollow whose treasures belong to exactly one cell.
 *
 * <p>Treasures are kept in an {@link OrderedTree} keyed by treasure id, so removals by id are
 * {@code O(log n)}. Since the key is not the ratio, finding the best ratio walks the tree in order.</p>
 */
public final class SpookyHollow extends Hollow {

    private final OrderedTree<Integer, Treasure> treasures = new OrderedTree<>();

    /**
     * Creates a hollow holding the given treasures.
     *
     * @throws IllegalArgumentException if two treasures share an id
     */
    public SpookyHollow(@NotNull Collection<Treasure> initial) {
        for (Treasure treasure : initial) {
            if (treasures.contains(treasure.id())) {
                throw new IllegalArgumentException("duplicate treasure id " + treasure.id());
            }
            treasures.insert(treasure.id(), treasure);
        }
    }

    /**
     * Creates a hollow filled by the generator.
     */
    public static @NotNull SpookyHollow generate(@NotNull TreasureGenerator generator) {
        return new SpookyHollow(generator.generateBatch());
    }

    @Override
    public @NotNull Tile tile() {
        return Tile.SPOOKY_HOLLOW;
    }

    @Override
    public int size() {
        return treasures.size();
    }

    @Override
    public @NotNull List<Treasure> rankedTreasures() {
        List<Treasure> ranked = treasures.inOrder();
        ranked.sort(Treasure.BY_RATIO);
        return ranked;
    }

    @Override
    public @Nullable Treasure bestTreasure() {
        Treasure best = null;
        for (Treasure treasure : treasures) {
            if (best == null || Treasure.BY_RATIO.compare(treasure, best) < 0) {
                best = treasure;
            }
        }
        return best;
    }

    /**
     * Looks up a treasure by id.
     *
     * @return the treasure, or null if it was taken or never existed
     */
    public @Nullable Treasure find(int id) {
        return treasures.find(id);
    }

    @Override
    protected void removeTreasure(@NotNull Treasure treasure) {
        treasures.remove(treasure.id());
    }

    @Override
    protected boolean isShared() {
        return false;
    }
}
