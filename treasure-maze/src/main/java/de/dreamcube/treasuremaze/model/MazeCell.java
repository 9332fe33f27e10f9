package de.dreamcube.treasuremaze.model;

import de.dreamcube.treasuremaze.hollow.Hollow;
import lombok.Getter;
import lombok.Setter;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * One grid square: its position, terrain and, for hollow sites, the hollow it references.
 *
 * <p>The hollow is referenced, not owned. Cells linked to the same mystical pool all point at the
 * same {@link Hollow} instance.</p>
 */
public final class MazeCell {

    @Getter
    private final Position position;

    @Getter
    private final Tile tile;

    private final Hollow hollow;

    /**
     * Traversal marker, reset before every search.
     */
    @Getter
    @Setter
    private boolean visited;

    MazeCell(@NotNull Position position, @NotNull Tile tile, @Nullable Hollow hollow) {
        if (tile.isHollow() != (hollow != null)) {
            throw new IllegalArgumentException("tile " + tile + " does not match hollow " + hollow);
        }
        this.position = position;
        this.tile = tile;
        this.hollow = hollow;
    }

    /**
     * Returns the hollow at this cell, or null if the cell is not a hollow site.
     */
    public @Nullable Hollow getHollow() {
        return hollow;
    }

    /**
     * Returns true unless the cell is a wall.
     */
    public boolean isPassable() {
        return tile != Tile.WALL;
    }

    /**
     * Returns true for exit cells.
     */
    public boolean isExit() {
        return tile == Tile.EXIT;
    }

    /**
     * Returns true for spooky and mystical hollow sites.
     */
    public boolean isHollowSite() {
        return hollow != null;
    }

    @Override
    public @NotNull String toString() {
        return String.valueOf(tile.symbol());
    }
}
