package de.dreamcube.treasuremaze.model;

import org.jetbrains.annotations.Nullable;

/**
 * Terrain kinds and their layout symbols.
 */
public enum Tile {
    OPEN('.'),
    WALL('#'),
    ENTRANCE('P'),
    EXIT('E'),
    SPOOKY_HOLLOW('S'),
    MYSTICAL_HOLLOW('M');

    private final char symbol;

    Tile(char symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the layout symbol.
     */
    public char symbol() {
        return symbol;
    }

    /**
     * Returns true for both hollow kinds.
     */
    public boolean isHollow() {
        return this == SPOOKY_HOLLOW || this == MYSTICAL_HOLLOW;
    }

    /**
     * Maps a layout symbol to its tile. A space is read as open ground.
     *
     * @return the tile, or null for an unknown symbol
     */
    public static @Nullable Tile fromSymbol(char symbol) {
        if (symbol == ' ') return OPEN;
        for (Tile tile : values()) {
            if (tile.symbol == symbol) return tile;
        }
        return null;
    }
}
