package de.dreamcube.treasuremaze.model;

import org.jetbrains.annotations.NotNull;

/**
 * Immutable grid coordinate.
 */
public final class Position {

    private final int row;
    private final int col;

    /**
     * Creates a new position.
     */
    public Position(int row, int col) {
        this.row = row;
        this.col = col;
    }

    /**
     * Returns the row.
     */
    public int row() {
        return row;
    }

    /**
     * Returns the column.
     */
    public int col() {
        return col;
    }

    /**
     * Returns the adjacent position one step in the given direction.
     */
    public @NotNull Position neighbour(@NotNull Direction direction) {
        return new Position(row + direction.deltaRow(), col + direction.deltaCol());
    }

    /**
     * Returns true if the other position is exactly one orthogonal step away.
     */
    public boolean isAdjacentTo(@NotNull Position other) {
        return Math.abs(row - other.row) + Math.abs(col - other.col) == 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Position)) return false;
        Position other = (Position) o;
        return row == other.row && col == other.col;
    }

    @Override
    public int hashCode() {
        return 31 * row + col;
    }

    @Override
    public @NotNull String toString() {
        return "(" + row + ", " + col + ")";
    }
}
