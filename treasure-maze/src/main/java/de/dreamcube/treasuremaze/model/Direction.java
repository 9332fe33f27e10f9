package de.dreamcube.treasuremaze.model;

/**
 * Orthogonal step directions.
 *
 * <p>The declaration order is the order in which the search tries neighbours.</p>
 */
public enum Direction {
    UP,
    DOWN,
    LEFT,
    RIGHT;

    /**
     * Returns the row change when stepping in this direction.
     *
     * @return -1 for UP, 1 for DOWN, 0 otherwise
     */
    public int deltaRow() {
        return switch (this) {
            case UP -> -1;
            case DOWN -> 1;
            case LEFT, RIGHT -> 0;
        };
    }

    /**
     * Returns the column change when stepping in this direction.
     *
     * @return -1 for LEFT, 1 for RIGHT, 0 otherwise
     */
    public int deltaCol() {
        return switch (this) {
            case UP, DOWN -> 0;
            case LEFT -> -1;
            case RIGHT -> 1;
        };
    }
}
