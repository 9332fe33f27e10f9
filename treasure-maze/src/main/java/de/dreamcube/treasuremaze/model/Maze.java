package de.dreamcube.treasuremaze.model;

import de.dreamcube.treasuremaze.hollow.Hollow;
import de.dreamcube.treasuremaze.hollow.Treasure;
import lombok.Getter;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rectangular grid of {@link MazeCell}s with one entrance and at least one exit.
 *
 * <p>Coordinate system:</p>
 * <ul>
 *     <li>row: vertical coordinate, increasing from top to bottom (0 to rows-1)</li>
 *     <li>col: horizontal coordinate, increasing from left to right (0 to cols-1)</li>
 * </ul>
 *
 * <p>The maze exclusively owns its cells. Hollows are owned by the hollow objects themselves and
 * only referenced from cells. A maze is built once per puzzle; only the cells' visited flags and
 * the hollows' contents change afterwards.</p>
 *
 * <p>This class is not thread-safe.</p>
 */
public final class Maze {

    @Getter
    private final int rows;

    @Getter
    private final int cols;

    @Getter
    private final Position entrance;

    private final List<Position> exits;
    private final MazeCell[][] grid;

    /**
     * Builds a maze from explicit positions.
     *
     * <p>Every cell not listed is open ground. Passing the same hollow instance for several positions
     * links those cells to one shared pool, which is only allowed for shareable hollows.</p>
     *
     * @param rows number of rows, positive
     * @param cols number of columns, positive
     * @param entrance the start cell
     * @param exits the exit cells, at least one
     * @param walls the wall cells
     * @param hollows hollow sites and the hollow each one references
     * @throws InvalidMazeLayoutException if a position is out of bounds, cells overlap, the
     *         entrance or exits are missing, an exclusive hollow is placed twice, or two hollows
     *         hold treasures with the same id
     */
    public Maze(int rows,
                int cols,
                @NotNull Position entrance,
                @NotNull Collection<Position> exits,
                @NotNull Collection<Position> walls,
                @NotNull Map<Position, ? extends Hollow> hollows) {
        if (rows <= 0 || cols <= 0) {
            throw new InvalidMazeLayoutException("Maze must have positive dimensions, got " + rows + "x" + cols);
        }
        if (entrance == null) {
            throw new InvalidMazeLayoutException("Maze has no entrance");
        }
        if (exits.isEmpty()) {
            throw new InvalidMazeLayoutException("Maze has no exit");
        }

        this.rows = rows;
        this.cols = cols;
        this.entrance = entrance;
        this.exits = List.copyOf(exits);

        Tile[][] tiles = new Tile[rows][cols];
        Set<Position> claimed = new HashSet<>();

        place(tiles, claimed, entrance, Tile.ENTRANCE);
        for (Position exit : this.exits) {
            place(tiles, claimed, exit, Tile.EXIT);
        }
        for (Position wall : walls) {
            place(tiles, claimed, wall, Tile.WALL);
        }
        for (Map.Entry<Position, ? extends Hollow> entry : hollows.entrySet()) {
            place(tiles, claimed, entry.getKey(), entry.getValue().tile());
        }

        checkHollows(hollows);

        this.grid = new MazeCell[rows][cols];
        for (int row = 0; row < rows; row++) {
            for (int col = 0; col < cols; col++) {
                Position position = new Position(row, col);
                Tile tile = tiles[row][col] == null ? Tile.OPEN : tiles[row][col];
                Hollow hollow = hollows.get(position);
                if (hollow != null) {
                    hollow.link(position);
                }
                grid[row][col] = new MazeCell(position, tile, hollow);
            }
        }
    }

    /**
     * Returns the exit positions in the order they were given.
     */
    public @NotNull List<Position> getExits() {
        return exits;
    }

    /**
     * Checks if the given coordinates lie within the maze boundaries.
     */
    public boolean isWithinBounds(int row, int col) {
        return row >= 0 && col >= 0 && row < rows && col < cols;
    }

    /**
     * Checks if the given position lies within the maze boundaries.
     */
    public boolean isWithinBounds(@NotNull Position position) {
        return isWithinBounds(position.row(), position.col());
    }

    /**
     * Checks if a position is inside the maze and not a wall.
     */
    public boolean isPassable(@NotNull Position position) {
        return isWithinBounds(position) && grid[position.row()][position.col()].isPassable();
    }

    /**
     * Returns the cell at the given position.
     *
     * @throws IndexOutOfBoundsException if the position is outside the maze
     */
    public @NotNull MazeCell cell(@NotNull Position position) {
        return cell(position.row(), position.col());
    }

    /**
     * Returns the cell at the given coordinates.
     *
     * @throws IndexOutOfBoundsException if the coordinates are outside the maze
     */
    public @NotNull MazeCell cell(int row, int col) {
        if (!isWithinBounds(row, col)) {
            throw new IndexOutOfBoundsException("(" + row + ", " + col + ") is outside " + rows + "x" + cols);
        }
        return grid[row][col];
    }

    /**
     * Clears the visited flag of every cell.
     */
    public void resetVisited() {
        for (MazeCell[] row : grid) {
            for (MazeCell cell : row) {
                cell.setVisited(false);
            }
        }
    }

    /**
     * Returns each distinct hollow once, in row-major order of its first linked cell.
     */
    public @NotNull List<Hollow> hollows() {
        Map<Hollow, Boolean> seen = new IdentityHashMap<>();
        List<Hollow> distinct = new ArrayList<>();
        for (MazeCell[] row : grid) {
            for (MazeCell cell : row) {
                Hollow hollow = cell.getHollow();
                if (hollow != null && seen.put(hollow, Boolean.TRUE) == null) {
                    distinct.add(hollow);
                }
            }
        }
        return Collections.unmodifiableList(distinct);
    }

    /**
     * Renders the grid, one line per row, using the tile symbols.
     */
    public @NotNull String render() {
        return render(List.of());
    }

    /**
     * Renders the grid and marks open cells on the given path with {@code *}.
     *
     * <p>Entrance, exit and hollow symbols stay visible on the path.</p>
     */
    public @NotNull String render(@NotNull Collection<Position> path) {
        Set<Position> onPath = new HashSet<>(path);
        StringBuilder out = new StringBuilder(rows * (cols + 1));
        for (int row = 0; row < rows; row++) {
            if (row > 0) out.append('\n');
            for (int col = 0; col < cols; col++) {
                MazeCell cell = grid[row][col];
                if (cell.getTile() == Tile.OPEN && onPath.contains(cell.getPosition())) {
                    out.append('*');
                } else {
                    out.append(cell.getTile().symbol());
                }
            }
        }
        return out.toString();
    }

    @Override
    public @NotNull String toString() {
        return render();
    }

    /**
     * Validates placement and treasure ids of all hollows before any of them is linked, so a rejected
     * layout leaves the hollows untouched.
     */
    private static void checkHollows(Map<Position, ? extends Hollow> hollows) {
        Map<Hollow, List<Position>> sites = new IdentityHashMap<>();
        for (Map.Entry<Position, ? extends Hollow> entry : hollows.entrySet()) {
            sites.computeIfAbsent(entry.getValue(), hollow -> new ArrayList<>()).add(entry.getKey());
        }

        Map<Integer, Hollow> owners = new HashMap<>();
        for (Map.Entry<Hollow, List<Position>> entry : sites.entrySet()) {
            Hollow hollow = entry.getKey();
            try {
                hollow.checkLinkable(entry.getValue());
            } catch (IllegalStateException e) {
                throw new InvalidMazeLayoutException(e.getMessage(), e);
            }
            for (Treasure treasure : hollow.rankedTreasures()) {
                Hollow owner = owners.putIfAbsent(treasure.id(), hollow);
                if (owner != null && owner != hollow) {
                    throw new InvalidMazeLayoutException("Treasure id " + treasure.id() + " is held by the "
                            + owner.tile() + " hollow at " + sites.get(owner) + " and the " + hollow.tile()
                            + " hollow at " + entry.getValue());
                }
            }
        }
    }

    private void place(Tile[][] tiles, Set<Position> claimed, Position position, Tile tile) {
        if (!isWithinBounds(position)) {
            throw new InvalidMazeLayoutException(tile + " at " + position + " is outside " + rows + "x" + cols);
        }
        if (!claimed.add(position)) {
            throw new InvalidMazeLayoutException(tile + " at " + position + " overlaps "
                    + tiles[position.row()][position.col()]);
        }
        tiles[position.row()][position.col()] = tile;
    }
}
