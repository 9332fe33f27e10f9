package de.dreamcube.treasuremaze.pathfinding;

import de.dreamcube.treasuremaze.model.Direction;
import de.dreamcube.treasuremaze.model.Maze;
import de.dreamcube.treasuremaze.model.MazeCell;
import de.dreamcube.treasuremaze.model.Position;
import lombok.Getter;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Finds a way from the maze entrance to any exit by depth-first search with backtracking.
 *
 * <p>The search starts at the entrance. On entering a cell it marks the cell visited and notifies
 * the {@link CellVisitListener}. If the cell is an exit the search stops and the current path is
 * returned. Otherwise neighbours are tried in the fixed order {@link Direction#UP},
 * {@link Direction#DOWN}, {@link Direction#LEFT}, {@link Direction#RIGHT}, skipping any that are
 * outside the maze, walls, or already visited. When a cell runs out of neighbours it is popped
 * from the path and the search continues with its parent.</p>
 *
 * <ul>
 *     <li>The first exit reached wins. No shortest or most valuable path is sought.</li>
 *     <li>Visited flags are never cleared on backtrack, so each cell is entered at most once and
 *     the work is bounded by the number of reachable cells.</li>
 *     <li>The call frames of the recursive formulation are kept on an explicit stack, so large
 *     mazes cannot exhaust the Java call stack. The visiting order is identical.</li>
 * </ul>
 *
 * <p>Thread safety: This class is not thread-safe and mutates the visited flags of the maze.</p>
 *
 * @see Maze
 */
public final class DepthFirstEscape {

    private static final Logger LOG = LoggerFactory.getLogger(DepthFirstEscape.class);

    private static final Direction[] DIRECTIONS = Direction.values();

    private final Maze maze;

    /**
     * Number of cells entered by the most recent search.
     */
    @Getter
    private int enteredCells;

    /**
     * Constructs a new search over the given maze.
     *
     * @param maze the maze providing cells and walls
     */
    public DepthFirstEscape(@NotNull Maze maze) {
        this.maze = maze;
    }

    /**
     * Searches for a way out without observing visited cells.
     *
     * @see #findWayOut(CellVisitListener)
     */
    public @NotNull List<Position> findWayOut() {
        return findWayOut(CellVisitListener.NONE);
    }

    /**
     * Searches for a way out, reporting every entered cell to the listener.
     *
     * <p>All visited flags are reset before the search starts. Side effects performed by the
     * listener are not undone when the search backtracks.</p>
     *
     * @param listener notified once per entered cell, in visiting order
     * @return the cells from the entrance to the first exit reached, or an empty list if no exit
     *         is reachable from the entrance
     */
    public @NotNull List<Position> findWayOut(@NotNull CellVisitListener listener) {
        maze.resetVisited();
        enteredCells = 0;

        ArrayDeque<Frame> path = new ArrayDeque<>();
        MazeCell start = maze.cell(maze.getEntrance());
        enter(start, listener);
        if (start.isExit()) {
            return List.of(start.getPosition());
        }
        path.push(new Frame(start));

        while (!path.isEmpty()) {
            Frame frame = path.peek();

            if (frame.nextDirection == DIRECTIONS.length) {
                path.pop();
                continue;
            }

            Position next = frame.cell.getPosition().neighbour(DIRECTIONS[frame.nextDirection++]);
            if (!maze.isPassable(next)) {
                continue;
            }

            MazeCell cell = maze.cell(next);
            if (cell.isVisited()) {
                continue;
            }

            enter(cell, listener);
            if (cell.isExit()) {
                List<Position> way = toPositions(path, cell);
                LOG.debug("Reached exit {} after entering {} cells, path length {}",
                        next, enteredCells, way.size());
                return way;
            }
            path.push(new Frame(cell));
        }

        LOG.debug("No exit reachable from {} after entering {} cells", maze.getEntrance(), enteredCells);
        return List.of();
    }

    private void enter(MazeCell cell, CellVisitListener listener) {
        cell.setVisited(true);
        enteredCells++;
        listener.onEnter(cell);
    }

    /**
     * Converts the frame stack (top = most recent) plus the exit cell into an entrance-first list.
     */
    private static List<Position> toPositions(ArrayDeque<Frame> path, MazeCell exit) {
        List<Position> positions = new ArrayList<>(path.size() + 1);
        Iterator<Frame> fromBottom = path.descendingIterator();
        while (fromBottom.hasNext()) {
            positions.add(fromBottom.next().cell.getPosition());
        }
        positions.add(exit.getPosition());
        return List.copyOf(positions);
    }

    /**
     * One level of the depth-first search: a cell and the next direction to try from it.
     */
    private static final class Frame {
        private final MazeCell cell;
        private int nextDirection;

        Frame(MazeCell cell) {
            this.cell = cell;
        }
    }
}
