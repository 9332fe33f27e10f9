package de.dreamcube.treasuremaze.pathfinding;

import de.dreamcube.treasuremaze.model.MazeCell;
import org.jetbrains.annotations.NotNull;

/**
 * Callback invoked each time the search enters a cell for the first time.
 */
@FunctionalInterface
public interface CellVisitListener {

    /** Listener that ignores every cell. */
    CellVisitListener NONE = cell -> { };

    /**
     * Called after the cell is marked visited and before its neighbours are explored.
     */
    void onEnter(@NotNull MazeCell cell);
}
