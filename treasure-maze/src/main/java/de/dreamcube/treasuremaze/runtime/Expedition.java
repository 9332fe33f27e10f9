package de.dreamcube.treasuremaze.runtime;

import de.dreamcube.treasuremaze.hollow.Hollow;
import de.dreamcube.treasuremaze.hollow.Treasure;
import de.dreamcube.treasuremaze.model.Maze;
import de.dreamcube.treasuremaze.model.MazeCell;
import de.dreamcube.treasuremaze.model.Position;
import de.dreamcube.treasuremaze.pathfinding.DepthFirstEscape;
import de.dreamcube.treasuremaze.planning.ExpeditionConfig;
import de.dreamcube.treasuremaze.planning.GreedySelector;
import de.dreamcube.treasuremaze.planning.Selection;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the escape search over a maze and collects treasures from the hollows it meets.
 *
 * <p>Every call to {@link #solve()} starts with an empty backpack of the configured capacity.
 * Hollow contents are not restored between runs.</p>
 */
public final class Expedition {

    private static final Logger LOG = LoggerFactory.getLogger(Expedition.class);

    private final Maze maze;
    private final ExpeditionConfig config;
    private final GreedySelector selector;
    private final DepthFirstEscape search;

    public Expedition(@NotNull Maze maze, @NotNull ExpeditionConfig config) {
        this(maze, config, new GreedySelector());
    }

    public Expedition(@NotNull Maze maze, @NotNull ExpeditionConfig config, @NotNull GreedySelector selector) {
        this.maze = maze;
        this.config = config;
        this.selector = selector;
        this.search = new DepthFirstEscape(maze);
    }

    /**
     * Searches for a way out and collects treasures according to the configured collection mode.
     */
    public @NotNull ExpeditionReport solve() {
        Backpack backpack = new Backpack(config.backpackCapacity());

        List<Position> path = switch (config.collectionMode()) {
            case DURING_SEARCH -> search.findWayOut(cell -> {
                if (cell.isHollowSite()) {
                    collectAt(cell, backpack);
                }
            });
            case ALONG_PATH -> {
                List<Position> found = search.findWayOut();
                collectAlong(found, backpack);
                yield found;
            }
        };

        ExpeditionReport report = new ExpeditionReport(path, backpack.loot(), backpack.capacity(), backpack.remaining());
        if (report.escaped()) {
            LOG.info("Escaped from {} to {}: {}", maze.getEntrance(), path.get(path.size() - 1), report);
        } else {
            LOG.info("No path found from {}: {}", maze.getEntrance(), report);
        }
        return report;
    }

    /**
     * Collects at each hollow cell of an already known path, in path order.
     *
     * @param path cells to walk, assumed to be a valid path
     * @param capacity backpack capacity to start from
     * @return the collected treasures in order, empty if nothing was viable
     */
    public @NotNull List<Treasure> takeTreasures(@NotNull List<Position> path, int capacity) {
        Backpack backpack = new Backpack(capacity);
        collectAlong(path, backpack);
        return new ArrayList<>(backpack.loot().values());
    }

    private void collectAlong(List<Position> path, Backpack backpack) {
        for (Position position : path) {
            MazeCell cell = maze.cell(position);
            if (cell.isHollowSite()) {
                collectAt(cell, backpack);
            }
        }
    }

    private void collectAt(MazeCell cell, Backpack backpack) {
        Hollow hollow = cell.getHollow();
        if (hollow == null) return;

        Selection selection = hollow.collect(selector, backpack.remaining(), config.maxTakePerVisit());
        for (Treasure treasure : selection.accepted()) {
            backpack.stow(treasure);
        }

        if (!selection.isEmpty()) {
            LOG.debug("Took {} from {} at {}, {} capacity left",
                    selection.accepted(), hollow.tile(), cell.getPosition(), backpack.remaining());
        } else {
            LOG.debug("Nothing viable in {} at {} ({} left, {} capacity)",
                    hollow.tile(), cell.getPosition(), hollow.size(), backpack.remaining());
        }
    }
}
