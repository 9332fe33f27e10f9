package de.dreamcube.treasuremaze;

import de.dreamcube.treasuremaze.hollow.RandomTreasureGenerator;
import de.dreamcube.treasuremaze.hollow.Treasure;
import de.dreamcube.treasuremaze.model.InvalidMazeLayoutException;
import de.dreamcube.treasuremaze.model.Maze;
import de.dreamcube.treasuremaze.model.MazeParser;
import de.dreamcube.treasuremaze.planning.ExpeditionConfig;
import de.dreamcube.treasuremaze.runtime.Expedition;
import de.dreamcube.treasuremaze.runtime.ExpeditionReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Command line entry point: {@code TreasureMazeApp <maze-file> [capacity]}.
 *
 * <p>Without a file argument the bundled sample maze is used.</p>
 */
public final class TreasureMazeApp {

    private static final Logger LOG = LoggerFactory.getLogger(TreasureMazeApp.class);

    static final String SAMPLE_MAZE = "mazes/sample.txt";

    private TreasureMazeApp() {
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Runs one expedition and returns the process exit code.
     *
     * @return 0 if the maze was escaped, 1 if no path exists, 2 on bad input
     */
    static int run(String[] args) {
        ExpeditionConfig config;
        Maze maze;
        try {
            config = ExpeditionConfig.load();
            if (args.length > 1) {
                config = config.withBackpackCapacity(Integer.parseInt(args[1].trim()));
            }

            MazeParser parser = new MazeParser(new RandomTreasureGenerator(config), config);
            maze = args.length > 0 ? parser.load(Path.of(args[0])) : parser.loadResource(SAMPLE_MAZE);
        } catch (IOException e) {
            LOG.error("Could not read maze: {}", e.getMessage());
            return 2;
        } catch (InvalidMazeLayoutException | IllegalArgumentException e) {
            LOG.error("Invalid input: {}", e.getMessage());
            return 2;
        }

        LOG.info("Maze {}x{}, capacity {}, mode {}:\n{}",
                maze.getRows(), maze.getCols(), config.backpackCapacity(), config.collectionMode(), maze.render());

        ExpeditionReport report = new Expedition(maze, config).solve();
        if (!report.escaped()) {
            LOG.info("No way out.");
            return 1;
        }

        LOG.info("Path {}:\n{}", report.path(), maze.render(report.path()));
        for (Treasure treasure : report.collected()) {
            LOG.info("  {}", treasure);
        }
        LOG.info("Total value {}, weight {}, capacity left {}",
                report.totalValue(), report.totalWeight(), report.remainingCapacity());
        return 0;
    }
}
