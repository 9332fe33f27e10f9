package de.dreamcube.treasuremaze.pathfinding;

import de.dreamcube.treasuremaze.hollow.Treasure;
import de.dreamcube.treasuremaze.hollow.TreasureGenerator;
import de.dreamcube.treasuremaze.model.Direction;
import de.dreamcube.treasuremaze.model.Maze;
import de.dreamcube.treasuremaze.model.MazeCell;
import de.dreamcube.treasuremaze.model.MazeParser;
import de.dreamcube.treasuremaze.model.Position;
import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DepthFirstEscapeTest {

    private static final TreasureGenerator ONE_TREASURE = new TreasureGenerator() {
        private int nextId = 1;

        @Override
        public @NotNull Treasure generate() {
            return new Treasure(nextId++, 1, 1);
        }

        @Override
        public int nextBatchSize() {
            return 1;
        }
    };

    private final MazeParser parser = new MazeParser(ONE_TREASURE, 400, 400);

    @Test
    void findsStraightCorridor() {
        Maze maze = parser.parse("P..E");

        List<Position> path = new DepthFirstEscape(maze).findWayOut();

        assertEquals(List.of(new Position(0, 0), new Position(0, 1), new Position(0, 2), new Position(0, 3)), path);
    }

    @Test
    void enclosedEntranceHasNoPath() {
        Maze maze = parser.parse(List.of(
                "#####",
                "#P#.#",
                "###.#",
                "#..E#",
                "#####"));

        DepthFirstEscape search = new DepthFirstEscape(maze);

        assertEquals(List.of(), search.findWayOut());
        assertEquals(1, search.getEnteredCells());
    }

    @Test
    void unreachableExitExhaustsComponentOnce() {
        Maze maze = parser.parse(List.of(
                "P..#.",
                "...#E"));

        DepthFirstEscape search = new DepthFirstEscape(maze);

        assertEquals(List.of(), search.findWayOut());
        assertEquals(6, search.getEnteredCells());
    }

    @Test
    void firstExitInCompassOrderWins() {
        // Exits above and below the entrance; UP is tried before DOWN.
        Maze maze = parser.parse(List.of(
                ".E.",
                ".P.",
                ".E."));

        assertEquals(List.of(new Position(1, 1), new Position(0, 1)), new DepthFirstEscape(maze).findWayOut());
    }

    @Test
    void exhaustsDownwardBranchBeforeTurningRight() {
        // DOWN is tried before RIGHT; the dead-end pocket is explored once and never re-entered.
        Maze maze = parser.parse(List.of(
                "PE",
                ".#",
                "..",
                ".."));

        DepthFirstEscape search = new DepthFirstEscape(maze);
        List<Position> path = search.findWayOut();

        assertEquals(List.of(new Position(0, 0), new Position(0, 1)), path);
        assertEquals(7, search.getEnteredCells());
    }

    @Test
    void repeatedSearchGivesSamePath() {
        Maze maze = parser.parse(List.of(
                "P...#",
                ".##.#",
                "..#..",
                "#...E"));
        DepthFirstEscape search = new DepthFirstEscape(maze);

        List<Position> first = search.findWayOut();
        List<Position> second = search.findWayOut();

        assertEquals(first, second);
    }

    @Test
    void listenerSeesEveryEnteredCellOnce() {
        Maze maze = parser.parse(List.of(
                "P.S",
                ".#.",
                "S.E"));
        List<MazeCell> entered = new ArrayList<>();

        DepthFirstEscape search = new DepthFirstEscape(maze);
        List<Position> path = search.findWayOut(entered::add);

        Set<MazeCell> distinct = new HashSet<>(entered);
        assertEquals(entered.size(), distinct.size());
        assertEquals(search.getEnteredCells(), entered.size());
        assertEquals(maze.getEntrance(), entered.get(0).getPosition());
        assertEquals(path.get(path.size() - 1), entered.get(entered.size() - 1).getPosition());
    }

    @Test
    void deepSerpentineDoesNotOverflowStack() {
        int rows = 301;
        int cols = 301;
        List<String> lines = new ArrayList<>();
        for (int row = 0; row < rows; row++) {
            StringBuilder line = new StringBuilder();
            for (int col = 0; col < cols; col++) {
                boolean wall = row % 2 == 1 && (row % 4 == 1 ? col != cols - 1 : col != 0);
                line.append(wall ? '#' : '.');
            }
            lines.add(line.toString());
        }
        lines.set(0, "P" + lines.get(0).substring(1));
        String last = lines.get(rows - 1);
        lines.set(rows - 1, last.substring(0, cols - 1) + "E");

        Maze maze = parser.parse(lines);
        List<Position> path = new DepthFirstEscape(maze).findWayOut();

        assertValidPath(maze, path);
        assertTrue(path.size() > rows * cols / 2, "path length " + path.size());
    }

    @Test
    void randomMazesYieldValidPathsExactlyWhenReachable() {
        Random random = new Random(2024L);
        for (int round = 0; round < 300; round++) {
            int rows = 2 + random.nextInt(10);
            int cols = 2 + random.nextInt(10);
            Maze maze = randomMaze(random, rows, cols);

            List<Position> path = new DepthFirstEscape(maze).findWayOut();

            if (reachable(maze)) {
                assertValidPath(maze, path);
            } else {
                assertEquals(List.of(), path, "round " + round + "\n" + maze.render());
            }
        }
    }

    private static void assertValidPath(Maze maze, List<Position> path) {
        assertTrue(!path.isEmpty(), "expected a path\n" + maze.render());
        assertEquals(maze.getEntrance(), path.get(0));
        assertTrue(maze.cell(path.get(path.size() - 1)).isExit());
        Set<Position> seen = new HashSet<>();
        for (int i = 0; i < path.size(); i++) {
            Position position = path.get(i);
            assertTrue(maze.isPassable(position), position + " is not passable");
            assertTrue(seen.add(position), position + " repeats");
            if (i > 0) {
                assertTrue(path.get(i - 1).isAdjacentTo(position), path.get(i - 1) + " -> " + position);
            }
        }
    }

    private static Maze randomMaze(Random random, int rows, int cols) {
        List<Position> cells = new ArrayList<>();
        for (int row = 0; row < rows; row++) {
            for (int col = 0; col < cols; col++) {
                cells.add(new Position(row, col));
            }
        }
        Position entrance = cells.remove(random.nextInt(cells.size()));
        List<Position> exits = new ArrayList<>();
        int exitCount = 1 + random.nextInt(Math.min(3, cells.size()));
        for (int i = 0; i < exitCount; i++) {
            exits.add(cells.remove(random.nextInt(cells.size())));
        }
        List<Position> walls = new ArrayList<>();
        for (Position position : cells) {
            if (random.nextInt(100) < 35) {
                walls.add(position);
            }
        }
        return new Maze(rows, cols, entrance, exits, walls, Map.of());
    }

    private static boolean reachable(Maze maze) {
        ArrayDeque<Position> queue = new ArrayDeque<>();
        Set<Position> seen = new HashSet<>();
        queue.add(maze.getEntrance());
        seen.add(maze.getEntrance());
        while (!queue.isEmpty()) {
            Position current = queue.poll();
            if (maze.cell(current).isExit()) {
                return true;
            }
            for (Direction direction : Direction.values()) {
                Position next = current.neighbour(direction);
                if (maze.isPassable(next) && seen.add(next)) {
                    queue.add(next);
                }
            }
        }
        return false;
    }
}
