package de.dreamcube.treasuremaze.model;

import de.dreamcube.treasuremaze.hollow.Hollow;
import de.dreamcube.treasuremaze.hollow.MysticalHollow;
import de.dreamcube.treasuremaze.hollow.SpookyHollow;
import de.dreamcube.treasuremaze.hollow.Treasure;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MazeTest {

    private static final Position ENTRANCE = new Position(0, 0);
    private static final List<Position> EXITS = List.of(new Position(2, 2));

    @Test
    void unlistedCellsAreOpen() {
        Maze maze = new Maze(3, 3, ENTRANCE, EXITS, List.of(new Position(1, 1)), Map.of());

        assertEquals(Tile.ENTRANCE, maze.cell(ENTRANCE).getTile());
        assertEquals(Tile.EXIT, maze.cell(2, 2).getTile());
        assertEquals(Tile.OPEN, maze.cell(0, 1).getTile());
        assertFalse(maze.isPassable(new Position(1, 1)));
        assertFalse(maze.isPassable(new Position(-1, 0)));
        assertTrue(maze.isPassable(new Position(2, 1)));
    }

    @Test
    void sharedMysticalPoolIsLinkedToEachCell() {
        MysticalHollow pool = new MysticalHollow(List.of(new Treasure(1, 1, 1)));
        Maze maze = new Maze(3, 3, ENTRANCE, EXITS, List.of(),
                Map.of(new Position(0, 2), pool, new Position(2, 0), pool));

        assertSame(pool, maze.cell(0, 2).getHollow());
        assertSame(pool, maze.cell(2, 0).getHollow());
        assertEquals(List.of(pool), maze.hollows());
        assertEquals(2, pool.linkedCells().size());
    }

    @Test
    void spookyHollowCannotBeShared() {
        SpookyHollow hollow = new SpookyHollow(List.of(new Treasure(1, 1, 1)));
        Map<Position, Hollow> hollows = Map.of(new Position(0, 2), hollow, new Position(2, 0), hollow);

        assertThrows(InvalidMazeLayoutException.class,
                () -> new Maze(3, 3, ENTRANCE, EXITS, List.of(), hollows));
    }

    @Test
    void treasureIdsMustBeUniqueAcrossHollows() {
        SpookyHollow first = new SpookyHollow(List.of(new Treasure(1, 2, 7)));
        SpookyHollow second = new SpookyHollow(List.of(new Treasure(1, 3, 5)));
        Map<Position, Hollow> hollows = Map.of(new Position(0, 1), first, new Position(0, 2), second);

        InvalidMazeLayoutException e = assertThrows(InvalidMazeLayoutException.class,
                () -> new Maze(3, 3, ENTRANCE, EXITS, List.of(), hollows));

        assertTrue(e.getMessage().contains("Treasure id 1"), e.getMessage());
        assertTrue(first.linkedCells().isEmpty());
        assertTrue(second.linkedCells().isEmpty());
    }

    @Test
    void sharedPoolMayRepeatItsOwnIds() {
        MysticalHollow pool = new MysticalHollow(List.of(new Treasure(1, 1, 1), new Treasure(2, 1, 1)));

        Maze maze = new Maze(3, 3, ENTRANCE, EXITS, List.of(),
                Map.of(new Position(0, 1), pool, new Position(1, 0), pool, new Position(2, 1), pool));

        assertEquals(List.of(pool), maze.hollows());
    }

    @Test
    void rejectedLayoutLinksNoHollow() {
        SpookyHollow single = new SpookyHollow(List.of(new Treasure(1, 1, 1)));
        SpookyHollow reused = new SpookyHollow(List.of(new Treasure(2, 1, 1)));
        MysticalHollow pool = new MysticalHollow(List.of(new Treasure(3, 1, 1)));
        Map<Position, Hollow> hollows = Map.of(
                new Position(0, 1), single,
                new Position(0, 2), reused,
                new Position(2, 0), reused,
                new Position(1, 1), pool);

        assertThrows(InvalidMazeLayoutException.class,
                () -> new Maze(3, 3, ENTRANCE, EXITS, List.of(), hollows));

        assertTrue(single.linkedCells().isEmpty());
        assertTrue(reused.linkedCells().isEmpty());
        assertTrue(pool.linkedCells().isEmpty());
    }

    @Test
    void rejectsOverlapsAndOutOfBounds() {
        assertThrows(InvalidMazeLayoutException.class,
                () -> new Maze(3, 3, ENTRANCE, EXITS, List.of(ENTRANCE), Map.of()));
        assertThrows(InvalidMazeLayoutException.class,
                () -> new Maze(3, 3, ENTRANCE, List.of(new Position(3, 0)), List.of(), Map.of()));
        assertThrows(InvalidMazeLayoutException.class,
                () -> new Maze(3, 3, ENTRANCE, List.of(), List.of(), Map.of()));
        assertThrows(InvalidMazeLayoutException.class,
                () -> new Maze(0, 3, ENTRANCE, EXITS, List.of(), Map.of()));
    }

    @Test
    void cellOutsideGridThrows() {
        Maze maze = new Maze(3, 3, ENTRANCE, EXITS, List.of(), Map.of());
        assertThrows(IndexOutOfBoundsException.class, () -> maze.cell(3, 0));
    }

    @Test
    void rendersGridAndPathOverlay() {
        Maze maze = new Maze(3, 3, ENTRANCE, EXITS, List.of(new Position(1, 1)),
                Map.of(new Position(0, 2), new SpookyHollow(List.of(new Treasure(1, 1, 1)))));

        assertEquals("P.S\n.#.\n..E", maze.render());
        assertEquals("P.S\n*#.\n**E", maze.render(List.of(
                new Position(0, 0), new Position(1, 0), new Position(2, 0), new Position(2, 1), new Position(2, 2))));
        assertEquals(maze.render(), maze.toString());
    }

    @Test
    void resetClearsVisitedFlags() {
        Maze maze = new Maze(2, 2, ENTRANCE, List.of(new Position(1, 1)), List.of(), Map.of());
        maze.cell(0, 1).setVisited(true);

        maze.resetVisited();

        assertFalse(maze.cell(0, 1).isVisited());
    }
}
