package de.dreamcube.treasuremaze.model;

import de.dreamcube.treasuremaze.hollow.Hollow;
import de.dreamcube.treasuremaze.hollow.MysticalHollow;
import de.dreamcube.treasuremaze.hollow.SpookyHollow;
import de.dreamcube.treasuremaze.hollow.TreasureGenerator;
import de.dreamcube.treasuremaze.planning.ExpeditionConfig;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads maze layouts made of one text line per row.
 *
 * <p>Symbols are those of {@link Tile}; a space also counts as open ground. Every {@code S} gets
 * its own freshly generated {@link SpookyHollow}. All {@code M} cells of one layout are linked to a
 * single generated {@link MysticalHollow}.</p>
 *
 * <p>A layout is rejected with {@link InvalidMazeLayoutException} when it is empty, its rows differ
 * in length, it exceeds the configured size, it contains an unknown symbol, or it does not have
 * exactly one entrance and at least one exit.</p>
 */
public final class MazeParser {

    private static final Logger LOG = LoggerFactory.getLogger(MazeParser.class);

    private final TreasureGenerator generator;
    private final int maxRows;
    private final int maxCols;

    /**
     * Creates a parser with the size bounds of the given config.
     */
    public MazeParser(@NotNull TreasureGenerator generator, @NotNull ExpeditionConfig config) {
        this(generator, config.maxRows(), config.maxCols());
    }

    /**
     * Creates a parser with explicit size bounds.
     */
    public MazeParser(@NotNull TreasureGenerator generator, int maxRows, int maxCols) {
        this.generator = generator;
        this.maxRows = maxRows;
        this.maxCols = maxCols;
    }

    /**
     * Reads and parses a layout file.
     *
     * @throws IOException if the file cannot be read
     */
    public @NotNull Maze load(@NotNull Path file) throws IOException {
        LOG.debug("Loading maze from {}", file);
        return parse(Files.readAllLines(file, StandardCharsets.UTF_8));
    }

    /**
     * Reads and parses a layout from the classpath.
     *
     * @throws IOException if the resource is missing or cannot be read
     */
    public @NotNull Maze loadResource(@NotNull String resource) throws IOException {
        try (InputStream in = MazeParser.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("Maze resource not found: " + resource);
            }
            BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            List<String> lines = new ArrayList<>();
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
            return parse(lines);
        }
    }

    /**
     * Parses a layout given as one string with newline-separated rows.
     */
    public @NotNull Maze parse(@NotNull String layout) {
        return parse(Arrays.asList(layout.split("\n", -1)));
    }

    /**
     * Parses a layout given as rows.
     */
    public @NotNull Maze parse(@NotNull List<String> lines) {
        List<String> rowsText = normalise(lines);
        if (rowsText.isEmpty()) {
            throw new InvalidMazeLayoutException("Maze layout is empty");
        }

        int rows = rowsText.size();
        int cols = rowsText.get(0).length();
        if (cols == 0) {
            throw new InvalidMazeLayoutException("Maze layout has an empty first row");
        }
        if (rows > maxRows || cols > maxCols) {
            throw new InvalidMazeLayoutException("Maze " + rows + "x" + cols
                    + " exceeds the configured limit " + maxRows + "x" + maxCols);
        }

        Position entrance = null;
        List<Position> exits = new ArrayList<>();
        List<Position> walls = new ArrayList<>();
        Map<Position, Hollow> hollows = new LinkedHashMap<>();
        MysticalHollow sharedPool = null;

        for (int row = 0; row < rows; row++) {
            String line = rowsText.get(row);
            if (line.length() != cols) {
                throw new InvalidMazeLayoutException("Uneven columns: row " + row + " has " + line.length()
                        + " cells, expected " + cols);
            }

            for (int col = 0; col < cols; col++) {
                char symbol = line.charAt(col);
                Tile tile = Tile.fromSymbol(symbol);
                if (tile == null) {
                    throw new InvalidMazeLayoutException("Invalid tile '" + symbol + "' at (" + row + ", " + col + ")");
                }

                Position position = new Position(row, col);
                switch (tile) {
                    case ENTRANCE -> {
                        if (entrance != null) {
                            throw new InvalidMazeLayoutException("Multiple entrances: " + entrance + " and " + position);
                        }
                        entrance = position;
                    }
                    case EXIT -> exits.add(position);
                    case WALL -> walls.add(position);
                    case SPOOKY_HOLLOW -> hollows.put(position, SpookyHollow.generate(generator));
                    case MYSTICAL_HOLLOW -> {
                        if (sharedPool == null) {
                            sharedPool = MysticalHollow.generate(generator);
                        }
                        hollows.put(position, sharedPool);
                    }
                    case OPEN -> {
                        // nothing to record
                    }
                }
            }
        }

        if (entrance == null) {
            throw new InvalidMazeLayoutException("Maze has no entrance ('" + Tile.ENTRANCE.symbol() + "')");
        }
        if (exits.isEmpty()) {
            throw new InvalidMazeLayoutException("Maze has no exit ('" + Tile.EXIT.symbol() + "')");
        }

        LOG.debug("Parsed {}x{} maze with {} exits, {} walls and {} hollow sites",
                rows, cols, exits.size(), walls.size(), hollows.size());
        return new Maze(rows, cols, entrance, exits, walls, hollows);
    }

    /**
     * Drops carriage returns and trailing empty lines.
     */
    private static List<String> normalise(List<String> lines) {
        List<String> result = new ArrayList<>(lines.size());
        for (String line : lines) {
            String text = line == null ? "" : line;
            if (text.endsWith("\r")) {
                text = text.substring(0, text.length() - 1);
            }
            result.add(text);
        }
        while (!result.isEmpty() && result.get(result.size() - 1).isEmpty()) {
            result.remove(result.size() - 1);
        }
        return result;
    }
}
