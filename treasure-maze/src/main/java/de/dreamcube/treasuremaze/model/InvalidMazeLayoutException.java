package de.dreamcube.treasuremaze.model;

/**
 * Thrown when a maze layout cannot be turned into a solvable grid.
 */
public class InvalidMazeLayoutException extends RuntimeException {

    public InvalidMazeLayoutException(String message) {
        super(message);
    }

    public InvalidMazeLayoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
