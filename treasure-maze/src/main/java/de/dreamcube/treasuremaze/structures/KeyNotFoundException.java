package de.dreamcube.treasuremaze.structures;

import java.util.NoSuchElementException;

/**
 * Thrown when a keyed container is asked to remove a key it does not hold.
 *
 * <p>Callers use this to tell an entry that was already taken apart from a silent no-op.</p>
 */
public class KeyNotFoundException extends NoSuchElementException {

    private final transient Object key;

    /**
     * Creates a new exception for the missing key.
     *
     * @param key the key that was not present
     */
    public KeyNotFoundException(Object key) {
        super("Key not found: " + key);
        this.key = key;
    }

    /**
     * Returns the key that was not present.
     */
    public Object getKey() {
        return key;
    }
}
