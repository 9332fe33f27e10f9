package de.dreamcube.treasuremaze.planning;

/**
 * When treasures are taken during an expedition.
 */
public enum CollectionMode {
    /** Collect on first entry into a hollow cell while the search runs, even on dead-end branches. */
    DURING_SEARCH,
    /** Find the escape path first, then collect at the hollow cells on that path in order. */
    ALONG_PATH
}
