package de.bsommerfeld.sixdegrees.db;

/**
 * Unchecked wrapper for failures of the graph store. The stages that throw it
 * (load, cleaning, indexing, queries) assume a consistent store, so a failure
 * is fatal to the run.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
