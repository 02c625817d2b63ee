package de.bsommerfeld.sixdegrees.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Handle to the relational graph store. Every component that reads or writes
 * the store receives one through its constructor; there is no shared ambient
 * connection.
 *
 * <p>
 * Connections returned by {@link #openConnection()} enforce foreign keys, so
 * deleting a movie or person cascades to {@code edges} and {@code ratings}.
 * Callers own the connection and must close it.
 */
public interface GraphStore {

    /**
     * Opens a new connection with foreign-key enforcement enabled and
     * auto-commit on.
     */
    Connection openConnection() throws SQLException;

    /**
     * Checks that all {@link StoreTable tables} exist.
     *
     * @throws MissingTablesException if one or more are absent
     * @throws StoreException         if the check itself fails
     */
    void verifyTables();

    /** Human-readable location for log output. */
    String location();
}
