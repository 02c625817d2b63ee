package de.bsommerfeld.sixdegrees.db;

import java.util.List;

/**
 * Thrown before any query work when the graph store lacks mandatory tables,
 * typically because no load has been run yet.
 */
public class MissingTablesException extends StoreException {

    private final List<String> missingTables;

    public MissingTablesException(List<String> missingTables) {
        super("Mandatory graph store tables not found: " + String.join(", ", missingTables));
        this.missingTables = List.copyOf(missingTables);
    }

    public List<String> getMissingTables() {
        return missingTables;
    }
}
