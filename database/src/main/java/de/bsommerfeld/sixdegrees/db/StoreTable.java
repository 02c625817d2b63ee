package de.bsommerfeld.sixdegrees.db;

/**
 * Tables of the graph store, in load order. Parents precede the tables that
 * reference them, so dropping in reverse order never cascades through rows
 * that are about to be dropped anyway.
 */
public enum StoreTable {

    MOVIES("movies"),
    RATINGS("ratings"),
    PEOPLE("people"),
    EDGES("edges");

    private final String tableName;

    StoreTable(String tableName) {
        this.tableName = tableName;
    }

    public String tableName() {
        return tableName;
    }
}
