package de.bsommerfeld.sixdegrees.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Drops and recreates store tables. The store is never migrated or patched:
 * a table is replaced wholesale every time its dump is loaded.
 *
 * <p>
 * DDL lives in {@code sql/drop-<table>.sql} and {@code sql/create-<table>.sql}.
 */
public final class GraphSchema {

    private static final Logger LOG = LoggerFactory.getLogger(GraphSchema.class);

    private GraphSchema() {
    }

    /**
     * Drops {@code table} if it exists and creates it empty.
     */
    public static void recreate(Connection conn, StoreTable table) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(SqlLoader.load("drop-" + table.tableName()));
            stmt.execute(SqlLoader.load("create-" + table.tableName()));
        }
        LOG.debug("Recreated table {}", table.tableName());
    }

    /**
     * Drops every table, children first, so that dropping a parent does not
     * cascade row by row through a populated child table.
     */
    public static void dropAll(Connection conn) throws SQLException {
        List<StoreTable> tables = List.of(StoreTable.values());
        try (Statement stmt = conn.createStatement()) {
            for (int i = tables.size() - 1; i >= 0; i--) {
                stmt.execute(SqlLoader.load("drop-" + tables.get(i).tableName()));
            }
        }
        LOG.info("Dropped all graph store tables.");
    }
}
