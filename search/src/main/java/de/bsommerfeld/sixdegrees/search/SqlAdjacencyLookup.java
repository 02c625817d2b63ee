package de.bsommerfeld.sixdegrees.search;

import de.bsommerfeld.sixdegrees.db.SqlLoader;
import de.bsommerfeld.sixdegrees.db.StoreException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Computes neighbors on demand with a self-join on {@code edges}. Bound to
 * one connection and meant for the duration of one search; not thread-safe.
 */
public class SqlAdjacencyLookup implements AdjacencyLookup, AutoCloseable {

    private final PreparedStatement coStars;

    public SqlAdjacencyLookup(Connection conn) throws SQLException {
        this.coStars = conn.prepareStatement(SqlLoader.load("select-co-stars"));
    }

    @Override
    public Set<Integer> neighbors(int personId) {
        Set<Integer> neighbors = new LinkedHashSet<>();
        try {
            coStars.setInt(1, personId);
            coStars.setInt(2, personId);
            try (ResultSet rs = coStars.executeQuery()) {
                while (rs.next())
                    neighbors.add(rs.getInt(1));
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to load neighbors of " + personId, e);
        }
        return neighbors;
    }

    @Override
    public void close() throws SQLException {
        coStars.close();
    }
}
