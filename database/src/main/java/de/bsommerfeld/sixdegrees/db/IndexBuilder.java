package de.bsommerfeld.sixdegrees.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the lookup indexes used by adjacency and hydration queries:
 * {@code edges(movie_id)}, {@code edges(person_id)} and
 * {@code ratings(movie_id)}.
 *
 * <p>
 * The ingest pipeline calls this once after the bulk load, so that cascading
 * deletes during cleaning find child rows by index, and once more after
 * cleaning. Every statement is {@code CREATE INDEX IF NOT EXISTS}; running it
 * again is a no-op.
 */
@Singleton
public class IndexBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(IndexBuilder.class);

    private final GraphStore store;

    @Inject
    public IndexBuilder(GraphStore store) {
        this.store = store;
    }

    /**
     * @return number of index statements executed
     * @throws StoreException if any statement fails
     */
    public int buildIndexes() {
        try (Connection conn = store.openConnection()) {
            return buildIndexes(conn);
        } catch (SQLException e) {
            throw new StoreException("Index creation failed", e);
        }
    }

    /**
     * Runs every index statement on {@code conn} in one transaction and
     * leaves the connection in auto-commit mode.
     *
     * @return number of index statements executed
     * @throws StoreException if any statement fails; no index is added then
     */
    public int buildIndexes(Connection conn) {
        int executed = 0;
        try {
            conn.setAutoCommit(false);
            try (Statement stmt = conn.createStatement()) {
                for (String sql : SqlLoader.loadScript("create-indexes")) {
                    stmt.execute(sql);
                    executed++;
                }
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                try {
                    conn.rollback();
                } catch (SQLException rollbackFailure) {
                    e.addSuppressed(rollbackFailure);
                }
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Index creation failed", e);
        }
        LOG.info("Ensured {} lookup indexes.", executed);
        return executed;
    }

    /** Names of the explicitly created indexes currently in the store, sorted. */
    public List<String> listIndexes() {
        List<String> names = new ArrayList<>();
        try (Connection conn = store.openConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-index-names"));
                ResultSet rs = ps.executeQuery()) {
            while (rs.next())
                names.add(rs.getString("name"));
        } catch (SQLException e) {
            throw new StoreException("Failed to list indexes", e);
        }
        return names;
    }
}
