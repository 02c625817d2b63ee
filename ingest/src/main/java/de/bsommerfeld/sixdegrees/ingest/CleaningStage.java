package de.bsommerfeld.sixdegrees.ingest;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.sixdegrees.core.config.CleaningConfig;
import de.bsommerfeld.sixdegrees.core.event.ApplicationEventBus;
import de.bsommerfeld.sixdegrees.core.event.IngestEvents;
import de.bsommerfeld.sixdegrees.db.GraphStore;
import de.bsommerfeld.sixdegrees.db.SqlLoader;
import de.bsommerfeld.sixdegrees.db.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Removes movies that make poor links and the people left without any edge.
 *
 * <p>
 * Movie deletions cascade to {@code ratings} and {@code edges} through the
 * foreign keys, so the orphan-people step must run last. All steps share one
 * transaction. Every predicate selects only rows that a previous run would
 * already have removed, which makes a second run delete nothing.
 */
@Singleton
public class CleaningStage {

    private static final Logger LOG = LoggerFactory.getLogger(CleaningStage.class);

    private final GraphStore store;
    private final CleaningConfig config;
    private final ApplicationEventBus eventBus;

    @Inject
    public CleaningStage(GraphStore store, CleaningConfig config, ApplicationEventBus eventBus) {
        this.store = store;
        this.config = config;
        this.eventBus = eventBus;
    }

    /** Cleans on a fresh connection. */
    public CleaningReport clean() {
        try (Connection conn = store.openConnection()) {
            return clean(conn);
        } catch (SQLException e) {
            throw new StoreException("Cleaning failed", e);
        }
    }

    /**
     * Runs every step on {@code conn} in one transaction.
     *
     * @throws StoreException if a statement fails; nothing is deleted then
     */
    public CleaningReport clean(Connection conn) {
        List<String> titleTypes = config.getRetainedTitleTypes();
        if (titleTypes == null || titleTypes.isEmpty())
            throw new IllegalStateException("cleaning.retained-title-types must not be empty");

        Map<CleaningStep, Long> deleted = new EnumMap<>(CleaningStep.class);
        try {
            conn.setAutoCommit(false);
            try {
                deleted.put(CleaningStep.ADULT_MOVIES, update(conn, SqlLoader.load("delete-adult-movies")));
                deleted.put(CleaningStep.EXCLUDED_TITLE_TYPES, deleteExcludedTitleTypes(conn, titleTypes));
                deleted.put(CleaningStep.UNPOPULAR_MOVIES, deleteUnpopular(conn));
                deleted.put(CleaningStep.EXCLUDED_GENRES, deleteExcludedGenres(conn));
                deleted.put(CleaningStep.ORPHAN_PEOPLE, update(conn, SqlLoader.load("delete-orphan-people")));
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
            throw new StoreException("Cleaning failed", e);
        }

        CleaningReport report = new CleaningReport(deleted);
        deleted.forEach((step, rows) -> LOG.info("Cleaning {}: {} rows deleted", step, rows));
        eventBus.post(new IngestEvents.CleaningFinished(report.total()));
        return report;
    }

    private long deleteExcludedTitleTypes(Connection conn, List<String> titleTypes) throws SQLException {
        String placeholders = String.join(", ", Collections.nCopies(titleTypes.size(), "?"));
        String sql = String.format(SqlLoader.load("delete-excluded-title-types"), placeholders);
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < titleTypes.size(); i++)
                ps.setString(i + 1, titleTypes.get(i));
            return ps.executeUpdate();
        }
    }

    private long deleteUnpopular(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-unpopular-movies"))) {
            ps.setInt(1, config.getMinVotes());
            return ps.executeUpdate();
        }
    }

    private long deleteExcludedGenres(Connection conn) throws SQLException {
        List<String> genres = config.getExcludedGenres();
        if (genres == null || genres.isEmpty())
            return 0;

        long total = 0;
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-movies-with-genre"))) {
            for (String genre : genres) {
                ps.setString(1, genre);
                total += ps.executeUpdate();
            }
        }
        return total;
    }

    private static long update(Connection conn, String sql) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            return stmt.executeUpdate(sql);
        }
    }
}
