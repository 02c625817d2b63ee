package de.bsommerfeld.sixdegrees.ingest;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.sixdegrees.core.config.IngestConfig;
import de.bsommerfeld.sixdegrees.core.domain.ExternalId;
import de.bsommerfeld.sixdegrees.core.domain.Movie;
import de.bsommerfeld.sixdegrees.core.event.ApplicationEventBus;
import de.bsommerfeld.sixdegrees.db.SqlLoader;
import de.bsommerfeld.sixdegrees.db.StoreTable;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Loads {@code title.basics} into {@code movies}. Must run before every table
 * that references movies.
 */
@Singleton
public class MovieLoader extends DumpLoader {

    private static final String[] COLUMNS = {
            "tconst", "titleType", "primaryTitle", "isAdult", "startYear", "runtimeMinutes", "genres" };

    @Inject
    public MovieLoader(FieldNormalizer normalizer, ApplicationEventBus eventBus, IngestConfig config) {
        super(StoreTable.MOVIES, normalizer, eventBus, config.getBatchSize());
    }

    @Override
    protected String[] requiredColumns() {
        return COLUMNS;
    }

    /** Normalizes one {@code title.basics} row. */
    Movie toMovie(DumpRow row) {
        return new Movie(
                normalizer.id(ExternalId.MOVIE_PREFIX, row.get("tconst")),
                normalizer.text(row.get("primaryTitle")).orElse(""),
                normalizer.integer(row.get("startYear")).orElse(null),
                normalizer.category(row.get("titleType")).orElse(null),
                normalizer.flag(row.get("isAdult")),
                normalizer.integer(row.get("runtimeMinutes")).orElse(null),
                normalizer.text(row.get("genres")).orElse(null));
    }

    @Override
    protected RowSink openSink(Connection conn) throws SQLException {
        PreparedStatement insert = conn.prepareStatement(SqlLoader.load("insert-movie"));
        return new RowSink() {
            @Override
            public RowOutcome accept(DumpRow row) throws SQLException {
                Movie m = toMovie(row);
                insert.setInt(1, m.id());
                insert.setString(2, m.title());
                JdbcBinding.setNullableInt(insert, 3, m.year());
                insert.setString(4, m.titleType());
                insert.setInt(5, m.adult() ? 1 : 0);
                JdbcBinding.setNullableInt(insert, 6, m.runtime());
                insert.setString(7, m.genres());
                insert.addBatch();
                return RowOutcome.INSERTED;
            }

            @Override
            public void flush() throws SQLException {
                insert.executeBatch();
            }

            @Override
            public void close() throws SQLException {
                insert.close();
            }
        };
    }
}
