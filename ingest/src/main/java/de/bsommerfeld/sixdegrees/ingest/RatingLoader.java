package de.bsommerfeld.sixdegrees.ingest;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.sixdegrees.core.config.IngestConfig;
import de.bsommerfeld.sixdegrees.core.domain.ExternalId;
import de.bsommerfeld.sixdegrees.core.domain.Rating;
import de.bsommerfeld.sixdegrees.core.event.ApplicationEventBus;
import de.bsommerfeld.sixdegrees.db.SqlLoader;
import de.bsommerfeld.sixdegrees.db.StoreTable;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Loads {@code title.ratings} into {@code ratings}. Ratings of titles that
 * are not in {@code movies} are skipped and counted.
 */
@Singleton
public class RatingLoader extends DumpLoader {

    private static final String[] COLUMNS = { "tconst", "averageRating", "numVotes" };

    @Inject
    public RatingLoader(FieldNormalizer normalizer, ApplicationEventBus eventBus, IngestConfig config) {
        super(StoreTable.RATINGS, normalizer, eventBus, config.getBatchSize());
    }

    @Override
    protected String[] requiredColumns() {
        return COLUMNS;
    }

    Rating toRating(DumpRow row) {
        return new Rating(
                normalizer.id(ExternalId.MOVIE_PREFIX, row.get("tconst")),
                normalizer.decimal(row.get("averageRating")).orElse(null),
                normalizer.integer(row.get("numVotes")).orElse(null));
    }

    @Override
    protected RowSink openSink(Connection conn) throws SQLException {
        PreparedStatement movieExists = conn.prepareStatement(SqlLoader.load("exists-movie"));
        PreparedStatement insert = conn.prepareStatement(SqlLoader.load("insert-rating"));
        return new RowSink() {
            @Override
            public RowOutcome accept(DumpRow row) throws SQLException {
                Rating r = toRating(row);
                if (!JdbcBinding.exists(movieExists, r.movieId()))
                    return RowOutcome.MISSING_MOVIE;

                insert.setInt(1, r.movieId());
                JdbcBinding.setNullableDouble(insert, 2, r.average());
                JdbcBinding.setNullableInt(insert, 3, r.numVotes());
                insert.addBatch();
                return RowOutcome.INSERTED;
            }

            @Override
            public void flush() throws SQLException {
                insert.executeBatch();
            }

            @Override
            public void close() throws SQLException {
                try (movieExists; insert) {
                    // closes both
                }
            }
        };
    }
}
