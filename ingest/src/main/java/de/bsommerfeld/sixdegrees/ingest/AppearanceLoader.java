package de.bsommerfeld.sixdegrees.ingest;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.sixdegrees.core.config.IngestConfig;
import de.bsommerfeld.sixdegrees.core.domain.Appearance;
import de.bsommerfeld.sixdegrees.core.domain.ExternalId;
import de.bsommerfeld.sixdegrees.core.domain.RoleCategory;
import de.bsommerfeld.sixdegrees.core.event.ApplicationEventBus;
import de.bsommerfeld.sixdegrees.db.SqlLoader;
import de.bsommerfeld.sixdegrees.db.StoreTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Loads {@code title.principals} into {@code edges}.
 *
 * <p>
 * Both endpoints are looked up before the insert; a row whose person or movie
 * is absent is skipped and counted, never half-inserted. The insert is
 * {@code INSERT OR IGNORE} on the (person, movie) pair: a second credit of
 * the same person on the same movie (director and writer, say) is a benign
 * duplicate and keeps the first role. Re-running the load is therefore
 * idempotent.
 *
 * <p>
 * Inserts are executed row by row rather than batched because the update
 * count is what tells a duplicate apart from a new edge.
 */
@Singleton
public class AppearanceLoader extends DumpLoader {

    private static final Logger LOG = LoggerFactory.getLogger(AppearanceLoader.class);

    private static final String[] COLUMNS = { "tconst", "nconst", "category" };

    @Inject
    public AppearanceLoader(FieldNormalizer normalizer, ApplicationEventBus eventBus, IngestConfig config) {
        super(StoreTable.EDGES, normalizer, eventBus, config.getBatchSize());
    }

    @Override
    protected String[] requiredColumns() {
        return COLUMNS;
    }

    @Override
    protected RowSink openSink(Connection conn) throws SQLException {
        PreparedStatement personExists = conn.prepareStatement(SqlLoader.load("exists-person"));
        PreparedStatement movieExists = conn.prepareStatement(SqlLoader.load("exists-movie"));
        PreparedStatement insert = conn.prepareStatement(SqlLoader.load("insert-edge"));
        Set<String> reportedUnknownRoles = new HashSet<>();

        return new RowSink() {
            @Override
            public RowOutcome accept(DumpRow row) throws SQLException {
                int personId = normalizer.id(ExternalId.PERSON_PREFIX, row.get("nconst"));
                int movieId = normalizer.id(ExternalId.MOVIE_PREFIX, row.get("tconst"));
                String code = normalizer.category(row.get("category")).orElse(null);

                if (!JdbcBinding.exists(personExists, personId))
                    return RowOutcome.MISSING_PERSON;
                if (!JdbcBinding.exists(movieExists, movieId))
                    return RowOutcome.MISSING_MOVIE;

                Optional<RoleCategory> role = RoleCategory.fromCode(code);
                if (role.isEmpty()) {
                    if (reportedUnknownRoles.add(String.valueOf(code)))
                        LOG.warn("Unknown role category '{}' first seen at {}", code, row.location());
                    return RowOutcome.UNKNOWN_ROLE;
                }

                Appearance edge = new Appearance(personId, movieId, role.get());
                insert.setInt(1, edge.personId());
                insert.setInt(2, edge.movieId());
                insert.setString(3, edge.role().code());
                return insert.executeUpdate() == 0 ? RowOutcome.DUPLICATE_PAIR : RowOutcome.INSERTED;
            }

            @Override
            public void flush() {
                // rows are executed individually
            }

            @Override
            public void close() throws SQLException {
                try (personExists; movieExists; insert) {
                    // closes all three
                }
            }
        };
    }
}
