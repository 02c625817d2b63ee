package de.bsommerfeld.sixdegrees.ingest;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.sixdegrees.core.config.IngestConfig;
import de.bsommerfeld.sixdegrees.core.domain.ExternalId;
import de.bsommerfeld.sixdegrees.core.domain.Person;
import de.bsommerfeld.sixdegrees.core.event.ApplicationEventBus;
import de.bsommerfeld.sixdegrees.db.SqlLoader;
import de.bsommerfeld.sixdegrees.db.StoreTable;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Loads {@code name.basics} into {@code people}. The known-for column is kept
 * as raw text; it is only parsed when a resolver displays it.
 */
@Singleton
public class PersonLoader extends DumpLoader {

    private static final String[] COLUMNS = {
            "nconst", "primaryName", "birthYear", "deathYear", "knownForTitles" };

    @Inject
    public PersonLoader(FieldNormalizer normalizer, ApplicationEventBus eventBus, IngestConfig config) {
        super(StoreTable.PEOPLE, normalizer, eventBus, config.getBatchSize());
    }

    @Override
    protected String[] requiredColumns() {
        return COLUMNS;
    }

    Person toPerson(DumpRow row) {
        return new Person(
                normalizer.id(ExternalId.PERSON_PREFIX, row.get("nconst")),
                normalizer.text(row.get("primaryName")).orElse(""),
                normalizer.integer(row.get("birthYear")).orElse(null),
                normalizer.integer(row.get("deathYear")).orElse(null),
                normalizer.text(row.get("knownForTitles")).orElse(null));
    }

    @Override
    protected RowSink openSink(Connection conn) throws SQLException {
        PreparedStatement insert = conn.prepareStatement(SqlLoader.load("insert-person"));
        return new RowSink() {
            @Override
            public RowOutcome accept(DumpRow row) throws SQLException {
                Person p = toPerson(row);
                insert.setInt(1, p.id());
                insert.setString(2, p.name());
                JdbcBinding.setNullableInt(insert, 3, p.birth());
                JdbcBinding.setNullableInt(insert, 4, p.death());
                insert.setString(5, p.knownFor());
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
