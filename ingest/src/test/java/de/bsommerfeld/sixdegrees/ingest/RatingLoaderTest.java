package de.bsommerfeld.sixdegrees.ingest;

import de.bsommerfeld.sixdegrees.core.event.ApplicationEventBus;
import de.bsommerfeld.sixdegrees.db.SqliteGraphStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

class RatingLoaderTest {

    @TempDir
    Path tempDir;

    private SqliteGraphStore store;
    private MovieLoader movieLoader;
    private RatingLoader ratingLoader;

    @BeforeEach
    void setUp() {
        store = new SqliteGraphStore(tempDir.resolve("graph.db"));
        var config = IngestFixtures.ingestConfig();
        var normalizer = new FieldNormalizer(config);
        var bus = new ApplicationEventBus();
        movieLoader = new MovieLoader(normalizer, bus, config);
        ratingLoader = new RatingLoader(normalizer, bus, config);
    }

    @Test
    void load_shouldSkipRatingsOfUnknownTitles() throws SQLException {
        try (Connection conn = store.openConnection()) {
            movieLoader.load(conn, IngestFixtures.dump("title.basics.tsv"));
            LoadReport report = ratingLoader.load(conn, IngestFixtures.dump("title.ratings.tsv"));

            assertEquals(8, report.inserted());
            assertEquals(1, report.dropped(RowOutcome.MISSING_MOVIE));
            assertEquals(0, IngestFixtures.count(conn,
                    "SELECT COUNT(*) FROM ratings WHERE movie_id NOT IN (SELECT id FROM movies)"));
            assertEquals(1000, IngestFixtures.count(conn, "SELECT num_votes FROM ratings WHERE movie_id = 2"));
        }
    }
}
