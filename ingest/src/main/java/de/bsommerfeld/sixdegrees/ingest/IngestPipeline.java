package de.bsommerfeld.sixdegrees.ingest;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.sixdegrees.core.config.IngestConfig;
import de.bsommerfeld.sixdegrees.db.GraphSchema;
import de.bsommerfeld.sixdegrees.db.GraphStore;
import de.bsommerfeld.sixdegrees.db.IndexBuilder;
import de.bsommerfeld.sixdegrees.db.SqlLoader;
import de.bsommerfeld.sixdegrees.db.StoreException;
import de.bsommerfeld.sixdegrees.db.StoreTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds the graph store from a dump directory.
 *
 * <p>
 * Order: drop everything, load movies, ratings, people and edges (referenced
 * tables before referencing ones), index, clean, index again, verify. Each
 * load is checked against {@code ingest.max-skip-ratio} as soon as it
 * finishes.
 */
@Singleton
public class IngestPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(IngestPipeline.class);

    private final GraphStore store;
    private final IngestConfig config;
    private final MovieLoader movieLoader;
    private final RatingLoader ratingLoader;
    private final PersonLoader personLoader;
    private final AppearanceLoader appearanceLoader;
    private final IndexBuilder indexBuilder;
    private final CleaningStage cleaningStage;

    @Inject
    public IngestPipeline(GraphStore store, IngestConfig config, MovieLoader movieLoader,
            RatingLoader ratingLoader, PersonLoader personLoader, AppearanceLoader appearanceLoader,
            IndexBuilder indexBuilder, CleaningStage cleaningStage) {
        this.store = store;
        this.config = config;
        this.movieLoader = movieLoader;
        this.ratingLoader = ratingLoader;
        this.personLoader = personLoader;
        this.appearanceLoader = appearanceLoader;
        this.indexBuilder = indexBuilder;
        this.cleaningStage = cleaningStage;
    }

    /** Rebuilds from the configured dump directory. */
    public IngestSummary run() {
        return run(Paths.get(config.getDumpDirectory()));
    }

    /**
     * @throws UncheckedIOException          if a dump file is missing or unreadable
     * @throws DumpFormatException           on a malformed row
     * @throws SkipThresholdExceededException if a load skips too many rows
     * @throws StoreException                on any database failure
     */
    public IngestSummary run(Path dumpDir) {
        Path movies = dumpDir.resolve(config.getMoviesFile());
        Path ratings = dumpDir.resolve(config.getRatingsFile());
        Path people = dumpDir.resolve(config.getPeopleFile());
        Path appearances = dumpDir.resolve(config.getAppearancesFile());
        for (Path dump : List.of(movies, ratings, people, appearances)) {
            if (!Files.isRegularFile(dump))
                throw new UncheckedIOException(new NoSuchFileException(dump.toString()));
        }

        LOG.info("Rebuilding graph store {} from {}", store.location(), dumpDir.toAbsolutePath());
        List<LoadReport> loads = new ArrayList<>();
        CleaningReport cleaning;
        Map<StoreTable, Long> counts;
        try (Connection conn = store.openConnection()) {
            GraphSchema.dropAll(conn);

            loads.add(checked(movieLoader.load(conn, movies)));
            loads.add(checked(ratingLoader.load(conn, ratings)));
            loads.add(checked(personLoader.load(conn, people)));
            loads.add(checked(appearanceLoader.load(conn, appearances)));

            indexBuilder.buildIndexes(conn);
            cleaning = cleaningStage.clean(conn);
            indexBuilder.buildIndexes(conn);

            counts = countRows(conn);
        } catch (SQLException e) {
            throw new StoreException("Rebuild failed", e);
        }
        store.verifyTables();

        LOG.info("Graph store ready: {} people, {} movies, {} edges.",
                counts.get(StoreTable.PEOPLE), counts.get(StoreTable.MOVIES), counts.get(StoreTable.EDGES));
        return new IngestSummary(loads, cleaning, counts);
    }

    private LoadReport checked(LoadReport report) {
        if (report.skipRatio() > config.getMaxSkipRatio())
            throw new SkipThresholdExceededException(report, config.getMaxSkipRatio());
        return report;
    }

    private static Map<StoreTable, Long> countRows(Connection conn) throws SQLException {
        Map<StoreTable, Long> counts = new EnumMap<>(StoreTable.class);
        try (Statement stmt = conn.createStatement()) {
            for (StoreTable table : StoreTable.values()) {
                try (ResultSet rs = stmt.executeQuery(String.format(SqlLoader.load("count-rows"), table.tableName()))) {
                    rs.next();
                    counts.put(table, rs.getLong(1));
                }
            }
        }
        return counts;
    }
}
