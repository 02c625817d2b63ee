package de.bsommerfeld.sixdegrees.ingest;

import de.bsommerfeld.sixdegrees.core.event.ApplicationEventBus;
import de.bsommerfeld.sixdegrees.core.event.IngestEvents;
import de.bsommerfeld.sixdegrees.db.GraphSchema;
import de.bsommerfeld.sixdegrees.db.StoreException;
import de.bsommerfeld.sixdegrees.db.StoreTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Replaces one table with the contents of one dump.
 *
 * <h3>Transaction boundaries</h3>
 * The table is dropped and recreated, then rows are inserted and committed
 * every {@code batchSize} dump rows. A failure rolls back only the open
 * batch; earlier batches stay committed. That is acceptable because a load
 * never patches a store in place: the next run drops the table again.
 *
 * <p>
 * Subclasses supply the required columns and a {@link RowSink} that turns a
 * row into an insert (or a reason not to insert).
 */
public abstract class DumpLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DumpLoader.class);

    protected final FieldNormalizer normalizer;
    private final StoreTable table;
    private final ApplicationEventBus eventBus;
    private final int batchSize;

    protected DumpLoader(StoreTable table, FieldNormalizer normalizer, ApplicationEventBus eventBus,
            int batchSize) {
        if (batchSize <= 0)
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        this.table = table;
        this.normalizer = normalizer;
        this.eventBus = eventBus;
        this.batchSize = batchSize;
    }

    /** Header columns the dump must provide. */
    protected abstract String[] requiredColumns();

    /** Prepares the statements for one load on {@code conn}. */
    protected abstract RowSink openSink(Connection conn) throws SQLException;

    public StoreTable table() {
        return table;
    }

    /**
     * Drops and recreates the table, then streams {@code dump} into it on
     * {@code conn}. Auto-commit is restored afterwards.
     *
     * @throws DumpFormatException if a row violates the dump format
     * @throws StoreException      if the database rejects a statement
     * @throws UncheckedIOException if the dump cannot be read
     */
    public LoadReport load(Connection conn, Path dump) {
        LOG.info("Loading {} from {}", table.tableName(), dump);
        LoadReport.Builder report = LoadReport.builder(table);
        try {
            conn.setAutoCommit(false);
            try {
                GraphSchema.recreate(conn, table);
                conn.commit();
                stream(conn, dump, report);
            } catch (SQLException | IOException | RuntimeException e) {
                rollback(conn, e);
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Loading " + table.tableName() + " failed", e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + dump, e);
        }

        LoadReport result = report.build();
        LOG.info("Loaded {} rows into {} ({} skipped, {} duplicates).", result.inserted(), table.tableName(),
                result.skipped(), result.dropped(RowOutcome.DUPLICATE_PAIR));
        eventBus.post(new IngestEvents.TableLoaded(table.tableName(), result.inserted(), result.skipped()));
        return result;
    }

    private void stream(Connection conn, Path dump, LoadReport.Builder report) throws SQLException, IOException {
        try (DumpReader reader = DumpReader.open(dump, requiredColumns());
                RowSink sink = openSink(conn)) {
            long sinceCommit = 0;
            for (DumpRow row : reader) {
                RowOutcome outcome;
                try {
                    outcome = sink.accept(row);
                } catch (DumpFormatException e) {
                    throw new DumpFormatException(row.location() + ": " + e.getMessage(), e);
                }
                report.record(outcome);
                if (outcome != RowOutcome.INSERTED)
                    LOG.debug("Skipping {} ({})", row.location(), outcome);

                if (++sinceCommit >= batchSize) {
                    sink.flush();
                    conn.commit();
                    sinceCommit = 0;
                    eventBus.post(new IngestEvents.BatchCommitted(table.tableName(), report.inserted()));
                }
            }
            sink.flush();
            conn.commit();
        }
    }

    private static void rollback(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    /**
     * Per-load insert logic. Rows may be buffered in JDBC batches until
     * {@link #flush()}.
     */
    protected interface RowSink extends AutoCloseable {

        RowOutcome accept(DumpRow row) throws SQLException;

        /** Executes buffered statements; called before every commit. */
        void flush() throws SQLException;

        @Override
        void close() throws SQLException;
    }
}
