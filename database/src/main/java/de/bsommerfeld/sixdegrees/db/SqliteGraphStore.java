package de.bsommerfeld.sixdegrees.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.sixdegrees.core.config.StoreConfig;
import de.bsommerfeld.sixdegrees.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * SQLite-backed {@link GraphStore}.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per unit of work: one per load run, one
 * per resolver call. SQLite serializes writers at the file level, and the
 * loaders are single-threaded anyway, so pooling would buy nothing.
 * {@code PRAGMA foreign_keys} is per connection in SQLite and is switched on
 * through {@link SQLiteConfig} for every connection handed out.
 */
@Singleton
public class SqliteGraphStore implements GraphStore {

    private static final Logger LOG = LoggerFactory.getLogger(SqliteGraphStore.class);

    private final Path databaseFile;
    private final String dbUrl;
    private final Properties connectionProperties;

    @Inject
    public SqliteGraphStore(StoreConfig config) {
        this(resolveFile(config));
    }

    public SqliteGraphStore(Path databaseFile) {
        this.databaseFile = databaseFile.toAbsolutePath();
        this.dbUrl = "jdbc:sqlite:" + this.databaseFile;

        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.enforceForeignKeys(true);
        sqlite.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        sqlite.setJournalMode(SQLiteConfig.JournalMode.WAL);
        this.connectionProperties = sqlite.toProperties();

        try {
            Path parent = this.databaseFile.getParent();
            if (parent != null && !Files.exists(parent))
                Files.createDirectories(parent);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create directory for " + this.databaseFile, e);
        }
        LOG.info("Graph store at {}", this.databaseFile);
    }

    private static Path resolveFile(StoreConfig config) {
        String configured = config.getDatabaseFile();
        if (configured == null || configured.isBlank())
            return StorageUtils.getDefaultDatabaseFile(StorageUtils.APP_NAME);
        return Path.of(configured);
    }

    @Override
    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(dbUrl, connectionProperties);
    }

    @Override
    public void verifyTables() {
        List<String> missing = new ArrayList<>();
        try (Connection conn = openConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("table-exists"))) {
            for (StoreTable table : StoreTable.values()) {
                ps.setString(1, table.tableName());
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next())
                        missing.add(table.tableName());
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to inspect tables of " + databaseFile, e);
        }
        if (!missing.isEmpty()) {
            throw new MissingTablesException(missing);
        }
        LOG.debug("All mandatory tables present in {}", databaseFile);
    }

    @Override
    public String location() {
        return databaseFile.toString();
    }
}
