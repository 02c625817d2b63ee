package de.bsommerfeld.sixdegrees.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads and caches SQL statements from classpath resource files under
 * {@code sql/}. Each module ships its own statements there: the schema and
 * index DDL with this module, the load statements with {@code ingest}, the
 * adjacency and lookup queries with {@code search}.
 *
 * <p>
 * Each file is read exactly once and cached for the lifetime of the JVM.
 * The naming convention is {@code sql/<operation>-<entity>.sql},
 * e.g. {@code insert-movie.sql}, {@code select-co-stars.sql}.
 */
public final class SqlLoader {

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the SQL statement from {@code sql/<name>.sql} on the classpath,
     * trimmed and cached.
     *
     * @param name the file stem without path prefix or extension
     * @return the SQL string, ready for {@link java.sql.PreparedStatement} use
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent(name, SqlLoader::readResource);
    }

    /**
     * Returns the statements of a multi-statement script, split on semicolons
     * that end a line.
     */
    public static List<String> loadScript(String name) {
        List<String> statements = new ArrayList<>();
        for (String sql : load(name).split(";\\s*(\\r?\\n|$)")) {
            String trimmed = sql.trim();
            if (!trimmed.isEmpty())
                statements.add(trimmed);
        }
        return statements;
    }

    private static String readResource(String name) {
        String path = "sql/" + name + ".sql";
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }
}
