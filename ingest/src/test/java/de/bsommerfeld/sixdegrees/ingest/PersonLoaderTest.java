package de.bsommerfeld.sixdegrees.ingest;

import de.bsommerfeld.sixdegrees.core.event.ApplicationEventBus;
import de.bsommerfeld.sixdegrees.db.SqliteGraphStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

class PersonLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_shouldKeepKnownForAsRawText() throws SQLException {
        var store = new SqliteGraphStore(tempDir.resolve("graph.db"));
        var config = IngestFixtures.ingestConfig();
        var loader = new PersonLoader(new FieldNormalizer(config), new ApplicationEventBus(), config);

        try (Connection conn = store.openConnection()) {
            LoadReport report = loader.load(conn, IngestFixtures.dump("name.basics.tsv"));
            assertEquals(8, report.inserted());

            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT name, birth, death, known_for FROM people WHERE id = ?")) {
                ps.setInt(1, 1);
                try (ResultSet rs = ps.executeQuery()) {
                    assertTrue(rs.next());
                    assertEquals("Kevin Bacon", rs.getString("name"));
                    assertEquals(1958, rs.getInt("birth"));
                    assertNull(rs.getObject("death"));
                    assertEquals("tt0000001,tt0000002,tt0000009", rs.getString("known_for"));
                }

                ps.setInt(1, 8);
                try (ResultSet rs = ps.executeQuery()) {
                    assertTrue(rs.next());
                    assertNull(rs.getObject("known_for"));
                }
            }
        }
    }
}
