package de.bsommerfeld.sixdegrees.db;

import org.junit.jupiter.api.function.Executable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IndexBuilderTest {

    @TempDir
    Path tempDir;

    private SqliteGraphStore store;

    @BeforeEach
    void setUp() throws SQLException {
        store = new SqliteGraphStore(tempDir.resolve("graph.db"));
        try (Connection conn = store.openConnection()) {
            for (StoreTable table : StoreTable.values())
                GraphSchema.recreate(conn, table);
        }
    }

    @Test
    void buildIndexes_shouldCreateAdjacencyIndexes() {
        new IndexBuilder(store).buildIndexes();

        assertEquals(List.of("edges_movie_id_index", "edges_person_id_index", "ratings_movie_id_index"),
                new IndexBuilder(store).listIndexes());
    }

    @Test
    void buildIndexes_shouldBeIdempotent() {
        IndexBuilder builder = new IndexBuilder(store);
        builder.buildIndexes();
        List<String> first = builder.listIndexes();

        assertDoesNotThrow((Executable) builder::buildIndexes);
        assertEquals(first, builder.listIndexes());
    }

    @Test
    void buildIndexes_onCallerConnection_shouldNotOpenAnotherOne() throws SQLException {
        GraphStore counting = spy(store);
        IndexBuilder builder = new IndexBuilder(counting);

        try (Connection conn = store.openConnection()) {
            assertEquals(3, builder.buildIndexes(conn));
            assertTrue(conn.getAutoCommit());
        }

        verify(counting, never()).openConnection();
        assertEquals(3, builder.listIndexes().size());
    }

    @Test
    void buildIndexes_shouldWrapConnectionFailure() throws SQLException {
        GraphStore broken = mock(GraphStore.class);
        when(broken.openConnection()).thenThrow(new SQLException("disk gone"));

        StoreException ex = assertThrows(StoreException.class, () -> new IndexBuilder(broken).buildIndexes());
        assertEquals("disk gone", ex.getCause().getMessage());
    }
}
