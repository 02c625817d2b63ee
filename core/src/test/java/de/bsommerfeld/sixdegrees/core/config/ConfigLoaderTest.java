package de.bsommerfeld.sixdegrees.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    private final ConfigLoader loader = new ConfigLoader();

    @Test
    void load_shouldWriteDefaultsWhenMissing() {
        Path file = tempDir.resolve("nested").resolve("config.toml");

        GlobalConfig config = loader.load(file);

        assertTrue(Files.exists(file));
        assertEquals(100_000, config.getIngest().getBatchSize());
    }

    @Test
    void load_shouldReadBackWrittenDefaults() {
        Path file = tempDir.resolve("config.toml");
        loader.load(file);

        GlobalConfig reloaded = loader.load(file);

        assertEquals(20, reloaded.getCleaning().getMinVotes());
        assertEquals(1_000_000, reloaded.getSearch().getMaxNodes());
        assertEquals("\\N", reloaded.getIngest().getNullSentinel());
    }

    @Test
    void load_shouldApplyValuesFromFile() throws IOException {
        Path file = tempDir.resolve("config.toml");
        Files.writeString(file, String.join("\n",
                "[ingest]",
                "batch-size = 500",
                "max-skip-ratio = 0.25",
                "",
                "[cleaning]",
                "min-votes = 5",
                "excluded-genres = [\"News\"]",
                "",
                "[search]",
                "max-nodes = 42",
                ""), StandardCharsets.UTF_8);

        GlobalConfig config = loader.load(file);

        assertEquals(500, config.getIngest().getBatchSize());
        assertEquals(0.25, config.getIngest().getMaxSkipRatio(), 0.0001);
        assertEquals(5, config.getCleaning().getMinVotes());
        assertEquals(List.of("News"), config.getCleaning().getExcludedGenres());
        assertEquals(42, config.getSearch().getMaxNodes());
        // untouched sections keep defaults
        assertEquals("title.basics.tsv", config.getIngest().getMoviesFile());
    }

    @Test
    void load_shouldIgnoreUnknownKeys() throws IOException {
        Path file = tempDir.resolve("config.toml");
        Files.writeString(file, "[search]\nmax-nodes = 7\nflavour = \"strawberry\"\n", StandardCharsets.UTF_8);

        assertEquals(7, loader.load(file).getSearch().getMaxNodes());
    }

    @Test
    void load_shouldFailOnBrokenToml() throws IOException {
        Path file = tempDir.resolve("config.toml");
        Files.writeString(file, "[search\nmax-nodes = ", StandardCharsets.UTF_8);

        assertThrows(java.io.UncheckedIOException.class, () -> loader.load(file));
    }
}
