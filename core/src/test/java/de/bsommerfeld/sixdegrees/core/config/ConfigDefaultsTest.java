package de.bsommerfeld.sixdegrees.core.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigDefaultsTest {

    @Test
    void globalConfig_shouldInitializeWithDefaults() {
        var config = new GlobalConfig();

        assertNotNull(config.getStore());
        assertNotNull(config.getIngest());
        assertNotNull(config.getCleaning());
        assertNotNull(config.getSearch());
    }

    @Test
    void ingestConfig_shouldHaveReasonableDefaults() {
        var config = new IngestConfig();

        assertEquals(100_000, config.getBatchSize());
        assertEquals("\\N", config.getNullSentinel());
        assertEquals(1.0, config.getMaxSkipRatio(), 0.0001);
        assertEquals("title.principals.tsv", config.getAppearancesFile());
    }

    @Test
    void cleaningConfig_shouldRetainTheFourTitleTypes() {
        var config = new CleaningConfig();

        assertEquals(List.of("movie", "short", "tvSeries", "tvMiniSeries"), config.getRetainedTitleTypes());
        assertEquals(20, config.getMinVotes());
        assertEquals(List.of("News", "Talk-Show", "Reality-TV", "Adult"), config.getExcludedGenres());
    }

    @Test
    void searchConfig_shouldDefaultToOneMillionNodes() {
        assertEquals(1_000_000, new SearchConfig().getMaxNodes());
    }

    @Test
    void storeConfig_shouldDefaultToAppDataFile() {
        assertTrue(new StoreConfig().getDatabaseFile().isEmpty());
    }
}
