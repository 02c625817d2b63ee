package de.bsommerfeld.sixdegrees.app;

import com.google.inject.AbstractModule;
import de.bsommerfeld.sixdegrees.core.config.CleaningConfig;
import de.bsommerfeld.sixdegrees.core.config.ConfigLoader;
import de.bsommerfeld.sixdegrees.core.config.GlobalConfig;
import de.bsommerfeld.sixdegrees.core.config.IngestConfig;
import de.bsommerfeld.sixdegrees.core.config.SearchConfig;
import de.bsommerfeld.sixdegrees.core.config.StoreConfig;
import de.bsommerfeld.sixdegrees.core.util.StorageUtils;
import de.bsommerfeld.sixdegrees.db.GraphStore;
import de.bsommerfeld.sixdegrees.db.SqliteGraphStore;

import java.nio.file.Path;

/**
 * Guice module for the command line application.
 */
public class AppModule extends AbstractModule {

    /** System property overriding the location of {@code config.toml}. */
    public static final String CONFIG_PROPERTY = "sixdegrees.config";

    private final GlobalConfig config;

    /** Loads the configuration from the default or overridden location. */
    public AppModule() {
        this(new ConfigLoader().load(configFile()));
    }

    public AppModule(GlobalConfig config) {
        this.config = config;
    }

    static Path configFile() {
        String override = System.getProperty(CONFIG_PROPERTY);
        if (override != null && !override.isBlank())
            return Path.of(override);
        return StorageUtils.getConfigFile(StorageUtils.APP_NAME);
    }

    @Override
    protected void configure() {
        bind(GlobalConfig.class).toInstance(config);

        // sections, so components depend only on what they read
        bind(StoreConfig.class).toInstance(config.getStore());
        bind(IngestConfig.class).toInstance(config.getIngest());
        bind(CleaningConfig.class).toInstance(config.getCleaning());
        bind(SearchConfig.class).toInstance(config.getSearch());

        bind(GraphStore.class).to(SqliteGraphStore.class);
    }
}
