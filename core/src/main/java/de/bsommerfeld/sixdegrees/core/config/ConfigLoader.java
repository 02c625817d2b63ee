package de.bsommerfeld.sixdegrees.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link GlobalConfig} from a TOML file. A missing file is created with
 * the defaults so users have something to edit.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private final TomlMapper mapper;

    public ConfigLoader() {
        this.mapper = TomlMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    /**
     * Loads the configuration at {@code path}, writing defaults first if the
     * file does not exist yet.
     *
     * @throws UncheckedIOException if the file cannot be read, parsed or
     *                              created
     */
    public GlobalConfig load(Path path) {
        try {
            if (!Files.exists(path)) {
                GlobalConfig defaults = new GlobalConfig();
                Path parent = path.toAbsolutePath().getParent();
                if (parent != null)
                    Files.createDirectories(parent);
                mapper.writeValue(path.toFile(), defaults);
                LOG.info("Wrote default configuration to {}", path.toAbsolutePath());
                return defaults;
            }
            LOG.info("Loading configuration from {}", path.toAbsolutePath());
            return mapper.readValue(path.toFile(), GlobalConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load configuration from " + path, e);
        }
    }
}
