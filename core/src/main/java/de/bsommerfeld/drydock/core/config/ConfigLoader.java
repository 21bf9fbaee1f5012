package de.bsommerfeld.drydock.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@code config.toml}. A missing file is created with the defaults so
 * the user has something to edit; an unreadable or malformed file is an error.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private ConfigLoader() {
    }

    public static DryDockConfig load(Path configPath) throws IOException {
        if (!Files.exists(configPath)) {
            LOG.info("No configuration at {}, writing defaults.", configPath.toAbsolutePath());
            DryDockConfig defaults = new DryDockConfig();
            write(configPath, defaults);
            return defaults;
        }
        LOG.info("Loading configuration from {}", configPath.toAbsolutePath());
        return MAPPER.readValue(configPath.toFile(), DryDockConfig.class);
    }

    public static void write(Path configPath, DryDockConfig config) throws IOException {
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null)
            Files.createDirectories(parent);
        MAPPER.writeValue(configPath.toFile(), config);
    }
}
