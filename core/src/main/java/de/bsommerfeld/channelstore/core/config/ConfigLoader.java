package de.bsommerfeld.channelstore.core.config;

import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import de.bsommerfeld.channelstore.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link StoreConfig} from a TOML file. A missing file is created with
 * the defaults so operators have something to edit.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final TomlMapper MAPPER = new TomlMapper();

    private ConfigLoader() {
    }

    /** Loads {@code config.toml} from the platform app data directory. */
    public static StoreConfig loadDefault() {
        return load(StorageUtils.getAppDataDir(StoreConfig.APP_NAME).resolve("config.toml"));
    }

    /**
     * @throws IllegalStateException if the file exists but cannot be parsed, or
     *                               the defaults cannot be written
     */
    public static StoreConfig load(Path configFile) {
        LOG.info("Loading configuration from: {}", configFile.toAbsolutePath());
        try {
            if (Files.exists(configFile)) {
                return MAPPER.readValue(configFile.toFile(), StoreConfig.class);
            }
            Path parent = configFile.toAbsolutePath().getParent();
            if (parent != null)
                Files.createDirectories(parent);
            StoreConfig defaults = new StoreConfig();
            MAPPER.writeValue(configFile.toFile(), defaults);
            LOG.info("No configuration found, wrote defaults.");
            return defaults;
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + configFile, e);
        }
    }
}
