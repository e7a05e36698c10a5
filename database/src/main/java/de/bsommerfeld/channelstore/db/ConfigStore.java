package de.bsommerfeld.channelstore.db;

import de.bsommerfeld.channelstore.core.config.ApplicationMode;
import de.bsommerfeld.channelstore.core.config.StoreConfig;
import de.bsommerfeld.channelstore.core.domain.EntityKind;
import de.bsommerfeld.channelstore.core.error.StorageUnavailableException;
import de.bsommerfeld.channelstore.core.error.StoreException;
import de.bsommerfeld.channelstore.core.event.ApplicationEventBus;
import de.bsommerfeld.channelstore.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Entry point of the configuration store. Owns the {@link SchemaManager} and
 * hands its connection to one repository per entity kind.
 *
 * <p>
 * Not thread-safe: the store is meant to be driven from a single thread. Use
 * try-with-resources or call {@link #close()} at shutdown so the connection
 * is released deterministically.
 */
public class ConfigStore implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigStore.class);
    private static final int DEFAULT_BUSY_TIMEOUT_MS = new StoreConfig().getBusyTimeoutMs();

    private final SchemaManager schema;
    private final ChannelRepository channels;
    private final SourceRepository sources;
    private final SiteRepository sites;

    /**
     * Wraps an already opened schema manager whose schema has been applied.
     * The store takes ownership and closes it in {@link #close()}.
     */
    public ConfigStore(SchemaManager schema, ApplicationEventBus eventBus) {
        this.schema = schema;
        this.channels = new ChannelRepository(schema.connection(), eventBus);
        this.sources = new SourceRepository(schema.connection(), eventBus);
        this.sites = new SiteRepository(schema.connection(), eventBus);
    }

    /**
     * Opens the store the way {@code config} and {@code mode} describe: an
     * in-memory database in TEST mode, otherwise the configured file resolved
     * against the app data directory.
     *
     * @throws StorageUnavailableException if the database cannot be opened or
     *                                     prepared
     */
    public static ConfigStore open(StoreConfig config, ApplicationMode mode, ApplicationEventBus eventBus) {
        if (mode.isInMemory()) {
            LOG.info("Application mode {}: using in-memory database.", mode);
            return initialize(SchemaManager.openInMemory(config.getBusyTimeoutMs()), eventBus);
        }
        Path file = StorageUtils.resolveDataFile(
                StorageUtils.getAppDataDir(StoreConfig.APP_NAME), config.getDatabaseFile());
        return open(file, config.getBusyTimeoutMs(), eventBus);
    }

    public static ConfigStore open(Path file, ApplicationEventBus eventBus) {
        return open(file, DEFAULT_BUSY_TIMEOUT_MS, eventBus);
    }

    public static ConfigStore open(Path file, int busyTimeoutMs, ApplicationEventBus eventBus) {
        return initialize(SchemaManager.open(file, busyTimeoutMs), eventBus);
    }

    private static ConfigStore initialize(SchemaManager schema, ApplicationEventBus eventBus) {
        try {
            schema.ensureSchema();
        } catch (StoreException e) {
            schema.close();
            throw e;
        }
        return new ConfigStore(schema, eventBus);
    }

    public ChannelRepository channels() {
        return channels;
    }

    public SourceRepository sources() {
        return sources;
    }

    public SiteRepository sites() {
        return sites;
    }

    /**
     * Returns the repository for {@code kind}, for front ends that handle all
     * three levels through one code path.
     */
    public EntityRepository<?> repository(EntityKind kind) {
        switch (kind) {
            case CHANNEL:
                return channels;
            case SOURCE:
                return sources;
            case SITE:
                return sites;
            default:
                throw new IllegalArgumentException("Unknown entity kind: " + kind);
        }
    }

    public boolean isOpen() {
        return schema.isOpen();
    }

    @Override
    public void close() {
        LOG.info("Shutting down ConfigStore...");
        schema.close();
    }
}
