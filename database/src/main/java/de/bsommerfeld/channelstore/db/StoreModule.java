package de.bsommerfeld.channelstore.db;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.channelstore.core.config.ApplicationMode;
import de.bsommerfeld.channelstore.core.config.ConfigLoader;
import de.bsommerfeld.channelstore.core.config.StoreConfig;
import de.bsommerfeld.channelstore.core.event.ApplicationEventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guice wiring for front ends. Binds the loaded configuration, the event bus
 * and one {@link ConfigStore} per injector. Whoever creates the injector owns
 * the store and must close it at shutdown.
 */
public class StoreModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(StoreModule.class);

    private final StoreConfig config;
    private final ApplicationMode mode;

    /** Loads {@code config.toml} from the app data directory and resolves the mode. */
    public StoreModule() {
        this(ConfigLoader.loadDefault(), ApplicationMode.get());
    }

    public StoreModule(StoreConfig config, ApplicationMode mode) {
        this.config = config;
        this.mode = mode;
    }

    @Override
    protected void configure() {
        LOG.info("Application mode initialized: {}", mode);
        bind(StoreConfig.class).toInstance(config);
        bind(ApplicationMode.class).toInstance(mode);
        bind(ApplicationEventBus.class).in(Singleton.class);
    }

    @Provides
    @Singleton
    ConfigStore provideConfigStore(ApplicationEventBus eventBus) {
        return ConfigStore.open(config, mode, eventBus);
    }

    @Provides
    ChannelRepository provideChannels(ConfigStore store) {
        return store.channels();
    }

    @Provides
    SourceRepository provideSources(ConfigStore store) {
        return store.sources();
    }

    @Provides
    SiteRepository provideSites(ConfigStore store) {
        return store.sites();
    }
}
