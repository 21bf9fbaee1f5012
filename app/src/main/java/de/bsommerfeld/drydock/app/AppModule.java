package de.bsommerfeld.drydock.app;

import com.google.inject.AbstractModule;
import de.bsommerfeld.drydock.core.config.ConfigLoader;
import de.bsommerfeld.drydock.core.config.DryDockConfig;
import de.bsommerfeld.drydock.core.util.StorageUtils;
import de.bsommerfeld.drydock.db.ConnectionPool;
import de.bsommerfeld.drydock.feeds.FeedFetcher;
import de.bsommerfeld.drydock.feeds.HttpFeedFetcher;
import de.bsommerfeld.drydock.sync.FeedSyncScheduler;
import de.bsommerfeld.drydock.sync.ViewStateCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Guice module for the application wiring. Loads {@code config.toml}, opens
 * the process-wide database pool and binds everything that cannot be
 * resolved just-in-time.
 */
public class AppModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(AppModule.class);

    private final Path appDataDir;

    public AppModule() {
        this(StorageUtils.getAppDataDir(StorageUtils.APP_NAME));
    }

    /** @param appDataDir directory holding {@code config.toml} and the database */
    public AppModule(Path appDataDir) {
        this.appDataDir = appDataDir;
    }

    @Override
    protected void configure() {
        try {
            Files.createDirectories(appDataDir);
            DryDockConfig config = ConfigLoader.load(appDataDir.resolve(StorageUtils.CONFIG_FILE));
            bind(DryDockConfig.class).toInstance(config);

            Path databaseFile = appDataDir.resolve(config.getDatabase().getFileName());
            bind(ConnectionPool.class).toInstance(ConnectionPool.initialize(databaseFile, config.getDatabase()));
            LOG.info("Feed sync interval: {}s, assistant at {}",
                    config.getSync().getIntervalSeconds(), config.getAssistant().getBaseUrl());
        } catch (Exception e) {
            // Config and store are vital, fail fast
            throw new RuntimeException("Failed to initialize application", e);
        }

        bind(FeedFetcher.class).to(HttpFeedFetcher.class);

        // Must subscribe to the event bus before the first cycle posts
        bind(ViewStateCoordinator.class).asEagerSingleton();
        bind(FeedSyncScheduler.class).asEagerSingleton();
    }
}
