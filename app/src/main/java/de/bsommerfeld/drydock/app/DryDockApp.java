package de.bsommerfeld.drydock.app;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.drydock.agent.AssistantBridge;
import de.bsommerfeld.drydock.core.util.StorageUtils;
import de.bsommerfeld.drydock.db.ConnectionPool;
import de.bsommerfeld.drydock.sync.FeedSyncScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

/**
 * Headless entry point. Wires the application, starts the background feed
 * sync and keeps the process alive until it is terminated.
 */
public final class DryDockApp {

    static {
        // LOG_DIR must be set before the first logger initializes Logback
        Path logDir = StorageUtils.getLogsDir(StorageUtils.APP_NAME);
        try {
            Files.createDirectories(logDir);
            System.setProperty("LOG_DIR", logDir.toAbsolutePath().toString());
        } catch (Exception e) {
            System.err.println("Failed to create log directory: " + logDir);
            e.printStackTrace();
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(DryDockApp.class);

    private DryDockApp() {
    }

    public static void main(String[] args) throws InterruptedException {
        LOG.info("Starting Dry Dock...");
        Injector injector = Guice.createInjector(new AppModule());

        FeedSyncScheduler scheduler = injector.getInstance(FeedSyncScheduler.class);
        CountDownLatch terminated = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down...");
            scheduler.stop();
            ConnectionPool.shutdown();
            terminated.countDown();
        }, "drydock-shutdown"));

        scheduler.start();

        AssistantBridge assistant = injector.getInstance(AssistantBridge.class);
        if (assistant.isServerAvailable())
            LOG.info("Local assistant server is available.");
        else
            LOG.info("Local assistant server is not reachable; chat is disabled until it starts.");

        terminated.await();
    }
}
