package com.logtail.app;

import com.logtail.adapter.mongodb.CommandMonitor;
import com.logtail.adapter.mongodb.MongoLogStoreDriver;
import com.logtail.adapter.spi.LogStoreConfig;
import com.logtail.adapter.spi.LogTailException;
import com.logtail.stream.LogStreamAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;

/**
 * Process entry point.
 *
 * <p>Usage: {@code logtail [config.properties]}. Without an argument the
 * classpath resource {@code logtail.properties} is used; {@code -Dlogtail.store.*}
 * system properties override either.
 */
public final class LogTailApplication {

    private static final Logger log = LoggerFactory.getLogger(LogTailApplication.class);

    private static final String DEFAULT_RESOURCE = "logtail.properties";

    private LogTailApplication() {}

    public static void main(String[] args) {
        LogStoreConfig config;
        try {
            config = args.length > 0
                    ? LogStoreConfig.load(Path.of(args[0]))
                    : LogStoreConfig.loadResource(DEFAULT_RESOURCE);
        } catch (LogTailException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }

        MongoLogStoreDriver driver = new MongoLogStoreDriver(config);
        LogStreamAdapter adapter = new LogStreamAdapter(config, driver);
        LogTailService service = new LogTailService(adapter, RecordSink.logging(),
                Duration.ofMillis(config.connectTimeoutMillis() + config.stopTimeoutMillis()));

        log.info("Initializing log stream for {}", config);
        try {
            service.start();
        } catch (LogTailException e) {
            log.error("An error occurred while setting up logtail: {}", e.getMessage(), e);
            log.error("Bail out");
            System.exit(1);
            return;
        }

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("logtail shutting down");
            int exitCode = service.stop();
            CommandMonitor monitor = driver.commandMonitor();
            log.info("Store commands: {} completed, {} failed", monitor.getCompletedCommandCount(),
                    monitor.getFailedCommandCount());
            stopped.countDown();
            if (exitCode != 0) {
                Runtime.getRuntime().halt(exitCode);
            }
        }, "logtail-shutdown"));

        log.info("logtail streaming {} collection {}", config.describeTarget(), config.collection());

        // adapter threads are daemons; main keeps the process up until shutdown
        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
