package com.logtail.adapter.mongodb;

import com.logtail.adapter.spi.ConnectionException;
import com.logtail.adapter.spi.LogStoreConfig;
import com.logtail.adapter.spi.LogStoreConnection;
import com.logtail.adapter.spi.LogStoreDriver;
import com.logtail.util.TimeSource;
import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * MongoDB implementation of {@link LogStoreDriver}.
 * Reads the capped collection that syslog-ng's {@code mongodb()} destination writes.
 */
public class MongoLogStoreDriver implements LogStoreDriver {

    private static final Logger log = LoggerFactory.getLogger(MongoLogStoreDriver.class);

    static final String SCHEME = "mongodb://";

    private final LogStoreConfig config;
    private final CommandMonitor commandMonitor;
    private final Function<MongoClientSettings, MongoClient> clientFactory;

    public MongoLogStoreDriver(LogStoreConfig config) {
        this(config, MongoClients::create);
    }

    MongoLogStoreDriver(LogStoreConfig config, Function<MongoClientSettings, MongoClient> clientFactory) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory must not be null");
        this.commandMonitor = new CommandMonitor(TimeSource.system());
    }

    @Override
    public String scheme() {
        return SCHEME;
    }

    /**
     * Creates a client and pings the database so an unreachable server fails here
     * rather than on the first query.
     */
    @Override
    public LogStoreConnection connect(String connectionString) {
        String target = config.describeTarget();

        ConnectionString parsed;
        try {
            parsed = new ConnectionString(connectionString);
        } catch (IllegalArgumentException e) {
            throw new ConnectionException(target, "invalid connection string: " + e.getMessage(), e);
        }
        String dbName = parsed.getDatabase() != null ? parsed.getDatabase() : config.database();

        MongoClientSettings settings = MongoClientSettings.builder()
                .applyConnectionString(parsed)
                .applyToSocketSettings(builder -> builder
                        .connectTimeout(config.connectTimeoutMillis(), TimeUnit.MILLISECONDS))
                .applyToClusterSettings(builder -> builder
                        .serverSelectionTimeout(config.connectTimeoutMillis(), TimeUnit.MILLISECONDS))
                .addCommandListener(commandMonitor)
                .build();

        MongoClient client = null;
        try {
            client = clientFactory.apply(settings);
            client.getDatabase(dbName).runCommand(new Document("ping", 1));
        } catch (MongoException e) {
            if (client != null) {
                client.close();
            }
            throw new ConnectionException(target, "cannot connect to " + target + ": " + e.getMessage(), e);
        }

        log.debug("Connected to MongoDB at {}", target);
        return new MongoLogStoreConnection(client, dbName, config.tailAwaitMillis());
    }

    /**
     * Returns the listener that counts driver commands for this driver's clients.
     */
    public CommandMonitor commandMonitor() {
        return commandMonitor;
    }
}
