package com.logtail.adapter.spi;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.TreeSet;

/**
 * Immutable configuration for connecting to the log store.
 *
 * <p>Unset values fall back to the syslog-ng defaults: host {@code localhost},
 * database {@code syslog}, collection {@code messages}.
 */
public final class LogStoreConfig {

    public static final String DEFAULT_HOST = "localhost";
    public static final String DEFAULT_DATABASE = "syslog";
    public static final String DEFAULT_COLLECTION = "messages";

    static final String PREFIX = "logtail.store.";
    static final String OPTION_PREFIX = PREFIX + "option.";

    private final String host;
    private final Integer port;
    private final String database;
    private final String collection;
    private final String username;
    private final String password;
    private final Map<String, String> options;
    private final int connectTimeoutMillis;
    private final int tailAwaitMillis;
    private final int stopTimeoutMillis;

    private LogStoreConfig(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.database = builder.database;
        this.collection = builder.collection;
        this.username = builder.username;
        this.password = builder.password;
        this.options = Collections.unmodifiableMap(new LinkedHashMap<>(builder.options));
        this.connectTimeoutMillis = builder.connectTimeoutMillis;
        this.tailAwaitMillis = builder.tailAwaitMillis;
        this.stopTimeoutMillis = builder.stopTimeoutMillis;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a configuration with every default applied.
     */
    public static LogStoreConfig defaults() {
        return builder().build();
    }

    /**
     * Reads configuration from {@code logtail.store.*} properties.
     *
     * @param properties the source properties
     * @return the configuration
     * @throws ConfigurationException if a value is malformed
     */
    public static LogStoreConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        Builder builder = builder();

        String host = properties.getProperty(PREFIX + "host");
        if (host != null) {
            builder.host(host.trim());
        }
        String port = properties.getProperty(PREFIX + "port");
        if (port != null && !port.isBlank()) {
            builder.port(parseInt(PREFIX + "port", port));
        }
        String database = properties.getProperty(PREFIX + "database");
        if (database != null) {
            builder.database(database.trim());
        }
        String collection = properties.getProperty(PREFIX + "collection");
        if (collection != null) {
            builder.collection(collection.trim());
        }
        builder.username(properties.getProperty(PREFIX + "username"));
        builder.password(properties.getProperty(PREFIX + "password"));

        // sorted so the connection string is stable regardless of Properties hashing
        for (String name : new TreeSet<>(properties.stringPropertyNames())) {
            if (name.startsWith(OPTION_PREFIX) && name.length() > OPTION_PREFIX.length()) {
                builder.option(name.substring(OPTION_PREFIX.length()), properties.getProperty(name));
            }
        }

        String connectTimeout = properties.getProperty(PREFIX + "connectTimeoutMillis");
        if (connectTimeout != null) {
            builder.connectTimeoutMillis(parseInt(PREFIX + "connectTimeoutMillis", connectTimeout));
        }
        String tailAwait = properties.getProperty(PREFIX + "tailAwaitMillis");
        if (tailAwait != null) {
            builder.tailAwaitMillis(parseInt(PREFIX + "tailAwaitMillis", tailAwait));
        }
        String stopTimeout = properties.getProperty(PREFIX + "stopTimeoutMillis");
        if (stopTimeout != null) {
            builder.stopTimeoutMillis(parseInt(PREFIX + "stopTimeoutMillis", stopTimeout));
        }

        return builder.build();
    }

    /**
     * Loads a properties file and overlays {@code logtail.store.*} system properties.
     *
     * @param path the properties file
     * @return the configuration
     * @throws ConfigurationException if the file cannot be read or a value is malformed
     */
    public static LogStoreConfig load(Path path) {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException e) {
            throw new ConfigurationException(path.toString(), "cannot read configuration file", e);
        }
        return fromProperties(withSystemOverrides(properties));
    }

    /**
     * Loads a classpath resource, or only system properties if the resource is absent.
     *
     * @param resource the resource name
     * @return the configuration
     * @throws ConfigurationException if the resource cannot be read or a value is malformed
     */
    public static LogStoreConfig loadResource(String resource) {
        Properties properties = new Properties();
        try (InputStream in = LogStoreConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new ConfigurationException(resource, "cannot read configuration resource", e);
        }
        return fromProperties(withSystemOverrides(properties));
    }

    private static Properties withSystemOverrides(Properties fileProperties) {
        Properties merged = new Properties();
        merged.putAll(fileProperties);
        Properties system = System.getProperties();
        for (String name : system.stringPropertyNames()) {
            if (name.startsWith(PREFIX)) {
                merged.setProperty(name, system.getProperty(name));
            }
        }
        return merged;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key, "not a number: '" + value + "'", e);
        }
    }

    public String host() {
        return host;
    }

    public Optional<Integer> port() {
        return Optional.ofNullable(port);
    }

    public String database() {
        return database;
    }

    public String collection() {
        return collection;
    }

    public Optional<String> username() {
        return Optional.ofNullable(username);
    }

    public Optional<String> password() {
        return Optional.ofNullable(password);
    }

    /**
     * Returns the store-specific options, in insertion order.
     */
    public Map<String, String> options() {
        return options;
    }

    public int connectTimeoutMillis() {
        return connectTimeoutMillis;
    }

    public int tailAwaitMillis() {
        return tailAwaitMillis;
    }

    public int stopTimeoutMillis() {
        return stopTimeoutMillis;
    }

    /**
     * Returns {@code host[:port]/database} for log messages; never includes credentials.
     */
    public String describeTarget() {
        return host + (port != null ? ":" + port : "") + "/" + database;
    }

    @Override
    public String toString() {
        return "LogStoreConfig[" + describeTarget() + ", collection=" + collection
                + ", user=" + (username != null ? username : "-") + "]";
    }

    public static final class Builder {
        private String host = DEFAULT_HOST;
        private Integer port;
        private String database = DEFAULT_DATABASE;
        private String collection = DEFAULT_COLLECTION;
        private String username;
        private String password;
        private final Map<String, String> options = new LinkedHashMap<>();
        private int connectTimeoutMillis = 10_000;
        private int tailAwaitMillis = 1_000;
        private int stopTimeoutMillis = 5_000;

        private Builder() {}

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(Integer port) {
            this.port = port;
            return this;
        }

        public Builder database(String database) {
            this.database = database;
            return this;
        }

        public Builder collection(String collection) {
            this.collection = collection;
            return this;
        }

        public Builder username(String username) {
            this.username = emptyToNull(username);
            return this;
        }

        public Builder password(String password) {
            this.password = emptyToNull(password);
            return this;
        }

        public Builder option(String name, String value) {
            options.put(Objects.requireNonNull(name, "name must not be null"),
                    Objects.requireNonNull(value, "value must not be null"));
            return this;
        }

        public Builder options(Map<String, String> options) {
            options.forEach(this::option);
            return this;
        }

        public Builder connectTimeoutMillis(int connectTimeoutMillis) {
            this.connectTimeoutMillis = connectTimeoutMillis;
            return this;
        }

        public Builder tailAwaitMillis(int tailAwaitMillis) {
            this.tailAwaitMillis = tailAwaitMillis;
            return this;
        }

        public Builder stopTimeoutMillis(int stopTimeoutMillis) {
            this.stopTimeoutMillis = stopTimeoutMillis;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @throws ConfigurationException if a value is invalid
         */
        public LogStoreConfig build() {
            if (host == null || host.isBlank()) {
                throw new ConfigurationException("host", "must not be blank");
            }
            if (database == null || database.isBlank()) {
                throw new ConfigurationException("database", "must not be blank");
            }
            if (collection == null || collection.isBlank()) {
                throw new ConfigurationException("collection", "must not be blank");
            }
            if (port != null && (port < 1 || port > 65535)) {
                throw new ConfigurationException("port", "out of range: " + port);
            }
            if (password != null && username == null) {
                throw new ConfigurationException("password", "set without a username");
            }
            if (connectTimeoutMillis <= 0) {
                throw new ConfigurationException("connectTimeoutMillis", "must be positive");
            }
            if (tailAwaitMillis <= 0) {
                throw new ConfigurationException("tailAwaitMillis", "must be positive");
            }
            if (stopTimeoutMillis <= 0) {
                throw new ConfigurationException("stopTimeoutMillis", "must be positive");
            }
            // one tail iteration is a getMore plus, on a dropped cursor, an equal retry pause
            if (stopTimeoutMillis <= 2L * tailAwaitMillis) {
                throw new ConfigurationException("stopTimeoutMillis",
                        "must exceed twice tailAwaitMillis (" + tailAwaitMillis + ")");
            }
            return new LogStoreConfig(this);
        }

        private static String emptyToNull(String value) {
            return value == null || value.isEmpty() ? null : value;
        }
    }
}
