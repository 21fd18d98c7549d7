package com.logtail.stream;

import com.logtail.adapter.spi.LogStoreConfig;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Builds the store connection identifier from configuration.
 *
 * <p>Layout: {@code scheme[user[:password]@]host[:port]/database[?options]}.
 * Credentials and options are percent-encoded, so {@code @ : / ? & =} inside
 * them never reach the identifier literally.
 */
public final class ConnectionStringBuilder {

    private ConnectionStringBuilder() {}

    /**
     * Builds the connection string.
     *
     * @param scheme the scheme including {@code ://}, e.g. {@code mongodb://}
     * @param config the store configuration
     * @return the connection identifier
     */
    public static String build(String scheme, LogStoreConfig config) {
        Objects.requireNonNull(scheme, "scheme must not be null");
        Objects.requireNonNull(config, "config must not be null");

        StringBuilder cs = new StringBuilder(scheme);

        config.username().ifPresent(username -> {
            cs.append(encode(username));
            config.password().ifPresent(password -> cs.append(':').append(encode(password)));
            cs.append('@');
        });

        cs.append(config.host());
        config.port().ifPresent(port -> cs.append(':').append(port));
        cs.append('/').append(config.database());

        if (!config.options().isEmpty()) {
            cs.append('?').append(queryString(config.options()));
        }

        return cs.toString();
    }

    /**
     * Encodes options as {@code key=value&...}, keeping map order.
     */
    static String queryString(Map<String, String> options) {
        StringJoiner query = new StringJoiner("&");
        options.forEach((name, value) -> query.add(encode(name) + "=" + encode(value)));
        return query.toString();
    }

    // form encoding, with %20 for space and the RFC 3986 marks ! ' ( ) ~ left literal
    static String encode(String component) {
        return URLEncoder.encode(component, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("%21", "!")
                .replace("%27", "'")
                .replace("%28", "(")
                .replace("%29", ")")
                .replace("%7E", "~");
    }
}
