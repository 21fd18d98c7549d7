package com.logtail.adapter.spi;

/**
 * Exception thrown when configuration is invalid.
 */
public class ConfigurationException extends LogTailException {

    private final String key;

    public ConfigurationException(String key, String message) {
        super(key + ": " + message);
        this.key = key;
    }

    public ConfigurationException(String key, String message, Throwable cause) {
        super(key + ": " + message, cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
