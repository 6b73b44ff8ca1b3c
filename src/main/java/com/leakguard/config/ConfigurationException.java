package com.leakguard.config;

/**
 * The configuration file could not be read or holds values the scanner cannot run with.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
