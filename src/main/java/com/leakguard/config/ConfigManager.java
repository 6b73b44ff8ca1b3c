package com.leakguard.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

public class ConfigManager {
    private static final Logger logger = LoggerFactory.getLogger(ConfigManager.class);
    static final String DEFAULT_CONFIG_RESOURCE = "/default_config.yaml";

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    private Config config;

    /**
     * Loads the given YAML file, or the bundled defaults when {@code configFile} is null.
     *
     * @throws ConfigurationException if the file is missing, malformed or holds invalid values
     */
    public void init(File configFile) {
        if (configFile == null) {
            this.config = loadDefaultConfig();
        } else {
            if (!configFile.isFile()) {
                throw new ConfigurationException("Configuration file not found: " + configFile.getAbsolutePath());
            }
            this.config = loadConfig(configFile);
            logger.info("Loaded configuration: {}", configFile.getAbsolutePath());
        }
        validate(config);
        logger.debug("Configuration loaded. Extra rules: {}, Disabled rules: {}, Max file size: {}",
                config.getRules().size(), config.getDisabledRules().size(), config.getScanConfig().getMaxFileSize());
    }

    private Config loadDefaultConfig() {
        try (InputStream in = getClass().getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (in == null) {
                // Resource stripped from the jar; the in-code defaults are equivalent
                logger.warn("Could not find default configuration in resources: {}", DEFAULT_CONFIG_RESOURCE);
                return new Config();
            }
            Config loaded = mapper.readValue(in, Config.class);
            return loaded != null ? loaded : new Config();
        } catch (IOException e) {
            throw new ConfigurationException("Failed to parse default configuration", e);
        }
    }

    private Config loadConfig(File configFile) {
        if (configFile.length() == 0) {
            return new Config();
        }
        try {
            Config loaded = mapper.readValue(configFile, Config.class);
            // An empty YAML document binds to null
            return loaded != null ? loaded : new Config();
        } catch (IOException e) {
            throw new ConfigurationException("Configuration load failed: " + configFile.getName() + ": " + e.getMessage(), e);
        }
    }

    static void validate(Config config) {
        ScanConfig scan = config.getScanConfig();
        if (scan.getMaxFileSize() <= 0) {
            throw new ConfigurationException("max_file_size must be positive, got " + scan.getMaxFileSize());
        }
        if (scan.getThreads() < 1) {
            throw new ConfigurationException("threads must be at least 1, got " + scan.getThreads());
        }
        if (scan.getFileTimeoutSeconds() < 0) {
            throw new ConfigurationException("file_timeout_seconds must not be negative, got " + scan.getFileTimeoutSeconds());
        }
        for (String marker : scan.getCommentMarkers()) {
            // A blank marker would suppress every line
            if (marker == null || marker.isBlank()) {
                throw new ConfigurationException("comment_markers must not contain blank entries");
            }
        }
    }

    public Config getConfig() {
        return config;
    }
}
