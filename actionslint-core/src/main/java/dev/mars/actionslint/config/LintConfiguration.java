/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.actionslint.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configuration management for Actions Lint.
 * Handles loading and providing access to lint run parameters.
 *
 * <p>Sources, later ones overriding earlier ones: built-in defaults, the first readable
 * {@code actionslint.properties} found on the file search path (or the classpath), and finally
 * system properties starting with {@code actionslint.}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class LintConfiguration {
    private static final Logger logger = Logger.getLogger(LintConfiguration.class.getName());

    public static final String FIX_ENABLED = "actionslint.fix.enabled";
    public static final String MAX_WARNINGS = "actionslint.warnings.max";
    public static final String WORKFLOWS_DIR = "actionslint.workflows.dir";
    public static final String RULES_PARALLEL = "actionslint.rules.parallel";
    public static final String RULES_TIMEOUT_MS = "actionslint.rules.timeout.ms";
    public static final String METADATA_ENABLED = "actionslint.metadata.enabled";
    public static final String METADATA_RAW_URL = "actionslint.metadata.raw.url";
    public static final String METADATA_API_URL = "actionslint.metadata.api.url";
    public static final String METADATA_TIMEOUT_MS = "actionslint.metadata.timeout.ms";
    public static final String METADATA_RETRIES = "actionslint.metadata.retries";
    public static final String METADATA_TOKEN = "actionslint.metadata.token";
    public static final String SIMILARITY_THRESHOLD = "actionslint.similarity.threshold";

    // Default configuration values
    private static final boolean DEFAULT_FIX_ENABLED = false;
    private static final int DEFAULT_MAX_WARNINGS = -1;
    private static final String DEFAULT_WORKFLOWS_DIR = ".github/workflows";
    private static final boolean DEFAULT_RULES_PARALLEL = false;
    private static final long DEFAULT_RULES_TIMEOUT_MS = 30000;
    private static final boolean DEFAULT_METADATA_ENABLED = false;
    private static final String DEFAULT_METADATA_RAW_URL = "https://raw.githubusercontent.com";
    private static final String DEFAULT_METADATA_API_URL = "https://api.github.com";
    private static final long DEFAULT_METADATA_TIMEOUT_MS = 5000;
    private static final int DEFAULT_METADATA_RETRIES = 2;
    private static final double DEFAULT_SIMILARITY_THRESHOLD = 0.8;

    private static final String CONFIG_FILE_NAME = "actionslint.properties";

    private final Properties properties;

    public LintConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public LintConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    /**
     * Configuration holding only the built-in defaults.
     */
    public static LintConfiguration defaults() {
        return new LintConfiguration(null);
    }

    // Run Configuration
    public boolean isFixEnabled() {
        return getBooleanProperty(FIX_ENABLED, DEFAULT_FIX_ENABLED);
    }

    public int getMaxWarnings() {
        return getIntProperty(MAX_WARNINGS, DEFAULT_MAX_WARNINGS);
    }

    public Path getWorkflowsDirectory() {
        return Paths.get(getStringProperty(WORKFLOWS_DIR, DEFAULT_WORKFLOWS_DIR));
    }

    // Rule Engine Configuration
    public boolean isParallelRules() {
        return getBooleanProperty(RULES_PARALLEL, DEFAULT_RULES_PARALLEL);
    }

    public Duration getRuleTimeout() {
        return Duration.ofMillis(getLongProperty(RULES_TIMEOUT_MS, DEFAULT_RULES_TIMEOUT_MS));
    }

    public double getSimilarityThreshold() {
        String value = properties.getProperty(SIMILARITY_THRESHOLD);
        if (value != null) {
            try {
                double threshold = Double.parseDouble(value.trim());
                if (threshold > 0.0 && threshold <= 1.0) {
                    return threshold;
                }
                logger.warning("Similarity threshold out of range (0, 1]: " + value +
                             ". Using default: " + DEFAULT_SIMILARITY_THRESHOLD);
            } catch (NumberFormatException e) {
                logger.warning("Invalid double value for property " + SIMILARITY_THRESHOLD + ": " + value +
                             ". Using default: " + DEFAULT_SIMILARITY_THRESHOLD);
            }
        }
        return DEFAULT_SIMILARITY_THRESHOLD;
    }

    // Action Metadata Configuration
    public boolean isMetadataEnabled() {
        return getBooleanProperty(METADATA_ENABLED, DEFAULT_METADATA_ENABLED);
    }

    public String getMetadataRawUrl() {
        return getStringProperty(METADATA_RAW_URL, DEFAULT_METADATA_RAW_URL);
    }

    public String getMetadataApiUrl() {
        return getStringProperty(METADATA_API_URL, DEFAULT_METADATA_API_URL);
    }

    public Duration getMetadataTimeout() {
        return Duration.ofMillis(getLongProperty(METADATA_TIMEOUT_MS, DEFAULT_METADATA_TIMEOUT_MS));
    }

    public int getMetadataRetries() {
        return Math.max(0, getIntProperty(METADATA_RETRIES, DEFAULT_METADATA_RETRIES));
    }

    public String getMetadataToken() {
        String token = properties.getProperty(METADATA_TOKEN);
        return token == null || token.isBlank() ? null : token.trim();
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    // Utility methods for type conversion
    private String getStringProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid integer value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid long value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(FIX_ENABLED, String.valueOf(DEFAULT_FIX_ENABLED));
        properties.setProperty(MAX_WARNINGS, String.valueOf(DEFAULT_MAX_WARNINGS));
        properties.setProperty(WORKFLOWS_DIR, DEFAULT_WORKFLOWS_DIR);
        properties.setProperty(RULES_PARALLEL, String.valueOf(DEFAULT_RULES_PARALLEL));
        properties.setProperty(RULES_TIMEOUT_MS, String.valueOf(DEFAULT_RULES_TIMEOUT_MS));
        properties.setProperty(METADATA_ENABLED, String.valueOf(DEFAULT_METADATA_ENABLED));
        properties.setProperty(METADATA_RAW_URL, DEFAULT_METADATA_RAW_URL);
        properties.setProperty(METADATA_API_URL, DEFAULT_METADATA_API_URL);
        properties.setProperty(METADATA_TIMEOUT_MS, String.valueOf(DEFAULT_METADATA_TIMEOUT_MS));
        properties.setProperty(METADATA_RETRIES, String.valueOf(DEFAULT_METADATA_RETRIES));
        properties.setProperty(SIMILARITY_THRESHOLD, String.valueOf(DEFAULT_SIMILARITY_THRESHOLD));
    }

    private void loadConfigurationFromFile() {
        // Try to load from various locations
        String[] configFiles = {
                CONFIG_FILE_NAME,
                ".github/" + CONFIG_FILE_NAME,
                System.getProperty("user.home") + "/.actionslint/" + CONFIG_FILE_NAME
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: " + configPath);
                    return;
                } catch (IOException e) {
                    logger.warning("Failed to load configuration from " + configPath + ": " + e.getMessage());
                }
            }
        }

        // Try to load from classpath
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE_NAME)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warning("Failed to load configuration from classpath: " + e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        // Override with system properties that start with "actionslint."
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("actionslint."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.fine("Override from system property: " + entry.getKey());
                });
    }

    @Override
    public String toString() {
        return "LintConfiguration{" +
                "fixEnabled=" + isFixEnabled() +
                ", maxWarnings=" + getMaxWarnings() +
                ", parallelRules=" + isParallelRules() +
                ", metadataEnabled=" + isMetadataEnabled() +
                '}';
    }
}
