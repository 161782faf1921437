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

package dev.mars.tessera.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configuration for the orchestration core.
 *
 * <p>Values are layered: built-in defaults, then the first readable {@code tessera.properties}
 * found on disk or on the classpath, then {@code tessera.*} system properties.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class TesseraConfiguration {
    private static final Logger logger = Logger.getLogger(TesseraConfiguration.class.getName());

    public static final String WORKER_CALL_TIMEOUT_MS = "tessera.worker.call.timeout.ms";
    public static final String HEALTH_PROBE_TIMEOUT_MS = "tessera.health.probe.timeout.ms";
    public static final String PATTERN_THREADS = "tessera.pattern.threads";
    public static final String PATTERN_QUEUE_MAX_PENDING = "tessera.pattern.queue.max.pending";
    public static final String RETRY_SCHEDULER_THREADS = "tessera.retry.scheduler.threads";
    public static final String ROUTING_MEMOIZE_ENABLED = "tessera.routing.memoize.enabled";
    public static final String METRICS_ENABLED = "tessera.monitoring.metrics.enabled";

    private static final long DEFAULT_WORKER_CALL_TIMEOUT_MS = 30000;
    private static final long DEFAULT_HEALTH_PROBE_TIMEOUT_MS = 5000;
    private static final int DEFAULT_PATTERN_THREADS = 4;
    private static final int DEFAULT_PATTERN_QUEUE_MAX_PENDING = 64;
    private static final int DEFAULT_RETRY_SCHEDULER_THREADS = 2;

    private static final String CONFIG_FILE_NAME = "tessera.properties";

    private final Properties properties;

    public TesseraConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    /**
     * Builds a configuration from defaults overlaid with the given properties only.
     * Files and system properties are ignored, which keeps tests hermetic.
     */
    public TesseraConfiguration(Properties overrides) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (overrides != null) {
            this.properties.putAll(overrides);
        }
    }

    public static TesseraConfiguration defaults() {
        return new TesseraConfiguration(null);
    }

    public Duration getWorkerCallTimeout() {
        return Duration.ofMillis(getLongProperty(WORKER_CALL_TIMEOUT_MS, DEFAULT_WORKER_CALL_TIMEOUT_MS));
    }

    public Duration getHealthProbeTimeout() {
        return Duration.ofMillis(getLongProperty(HEALTH_PROBE_TIMEOUT_MS, DEFAULT_HEALTH_PROBE_TIMEOUT_MS));
    }

    public int getPatternThreads() {
        return getIntProperty(PATTERN_THREADS, DEFAULT_PATTERN_THREADS);
    }

    public int getPatternQueueMaxPending() {
        return getIntProperty(PATTERN_QUEUE_MAX_PENDING, DEFAULT_PATTERN_QUEUE_MAX_PENDING);
    }

    public int getRetrySchedulerThreads() {
        return getIntProperty(RETRY_SCHEDULER_THREADS, DEFAULT_RETRY_SCHEDULER_THREADS);
    }

    public boolean isRoutingMemoizeEnabled() {
        return getBooleanProperty(ROUTING_MEMOIZE_ENABLED, true);
    }

    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED, true);
    }

    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                int parsed = Integer.parseInt(value.trim());
                if (parsed > 0) {
                    return parsed;
                }
                logger.warning("Non-positive value for property " + key + ": " + value +
                        ". Using default: " + defaultValue);
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
                long parsed = Long.parseLong(value.trim());
                if (parsed > 0) {
                    return parsed;
                }
                logger.warning("Non-positive value for property " + key + ": " + value +
                        ". Using default: " + defaultValue);
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
        properties.setProperty(WORKER_CALL_TIMEOUT_MS, String.valueOf(DEFAULT_WORKER_CALL_TIMEOUT_MS));
        properties.setProperty(HEALTH_PROBE_TIMEOUT_MS, String.valueOf(DEFAULT_HEALTH_PROBE_TIMEOUT_MS));
        properties.setProperty(PATTERN_THREADS, String.valueOf(DEFAULT_PATTERN_THREADS));
        properties.setProperty(PATTERN_QUEUE_MAX_PENDING, String.valueOf(DEFAULT_PATTERN_QUEUE_MAX_PENDING));
        properties.setProperty(RETRY_SCHEDULER_THREADS, String.valueOf(DEFAULT_RETRY_SCHEDULER_THREADS));
        properties.setProperty(ROUTING_MEMOIZE_ENABLED, "true");
        properties.setProperty(METRICS_ENABLED, "true");
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                CONFIG_FILE_NAME,
                "config/" + CONFIG_FILE_NAME,
                System.getProperty("user.home") + "/.tessera/" + CONFIG_FILE_NAME,
                "/etc/tessera/" + CONFIG_FILE_NAME
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
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("tessera."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.fine("Override from system property: " + entry.getKey() + "=" + entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "TesseraConfiguration{" +
                "workerCallTimeout=" + getWorkerCallTimeout().toMillis() + "ms" +
                ", healthProbeTimeout=" + getHealthProbeTimeout().toMillis() + "ms" +
                ", patternThreads=" + getPatternThreads() +
                ", memoizeRouting=" + isRoutingMemoizeEnabled() +
                '}';
    }
}
