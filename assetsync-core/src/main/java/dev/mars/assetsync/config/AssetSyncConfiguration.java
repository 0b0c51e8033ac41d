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


package dev.mars.assetsync.config;

import dev.mars.assetsync.assign.Volume;
import dev.mars.assetsync.core.exceptions.ConfigurationException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Configuration management for AssetSync.
 *
 * <p>Values are resolved in layers, highest priority first:</p>
 * <ol>
 *   <li>Environment variable (e.g. {@code ASSETSYNC_MATCH_THRESHOLD})</li>
 *   <li>System property (e.g. {@code -Dassetsync.match.threshold=80})</li>
 *   <li>Properties file: an explicit file, or the first {@code assetsync.properties}
 *       found in the working directory, {@code config/}, {@code ~/.assetsync/} or the classpath</li>
 *   <li>Built-in default</li>
 * </ol>
 *
 * <p>Instances created from a {@link Properties} object skip the environment and
 * system property layers, which keeps tests independent of the host.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class AssetSyncConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(AssetSyncConfiguration.class);

    public static final String CONFIG_FILE_NAME = "assetsync.properties";

    // Default configuration values
    private static final long DEFAULT_CACHE_MAX_AGE_HOURS = 24;
    private static final int DEFAULT_MATCH_THRESHOLD = 75;
    private static final String DEFAULT_COURSE_ROOT = "Downloaded Courses";
    private static final double DEFAULT_MIN_FREE_GB = 5.0;
    private static final double DEFAULT_TIE_TOLERANCE = 0.05;
    private static final String DEFAULT_STATE_DIR = ".assetsync";
    private static final String DEFAULT_TRANSFER_COMMAND = "rclone";
    private static final String DEFAULT_TRANSFER_REMOTE = "gdrive";
    private static final String DEFAULT_TRANSFER_EXTRA_ARGS =
            "--transfers=4 --checkers=8 --retries=3 --low-level-retries=10 --stats=10s";
    private static final int DEFAULT_MAX_RETRIES = 3;
    private static final long DEFAULT_RETRY_DELAY_MS = 15000;
    private static final long DEFAULT_TRANSFER_TIMEOUT_MINUTES = 240;

    private static final long BYTES_PER_GB = 1024L * 1024 * 1024;

    private final Properties properties;
    private final boolean layered;

    /**
     * Loads defaults, the first properties file found, then system properties and
     * environment overrides.
     */
    public AssetSyncConfiguration() {
        this.properties = new Properties();
        this.layered = true;
        loadConfigurationFromFile();
    }

    /**
     * Creates a configuration from the given properties only. Built-in defaults
     * still apply to keys the properties do not set.
     */
    public AssetSyncConfiguration(Properties properties) {
        this.properties = new Properties();
        this.layered = false;
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    private AssetSyncConfiguration(Properties properties, boolean layered) {
        this.properties = properties;
        this.layered = layered;
    }

    /**
     * Loads an explicit properties file, with system property and environment overrides.
     *
     * @param configFile the file named on the command line
     * @throws ConfigurationException if the file cannot be read
     */
    public static AssetSyncConfiguration fromFile(Path configFile) throws ConfigurationException {
        Properties loaded = new Properties();
        try (InputStream input = Files.newInputStream(configFile)) {
            loaded.load(input);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration file " + configFile, e);
        }
        logger.info("Loaded configuration from: {}", configFile);
        return new AssetSyncConfiguration(loaded, true);
    }

    // ==================== Storage Indexer ====================

    public List<Path> getIndexRoots() {
        return splitList(getString("assetsync.index.roots", "")).stream()
                .map(Paths::get)
                .collect(Collectors.toList());
    }

    public Path getIndexCacheFile() {
        String value = getString("assetsync.index.cache.file", null);
        return StringUtils.isBlank(value) ? getStateDir().resolve("drive_index.json") : Paths.get(value);
    }

    public Duration getIndexCacheMaxAge() {
        return Duration.ofHours(getLong("assetsync.index.cache.max-age-hours", DEFAULT_CACHE_MAX_AGE_HOURS));
    }

    /**
     * File extensions to index, lower case and without the leading dot. Empty means all files.
     */
    public Set<String> getIndexExtensions() {
        return splitList(getString("assetsync.index.extensions", "")).stream()
                .map(ext -> StringUtils.removeStart(ext, ".").toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    // ==================== Fuzzy Matching ====================

    public int getMatchThreshold() {
        return getInt("assetsync.match.threshold", DEFAULT_MATCH_THRESHOLD);
    }

    public boolean isMatchParallel() {
        return getBoolean("assetsync.match.parallel", true);
    }

    // ==================== Volumes & Assignment ====================

    public String getCourseRoot() {
        return getString("assetsync.volume.course-root", DEFAULT_COURSE_ROOT);
    }

    /**
     * Target volumes in the configured order. A volume may override the course root
     * with {@code assetsync.volume.<id>.course-root}.
     */
    public List<Volume> getVolumes() {
        List<Volume> volumes = new ArrayList<>();
        for (String id : splitList(getString("assetsync.volumes", ""))) {
            String path = getString("assetsync.volume." + id + ".path", null);
            if (StringUtils.isBlank(path)) {
                continue;
            }
            String courseRoot = getString("assetsync.volume." + id + ".course-root", getCourseRoot());
            volumes.add(new Volume(id, Paths.get(path.trim()), courseRoot));
        }
        return Collections.unmodifiableList(volumes);
    }

    public double getMinFreeGb() {
        return getDouble("assetsync.assignment.min-free-gb", DEFAULT_MIN_FREE_GB);
    }

    public long getMinFreeBytes() {
        return (long) (getMinFreeGb() * BYTES_PER_GB);
    }

    public double getTieTolerance() {
        return getDouble("assetsync.assignment.tie-tolerance", DEFAULT_TIE_TOLERANCE);
    }

    // ==================== State ====================

    public Path getStateDir() {
        return Paths.get(getString("assetsync.state.dir", DEFAULT_STATE_DIR));
    }

    // ==================== Transfer ====================

    public String getTransferCommand() {
        return getString("assetsync.transfer.command", DEFAULT_TRANSFER_COMMAND);
    }

    public String getTransferRemote() {
        return getString("assetsync.transfer.remote", DEFAULT_TRANSFER_REMOTE);
    }

    public List<String> getTransferExtraArgs() {
        String value = getString("assetsync.transfer.extra-args", DEFAULT_TRANSFER_EXTRA_ARGS);
        return Arrays.asList(StringUtils.split(value.trim()));
    }

    public int getMaxRetries() {
        return getInt("assetsync.transfer.max-retries", DEFAULT_MAX_RETRIES);
    }

    public long getRetryDelayMs() {
        return getLong("assetsync.transfer.retry-delay-ms", DEFAULT_RETRY_DELAY_MS);
    }

    public Duration getTransferTimeout() {
        return Duration.ofMinutes(getLong("assetsync.transfer.timeout-minutes", DEFAULT_TRANSFER_TIMEOUT_MINUTES));
    }

    public boolean isCompletionMarkerEnabled() {
        return getBoolean("assetsync.transfer.completion-marker.enabled", false);
    }

    public boolean isParallelVolumes() {
        return getBoolean("assetsync.transfer.parallel-volumes", false);
    }

    // ==================== Manifest ====================

    /**
     * Source column label for a logical manifest field, or the given default.
     */
    public String getManifestColumn(String field, String defaultLabel) {
        return getString("assetsync.manifest.column." + field, defaultLabel);
    }

    // ==================== Core Property Accessors ====================

    /**
     * Gets a string property with layered resolution.
     */
    public String getString(String key, String defaultValue) {
        if (layered) {
            String envKey = key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
            String envValue = System.getenv(envKey);
            if (envValue != null && !envValue.isEmpty()) {
                return envValue;
            }
            String sysProp = System.getProperty(key);
            if (sysProp != null && !sysProp.isEmpty()) {
                return sysProp;
            }
        }
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    private int getInt(String key, int defaultValue) {
        String value = getString(key, null);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private long getLong(String key, long defaultValue) {
        String value = getString(key, null);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid long value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private double getDouble(String key, double defaultValue) {
        String value = getString(key, null);
        if (value != null) {
            try {
                return Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid decimal value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private static List<String> splitList(String value) {
        if (StringUtils.isBlank(value)) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(StringUtils::isNotEmpty)
                .collect(Collectors.toList());
    }

    // ==================== Validation ====================

    /**
     * Validates that required configuration is present and values are sensible.
     * Called at startup to fail fast on misconfiguration.
     *
     * @param requireVolumes whether at least one target volume must be configured;
     *                       report-only runs do not need volumes
     * @throws ConfigurationException if the configuration is unusable
     */
    public void validate(boolean requireVolumes) throws ConfigurationException {
        if (requireVolumes) {
            List<String> ids = splitList(getString("assetsync.volumes", ""));
            if (ids.isEmpty()) {
                throw new ConfigurationException("No target volumes configured (assetsync.volumes)");
            }
            for (String id : ids) {
                if (StringUtils.isBlank(getString("assetsync.volume." + id + ".path", null))) {
                    throw new ConfigurationException("Volume '" + id + "' has no mount path (assetsync.volume."
                            + id + ".path)");
                }
            }
        }
        int threshold = getMatchThreshold();
        if (threshold < 0 || threshold > 100) {
            throw new ConfigurationException("Match threshold must be between 0 and 100, got: " + threshold);
        }
        if (getMinFreeGb() < 0) {
            throw new ConfigurationException("Minimum free space must not be negative, got: " + getMinFreeGb());
        }
        double tolerance = getTieTolerance();
        if (tolerance < 0 || tolerance >= 1) {
            throw new ConfigurationException("Tie tolerance must be in [0, 1), got: " + tolerance);
        }
        if (getMaxRetries() < 1) {
            throw new ConfigurationException("Max retries must be at least 1, got: " + getMaxRetries());
        }
        if (getTransferTimeout().isZero() || getTransferTimeout().isNegative()) {
            throw new ConfigurationException("Transfer timeout must be positive, got: " + getTransferTimeout());
        }
        logger.info("Configuration validated successfully");
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                CONFIG_FILE_NAME,
                "config/" + CONFIG_FILE_NAME,
                System.getProperty("user.home") + "/.assetsync/" + CONFIG_FILE_NAME
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: {}", configPath);
                    return;
                } catch (IOException e) {
                    logger.warn("Failed to load configuration from {}: {}", configPath, e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE_NAME)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "AssetSyncConfiguration{" +
                "roots=" + getIndexRoots() +
                ", volumes=" + getVolumes() +
                ", matchThreshold=" + getMatchThreshold() +
                ", minFreeGb=" + getMinFreeGb() +
                ", stateDir=" + getStateDir() +
                '}';
    }
}
