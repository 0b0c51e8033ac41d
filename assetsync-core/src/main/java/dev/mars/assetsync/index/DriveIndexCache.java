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


package dev.mars.assetsync.index;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.assetsync.storage.FileManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * File-backed cache of the last {@link DriveIndex}.
 *
 * <p>A cached index is reused only while all of the following hold:</p>
 * <ul>
 *   <li>no forced refresh was requested</li>
 *   <li>its fingerprint matches the fingerprint of the configured root set</li>
 *   <li>its age, measured with the injected {@link Clock}, does not exceed the maximum age</li>
 * </ul>
 *
 * <p>The cache is never a source of truth: an unreadable cache file is logged and
 * treated as a miss.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class DriveIndexCache {

    private static final Logger logger = LoggerFactory.getLogger(DriveIndexCache.class);

    static final int VERSION = 1;

    private final Path cacheFile;
    private final Clock clock;
    private final ObjectMapper mapper;

    public DriveIndexCache(Path cacheFile, Clock clock) {
        this.cacheFile = cacheFile;
        this.clock = clock;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public Clock getClock() {
        return clock;
    }

    public Path getCacheFile() {
        return cacheFile;
    }

    /**
     * Invalidation predicate.
     *
     * @return {@code true} if an index with the given fingerprint and creation time may be reused
     */
    public boolean isUsable(String storedFingerprint, Instant createdAt, String expectedFingerprint,
                            Duration maxAge, boolean forceRefresh) {
        if (forceRefresh) {
            return false;
        }
        if (!expectedFingerprint.equals(storedFingerprint)) {
            return false;
        }
        Duration age = Duration.between(createdAt, clock.instant());
        return age.compareTo(maxAge) <= 0;
    }

    /**
     * Loads the cached index if it exists and passes {@link #isUsable}.
     */
    public Optional<DriveIndex> load(String expectedFingerprint, Duration maxAge, boolean forceRefresh) {
        if (forceRefresh) {
            logger.info("Drive index refresh forced; ignoring cache {}", cacheFile);
            return Optional.empty();
        }
        if (!Files.exists(cacheFile)) {
            return Optional.empty();
        }
        CacheDocument document;
        try {
            document = mapper.readValue(cacheFile.toFile(), CacheDocument.class);
        } catch (IOException e) {
            logger.warn("Ignoring unreadable drive index cache {}: {}", cacheFile, e.getMessage());
            return Optional.empty();
        }
        if (document == null || document.version != VERSION || document.index == null) {
            logger.warn("Ignoring drive index cache {} with unexpected content", cacheFile);
            return Optional.empty();
        }
        DriveIndex index = document.index;
        if (!isUsable(index.getFingerprint(), index.getCreatedAt(), expectedFingerprint, maxAge, false)) {
            logger.info("Drive index cache is stale or was built for different roots");
            return Optional.empty();
        }
        logger.info("Using cached drive index from {} ({} entries)", index.getCreatedAt(), index.size());
        return Optional.of(index);
    }

    /**
     * Writes the index to the cache file. A failure is logged, never thrown.
     */
    public void store(DriveIndex index) {
        try {
            FileManager.writeAtomically(cacheFile, mapper.writeValueAsBytes(new CacheDocument(VERSION, index)));
            logger.debug("Stored drive index cache at {}", cacheFile);
        } catch (IOException e) {
            logger.warn("Could not write drive index cache {}: {}", cacheFile, e.getMessage());
        }
    }

    public void invalidate() {
        try {
            if (Files.deleteIfExists(cacheFile)) {
                logger.info("Invalidated drive index cache {}", cacheFile);
            }
        } catch (IOException e) {
            logger.warn("Could not delete drive index cache {}: {}", cacheFile, e.getMessage());
        }
    }

    static final class CacheDocument {
        @JsonProperty("version")
        final int version;
        @JsonProperty("index")
        final DriveIndex index;

        @JsonCreator
        CacheDocument(@JsonProperty("version") int version, @JsonProperty("index") DriveIndex index) {
            this.version = version;
            this.index = index;
        }
    }
}
