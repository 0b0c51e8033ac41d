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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DriveIndexCacheTest {

    private static final Instant NOW = Instant.parse("2026-10-18T08:00:00Z");

    @TempDir
    Path tempDir;

    private DriveIndexCache cache;

    @BeforeEach
    void setUp() {
        cache = new DriveIndexCache(tempDir.resolve("drive_index.json"), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static DriveIndex sampleIndex(String fingerprint, Instant createdAt) {
        StorageRoot root = new StorageRoot("/mnt/a", "/mnt/a");
        IndexEntry entry = new IndexEntry(root.getId(), "Physics", "physics", true);
        return new DriveIndex(fingerprint, createdAt, List.of(root), Map.of(root.getId(), List.of(entry)));
    }

    @Test
    void testIsUsable() {
        Duration day = Duration.ofHours(24);
        assertTrue(cache.isUsable("fp", NOW.minusSeconds(3600), "fp", day, false));
        assertFalse(cache.isUsable("fp", NOW.minusSeconds(3600), "fp", day, true));
        assertFalse(cache.isUsable("other", NOW.minusSeconds(3600), "fp", day, false));
        assertFalse(cache.isUsable("fp", NOW.minus(Duration.ofHours(25)), "fp", day, false));
    }

    @Test
    void testStoreAndLoad() {
        cache.store(sampleIndex("fp", NOW.minusSeconds(60)));

        Optional<DriveIndex> loaded = cache.load("fp", Duration.ofHours(24), false);
        assertTrue(loaded.isPresent());
        assertEquals(1, loaded.get().size());
        assertEquals("Physics", loaded.get().getEntries().get(0).getName());
    }

    @Test
    void testStaleOrForeignCacheIgnored() {
        cache.store(sampleIndex("fp", NOW.minus(Duration.ofDays(3))));
        assertTrue(cache.load("fp", Duration.ofHours(24), false).isEmpty());
        assertTrue(cache.load("different", Duration.ofDays(7), false).isEmpty());
        assertTrue(cache.load("fp", Duration.ofDays(7), true).isEmpty());
        assertTrue(cache.load("fp", Duration.ofDays(7), false).isPresent());
    }

    @Test
    void testCorruptCacheIsAMiss() throws IOException {
        Files.writeString(cache.getCacheFile(), "{not json");
        assertTrue(cache.load("fp", Duration.ofHours(24), false).isEmpty());
    }

    @Test
    void testInvalidateDeletesFile() {
        cache.store(sampleIndex("fp", NOW));
        assertTrue(Files.exists(cache.getCacheFile()));
        cache.invalidate();
        assertFalse(Files.exists(cache.getCacheFile()));
    }
}
