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


package dev.mars.assetsync.storage;

import dev.mars.assetsync.core.AssetOutcome;
import dev.mars.assetsync.core.AssetType;
import dev.mars.assetsync.core.TransferOutcome;
import dev.mars.assetsync.core.exceptions.StatusStoreException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link JsonFileStatusStore} durability and failure handling.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 */
class JsonFileStatusStoreTest {

    private static final Instant NOW = Instant.parse("2026-10-18T11:00:00Z");

    @TempDir
    Path stateDir;

    @Test
    void testMissingDocumentsMeanEmptyStore() throws StatusStoreException {
        JsonFileStatusStore store = JsonFileStatusStore.open(stateDir);
        assertTrue(store.getAssignments().isEmpty());
        assertTrue(store.getAllOutcomes().isEmpty());
        assertTrue(store.getOutcomes("Physics").isEmpty());
    }

    @Test
    void testAssignmentIsWriteOnceAndDurable() throws StatusStoreException {
        JsonFileStatusStore store = JsonFileStatusStore.open(stateDir);
        assertEquals("disk-a", store.assignIfAbsent("Physics", "disk-a"));
        assertEquals("disk-a", store.assignIfAbsent("Physics", "disk-b"));
        assertTrue(Files.exists(store.getAssignmentFile()));

        JsonFileStatusStore reopened = JsonFileStatusStore.open(stateDir);
        assertEquals(Optional.of("disk-a"), reopened.getAssignment("Physics"));
        assertEquals(Map.of("Physics", "disk-a"), reopened.getAssignments());
    }

    @Test
    void testOutcomeUpsertReplacesAndSurvivesReopen() throws StatusStoreException {
        JsonFileStatusStore store = JsonFileStatusStore.open(stateDir);
        store.upsertOutcome(TransferOutcome.of("Physics", AssetType.SLIDES, AssetOutcome.FAILED, "disk-a", NOW)
                .withDetail("Exit code 1"));
        store.upsertOutcome(TransferOutcome.of("Physics", AssetType.COURSE_OUTLINE, AssetOutcome.NO_LINK,
                "disk-a", NOW));
        store.upsertOutcome(TransferOutcome.of("Physics", AssetType.SLIDES, AssetOutcome.OK, "disk-a", NOW));
        store.upsertOutcome(TransferOutcome.of("Physics", AssetType.RAW_VIDEOS, AssetOutcome.SKIPPED_PRESENT,
                "disk-a", NOW).withDuplicateOf(AssetType.SLIDES));

        assertEquals(stateDir.resolve(JsonFileStatusStore.OUTCOME_FILE), store.getOutcomeFile());
        assertTrue(Files.exists(store.getOutcomeFile()));

        JsonFileStatusStore reopened = JsonFileStatusStore.open(stateDir);
        Map<AssetType, TransferOutcome> outcomes = reopened.getOutcomes("Physics");
        assertEquals(List.of(AssetType.COURSE_OUTLINE, AssetType.SLIDES, AssetType.RAW_VIDEOS),
                List.copyOf(outcomes.keySet()));
        TransferOutcome slides = outcomes.get(AssetType.SLIDES);
        assertEquals(AssetOutcome.OK, slides.getStatus());
        assertNull(slides.getDetail());
        assertEquals(NOW, slides.getTimestamp());
        assertEquals(AssetType.SLIDES, outcomes.get(AssetType.RAW_VIDEOS).getDuplicateOf());
        assertEquals(3, reopened.getAllOutcomes().size());
        assertEquals(Optional.of(slides), reopened.getOutcome("Physics", AssetType.SLIDES));
        assertTrue(reopened.getOutcome("Physics", AssetType.FINAL_VIDEOS).isEmpty());
    }

    @Test
    void testCorruptDocumentIsFatal() throws IOException {
        Files.writeString(stateDir.resolve(JsonFileStatusStore.OUTCOME_FILE), "{\"version\": 1, \"outcomes\": [");
        StatusStoreException e = assertThrows(StatusStoreException.class, () -> JsonFileStatusStore.open(stateDir));
        assertEquals(stateDir.resolve(JsonFileStatusStore.OUTCOME_FILE), e.getLocation());
    }

    @Test
    void testUnknownVersionIsFatal() throws IOException {
        Files.writeString(stateDir.resolve(JsonFileStatusStore.ASSIGNMENT_FILE),
                "{\"version\": 7, \"assignments\": {}}");
        assertThrows(StatusStoreException.class, () -> JsonFileStatusStore.open(stateDir));
    }

    @Test
    void testFailedWriteLeavesStoreUnchanged() throws IOException, StatusStoreException {
        JsonFileStatusStore store = JsonFileStatusStore.open(stateDir);
        Path blocker = Files.createDirectories(stateDir.resolve(JsonFileStatusStore.ASSIGNMENT_FILE));
        Files.writeString(blocker.resolve("occupied"), "x");

        assertThrows(StatusStoreException.class, () -> store.assignIfAbsent("Physics", "disk-a"));
        assertTrue(store.getAssignment("Physics").isEmpty());
    }

    @Test
    void testCourseNamesAreKeyedWithoutCase() throws StatusStoreException {
        JsonFileStatusStore store = JsonFileStatusStore.open(stateDir);
        store.assignIfAbsent("Intro to Programming", "disk-b");
        store.upsertOutcome(TransferOutcome.of("Intro to Programming", AssetType.SLIDES, AssetOutcome.OK,
                "disk-b", NOW));

        assertEquals("disk-b", store.assignIfAbsent("intro to programming", "disk-a"));
        store.upsertOutcome(TransferOutcome.of("INTRO TO PROGRAMMING", AssetType.FINAL_VIDEOS,
                AssetOutcome.FAILED, "disk-b", NOW));

        JsonFileStatusStore reopened = JsonFileStatusStore.open(stateDir);
        assertEquals(Map.of("Intro to Programming", "disk-b"), reopened.getAssignments());
        assertEquals(Optional.of("disk-b"), reopened.getAssignment("INTRO to programming"));
        assertEquals(2, reopened.getOutcomes("intro to programming").size());
        assertEquals(AssetOutcome.OK,
                reopened.getOutcome("Intro To Programming", AssetType.SLIDES).orElseThrow().getStatus());
    }
}
