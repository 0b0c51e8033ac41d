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


package dev.mars.assetsync.core;

import dev.mars.assetsync.core.exceptions.InvalidTransitionException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CourseResultTest {

    private static final Instant NOW = Instant.parse("2026-10-18T10:00:00Z");

    private static void recordAll(CourseResult result, AssetOutcome... outcomes) {
        AssetType[] types = AssetType.values();
        for (int i = 0; i < outcomes.length; i++) {
            result.record(TransferOutcome.of(result.getCourseName(), types[i], outcomes[i], "disk-a", NOW));
        }
    }

    @Test
    void testAllSettledIsComplete() {
        CourseResult result = new CourseResult("Physics");
        result.start("disk-a");
        recordAll(result, AssetOutcome.OK, AssetOutcome.SKIPPED_PRESENT, AssetOutcome.NO_LINK,
                AssetOutcome.OK, AssetOutcome.NO_LINK, AssetOutcome.SKIPPED_PRESENT);

        assertEquals(CourseTransferStatus.COMPLETE, result.finish());
        assertEquals(2, result.countOf(AssetOutcome.OK));
        assertEquals("disk-a", result.getVolumeId());
    }

    @Test
    void testAllAttemptsFailedIsFailed() {
        CourseResult result = new CourseResult("Physics");
        result.start("disk-a");
        recordAll(result, AssetOutcome.FAILED, AssetOutcome.NO_LINK, AssetOutcome.SKIPPED_PRESENT,
                AssetOutcome.FAILED, AssetOutcome.NO_LINK, AssetOutcome.NO_LINK);

        assertEquals(CourseTransferStatus.FAILED, result.finish());
    }

    @Test
    void testMixedIsPartial() {
        CourseResult result = new CourseResult("Physics");
        result.start("disk-a");
        recordAll(result, AssetOutcome.OK, AssetOutcome.FAILED, AssetOutcome.NO_LINK,
                AssetOutcome.NO_LINK, AssetOutcome.NO_LINK, AssetOutcome.NO_LINK);

        assertEquals(CourseTransferStatus.PARTIAL, result.finish());
    }

    @Test
    void testStoppedBeforeAllAssetsIsPartial() {
        CourseResult result = new CourseResult("Physics");
        result.start("disk-a");
        recordAll(result, AssetOutcome.OK, AssetOutcome.OK);

        assertEquals(CourseTransferStatus.PARTIAL, result.finish());
    }

    @Test
    void testSkipOnlyFromPending() {
        CourseResult result = new CourseResult("Physics");
        result.skip("no space");
        assertEquals(CourseTransferStatus.SKIPPED, result.getStatus());
        assertEquals("no space", result.getDetail());
        assertThrows(InvalidTransitionException.class, () -> result.start("disk-a"));
    }
}
