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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RowClassificationTest {

    private static AvailabilityRecord record(AssetType type, LocalStatus local, RemoteStatus remote) {
        return new AvailabilityRecord("Physics", type, local, remote, null, 0);
    }

    @Test
    void testLocalOrRemoteSatisfies() {
        List<AvailabilityRecord> records = List.of(
                record(AssetType.COURSE_OUTLINE, LocalStatus.FOUND, RemoteStatus.UNCHECKED),
                record(AssetType.SLIDES, LocalStatus.ABSENT, RemoteStatus.AVAILABLE),
                record(AssetType.WRITTEN_ASSETS, LocalStatus.FOUND_VIA_TRANSFER, RemoteStatus.BROKEN));
        assertEquals(RowClassification.COMPLETE, RowClassification.classify(records));
    }

    @Test
    void testSomeSatisfiedIsPartial() {
        List<AvailabilityRecord> records = List.of(
                record(AssetType.COURSE_OUTLINE, LocalStatus.FOUND, RemoteStatus.UNCHECKED),
                record(AssetType.SLIDES, LocalStatus.ABSENT, RemoteStatus.MISSING));
        assertEquals(RowClassification.PARTIAL, RowClassification.classify(records));
    }

    @Test
    void testNothingSatisfiedIsNone() {
        List<AvailabilityRecord> records = List.of(
                record(AssetType.COURSE_OUTLINE, LocalStatus.ABSENT, RemoteStatus.ABSENT_LINK),
                record(AssetType.SLIDES, LocalStatus.ABSENT, RemoteStatus.BROKEN));
        assertEquals(RowClassification.NONE, RowClassification.classify(records));
        assertEquals(RowClassification.NONE, RowClassification.classify(List.of()));
    }
}
