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
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class AssetLinkTest {

    @ParameterizedTest
    @CsvSource({
            "https://drive.google.com/drive/folders/1AbCdEfGhIjKlMnOp?usp=sharing, 1AbCdEfGhIjKlMnOp",
            "https://drive.google.com/file/d/0BxYz123456789abc/view, 0BxYz123456789abc",
            "https://drive.google.com/open?id=1QwErTyUiOp12345, 1QwErTyUiOp12345",
            "https://drive.google.com/drive/u/0/folders/1ZyXwVuTsRqP_-987, 1ZyXwVuTsRqP_-987",
            "1AbCdEfGhIjKlMnOpQrStUvWxYz, 1AbCdEfGhIjKlMnOpQrStUvWxYz"
    })
    void testExtractsFolderId(String raw, String expectedId) {
        AssetLink link = AssetLink.parse(raw).orElseThrow();
        assertEquals(expectedId, link.getFolderId().orElseThrow());
        assertEquals(expectedId, link.getRemoteKey());
    }

    @Test
    void testBlankCellIsNoLink() {
        assertTrue(AssetLink.parse(null).isEmpty());
        assertTrue(AssetLink.parse("   ").isEmpty());
    }

    @Test
    void testUnparseableLinkKeptWithoutId() {
        AssetLink link = AssetLink.parse("  see shared drive  ").orElseThrow();
        assertEquals("see shared drive", link.getUrl());
        assertTrue(link.getFolderId().isEmpty());
        assertEquals("see shared drive", link.getRemoteKey());
    }

    @Test
    void testRemoteStatusVerdicts() {
        assertEquals(RemoteStatus.AVAILABLE, RemoteStatus.fromVerdict("available"));
        assertEquals(RemoteStatus.BROKEN, RemoteStatus.fromVerdict("Broken Link"));
        assertEquals(RemoteStatus.BROKEN, RemoteStatus.fromVerdict("BROKEN"));
        assertEquals(RemoteStatus.MISSING, RemoteStatus.fromVerdict(" Missing "));
        assertThrows(IllegalArgumentException.class, () -> RemoteStatus.fromVerdict("maybe"));
    }

    @Test
    void testCourseStatusLabels() {
        assertEquals(CourseStatus.COMPLETED, CourseStatus.fromLabel("Completed"));
        assertEquals(CourseStatus.IN_PRODUCTION, CourseStatus.fromLabel("In-Production"));
        assertEquals(CourseStatus.OTHER, CourseStatus.fromLabel(""));
        assertFalse(CourseStatus.IN_PRODUCTION.isTransferable());
        assertTrue(CourseStatus.OTHER.isTransferable());
    }
}
