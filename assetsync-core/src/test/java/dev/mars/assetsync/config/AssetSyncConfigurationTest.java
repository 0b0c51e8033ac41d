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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Properties;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link AssetSyncConfiguration}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 */
class AssetSyncConfigurationTest {

    @TempDir
    Path tempDir;

    private static AssetSyncConfiguration config(String... keyValues) {
        Properties properties = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            properties.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return new AssetSyncConfiguration(properties);
    }

    @Test
    void testDefaults() {
        AssetSyncConfiguration config = config();

        assertEquals(75, config.getMatchThreshold());
        assertEquals(5.0, config.getMinFreeGb());
        assertEquals(5L * 1024 * 1024 * 1024, config.getMinFreeBytes());
        assertEquals(0.05, config.getTieTolerance());
        assertEquals(Paths.get(".assetsync"), config.getStateDir());
        assertEquals(Paths.get(".assetsync", "drive_index.json"), config.getIndexCacheFile());
        assertEquals(Duration.ofHours(24), config.getIndexCacheMaxAge());
        assertEquals("rclone", config.getTransferCommand());
        assertEquals("gdrive", config.getTransferRemote());
        assertTrue(config.getTransferExtraArgs().contains("--transfers=4"));
        assertEquals(3, config.getMaxRetries());
        assertFalse(config.isCompletionMarkerEnabled());
        assertFalse(config.isParallelVolumes());
        assertTrue(config.getIndexRoots().isEmpty());
        assertTrue(config.getVolumes().isEmpty());
    }

    @Test
    void testVolumesKeepConfiguredOrderAndCourseRoots() {
        AssetSyncConfiguration config = config(
                "assetsync.volumes", "disk-b, disk-a",
                "assetsync.volume.disk-a.path", "/mnt/a",
                "assetsync.volume.disk-b.path", "/mnt/b",
                "assetsync.volume.disk-b.course-root", "Archive");

        List<Volume> volumes = config.getVolumes();
        assertEquals(2, volumes.size());
        assertEquals("disk-b", volumes.get(0).getId());
        assertEquals("Archive", volumes.get(0).getCourseRoot());
        assertEquals(Paths.get("/mnt/a"), volumes.get(1).getMountPath());
        assertEquals("Downloaded Courses", volumes.get(1).getCourseRoot());
    }

    @Test
    void testListsAndExtensions() {
        AssetSyncConfiguration config = config(
                "assetsync.index.roots", "/mnt/a, /mnt/b ,",
                "assetsync.index.extensions", ".MP4,pptx",
                "assetsync.transfer.extra-args", "  --transfers=2   --fast-list ");

        assertEquals(List.of(Paths.get("/mnt/a"), Paths.get("/mnt/b")), config.getIndexRoots());
        assertEquals(Set.of("mp4", "pptx"), config.getIndexExtensions());
        assertEquals(List.of("--transfers=2", "--fast-list"), config.getTransferExtraArgs());
    }

    @Test
    void testInvalidNumberFallsBackToDefault() {
        assertEquals(75, config("assetsync.match.threshold", "high").getMatchThreshold());
    }

    @Test
    void testValidateRequiresVolumesOnlyWhenAsked() throws ConfigurationException {
        AssetSyncConfiguration config = config();
        config.validate(false);
        assertThrows(ConfigurationException.class, () -> config.validate(true));

        AssetSyncConfiguration missingPath = config("assetsync.volumes", "disk-a");
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> missingPath.validate(true));
        assertTrue(e.getMessage().contains("disk-a"));
    }

    @Test
    void testValidateRejectsOutOfRangeValues() {
        assertThrows(ConfigurationException.class,
                () -> config("assetsync.match.threshold", "101").validate(false));
        assertThrows(ConfigurationException.class,
                () -> config("assetsync.assignment.tie-tolerance", "1.0").validate(false));
        assertThrows(ConfigurationException.class,
                () -> config("assetsync.assignment.min-free-gb", "-1").validate(false));
        assertThrows(ConfigurationException.class,
                () -> config("assetsync.transfer.max-retries", "0").validate(false));
        assertThrows(ConfigurationException.class,
                () -> config("assetsync.transfer.timeout-minutes", "0").validate(false));
    }

    @Test
    void testFromFile() throws IOException, ConfigurationException {
        Path file = tempDir.resolve("assetsync.properties");
        Files.writeString(file, "assetsync.match.threshold=82\nassetsync.state.dir=" + tempDir.resolve("state")
                .toString().replace("\\", "\\\\") + "\n");

        AssetSyncConfiguration config = AssetSyncConfiguration.fromFile(file);

        assertEquals(82, config.getMatchThreshold());
        assertEquals(tempDir.resolve("state"), config.getStateDir());
        assertThrows(ConfigurationException.class,
                () -> AssetSyncConfiguration.fromFile(tempDir.resolve("missing.properties")));
    }
}
