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

import java.util.List;

/**
 * The six fixed categories of course material tracked per course.
 *
 * <p>Declaration order is the processing order used by the transfer orchestrator
 * and the column order of the availability report.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public enum AssetType {

    COURSE_OUTLINE("Course Outline", "Course Outline", List.of("Outline", "Syllabus", "COD")),
    SLIDES("PPTs", "PPTs", List.of("Slides", "PPT", "Presentations")),
    WRITTEN_ASSETS("Written Assets", "Written Assets", List.of("Written", "Written Assets (PQ, GQ, DP)")),
    FINAL_VIDEOS("Final Videos", "Final Videos", List.of("Final Video", "Final")),
    RAW_VIDEOS("Raw Videos", "Raw Videos", List.of("Raw Video", "Raw Footage", "Rushes")),
    COURSE_ARTIFACTS("Course Artifacts", "Course Artifacts", List.of("Artifacts", "Course Artifacts Link"));

    private final String displayName;
    private final String folderName;
    private final List<String> aliases;

    AssetType(String displayName, String folderName, List<String> aliases) {
        this.displayName = displayName;
        this.folderName = folderName;
        this.aliases = aliases;
    }

    /**
     * Human readable label, also the default manifest column label.
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Name of the sub-folder this asset is stored under inside a course folder.
     */
    public String getFolderName() {
        return folderName;
    }

    /**
     * Alternative folder names accepted when locating an existing asset folder.
     */
    public List<String> getAliases() {
        return aliases;
    }
}
