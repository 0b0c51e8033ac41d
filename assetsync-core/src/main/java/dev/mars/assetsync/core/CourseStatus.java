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

import java.util.Locale;

/**
 * Production status of a course as recorded in the manifest.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 */
public enum CourseStatus {
    COMPLETED,
    IN_PRODUCTION,
    OTHER;

    /**
     * Parses a free-form manifest label such as {@code "Completed"} or
     * {@code "In Production"}. Anything unrecognised, including blank labels, maps to OTHER.
     *
     * @param label the manifest cell value, may be null
     * @return the matching status, never null
     */
    public static CourseStatus fromLabel(String label) {
        if (label == null) {
            return OTHER;
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s_-]+", " ");
        switch (normalized) {
            case "completed":
            case "complete":
                return COMPLETED;
            case "in production":
                return IN_PRODUCTION;
            default:
                return OTHER;
        }
    }

    /**
     * Courses still in production are not transferred.
     */
    public boolean isTransferable() {
        return this != IN_PRODUCTION;
    }
}
