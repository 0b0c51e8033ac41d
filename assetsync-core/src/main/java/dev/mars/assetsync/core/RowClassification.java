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

import java.util.Collection;

/**
 * Row-level verdict for a course in the availability report.
 *
 * <pre>
 *   COMPLETE  every asset satisfied (report colour green)
 *   PARTIAL   some assets satisfied (yellow)
 *   NONE      no asset satisfied (red)
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 */
public enum RowClassification {
    COMPLETE,
    PARTIAL,
    NONE;

    /**
     * Classifies the records of one course. Pure function of its input.
     *
     * @param records the availability records of a single course
     * @return the row classification; NONE for an empty collection
     */
    public static RowClassification classify(Collection<AvailabilityRecord> records) {
        long satisfied = records.stream().filter(AvailabilityRecord::isSatisfied).count();
        if (satisfied == 0) {
            return NONE;
        }
        return satisfied == records.size() ? COMPLETE : PARTIAL;
    }
}
