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

/**
 * Result of processing one asset of one course.
 *
 * <pre>
 * NOT_STARTED → {OK | SKIPPED_PRESENT | NO_LINK | FAILED}
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 */
public enum AssetOutcome {
    OK,
    SKIPPED_PRESENT,
    NO_LINK,
    FAILED,
    NOT_STARTED;

    /**
     * Outcomes that leave nothing to do for the asset on a later run.
     */
    public boolean isSettled() {
        return this == OK || this == SKIPPED_PRESENT || this == NO_LINK;
    }
}
