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


package dev.mars.assetsync.assign;

import java.util.Objects;
import java.util.Optional;

/**
 * The volume chosen for a course and why.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 */
public final class AssignmentDecision {

    public enum Reason {
        /** The course already had a persisted assignment. */
        EXISTING,
        /** A folder for the course already existed on this volume. */
        REUSE_IN_PLACE,
        /** This volume had clearly more free space than the others. */
        MORE_FREE_SPACE,
        /** Free space was level, so volumes took turns. */
        ROUND_ROBIN,
        /** No volume had the minimum free space; retried on the next run. */
        SKIPPED_INSUFFICIENT_SPACE
    }

    private final String course;
    private final String volumeId;
    private final Reason reason;

    private AssignmentDecision(String course, String volumeId, Reason reason) {
        this.course = Objects.requireNonNull(course, "course");
        this.volumeId = volumeId;
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public static AssignmentDecision assigned(String course, String volumeId, Reason reason) {
        return new AssignmentDecision(course, Objects.requireNonNull(volumeId, "volumeId"), reason);
    }

    public static AssignmentDecision skipped(String course) {
        return new AssignmentDecision(course, null, Reason.SKIPPED_INSUFFICIENT_SPACE);
    }

    public String getCourse() { return course; }

    public Optional<String> getVolumeId() { return Optional.ofNullable(volumeId); }

    public Reason getReason() { return reason; }

    public boolean isAssigned() {
        return volumeId != null;
    }

    @Override
    public String toString() {
        return "AssignmentDecision{" + course + " -> " + volumeId + " (" + reason + ")}";
    }
}
