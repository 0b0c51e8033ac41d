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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of running one course through the transfer orchestrator.
 *
 * <p>Instances are confined to the thread processing the course. The status moves
 * through {@link CourseTransferStatus}; the final status is derived from the
 * recorded asset outcomes by {@link #finish()}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public final class CourseResult {

    private final String courseName;
    private final Map<AssetType, TransferOutcome> outcomes = new EnumMap<>(AssetType.class);
    private CourseTransferStatus status = CourseTransferStatus.PENDING;
    private String volumeId;
    private String detail;

    public CourseResult(String courseName) {
        this.courseName = Objects.requireNonNull(courseName, "courseName");
    }

    public void start(String volumeId) {
        this.status = status.transitionTo(courseName, CourseTransferStatus.IN_PROGRESS);
        this.volumeId = volumeId;
    }

    public void skip(String reason) {
        this.status = status.transitionTo(courseName, CourseTransferStatus.SKIPPED);
        this.detail = reason;
    }

    public void record(TransferOutcome outcome) {
        outcomes.put(outcome.getAssetType(), outcome);
    }

    /**
     * Moves the course to its terminal status:
     * COMPLETE when every asset is settled, FAILED when at least one transfer was
     * attempted and every attempt failed, PARTIAL otherwise.
     *
     * @return the terminal status
     */
    public CourseTransferStatus finish() {
        this.status = status.transitionTo(courseName, deriveStatus());
        return status;
    }

    private CourseTransferStatus deriveStatus() {
        boolean allSettled = outcomes.size() == AssetType.values().length
                && outcomes.values().stream().allMatch(o -> o.getStatus().isSettled());
        if (allSettled) {
            return CourseTransferStatus.COMPLETE;
        }
        long attempted = outcomes.values().stream()
                .filter(o -> o.getStatus() == AssetOutcome.OK || o.getStatus() == AssetOutcome.FAILED)
                .count();
        long failed = countOf(AssetOutcome.FAILED);
        if (attempted > 0 && attempted == failed) {
            return CourseTransferStatus.FAILED;
        }
        return CourseTransferStatus.PARTIAL;
    }

    public long countOf(AssetOutcome outcome) {
        return outcomes.values().stream().filter(o -> o.getStatus() == outcome).count();
    }

    public String getCourseName() { return courseName; }

    public CourseTransferStatus getStatus() { return status; }

    public String getVolumeId() { return volumeId; }

    public String getDetail() { return detail; }

    public Map<AssetType, TransferOutcome> getOutcomes() {
        return Collections.unmodifiableMap(outcomes);
    }

    public TransferOutcome getOutcome(AssetType type) {
        return outcomes.get(type);
    }

    @Override
    public String toString() {
        return "CourseResult{course='" + courseName + "', status=" + status
                + ", volume=" + volumeId + ", outcomes=" + outcomes.size() + "}";
    }
}
