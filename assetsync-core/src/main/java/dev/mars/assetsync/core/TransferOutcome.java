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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Persistent outcome of one asset transfer, keyed by course and asset type.
 *
 * <p>Written by the transfer orchestrator immediately after the asset has been
 * processed, so an interrupted run loses at most the asset that was in flight.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TransferOutcome {

    private final String course;
    private final AssetType assetType;
    private final AssetOutcome status;
    private final Instant timestamp;
    private final String volumeId;
    private final String detail;
    private final AssetType duplicateOf;

    @JsonCreator
    public TransferOutcome(
            @JsonProperty("course") String course,
            @JsonProperty("assetType") AssetType assetType,
            @JsonProperty("status") AssetOutcome status,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("volumeId") String volumeId,
            @JsonProperty("detail") String detail,
            @JsonProperty("duplicateOf") AssetType duplicateOf) {
        this.course = Objects.requireNonNull(course, "course");
        this.assetType = Objects.requireNonNull(assetType, "assetType");
        this.status = Objects.requireNonNull(status, "status");
        this.timestamp = timestamp != null ? timestamp : Instant.now();
        this.volumeId = volumeId;
        this.detail = detail;
        this.duplicateOf = duplicateOf;
    }

    public static TransferOutcome of(String course, AssetType assetType, AssetOutcome status,
                                     String volumeId, Instant timestamp) {
        return new TransferOutcome(course, assetType, status, timestamp, volumeId, null, null);
    }

    public TransferOutcome withDetail(String newDetail) {
        return new TransferOutcome(course, assetType, status, timestamp, volumeId, newDetail, duplicateOf);
    }

    public TransferOutcome withDuplicateOf(AssetType first) {
        return new TransferOutcome(course, assetType, status, timestamp, volumeId, detail, first);
    }

    public String getCourse() { return course; }

    public AssetType getAssetType() { return assetType; }

    public AssetOutcome getStatus() { return status; }

    public Instant getTimestamp() { return timestamp; }

    public String getVolumeId() { return volumeId; }

    public String getDetail() { return detail; }

    public AssetType getDuplicateOf() { return duplicateOf; }

    @JsonIgnore
    public boolean isDuplicate() {
        return duplicateOf != null;
    }

    /**
     * Two outcomes record the same decision when status, volume and duplicate
     * reference agree. Timestamp and detail are ignored.
     */
    public boolean sameDecisionAs(TransferOutcome other) {
        return other != null && status == other.status
                && Objects.equals(volumeId, other.volumeId)
                && duplicateOf == other.duplicateOf;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransferOutcome)) return false;
        TransferOutcome that = (TransferOutcome) o;
        return course.equals(that.course) && assetType == that.assetType && status == that.status
                && timestamp.equals(that.timestamp) && Objects.equals(volumeId, that.volumeId)
                && Objects.equals(detail, that.detail) && duplicateOf == that.duplicateOf;
    }

    @Override
    public int hashCode() {
        return Objects.hash(course, assetType, status, timestamp, volumeId, detail, duplicateOf);
    }

    @Override
    public String toString() {
        return "TransferOutcome{" + course + "/" + assetType + "=" + status
                + ", volume=" + volumeId
                + (duplicateOf != null ? ", duplicateOf=" + duplicateOf : "")
                + (detail != null ? ", detail='" + detail + "'" : "") + "}";
    }
}
