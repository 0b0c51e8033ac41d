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
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Availability of one asset of one course, combining local and remote evidence.
 * Derived per run and handed to report rendering; never persisted by the engine.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public final class AvailabilityRecord {

    private final String course;
    private final AssetType assetType;
    private final LocalStatus localStatus;
    private final RemoteStatus remoteStatus;
    private final String localPath;
    private final int matchScore;

    @JsonCreator
    public AvailabilityRecord(
            @JsonProperty("course") String course,
            @JsonProperty("assetType") AssetType assetType,
            @JsonProperty("localStatus") LocalStatus localStatus,
            @JsonProperty("remoteStatus") RemoteStatus remoteStatus,
            @JsonProperty("localPath") String localPath,
            @JsonProperty("matchScore") int matchScore) {
        this.course = Objects.requireNonNull(course, "course");
        this.assetType = Objects.requireNonNull(assetType, "assetType");
        this.localStatus = Objects.requireNonNull(localStatus, "localStatus");
        this.remoteStatus = Objects.requireNonNull(remoteStatus, "remoteStatus");
        this.localPath = localPath;
        this.matchScore = matchScore;
    }

    public String getCourse() { return course; }

    public AssetType getAssetType() { return assetType; }

    public LocalStatus getLocalStatus() { return localStatus; }

    public RemoteStatus getRemoteStatus() { return remoteStatus; }

    /**
     * Root-qualified path of the located folder, or null when nothing was located.
     */
    public String getLocalPath() { return localPath; }

    /**
     * Fuzzy score of the course folder match, 0 when no folder matched.
     */
    public int getMatchScore() { return matchScore; }

    /**
     * An asset is satisfied when it is held locally or can still be fetched.
     */
    @JsonIgnore
    public boolean isSatisfied() {
        return localStatus.isFound() || remoteStatus == RemoteStatus.AVAILABLE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AvailabilityRecord)) return false;
        AvailabilityRecord that = (AvailabilityRecord) o;
        return matchScore == that.matchScore && course.equals(that.course)
                && assetType == that.assetType && localStatus == that.localStatus
                && remoteStatus == that.remoteStatus && Objects.equals(localPath, that.localPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(course, assetType, localStatus, remoteStatus, localPath, matchScore);
    }

    @Override
    public String toString() {
        return "AvailabilityRecord{" + course + "/" + assetType + ", local=" + localStatus
                + ", remote=" + remoteStatus + ", path=" + localPath + ", score=" + matchScore + "}";
    }
}
