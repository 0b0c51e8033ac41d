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


package dev.mars.assetsync.transfer;

import dev.mars.assetsync.core.AssetLink;
import dev.mars.assetsync.core.AssetType;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Immutable request to copy one remote asset folder into one local folder.
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * TransferRequest request = TransferRequest.builder()
 *     .courseName("Intro to Programming")
 *     .assetType(AssetType.SLIDES)
 *     .link(link)
 *     .destination(volume.assetDirectory("Intro to Programming", AssetType.SLIDES))
 *     .volumeId("disk-a")
 *     .build();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public final class TransferRequest {

    private final String requestId;
    private final String courseName;
    private final AssetType assetType;
    private final AssetLink link;
    private final Path destination;
    private final String volumeId;

    private TransferRequest(Builder builder) {
        this.courseName = Objects.requireNonNull(builder.courseName, "Course name cannot be null");
        this.assetType = Objects.requireNonNull(builder.assetType, "Asset type cannot be null");
        this.link = Objects.requireNonNull(builder.link, "Asset link cannot be null");
        this.destination = Objects.requireNonNull(builder.destination, "Destination cannot be null");
        this.volumeId = builder.volumeId;
        this.requestId = builder.requestId != null ? builder.requestId : courseName + "/" + assetType;
    }

    /**
     * Returns the identifier used in logs and errors, {@code <course>/<asset type>} by default.
     */
    public String getRequestId() { return requestId; }

    public String getCourseName() { return courseName; }

    public AssetType getAssetType() { return assetType; }

    public AssetLink getLink() { return link; }

    /**
     * Returns the local folder the remote folder's contents are copied into.
     */
    public Path getDestination() { return destination; }

    public String getVolumeId() { return volumeId; }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "TransferRequest{" + requestId + " -> " + destination + "}";
    }

    public static class Builder {
        private String requestId;
        private String courseName;
        private AssetType assetType;
        private AssetLink link;
        private Path destination;
        private String volumeId;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder courseName(String courseName) {
            this.courseName = courseName;
            return this;
        }

        public Builder assetType(AssetType assetType) {
            this.assetType = assetType;
            return this;
        }

        public Builder link(AssetLink link) {
            this.link = link;
            return this;
        }

        public Builder destination(Path destination) {
            this.destination = destination;
            return this;
        }

        public Builder volumeId(String volumeId) {
            this.volumeId = volumeId;
            return this;
        }

        public TransferRequest build() {
            return new TransferRequest(this);
        }
    }
}
