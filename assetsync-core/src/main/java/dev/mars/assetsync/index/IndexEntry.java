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


package dev.mars.assetsync.index;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One file or directory discovered while scanning a storage root.
 *
 * <p>The relative path is {@code /}-separated and relative to the owning root, so an
 * entry can never point outside it.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 */
public final class IndexEntry {

    private final String rootId;
    private final String relativePath;
    private final String normalizedName;
    private final boolean directory;

    @JsonCreator
    public IndexEntry(@JsonProperty("rootId") String rootId,
                      @JsonProperty("relativePath") String relativePath,
                      @JsonProperty("normalizedName") String normalizedName,
                      @JsonProperty("directory") boolean directory) {
        this.rootId = Objects.requireNonNull(rootId, "rootId");
        this.relativePath = Objects.requireNonNull(relativePath, "relativePath");
        this.normalizedName = Objects.requireNonNull(normalizedName, "normalizedName");
        this.directory = directory;
    }

    public String getRootId() { return rootId; }

    public String getRelativePath() { return relativePath; }

    public String getNormalizedName() { return normalizedName; }

    public boolean isDirectory() { return directory; }

    /**
     * Last path segment as it appears on disk.
     */
    @JsonIgnore
    public String getName() {
        int slash = relativePath.lastIndexOf('/');
        return slash < 0 ? relativePath : relativePath.substring(slash + 1);
    }

    /**
     * Number of path segments below the root; a top-level entry has depth 1.
     */
    @JsonIgnore
    public int getDepth() {
        int depth = 1;
        for (int i = 0; i < relativePath.length(); i++) {
            if (relativePath.charAt(i) == '/') {
                depth++;
            }
        }
        return depth;
    }

    /**
     * True when {@code other} lives strictly below this entry in the same root.
     */
    public boolean isAncestorOf(IndexEntry other) {
        return rootId.equals(other.rootId) && other.relativePath.startsWith(relativePath + "/");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IndexEntry)) return false;
        IndexEntry that = (IndexEntry) o;
        return directory == that.directory && rootId.equals(that.rootId)
                && relativePath.equals(that.relativePath) && normalizedName.equals(that.normalizedName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rootId, relativePath, normalizedName, directory);
    }

    @Override
    public String toString() {
        return (directory ? "dir:" : "file:") + relativePath;
    }
}
