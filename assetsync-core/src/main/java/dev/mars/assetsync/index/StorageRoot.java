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
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * A mounted storage root scanned by the {@link StorageIndexer}. The id is the absolute,
 * normalized path, so the same mount always maps to the same partition.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 */
public final class StorageRoot {

    private final String id;
    private final String path;

    @JsonCreator
    public StorageRoot(@JsonProperty("id") String id, @JsonProperty("path") String path) {
        this.id = Objects.requireNonNull(id, "id");
        this.path = Objects.requireNonNull(path, "path");
    }

    public static StorageRoot of(Path path) {
        String absolute = path.toAbsolutePath().normalize().toString();
        return new StorageRoot(absolute, absolute);
    }

    public String getId() { return id; }

    public String getPath() { return path; }

    public Path toPath() {
        return Paths.get(path);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StorageRoot)) return false;
        StorageRoot that = (StorageRoot) o;
        return id.equals(that.id) && path.equals(that.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, path);
    }

    @Override
    public String toString() {
        return "StorageRoot{" + path + "}";
    }
}
