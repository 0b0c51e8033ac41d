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

import dev.mars.assetsync.core.AssetType;
import dev.mars.assetsync.storage.FileManager;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A target volume that receives transferred courses under its course root.
 *
 * <pre>
 * {mountPath}/{courseRoot}/{sanitized course name}/{asset folder}
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 */
public final class Volume {

    private final String id;
    private final Path mountPath;
    private final String courseRoot;

    public Volume(String id, Path mountPath, String courseRoot) {
        this.id = Objects.requireNonNull(id, "Volume id cannot be null");
        this.mountPath = Objects.requireNonNull(mountPath, "Mount path cannot be null");
        this.courseRoot = courseRoot != null ? courseRoot : "";
    }

    public String getId() { return id; }

    public Path getMountPath() { return mountPath; }

    public String getCourseRoot() { return courseRoot; }

    public Path getCourseRootPath() {
        return courseRoot.isEmpty() ? mountPath : mountPath.resolve(courseRoot);
    }

    public Path courseDirectory(String courseName) {
        return getCourseRootPath().resolve(FileManager.sanitizeName(courseName));
    }

    public Path assetDirectory(String courseName, AssetType type) {
        return courseDirectory(courseName).resolve(type.getFolderName());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Volume)) return false;
        Volume volume = (Volume) o;
        return id.equals(volume.id) && mountPath.equals(volume.mountPath) && courseRoot.equals(volume.courseRoot);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, mountPath, courseRoot);
    }

    @Override
    public String toString() {
        return "Volume{" + id + "=" + mountPath + "}";
    }
}
