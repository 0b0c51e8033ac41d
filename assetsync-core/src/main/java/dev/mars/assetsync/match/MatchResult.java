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


package dev.mars.assetsync.match;

import dev.mars.assetsync.core.AssetType;

import java.util.Objects;

/**
 * Where, if anywhere, an asset of a course was found on the indexed storage.
 * Derived on every run and never persisted.
 */
public final class MatchResult {

    private final String course;
    private final AssetType assetType;
    private final boolean matched;
    private final String courseFolder;
    private final String localPath;
    private final int score;

    private MatchResult(String course, AssetType assetType, boolean matched,
                        String courseFolder, String localPath, int score) {
        this.course = Objects.requireNonNull(course, "course");
        this.assetType = Objects.requireNonNull(assetType, "assetType");
        this.matched = matched;
        this.courseFolder = courseFolder;
        this.localPath = localPath;
        this.score = score;
    }

    public static MatchResult found(String course, AssetType assetType, String courseFolder,
                                    String assetFolder, int score) {
        return new MatchResult(course, assetType, true, courseFolder, assetFolder, score);
    }

    /**
     * The course folder was found but the asset sub-folder was not.
     */
    public static MatchResult courseOnly(String course, AssetType assetType, String courseFolder, int score) {
        return new MatchResult(course, assetType, false, courseFolder, null, score);
    }

    public static MatchResult notFound(String course, AssetType assetType) {
        return new MatchResult(course, assetType, false, null, null, 0);
    }

    public String getCourse() { return course; }

    public AssetType getAssetType() { return assetType; }

    /**
     * True when the asset sub-folder itself was located.
     */
    public boolean isMatched() { return matched; }

    public String getCourseFolder() { return courseFolder; }

    public String getLocalPath() { return localPath; }

    /**
     * Score of the course folder match, 0 when no course folder matched.
     */
    public int getScore() { return score; }

    @Override
    public String toString() {
        return "MatchResult{" + course + "/" + assetType + ", matched=" + matched
                + ", path=" + (localPath != null ? localPath : courseFolder) + ", score=" + score + "}";
    }
}
