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
import dev.mars.assetsync.core.Course;
import dev.mars.assetsync.index.DriveIndex;
import dev.mars.assetsync.index.IndexEntry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Locates course folders and their asset sub-folders in a {@link DriveIndex}.
 *
 * <p>The course name is fuzzy matched against every indexed directory name. Inside the
 * matched course folders an asset sub-folder is looked up by its fixed folder name and
 * aliases first, shallowest match winning, and only then fuzzy matched on the asset
 * type name. The fuzzy fallback never picks a folder carrying another asset type's
 * fixed name.</p>
 *
 * <p>Directory names are normalized once at construction; instances are immutable and
 * may be shared by parallel reconciliation workers.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 */
public class CourseFolderLocator {

    private static final Comparator<IndexEntry> SHALLOWEST_FIRST = Comparator
            .comparingInt(IndexEntry::getDepth)
            .thenComparing(IndexEntry::getRootId)
            .thenComparing(IndexEntry::getRelativePath);

    private final DriveIndex index;
    private final FuzzyMatcher matcher;
    private final int threshold;
    private final FuzzyMatcher.CandidateSet<IndexEntry> directories;
    private final Map<AssetType, Set<String>> fixedNames = new EnumMap<>(AssetType.class);
    private final Map<AssetType, Set<String>> claimedByOthers = new EnumMap<>(AssetType.class);

    public CourseFolderLocator(DriveIndex index, FuzzyMatcher matcher, int threshold) {
        this.index = index;
        this.matcher = matcher;
        this.threshold = threshold;
        List<IndexEntry> dirs = new ArrayList<>(index.getDirectories());
        dirs.sort(SHALLOWEST_FIRST);
        this.directories = matcher.prepare(dirs, IndexEntry::getName);
        for (AssetType type : AssetType.values()) {
            Set<String> names = new HashSet<>();
            names.add(NameNormalizer.normalize(type.getFolderName()));
            type.getAliases().forEach(alias -> names.add(NameNormalizer.normalize(alias)));
            fixedNames.put(type, names);
        }
        for (AssetType type : AssetType.values()) {
            Set<String> claimed = new HashSet<>();
            fixedNames.forEach((other, otherNames) -> {
                if (other != type) {
                    claimed.addAll(otherNames);
                }
            });
            claimedByOthers.put(type, claimed);
        }
    }

    public Optional<MatchCandidate<IndexEntry>> findCourseFolder(String courseName) {
        return matcher.findBestMatch(courseName, directories, threshold);
    }

    /**
     * Every course folder sharing the best score, for example the same course folder
     * present on several roots. Shallowest first within equal names.
     */
    public List<MatchCandidate<IndexEntry>> findCourseFolders(String courseName) {
        return matcher.findBestMatches(courseName, directories, threshold);
    }

    public Optional<IndexEntry> findAssetFolder(IndexEntry courseFolder, AssetType type) {
        List<IndexEntry> descendants = index.getDescendantDirectories(courseFolder);
        Set<String> names = fixedNames.get(type);
        Optional<IndexEntry> fixed = descendants.stream()
                .filter(dir -> names.contains(dir.getNormalizedName()))
                .min(SHALLOWEST_FIRST);
        if (fixed.isPresent()) {
            return fixed;
        }

        if (descendants.isEmpty()) {
            return Optional.empty();
        }
        Set<String> claimed = claimedByOthers.get(type);
        List<IndexEntry> unclaimed = descendants.stream()
                .filter(dir -> !claimed.contains(dir.getNormalizedName()))
                .sorted(SHALLOWEST_FIRST)
                .collect(Collectors.toList());
        return matcher.findBestMatch(type.getDisplayName(), matcher.prepare(unclaimed, IndexEntry::getName), threshold)
                .map(MatchCandidate::getItem);
    }

    /**
     * Locates all six assets of a course, in asset order. The course folders are matched
     * once; each asset is looked up in every best-scoring course folder and the first
     * folder holding it wins. An asset found nowhere is reported against the first folder.
     */
    public List<MatchResult> locate(Course course) {
        List<MatchResult> results = new ArrayList<>(AssetType.values().length);
        List<MatchCandidate<IndexEntry>> courseFolders = findCourseFolders(course.getName());
        for (AssetType type : AssetType.values()) {
            if (courseFolders.isEmpty()) {
                results.add(MatchResult.notFound(course.getName(), type));
                continue;
            }
            results.add(locateAsset(course.getName(), type, courseFolders));
        }
        return results;
    }

    private MatchResult locateAsset(String courseName, AssetType type, List<MatchCandidate<IndexEntry>> courseFolders) {
        for (MatchCandidate<IndexEntry> candidate : courseFolders) {
            Optional<IndexEntry> assetFolder = findAssetFolder(candidate.getItem(), type);
            if (assetFolder.isPresent()) {
                return MatchResult.found(courseName, type, index.resolve(candidate.getItem()).toString(),
                        index.resolve(assetFolder.get()).toString(), candidate.getScore());
            }
        }
        MatchCandidate<IndexEntry> first = courseFolders.get(0);
        return MatchResult.courseOnly(courseName, type, index.resolve(first.getItem()).toString(), first.getScore());
    }
}
