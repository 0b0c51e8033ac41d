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


package dev.mars.assetsync.reconcile;

import dev.mars.assetsync.core.AssetLink;
import dev.mars.assetsync.core.AssetOutcome;
import dev.mars.assetsync.core.AssetType;
import dev.mars.assetsync.core.AvailabilityRecord;
import dev.mars.assetsync.core.Course;
import dev.mars.assetsync.core.LocalStatus;
import dev.mars.assetsync.core.RemoteStatus;
import dev.mars.assetsync.core.TransferOutcome;
import dev.mars.assetsync.index.DriveIndex;
import dev.mars.assetsync.match.CourseFolderLocator;
import dev.mars.assetsync.match.FuzzyMatcher;
import dev.mars.assetsync.match.MatchResult;
import dev.mars.assetsync.storage.StatusStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Combines local evidence (the drive index and prior transfer outcomes) with remote
 * link reachability into one {@link AvailabilityRecord} per course and asset type.
 *
 * <p>Prior transfer outcomes are authoritative over a fresh filesystem probe: an asset
 * recorded as OK is reported as found via transfer, and one recorded as already present
 * is reported as found. A duplicate skip counts only when the asset it points at is
 * itself OK or present. Otherwise the asset is found only when its sub-folder was
 * located inside the matched course folder.</p>
 *
 * <p>Courses may be processed in parallel; the index is only read. Output order always
 * follows the input order.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class ReconciliationEngine {

    private static final Logger logger = LoggerFactory.getLogger(ReconciliationEngine.class);

    private final FuzzyMatcher matcher;
    private final int threshold;
    private final boolean parallel;
    private final StatusStore statusStore;

    /**
     * @param matcher     the fuzzy matcher
     * @param threshold   minimum course folder match score
     * @param parallel    whether to reconcile courses in parallel
     * @param statusStore prior transfer outcomes, or null when no store is available
     */
    public ReconciliationEngine(FuzzyMatcher matcher, int threshold, boolean parallel, StatusStore statusStore) {
        this.matcher = matcher;
        this.threshold = threshold;
        this.parallel = parallel;
        this.statusStore = statusStore;
    }

    /**
     * Reconciles every course against the index and the link verdicts.
     *
     * @param courses      courses in manifest order
     * @param driveIndex   the current drive index
     * @param linkStatuses reachability verdicts keyed by link URL or remote folder id
     * @return the report, in manifest order
     */
    public ReconciliationReport reconcile(List<Course> courses, DriveIndex driveIndex,
                                          Map<String, RemoteStatus> linkStatuses) {
        CourseFolderLocator locator = new CourseFolderLocator(driveIndex, matcher, threshold);
        logger.info("Reconciling {} course(s) against {} indexed path(s)", courses.size(), driveIndex.size());

        Stream<Course> stream = parallel ? courses.parallelStream() : courses.stream();
        List<CourseReconciliation> reconciled = stream
                .map(course -> reconcileCourse(course, locator, linkStatuses))
                .collect(Collectors.toList());

        Map<String, List<AvailabilityRecord>> byCourse = new LinkedHashMap<>();
        List<String> unmatched = new ArrayList<>();
        for (CourseReconciliation result : reconciled) {
            byCourse.put(result.course, result.records);
            if (!result.courseFolderMatched) {
                unmatched.add(result.course);
            }
        }
        ReconciliationReport report = new ReconciliationReport(byCourse, unmatched);
        logger.info("Reconciliation finished: {}", report.getSummary());
        return report;
    }

    private CourseReconciliation reconcileCourse(Course course, CourseFolderLocator locator,
                                                 Map<String, RemoteStatus> linkStatuses) {
        List<MatchResult> matches = locator.locate(course);
        Map<AssetType, TransferOutcome> outcomes = statusStore != null
                ? statusStore.getOutcomes(course.getName()) : Map.of();

        List<AvailabilityRecord> records = new ArrayList<>(matches.size());
        boolean courseFolderMatched = false;
        for (MatchResult match : matches) {
            AssetType type = match.getAssetType();
            courseFolderMatched |= match.getCourseFolder() != null;
            RemoteStatus remote = course.getLink(type)
                    .map(link -> remoteStatus(link, linkStatuses))
                    .orElse(RemoteStatus.ABSENT_LINK);
            LocalStatus local = localStatus(match, outcomes);
            String path = match.getLocalPath() != null ? match.getLocalPath() : match.getCourseFolder();
            records.add(new AvailabilityRecord(course.getName(), type, local, remote, path, match.getScore()));
        }
        return new CourseReconciliation(course.getName(), records, courseFolderMatched);
    }

    static RemoteStatus remoteStatus(AssetLink link, Map<String, RemoteStatus> linkStatuses) {
        RemoteStatus byUrl = linkStatuses.get(link.getUrl());
        if (byUrl != null) {
            return byUrl;
        }
        return link.getFolderId()
                .map(linkStatuses::get)
                .orElse(RemoteStatus.UNCHECKED);
    }

    static LocalStatus localStatus(MatchResult match, Map<AssetType, TransferOutcome> outcomes) {
        Optional<LocalStatus> recorded = recordedStatus(outcomes.get(match.getAssetType()), outcomes);
        if (recorded.isPresent()) {
            return recorded.get();
        }
        return match.isMatched() ? LocalStatus.FOUND : LocalStatus.ABSENT;
    }

    private static Optional<LocalStatus> recordedStatus(TransferOutcome outcome,
                                                        Map<AssetType, TransferOutcome> outcomes) {
        if (outcome == null) {
            return Optional.empty();
        }
        if (outcome.getStatus() == AssetOutcome.OK) {
            return Optional.of(LocalStatus.FOUND_VIA_TRANSFER);
        }
        if (outcome.getStatus() != AssetOutcome.SKIPPED_PRESENT) {
            return Optional.empty();
        }
        if (!outcome.isDuplicate()) {
            return Optional.of(LocalStatus.FOUND);
        }
        TransferOutcome referenced = outcomes.get(outcome.getDuplicateOf());
        if (referenced != null && !referenced.isDuplicate()
                && (referenced.getStatus() == AssetOutcome.OK
                || referenced.getStatus() == AssetOutcome.SKIPPED_PRESENT)) {
            return Optional.of(LocalStatus.FOUND);
        }
        return Optional.empty();
    }

    private static final class CourseReconciliation {
        final String course;
        final List<AvailabilityRecord> records;
        final boolean courseFolderMatched;

        CourseReconciliation(String course, List<AvailabilityRecord> records, boolean courseFolderMatched) {
            this.course = course;
            this.records = records;
            this.courseFolderMatched = courseFolderMatched;
        }
    }
}
