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

import dev.mars.assetsync.core.AssetOutcome;
import dev.mars.assetsync.core.CourseResult;
import dev.mars.assetsync.core.CourseTransferStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Results of one orchestrator run, in manifest order.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 */
public final class RunSummary {

    private final List<CourseResult> results;
    private final boolean dryRun;
    private final boolean stopped;

    public RunSummary(List<CourseResult> results, boolean dryRun, boolean stopped) {
        this.results = Collections.unmodifiableList(results);
        this.dryRun = dryRun;
        this.stopped = stopped;
    }

    public List<CourseResult> getResults() {
        return results;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    /**
     * True when the run was stopped before every selected course was processed.
     */
    public boolean isStopped() {
        return stopped;
    }

    public Map<CourseTransferStatus, Long> getCourseCounts() {
        Map<CourseTransferStatus, Long> counts = new EnumMap<>(CourseTransferStatus.class);
        for (CourseTransferStatus status : CourseTransferStatus.values()) {
            counts.put(status, 0L);
        }
        for (CourseResult result : results) {
            counts.merge(result.getStatus(), 1L, Long::sum);
        }
        return counts;
    }

    public long countCourses(CourseTransferStatus status) {
        return results.stream().filter(r -> r.getStatus() == status).count();
    }

    public long countAssets(AssetOutcome outcome) {
        return results.stream().mapToLong(r -> r.countOf(outcome)).sum();
    }

    public boolean hasFailures() {
        return countAssets(AssetOutcome.FAILED) > 0 || countCourses(CourseTransferStatus.FAILED) > 0;
    }

    @Override
    public String toString() {
        return String.format("RunSummary{courses=%d, complete=%d, partial=%d, failed=%d, skipped=%d, "
                        + "assetsOk=%d, assetsFailed=%d, dryRun=%s, stopped=%s}",
                results.size(),
                countCourses(CourseTransferStatus.COMPLETE),
                countCourses(CourseTransferStatus.PARTIAL),
                countCourses(CourseTransferStatus.FAILED),
                countCourses(CourseTransferStatus.SKIPPED),
                countAssets(AssetOutcome.OK),
                countAssets(AssetOutcome.FAILED),
                dryRun, stopped);
    }
}
