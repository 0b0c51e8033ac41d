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

import dev.mars.assetsync.core.Course;
import dev.mars.assetsync.core.exceptions.StatusStoreException;
import dev.mars.assetsync.storage.StatusStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Decides, once and for good, which volume a course is transferred to.
 *
 * <p>Rules, applied in order:</p>
 * <ol>
 *   <li>A persisted assignment is returned unchanged, whatever the current free space.</li>
 *   <li>If {@code <volume>/<courseRoot>/<course>} already exists as a directory on a
 *       candidate volume, that volume is reused.</li>
 *   <li>Volumes below the minimum free space are not eligible. With none eligible the
 *       course is skipped for this run.</li>
 *   <li>Eligible volumes whose free space is within the relative tie tolerance of the
 *       largest reading are tied. A single tied volume wins outright; several tied
 *       volumes take turns through a running counter.</li>
 * </ol>
 *
 * <p>Decisions are persisted with put-if-absent semantics. There is no rebalancing and
 * no migration of assigned courses.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class DiskAssignmentPolicy {

    private static final Logger logger = LoggerFactory.getLogger(DiskAssignmentPolicy.class);

    private final long minFreeBytes;
    private final double tieTolerance;
    private final AtomicLong turn = new AtomicLong();

    public DiskAssignmentPolicy(long minFreeBytes, double tieTolerance) {
        if (tieTolerance < 0 || tieTolerance >= 1) {
            throw new IllegalArgumentException("Tie tolerance must be in [0, 1), got: " + tieTolerance);
        }
        this.minFreeBytes = minFreeBytes;
        this.tieTolerance = tieTolerance;
    }

    /**
     * Decides the volume for {@code course} and persists a new decision immediately.
     *
     * @param course            the course to place
     * @param candidateVolumes  volumes in configured order
     * @param statusStore       the store holding existing assignments
     * @param freeSpaceByVolume free bytes keyed by volume id; missing or negative means unknown
     * @return the decision; not assigned when no volume has enough space
     * @throws StatusStoreException if a new assignment cannot be persisted
     */
    public AssignmentDecision assign(Course course, List<Volume> candidateVolumes, StatusStore statusStore,
                                     Map<String, Long> freeSpaceByVolume) throws StatusStoreException {
        AssignmentDecision decision = decide(course, candidateVolumes, statusStore, freeSpaceByVolume);
        if (!decision.isAssigned() || decision.getReason() == AssignmentDecision.Reason.EXISTING) {
            return decision;
        }
        String chosen = decision.getVolumeId().orElseThrow();
        String stored = statusStore.assignIfAbsent(course.getName(), chosen);
        if (!stored.equals(chosen)) {
            return AssignmentDecision.assigned(course.getName(), stored, AssignmentDecision.Reason.EXISTING);
        }
        logger.info("Assigned '{}' to volume {} ({})", course.getName(), chosen, decision.getReason());
        return decision;
    }

    /**
     * Decides without persisting. Dry runs use this so that they report the same placement
     * a live run would make.
     */
    public AssignmentDecision decide(Course course, List<Volume> candidateVolumes, StatusStore statusStore,
                                     Map<String, Long> freeSpaceByVolume) {
        String name = course.getName();
        Optional<String> existing = statusStore.getAssignment(name);
        if (existing.isPresent()) {
            return AssignmentDecision.assigned(name, existing.get(), AssignmentDecision.Reason.EXISTING);
        }

        for (Volume volume : candidateVolumes) {
            if (Files.isDirectory(volume.courseDirectory(name))) {
                return AssignmentDecision.assigned(name, volume.getId(), AssignmentDecision.Reason.REUSE_IN_PLACE);
            }
        }

        List<Volume> eligible = candidateVolumes.stream()
                .filter(v -> isEligible(freeBytes(freeSpaceByVolume, v)))
                .collect(Collectors.toList());
        if (eligible.isEmpty()) {
            logger.warn("No volume has {} bytes free for '{}'; skipping this run", minFreeBytes, name);
            return AssignmentDecision.skipped(name);
        }

        long max = eligible.stream().mapToLong(v -> freeBytes(freeSpaceByVolume, v)).max().orElse(0);
        double floor = max * (1.0 - tieTolerance);
        List<Volume> tied = eligible.stream()
                .filter(v -> freeBytes(freeSpaceByVolume, v) >= floor)
                .collect(Collectors.toList());
        if (tied.size() == 1) {
            return AssignmentDecision.assigned(name, tied.get(0).getId(), AssignmentDecision.Reason.MORE_FREE_SPACE);
        }
        int index = (int) (turn.getAndIncrement() % tied.size());
        return AssignmentDecision.assigned(name, tied.get(index).getId(), AssignmentDecision.Reason.ROUND_ROBIN);
    }

    private boolean isEligible(long free) {
        return free >= 0 && free >= minFreeBytes;
    }

    private static long freeBytes(Map<String, Long> freeSpaceByVolume, Volume volume) {
        Long free = freeSpaceByVolume.get(volume.getId());
        return free != null ? free : -1L;
    }

    public long getMinFreeBytes() {
        return minFreeBytes;
    }

    public double getTieTolerance() {
        return tieTolerance;
    }
}
