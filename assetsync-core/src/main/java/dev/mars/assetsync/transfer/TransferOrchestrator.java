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

import dev.mars.assetsync.assign.AssignmentDecision;
import dev.mars.assetsync.assign.DiskAssignmentPolicy;
import dev.mars.assetsync.assign.FreeSpaceProbe;
import dev.mars.assetsync.assign.Volume;
import dev.mars.assetsync.core.AssetLink;
import dev.mars.assetsync.core.AssetOutcome;
import dev.mars.assetsync.core.AssetType;
import dev.mars.assetsync.core.Course;
import dev.mars.assetsync.core.CourseResult;
import dev.mars.assetsync.core.CourseTransferStatus;
import dev.mars.assetsync.core.TransferOutcome;
import dev.mars.assetsync.core.exceptions.StatusStoreException;
import dev.mars.assetsync.storage.FileManager;
import dev.mars.assetsync.storage.StatusStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives the transfer of course assets onto their assigned volumes.
 *
 * <p>Assets of one course are processed one at a time in {@link AssetType} order, and each
 * outcome is persisted before the next asset starts. Folders that are already populated
 * are never transferred again, and a remote folder linked from several asset columns of a
 * course is fetched only once. Per-asset problems become {@link AssetOutcome#FAILED}; only
 * a {@link StatusStoreException} escapes.</p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * TransferOrchestrator orchestrator = TransferOrchestrator.builder()
 *     .statusStore(store)
 *     .assignmentPolicy(policy)
 *     .volumes(config.getVolumes())
 *     .freeSpaceProbe(new FileStoreFreeSpaceProbe())
 *     .executor(new RetryingTransferExecutor(protocol, 3, 15_000))
 *     .build();
 * RunSummary summary = orchestrator.runAll(courses, TransferOptions.defaults());
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class TransferOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(TransferOrchestrator.class);

    /** Written into an asset folder after a successful transfer when markers are enabled. */
    public static final String COMPLETION_MARKER = ".assetsync-complete";

    static final String WOULD_TRANSFER = "would transfer";

    private final StatusStore statusStore;
    private final DiskAssignmentPolicy assignmentPolicy;
    private final List<Volume> volumes;
    private final FreeSpaceProbe freeSpaceProbe;
    private final RetryingTransferExecutor executor;
    private final boolean completionMarkerEnabled;
    private final boolean parallelVolumes;
    private final Clock clock;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    private TransferOrchestrator(Builder builder) {
        this.statusStore = Objects.requireNonNull(builder.statusStore, "Status store cannot be null");
        this.assignmentPolicy = Objects.requireNonNull(builder.assignmentPolicy, "Assignment policy cannot be null");
        this.volumes = List.copyOf(builder.volumes);
        this.freeSpaceProbe = Objects.requireNonNull(builder.freeSpaceProbe, "Free space probe cannot be null");
        this.executor = Objects.requireNonNull(builder.executor, "Transfer executor cannot be null");
        this.completionMarkerEnabled = builder.completionMarkerEnabled;
        this.parallelVolumes = builder.parallelVolumes;
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Asks the orchestrator to stop. The asset in flight finishes; no further asset or
     * course is started.
     */
    public void requestStop() {
        if (stopRequested.compareAndSet(false, true)) {
            logger.info("Stop requested; finishing the asset in flight");
        }
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    /**
     * Selects, assigns and transfers every eligible course.
     *
     * @return one result per selected course, in the order given
     * @throws StatusStoreException if the status store cannot be read or written
     */
    public RunSummary runAll(List<Course> courses, TransferOptions options) throws StatusStoreException {
        Map<String, Volume> volumesById = new LinkedHashMap<>();
        for (Volume volume : volumes) {
            volumesById.put(volume.getId(), volume);
        }

        List<Course> selected = new ArrayList<>();
        for (Course course : courses) {
            if (options.matches(course)) {
                selected.add(course);
            }
        }
        logger.info("Selected {} of {} courses{}", selected.size(), courses.size(),
                options.isDryRun() ? " (dry run)" : "");

        Map<String, CourseResult> results = new ConcurrentHashMap<>();
        Map<Volume, List<Course>> byVolume = new LinkedHashMap<>();
        Map<String, Long> freeSpace = freeSpaceProbe.snapshot(volumes);

        for (Course course : selected) {
            CourseResult result = new CourseResult(course.getName());
            if (!course.getStatus().isTransferable()) {
                result.skip("course is in production");
                results.put(course.getKey(), result);
                continue;
            }
            if (!course.hasAnyLink()) {
                result.skip("course has no asset links");
                results.put(course.getKey(), result);
                continue;
            }

            AssignmentDecision decision = options.isDryRun()
                    ? assignmentPolicy.decide(course, volumes, statusStore, freeSpace)
                    : assignmentPolicy.assign(course, volumes, statusStore, freeSpace);
            if (!decision.isAssigned()) {
                result.skip("no volume has enough free space");
                results.put(course.getKey(), result);
                continue;
            }
            Volume volume = volumesById.get(decision.getVolumeId().orElseThrow());
            if (volume == null) {
                logger.warn("Course '{}' is assigned to unknown volume {}; skipping",
                        course.getName(), decision.getVolumeId().orElse(null));
                result.skip("assigned to unknown volume " + decision.getVolumeId().orElse(null));
                results.put(course.getKey(), result);
                continue;
            }
            byVolume.computeIfAbsent(volume, v -> new ArrayList<>()).add(course);
        }

        if (parallelVolumes && byVolume.size() > 1) {
            runVolumesInParallel(byVolume, options, results);
        } else {
            for (Map.Entry<Volume, List<Course>> entry : byVolume.entrySet()) {
                runVolume(entry.getKey(), entry.getValue(), options, results);
            }
        }

        List<CourseResult> ordered = new ArrayList<>();
        for (Course course : selected) {
            CourseResult result = results.get(course.getKey());
            if (result != null) {
                ordered.add(result);
            }
        }
        RunSummary summary = new RunSummary(ordered, options.isDryRun(), stopRequested.get());
        logger.info("Run finished: {}", summary);
        return summary;
    }

    private void runVolume(Volume volume, List<Course> courses, TransferOptions options,
                           Map<String, CourseResult> results) throws StatusStoreException {
        for (Course course : courses) {
            if (stopRequested.get()) {
                logger.info("Stopping before course '{}'", course.getName());
                return;
            }
            results.put(course.getKey(), runCourse(course, volume, options));
        }
    }

    private void runVolumesInParallel(Map<Volume, List<Course>> byVolume, TransferOptions options,
                                      Map<String, CourseResult> results) throws StatusStoreException {
        AtomicInteger threadCounter = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(byVolume.size(), r -> {
            Thread t = new Thread(r, "TransferOrchestrator-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<Void>> futures = new ArrayList<>();
            for (Map.Entry<Volume, List<Course>> entry : byVolume.entrySet()) {
                Callable<Void> worker = () -> {
                    runVolume(entry.getKey(), entry.getValue(), options, results);
                    return null;
                };
                futures.add(pool.submit(worker));
            }
            for (Future<Void> future : futures) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    requestStop();
                    Throwable cause = e.getCause();
                    if (cause instanceof StatusStoreException) {
                        throw (StatusStoreException) cause;
                    }
                    if (cause instanceof RuntimeException) {
                        throw (RuntimeException) cause;
                    }
                    throw new IllegalStateException("Volume worker failed", cause);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            requestStop();
            logger.warn("Interrupted while waiting for volume workers");
        } finally {
            pool.shutdown();
        }
    }

    /**
     * Processes one course on its assigned volume.
     *
     * @throws StatusStoreException  if an outcome cannot be persisted
     * @throws IllegalStateException if a live run targets a volume the course is not assigned to
     */
    public CourseResult runCourse(Course course, Volume volume, TransferOptions options)
            throws StatusStoreException {
        String name = course.getName();
        CourseResult result = new CourseResult(name);

        if (!options.isDryRun()) {
            Optional<String> assigned = statusStore.getAssignment(name);
            if (assigned.isEmpty() || !assigned.get().equals(volume.getId())) {
                throw new IllegalStateException("Course '" + name + "' is not assigned to volume "
                        + volume.getId() + " (assignment: " + assigned.orElse("none") + ")");
            }
        }

        long free = freeSpaceProbe.freeBytes(volume);
        if (free < 0 || free < assignmentPolicy.getMinFreeBytes()) {
            logger.warn("Skipping '{}': volume {} has {} bytes free, {} required",
                    name, volume.getId(), free, assignmentPolicy.getMinFreeBytes());
            result.skip("insufficient free space on " + volume.getId());
            return result;
        }

        if (!options.isDryRun()) {
            result.start(volume.getId());
        }
        logger.info("Processing '{}' on volume {}", name, volume.getId());

        Map<AssetType, TransferOutcome> prior = statusStore.getOutcomes(name);
        Map<String, AssetType> seenRemotes = new HashMap<>();

        for (AssetType type : AssetType.values()) {
            if (stopRequested.get()) {
                logger.info("Stopping '{}' before {}", name, type);
                break;
            }
            TransferOutcome outcome;
            try {
                outcome = processAsset(course, type, volume, options, prior.get(type), seenRemotes);
            } catch (RuntimeException e) {
                logger.error("Unexpected error processing {} of '{}'", type, name, e);
                outcome = TransferOutcome.of(name, type, AssetOutcome.FAILED, volume.getId(), Instant.now(clock))
                        .withDetail(e.getClass().getSimpleName() + ": " + e.getMessage());
            }
            result.record(persist(outcome, prior.get(type), options));
        }

        if (!options.isDryRun()) {
            CourseTransferStatus status = result.finish();
            logger.info("Course '{}' finished {}: ok={}, present={}, noLink={}, failed={}", name, status,
                    result.countOf(AssetOutcome.OK), result.countOf(AssetOutcome.SKIPPED_PRESENT),
                    result.countOf(AssetOutcome.NO_LINK), result.countOf(AssetOutcome.FAILED));
        }
        return result;
    }

    private TransferOutcome processAsset(Course course, AssetType type, Volume volume, TransferOptions options,
                                         TransferOutcome prior, Map<String, AssetType> seenRemotes) {
        String name = course.getName();
        Instant now = Instant.now(clock);

        Optional<AssetLink> maybeLink = course.getLink(type);
        if (maybeLink.isEmpty()) {
            return TransferOutcome.of(name, type, AssetOutcome.NO_LINK, volume.getId(), now);
        }
        AssetLink link = maybeLink.get();
        String remoteKey = link.getRemoteKey();
        Path target = volume.assetDirectory(name, type);

        if (isPresent(target)) {
            seenRemotes.putIfAbsent(remoteKey, type);
            if (prior != null && volume.getId().equals(prior.getVolumeId())
                    && (prior.getStatus() == AssetOutcome.OK
                    || (prior.getStatus() == AssetOutcome.SKIPPED_PRESENT && !prior.isDuplicate()))) {
                return prior;
            }
            logger.debug("{} of '{}' already present at {}", type, name, target);
            return TransferOutcome.of(name, type, AssetOutcome.SKIPPED_PRESENT, volume.getId(), now);
        }

        AssetType first = seenRemotes.get(remoteKey);
        if (first != null) {
            logger.info("{} of '{}' links the same folder as {}; not fetching again", type, name, first);
            return TransferOutcome.of(name, type, AssetOutcome.SKIPPED_PRESENT, volume.getId(), now)
                    .withDuplicateOf(first);
        }
        seenRemotes.put(remoteKey, type);

        if (link.getFolderId().isEmpty()) {
            logger.warn("Cannot extract a remote folder id for {} of '{}': {}", type, name, link.getUrl());
            return TransferOutcome.of(name, type, AssetOutcome.FAILED, volume.getId(), now)
                    .withDetail("unparseable remote folder reference");
        }

        if (options.isDryRun()) {
            logger.info("[dry run] would transfer {} of '{}' into {}", type, name, target);
            return TransferOutcome.of(name, type, AssetOutcome.NOT_STARTED, volume.getId(), now)
                    .withDetail(WOULD_TRANSFER);
        }

        TransferRequest request = TransferRequest.builder()
                .courseName(name)
                .assetType(type)
                .link(link)
                .destination(target)
                .volumeId(volume.getId())
                .build();
        TransferResult transferResult = executor.execute(request, new TransferContext(request.getRequestId()));
        Instant finished = Instant.now(clock);

        if (!transferResult.isSuccessful()) {
            return TransferOutcome.of(name, type, AssetOutcome.FAILED, volume.getId(), finished)
                    .withDetail(transferResult.getErrorMessage().orElse("transfer failed"));
        }
        if (completionMarkerEnabled) {
            try {
                writeMarker(target, finished);
            } catch (IOException e) {
                logger.error("Cannot write completion marker in {}: {}", target, e.getMessage());
                return TransferOutcome.of(name, type, AssetOutcome.FAILED, volume.getId(), finished)
                        .withDetail("completion marker could not be written: " + e.getMessage());
            }
        }
        logger.info("Transferred {} of '{}' in {} attempt(s)", type, name, transferResult.getAttempts());
        return TransferOutcome.of(name, type, AssetOutcome.OK, volume.getId(), finished);
    }

    private TransferOutcome persist(TransferOutcome outcome, TransferOutcome prior, TransferOptions options)
            throws StatusStoreException {
        if (options.isDryRun()) {
            return outcome;
        }
        if (prior != null && prior.sameDecisionAs(outcome) && outcome.getStatus().isSettled()) {
            return prior;
        }
        statusStore.upsertOutcome(outcome);
        return outcome;
    }

    boolean isPresent(Path assetDirectory) {
        if (completionMarkerEnabled) {
            return Files.isRegularFile(assetDirectory.resolve(COMPLETION_MARKER));
        }
        return FileManager.isPopulated(assetDirectory);
    }

    private static void writeMarker(Path assetDirectory, Instant when) throws IOException {
        FileManager.writeAtomically(assetDirectory.resolve(COMPLETION_MARKER),
                (when.toString() + System.lineSeparator()).getBytes(StandardCharsets.UTF_8));
    }

    public static class Builder {
        private StatusStore statusStore;
        private DiskAssignmentPolicy assignmentPolicy;
        private List<Volume> volumes = List.of();
        private FreeSpaceProbe freeSpaceProbe;
        private RetryingTransferExecutor executor;
        private boolean completionMarkerEnabled;
        private boolean parallelVolumes;
        private Clock clock = Clock.systemUTC();

        public Builder statusStore(StatusStore statusStore) {
            this.statusStore = statusStore;
            return this;
        }

        public Builder assignmentPolicy(DiskAssignmentPolicy assignmentPolicy) {
            this.assignmentPolicy = assignmentPolicy;
            return this;
        }

        public Builder volumes(List<Volume> volumes) {
            this.volumes = volumes;
            return this;
        }

        public Builder freeSpaceProbe(FreeSpaceProbe freeSpaceProbe) {
            this.freeSpaceProbe = freeSpaceProbe;
            return this;
        }

        public Builder executor(RetryingTransferExecutor executor) {
            this.executor = executor;
            return this;
        }

        public Builder completionMarkerEnabled(boolean completionMarkerEnabled) {
            this.completionMarkerEnabled = completionMarkerEnabled;
            return this;
        }

        public Builder parallelVolumes(boolean parallelVolumes) {
            this.parallelVolumes = parallelVolumes;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public TransferOrchestrator build() {
            return new TransferOrchestrator(this);
        }
    }
}
