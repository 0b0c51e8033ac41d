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


package dev.mars.assetsync.storage;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.assetsync.core.AssetType;
import dev.mars.assetsync.core.TransferOutcome;
import dev.mars.assetsync.core.exceptions.StatusStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * {@link StatusStore} backed by two versioned JSON documents in a state directory.
 *
 * <p><b>Storage Layout:</b></p>
 * <pre>
 * {stateDir}/
 *   ├── disk_assignment.json     // {"version": 1, "assignments": {course: volumeId}}
 *   └── transfer_outcomes.json   // {"version": 1, "outcomes": {course: {assetType: outcome}}}
 * </pre>
 *
 * <p>Course names are keys compared without regard to case; the spelling first
 * recorded is the one kept in the documents.</p>
 *
 * <p>Both documents are loaded once when the store is opened. Each mutation rewrites the
 * affected document through a temp file and an atomic rename, so a crash leaves either
 * the old or the new document in place, never a torn one.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-18
 */
public final class JsonFileStatusStore implements StatusStore {

    private static final Logger logger = LoggerFactory.getLogger(JsonFileStatusStore.class);

    public static final String ASSIGNMENT_FILE = "disk_assignment.json";
    public static final String OUTCOME_FILE = "transfer_outcomes.json";

    /** Current document format version */
    static final int VERSION = 1;

    private final ObjectMapper mapper;
    private final Path assignmentFile;
    private final Path outcomeFile;
    private final Map<String, String> assignments;
    private final Map<String, Map<AssetType, TransferOutcome>> outcomes;

    private JsonFileStatusStore(ObjectMapper mapper, Path assignmentFile, Path outcomeFile,
                                Map<String, String> assignments,
                                Map<String, Map<AssetType, TransferOutcome>> outcomes) {
        this.mapper = mapper;
        this.assignmentFile = assignmentFile;
        this.outcomeFile = outcomeFile;
        this.assignments = assignments;
        this.outcomes = outcomes;
    }

    /**
     * Opens the store in {@code stateDir}. Missing documents mean an empty store.
     *
     * @throws StatusStoreException if a document exists but cannot be read, is corrupt,
     *                              or carries an unknown version
     */
    public static JsonFileStatusStore open(Path stateDir) throws StatusStoreException {
        ObjectMapper mapper = createMapper();
        Path assignmentFile = stateDir.resolve(ASSIGNMENT_FILE);
        Path outcomeFile = stateDir.resolve(OUTCOME_FILE);

        Map<String, String> assignments = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        AssignmentDocument assignmentDoc = read(mapper, assignmentFile, AssignmentDocument.class);
        if (assignmentDoc != null) {
            checkVersion(assignmentFile, assignmentDoc.version);
            if (assignmentDoc.assignments != null) {
                assignments.putAll(assignmentDoc.assignments);
            }
        }

        Map<String, Map<AssetType, TransferOutcome>> outcomes = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        OutcomeDocument outcomeDoc = read(mapper, outcomeFile, OutcomeDocument.class);
        if (outcomeDoc != null) {
            checkVersion(outcomeFile, outcomeDoc.version);
            if (outcomeDoc.outcomes != null) {
                outcomeDoc.outcomes.forEach((course, byType) -> {
                    Map<AssetType, TransferOutcome> copy =
                            outcomes.computeIfAbsent(course, c -> new EnumMap<>(AssetType.class));
                    if (byType != null) {
                        copy.putAll(byType);
                    }
                });
            }
        }

        logger.info("Opened status store in {} ({} assignments, {} courses with outcomes)",
                stateDir, assignments.size(), outcomes.size());
        return new JsonFileStatusStore(mapper, assignmentFile, outcomeFile, assignments, outcomes);
    }

    static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }

    private static <T> T read(ObjectMapper mapper, Path file, Class<T> type) throws StatusStoreException {
        if (!Files.exists(file)) {
            return null;
        }
        try {
            T document = mapper.readValue(file.toFile(), type);
            if (document == null) {
                throw new StatusStoreException(file, "document is empty");
            }
            return document;
        } catch (IOException e) {
            throw new StatusStoreException(file, "unreadable or corrupt: " + e.getMessage(), e);
        }
    }

    private static void checkVersion(Path file, int version) throws StatusStoreException {
        if (version != VERSION) {
            throw new StatusStoreException(file, "unsupported version " + version + ", expected " + VERSION);
        }
    }

    @Override
    public synchronized Optional<String> getAssignment(String courseName) {
        return Optional.ofNullable(assignments.get(courseName));
    }

    @Override
    public synchronized String assignIfAbsent(String courseName, String volumeId) throws StatusStoreException {
        String existing = assignments.get(courseName);
        if (existing != null) {
            return existing;
        }
        assignments.put(courseName, volumeId);
        try {
            write(assignmentFile, new AssignmentDocument(VERSION, assignments));
        } catch (StatusStoreException e) {
            assignments.remove(courseName);
            throw e;
        }
        logger.debug("Assigned '{}' to volume {}", courseName, volumeId);
        return volumeId;
    }

    @Override
    public synchronized Map<String, String> getAssignments() {
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(assignments);
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public synchronized Optional<TransferOutcome> getOutcome(String courseName, AssetType assetType) {
        Map<AssetType, TransferOutcome> byType = outcomes.get(courseName);
        return byType == null ? Optional.empty() : Optional.ofNullable(byType.get(assetType));
    }

    @Override
    public synchronized Map<AssetType, TransferOutcome> getOutcomes(String courseName) {
        Map<AssetType, TransferOutcome> byType = outcomes.get(courseName);
        if (byType == null) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new EnumMap<>(byType));
    }

    @Override
    public synchronized List<TransferOutcome> getAllOutcomes() {
        List<TransferOutcome> all = new ArrayList<>();
        outcomes.values().forEach(byType -> all.addAll(byType.values()));
        return Collections.unmodifiableList(all);
    }

    @Override
    public synchronized void upsertOutcome(TransferOutcome outcome) throws StatusStoreException {
        Map<AssetType, TransferOutcome> byType =
                outcomes.computeIfAbsent(outcome.getCourse(), c -> new EnumMap<>(AssetType.class));
        TransferOutcome previous = byType.put(outcome.getAssetType(), outcome);
        try {
            write(outcomeFile, new OutcomeDocument(VERSION, outcomes));
        } catch (StatusStoreException e) {
            if (previous != null) {
                byType.put(outcome.getAssetType(), previous);
            } else {
                byType.remove(outcome.getAssetType());
            }
            throw e;
        }
    }

    private void write(Path file, Object document) throws StatusStoreException {
        try {
            FileManager.writeAtomically(file, mapper.writeValueAsBytes(document));
        } catch (IOException e) {
            throw new StatusStoreException(file, "write failed: " + e.getMessage(), e);
        }
    }

    public Path getAssignmentFile() {
        return assignmentFile;
    }

    public Path getOutcomeFile() {
        return outcomeFile;
    }

    static final class AssignmentDocument {
        @JsonProperty("version")
        final int version;
        @JsonProperty("assignments")
        final Map<String, String> assignments;

        @JsonCreator
        AssignmentDocument(@JsonProperty("version") int version,
                           @JsonProperty("assignments") Map<String, String> assignments) {
            this.version = version;
            this.assignments = assignments;
        }
    }

    static final class OutcomeDocument {
        @JsonProperty("version")
        final int version;
        @JsonProperty("outcomes")
        final Map<String, Map<AssetType, TransferOutcome>> outcomes;

        @JsonCreator
        OutcomeDocument(@JsonProperty("version") int version,
                        @JsonProperty("outcomes") Map<String, Map<AssetType, TransferOutcome>> outcomes) {
            this.version = version;
            this.outcomes = outcomes;
        }
    }
}
