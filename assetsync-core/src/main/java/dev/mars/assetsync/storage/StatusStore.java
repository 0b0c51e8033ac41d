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

import dev.mars.assetsync.core.AssetType;
import dev.mars.assetsync.core.TransferOutcome;
import dev.mars.assetsync.core.exceptions.StatusStoreException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable record of disk assignments and per-asset transfer outcomes.
 *
 * <p>The store is the single source of truth for what still needs doing. Every
 * mutating call is durable when it returns. Implementations are safe for use by
 * several threads of one process; access from several processes is not supported.</p>
 *
 * <p>Course names are compared case-insensitively, matching {@link dev.mars.assetsync.core.Course#getKey()}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public interface StatusStore {

    Optional<String> getAssignment(String courseName);

    /**
     * Records {@code volumeId} for the course unless it already has an assignment.
     * Existing assignments are never overwritten.
     *
     * @return the volume the course is assigned to after the call
     * @throws StatusStoreException if the assignment cannot be persisted
     */
    String assignIfAbsent(String courseName, String volumeId) throws StatusStoreException;

    /**
     * Snapshot of all assignments, course name to volume id.
     */
    Map<String, String> getAssignments();

    Optional<TransferOutcome> getOutcome(String courseName, AssetType assetType);

    /**
     * Snapshot of the recorded outcomes of one course, in asset order.
     */
    Map<AssetType, TransferOutcome> getOutcomes(String courseName);

    List<TransferOutcome> getAllOutcomes();

    /**
     * Inserts or replaces the outcome for the outcome's course and asset type.
     *
     * @throws StatusStoreException if the outcome cannot be persisted
     */
    void upsertOutcome(TransferOutcome outcome) throws StatusStoreException;
}
