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


package dev.mars.assetsync.core;

import dev.mars.assetsync.core.exceptions.InvalidTransitionException;

/**
 * Lifecycle states of one course within a transfer run.
 * <pre>
 *   PENDING → IN_PROGRESS → {COMPLETE | PARTIAL | FAILED}
 *   PENDING → SKIPPED
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-18
 */
public enum CourseTransferStatus {

    /** Course selected for the run, no asset processed yet. */
    PENDING,

    /** Assets are being processed one at a time. */
    IN_PROGRESS,

    /** Every asset is OK, present or without a link. */
    COMPLETE,

    /** Some assets settled and some failed, or some were not attempted. */
    PARTIAL,

    /** At least one transfer was attempted and all attempted transfers failed. */
    FAILED,

    /** The course was not processed this run, for example because no volume had space. */
    SKIPPED;

    public boolean isTerminal() {
        return this == COMPLETE || this == PARTIAL || this == FAILED || this == SKIPPED;
    }

    /**
     * Checks whether a transition from this status to the given target status is valid.
     *
     * @param target the target status to transition to
     * @return {@code true} if the transition is valid
     */
    public boolean canTransitionTo(CourseTransferStatus target) {
        return switch (this) {
            case PENDING -> target == IN_PROGRESS || target == SKIPPED;
            case IN_PROGRESS -> target == COMPLETE || target == PARTIAL || target == FAILED;
            case COMPLETE, PARTIAL, FAILED, SKIPPED -> false;
        };
    }

    /**
     * Returns all valid target statuses that this status can transition to.
     *
     * @return array of valid target statuses (empty for terminal states)
     */
    public CourseTransferStatus[] getValidTransitions() {
        return switch (this) {
            case PENDING -> new CourseTransferStatus[]{IN_PROGRESS, SKIPPED};
            case IN_PROGRESS -> new CourseTransferStatus[]{COMPLETE, PARTIAL, FAILED};
            case COMPLETE, PARTIAL, FAILED, SKIPPED -> new CourseTransferStatus[0];
        };
    }

    /**
     * Returns the target status if the transition is valid.
     *
     * @param courseName the course being transitioned, used in the error message
     * @param target     the requested status
     * @return {@code target}
     * @throws InvalidTransitionException if the transition is not allowed
     */
    public CourseTransferStatus transitionTo(String courseName, CourseTransferStatus target) {
        if (!canTransitionTo(target)) {
            throw new InvalidTransitionException(courseName, this, target, getValidTransitions());
        }
        return target;
    }
}
