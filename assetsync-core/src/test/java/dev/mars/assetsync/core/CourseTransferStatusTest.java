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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Covers every (source, target) pair of the course lifecycle.
 */
class CourseTransferStatusTest {

    private static EnumSet<CourseTransferStatus> validTargets(CourseTransferStatus from) {
        return switch (from) {
            case PENDING -> EnumSet.of(CourseTransferStatus.IN_PROGRESS, CourseTransferStatus.SKIPPED);
            case IN_PROGRESS -> EnumSet.of(CourseTransferStatus.COMPLETE, CourseTransferStatus.PARTIAL,
                    CourseTransferStatus.FAILED);
            case COMPLETE, PARTIAL, FAILED, SKIPPED -> EnumSet.noneOf(CourseTransferStatus.class);
        };
    }

    static Stream<Arguments> allStatusPairs() {
        List<Arguments> pairs = new ArrayList<>();
        for (CourseTransferStatus from : CourseTransferStatus.values()) {
            Set<CourseTransferStatus> valid = validTargets(from);
            for (CourseTransferStatus to : CourseTransferStatus.values()) {
                pairs.add(Arguments.of(from, to, valid.contains(to)));
            }
        }
        return pairs.stream();
    }

    @ParameterizedTest(name = "{0} -> {1} valid={2}")
    @MethodSource("allStatusPairs")
    void testCanTransitionTo(CourseTransferStatus from, CourseTransferStatus to, boolean expected) {
        assertEquals(expected, from.canTransitionTo(to));
        assertEquals(expected, Arrays.asList(from.getValidTransitions()).contains(to));
    }

    @Test
    void testTerminalStatesHaveNoTransitions() {
        for (CourseTransferStatus status : CourseTransferStatus.values()) {
            assertEquals(status.isTerminal(), status.getValidTransitions().length == 0, status.name());
        }
    }

    @Test
    void testInvalidTransitionThrows() {
        InvalidTransitionException e = assertThrows(InvalidTransitionException.class,
                () -> CourseTransferStatus.COMPLETE.transitionTo("Physics", CourseTransferStatus.IN_PROGRESS));
        assertEquals("Physics", e.getEntityId());
        assertEquals(CourseTransferStatus.COMPLETE, e.getCurrentState());
        assertEquals(CourseTransferStatus.IN_PROGRESS, e.getRequestedState());
        assertTrue(e.getMessage().contains("Physics"));
    }
}
