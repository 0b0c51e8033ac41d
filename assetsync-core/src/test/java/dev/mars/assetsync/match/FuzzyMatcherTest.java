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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FuzzyMatcherTest {

    private FuzzyMatcher matcher;

    @BeforeEach
    void setUp() {
        matcher = new FuzzyMatcher();
    }

    @Test
    void testIdenticalNamesScoreFullMarks() {
        assertEquals(100, matcher.score("Intro to Programming", "intro_to_programming"));
    }

    @Test
    void testReorderedWordsScoreFullMarks() {
        assertEquals(100, matcher.score("Programming Intro", "Intro Programming"));
    }

    @Test
    void testVersionSuffixToleratedByPartialRatio() {
        assertEquals(100, matcher.score("Intro to Programming", "Intro_to_Programming_v2"));
    }

    @Test
    void testBestMatchPrefersCloserName() {
        Optional<MatchCandidate<String>> match = matcher.findBestMatch("Intro to Programming",
                List.of("Advanced Programming", "Intro_to_Programming_v2"), 75);

        assertTrue(match.isPresent());
        assertEquals("Intro_to_Programming_v2", match.get().getName());
        assertEquals(100, match.get().getScore());
        assertTrue(matcher.score("Intro to Programming", "Advanced Programming") < 75);
    }

    @Test
    void testNoMatchBelowThreshold() {
        Optional<MatchCandidate<String>> match = matcher.findBestMatch("Organic Chemistry",
                List.of("Medieval History", "Linear Algebra"), 75);
        assertTrue(match.isEmpty());
    }

    @Test
    void testShortCandidatesIgnored() {
        assertTrue(matcher.findBestMatch("AI", List.of("AI", "Go"), 0).isEmpty());
    }

    @Test
    void testEmptyTargetNeverMatches() {
        assertTrue(matcher.findBestMatch("  ", List.of("Anything"), 0).isEmpty());
    }

    @Test
    void testTieBreaksOnShorterThenLexicalName() {
        // Both contain the target exactly, so both score 100.
        Optional<MatchCandidate<String>> match = matcher.findBestMatch("Statistics",
                List.of("Statistics 2024", "Statistics II", "Statistics"), 75);
        assertEquals("Statistics", match.orElseThrow().getName());

        Optional<MatchCandidate<String>> tied = matcher.findBestMatch("Calculus",
                List.of("Calculus B", "Calculus A"), 75);
        assertEquals("Calculus A", tied.orElseThrow().getName());
    }

    @Test
    void testEquivalentNamesResolveStably() {
        Optional<MatchCandidate<String>> first = matcher.findBestMatch("Data Science",
                List.of("data_science", "Data Science"), 75);
        Optional<MatchCandidate<String>> second = matcher.findBestMatch("Data Science",
                List.of("Data Science", "data_science"), 75);
        assertEquals(first.orElseThrow().getName(), second.orElseThrow().getName());
        assertEquals("Data Science", first.get().getName());
    }

    @Test
    void testPartialRatioOnlyForComparableLengths() {
        assertEquals(0.0, matcher.partialRatio("abc", "abcdefghijklmnop"));
        assertEquals(100.0, matcher.partialRatio("abcdefgh", "xxabcdefghxx"));
    }

    @Test
    void testPreparedCandidatesReusable() {
        FuzzyMatcher.CandidateSet<String> prepared = matcher.prepare(
                List.of("Linear Algebra", "Operating Systems", "Computer Networks"));
        assertEquals(3, prepared.size());
        assertEquals("Operating Systems",
                matcher.findBestMatch("Operating_Systems", prepared, 75).orElseThrow().getName());
        assertEquals("Computer Networks",
                matcher.findBestMatch("computer networks", prepared, 75).orElseThrow().getName());
    }
}
