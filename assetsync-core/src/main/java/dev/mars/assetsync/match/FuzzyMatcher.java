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

import org.apache.commons.text.similarity.LongestCommonSubsequence;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Approximate name matching that tolerates drift between manifest course names and
 * folder names on disk.
 *
 * <h3>Scoring</h3>
 * <p>Both names are normalized with {@link NameNormalizer}. The score, an integer in
 * [0, 100], is the larger of:</p>
 * <ul>
 *   <li>the token-sort ratio: {@code 200 * LCS(a, b) / (|a| + |b|)} over the names
 *       with their words sorted, which tolerates reordered words</li>
 *   <li>the partial ratio: the best ratio of the shorter name against every equally
 *       long window of the longer one, which tolerates truncated names. Used only
 *       when the shorter name is at least half as long as the longer one.</li>
 * </ul>
 *
 * <h3>Determinism</h3>
 * <p>The highest score at or above the threshold wins. Ties go to the shortest
 * normalized name, then the lexically smaller normalized name, then the lexically
 * smaller original name, then the earlier candidate.</p>
 *
 * <p>Stateless and thread-safe.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class FuzzyMatcher {

    /** Normalized candidates shorter than this are never matched. */
    static final int MIN_CANDIDATE_LENGTH = 3;

    private final LongestCommonSubsequence lcs = new LongestCommonSubsequence();

    /**
     * Normalizes candidate names once so they can be matched against many targets.
     * Candidates with the same normalized name share one score computation. Normalized
     * names shorter than {@value #MIN_CANDIDATE_LENGTH} characters are dropped.
     */
    public <T> CandidateSet<T> prepare(Collection<T> items, Function<T, String> nameOf) {
        Map<String, List<Candidate<T>>> groups = new LinkedHashMap<>();
        for (T item : items) {
            String name = nameOf.apply(item);
            String normalized = NameNormalizer.normalize(name);
            if (normalized.length() < MIN_CANDIDATE_LENGTH) {
                continue;
            }
            groups.computeIfAbsent(normalized, k -> new ArrayList<>()).add(new Candidate<>(item, name));
        }
        List<Group<T>> prepared = new ArrayList<>(groups.size());
        groups.forEach((normalized, members) -> {
            List<Candidate<T>> sorted = new ArrayList<>(members);
            sorted.sort(Comparator.comparing(c -> c.name));
            prepared.add(new Group<>(normalized, NameNormalizer.tokenSort(normalized), sorted));
        });
        return new CandidateSet<>(prepared);
    }

    public CandidateSet<String> prepare(Collection<String> names) {
        return prepare(names, Function.identity());
    }

    /**
     * Finds the best candidate name for {@code target}.
     *
     * @return the best candidate scoring at least {@code threshold}, or empty
     */
    public Optional<MatchCandidate<String>> findBestMatch(String target, Collection<String> candidates, int threshold) {
        return findBestMatch(target, prepare(candidates), threshold);
    }

    public <T> Optional<MatchCandidate<T>> findBestMatch(String target, CandidateSet<T> candidates, int threshold) {
        List<MatchCandidate<T>> best = findBestMatches(target, candidates, threshold);
        return best.isEmpty() ? Optional.empty() : Optional.of(best.get(0));
    }

    /**
     * Every candidate sharing the best score for {@code target}, in tie-break order.
     * Candidates whose normalized names are equal are all returned, not only the first.
     *
     * @return the best-scoring candidates at or above {@code threshold}; empty when none qualifies
     */
    public <T> List<MatchCandidate<T>> findBestMatches(String target, CandidateSet<T> candidates, int threshold) {
        String normalizedTarget = NameNormalizer.normalize(target);
        if (normalizedTarget.isEmpty()) {
            return List.of();
        }
        String sortedTarget = NameNormalizer.tokenSort(normalizedTarget);

        List<Group<T>> best = new ArrayList<>();
        int bestScore = -1;
        for (Group<T> group : candidates.groups) {
            int score = score(normalizedTarget, sortedTarget, group.normalized, group.tokenSorted);
            if (score < threshold || score < bestScore) {
                continue;
            }
            if (score > bestScore) {
                best.clear();
                bestScore = score;
            }
            best.add(group);
        }
        best.sort(TIE_BREAK);

        List<MatchCandidate<T>> matches = new ArrayList<>();
        for (Group<T> group : best) {
            for (Candidate<T> member : group.members) {
                matches.add(new MatchCandidate<>(member.item, member.name, group.normalized, bestScore));
            }
        }
        return matches;
    }

    /**
     * Similarity of two raw names in [0, 100].
     */
    public int score(String a, String b) {
        String na = NameNormalizer.normalize(a);
        String nb = NameNormalizer.normalize(b);
        return score(na, NameNormalizer.tokenSort(na), nb, NameNormalizer.tokenSort(nb));
    }

    private int score(String a, String aSorted, String b, String bSorted) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0;
        }
        double best = Math.max(ratio(aSorted, bSorted), partialRatio(a, b));
        return (int) Math.round(best);
    }

    double ratio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 100.0;
        }
        return 200.0 * lcs.apply(a, b) / total;
    }

    double partialRatio(String a, String b) {
        String shorter = a.length() <= b.length() ? a : b;
        String longer = shorter == a ? b : a;
        if (shorter.isEmpty() || shorter.length() * 2 < longer.length()) {
            return 0.0;
        }
        double best = 0.0;
        int window = shorter.length();
        for (int start = 0; start + window <= longer.length(); start++) {
            best = Math.max(best, ratio(shorter, longer.substring(start, start + window)));
            if (best >= 100.0) {
                break;
            }
        }
        return best;
    }

    private static final Comparator<Group<?>> TIE_BREAK = Comparator
            .<Group<?>>comparingInt(g -> g.normalized.length())
            .thenComparing(g -> g.normalized)
            .thenComparing(g -> g.members.get(0).name);

    /**
     * Candidates normalized once for repeated matching. Immutable.
     */
    public static final class CandidateSet<T> {
        private final List<Group<T>> groups;

        private CandidateSet(List<Group<T>> groups) {
            this.groups = Collections.unmodifiableList(groups);
        }

        public int size() {
            return groups.size();
        }

        public boolean isEmpty() {
            return groups.isEmpty();
        }
    }

    private static final class Candidate<T> {
        final T item;
        final String name;

        Candidate(T item, String name) {
            this.item = item;
            this.name = name;
        }
    }

    private static final class Group<T> {
        final String normalized;
        final String tokenSorted;
        final List<Candidate<T>> members;

        Group(String normalized, String tokenSorted, List<Candidate<T>> members) {
            this.normalized = normalized;
            this.tokenSorted = tokenSorted;
            this.members = members;
        }
    }
}
