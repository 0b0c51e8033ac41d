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

import java.util.Objects;

/**
 * A candidate that met the similarity threshold, with its score.
 *
 * @param <T> the matched item, for example a plain name or an index entry
 */
public final class MatchCandidate<T> {

    private final T item;
    private final String name;
    private final String normalizedName;
    private final int score;

    public MatchCandidate(T item, String name, String normalizedName, int score) {
        this.item = item;
        this.name = name;
        this.normalizedName = normalizedName;
        this.score = score;
    }

    public T getItem() { return item; }

    public String getName() { return name; }

    public String getNormalizedName() { return normalizedName; }

    public int getScore() { return score; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MatchCandidate)) return false;
        MatchCandidate<?> that = (MatchCandidate<?>) o;
        return score == that.score && Objects.equals(item, that.item)
                && name.equals(that.name) && normalizedName.equals(that.normalizedName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(item, name, normalizedName, score);
    }

    @Override
    public String toString() {
        return "MatchCandidate{name='" + name + "', score=" + score + "}";
    }
}
