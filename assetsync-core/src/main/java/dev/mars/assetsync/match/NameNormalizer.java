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

import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Canonical form of course and folder names used for matching.
 *
 * <p>Accents are stripped, case is folded, and every run of punctuation, underscores
 * or whitespace becomes a single space. {@code "Intro_to  Programming!"} and
 * {@code "intro to programming"} normalize to the same string.</p>
 */
public final class NameNormalizer {

    private static final Pattern SEPARATORS = Pattern.compile("[\\p{Punct}\\p{IsPunctuation}_\\s]+");

    private NameNormalizer() {
    }

    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        String stripped = StringUtils.stripAccents(name).toLowerCase(Locale.ROOT);
        return SEPARATORS.matcher(stripped).replaceAll(" ").trim();
    }

    /**
     * Normalized tokens sorted lexically and joined by single spaces.
     */
    public static String tokenSort(String normalized) {
        if (normalized.isEmpty()) {
            return normalized;
        }
        return Arrays.stream(normalized.split(" "))
                .sorted()
                .collect(Collectors.joining(" "));
    }
}
