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

import java.util.Locale;

/**
 * Reachability of the remote folder behind an asset link.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 */
public enum RemoteStatus {
    AVAILABLE("Available"),
    MISSING("Missing"),
    BROKEN("Broken Link"),
    ABSENT_LINK("No Link"),
    UNCHECKED("Not Checked");

    private final String label;

    RemoteStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Parses a verdict produced by the external link checker. Accepts the enum name
     * or the report label, case-insensitively.
     *
     * @throws IllegalArgumentException if the verdict is not recognised
     */
    public static RemoteStatus fromVerdict(String verdict) {
        if (verdict == null) {
            throw new IllegalArgumentException("Link verdict cannot be null");
        }
        String normalized = verdict.trim().toLowerCase(Locale.ROOT).replace('_', ' ');
        for (RemoteStatus status : values()) {
            if (status.label.toLowerCase(Locale.ROOT).equals(normalized)
                    || status.name().toLowerCase(Locale.ROOT).replace('_', ' ').equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown link verdict: " + verdict);
    }
}
