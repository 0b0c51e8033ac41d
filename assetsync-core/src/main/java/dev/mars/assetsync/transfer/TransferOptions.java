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

import dev.mars.assetsync.core.Course;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Per-run switches for the transfer orchestrator.
 */
public final class TransferOptions {

    private final boolean dryRun;
    private final List<String> courseFilters;

    private TransferOptions(Builder builder) {
        this.dryRun = builder.dryRun;
        this.courseFilters = Collections.unmodifiableList(new ArrayList<>(builder.courseFilters));
    }

    public static TransferOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public List<String> getCourseFilters() {
        return courseFilters;
    }

    /**
     * True when no filter is set, or when the course name contains any filter,
     * ignoring case.
     */
    public boolean matches(Course course) {
        if (courseFilters.isEmpty()) {
            return true;
        }
        String name = course.getName().toLowerCase(Locale.ROOT);
        for (String filter : courseFilters) {
            if (name.contains(filter.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "TransferOptions{dryRun=" + dryRun + ", courseFilters=" + courseFilters + "}";
    }

    public static class Builder {
        private boolean dryRun;
        private final List<String> courseFilters = new ArrayList<>();

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder courseFilter(String filter) {
            if (filter != null && !filter.isBlank()) {
                this.courseFilters.add(filter.trim());
            }
            return this;
        }

        public Builder courseFilters(List<String> filters) {
            filters.forEach(this::courseFilter);
            return this;
        }

        public TransferOptions build() {
            return new TransferOptions(this);
        }
    }
}
