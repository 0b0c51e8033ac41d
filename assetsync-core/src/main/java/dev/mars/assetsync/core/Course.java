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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable value object representing one course row of the manifest.
 *
 * <p>A course is rebuilt from the manifest on every run and never mutated. Its name is
 * the identity used by the status store; comparisons between manifest names are
 * case-insensitive through {@link #getKey()}.</p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * Course course = Course.builder()
 *     .name("Intro to Programming")
 *     .status(CourseStatus.COMPLETED)
 *     .link(AssetType.SLIDES, "https://drive.google.com/drive/folders/1AbC...")
 *     .build();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public final class Course {

    private final String name;
    private final CourseStatus status;
    private final String semester;
    private final String term;
    private final Map<AssetType, AssetLink> links;

    private Course(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Course name cannot be null").trim();
        if (this.name.isEmpty()) {
            throw new IllegalArgumentException("Course name cannot be blank");
        }
        this.status = builder.status != null ? builder.status : CourseStatus.OTHER;
        this.semester = builder.semester != null ? builder.semester : "";
        this.term = builder.term != null ? builder.term : "";
        this.links = Collections.unmodifiableMap(new EnumMap<>(builder.links));
    }

    public String getName() { return name; }

    /**
     * Case-folded name used for duplicate detection and course filters.
     */
    public String getKey() { return name.toLowerCase(Locale.ROOT); }

    public CourseStatus getStatus() { return status; }

    public String getSemester() { return semester; }

    public String getTerm() { return term; }

    public Optional<AssetLink> getLink(AssetType type) {
        return Optional.ofNullable(links.get(type));
    }

    /**
     * Returns the populated asset slots, keyed in asset order.
     */
    public Map<AssetType, AssetLink> getLinks() { return links; }

    public boolean hasAnyLink() { return !links.isEmpty(); }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Course)) return false;
        Course course = (Course) o;
        return name.equals(course.name) && status == course.status
                && semester.equals(course.semester) && term.equals(course.term)
                && links.equals(course.links);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, status, semester, term, links);
    }

    @Override
    public String toString() {
        return "Course{name='" + name + "', status=" + status + ", links=" + links.keySet() + "}";
    }

    /**
     * Builder for {@link Course}. Blank link cells are ignored.
     */
    public static class Builder {
        private String name;
        private CourseStatus status;
        private String semester;
        private String term;
        private final Map<AssetType, AssetLink> links = new EnumMap<>(AssetType.class);

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder status(CourseStatus status) {
            this.status = status;
            return this;
        }

        public Builder semester(String semester) {
            this.semester = semester;
            return this;
        }

        public Builder term(String term) {
            this.term = term;
            return this;
        }

        public Builder link(AssetType type, String url) {
            AssetLink.parse(url).ifPresentOrElse(link -> links.put(type, link), () -> links.remove(type));
            return this;
        }

        public Builder link(AssetType type, AssetLink link) {
            if (link == null) {
                links.remove(type);
            } else {
                links.put(type, link);
            }
            return this;
        }

        public Course build() {
            return new Course(this);
        }
    }
}
