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


package dev.mars.assetsync.reconcile;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import dev.mars.assetsync.core.AvailabilityRecord;
import dev.mars.assetsync.core.RowClassification;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Outcome of one reconciliation pass: the availability records of every course, in
 * manifest order, with the row classification of each course.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 */
@JsonPropertyOrder({"summary", "unmatchedCourses", "courses"})
public final class ReconciliationReport {

    private final Map<String, List<AvailabilityRecord>> recordsByCourse;
    private final Map<String, RowClassification> classifications;
    private final List<String> unmatchedCourses;

    ReconciliationReport(Map<String, List<AvailabilityRecord>> recordsByCourse, List<String> unmatchedCourses) {
        Map<String, List<AvailabilityRecord>> records = new LinkedHashMap<>();
        Map<String, RowClassification> rows = new LinkedHashMap<>();
        recordsByCourse.forEach((course, courseRecords) -> {
            records.put(course, List.copyOf(courseRecords));
            rows.put(course, RowClassification.classify(courseRecords));
        });
        this.recordsByCourse = Collections.unmodifiableMap(records);
        this.classifications = Collections.unmodifiableMap(rows);
        this.unmatchedCourses = List.copyOf(unmatchedCourses);
    }

    @JsonIgnore
    public List<AvailabilityRecord> getRecords() {
        List<AvailabilityRecord> all = new ArrayList<>();
        recordsByCourse.values().forEach(all::addAll);
        return all;
    }

    public List<AvailabilityRecord> getRecords(String course) {
        return recordsByCourse.getOrDefault(course, List.of());
    }

    @JsonIgnore
    public Map<String, RowClassification> getClassifications() {
        return classifications;
    }

    public RowClassification getClassification(String course) {
        return classifications.get(course);
    }

    /**
     * Courses for which no folder matched on any storage root.
     */
    @JsonProperty("unmatchedCourses")
    public List<String> getUnmatchedCourses() {
        return unmatchedCourses;
    }

    public long count(RowClassification classification) {
        return classifications.values().stream().filter(c -> c == classification).count();
    }

    @JsonProperty("summary")
    public Map<String, Long> getSummary() {
        Map<String, Long> summary = new LinkedHashMap<>();
        summary.put("courses", (long) classifications.size());
        for (RowClassification classification : RowClassification.values()) {
            summary.put(classification.name().toLowerCase(Locale.ROOT), count(classification));
        }
        return summary;
    }

    /**
     * One entry per course with its classification and records, the shape consumed by
     * the external report renderer.
     */
    @JsonProperty("courses")
    public List<Map<String, Object>> getCourses() {
        List<Map<String, Object>> courses = new ArrayList<>();
        recordsByCourse.forEach((course, records) -> {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("course", course);
            row.put("classification", classifications.get(course));
            row.put("assets", records);
            courses.add(row);
        });
        return courses;
    }

    @Override
    public String toString() {
        return "ReconciliationReport" + getSummary();
    }
}
