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


package dev.mars.assetsync.cli;

import dev.mars.assetsync.config.AssetSyncConfiguration;
import dev.mars.assetsync.core.AssetType;
import dev.mars.assetsync.core.Course;
import dev.mars.assetsync.core.CourseStatus;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Declarative description of the course manifest: the logical fields and the column
 * label each one is read from.
 *
 * <p>The schema is resolved once against a CSV header, giving a {@link Resolved} view that
 * turns records into typed {@link Course} objects. Only the course column is required.
 * Labels are matched ignoring case and surrounding whitespace; asset columns also accept
 * the aliases of their {@link AssetType}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public final class ManifestSchema {

    private static final Logger logger = LoggerFactory.getLogger(ManifestSchema.class);

    public enum Field {
        COURSE("course", "Course", null),
        SEMESTER("semester", "Sem", null),
        TERM("term", "Term", null),
        STATUS("status", "Status", null),
        COURSE_OUTLINE("course-outline", null, AssetType.COURSE_OUTLINE),
        SLIDES("slides", null, AssetType.SLIDES),
        WRITTEN_ASSETS("written-assets", null, AssetType.WRITTEN_ASSETS),
        FINAL_VIDEOS("final-videos", null, AssetType.FINAL_VIDEOS),
        RAW_VIDEOS("raw-videos", null, AssetType.RAW_VIDEOS),
        COURSE_ARTIFACTS("course-artifacts", null, AssetType.COURSE_ARTIFACTS);

        private final String key;
        private final String defaultLabel;
        private final AssetType assetType;

        Field(String key, String defaultLabel, AssetType assetType) {
            this.key = key;
            this.defaultLabel = defaultLabel != null ? defaultLabel : assetType.getDisplayName();
            this.assetType = assetType;
        }

        /** Suffix of the {@code assetsync.manifest.column.<key>} property. */
        public String getKey() {
            return key;
        }

        public String getDefaultLabel() {
            return defaultLabel;
        }

        public Optional<AssetType> getAssetType() {
            return Optional.ofNullable(assetType);
        }
    }

    private final Map<Field, String> labels;

    private ManifestSchema(Map<Field, String> labels) {
        this.labels = Collections.unmodifiableMap(new EnumMap<>(labels));
    }

    public static ManifestSchema defaults() {
        Map<Field, String> labels = new EnumMap<>(Field.class);
        for (Field field : Field.values()) {
            labels.put(field, field.getDefaultLabel());
        }
        return new ManifestSchema(labels);
    }

    public static ManifestSchema fromConfiguration(AssetSyncConfiguration config) {
        Map<Field, String> labels = new EnumMap<>(Field.class);
        for (Field field : Field.values()) {
            labels.put(field, config.getManifestColumn(field.getKey(), field.getDefaultLabel()));
        }
        return new ManifestSchema(labels);
    }

    public String getLabel(Field field) {
        return labels.get(field);
    }

    /**
     * Maps each field to its column position in {@code headerNames}.
     *
     * @throws InputFileException if the course column is missing
     */
    public Resolved resolve(Path source, List<String> headerNames) throws InputFileException {
        Map<Field, Integer> positions = new EnumMap<>(Field.class);
        for (Field field : Field.values()) {
            int index = findColumn(headerNames, acceptedLabels(field));
            if (index >= 0) {
                positions.put(field, index);
            } else if (field == Field.COURSE) {
                throw new InputFileException(source, "Missing course column '" + labels.get(field)
                        + "' in header " + headerNames);
            } else {
                logger.debug("{}: no '{}' column", source.getFileName(), labels.get(field));
            }
        }
        boolean anyAsset = positions.keySet().stream().anyMatch(f -> f.getAssetType().isPresent());
        if (!anyAsset) {
            logger.warn("{}: no asset link columns found; courses will have no links", source.getFileName());
        }
        return new Resolved(positions);
    }

    private List<String> acceptedLabels(Field field) {
        List<String> accepted = new ArrayList<>();
        accepted.add(labels.get(field));
        field.getAssetType().ifPresent(type -> accepted.addAll(type.getAliases()));
        return accepted;
    }

    private static int findColumn(List<String> headerNames, List<String> accepted) {
        for (String label : accepted) {
            String wanted = normalizeHeader(label);
            for (int i = 0; i < headerNames.size(); i++) {
                if (normalizeHeader(headerNames.get(i)).equals(wanted)) {
                    return i;
                }
            }
        }
        return -1;
    }

    static String normalizeHeader(String header) {
        if (header == null) {
            return "";
        }
        return header.replace("\uFEFF", "").trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    /**
     * The schema bound to the columns of one file.
     */
    public static final class Resolved {

        private final Map<Field, Integer> positions;

        private Resolved(Map<Field, Integer> positions) {
            this.positions = positions;
        }

        public boolean hasColumn(Field field) {
            return positions.containsKey(field);
        }

        /**
         * Builds the course of one record, or empty when the record has no course name.
         */
        public Optional<Course> toCourse(CSVRecord record) {
            String name = cell(record, Field.COURSE);
            if (name.isEmpty()) {
                return Optional.empty();
            }
            Course.Builder builder = Course.builder()
                    .name(name)
                    .semester(cell(record, Field.SEMESTER))
                    .term(cell(record, Field.TERM))
                    .status(CourseStatus.fromLabel(cell(record, Field.STATUS)));
            for (Field field : Field.values()) {
                field.getAssetType().ifPresent(type -> builder.link(type, cell(record, field)));
            }
            return Optional.of(builder.build());
        }

        private String cell(CSVRecord record, Field field) {
            Integer index = positions.get(field);
            if (index == null || index >= record.size()) {
                return "";
            }
            String value = record.get(index);
            return value == null ? "" : value.trim();
        }
    }
}
