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

import dev.mars.assetsync.core.Course;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads the course manifest from CSV exports of the course sheet.
 *
 * <p>The path may name a single CSV file or a directory, in which case every {@code .csv}
 * file below it is read in path order. Rows without a course name are dropped. A course
 * named more than once, ignoring case, keeps its first row.</p>
 */
public class CsvManifestReader {

    private static final Logger logger = LoggerFactory.getLogger(CsvManifestReader.class);

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .build();

    private final ManifestSchema schema;

    public CsvManifestReader(ManifestSchema schema) {
        this.schema = schema;
    }

    public List<Course> read(Path manifest) throws InputFileException {
        List<Path> files = listFiles(manifest);
        List<Course> all = new ArrayList<>();
        for (Path file : files) {
            List<Course> batch = readFile(file);
            long withLinks = batch.stream().filter(Course::hasAnyLink).count();
            logger.info("{}: {} course(s), {} with asset links", file.getFileName(), batch.size(), withLinks);
            all.addAll(batch);
        }

        Set<String> seen = new HashSet<>();
        List<Course> unique = new ArrayList<>();
        for (Course course : all) {
            if (seen.add(course.getName().toLowerCase(Locale.ROOT))) {
                unique.add(course);
            } else {
                logger.debug("Dropping duplicate manifest row for '{}'", course.getName());
            }
        }
        logger.info("Total unique courses: {}", unique.size());
        return unique;
    }

    private static List<Path> listFiles(Path manifest) throws InputFileException {
        if (Files.isRegularFile(manifest)) {
            return List.of(manifest);
        }
        if (!Files.isDirectory(manifest)) {
            throw new InputFileException(manifest, "Manifest not found");
        }
        try (Stream<Path> walk = Files.walk(manifest)) {
            List<Path> files = walk
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv"))
                    .sorted()
                    .collect(Collectors.toList());
            if (files.isEmpty()) {
                logger.warn("No .csv files found in {}", manifest);
            }
            return files;
        } catch (IOException e) {
            throw new InputFileException(manifest, "Cannot list manifest directory: " + e.getMessage(), e);
        }
    }

    List<Course> readFile(Path file) throws InputFileException {
        List<Course> courses = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = new CSVParser(reader, FORMAT)) {
            Iterator<CSVRecord> records = parser.iterator();
            if (!records.hasNext()) {
                logger.warn("{} is empty", file);
                return courses;
            }
            ManifestSchema.Resolved resolved = schema.resolve(file, headerOf(records.next()));
            int dropped = 0;
            while (records.hasNext()) {
                CSVRecord record = records.next();
                Optional<Course> course = resolved.toCourse(record);
                if (course.isPresent()) {
                    courses.add(course.get());
                } else {
                    dropped++;
                }
            }
            if (dropped > 0) {
                logger.debug("{}: dropped {} row(s) without a course name", file.getFileName(), dropped);
            }
            return courses;
        } catch (IOException | IllegalStateException e) {
            throw new InputFileException(file, "Cannot parse CSV: " + e.getMessage(), e);
        }
    }

    private static List<String> headerOf(CSVRecord record) {
        List<String> header = new ArrayList<>(record.size());
        for (int i = 0; i < record.size(); i++) {
            header.add(record.get(i));
        }
        return header;
    }
}
