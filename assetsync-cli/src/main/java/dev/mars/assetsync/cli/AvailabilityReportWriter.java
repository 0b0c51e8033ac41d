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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.assetsync.core.CourseResult;
import dev.mars.assetsync.reconcile.ReconciliationReport;
import dev.mars.assetsync.storage.FileManager;
import dev.mars.assetsync.transfer.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the availability records, and the transfer results when a run happened, as one
 * JSON document for the external report renderer.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 */
public class AvailabilityReportWriter {

    private static final Logger logger = LoggerFactory.getLogger(AvailabilityReportWriter.class);

    static final int REPORT_VERSION = 1;

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AvailabilityReportWriter(Clock clock) {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
    }

    /**
     * @param summary the transfer run, or null for a report-only run
     */
    public void write(ReconciliationReport report, RunSummary summary, Path target) throws IOException {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("version", REPORT_VERSION);
        document.put("generatedAt", clock.instant());
        document.put("availability", report);
        if (summary != null) {
            document.put("transfers", describe(summary));
        }
        FileManager.writeAtomically(target, objectMapper.writeValueAsBytes(document));
        logger.info("Wrote availability report to {}", target);
    }

    private static Map<String, Object> describe(RunSummary summary) {
        Map<String, Object> transfers = new LinkedHashMap<>();
        transfers.put("dryRun", summary.isDryRun());
        transfers.put("stopped", summary.isStopped());
        transfers.put("courseCounts", summary.getCourseCounts());
        List<Map<String, Object>> courses = new ArrayList<>();
        for (CourseResult result : summary.getResults()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("course", result.getCourseName());
            row.put("status", result.getStatus());
            if (result.getVolumeId() != null) {
                row.put("volumeId", result.getVolumeId());
            }
            if (result.getDetail() != null) {
                row.put("detail", result.getDetail());
            }
            row.put("assets", new ArrayList<>(result.getOutcomes().values()));
            courses.add(row);
        }
        transfers.put("courses", courses);
        return transfers;
    }
}
