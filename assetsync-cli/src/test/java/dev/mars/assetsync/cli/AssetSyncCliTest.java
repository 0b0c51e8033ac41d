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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.assetsync.storage.JsonFileStatusStore;
import dev.mars.assetsync.transfer.TransferOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

/**
 * End-to-end runs of {@link AssetSyncCli} over a temporary drive, manifest and volume.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 */
class AssetSyncCliTest {

    private static final String DRIVE = "https://drive.google.com/drive/folders/";

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private CopyingTransferProtocol protocol;
    private Path manifest;
    private Path config;
    private Path stateDir;

    @BeforeEach
    void setUp() throws IOException {
        Path drive = tempDir.resolve("drive");
        Path slides = Files.createDirectories(drive.resolve("Intro_to_Programming_v2/PPTs"));
        Files.writeString(slides.resolve("week1.pptx"), "deck");
        Path volume = Files.createDirectories(tempDir.resolve("vol"));
        stateDir = tempDir.resolve("state");

        manifest = tempDir.resolve("courses.csv");
        Files.writeString(manifest, String.join("\n",
                "Course,Status,PPTs,Final Videos",
                "Intro to Programming,Completed," + DRIVE + "1IntroSlidesAbc," + DRIVE + "1IntroFinalsXyz",
                "Data Science,Completed," + DRIVE + "1DataSlidesAbcd,",
                "") );

        config = tempDir.resolve("assetsync.properties");
        Files.writeString(config, String.join("\n",
                "assetsync.index.roots=" + escape(drive),
                "assetsync.state.dir=" + escape(stateDir),
                "assetsync.volumes=disk-a",
                "assetsync.volume.disk-a.path=" + escape(volume),
                "assetsync.assignment.min-free-gb=0",
                "assetsync.transfer.max-retries=1",
                "assetsync.transfer.retry-delay-ms=0",
                "assetsync.match.parallel=false",
                ""));

        protocol = new CopyingTransferProtocol(false);
    }

    private static String escape(Path path) {
        return path.toString().replace("\\", "\\\\");
    }

    private int run(AssetSyncCli.ShutdownHooks hooks, String... args) {
        AssetSyncCli cli = new AssetSyncCli(new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8), c -> protocol, hooks);
        return cli.run(args);
    }

    private int run(String... args) {
        AssetSyncCli cli = new AssetSyncCli(new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8), c -> protocol);
        return cli.run(args);
    }

    private JsonNode readReport() throws IOException {
        return new ObjectMapper().readTree(stateDir.resolve(AssetSyncCli.REPORT_FILE_NAME).toFile());
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testHelpAndVersion() {
        assertEquals(AssetSyncCli.EXIT_OK, run("--help"));
        assertTrue(stdout().contains("USAGE:"));
        assertEquals(AssetSyncCli.EXIT_OK, run("--version"));
        assertTrue(stdout().contains("AssetSync v" + AssetSyncCli.VERSION));
    }

    @Test
    void testUsageErrors() {
        assertEquals(AssetSyncCli.EXIT_USAGE, run());
        assertTrue(stderr().contains("--manifest is required"));
        assertEquals(AssetSyncCli.EXIT_USAGE, run("--bogus"));
        assertTrue(stderr().contains("Unknown option: --bogus"));
        assertEquals(AssetSyncCli.EXIT_USAGE, run("--manifest"));
        assertEquals(AssetSyncCli.EXIT_USAGE, run("--manifest", manifest.toString(), "--dry-run", "--report-only"));
        assertEquals(AssetSyncCli.EXIT_USAGE, run("--manifest", tempDir.resolve("missing.csv").toString()));
        assertEquals(AssetSyncCli.EXIT_USAGE,
                run("--manifest", manifest.toString(), "--config", tempDir.resolve("missing.properties").toString()));
    }

    @Test
    void testArgumentParsing() {
        AssetSyncCli.Arguments arguments = AssetSyncCli.Arguments.parse(new String[]{
                "--manifest", "courses.csv", "--course", "Intro", "--course", "Data", "--refresh-index", "--dry-run"});

        assertEquals(List.of("Intro", "Data"), arguments.courseFilters);
        assertTrue(arguments.refreshIndex);
        assertTrue(arguments.dryRun);
        assertFalse(arguments.reportOnly);
        assertThrows(IllegalArgumentException.class,
                () -> AssetSyncCli.Arguments.parse(new String[]{"--course", "--dry-run"}));
    }

    @Test
    void testReportOnlyWritesAvailabilityWithoutTransfers() throws IOException {
        int exit = run("--manifest", manifest.toString(), "--config", config.toString(), "--report-only");

        assertEquals(AssetSyncCli.EXIT_OK, exit, stderr());
        assertEquals(0, protocol.getCalls());
        JsonNode report = readReport();
        assertEquals(1, report.get("version").asInt());
        assertFalse(report.has("transfers"));
        JsonNode availability = report.get("availability");
        assertEquals(2, availability.get("summary").get("courses").asInt());
        assertEquals("Data Science", availability.get("unmatchedCourses").get(0).asText());
        JsonNode intro = availability.get("courses").get(0);
        assertEquals("Intro to Programming", intro.get("course").asText());
        assertEquals("FOUND", intro.get("assets").get(1).get("localStatus").asText());
        assertTrue(stdout().contains("Courses: 2"));
    }

    @Test
    void testDryRunPlansWithoutTransferring() throws IOException {
        int exit = run("--manifest", manifest.toString(), "--config", config.toString(), "--dry-run");

        assertEquals(AssetSyncCli.EXIT_OK, exit, stderr());
        assertEquals(0, protocol.getCalls());
        assertFalse(Files.exists(stateDir.resolve(JsonFileStatusStore.OUTCOME_FILE)));
        JsonNode transfers = readReport().get("transfers");
        assertTrue(transfers.get("dryRun").asBoolean());
        assertEquals("NOT_STARTED", transfers.get("courses").get(1).get("assets").get(1).get("status").asText());
        assertTrue(stdout().contains("Transfer plan (dry run):"));
    }

    @Test
    void testLiveRunTransfersAndReportsFoundViaTransfer() throws IOException {
        int exit = run("--manifest", manifest.toString(), "--config", config.toString());

        assertEquals(AssetSyncCli.EXIT_OK, exit, stderr());
        assertEquals(3, protocol.getCalls());
        JsonNode report = readReport();
        JsonNode transfers = report.get("transfers");
        assertFalse(transfers.get("dryRun").asBoolean());
        assertEquals("COMPLETE", transfers.get("courses").get(0).get("status").asText());
        assertEquals("disk-a", transfers.get("courses").get(1).get("volumeId").asText());
        JsonNode dataScience = report.get("availability").get("courses").get(1);
        assertEquals("FOUND_VIA_TRANSFER", dataScience.get("assets").get(1).get("localStatus").asText());

        assertEquals(AssetSyncCli.EXIT_OK, run("--manifest", manifest.toString(), "--config", config.toString()));
        assertEquals(3, protocol.getCalls());
    }

    @Test
    void testCourseFilterLimitsTheRun() throws IOException {
        int exit = run("--manifest", manifest.toString(), "--config", config.toString(), "--course", "data");

        assertEquals(AssetSyncCli.EXIT_OK, exit, stderr());
        assertEquals(1, protocol.getCalls());
        assertEquals(1, readReport().get("transfers").get("courses").size());
    }

    @Test
    void testFailedTransfersExitWithFailureCode() {
        protocol = new CopyingTransferProtocol(true);

        int exit = run("--manifest", manifest.toString(), "--config", config.toString());

        assertEquals(AssetSyncCli.EXIT_FAILURES, exit);
        assertTrue(stdout().contains("FAILED"));
    }

    @Test
    void testFatalErrors() throws IOException {
        Path noVolumes = tempDir.resolve("no-volumes.properties");
        Files.writeString(noVolumes, "assetsync.state.dir=" + escape(stateDir) + "\n");
        assertEquals(AssetSyncCli.EXIT_FATAL, run("--manifest", manifest.toString(), "--config", noVolumes.toString()));
        assertTrue(stderr().contains("Configuration error"));

        Path links = tempDir.resolve("links.json");
        Files.writeString(links, "not json");
        assertEquals(AssetSyncCli.EXIT_FATAL, run("--manifest", manifest.toString(), "--config", config.toString(),
                "--link-status", links.toString(), "--report-only"));
        assertTrue(stderr().contains("Input error"));

        Files.createDirectories(stateDir);
        Files.writeString(stateDir.resolve(JsonFileStatusStore.ASSIGNMENT_FILE), "{ broken");
        assertEquals(AssetSyncCli.EXIT_FATAL, run("--manifest", manifest.toString(), "--config", config.toString()));
        assertTrue(stderr().contains("Status store error"));
    }

    @Test
    void testShutdownSignalStopsBetweenAssetsAndKeepsState() throws Exception {
        List<Thread> registered = new ArrayList<>();
        List<Thread> unregistered = new ArrayList<>();
        AssetSyncCli.ShutdownHooks hooks = new AssetSyncCli.ShutdownHooks() {
            @Override
            public void register(Thread hook) {
                registered.add(hook);
            }

            @Override
            public void unregister(Thread hook) {
                unregistered.add(hook);
            }
        };
        protocol.onTransfer(() -> {
            Thread hook = registered.get(0);
            if (hook.getState() != Thread.State.NEW) {
                return;
            }
            hook.start();
            long deadline = System.currentTimeMillis() + 5000;
            while (hook.getState() != Thread.State.TIMED_WAITING && System.currentTimeMillis() < deadline) {
                Thread.onSpinWait();
            }
        });

        int exit = run(hooks, "--manifest", manifest.toString(), "--config", config.toString());

        assertEquals(AssetSyncCli.EXIT_OK, exit, stderr());
        assertEquals(1, protocol.getCalls());
        assertTrue(stdout().contains("Run was stopped before all courses were processed"));
        assertEquals(registered, unregistered);
        Thread hook = registered.get(0);
        hook.join(5000);
        assertFalse(hook.isAlive());
        assertTrue(readReport().get("transfers").get("stopped").asBoolean());
        assertTrue(Files.exists(stateDir.resolve(JsonFileStatusStore.OUTCOME_FILE)));
    }

    @Test
    void testStopOnShutdownGivesUpAfterGracePeriod() throws Exception {
        TransferOrchestrator orchestrator = mock(TransferOrchestrator.class);
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(new AssetSyncCli.StopOnShutdown(orchestrator, finished, Duration.ofMillis(50)));

        hook.start();
        hook.join(5000);

        assertFalse(hook.isAlive());
        verify(orchestrator).requestStop();
    }
}
