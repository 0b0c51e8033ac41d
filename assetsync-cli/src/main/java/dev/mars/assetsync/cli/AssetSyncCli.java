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

import dev.mars.assetsync.assign.DiskAssignmentPolicy;
import dev.mars.assetsync.assign.FileStoreFreeSpaceProbe;
import dev.mars.assetsync.assign.FreeSpaceProbe;
import dev.mars.assetsync.config.AssetSyncConfiguration;
import dev.mars.assetsync.core.Course;
import dev.mars.assetsync.core.CourseResult;
import dev.mars.assetsync.core.RemoteStatus;
import dev.mars.assetsync.core.exceptions.ConfigurationException;
import dev.mars.assetsync.core.exceptions.StatusStoreException;
import dev.mars.assetsync.index.DriveIndex;
import dev.mars.assetsync.index.DriveIndexCache;
import dev.mars.assetsync.index.StorageIndexer;
import dev.mars.assetsync.match.FuzzyMatcher;
import dev.mars.assetsync.reconcile.ReconciliationEngine;
import dev.mars.assetsync.reconcile.ReconciliationReport;
import dev.mars.assetsync.storage.JsonFileStatusStore;
import dev.mars.assetsync.storage.StatusStore;
import dev.mars.assetsync.transfer.RcloneTransferProtocol;
import dev.mars.assetsync.transfer.RetryingTransferExecutor;
import dev.mars.assetsync.transfer.RunSummary;
import dev.mars.assetsync.transfer.TransferOptions;
import dev.mars.assetsync.transfer.TransferOrchestrator;
import dev.mars.assetsync.transfer.TransferProtocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Command-line entry point: reconciles the course manifest against local storage, then
 * fetches missing assets onto the target volumes.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class AssetSyncCli {

    private static final Logger logger = LoggerFactory.getLogger(AssetSyncCli.class);

    static final String VERSION = "1.0.0";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURES = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_FATAL = 3;

    static final String REPORT_FILE_NAME = "availability_report.json";

    private static final String USAGE = """
            AssetSync v%s

            USAGE:
              assetsync --manifest FILE.csv [options]

            OPTIONS:
              --manifest FILE        Course manifest CSV, or a directory of CSV files (required)
              --config FILE          Properties file (default: assetsync.properties lookup)
              --link-status FILE     JSON map of link URL or folder id to available/missing/broken
              --refresh-index        Rebuild the drive index even if the cache is fresh
              --course NAME          Only process courses whose name contains NAME (repeatable)
              --dry-run              Classify and plan transfers without copying or persisting
              --report-only          Reconcile and write the report; no transfers
              --report FILE          Report output (default: <state dir>/availability_report.json)
              --help                 Show this help message
              --version              Show version information

            EXIT CODES:
              0  Run finished without failures
              1  Run finished with failed assets
              2  Invalid command line arguments
              3  Fatal error (configuration, status store, unreadable input)
            """.formatted(VERSION);

    private final PrintStream out;
    private final PrintStream err;
    private final Function<AssetSyncConfiguration, TransferProtocol> protocolFactory;
    private final ShutdownHooks shutdownHooks;

    public AssetSyncCli() {
        this(System.out, System.err, AssetSyncCli::createProtocol);
    }

    AssetSyncCli(PrintStream out, PrintStream err,
                 Function<AssetSyncConfiguration, TransferProtocol> protocolFactory) {
        this(out, err, protocolFactory, RUNTIME_HOOKS);
    }

    AssetSyncCli(PrintStream out, PrintStream err,
                 Function<AssetSyncConfiguration, TransferProtocol> protocolFactory,
                 ShutdownHooks shutdownHooks) {
        this.out = out;
        this.err = err;
        this.protocolFactory = protocolFactory;
        this.shutdownHooks = shutdownHooks;
    }

    public static void main(String[] args) {
        AssetSyncCli cli = new AssetSyncCli();
        System.exit(cli.run(args));
    }

    public int run(String[] args) {
        Arguments arguments;
        try {
            arguments = Arguments.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.println();
            err.println(USAGE);
            return EXIT_USAGE;
        }
        if (arguments.help) {
            out.println(USAGE);
            return EXIT_OK;
        }
        if (arguments.version) {
            out.println("AssetSync v" + VERSION);
            return EXIT_OK;
        }
        if (arguments.manifest == null) {
            err.println("Error: --manifest is required");
            err.println();
            err.println(USAGE);
            return EXIT_USAGE;
        }
        if (!Files.exists(arguments.manifest)) {
            err.println("Error: manifest not found: " + arguments.manifest);
            return EXIT_USAGE;
        }
        if (arguments.configFile != null && !Files.isRegularFile(arguments.configFile)) {
            err.println("Error: configuration file not found: " + arguments.configFile);
            return EXIT_USAGE;
        }

        try {
            return execute(arguments);
        } catch (ConfigurationException e) {
            logger.error("Configuration error: {}", e.getMessage());
            err.println("Configuration error: " + e.getMessage());
            return EXIT_FATAL;
        } catch (StatusStoreException e) {
            logger.error("Status store error, aborting run: {}", e.getMessage(), e);
            err.println("Status store error: " + e.getMessage());
            return EXIT_FATAL;
        } catch (InputFileException e) {
            logger.error("Input error: {}", e.getMessage());
            err.println("Input error: " + e.getMessage());
            return EXIT_FATAL;
        } catch (IOException e) {
            logger.error("I/O error: {}", e.getMessage(), e);
            err.println("I/O error: " + e.getMessage());
            return EXIT_FATAL;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Interrupted");
            return EXIT_FATAL;
        }
    }

    private int execute(Arguments arguments)
            throws ConfigurationException, StatusStoreException, InputFileException, IOException,
            InterruptedException {
        AssetSyncConfiguration config = arguments.configFile != null
                ? AssetSyncConfiguration.fromFile(arguments.configFile)
                : new AssetSyncConfiguration();
        config.validate(!arguments.reportOnly);

        List<Course> courses = new CsvManifestReader(ManifestSchema.fromConfiguration(config))
                .read(arguments.manifest);
        Map<String, RemoteStatus> linkStatuses = arguments.linkStatus != null
                ? new LinkStatusLoader().load(arguments.linkStatus)
                : Map.of();

        StatusStore store = JsonFileStatusStore.open(config.getStateDir());

        Clock clock = Clock.systemUTC();
        StorageIndexer indexer = new StorageIndexer(
                new DriveIndexCache(config.getIndexCacheFile(), clock), config.getIndexExtensions());
        List<Path> roots = config.getIndexRoots();
        if (roots.isEmpty()) {
            logger.warn("No storage roots configured (assetsync.index.roots); every course will be unmatched");
        }
        DriveIndex index = indexer.buildOrLoadIndex(roots, config.getIndexCacheMaxAge(), arguments.refreshIndex);

        ReconciliationEngine engine = new ReconciliationEngine(
                new FuzzyMatcher(), config.getMatchThreshold(), config.isMatchParallel(), store);
        ReconciliationReport report = engine.reconcile(courses, index, linkStatuses);
        logger.info("Availability: {}", report);

        Path reportFile = arguments.reportFile != null
                ? arguments.reportFile
                : config.getStateDir().resolve(REPORT_FILE_NAME);
        AvailabilityReportWriter writer = new AvailabilityReportWriter(clock);

        if (arguments.reportOnly) {
            writer.write(report, null, reportFile);
            printReport(report);
            return EXIT_OK;
        }

        FreeSpaceProbe probe = new FileStoreFreeSpaceProbe();
        TransferOrchestrator orchestrator = TransferOrchestrator.builder()
                .statusStore(store)
                .assignmentPolicy(new DiskAssignmentPolicy(config.getMinFreeBytes(), config.getTieTolerance()))
                .volumes(config.getVolumes())
                .freeSpaceProbe(probe)
                .executor(new RetryingTransferExecutor(protocolFactory.apply(config),
                        config.getMaxRetries(), config.getRetryDelayMs()))
                .completionMarkerEnabled(config.isCompletionMarkerEnabled())
                .parallelVolumes(config.isParallelVolumes())
                .clock(clock)
                .build();

        TransferOptions options = TransferOptions.builder()
                .dryRun(arguments.dryRun)
                .courseFilters(arguments.courseFilters)
                .build();

        // Ctrl-C or SIGTERM stops the pass between assets; the hook holds the JVM until the
        // outcomes and the report are written.
        CountDownLatch finished = new CountDownLatch(1);
        Duration grace = config.getTransferTimeout().multipliedBy(Math.max(1, config.getMaxRetries()));
        Thread hook = new Thread(new StopOnShutdown(orchestrator, finished, grace), "assetsync-shutdown");
        shutdownHooks.register(hook);
        try {
            RunSummary summary = orchestrator.runAll(courses, options);

            if (!arguments.dryRun) {
                report = engine.reconcile(courses, index, linkStatuses);
            }
            writer.write(report, summary, reportFile);
            printReport(report);
            printSummary(summary);
            return summary.hasFailures() ? EXIT_FAILURES : EXIT_OK;
        } finally {
            finished.countDown();
            shutdownHooks.unregister(hook);
        }
    }

    private void printReport(ReconciliationReport report) {
        Map<String, Long> summary = report.getSummary();
        out.printf("Courses: %d  complete: %d  partial: %d  none: %d  unmatched: %d%n",
                summary.get("courses"), summary.get("complete"), summary.get("partial"),
                summary.get("none"), report.getUnmatchedCourses().size());
    }

    private void printSummary(RunSummary summary) {
        out.println(summary.isDryRun() ? "Transfer plan (dry run):" : "Transfer results:");
        for (CourseResult result : summary.getResults()) {
            out.printf("  %-50s %-12s %s%n", result.getCourseName(), result.getStatus(),
                    result.getVolumeId() != null ? result.getVolumeId()
                            : result.getDetail() != null ? result.getDetail() : "");
        }
        out.println(summary);
        if (summary.isStopped()) {
            out.println("Run was stopped before all courses were processed");
        }
    }

    private static TransferProtocol createProtocol(AssetSyncConfiguration config) {
        return new RcloneTransferProtocol(config.getTransferCommand(), config.getTransferRemote(),
                config.getTransferExtraArgs(), config.getTransferTimeout());
    }

    /**
     * Where the stop-on-shutdown hook of a transfer pass is registered.
     */
    interface ShutdownHooks {
        void register(Thread hook);

        void unregister(Thread hook);
    }

    private static final ShutdownHooks RUNTIME_HOOKS = new ShutdownHooks() {
        @Override
        public void register(Thread hook) {
            Runtime.getRuntime().addShutdownHook(hook);
        }

        @Override
        public void unregister(Thread hook) {
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                logger.debug("Shutdown already in progress, hook stays registered: {}", e.getMessage());
            }
        }
    };

    /**
     * Asks the orchestrator to stop, then waits for the pass to persist its state.
     */
    static final class StopOnShutdown implements Runnable {
        private final TransferOrchestrator orchestrator;
        private final CountDownLatch finished;
        private final Duration grace;

        StopOnShutdown(TransferOrchestrator orchestrator, CountDownLatch finished, Duration grace) {
            this.orchestrator = orchestrator;
            this.finished = finished;
            this.grace = grace;
        }

        @Override
        public void run() {
            logger.info("Shutdown signal received, stopping after the asset in flight...");
            orchestrator.requestStop();
            try {
                if (!finished.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                    logger.warn("Transfer pass did not stop within {}; exiting with work in flight", grace);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for the transfer pass to stop");
            }
        }
    }

    /**
     * Parsed command line.
     */
    static final class Arguments {
        Path manifest;
        Path configFile;
        Path linkStatus;
        Path reportFile;
        boolean refreshIndex;
        boolean dryRun;
        boolean reportOnly;
        boolean help;
        boolean version;
        final List<String> courseFilters = new ArrayList<>();

        static Arguments parse(String[] args) {
            Arguments parsed = new Arguments();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--manifest":
                        parsed.manifest = Paths.get(valueOf(args, ++i, arg));
                        break;
                    case "--config":
                        parsed.configFile = Paths.get(valueOf(args, ++i, arg));
                        break;
                    case "--link-status":
                        parsed.linkStatus = Paths.get(valueOf(args, ++i, arg));
                        break;
                    case "--report":
                        parsed.reportFile = Paths.get(valueOf(args, ++i, arg));
                        break;
                    case "--course":
                        parsed.courseFilters.add(valueOf(args, ++i, arg));
                        break;
                    case "--refresh-index":
                        parsed.refreshIndex = true;
                        break;
                    case "--dry-run":
                        parsed.dryRun = true;
                        break;
                    case "--report-only":
                        parsed.reportOnly = true;
                        break;
                    case "--help":
                    case "-h":
                        parsed.help = true;
                        break;
                    case "--version":
                        parsed.version = true;
                        break;
                    default:
                        throw new IllegalArgumentException("Unknown option: " + arg);
                }
            }
            if (parsed.dryRun && parsed.reportOnly) {
                throw new IllegalArgumentException("--dry-run and --report-only cannot be combined");
            }
            return parsed;
        }

        private static String valueOf(String[] args, int index, String option) {
            if (index >= args.length || args[index].startsWith("--")) {
                throw new IllegalArgumentException(option + " requires a value");
            }
            return args[index];
        }
    }
}
