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


package dev.mars.assetsync.index;

import dev.mars.assetsync.match.NameNormalizer;
import dev.mars.assetsync.storage.Fingerprints;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds the {@link DriveIndex} by walking every storage root, or reuses the cached one.
 *
 * <p>Each root is walked by its own worker thread and produces its own partition, so
 * workers share no mutable state. A root that is missing or unreadable yields an empty
 * partition and a warning; unreadable subtrees are skipped. Symbolic links are not
 * followed, and hidden entries and operating system folders are skipped.</p>
 *
 * <p>The walk checks for interruption before each directory. An interrupted build
 * throws {@link InterruptedException} and leaves the cache untouched.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class StorageIndexer {

    private static final Logger logger = LoggerFactory.getLogger(StorageIndexer.class);

    private static final Set<String> SYSTEM_FOLDERS = Set.of(
            "system volume information", "$recycle.bin", "lost+found");

    private final DriveIndexCache cache;
    private final Set<String> extensions;

    public StorageIndexer(DriveIndexCache cache) {
        this(cache, Set.of());
    }

    /**
     * @param cache      the index cache
     * @param extensions file extensions to index, lower case without the dot; empty indexes all files
     */
    public StorageIndexer(DriveIndexCache cache, Collection<String> extensions) {
        this.cache = cache;
        this.extensions = new LinkedHashSet<>(extensions);
    }

    /**
     * Returns the cached index when it is still usable, otherwise walks every root.
     *
     * @param roots        the storage roots to index
     * @param maxAge       maximum age of a reusable cached index
     * @param forceRefresh ignore the cache and rebuild
     * @return the index, never null
     * @throws InterruptedException if the calling thread is interrupted during the walk
     */
    public DriveIndex buildOrLoadIndex(List<Path> roots, Duration maxAge, boolean forceRefresh)
            throws InterruptedException {
        String fingerprint = Fingerprints.ofRoots(roots);
        Optional<DriveIndex> cached = cache.load(fingerprint, maxAge, forceRefresh);
        if (cached.isPresent()) {
            return cached.get();
        }
        DriveIndex index = buildIndex(roots, fingerprint);
        if (roots.stream().allMatch(Files::isDirectory)) {
            cache.store(index);
        } else {
            logger.warn("Not caching the drive index: at least one storage root is not mounted");
        }
        return index;
    }

    DriveIndex buildIndex(List<Path> rootPaths, String fingerprint) throws InterruptedException {
        List<StorageRoot> roots = new ArrayList<>();
        for (Path path : rootPaths) {
            StorageRoot root = StorageRoot.of(path);
            if (!roots.contains(root)) {
                roots.add(root);
            }
        }
        logger.info("Indexing {} storage root(s)", roots.size());

        Map<String, List<IndexEntry>> partitions = new LinkedHashMap<>();
        List<String> warnings = new ArrayList<>();
        if (roots.isEmpty()) {
            return new DriveIndex(fingerprint, cache.getClock().instant(), roots, partitions, warnings);
        }

        AtomicInteger threadCount = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(roots.size(), r -> {
            Thread t = new Thread(r, "StorageIndexer-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<Partition>> futures = new ArrayList<>();
            for (StorageRoot root : roots) {
                futures.add(executor.submit(() -> scanRoot(root)));
            }
            for (int i = 0; i < roots.size(); i++) {
                StorageRoot root = roots.get(i);
                Partition partition;
                try {
                    partition = futures.get(i).get();
                } catch (ExecutionException e) {
                    String warning = "Indexing failed for " + root.getPath() + ": " + e.getCause();
                    logger.warn(warning);
                    partition = new Partition(List.of(), List.of(warning), false);
                }
                if (partition.interrupted) {
                    throw new InterruptedException("Indexing interrupted while scanning " + root.getPath());
                }
                partitions.put(root.getId(), partition.entries);
                warnings.addAll(partition.warnings);
            }
        } catch (InterruptedException | CancellationException e) {
            executor.shutdownNow();
            InterruptedException interrupted = e instanceof InterruptedException
                    ? (InterruptedException) e : new InterruptedException("Indexing cancelled");
            logger.warn("Drive indexing interrupted; partial index discarded");
            throw interrupted;
        } finally {
            executor.shutdownNow();
        }

        DriveIndex index = new DriveIndex(fingerprint, cache.getClock().instant(), roots, partitions, warnings);
        logger.info("Indexed {} paths across {} root(s) with {} warning(s)",
                index.size(), roots.size(), warnings.size());
        return index;
    }

    private Partition scanRoot(StorageRoot root) {
        Path rootPath = root.toPath();
        List<IndexEntry> entries = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (!Files.isDirectory(rootPath) || !Files.isReadable(rootPath)) {
            String warning = "Storage root not mounted or not readable: " + rootPath;
            logger.warn(warning);
            return new Partition(entries, List.of(warning), false);
        }

        boolean[] interrupted = {false};
        try {
            Files.walkFileTree(rootPath, new SimpleFileVisitor<Path>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (Thread.currentThread().isInterrupted()) {
                        interrupted[0] = true;
                        return FileVisitResult.TERMINATE;
                    }
                    if (dir.equals(rootPath)) {
                        return FileVisitResult.CONTINUE;
                    }
                    if (isSkipped(dir)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    entries.add(entry(root, rootPath, dir, true));
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && !isSkipped(file) && acceptsExtension(file)) {
                        entries.add(entry(root, rootPath, file, false));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    String warning = "Skipping unreadable path " + file + ": " + exc.getMessage();
                    logger.warn(warning);
                    warnings.add(warning);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            String warning = "Indexing of " + rootPath + " stopped early: " + e.getMessage();
            logger.warn(warning);
            warnings.add(warning);
        }
        logger.debug("Indexed {} paths under {}", entries.size(), rootPath);
        return new Partition(entries, warnings, interrupted[0]);
    }

    private static IndexEntry entry(StorageRoot root, Path rootPath, Path path, boolean directory) {
        String relative = rootPath.relativize(path).toString().replace('\\', '/');
        String name = path.getFileName().toString();
        return new IndexEntry(root.getId(), relative, NameNormalizer.normalize(name), directory);
    }

    static boolean isSkipped(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString();
        return name.startsWith(".") || SYSTEM_FOLDERS.contains(name.toLowerCase(Locale.ROOT));
    }

    private boolean acceptsExtension(Path file) {
        if (extensions.isEmpty()) {
            return true;
        }
        String name = file.getFileName().toString();
        String extension = StringUtils.substringAfterLast(name, ".").toLowerCase(Locale.ROOT);
        return extensions.contains(extension);
    }

    private static final class Partition {
        final List<IndexEntry> entries;
        final List<String> warnings;
        final boolean interrupted;

        Partition(List<IndexEntry> entries, List<String> warnings, boolean interrupted) {
            this.entries = entries;
            this.warnings = warnings;
            this.interrupted = interrupted;
        }
    }
}
