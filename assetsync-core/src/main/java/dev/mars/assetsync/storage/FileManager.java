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


package dev.mars.assetsync.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.stream.Stream;

public class FileManager {
    private static final Logger logger = LoggerFactory.getLogger(FileManager.class);

    private static final int MAX_FOLDER_NAME_LENGTH = 120;

    static final String PLACEHOLDER_NAME = "_";

    private FileManager() {
    }

    /**
     * Makes a course name safe for use as a folder name on any of the target file systems.
     * The result is always a single path segment: a name that cleans down to nothing or
     * to dots only becomes {@value #PLACEHOLDER_NAME}.
     */
    public static String sanitizeName(String name) {
        String cleaned = name.trim()
                .replaceAll("[<>:\"/\\\\|?*\\x00-\\x1f]", "")
                .replaceAll("\\s+", " ")
                .trim();
        if (cleaned.length() > MAX_FOLDER_NAME_LENGTH) {
            cleaned = cleaned.substring(0, MAX_FOLDER_NAME_LENGTH).trim();
        }
        if (cleaned.isEmpty() || cleaned.chars().allMatch(c -> c == '.')) {
            return PLACEHOLDER_NAME;
        }
        return cleaned;
    }

    public static void ensureDirectoryExists(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            Files.createDirectories(dir);
            logger.debug("Created directory: {}", dir);
        }
    }

    /**
     * True when the directory contains at least one regular file at any depth.
     */
    public static boolean isPopulated(Path dir) {
        if (!Files.isDirectory(dir)) {
            return false;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk.anyMatch(Files::isRegularFile);
        } catch (IOException | UncheckedIOException e) {
            logger.warn("Could not inspect folder {}: {}", dir, e.getMessage());
            return false;
        }
    }

    /**
     * Usable bytes on the file store holding {@code path}, resolved through the nearest
     * existing ancestor. Returns -1 when the store cannot be queried.
     */
    public static long getAvailableSpace(Path path) {
        Path probe = path.toAbsolutePath();
        while (probe != null && !Files.exists(probe)) {
            probe = probe.getParent();
        }
        if (probe == null) {
            logger.warn("No existing ancestor for path: {}", path);
            return -1;
        }
        try {
            FileStore store = Files.getFileStore(probe);
            return store.getUsableSpace();
        } catch (IOException e) {
            logger.warn("Could not get available space for path: {} - {}", path, e.getMessage());
            return -1;
        }
    }

    /**
     * Writes {@code content} to a temp file next to {@code target}, forces it to disk, then
     * renames it into place atomically where the file system allows it.
     */
    public static void writeAtomically(Path target, byte[] content) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        ensureDirectoryExists(parent);
        Path tmp = parent.resolve(target.getFileName().toString() + ".tmp");

        try (FileChannel ch = FileChannel.open(tmp,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE)) {
            ByteBuffer buf = ByteBuffer.wrap(content);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true);
        }

        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
