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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Flat, queryable inventory of every indexed path, partitioned by storage root.
 *
 * <p>Immutable once built. Safe to share between threads, which lets the
 * reconciliation pass match courses in parallel.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public final class DriveIndex {

    private final String fingerprint;
    private final Instant createdAt;
    private final List<StorageRoot> roots;
    private final Map<String, List<IndexEntry>> partitions;
    private final List<String> warnings;
    private final Map<String, List<IndexEntry>> descendantDirectories;

    @JsonCreator
    public DriveIndex(@JsonProperty("fingerprint") String fingerprint,
                      @JsonProperty("createdAt") Instant createdAt,
                      @JsonProperty("roots") List<StorageRoot> roots,
                      @JsonProperty("partitions") Map<String, List<IndexEntry>> partitions) {
        this(fingerprint, createdAt, roots, partitions, List.of());
    }

    public DriveIndex(String fingerprint, Instant createdAt, List<StorageRoot> roots,
                      Map<String, List<IndexEntry>> partitions, List<String> warnings) {
        this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.roots = List.copyOf(roots != null ? roots : List.of());
        Map<String, List<IndexEntry>> copy = new LinkedHashMap<>();
        for (StorageRoot root : this.roots) {
            List<IndexEntry> entries = partitions != null ? partitions.get(root.getId()) : null;
            copy.put(root.getId(), entries != null ? List.copyOf(entries) : List.of());
        }
        this.partitions = Collections.unmodifiableMap(copy);
        this.warnings = List.copyOf(warnings != null ? warnings : List.of());
        this.descendantDirectories = indexDescendants(this.partitions);
    }

    /**
     * Maps every directory to the directories below it, keyed by root id and relative path.
     */
    private static Map<String, List<IndexEntry>> indexDescendants(Map<String, List<IndexEntry>> partitions) {
        Map<String, List<IndexEntry>> below = new HashMap<>();
        partitions.forEach((rootId, entries) -> {
            for (IndexEntry entry : entries) {
                if (!entry.isDirectory()) {
                    continue;
                }
                String path = entry.getRelativePath();
                for (int slash = path.indexOf('/'); slash > 0; slash = path.indexOf('/', slash + 1)) {
                    below.computeIfAbsent(key(rootId, path.substring(0, slash)), k -> new ArrayList<>()).add(entry);
                }
            }
        });
        below.replaceAll((k, dirs) -> List.copyOf(dirs));
        return below;
    }

    private static String key(String rootId, String relativePath) {
        return rootId + '\0' + relativePath;
    }

    public String getFingerprint() { return fingerprint; }

    public Instant getCreatedAt() { return createdAt; }

    public List<StorageRoot> getRoots() { return roots; }

    public Map<String, List<IndexEntry>> getPartitions() { return partitions; }

    public List<IndexEntry> getPartition(String rootId) {
        return partitions.getOrDefault(rootId, List.of());
    }

    /**
     * Warnings recorded during the scan that produced this index. Not cached.
     */
    @JsonIgnore
    public List<String> getWarnings() { return warnings; }

    @JsonIgnore
    public List<IndexEntry> getEntries() {
        List<IndexEntry> all = new ArrayList<>();
        partitions.values().forEach(all::addAll);
        return all;
    }

    @JsonIgnore
    public List<IndexEntry> getDirectories() {
        return partitions.values().stream()
                .flatMap(List::stream)
                .filter(IndexEntry::isDirectory)
                .collect(Collectors.toList());
    }

    /**
     * Directories strictly below {@code directory}, in index order.
     */
    public List<IndexEntry> getDescendantDirectories(IndexEntry directory) {
        return descendantDirectories.getOrDefault(key(directory.getRootId(), directory.getRelativePath()), List.of());
    }

    /**
     * Absolute path of an entry on the file system.
     */
    public Path resolve(IndexEntry entry) {
        StorageRoot root = roots.stream()
                .filter(r -> r.getId().equals(entry.getRootId()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown root: " + entry.getRootId()));
        return root.toPath().resolve(entry.getRelativePath());
    }

    public int size() {
        return partitions.values().stream().mapToInt(List::size).sum();
    }

    @Override
    public String toString() {
        return "DriveIndex{roots=" + roots.size() + ", entries=" + size() + ", createdAt=" + createdAt + "}";
    }
}
