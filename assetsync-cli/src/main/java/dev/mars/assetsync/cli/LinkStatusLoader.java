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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.assetsync.core.RemoteStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads the verdicts of the external link checker: a JSON object mapping a link URL or
 * remote folder id to {@code available}, {@code missing} or {@code broken}.
 * Entries with an unknown verdict are logged and ignored.
 */
public class LinkStatusLoader {

    private static final Logger logger = LoggerFactory.getLogger(LinkStatusLoader.class);

    private final ObjectMapper objectMapper;

    public LinkStatusLoader() {
        this(new ObjectMapper());
    }

    public LinkStatusLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, RemoteStatus> load(Path file) throws InputFileException {
        if (!Files.isRegularFile(file)) {
            throw new InputFileException(file, "Link status file not found");
        }
        Map<String, String> raw;
        try {
            raw = objectMapper.readValue(file.toFile(), new TypeReference<Map<String, String>>() { });
        } catch (JsonProcessingException e) {
            throw new InputFileException(file, "Expected a JSON object of link to verdict: "
                    + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new InputFileException(file, "Cannot read link status file: " + e.getMessage(), e);
        }
        if (raw == null) {
            throw new InputFileException(file, "Link status file is empty");
        }

        Map<String, RemoteStatus> statuses = new LinkedHashMap<>();
        raw.forEach((key, verdict) -> {
            try {
                statuses.put(key.trim(), RemoteStatus.fromVerdict(verdict));
            } catch (IllegalArgumentException e) {
                logger.warn("Ignoring link status for {}: {}", key, e.getMessage());
            }
        });
        logger.info("Loaded {} link status verdict(s) from {}", statuses.size(), file);
        return statuses;
    }
}
