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

import dev.mars.assetsync.core.exceptions.AssetSyncException;

import java.nio.file.Path;

/**
 * Thrown when a manifest or link status file cannot be read or has the wrong shape.
 */
public class InputFileException extends AssetSyncException {

    private final Path file;

    public InputFileException(Path file, String message) {
        super(message);
        this.file = file;
    }

    public InputFileException(Path file, String message, Throwable cause) {
        super(message, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }

    @Override
    public String getMessage() {
        return file + ": " + super.getMessage();
    }
}
