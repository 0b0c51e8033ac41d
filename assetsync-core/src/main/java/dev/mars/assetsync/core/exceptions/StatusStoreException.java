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

package dev.mars.assetsync.core.exceptions;

import java.nio.file.Path;

/**
 * Thrown when the persistent status store cannot be read, parsed or written.
 *
 * <p>This is the one failure that stops a run: without a trustworthy store the
 * resume contract cannot be honoured, so callers must not convert it into a
 * per-asset status.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class StatusStoreException extends AssetSyncException {

    private final Path location;

    public StatusStoreException(Path location, String message) {
        super(message);
        this.location = location;
    }

    public StatusStoreException(Path location, String message, Throwable cause) {
        super(message, cause);
        this.location = location;
    }

    public Path getLocation() {
        return location;
    }

    @Override
    public String getMessage() {
        return String.format("Status store %s: %s", location, super.getMessage());
    }
}
