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


package dev.mars.assetsync.assign;

import dev.mars.assetsync.storage.FileManager;

import java.nio.file.Files;

/**
 * Reads usable space from the file store of the volume's mount path. An unmounted
 * volume reports -1, which never satisfies a minimum free space requirement.
 */
public class FileStoreFreeSpaceProbe implements FreeSpaceProbe {

    @Override
    public long freeBytes(Volume volume) {
        if (!Files.isDirectory(volume.getMountPath())) {
            return -1;
        }
        return FileManager.getAvailableSpace(volume.getMountPath());
    }
}
