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

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Source of free-space readings for target volumes.
 */
@FunctionalInterface
public interface FreeSpaceProbe {

    /**
     * @return usable bytes on the volume, or a negative value when it cannot be determined
     */
    long freeBytes(Volume volume);

    default Map<String, Long> snapshot(Collection<Volume> volumes) {
        Map<String, Long> readings = new LinkedHashMap<>();
        for (Volume volume : volumes) {
            readings.put(volume.getId(), freeBytes(volume));
        }
        return readings;
    }
}
