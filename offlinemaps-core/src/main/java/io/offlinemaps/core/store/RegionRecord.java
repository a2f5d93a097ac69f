package io.offlinemaps.core.store;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.offlinemaps.api.region.OfflineRegionDefinition;
import io.offlinemaps.api.region.RegionState;

/// On-disk record of an offline region. Completed-resource counters are not persisted; they
/// are recomputed from resource records whenever the store is opened.
record RegionRecord(
    int version,
    long id,
    OfflineRegionDefinition definition,
    String metadata,
    RegionState state,
    long manifestCount,
    long manifestTileCount,
    long erroredResourceCount,
    String createdAt
) {
}
