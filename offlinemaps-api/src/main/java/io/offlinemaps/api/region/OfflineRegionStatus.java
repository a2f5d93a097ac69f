package io.offlinemaps.api.region;

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

/// A snapshot of an offline region's download progress.
///
/// Counters only grow while a download runs, so observers can discard duplicate or
/// out-of-order notifications by comparing them.
///
/// @param regionId the region
/// @param downloadState the download phase
/// @param requiredResourceCount the number of resources in the region's manifest
/// @param requiredResourceCountIsPrecise true once the manifest has been fully enumerated
/// @param completedResourceCount manifest resources stored and linked to the region
/// @param completedResourceSize total bytes of the completed resources
/// @param completedTileCount completed resources that are tiles
/// @param completedTileSize total bytes of the completed tiles
/// @param erroredResourceCount resources that failed permanently during the current download
public record OfflineRegionStatus(
    long regionId,
    DownloadState downloadState,
    long requiredResourceCount,
    boolean requiredResourceCountIsPrecise,
    long completedResourceCount,
    long completedResourceSize,
    long completedTileCount,
    long completedTileSize,
    long erroredResourceCount
) {

    /// @return true if every manifest resource is stored for the region
    public boolean isComplete() {
        return completedResourceCount >= requiredResourceCount;
    }
}
