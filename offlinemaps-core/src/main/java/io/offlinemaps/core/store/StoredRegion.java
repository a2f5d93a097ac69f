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

import io.offlinemaps.api.region.DownloadState;
import io.offlinemaps.api.region.OfflineRegion;
import io.offlinemaps.api.region.OfflineRegionDefinition;
import io.offlinemaps.api.region.OfflineRegionStatus;
import io.offlinemaps.api.region.RegionState;

import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/// An immutable snapshot of a persisted offline region together with its completion
/// counters.
///
/// The completed counters describe the resources currently linked to the region. They are
/// maintained by the store as links change and are recomputed from resource records on open.
///
/// @param id the region id
/// @param definition the region definition
/// @param metadata opaque application metadata
/// @param state the persisted activation state
/// @param createdAt creation time
/// @param manifestCount number of resources in the region's manifest
/// @param manifestTileCount number of tiles in the region's manifest
/// @param completedResourceCount linked resources
/// @param completedResourceSize total bytes of linked resources
/// @param completedTileCount linked tiles
/// @param completedTileSize total bytes of linked tiles
/// @param erroredResourceCount resources that failed during the most recent activation
public record StoredRegion(
    long id,
    OfflineRegionDefinition definition,
    byte[] metadata,
    RegionState state,
    Instant createdAt,
    long manifestCount,
    long manifestTileCount,
    long completedResourceCount,
    long completedResourceSize,
    long completedTileCount,
    long completedTileSize,
    long erroredResourceCount
) {

    public StoredRegion {
        Objects.requireNonNull(definition, "definition cannot be null");
        Objects.requireNonNull(state, "state cannot be null");
        metadata = metadata == null ? new byte[0] : metadata.clone();
    }

    @Override
    public byte[] metadata() {
        return metadata.clone();
    }

    /// Builds the public status snapshot.
    /// @param downloadState the current download state, which is not persisted
    /// @return the status
    public OfflineRegionStatus status(DownloadState downloadState) {
        return new OfflineRegionStatus(
            id,
            downloadState,
            manifestCount,
            true,
            completedResourceCount,
            completedResourceSize,
            completedTileCount,
            completedTileSize,
            erroredResourceCount
        );
    }

    public OfflineRegion toRegion(DownloadState downloadState) {
        return new OfflineRegion(id, definition, metadata.clone(), state, createdAt, status(downloadState));
    }

    StoredRegion withState(RegionState newState) {
        return new StoredRegion(id, definition, metadata, newState, createdAt, manifestCount, manifestTileCount,
            completedResourceCount, completedResourceSize, completedTileCount, completedTileSize,
            erroredResourceCount);
    }

    StoredRegion withMetadata(byte[] newMetadata) {
        return new StoredRegion(id, definition, newMetadata, state, createdAt, manifestCount, manifestTileCount,
            completedResourceCount, completedResourceSize, completedTileCount, completedTileSize,
            erroredResourceCount);
    }

    StoredRegion withErroredResourceCount(long count) {
        return new StoredRegion(id, definition, metadata, state, createdAt, manifestCount, manifestTileCount,
            completedResourceCount, completedResourceSize, completedTileCount, completedTileSize, count);
    }

    /// Adds (sign 1) or removes (sign -1) one linked resource from the completion counters.
    StoredRegion withCompleted(StoredEntry entry, int sign) {
        long tiles = entry.key().isTile() ? sign : 0;
        long tileBytes = entry.key().isTile() ? sign * entry.size() : 0;
        return new StoredRegion(id, definition, metadata, state, createdAt, manifestCount, manifestTileCount,
            completedResourceCount + sign,
            completedResourceSize + sign * entry.size(),
            completedTileCount + tiles,
            completedTileSize + tileBytes,
            erroredResourceCount);
    }

    RegionRecord toRecord(int version) {
        return new RegionRecord(
            version,
            id,
            definition,
            Base64.getEncoder().encodeToString(metadata),
            state,
            manifestCount,
            manifestTileCount,
            erroredResourceCount,
            createdAt.toString()
        );
    }

    static StoredRegion fromRecord(RegionRecord record) {
        return new StoredRegion(
            record.id(),
            record.definition(),
            record.metadata() == null ? new byte[0] : Base64.getDecoder().decode(record.metadata()),
            record.state() == null ? RegionState.INACTIVE : record.state(),
            Instant.parse(record.createdAt()),
            record.manifestCount(),
            record.manifestTileCount(),
            0, 0, 0, 0,
            record.erroredResourceCount()
        );
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StoredRegion)) {
            return false;
        }
        StoredRegion other = (StoredRegion) o;
        return id == other.id
            && definition.equals(other.definition)
            && Arrays.equals(metadata, other.metadata)
            && state == other.state
            && Objects.equals(createdAt, other.createdAt)
            && manifestCount == other.manifestCount
            && manifestTileCount == other.manifestTileCount
            && completedResourceCount == other.completedResourceCount
            && completedResourceSize == other.completedResourceSize
            && completedTileCount == other.completedTileCount
            && completedTileSize == other.completedTileSize
            && erroredResourceCount == other.erroredResourceCount;
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, definition, state, createdAt, manifestCount, manifestTileCount,
            completedResourceCount, completedResourceSize, completedTileCount, completedTileSize,
            erroredResourceCount);
        return 31 * result + Arrays.hashCode(metadata);
    }

    @Override
    public String toString() {
        return "StoredRegion{id=" + id + ", state=" + state + ", completed="
            + completedResourceCount + "/" + manifestCount + ", errored=" + erroredResourceCount + "}";
    }
}
