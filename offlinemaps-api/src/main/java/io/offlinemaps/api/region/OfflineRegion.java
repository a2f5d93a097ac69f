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

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/// An offline region as seen by applications.
///
/// @param id the region id, assigned by the store
/// @param definition the persisted definition
/// @param metadata opaque client bytes
/// @param state the persisted region state
/// @param createdAt when the region was created
/// @param status the current download status
public record OfflineRegion(
    long id,
    OfflineRegionDefinition definition,
    byte[] metadata,
    RegionState state,
    Instant createdAt,
    OfflineRegionStatus status
) {

    public OfflineRegion {
        metadata = metadata == null ? new byte[0] : metadata;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OfflineRegion)) {
            return false;
        }
        OfflineRegion other = (OfflineRegion) o;
        return id == other.id
            && definition.equals(other.definition)
            && Arrays.equals(metadata, other.metadata)
            && state == other.state
            && Objects.equals(createdAt, other.createdAt)
            && Objects.equals(status, other.status);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, definition, Arrays.hashCode(metadata), state, createdAt, status);
    }

    @Override
    public String toString() {
        return "OfflineRegion{id=" + id + ", state=" + state + ", createdAt=" + createdAt + ", status=" + status + "}";
    }
}
