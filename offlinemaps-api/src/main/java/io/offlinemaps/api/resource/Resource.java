package io.offlinemaps.api.resource;

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

/// A cached map resource: opaque payload bytes plus revalidation metadata.
///
/// @param key the cache key
/// @param payload the payload bytes, never interpreted by the cache
/// @param metadata revalidation metadata
/// @param accessedAt the last time the resource was stored or read from the ambient cache
public record Resource(ResourceKey key, byte[] payload, ResourceMetadata metadata, Instant accessedAt) {

    public Resource {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(payload, "payload cannot be null");
        metadata = metadata == null ? ResourceMetadata.NONE : metadata;
    }

    /// @return the payload size in bytes
    public long size() {
        return payload.length;
    }

    /// @param now the current time
    /// @return true if the resource should be revalidated before it is trusted
    public boolean isStale(Instant now) {
        return metadata.isStale(now);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Resource)) {
            return false;
        }
        Resource other = (Resource) o;
        return key.equals(other.key)
            && Arrays.equals(payload, other.payload)
            && metadata.equals(other.metadata)
            && Objects.equals(accessedAt, other.accessedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, Arrays.hashCode(payload), metadata, accessedAt);
    }

    @Override
    public String toString() {
        return "Resource{" + key + ", " + payload.length + " bytes, " + metadata + ", accessedAt=" + accessedAt + "}";
    }
}
