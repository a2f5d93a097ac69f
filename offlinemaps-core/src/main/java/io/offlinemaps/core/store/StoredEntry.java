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

import io.offlinemaps.api.resource.ResourceKey;
import io.offlinemaps.api.resource.ResourceMetadata;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/// An immutable snapshot of one committed resource in the store's index.
///
/// An entry with no region links is ambient and may be evicted; an entry linked to at least
/// one region is pinned.
///
/// @param key the cache key
/// @param url the URL the resource was fetched from
/// @param metadata revalidation metadata
/// @param size payload size in bytes
/// @param sha256 hex SHA-256 of the payload
/// @param payloadFile file name of the payload within the key's bucket directory
/// @param sequence commit sequence number, unique among live entries
/// @param accessedAt last store or ambient read time
/// @param regions ids of the regions this resource is linked to
public record StoredEntry(
    ResourceKey key,
    String url,
    ResourceMetadata metadata,
    long size,
    String sha256,
    String payloadFile,
    long sequence,
    Instant accessedAt,
    Set<Long> regions
) {

    public StoredEntry {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(accessedAt, "accessedAt cannot be null");
        metadata = metadata == null ? ResourceMetadata.NONE : metadata;
        regions = Collections.unmodifiableSet(new TreeSet<>(regions));
    }

    /// @return true if no region references this entry
    public boolean isAmbient() {
        return regions.isEmpty();
    }

    public boolean isLinkedTo(long regionId) {
        return regions.contains(regionId);
    }

    StoredEntry withAccessedAt(Instant instant) {
        return new StoredEntry(key, url, metadata, size, sha256, payloadFile, sequence, instant, regions);
    }

    StoredEntry withMetadata(ResourceMetadata newMetadata) {
        return new StoredEntry(key, url, newMetadata, size, sha256, payloadFile, sequence, accessedAt, regions);
    }

    StoredEntry withRegion(long regionId) {
        Set<Long> linked = new TreeSet<>(regions);
        linked.add(regionId);
        return new StoredEntry(key, url, metadata, size, sha256, payloadFile, sequence, accessedAt, linked);
    }

    StoredEntry withoutRegion(long regionId) {
        Set<Long> linked = new TreeSet<>(regions);
        linked.remove(regionId);
        return new StoredEntry(key, url, metadata, size, sha256, payloadFile, sequence, accessedAt, linked);
    }

    ResourceRecord toRecord(int version) {
        return new ResourceRecord(
            version,
            key.storageKey(),
            url,
            metadata.etag(),
            metadata.expires() == null ? null : metadata.expires().toString(),
            metadata.modified() == null ? null : metadata.modified().toString(),
            size,
            sha256,
            payloadFile,
            sequence,
            accessedAt.toString(),
            new ArrayList<>(regions)
        );
    }

    static StoredEntry fromRecord(ResourceRecord record) {
        ResourceMetadata metadata = new ResourceMetadata(
            record.etag(),
            record.expires() == null ? null : Instant.parse(record.expires()),
            record.modified() == null ? null : Instant.parse(record.modified())
        );
        return new StoredEntry(
            ResourceKey.parse(record.key()),
            record.url(),
            metadata,
            record.size(),
            record.sha256(),
            Objects.requireNonNull(record.payloadFile(), "payloadFile"),
            record.sequence(),
            Instant.parse(record.accessedAt()),
            record.regions() == null ? Set.of() : new TreeSet<>(record.regions())
        );
    }
}
