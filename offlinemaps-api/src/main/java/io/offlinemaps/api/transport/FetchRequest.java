package io.offlinemaps.api.transport;

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

import io.offlinemaps.api.resource.ResourceKind;
import io.offlinemaps.api.resource.ResourceMetadata;

import java.time.Instant;
import java.util.Objects;

/// A single transfer request handed to a [ResourceTransport].
///
/// When `priorEtag` or `priorModified` is set the request is conditional, and the transport
/// may answer with [FetchResponse#notModified(ResourceMetadata)].
///
/// @param url the URL to fetch
/// @param kind the kind of resource being fetched
/// @param priorEtag the entity tag of the cached copy, or null
/// @param priorModified the last-modified time of the cached copy, or null
public record FetchRequest(String url, ResourceKind kind, String priorEtag, Instant priorModified) {

    public FetchRequest {
        Objects.requireNonNull(url, "url cannot be null");
        Objects.requireNonNull(kind, "kind cannot be null");
    }

    public static FetchRequest unconditional(String url, ResourceKind kind) {
        return new FetchRequest(url, kind, null, null);
    }

    /// Creates a conditional request that revalidates a cached copy.
    public static FetchRequest revalidate(String url, ResourceKind kind, ResourceMetadata cached) {
        return new FetchRequest(url, kind, cached.etag(), cached.modified());
    }

    public boolean isConditional() {
        return priorEtag != null || priorModified != null;
    }

    public FetchRequest withoutConditions() {
        return unconditional(url, kind);
    }
}
