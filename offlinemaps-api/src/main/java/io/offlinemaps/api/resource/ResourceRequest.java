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

import java.util.Objects;

/// A request for a resource: the cache key plus the URL it is fetched from.
///
/// Tile keys do not contain a URL, so any request that may reach the network carries both.
///
/// @param key the cache key
/// @param url the URL to fetch the resource from
public record ResourceRequest(ResourceKey key, String url) {

    public ResourceRequest {
        Objects.requireNonNull(key, "key cannot be null");
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url cannot be null or blank for " + key);
        }
    }

    /// Creates a request for a URL-addressed key, fetched from its own locator.
    /// @param key a key whose kind uses a URL locator
    /// @return the request
    public static ResourceRequest of(ResourceKey key) {
        if (!key.kind().hasUrlLocator()) {
            throw new IllegalArgumentException("a url is required to request " + key);
        }
        return new ResourceRequest(key, key.locator());
    }

    public static ResourceRequest style(String url) {
        return of(ResourceKey.style(url));
    }

    public static ResourceRequest tile(String sourceId, int z, int x, int y, String url) {
        return new ResourceRequest(ResourceKey.tile(sourceId, z, x, y), url);
    }
}
