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

/// The primary key of a cached resource.
///
/// A key is the pair of a [ResourceKind] and a canonical locator. For URL-addressed kinds the
/// locator is the resource URL; for tiles it is `sourceId/z/x/y`. The storage form
/// `code:locator` is persisted and must stay stable across process restarts.
///
/// @param kind the resource kind
/// @param locator the canonical locator within that kind
public record ResourceKey(ResourceKind kind, String locator) {

    public ResourceKey {
        Objects.requireNonNull(kind, "kind cannot be null");
        if (locator == null || locator.isBlank()) {
            throw new IllegalArgumentException("locator cannot be null or blank");
        }
    }

    public static ResourceKey style(String url) {
        return new ResourceKey(ResourceKind.STYLE, url);
    }

    public static ResourceKey sprite(String url) {
        return new ResourceKey(ResourceKind.SPRITE, url);
    }

    public static ResourceKey glyph(String url) {
        return new ResourceKey(ResourceKind.GLYPH, url);
    }

    public static ResourceKey sourceMetadata(String url) {
        return new ResourceKey(ResourceKind.SOURCE_METADATA, url);
    }

    /// Creates a tile key.
    /// @param sourceId the id of the style source the tile belongs to
    /// @param z zoom level
    /// @param x tile column
    /// @param y tile row
    /// @return the tile key
    public static ResourceKey tile(String sourceId, int z, int x, int y) {
        if (sourceId == null || sourceId.isBlank() || sourceId.contains("/")) {
            throw new IllegalArgumentException("invalid tile source id: " + sourceId);
        }
        if (z < 0 || x < 0 || y < 0) {
            throw new IllegalArgumentException("tile coordinates must be non-negative: " + z + "/" + x + "/" + y);
        }
        return new ResourceKey(ResourceKind.TILE, sourceId + "/" + z + "/" + x + "/" + y);
    }

    /// @return true if this key names a tile
    public boolean isTile() {
        return kind == ResourceKind.TILE;
    }

    /// @return the persisted form of this key
    public String storageKey() {
        return kind.code() + ":" + locator;
    }

    /// Parses the persisted form produced by [#storageKey()].
    /// @param storageKey the persisted key
    /// @return the key
    /// @throws IllegalArgumentException if the value is not a valid storage key
    public static ResourceKey parse(String storageKey) {
        if (storageKey == null) {
            throw new IllegalArgumentException("storage key cannot be null");
        }
        int sep = storageKey.indexOf(':');
        if (sep <= 0) {
            throw new IllegalArgumentException("malformed storage key: " + storageKey);
        }
        return new ResourceKey(ResourceKind.fromCode(storageKey.substring(0, sep)), storageKey.substring(sep + 1));
    }

    @Override
    public String toString() {
        return storageKey();
    }
}
