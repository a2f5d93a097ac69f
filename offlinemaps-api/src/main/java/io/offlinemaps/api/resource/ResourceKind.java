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

/// The kinds of map resources held by the cache.
///
/// Each kind has a short, stable code used as the prefix of a [ResourceKey]'s storage form.
/// Codes are persisted on disk, so they must never change.
public enum ResourceKind {
    /// A style document
    STYLE("style", true),
    /// A vector or raster tile, addressed by source id and tile coordinate
    TILE("tile", false),
    /// A sprite sheet image or its index document
    SPRITE("sprite", true),
    /// A range of 256 glyphs for one font stack
    GLYPH("glyph", true),
    /// TileJSON or GeoJSON data referenced by a style source
    SOURCE_METADATA("source", true);

    private final String code;
    private final boolean urlLocator;

    ResourceKind(String code, boolean urlLocator) {
        this.code = code;
        this.urlLocator = urlLocator;
    }

    /// @return the persisted code for this kind
    public String code() {
        return code;
    }

    /// @return true if keys of this kind use the resource URL as their locator
    public boolean hasUrlLocator() {
        return urlLocator;
    }

    /// Looks up a kind by its persisted code.
    /// @param code the code, as returned by [#code()]
    /// @return the matching kind
    /// @throws IllegalArgumentException if no kind has this code
    public static ResourceKind fromCode(String code) {
        for (ResourceKind kind : values()) {
            if (kind.code.equals(code)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown resource kind code: " + code);
    }
}
