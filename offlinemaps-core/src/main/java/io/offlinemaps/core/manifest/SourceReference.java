package io.offlinemaps.core.manifest;

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

import java.util.List;
import java.util.Objects;

/// A style source, as far as resource enumeration is concerned.
///
/// @param id the source id within the style
/// @param type the source type (`vector`, `raster`, `raster-dem`, `geojson`, ...)
/// @param url the TileJSON URL for tiled sources given by reference, or the data URL of a
///     GeoJSON source; null if the source is inline
/// @param tiles tile URL templates
/// @param minZoom smallest zoom level the source provides
/// @param maxZoom largest zoom level the source provides
/// @param tms true if tile rows are numbered from the south
public record SourceReference(
    String id,
    String type,
    String url,
    List<String> tiles,
    int minZoom,
    int maxZoom,
    boolean tms
) {

    public static final int DEFAULT_MIN_ZOOM = 0;
    public static final int DEFAULT_MAX_ZOOM = 22;

    public SourceReference {
        Objects.requireNonNull(id, "source id cannot be null");
        tiles = tiles == null ? List.of() : List.copyOf(tiles);
    }

    /// @return true if the source is made of tiles
    public boolean isTiled() {
        return "vector".equals(type) || "raster".equals(type) || "raster-dem".equals(type);
    }

    /// @return true if tile templates must still be read from a TileJSON document
    public boolean needsTileJson() {
        return isTiled() && tiles.isEmpty() && url != null;
    }

    /// @return true if the source is a GeoJSON document loaded from a URL
    public boolean isGeoJsonUrl() {
        return "geojson".equals(type) && url != null;
    }

    /// @return this source with tile templates and zoom bounds taken from a TileJSON document
    public SourceReference withTileJson(List<String> tileTemplates, int tileJsonMinZoom, int tileJsonMaxZoom,
                                        boolean tileJsonTms) {
        return new SourceReference(id, type, url, tileTemplates, tileJsonMinZoom, tileJsonMaxZoom, tileJsonTms);
    }
}
