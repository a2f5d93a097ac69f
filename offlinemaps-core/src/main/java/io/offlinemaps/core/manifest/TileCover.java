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

import io.offlinemaps.api.region.LatLngBounds;

/// Web Mercator tile arithmetic.
public final class TileCover {

    /// Latitude limit of the Web Mercator projection
    public static final double MAX_LATITUDE = 85.051128779806604;

    private TileCover() {
    }

    /// The block of tiles covering a bounding box at one zoom level.
    ///
    /// @param z zoom level
    /// @param minX first column
    /// @param maxX last column, inclusive
    /// @param minY first row (northmost)
    /// @param maxY last row (southmost), inclusive
    public record TileRange(int z, int minX, int maxX, int minY, int maxY) {

        public long count() {
            return (long) (maxX - minX + 1) * (maxY - minY + 1);
        }

        public boolean contains(int x, int y) {
            return x >= minX && x <= maxX && y >= minY && y <= maxY;
        }
    }

    /// @param bounds a valid bounding box
    /// @param z zoom level
    /// @return the tiles intersecting `bounds` at `z`
    public static TileRange range(LatLngBounds bounds, int z) {
        if (z < 0 || z > 30) {
            throw new IllegalArgumentException("zoom out of range: " + z);
        }
        int minX = column(bounds.minLon(), z);
        int maxX = column(bounds.maxLon(), z);
        int minY = row(bounds.maxLat(), z);
        int maxY = row(bounds.minLat(), z);
        return new TileRange(z, minX, maxX, minY, maxY);
    }

    /// @return the number of tiles intersecting `bounds` over the inclusive zoom range
    public static long count(LatLngBounds bounds, int minZoom, int maxZoom) {
        long total = 0;
        for (int z = minZoom; z <= maxZoom; z++) {
            total += range(bounds, z).count();
        }
        return total;
    }

    static int column(double lon, int z) {
        int tiles = 1 << z;
        int x = (int) Math.floor((lon + 180.0) / 360.0 * tiles);
        return clamp(x, tiles);
    }

    static int row(double lat, int z) {
        int tiles = 1 << z;
        double clamped = Math.max(-MAX_LATITUDE, Math.min(MAX_LATITUDE, lat));
        double radians = Math.toRadians(clamped);
        double projected = (1.0 - Math.log(Math.tan(radians) + 1.0 / Math.cos(radians)) / Math.PI) / 2.0;
        return clamp((int) Math.floor(projected * tiles), tiles);
    }

    private static int clamp(int index, int tiles) {
        return Math.max(0, Math.min(tiles - 1, index));
    }
}
