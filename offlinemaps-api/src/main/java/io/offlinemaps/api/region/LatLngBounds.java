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

/// A geographic bounding box in degrees.
///
/// @param minLat southern edge
/// @param minLon western edge
/// @param maxLat northern edge
/// @param maxLon eastern edge
public record LatLngBounds(double minLat, double minLon, double maxLat, double maxLon) {

    /// The whole world, as far as Web Mercator can represent it.
    public static final LatLngBounds WORLD = new LatLngBounds(-90, -180, 90, 180);

    /// @return true if the edges are finite, ordered, and within geographic range
    public boolean isValid() {
        return Double.isFinite(minLat) && Double.isFinite(minLon)
            && Double.isFinite(maxLat) && Double.isFinite(maxLon)
            && minLat <= maxLat && minLon <= maxLon
            && minLat >= -90 && maxLat <= 90
            && minLon >= -180 && maxLon <= 180;
    }
}
