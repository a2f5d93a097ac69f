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

import io.offlinemaps.api.errors.InvalidRegionDefinitionException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;

/// The client-supplied description of an offline region, persisted with it.
///
/// @param bounds the area to cover
/// @param minZoom the lowest zoom level to download
/// @param maxZoom the highest zoom level to download
/// @param styleUrl the style document the region is rendered with
/// @param pixelRatio the device pixel ratio; ratios above 1 select `@2x` sprites and raster tiles
/// @param includeIdeographs whether glyph ranges for CJK ideographs are downloaded
public record OfflineRegionDefinition(
    LatLngBounds bounds,
    double minZoom,
    double maxZoom,
    String styleUrl,
    float pixelRatio,
    boolean includeIdeographs
) {

    public OfflineRegionDefinition {
        Objects.requireNonNull(bounds, "bounds cannot be null");
    }

    /// Checks that the definition describes a region that can be downloaded.
    /// @param maxSupportedZoom the highest zoom level the cache enumerates tiles for
    /// @throws InvalidRegionDefinitionException if any field is out of range
    public void validate(int maxSupportedZoom) {
        if (!bounds.isValid()) {
            throw new InvalidRegionDefinitionException("invalid bounds: " + bounds);
        }
        if (!Double.isFinite(minZoom) || !Double.isFinite(maxZoom)
            || minZoom < 0 || minZoom > maxZoom || maxZoom > maxSupportedZoom) {
            throw new InvalidRegionDefinitionException(
                "zoom range must satisfy 0 <= minZoom <= maxZoom <= " + maxSupportedZoom
                    + ", got " + minZoom + ".." + maxZoom);
        }
        if (!(pixelRatio > 0) || Float.isInfinite(pixelRatio)) {
            throw new InvalidRegionDefinitionException("pixel ratio must be positive, got " + pixelRatio);
        }
        if (styleUrl == null || styleUrl.isBlank()) {
            throw new InvalidRegionDefinitionException("style url is required");
        }
        try {
            URI uri = new URI(styleUrl);
            if (uri.getScheme() == null) {
                throw new InvalidRegionDefinitionException("style url has no scheme: " + styleUrl);
            }
        } catch (URISyntaxException e) {
            throw new InvalidRegionDefinitionException("malformed style url: " + styleUrl, e);
        }
    }
}
