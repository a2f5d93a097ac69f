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

import io.offlinemaps.api.region.OfflineRegionDefinition;
import io.offlinemaps.api.resource.ResourceKey;
import io.offlinemaps.api.resource.ResourceRequest;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Enumerates every resource an offline region requires.
///
/// The manifest lists, in order and without duplicates:
///
/// 1. the style document
/// 2. the TileJSON or GeoJSON document of each source given by URL
/// 3. the sprite index and image for the region's pixel ratio
/// 4. every 256-code-point glyph range of every font stack, skipping CJK unified ideographs
///    unless the definition includes them
/// 5. for each tiled source, every tile intersecting the bounds at each zoom level from
///    `floor(minZoom)` to `ceil(maxZoom)`, clamped to the zoom range the source provides
public class ManifestBuilder {

    /// Number of code points covered by one glyph range
    public static final int GLYPH_RANGE_SIZE = 256;
    private static final int GLYPH_RANGE_COUNT = 256;
    private static final int IDEOGRAPH_FIRST = 0x4E00;
    private static final int IDEOGRAPH_LAST = 0x9FFF;

    /// Builds the manifest.
    /// @param definition the validated region definition
    /// @param style references read from the style document
    /// @param sources the style's sources with TileJSON already applied
    /// @return the required resources
    public List<ResourceRequest> build(OfflineRegionDefinition definition, StyleReferences style,
                                       List<SourceReference> sources) {
        Map<ResourceKey, ResourceRequest> manifest = new LinkedHashMap<>();
        add(manifest, ResourceRequest.style(definition.styleUrl()));

        for (SourceReference source : style.sources()) {
            if (source.url() != null && (source.isTiled() || source.isGeoJsonUrl())) {
                String url = resolve(definition.styleUrl(), source.url());
                add(manifest, new ResourceRequest(ResourceKey.sourceMetadata(url), url));
            }
        }

        String ratioSuffix = definition.pixelRatio() > 1.0f ? "@2x" : "";
        for (String sprite : style.sprites()) {
            String base = resolve(definition.styleUrl(), sprite);
            for (String extension : List.of(".json", ".png")) {
                String url = withSuffix(base, ratioSuffix + extension);
                add(manifest, new ResourceRequest(ResourceKey.sprite(url), url));
            }
        }

        if (style.glyphs() != null) {
            for (String fontStack : style.fontStacks()) {
                for (int range = 0; range < GLYPH_RANGE_COUNT; range++) {
                    int first = range * GLYPH_RANGE_SIZE;
                    int last = first + GLYPH_RANGE_SIZE - 1;
                    if (!definition.includeIdeographs() && first <= IDEOGRAPH_LAST && last >= IDEOGRAPH_FIRST) {
                        continue;
                    }
                    String url = resolve(definition.styleUrl(), style.glyphs()
                        .replace("{fontstack}", encodeFontStack(fontStack))
                        .replace("{range}", first + "-" + last));
                    add(manifest, new ResourceRequest(ResourceKey.glyph(url), url));
                }
            }
        }

        int regionMinZoom = (int) Math.floor(definition.minZoom());
        int regionMaxZoom = (int) Math.ceil(definition.maxZoom());
        for (SourceReference source : sources) {
            if (!source.isTiled() || source.tiles().isEmpty()) {
                continue;
            }
            String base = source.url() != null ? resolve(definition.styleUrl(), source.url()) : definition.styleUrl();
            int minZoom = Math.max(regionMinZoom, source.minZoom());
            int maxZoom = Math.min(regionMaxZoom, source.maxZoom());
            for (int z = minZoom; z <= maxZoom; z++) {
                TileCover.TileRange range = TileCover.range(definition.bounds(), z);
                for (int x = range.minX(); x <= range.maxX(); x++) {
                    for (int y = range.minY(); y <= range.maxY(); y++) {
                        String template = source.tiles().get(Math.floorMod(x + y, source.tiles().size()));
                        String url = resolve(base, tileUrl(template, z, x, y, source.tms(), definition.pixelRatio()));
                        add(manifest, ResourceRequest.tile(source.id(), z, x, y, url));
                    }
                }
            }
        }
        return new ArrayList<>(manifest.values());
    }

    /// Expands a tile URL template.
    static String tileUrl(String template, int z, int x, int y, boolean tms, float pixelRatio) {
        int row = tms ? (1 << z) - 1 - y : y;
        return template
            .replace("{z}", Integer.toString(z))
            .replace("{x}", Integer.toString(x))
            .replace("{y}", Integer.toString(row))
            .replace("{ratio}", pixelRatio > 1.0f ? "@2x" : "")
            .replace("{prefix}", Integer.toHexString(x % 16) + Integer.toHexString(row % 16))
            .replace("{quadkey}", quadkey(z, x, row));
    }

    static String quadkey(int z, int x, int y) {
        StringBuilder key = new StringBuilder(z);
        for (int i = z; i > 0; i--) {
            int digit = 0;
            int mask = 1 << (i - 1);
            if ((x & mask) != 0) {
                digit += 1;
            }
            if ((y & mask) != 0) {
                digit += 2;
            }
            key.append(digit);
        }
        return key.toString();
    }

    /// Resolves a possibly relative reference against the URL of the document containing it.
    /// Templates are handled as plain strings because their placeholders are not valid URI
    /// characters.
    public static String resolve(String base, String reference) {
        if (reference.contains("://")) {
            return reference;
        }
        int schemeEnd = base.indexOf("://");
        if (schemeEnd < 0) {
            return reference;
        }
        if (reference.startsWith("/")) {
            int pathStart = base.indexOf('/', schemeEnd + 3);
            return (pathStart < 0 ? base : base.substring(0, pathStart)) + reference;
        }
        int query = base.indexOf('?');
        String path = query < 0 ? base : base.substring(0, query);
        return path.substring(0, path.lastIndexOf('/') + 1) + reference;
    }

    private static String withSuffix(String url, String suffix) {
        int query = url.indexOf('?');
        return query < 0 ? url + suffix : url.substring(0, query) + suffix + url.substring(query);
    }

    private static String encodeFontStack(String fontStack) {
        return URLEncoder.encode(fontStack, StandardCharsets.UTF_8).replace("+", "%20").replace("%2C", ",");
    }

    private static void add(Map<ResourceKey, ResourceRequest> manifest, ResourceRequest request) {
        manifest.putIfAbsent(request.key(), request);
    }
}
