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
import io.offlinemaps.api.region.OfflineRegionDefinition;
import io.offlinemaps.api.resource.ResourceKey;
import io.offlinemaps.api.resource.ResourceKind;
import io.offlinemaps.api.resource.ResourceRequest;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/// Unit tests for ManifestBuilder.
public class ManifestBuilderTest {

    private static final String STYLE_URL = "https://maps.test/styles/basic.json";
    private static final String GLYPHS = "https://maps.test/fonts/{fontstack}/{range}.pbf";
    private static final String FONT = "Noto Sans Regular";

    private final ManifestBuilder builder = new ManifestBuilder();

    @Test
    void testWorldRegion() {
        SourceReference base = inlineSource("base", "https://maps.test/tiles/{z}/{x}/{y}.pbf", 0, 14);
        StyleReferences style = new StyleReferences(List.of("https://maps.test/sprites/basic"), GLYPHS,
            Set.of(FONT), List.of(base));

        List<ResourceRequest> manifest = builder.build(region(0, 1, 1.0f, false), style, style.sources());

        assertEquals(ResourceRequest.style(STYLE_URL), manifest.get(0));
        assertEquals(2, count(manifest, ResourceKind.SPRITE));
        assertEquals(174, count(manifest, ResourceKind.GLYPH));
        assertEquals(5, count(manifest, ResourceKind.TILE));
        assertEquals(1 + 2 + 174 + 5, manifest.size());

        Set<String> urls = manifest.stream().map(ResourceRequest::url).collect(Collectors.toSet());
        assertTrue(urls.contains("https://maps.test/sprites/basic.json"));
        assertTrue(urls.contains("https://maps.test/sprites/basic.png"));
        assertTrue(urls.contains("https://maps.test/fonts/Noto%20Sans%20Regular/0-255.pbf"));
        assertFalse(urls.contains("https://maps.test/fonts/Noto%20Sans%20Regular/19968-20223.pbf"));
        assertTrue(urls.contains("https://maps.test/tiles/1/1/0.pbf"));
        assertTrue(manifest.contains(ResourceRequest.tile("base", 1, 1, 1, "https://maps.test/tiles/1/1/1.pbf")));
    }

    @Test
    void testIdeographsAndHighDensity() {
        StyleReferences style = new StyleReferences(List.of("https://maps.test/sprites/basic"), GLYPHS,
            Set.of(FONT, "Noto Sans Bold"), List.of());

        List<ResourceRequest> manifest = builder.build(region(0, 0, 2.0f, true), style, style.sources());

        assertEquals(2 * 256, count(manifest, ResourceKind.GLYPH));
        Set<String> urls = manifest.stream().map(ResourceRequest::url).collect(Collectors.toSet());
        assertTrue(urls.contains("https://maps.test/sprites/basic@2x.json"));
        assertTrue(urls.contains("https://maps.test/sprites/basic@2x.png"));
        assertTrue(urls.contains("https://maps.test/fonts/Noto%20Sans%20Bold/19968-20223.pbf"));
    }

    @Test
    void testSourceDocumentsAndRelativeTiles() {
        SourceReference declared = new SourceReference("t", "vector", "/sources/tiles.json", List.of(), 0, 22, false);
        SourceReference points = new SourceReference("points", "geojson", "data/points.geojson", List.of(), 0, 22,
            false);
        StyleReferences style = new StyleReferences(List.of(), null, Set.of(), List.of(declared, points));
        SourceReference applied = declared.withTileJson(List.of("/tiles/{z}/{x}/{y}.pbf"), 0, 0, false);

        List<ResourceRequest> manifest = builder.build(region(0, 3, 1.0f, false), style, List.of(applied, points));

        assertEquals(List.of(
            ResourceRequest.style(STYLE_URL),
            new ResourceRequest(ResourceKey.sourceMetadata("https://maps.test/sources/tiles.json"),
                "https://maps.test/sources/tiles.json"),
            new ResourceRequest(ResourceKey.sourceMetadata("https://maps.test/styles/data/points.geojson"),
                "https://maps.test/styles/data/points.geojson"),
            ResourceRequest.tile("t", 0, 0, 0, "https://maps.test/tiles/0/0/0.pbf")
        ), manifest);
    }

    @Test
    void testFractionalZoomsAndSourceZoomRange() {
        SourceReference base = inlineSource("base", "https://maps.test/tiles/{z}/{x}/{y}.pbf", 1, 14);
        StyleReferences style = new StyleReferences(List.of(), null, Set.of(), List.of(base));
        OfflineRegionDefinition definition = new OfflineRegionDefinition(LatLngBounds.WORLD, 0.5, 1.2, STYLE_URL,
            1.0f, false);

        List<ResourceRequest> manifest = builder.build(definition, style, style.sources());

        assertEquals(4 + 16, count(manifest, ResourceKind.TILE), "zoom 0 excluded by the source, 2 included");
    }

    @Test
    void testDuplicatesAreRemoved() {
        SourceReference first = inlineSource("base", "https://maps.test/tiles/{z}/{x}/{y}.pbf", 0, 0);
        StyleReferences style = new StyleReferences(
            List.of("https://maps.test/sprites/basic", "https://maps.test/sprites/basic"), null, Set.of(),
            List.of(first, first));

        List<ResourceRequest> manifest = builder.build(region(0, 0, 1.0f, false), style, style.sources());

        assertEquals(4, manifest.size());
        assertEquals(manifest.size(), manifest.stream().map(ResourceRequest::key).distinct().count());
    }

    @Test
    void testTemplatesAreSpreadAcrossHosts() {
        SourceReference sharded = new SourceReference("base", "raster", null,
            List.of("https://a.maps.test/{z}/{x}/{y}.png", "https://b.maps.test/{z}/{x}/{y}.png"), 0, 1, false);
        StyleReferences style = new StyleReferences(List.of(), null, Set.of(), List.of(sharded));

        List<ResourceRequest> manifest = builder.build(region(1, 1, 1.0f, false), style, style.sources());

        Set<String> urls = manifest.stream().map(ResourceRequest::url).collect(Collectors.toSet());
        assertTrue(urls.contains("https://a.maps.test/1/0/0.png"));
        assertTrue(urls.contains("https://b.maps.test/1/0/1.png"));
        assertTrue(urls.contains("https://b.maps.test/1/1/0.png"));
        assertTrue(urls.contains("https://a.maps.test/1/1/1.png"));
    }

    @Test
    void testTileUrlTemplates() {
        assertEquals("1/0/1", ManifestBuilder.tileUrl("{z}/{x}/{y}", 1, 0, 0, true, 1.0f));
        assertEquals("t/0/0/0@2x.png", ManifestBuilder.tileUrl("t/{z}/{x}/{y}{ratio}.png", 0, 0, 0, false, 2.0f));
        assertEquals("t/0/0/0.png", ManifestBuilder.tileUrl("t/{z}/{x}/{y}{ratio}.png", 0, 0, 0, false, 1.0f));
        assertEquals("10/1", ManifestBuilder.tileUrl("{prefix}/{z}", 1, 1, 0, false, 1.0f));
        assertEquals("q/213", ManifestBuilder.tileUrl("q/{quadkey}", 3, 3, 5, false, 1.0f));
    }

    @Test
    void testQuadkey() {
        assertEquals("", ManifestBuilder.quadkey(0, 0, 0));
        assertEquals("213", ManifestBuilder.quadkey(3, 3, 5));
        assertEquals("3", ManifestBuilder.quadkey(1, 1, 1));
    }

    @Test
    void testResolve() {
        String base = "https://a.test/styles/basic.json";
        assertEquals("https://a.test/sources/t.json", ManifestBuilder.resolve(base, "/sources/t.json"));
        assertEquals("https://a.test/styles/sprites/s", ManifestBuilder.resolve(base, "sprites/s"));
        assertEquals("https://b.test/x.json", ManifestBuilder.resolve(base, "https://b.test/x.json"));
        assertEquals("https://a.test/styles/t.json",
            ManifestBuilder.resolve("https://a.test/styles/basic.json?key=1", "t.json"));
        assertEquals("https://a.test/tiles/{z}/{x}/{y}.pbf",
            ManifestBuilder.resolve("https://a.test/sources/t.json", "/tiles/{z}/{x}/{y}.pbf"));
    }

    private static OfflineRegionDefinition region(double minZoom, double maxZoom, float ratio, boolean ideographs) {
        return new OfflineRegionDefinition(LatLngBounds.WORLD, minZoom, maxZoom, STYLE_URL, ratio, ideographs);
    }

    private static SourceReference inlineSource(String id, String template, int minZoom, int maxZoom) {
        return new SourceReference(id, "vector", null, List.of(template), minZoom, maxZoom, false);
    }

    private static long count(List<ResourceRequest> manifest, ResourceKind kind) {
        return manifest.stream().filter(request -> request.key().kind() == kind).count();
    }
}
