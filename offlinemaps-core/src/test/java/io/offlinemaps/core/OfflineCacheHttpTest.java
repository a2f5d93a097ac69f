package io.offlinemaps.core;


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

import io.offlinemaps.api.region.DownloadState;
import io.offlinemaps.api.region.LatLngBounds;
import io.offlinemaps.api.region.OfflineRegion;
import io.offlinemaps.api.region.OfflineRegionDefinition;
import io.offlinemaps.api.region.OfflineRegionStatus;
import io.offlinemaps.api.region.RegionState;
import io.offlinemaps.api.resource.Resource;
import io.offlinemaps.api.resource.ResourceKey;
import io.offlinemaps.core.config.OfflineCacheConfig;
import io.offlinemaps.core.testing.Conditions;
import io.offlinemaps.jetty.testserver.FaultInjectionFilter;
import io.offlinemaps.jetty.testserver.JettyFileServerExtension;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/// End-to-end tests of region downloads over HTTP against the Jetty test server.
@ExtendWith(JettyFileServerExtension.class)
public class OfflineCacheHttpTest {

    @TempDir
    Path storeDir;

    @Test
    void testRegionDownloadOverHttp() throws Exception {
        try (OfflineCache cache = OfflineCache.open(config())) {
            OfflineRegion region = cache.createRegion(worldRegion(), null).get(10, TimeUnit.SECONDS);
            assertEquals(9, region.status().requiredResourceCount(),
                "style, TileJSON, sprite index and image, 5 tiles");

            cache.setRegionState(region.id(), RegionState.ACTIVE).get(10, TimeUnit.SECONDS);
            awaitState(cache, region.id(), DownloadState.COMPLETE);

            OfflineRegionStatus status = cache.getRegionStatus(region.id());
            assertEquals(9, status.completedResourceCount());
            assertEquals(5, status.completedTileCount());
            assertEquals(5 * "tile 0/0/0".length(), status.completedTileSize());
            assertEquals(5, cache.offlineTileCount());
            assertEquals(1, faults().requestCount("/styles/basic.json"));

            Resource style = cache.resolve(ResourceKey.style(JettyFileServerExtension.url("styles/basic.json")))
                .get(10, TimeUnit.SECONDS);
            assertTrue(new String(style.payload(), StandardCharsets.UTF_8).contains("\"sprite\""));
            assertEquals(1, faults().requestCount("/styles/basic.json"), "served from the store");
        }
    }

    @Test
    void testTransientServerErrorsAreRetried() throws Exception {
        faults().failNext("/tiles/1/1/1.pbf", 2, 503);

        try (OfflineCache cache = OfflineCache.open(config())) {
            long id = cache.createRegion(worldRegion(), null).get(10, TimeUnit.SECONDS).id();
            cache.setRegionState(id, RegionState.ACTIVE).get(10, TimeUnit.SECONDS);
            awaitState(cache, id, DownloadState.COMPLETE);

            assertEquals(3, faults().requestCount("/tiles/1/1/1.pbf"));
            assertEquals(0, cache.getRegionStatus(id).erroredResourceCount());
        }
    }

    @Test
    void testMissingResourceCompletesWithErrors() throws Exception {
        faults().failNext("/tiles/1/0/0.pbf", 1, 404);

        try (OfflineCache cache = OfflineCache.open(config())) {
            long id = cache.createRegion(worldRegion(), null).get(10, TimeUnit.SECONDS).id();
            cache.setRegionState(id, RegionState.ACTIVE).get(10, TimeUnit.SECONDS);
            awaitState(cache, id, DownloadState.COMPLETE_WITH_ERRORS);

            OfflineRegionStatus status = cache.getRegionStatus(id);
            assertEquals(1, status.erroredResourceCount());
            assertEquals(8, status.completedResourceCount());
            assertEquals(1, faults().requestCount("/tiles/1/0/0.pbf"));
        }
    }

    private OfflineCacheConfig config() {
        return OfflineCacheConfig.builder(storeDir)
            .maxAttempts(3)
            .initialBackoff(Duration.ZERO)
            .maxBackoff(Duration.ZERO)
            .workerThreads(2)
            .build();
    }

    private static OfflineRegionDefinition worldRegion() {
        return new OfflineRegionDefinition(LatLngBounds.WORLD, 0, 1, JettyFileServerExtension.url("styles/basic.json"),
            1.0f, false);
    }

    private static FaultInjectionFilter faults() {
        return JettyFileServerExtension.getServer().faults();
    }

    private static void awaitState(OfflineCache cache, long id, DownloadState state) {
        Conditions.await("region " + id + " " + state, () -> cache.getRegionStatus(id).downloadState() == state);
    }
}
