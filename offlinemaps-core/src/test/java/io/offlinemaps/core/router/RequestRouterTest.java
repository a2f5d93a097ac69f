package io.offlinemaps.core.router;


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

import io.offlinemaps.api.resource.Resource;
import io.offlinemaps.api.resource.ResourceKey;
import io.offlinemaps.api.resource.ResourceMetadata;
import io.offlinemaps.api.resource.ResourceRequest;
import io.offlinemaps.core.download.Downloader;
import io.offlinemaps.core.download.RetryPolicy;
import io.offlinemaps.core.store.ResourceStore;
import io.offlinemaps.core.testing.Conditions;
import io.offlinemaps.core.testing.FakeTransport;
import io.offlinemaps.core.testing.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/// Tests for cache hits, misses and stale revalidation through the RequestRouter.
public class RequestRouterTest {

    private static final String STYLE_URL = "https://maps.test/styles/basic.json";
    private static final byte[] STYLE = "{\"version\":8}".getBytes(StandardCharsets.UTF_8);

    @TempDir
    Path root;

    private final MutableClock clock = MutableClock.at("2024-05-01T00:00:00Z");
    private final FakeTransport transport = new FakeTransport();
    private ResourceStore store;
    private Downloader downloader;
    private RequestRouter router;

    @BeforeEach
    void setUp() {
        store = new ResourceStore(root, 1024 * 1024, 100, clock);
        store.open();
        downloader = new Downloader(transport, store, 4, 64, new RetryPolicy(3, Duration.ZERO, Duration.ZERO));
        router = new RequestRouter(store, downloader, clock);
    }

    @AfterEach
    void tearDown() {
        transport.release();
        downloader.close();
        store.close();
    }

    @Test
    void testMissThenHit() throws Exception {
        transport.serve(STYLE_URL, STYLE);

        Resource fetched = router.resolve(ResourceRequest.style(STYLE_URL)).get(5, TimeUnit.SECONDS);
        CompletableFuture<Resource> cached = router.resolve(ResourceKey.style(STYLE_URL));

        assertTrue(cached.isDone(), "a hit completes immediately");
        assertArrayEquals(STYLE, fetched.payload());
        assertArrayEquals(STYLE, cached.get().payload());
        assertEquals(1, transport.callCount(STYLE_URL));
    }

    @Test
    void testConcurrentMissesShareOneTransfer() throws Exception {
        transport.serve(STYLE_URL, STYLE);
        transport.hold();

        List<CompletableFuture<Resource>> futures = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            futures.add(router.resolve(ResourceRequest.style(STYLE_URL)));
        }
        assertTrue(transport.awaitFetches(1, 5, TimeUnit.SECONDS));
        transport.release();

        for (CompletableFuture<Resource> future : futures) {
            assertArrayEquals(STYLE, future.get(5, TimeUnit.SECONDS).payload());
        }
        assertEquals(1, transport.callCount(STYLE_URL));
    }

    @Test
    void testStaleHitIsServedAndRevalidated() throws Exception {
        Instant firstExpiry = clock.instant().plusSeconds(60);
        transport.serve(STYLE_URL, STYLE, new ResourceMetadata("\"v1\"", firstExpiry, null));
        router.resolve(ResourceRequest.style(STYLE_URL)).get(5, TimeUnit.SECONDS);

        clock.advance(Duration.ofMinutes(2));
        Instant secondExpiry = clock.instant().plusSeconds(600);
        transport.serve(STYLE_URL, STYLE, new ResourceMetadata("\"v1\"", secondExpiry, null));

        CompletableFuture<Resource> stale = router.resolve(ResourceRequest.style(STYLE_URL));
        assertTrue(stale.isDone(), "a stale hit is not held back by revalidation");
        assertEquals(firstExpiry, stale.get().metadata().expires());

        Conditions.await("revalidated expiry stored",
            () -> secondExpiry.equals(store.entry(ResourceKey.style(STYLE_URL)).orElseThrow().metadata().expires()));
        assertEquals(2, transport.callCount(STYLE_URL));
        assertEquals("\"v1\"", transport.requests().get(1).priorEtag());

        Resource fresh = router.resolve(ResourceRequest.style(STYLE_URL)).get(5, TimeUnit.SECONDS);
        assertArrayEquals(STYLE, fresh.payload());
        assertEquals(2, transport.callCount(STYLE_URL), "fresh copy served without a request");
    }

    @Test
    void testTileKeysNeedAStoredUrl() throws Exception {
        ResourceKey tile = ResourceKey.tile("base", 0, 0, 0);
        String url = "https://maps.test/tiles/0/0/0.pbf";

        ExecutionException thrown = assertThrows(ExecutionException.class,
            () -> router.resolve(tile).get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalArgumentException.class, thrown.getCause());

        transport.serve(url, "tile");
        router.resolve(new ResourceRequest(tile, url)).get(5, TimeUnit.SECONDS);
        Resource resolved = router.resolve(tile).get(5, TimeUnit.SECONDS);
        assertArrayEquals("tile".getBytes(StandardCharsets.UTF_8), resolved.payload());
        assertEquals(1, transport.callCount(url));
    }

    @Test
    void testDamagedPayloadIsFetchedAgain() throws Exception {
        transport.serve(STYLE_URL, STYLE);
        router.resolve(ResourceRequest.style(STYLE_URL)).get(5, TimeUnit.SECONDS);

        for (Path payload : payloadFiles()) {
            Files.writeString(payload, "garbage");
        }

        Resource refetched = router.resolve(ResourceRequest.style(STYLE_URL)).get(5, TimeUnit.SECONDS);
        assertArrayEquals(STYLE, refetched.payload());
        assertEquals(2, transport.callCount(STYLE_URL));
        assertArrayEquals(STYLE, store.get(ResourceKey.style(STYLE_URL)).orElseThrow().payload());
    }

    private List<Path> payloadFiles() throws IOException {
        try (Stream<Path> files = Files.walk(root)) {
            return files.filter(file -> file.toString().endsWith(".bin")).collect(Collectors.toList());
        }
    }
}
