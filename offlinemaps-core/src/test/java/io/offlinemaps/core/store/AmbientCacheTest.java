package io.offlinemaps.core.store;


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

import io.offlinemaps.api.resource.ResourceKey;
import io.offlinemaps.api.resource.ResourceMetadata;
import io.offlinemaps.core.testing.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/// Least-recently-used eviction of unlinked resources.
public class AmbientCacheTest {

    private static final long MIB = 1024 * 1024;

    @TempDir
    Path root;

    private final MutableClock clock = MutableClock.at("2024-05-01T00:00:00Z");

    @Test
    void testStaysWithinMaximumSize() {
        try (ResourceStore store = new ResourceStore(root, 10 * MIB, 6000, clock)) {
            store.open();
            for (int i = 0; i < 12; i++) {
                clock.advance(Duration.ofSeconds(1));
                store.put(key(i), url(i), new byte[(int) MIB], ResourceMetadata.NONE).join();
            }

            assertThat(store.ambientResourceCount()).isEqualTo(10);
            assertThat(store.ambientCacheSize()).isLessThanOrEqualTo(10 * MIB);
            assertThat(store.contains(key(0))).isFalse();
            assertThat(store.contains(key(1))).isFalse();
            for (int i = 2; i < 12; i++) {
                assertThat(store.contains(key(i))).as("resource %d", i).isTrue();
            }
        }
    }

    @Test
    void testReadRefreshesRecency() {
        try (ResourceStore store = new ResourceStore(root, 300, 6000, clock)) {
            store.open();
            for (int i = 0; i < 3; i++) {
                clock.advance(Duration.ofSeconds(1));
                store.put(key(i), url(i), new byte[100], ResourceMetadata.NONE).join();
            }

            clock.advance(Duration.ofSeconds(1));
            assertThat(store.get(key(0))).isPresent();
            clock.advance(Duration.ofSeconds(1));
            store.put(key(3), url(3), new byte[100], ResourceMetadata.NONE).join();

            assertThat(store.contains(key(0))).as("recently read").isTrue();
            assertThat(store.contains(key(1))).as("least recently used").isFalse();
            assertThat(store.contains(key(2))).isTrue();
            assertThat(store.contains(key(3))).isTrue();
        }
    }

    @Test
    void testClearingKeepsLinkedResources() {
        try (ResourceStore store = new ResourceStore(root, 10 * MIB, 6000, clock)) {
            store.open();
            long regionId = store.createRegion(ResourceStoreTest.definition(), null,
                List.of(ResourceStoreTest.tileRequest(0, 0, 0))).join().id();
            ResourceKey tile = ResourceKey.tile("base", 0, 0, 0);
            store.commit(tile, ResourceStoreTest.tileRequest(0, 0, 0).url(), new byte[50], ResourceMetadata.NONE,
                Set.of(regionId), false).join();
            store.put(key(1), url(1), new byte[70], ResourceMetadata.NONE).join();
            store.put(key(2), url(2), new byte[30], ResourceMetadata.NONE).join();

            assertThat(store.clearAmbientCache().join()).isEqualTo(100L);

            assertThat(store.ambientCacheSize()).isZero();
            assertThat(store.contains(tile)).isTrue();
            assertThat(store.contains(key(1))).isFalse();
            assertThat(store.contains(key(2))).isFalse();
        }
    }

    @Test
    void testShrinkingTheMaximumEvicts() {
        try (ResourceStore store = new ResourceStore(root, 10 * MIB, 6000, clock)) {
            store.open();
            for (int i = 0; i < 3; i++) {
                clock.advance(Duration.ofSeconds(1));
                store.put(key(i), url(i), new byte[100], ResourceMetadata.NONE).join();
            }

            store.setMaximumAmbientCacheSize(150).join();

            assertThat(store.maximumAmbientCacheSize()).isEqualTo(150);
            assertThat(store.ambientResourceCount()).isEqualTo(1);
            assertThat(store.contains(key(2))).isTrue();
        }
    }

    @Test
    void testExplicitEviction() {
        try (ResourceStore store = new ResourceStore(root, 10 * MIB, 6000, clock)) {
            store.open();
            for (int i = 0; i < 3; i++) {
                clock.advance(Duration.ofSeconds(1));
                store.put(key(i), url(i), new byte[100], ResourceMetadata.NONE).join();
            }

            assertThat(store.evict(150).join()).isEqualTo(200L);
            assertThat(store.evict(0).join()).isZero();
            assertThat(store.ambientCacheSize()).isEqualTo(100);
        }
    }

    @Test
    void testResourceLargerThanTheCacheIsNotKept() {
        try (ResourceStore store = new ResourceStore(root, 50, 6000, clock)) {
            store.open();

            assertThat(store.put(key(0), url(0), new byte[100], ResourceMetadata.NONE).join().size()).isEqualTo(100);

            assertThat(store.contains(key(0))).isFalse();
            assertThat(store.ambientCacheSize()).isZero();
        }
    }

    @Test
    void testVictimsFollowAccessTimeThenSequence() {
        Instant now = clock.instant();
        AmbientCache cache = new AmbientCache(1000);
        StoredEntry older = entry(0, 3, now.minusSeconds(10), 40);
        StoredEntry sameTimeFirst = entry(1, 1, now, 40);
        StoredEntry sameTimeSecond = entry(2, 2, now, 40);
        cache.add(sameTimeSecond);
        cache.add(older);
        cache.add(sameTimeFirst);

        assertThat(cache.selectVictims(50)).containsExactly(older, sameTimeFirst);
        assertThat(cache.selectVictims(Long.MAX_VALUE)).containsExactly(older, sameTimeFirst, sameTimeSecond);
        assertThat(cache.size()).isEqualTo(120);

        cache.setMaximumSize(100);
        assertThat(cache.excess()).isEqualTo(20);
        cache.remove(older);
        assertThat(cache.excess()).isZero();
        assertThat(cache.count()).isEqualTo(2);
    }

    private static StoredEntry entry(int i, long sequence, Instant accessedAt, long size) {
        return new StoredEntry(key(i), url(i), ResourceMetadata.NONE, size, "00", "p-" + sequence + ".bin", sequence,
            accessedAt, Set.of());
    }

    private static ResourceKey key(int i) {
        return ResourceKey.sprite(url(i));
    }

    private static String url(int i) {
        return "https://maps.test/sprites/" + i + ".png";
    }
}
