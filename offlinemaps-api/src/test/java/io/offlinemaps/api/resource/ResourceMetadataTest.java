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

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class ResourceMetadataTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Test
    void testStaleness() {
        assertFalse(ResourceMetadata.NONE.isStale(NOW), "a resource without expiry is always fresh");
        assertFalse(new ResourceMetadata(null, NOW.plusSeconds(1), null).isStale(NOW));
        assertTrue(new ResourceMetadata(null, NOW, null).isStale(NOW));
        assertTrue(new ResourceMetadata(null, NOW.minusSeconds(60), null).isStale(NOW));
    }

    @Test
    void testValidators() {
        assertFalse(ResourceMetadata.NONE.hasValidators());
        assertTrue(new ResourceMetadata("\"abc\"", null, null).hasValidators());
        assertTrue(new ResourceMetadata(null, null, NOW).hasValidators());
    }

    @Test
    void testRefreshKeepsValidatorsTheResponseOmits() {
        ResourceMetadata cached = new ResourceMetadata("\"v1\"", NOW.minusSeconds(10), NOW.minusSeconds(3600));
        ResourceMetadata refreshed = cached.refreshedBy(new ResourceMetadata(null, NOW.plusSeconds(600), null));

        assertEquals("\"v1\"", refreshed.etag());
        assertEquals(NOW.plusSeconds(600), refreshed.expires());
        assertEquals(NOW.minusSeconds(3600), refreshed.modified());
    }

    @Test
    void testRefreshReplacesExpiry() {
        ResourceMetadata cached = new ResourceMetadata("\"v1\"", NOW.minusSeconds(10), null);
        ResourceMetadata refreshed = cached.refreshedBy(new ResourceMetadata("\"v2\"", null, null));

        assertEquals("\"v2\"", refreshed.etag());
        assertNull(refreshed.expires());
        assertFalse(refreshed.isStale(NOW));
    }

    @Test
    void testResourceEqualityUsesPayloadContents() {
        ResourceKey key = ResourceKey.style("https://maps.test/style.json");
        Resource a = new Resource(key, new byte[]{1, 2, 3}, null, NOW);
        Resource b = new Resource(key, new byte[]{1, 2, 3}, ResourceMetadata.NONE, NOW);

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals(3, a.size());
        assertNotEquals(a, new Resource(key, new byte[]{1, 2}, null, NOW));
    }
}
