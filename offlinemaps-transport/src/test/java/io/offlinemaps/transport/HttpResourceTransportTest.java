package io.offlinemaps.transport;


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

import io.offlinemaps.api.errors.NetworkException;
import io.offlinemaps.api.resource.ResourceKind;
import io.offlinemaps.api.resource.ResourceMetadata;
import io.offlinemaps.api.transport.FetchRequest;
import io.offlinemaps.api.transport.FetchResponse;
import io.offlinemaps.api.transport.TransportOptions;
import io.offlinemaps.jetty.testserver.JettyFileServerExtension;
import io.offlinemaps.jetty.testserver.JettyFileServerFixture;
import okhttp3.HttpUrl;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.nio.file.Files;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/// Tests for HttpResourceTransport against the Jetty test server.
@ExtendWith(JettyFileServerExtension.class)
public class HttpResourceTransportTest {

    private static final Instant NOW = Instant.parse("2024-06-01T08:00:00Z");

    private JettyFileServerFixture server;
    private HttpResourceTransport transport;

    @BeforeEach
    void setUp() {
        server = JettyFileServerExtension.getServer();
        transport = new HttpResourceTransport(TransportOptions.DEFAULTS, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        transport.close();
    }

    @Test
    void testFetchReturnsPayloadAndMetadata() throws Exception {
        String url = JettyFileServerExtension.url("styles/basic.json");
        FetchResponse response = transport.fetch(FetchRequest.unconditional(url, ResourceKind.STYLE));

        assertFalse(response.notModified());
        assertArrayEquals(Files.readAllBytes(server.getRootDirectory().resolve("styles/basic.json")),
            response.payload());
        ResourceMetadata metadata = response.metadata();
        assertNotNull(metadata.etag(), "the test server sends entity tags");
        assertNotNull(metadata.modified());
        assertEquals(NOW.plusSeconds(3600), metadata.expires(), "expiry comes from Cache-Control max-age");
        assertEquals(1, server.faults().requestCount("/styles/basic.json"));
    }

    @Test
    void testBinaryPayload() throws Exception {
        String url = JettyFileServerExtension.url("tiles/0/0/0.pbf");
        FetchResponse response = transport.fetch(FetchRequest.unconditional(url, ResourceKind.TILE));

        assertArrayEquals(Files.readAllBytes(server.getRootDirectory().resolve("tiles/0/0/0.pbf")),
            response.payload());
    }

    @Test
    void testConditionalRequestWithMatchingEtag() {
        String url = JettyFileServerExtension.url("styles/basic.json");
        FetchResponse first = transport.fetch(FetchRequest.unconditional(url, ResourceKind.STYLE));

        FetchResponse second = transport.fetch(FetchRequest.revalidate(url, ResourceKind.STYLE, first.metadata()));

        assertTrue(second.notModified());
        assertEquals(0, second.payload().length);
    }

    @Test
    void testServerErrorIsTransient() {
        server.faults().failNext("/styles/basic.json", 1, 503);
        String url = JettyFileServerExtension.url("styles/basic.json");

        NetworkException error = assertThrows(NetworkException.class,
            () -> transport.fetch(FetchRequest.unconditional(url, ResourceKind.STYLE)));
        assertTrue(error.isTransient());
        assertEquals(503, error.getStatus());

        // the fault is consumed, the next request succeeds
        assertFalse(transport.fetch(FetchRequest.unconditional(url, ResourceKind.STYLE)).notModified());
        assertEquals(2, server.faults().requestCount("/styles/basic.json"));
    }

    @Test
    void testMissingResourceIsPermanent() {
        String url = JettyFileServerExtension.url("tiles/9/9/9.pbf");

        NetworkException error = assertThrows(NetworkException.class,
            () -> transport.fetch(FetchRequest.unconditional(url, ResourceKind.TILE)));
        assertFalse(error.isTransient());
        assertEquals(404, error.getStatus());
        assertEquals(url, error.getUrl());
    }

    @Test
    void testConnectionRefusedIsTransient() {
        NetworkException error = assertThrows(NetworkException.class,
            () -> transport.fetch(FetchRequest.unconditional("http://127.0.0.1:1/style.json", ResourceKind.STYLE)));
        assertTrue(error.isTransient());
        assertEquals(NetworkException.NO_STATUS, error.getStatus());
    }

    @Test
    void testAccessTokenIsAppended() {
        try (HttpResourceTransport withToken =
                 new HttpResourceTransport(TransportOptions.DEFAULTS.withAccessToken("pk.secret"))) {
            HttpUrl url = withToken.requestUrl("https://maps.test/styles/basic.json?lang=en");
            assertEquals("pk.secret", url.queryParameter("access_token"));
            assertEquals("en", url.queryParameter("lang"));

            HttpUrl explicit = withToken.requestUrl("https://maps.test/styles/basic.json?access_token=other");
            assertEquals("other", explicit.queryParameter("access_token"));
            assertEquals(1, explicit.queryParameterValues("access_token").size());
        }
        assertNull(transport.requestUrl("https://maps.test/a.json").queryParameter("access_token"));
    }

    @Test
    void testNonHttpUrlIsMalformed() {
        NetworkException error = assertThrows(NetworkException.class, () -> transport.requestUrl("ftp://maps.test/a"));
        assertFalse(error.isTransient());
    }

    @Test
    void testClosedTransportRefusesRequests() {
        transport.close();
        String url = JettyFileServerExtension.url("styles/basic.json");
        assertThrows(IllegalStateException.class,
            () -> transport.fetch(FetchRequest.unconditional(url, ResourceKind.STYLE)));
    }
}
