package io.offlinemaps.jetty.testserver;


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

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class JettyFileServerFixtureTest {

    @TempDir
    Path tempDir;

    private final OkHttpClient client = new OkHttpClient();
    private JettyFileServerFixture fixture;

    @BeforeEach
    void setUp() throws IOException {
        Files.createDirectories(tempDir.resolve("styles"));
        Files.writeString(tempDir.resolve("styles/basic.json"), "{\"version\":8}");
        fixture = new JettyFileServerFixture(tempDir);
        fixture.start();
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void testServesFilesWithValidators() throws IOException {
        try (Response response = get("styles/basic.json")) {
            assertEquals(200, response.code());
            assertEquals("{\"version\":8}", response.body().string());
            assertNotNull(response.header("ETag"));
            assertTrue(response.header("Cache-Control", "").contains("max-age=3600"));
        }
        assertEquals(1, fixture.faults().requestCount("/styles/basic.json"));
    }

    @Test
    void testEtagRevalidation() throws IOException {
        String etag;
        try (Response response = get("styles/basic.json")) {
            etag = response.header("ETag");
        }
        Request conditional = new Request.Builder()
            .url(fixture.url("styles/basic.json"))
            .header("If-None-Match", etag)
            .build();
        try (Response response = client.newCall(conditional).execute()) {
            assertEquals(304, response.code());
        }
    }

    @Test
    void testScriptedFaultsAreConsumed() throws IOException {
        fixture.faults().failNext("/styles/basic.json", 2, 503);

        try (Response response = get("styles/basic.json")) {
            assertEquals(503, response.code());
        }
        try (Response response = get("styles/basic.json")) {
            assertEquals(503, response.code());
        }
        try (Response response = get("styles/basic.json")) {
            assertEquals(200, response.code());
        }
        assertEquals(3, fixture.faults().requestCount("/styles/basic.json"));

        fixture.faults().reset();
        assertEquals(0, fixture.faults().requestCount("/styles/basic.json"));
    }

    @Test
    void testMissingFile() throws IOException {
        try (Response response = get("tiles/0/0/0.pbf")) {
            assertEquals(404, response.code());
        }
    }

    @Test
    void testUrlsResolveAgainstBase() {
        assertTrue(fixture.getBaseUrl().toString().endsWith("/"));
        assertEquals(fixture.getBaseUrl() + "styles/basic.json", fixture.url("styles/basic.json").toString());
        assertEquals(tempDir.toAbsolutePath(), fixture.getRootDirectory());
    }

    @Test
    void testMissingRootDirectory() {
        assertThrows(UncheckedIOException.class, () -> new JettyFileServerFixture(tempDir.resolve("absent")));
    }

    private Response get(String path) throws IOException {
        return client.newCall(new Request.Builder().url(fixture.url(path)).build()).execute();
    }
}
