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
import io.offlinemaps.api.transport.FetchRequest;
import io.offlinemaps.api.transport.FetchResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class FileResourceTransportTest {

    @TempDir
    Path tempDir;

    private final FileResourceTransport transport = new FileResourceTransport();

    @Test
    void testReadsLocalFile() throws Exception {
        Path style = tempDir.resolve("style.json");
        Files.writeString(style, "{\"version\":8,\"sources\":{}}", StandardCharsets.UTF_8);
        Instant modified = Instant.parse("2024-01-15T10:00:00Z");
        Files.setLastModifiedTime(style, FileTime.from(modified));

        FetchResponse response = transport.fetch(FetchRequest.unconditional(style.toUri().toString(), ResourceKind.STYLE));

        assertFalse(response.notModified());
        assertEquals("{\"version\":8,\"sources\":{}}", new String(response.payload(), StandardCharsets.UTF_8));
        assertEquals(modified, response.metadata().modified());
        assertNull(response.metadata().expires(), "local files never expire");
        assertNull(response.metadata().etag());
    }

    @Test
    void testUnchangedFileIsNotModified() throws Exception {
        Path tile = tempDir.resolve("0.pbf");
        Files.write(tile, new byte[]{1, 2, 3});
        Instant modified = Instant.parse("2024-01-15T10:00:00Z");
        Files.setLastModifiedTime(tile, FileTime.from(modified));
        String url = tile.toUri().toString();

        FetchResponse unchanged = transport.fetch(new FetchRequest(url, ResourceKind.TILE, null, modified));
        assertTrue(unchanged.notModified());

        Files.setLastModifiedTime(tile, FileTime.from(modified.plusSeconds(60)));
        FetchResponse changed = transport.fetch(new FetchRequest(url, ResourceKind.TILE, null, modified));
        assertFalse(changed.notModified());
        assertArrayEquals(new byte[]{1, 2, 3}, changed.payload());
    }

    @Test
    void testMissingFileIsPermanentNotFound() {
        String url = tempDir.resolve("missing.json").toUri().toString();

        NetworkException error = assertThrows(NetworkException.class,
            () -> transport.fetch(FetchRequest.unconditional(url, ResourceKind.STYLE)));
        assertEquals(FileResourceTransport.NOT_FOUND, error.getStatus());
        assertFalse(error.isTransient());
    }

    @Test
    void testOpaqueFileUrlIsRejected() {
        NetworkException error = assertThrows(NetworkException.class,
            () -> transport.fetch(FetchRequest.unconditional("file:style.json", ResourceKind.STYLE)));
        assertFalse(error.isTransient());
    }
}
