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
import io.offlinemaps.api.resource.ResourceMetadata;
import io.offlinemaps.api.transport.FetchRequest;
import io.offlinemaps.api.transport.FetchResponse;
import io.offlinemaps.api.transport.ResourceTransport;
import io.offlinemaps.api.transport.TransportScheme;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;

/// Serves `file://` URLs from the local filesystem.
///
/// Local files carry no expiry, and their modification time is reported as the last-modified
/// validator. A conditional request for an unchanged file answers not-modified. Every
/// failure is permanent: retrying a local read does not help.
@TransportScheme("file")
public class FileResourceTransport implements ResourceTransport {
    private static final Logger logger = LogManager.getLogger(FileResourceTransport.class);

    /// Status reported for files that do not exist
    static final int NOT_FOUND = 404;

    @Override
    public FetchResponse fetch(FetchRequest request) {
        Path path;
        try {
            path = Path.of(URI.create(request.url()));
        } catch (IllegalArgumentException e) {
            throw new NetworkException(request.url(), NetworkException.NO_STATUS, false,
                "not a file url: " + request.url(), e);
        }

        try {
            Instant modified = Files.getLastModifiedTime(path).toInstant();
            if (request.priorModified() != null && !modified.isAfter(request.priorModified())) {
                return FetchResponse.notModified(new ResourceMetadata(null, null, modified));
            }
            byte[] payload = Files.readAllBytes(path);
            logger.debug("read {} bytes from {}", payload.length, path);
            return FetchResponse.ok(payload, new ResourceMetadata(null, null, modified));
        } catch (NoSuchFileException e) {
            throw new NetworkException(request.url(), NOT_FOUND, false, "file not found: " + path, e);
        } catch (IOException e) {
            throw new NetworkException(request.url(), NetworkException.NO_STATUS, false,
                "failed to read " + path + ": " + e.getMessage(), e);
        }
    }
}
