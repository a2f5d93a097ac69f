package io.offlinemaps.api.transport;

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

import io.offlinemaps.api.resource.ResourceMetadata;

import java.util.Objects;

/// The successful outcome of a [ResourceTransport] fetch. Failures are reported by throwing
/// [io.offlinemaps.api.errors.NetworkException].
///
/// @param notModified true if the origin confirmed the cached copy is still current
/// @param payload the response body, empty when `notModified`
/// @param metadata revalidation metadata reported with the response
public record FetchResponse(boolean notModified, byte[] payload, ResourceMetadata metadata) {

    private static final byte[] EMPTY = new byte[0];

    public FetchResponse {
        Objects.requireNonNull(payload, "payload cannot be null");
        metadata = metadata == null ? ResourceMetadata.NONE : metadata;
    }

    public static FetchResponse ok(byte[] payload, ResourceMetadata metadata) {
        return new FetchResponse(false, payload, metadata);
    }

    public static FetchResponse notModified(ResourceMetadata metadata) {
        return new FetchResponse(true, EMPTY, metadata);
    }
}
