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

import java.time.Duration;
import java.util.Objects;

/// Settings shared by every transport created through [ResourceTransports].
///
/// @param accessToken appended as the `access_token` query parameter to remote URLs, or null
/// @param userAgent the user agent sent with remote requests
/// @param connectTimeout connect timeout for remote requests
/// @param readTimeout read timeout for remote requests
public record TransportOptions(String accessToken, String userAgent, Duration connectTimeout, Duration readTimeout) {

    public static final TransportOptions DEFAULTS =
        new TransportOptions(null, "offlinemaps/1.0", Duration.ofSeconds(10), Duration.ofSeconds(30));

    public TransportOptions {
        Objects.requireNonNull(userAgent, "userAgent cannot be null");
        Objects.requireNonNull(connectTimeout, "connectTimeout cannot be null");
        Objects.requireNonNull(readTimeout, "readTimeout cannot be null");
    }

    public TransportOptions withAccessToken(String token) {
        return new TransportOptions(token, userAgent, connectTimeout, readTimeout);
    }
}
