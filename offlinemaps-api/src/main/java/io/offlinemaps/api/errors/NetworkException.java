package io.offlinemaps.api.errors;

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

import java.io.IOException;

/// A failure to fetch a resource.
///
/// Each failure is classified as transient or permanent. Transient failures (connection
/// errors, timeouts, HTTP 5xx and 429) may be retried; permanent failures (other HTTP 4xx,
/// malformed responses, missing local files) are terminal for the resource.
public class NetworkException extends OfflineStorageException {
    /// Status value used when no HTTP status was received
    public static final int NO_STATUS = -1;

    private final String url;
    private final int status;
    private final boolean transientFailure;

    public NetworkException(String url, int status, boolean transientFailure, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.status = status;
        this.transientFailure = transientFailure;
    }

    /// Classifies an HTTP error status.
    /// @param url the requested url
    /// @param status the HTTP status code
    /// @param detail optional detail, such as a response body excerpt
    /// @return the classified failure
    public static NetworkException forStatus(String url, int status, String detail) {
        boolean retryable = status >= 500 || status == 429 || status == 408;
        String message = "HTTP " + status + " fetching " + url + (detail == null || detail.isEmpty() ? "" : ": " + detail);
        return new NetworkException(url, status, retryable, message, null);
    }

    /// A connection-level failure, always transient.
    public static NetworkException connectionFailure(String url, IOException cause) {
        return new NetworkException(url, NO_STATUS, true, "I/O error fetching " + url + ": " + cause.getMessage(), cause);
    }

    /// A response that cannot be used, never retried.
    public static NetworkException malformed(String url, String message) {
        return new NetworkException(url, NO_STATUS, false, "malformed response from " + url + ": " + message, null);
    }

    public String getUrl() {
        return url;
    }

    /// @return the HTTP status, or [#NO_STATUS]
    public int getStatus() {
        return status;
    }

    /// @return true if the request may succeed when retried
    public boolean isTransient() {
        return transientFailure;
    }
}
