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

import io.offlinemaps.api.errors.NetworkException;

/// Moves resource bytes from an origin to the cache.
///
/// Implementations block the calling thread for the duration of one transfer; the cache's
/// downloader supplies the worker threads and so bounds the number of simultaneous transfers.
/// Implementations must be safe for concurrent use.
public interface ResourceTransport extends AutoCloseable {

    /// Performs one transfer. Retrying is the caller's concern.
    /// @param request what to fetch
    /// @return the response
    /// @throws NetworkException if the transfer failed; [NetworkException#isTransient()]
    ///     tells the caller whether to retry
    FetchResponse fetch(FetchRequest request) throws NetworkException;

    @Override
    default void close() {
    }
}
