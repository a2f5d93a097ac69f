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

import io.offlinemaps.api.transport.ResourceTransport;
import io.offlinemaps.api.transport.ResourceTransportProvider;
import io.offlinemaps.api.transport.TransportOptions;
import io.offlinemaps.api.transport.TransportScheme;

/// Provider for `file://` URLs.
@TransportScheme("file")
public class FileTransportProvider implements ResourceTransportProvider {

    /// No-args constructor required for ServiceLoader
    public FileTransportProvider() {
    }

    @Override
    public ResourceTransport createTransport(TransportOptions options) {
        return new FileResourceTransport();
    }
}
