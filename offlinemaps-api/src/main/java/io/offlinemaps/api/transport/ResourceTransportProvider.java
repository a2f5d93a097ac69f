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

/// Service Provider Interface for creating [ResourceTransport] instances.
///
/// Implementations must have a no-args constructor to be compatible with the Java
/// ServiceLoader mechanism, and should be annotated with [TransportScheme] to declare the
/// URL schemes they handle.
public interface ResourceTransportProvider {

    /// Creates a transport for this provider's schemes.
    /// @param options shared transport settings
    /// @return a new transport
    ResourceTransport createTransport(TransportOptions options);
}
