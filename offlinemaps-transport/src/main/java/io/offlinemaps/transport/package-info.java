/// Transports that move resource bytes from an origin into the offline cache.
///
/// Both providers are registered with ServiceLoader and selected by URL scheme through
/// [io.offlinemaps.api.transport.ResourceTransports]:
/// - [io.offlinemaps.transport.HttpResourceTransport] for `http` and `https`
/// - [io.offlinemaps.transport.FileResourceTransport] for `file`
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

