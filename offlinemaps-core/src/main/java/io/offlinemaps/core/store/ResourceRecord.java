package io.offlinemaps.core.store;

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

import java.util.List;

/// On-disk commit record of a stored resource. Writing this file commits the resource; its
/// payload file is always written first.
record ResourceRecord(
    int version,
    String key,
    String url,
    String etag,
    String expires,
    String modified,
    long size,
    String sha256,
    String payloadFile,
    long sequence,
    String accessedAt,
    List<Long> regions
) {
}
