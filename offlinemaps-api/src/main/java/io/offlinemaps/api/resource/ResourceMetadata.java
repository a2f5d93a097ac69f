package io.offlinemaps.api.resource;

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

import java.time.Instant;

/// Revalidation metadata for a cached resource. Every field is optional.
///
/// @param etag the entity tag reported by the origin, or null
/// @param expires the instant after which the resource is stale, or null if it never expires
/// @param modified the origin's last-modified time, or null
public record ResourceMetadata(String etag, Instant expires, Instant modified) {

    /// Metadata with no validators and no expiry.
    public static final ResourceMetadata NONE = new ResourceMetadata(null, null, null);

    /// A resource without an expiry is never stale.
    /// @param now the current time
    /// @return true if the resource has expired at `now`
    public boolean isStale(Instant now) {
        return expires != null && !now.isBefore(expires);
    }

    /// @return true if a conditional request can be made with these validators
    public boolean hasValidators() {
        return etag != null || modified != null;
    }

    /// Merges the metadata of a `304 Not Modified` response into this metadata. Fields the
    /// response omits keep their prior values.
    /// @param update metadata reported with the not-modified response
    /// @return the merged metadata
    public ResourceMetadata refreshedBy(ResourceMetadata update) {
        return new ResourceMetadata(
            update.etag != null ? update.etag : etag,
            update.expires,
            update.modified != null ? update.modified : modified
        );
    }
}
