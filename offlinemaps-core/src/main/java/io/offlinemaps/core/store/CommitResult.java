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

import io.offlinemaps.api.resource.Resource;

import java.util.Optional;
import java.util.Set;

/// The outcome of committing a fetched resource to the store.
///
/// @param resource the committed resource, or null if it was discarded
/// @param linkedRegions the requested regions the resource is now linked to
/// @param quotaRejected true if the tile count limit prevented linking to the requested regions
/// @param tileCountLimit the limit in force when the commit ran
public record CommitResult(Resource resource, Set<Long> linkedRegions, boolean quotaRejected, long tileCountLimit) {

    public CommitResult {
        linkedRegions = Set.copyOf(linkedRegions);
    }

    public Optional<Resource> stored() {
        return Optional.ofNullable(resource);
    }
}
