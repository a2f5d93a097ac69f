package io.offlinemaps.core.router;

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
import io.offlinemaps.api.resource.ResourceKey;
import io.offlinemaps.api.resource.ResourceRequest;
import io.offlinemaps.core.download.Downloader;
import io.offlinemaps.core.store.ResourceStore;
import io.offlinemaps.core.store.StoredEntry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/// Resolves resources for consumers: from the store when possible, from the network otherwise.
///
/// | Store state      | Result                                                         |
/// |------------------|----------------------------------------------------------------|
/// | fresh hit        | the cached resource, already completed                         |
/// | stale hit        | the cached resource, already completed, plus a background revalidation |
/// | miss             | the [Downloader]'s shared in-flight fetch                      |
///
/// A stale result is never held back by its revalidation; later calls see the refreshed
/// copy once it is stored.
public class RequestRouter {
    private static final Logger logger = LogManager.getLogger(RequestRouter.class);

    private final ResourceStore store;
    private final Downloader downloader;
    private final Clock clock;

    public RequestRouter(ResourceStore store, Downloader downloader, Clock clock) {
        this.store = store;
        this.downloader = downloader;
        this.clock = clock;
    }

    /// @param request the resource and the URL to fetch it from on a miss
    /// @return a future completing with the resource
    public CompletableFuture<Resource> resolve(ResourceRequest request) {
        Optional<Resource> cached = store.get(request.key());
        if (cached.isEmpty()) {
            logger.trace("miss {}", request.key());
            return downloader.fetch(request);
        }
        Resource resource = cached.get();
        if (resource.isStale(clock.instant())) {
            revalidateInBackground(request, resource);
        }
        return CompletableFuture.completedFuture(resource);
    }

    /// Resolves a key alone. URL-addressed keys fetch from their locator; a tile key can only
    /// be resolved if the tile is stored, because the key does not carry its URL.
    /// @param key the key
    /// @return a future completing with the resource, or failing with
    ///     [IllegalArgumentException] for a tile that is not stored
    public CompletableFuture<Resource> resolve(ResourceKey key) {
        if (key.kind().hasUrlLocator()) {
            return resolve(ResourceRequest.of(key));
        }
        Optional<StoredEntry> entry = store.entry(key);
        if (entry.isEmpty() || entry.get().url() == null) {
            return CompletableFuture.failedFuture(
                new IllegalArgumentException("tile " + key + " is not stored; resolve it with its url"));
        }
        return resolve(new ResourceRequest(key, entry.get().url()));
    }

    private void revalidateInBackground(ResourceRequest request, Resource stale) {
        logger.debug("{} is stale, revalidating", request.key());
        downloader.revalidate(request, stale.metadata()).whenComplete((fresh, error) -> {
            if (error != null) {
                logger.debug("revalidation of {} failed, keeping the stale copy: {}", request.key(),
                    error.getMessage());
            }
        });
    }
}
