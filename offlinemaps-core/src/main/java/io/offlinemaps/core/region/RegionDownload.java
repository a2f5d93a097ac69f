package io.offlinemaps.core.region;

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

import io.offlinemaps.api.errors.QuotaExceededException;
import io.offlinemaps.api.region.DownloadState;
import io.offlinemaps.api.resource.Resource;
import io.offlinemaps.api.resource.ResourceKey;
import io.offlinemaps.api.resource.ResourceRequest;
import io.offlinemaps.core.download.Downloader;
import io.offlinemaps.core.store.ResourceStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/// One activation of an offline region: walks the manifest, linking resources already in the
/// store and fetching the rest, with at most `window` operations outstanding.
///
/// Entries already linked to the region are skipped, so a resumed download never stores a
/// completed resource twice. A failed resource is counted and the walk continues; reaching
/// the tile count limit halts the whole download.
final class RegionDownload {
    private static final Logger logger = LogManager.getLogger(RegionDownload.class);

    private final long regionId;
    private final RegionManager manager;
    private final ResourceStore store;
    private final Downloader downloader;
    private final Iterator<ResourceRequest> pending;
    private final int window;
    private final Set<CompletableFuture<?>> outstanding = new HashSet<>();

    private volatile DownloadState state = DownloadState.DOWNLOADING;
    private volatile long erroredCount;
    private boolean stopped;
    private boolean pumping;
    private boolean pumpAgain;

    RegionDownload(long regionId, RegionManager manager, ResourceStore store, Downloader downloader,
                   List<ResourceRequest> manifest, int window) {
        this.regionId = regionId;
        this.manager = manager;
        this.store = store;
        this.downloader = downloader;
        this.pending = List.copyOf(manifest).iterator();
        this.window = window;
    }

    DownloadState state() {
        return state;
    }

    long erroredCount() {
        return erroredCount;
    }

    void start() {
        logger.info("region {} download started", regionId);
        pump();
    }

    /// Stops the download, cancelling outstanding fetches. Resources already linked stay.
    void stop() {
        List<CompletableFuture<?>> cancelled;
        synchronized (this) {
            if (stopped) {
                return;
            }
            stopped = true;
            state = DownloadState.INACTIVE;
            cancelled = List.copyOf(outstanding);
            outstanding.clear();
        }
        cancelled.forEach(future -> future.cancel(false));
        logger.info("region {} download stopped, {} fetches cancelled", regionId, cancelled.size());
    }

    private void pump() {
        synchronized (this) {
            if (pumping) {
                pumpAgain = true;
                return;
            }
            pumping = true;
        }
        try {
            do {
                issueWithinWindow();
            } while (continuePumping());
        } catch (RuntimeException e) {
            synchronized (this) {
                pumping = false;
            }
            throw e;
        }
        completeIfDrained();
    }

    private synchronized boolean continuePumping() {
        if (pumpAgain) {
            pumpAgain = false;
            return true;
        }
        pumping = false;
        return false;
    }

    private void issueWithinWindow() {
        while (true) {
            ResourceRequest request;
            synchronized (this) {
                if (stopped || outstanding.size() >= window || !pending.hasNext()) {
                    return;
                }
                request = pending.next();
            }
            if (store.isLinked(regionId, request.key())) {
                continue;
            }
            CompletableFuture<?> operation = linkOrFetch(request);
            synchronized (this) {
                if (stopped) {
                    operation.cancel(false);
                    return;
                }
                outstanding.add(operation);
            }
            operation.whenComplete((result, error) -> onResolved(request.key(), operation, error));
        }
    }

    /// Links a stored resource, or fetches it when it is missing. Cancelling the returned
    /// future also cancels a fetch it started.
    private CompletableFuture<?> linkOrFetch(ResourceRequest request) {
        if (!store.contains(request.key())) {
            return downloader.fetchForRegion(request, regionId);
        }
        CompletableFuture<Resource> operation = new CompletableFuture<>();
        store.link(regionId, request.key()).whenComplete((linked, error) -> {
            if (error != null) {
                operation.completeExceptionally(error);
            } else if (linked) {
                operation.complete(null);
            } else if (!operation.isDone()) {
                CompletableFuture<Resource> fetch = downloader.fetchForRegion(request, regionId);
                operation.whenComplete((resource, failure) -> {
                    if (operation.isCancelled()) {
                        fetch.cancel(false);
                    }
                });
                fetch.whenComplete((resource, failure) -> {
                    if (failure != null) {
                        operation.completeExceptionally(failure);
                    } else {
                        operation.complete(resource);
                    }
                });
            }
        });
        return operation;
    }

    private void onResolved(ResourceKey key, CompletableFuture<?> operation, Throwable error) {
        synchronized (this) {
            if (!outstanding.remove(operation) || stopped) {
                return;
            }
        }
        if (error != null) {
            Throwable cause = unwrap(error);
            if (cause instanceof QuotaExceededException) {
                haltForQuota((QuotaExceededException) cause);
                return;
            }
            if (cause instanceof CancellationException) {
                logger.debug("fetch of {} for region {} was cancelled", key, regionId);
            }
            logger.debug("region {} resource {} failed: {}", regionId, key, cause.getMessage());
            synchronized (this) {
                // submitted under the lock so the store sees the counts in order
                manager.recordError(regionId, ++erroredCount);
            }
            manager.publishError(regionId, key, cause);
        }
        manager.publishStatus(regionId);
        pump();
    }

    private void completeIfDrained() {
        synchronized (this) {
            if (stopped || !outstanding.isEmpty() || pending.hasNext()) {
                return;
            }
            stopped = true;
            state = erroredCount > 0 ? DownloadState.COMPLETE_WITH_ERRORS : DownloadState.COMPLETE;
        }
        logger.info("region {} download finished: {} ({} errored)", regionId, state, erroredCount);
        manager.publishStatus(regionId);
    }

    private void haltForQuota(QuotaExceededException error) {
        List<CompletableFuture<?>> cancelled;
        synchronized (this) {
            if (stopped) {
                return;
            }
            stopped = true;
            state = DownloadState.QUOTA_EXCEEDED;
            cancelled = List.copyOf(outstanding);
            outstanding.clear();
        }
        cancelled.forEach(future -> future.cancel(false));
        logger.warn("region {} download halted: tile count limit of {} reached", regionId,
            error.getTileCountLimit());
        manager.publishQuotaExceeded(regionId, error.getTileCountLimit());
        manager.publishStatus(regionId);
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
