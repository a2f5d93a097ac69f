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

import io.offlinemaps.api.errors.InvalidRegionDefinitionException;
import io.offlinemaps.api.errors.RegionNotFoundException;
import io.offlinemaps.api.errors.RegionStateException;
import io.offlinemaps.api.region.DownloadState;
import io.offlinemaps.api.region.OfflineRegion;
import io.offlinemaps.api.region.OfflineRegionDefinition;
import io.offlinemaps.api.region.OfflineRegionObserver;
import io.offlinemaps.api.region.OfflineRegionStatus;
import io.offlinemaps.api.region.RegionState;
import io.offlinemaps.api.resource.Resource;
import io.offlinemaps.api.resource.ResourceKey;
import io.offlinemaps.api.resource.ResourceRequest;
import io.offlinemaps.core.download.Downloader;
import io.offlinemaps.core.manifest.ManifestBuilder;
import io.offlinemaps.core.manifest.SourceReference;
import io.offlinemaps.core.manifest.StyleReferenceReader;
import io.offlinemaps.core.manifest.StyleReferences;
import io.offlinemaps.core.router.RequestRouter;
import io.offlinemaps.core.store.ResourceStore;
import io.offlinemaps.core.store.StoredRegion;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/// Creates, lists, activates, deactivates and deletes offline regions, and reports download
/// progress to registered observers.
///
/// Observers are notified through the [Executor] supplied with them, at least once per
/// resolved or failed resource and once when a download reaches a terminal state. Delivery
/// is at-least-once; the completed counters in each status only ever grow during a download,
/// so observers can discard stale notifications by comparing them.
public class RegionManager implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(RegionManager.class);

    private record ObserverBinding(OfflineRegionObserver observer, Executor executor) {
    }

    private final ResourceStore store;
    private final Downloader downloader;
    private final RequestRouter router;
    private final StyleReferenceReader styleReader;
    private final ManifestBuilder manifestBuilder;
    private final int maxZoom;
    private final int fetchWindow;
    private final Map<Long, RegionDownload> downloads = new ConcurrentHashMap<>();
    private final Map<Long, ObserverBinding> observers = new ConcurrentHashMap<>();

    public RegionManager(
        ResourceStore store,
        Downloader downloader,
        RequestRouter router,
        StyleReferenceReader styleReader,
        ManifestBuilder manifestBuilder,
        int maxZoom,
        int fetchWindow
    ) {
        if (fetchWindow < 1) {
            throw new IllegalArgumentException("fetch window must be at least 1, got " + fetchWindow);
        }
        this.store = store;
        this.downloader = downloader;
        this.router = router;
        this.styleReader = styleReader;
        this.manifestBuilder = manifestBuilder;
        this.maxZoom = maxZoom;
        this.fetchWindow = fetchWindow;
    }

    /// Creates an inactive region.
    ///
    /// The definition is validated before anything else happens. The style and the TileJSON
    /// documents it references are then resolved, through the ambient cache, to enumerate the
    /// manifest.
    ///
    /// @param definition the region definition
    /// @param metadata opaque application metadata
    /// @return a future completing with the new region
    /// @throws InvalidRegionDefinitionException if the definition is invalid
    public CompletableFuture<OfflineRegion> createRegion(OfflineRegionDefinition definition, byte[] metadata) {
        Objects.requireNonNull(definition, "definition cannot be null");
        definition.validate(maxZoom);
        return router.resolve(ResourceRequest.style(definition.styleUrl()))
            .thenCompose(style -> enumerate(definition, style))
            .thenCompose(manifest -> store.createRegion(definition, metadata, manifest))
            .thenApply(this::toRegion);
    }

    /// @return every region, ordered by creation time
    public List<OfflineRegion> listRegions() {
        return store.regions().stream().map(this::toRegion).collect(Collectors.toList());
    }

    /// @throws RegionNotFoundException if the region does not exist
    public OfflineRegion getRegion(long regionId) {
        return toRegion(requireRegion(regionId));
    }

    /// @throws RegionNotFoundException if the region does not exist
    public OfflineRegionStatus getRegionStatus(long regionId) {
        return statusOf(requireRegion(regionId));
    }

    /// Deletes an inactive region, releasing its resources to the ambient cache.
    /// @throws RegionStateException if the region is active
    /// @throws RegionNotFoundException if the region does not exist
    public synchronized CompletableFuture<Void> deleteRegion(long regionId) {
        StoredRegion region = requireRegion(regionId);
        RegionDownload download = downloads.get(regionId);
        boolean downloading = download != null && download.state() == DownloadState.DOWNLOADING;
        if (region.state() == RegionState.ACTIVE || downloading) {
            throw new RegionStateException(regionId, RegionState.ACTIVE, "deactivate it before deleting it");
        }
        downloads.remove(regionId);
        return store.deleteRegion(regionId).thenRun(() -> observers.remove(regionId));
    }

    /// Activates or deactivates a region.
    ///
    /// Activation downloads every manifest entry not yet linked to the region, resetting the
    /// errored count of any previous activation. Deactivation cancels this region's
    /// outstanding fetches; everything already linked is kept.
    ///
    /// @return a future completing with the region after the state change is persisted
    /// @throws RegionNotFoundException if the region does not exist
    public synchronized CompletableFuture<OfflineRegion> setRegionState(long regionId, RegionState state) {
        Objects.requireNonNull(state, "state cannot be null");
        requireRegion(regionId);
        if (state == RegionState.ACTIVE) {
            return activate(regionId);
        }
        RegionDownload download = downloads.remove(regionId);
        if (download != null) {
            download.stop();
        }
        return store.updateRegionState(regionId, RegionState.INACTIVE).thenApply(region -> {
            logger.info("region {} deactivated", regionId);
            publishStatus(regionId);
            return toRegion(region);
        });
    }

    /// Replaces a region's application metadata.
    /// @throws RegionNotFoundException if the region does not exist
    public CompletableFuture<OfflineRegion> updateRegionMetadata(long regionId, byte[] metadata) {
        requireRegion(regionId);
        return store.updateRegionMetadata(regionId, metadata).thenApply(this::toRegion);
    }

    /// Registers the observer of a region, replacing any previous one. A null observer
    /// removes the registration.
    /// @param regionId the region
    /// @param observer the observer, or null
    /// @param executor the executor observer callbacks run on
    /// @throws RegionNotFoundException if the region does not exist
    public void setRegionObserver(long regionId, OfflineRegionObserver observer, Executor executor) {
        requireRegion(regionId);
        if (observer == null) {
            observers.remove(regionId);
            return;
        }
        observers.put(regionId, new ObserverBinding(observer, Objects.requireNonNull(executor, "executor")));
    }

    @Override
    public synchronized void close() {
        for (RegionDownload download : List.copyOf(downloads.values())) {
            download.stop();
        }
        downloads.clear();
        observers.clear();
    }

    // ---------------------------------------------------------------------------------------

    /// Registers the new download before the state is persisted, so a deactivation issued
    /// while the store writes are pending stops it before it starts. Guarded by this.
    private CompletableFuture<OfflineRegion> activate(long regionId) {
        RegionDownload current = downloads.get(regionId);
        if (current != null && current.state() == DownloadState.DOWNLOADING) {
            return CompletableFuture.completedFuture(getRegion(regionId));
        }
        RegionDownload download = new RegionDownload(regionId, this, store, downloader,
            store.manifest(regionId), fetchWindow);
        downloads.put(regionId, download);
        if (current != null) {
            current.stop();
        }
        return store.updateRegionState(regionId, RegionState.ACTIVE)
            .thenCompose(region -> store.updateRegionErrors(regionId, 0))
            .thenApply(region -> {
                if (downloads.get(regionId) != download) {
                    logger.debug("region {} was deactivated before its download started", regionId);
                    return toRegion(store.region(regionId).orElse(region));
                }
                logger.info("region {} activated, {} of {} resources already complete", regionId,
                    region.completedResourceCount(), region.manifestCount());
                publishStatus(regionId);
                download.start();
                return toRegion(store.region(regionId).orElse(region));
            });
    }

    private CompletableFuture<List<ResourceRequest>> enumerate(OfflineRegionDefinition definition, Resource style) {
        StyleReferences references;
        try {
            references = styleReader.readStyle(style.payload());
        } catch (IllegalArgumentException e) {
            throw new InvalidRegionDefinitionException(
                "style " + definition.styleUrl() + " cannot be read: " + e.getMessage(), e);
        }
        List<CompletableFuture<SourceReference>> sources = new ArrayList<>();
        for (SourceReference source : references.sources()) {
            sources.add(source.needsTileJson()
                ? readTileJson(definition, source)
                : CompletableFuture.completedFuture(source));
        }
        return CompletableFuture.allOf(sources.toArray(new CompletableFuture<?>[0])).thenApply(done -> {
            List<SourceReference> resolved = sources.stream().map(CompletableFuture::join).collect(Collectors.toList());
            List<ResourceRequest> manifest = manifestBuilder.build(definition, references, resolved);
            logger.debug("enumerated {} resources for style {}", manifest.size(), definition.styleUrl());
            return manifest;
        });
    }

    private CompletableFuture<SourceReference> readTileJson(OfflineRegionDefinition definition, SourceReference source) {
        String url = ManifestBuilder.resolve(definition.styleUrl(), source.url());
        return router.resolve(new ResourceRequest(ResourceKey.sourceMetadata(url), url)).thenApply(tileJson -> {
            try {
                return styleReader.readTileJson(source, tileJson.payload());
            } catch (IllegalArgumentException e) {
                throw new InvalidRegionDefinitionException(
                    "TileJSON " + url + " of source " + source.id() + " cannot be read: " + e.getMessage(), e);
            }
        });
    }

    void recordError(long regionId, long erroredCount) {
        store.updateRegionErrors(regionId, erroredCount).whenComplete((region, error) -> {
            if (error != null) {
                logger.warn("could not persist errored count of region {}: {}", regionId, error.getMessage());
            }
        });
    }

    void publishStatus(long regionId) {
        ObserverBinding binding = observers.get(regionId);
        if (binding == null) {
            return;
        }
        store.region(regionId).map(this::statusOf).ifPresent(status ->
            deliver(binding, regionId, observer -> observer.statusChanged(status)));
    }

    void publishError(long regionId, ResourceKey key, Throwable error) {
        ObserverBinding binding = observers.get(regionId);
        if (binding != null) {
            deliver(binding, regionId, observer -> observer.resourceError(key, error));
        }
    }

    void publishQuotaExceeded(long regionId, long tileCountLimit) {
        ObserverBinding binding = observers.get(regionId);
        if (binding != null) {
            deliver(binding, regionId, observer -> observer.tileCountLimitExceeded(tileCountLimit));
        }
    }

    private void deliver(ObserverBinding binding, long regionId, Consumer<OfflineRegionObserver> call) {
        binding.executor().execute(() -> {
            try {
                call.accept(binding.observer());
            } catch (RuntimeException e) {
                logger.warn("observer of region {} threw", regionId, e);
            }
        });
    }

    private OfflineRegionStatus statusOf(StoredRegion region) {
        RegionDownload download = downloads.get(region.id());
        if (download == null) {
            return region.status(DownloadState.INACTIVE);
        }
        OfflineRegionStatus stored = region.status(download.state());
        return new OfflineRegionStatus(
            stored.regionId(),
            stored.downloadState(),
            stored.requiredResourceCount(),
            stored.requiredResourceCountIsPrecise(),
            stored.completedResourceCount(),
            stored.completedResourceSize(),
            stored.completedTileCount(),
            stored.completedTileSize(),
            download.erroredCount()
        );
    }

    private OfflineRegion toRegion(StoredRegion region) {
        return new OfflineRegion(region.id(), region.definition(), region.metadata(), region.state(),
            region.createdAt(), statusOf(region));
    }

    private StoredRegion requireRegion(long regionId) {
        return store.region(regionId).orElseThrow(() -> new RegionNotFoundException(regionId));
    }
}
