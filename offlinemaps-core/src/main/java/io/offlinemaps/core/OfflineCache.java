package io.offlinemaps.core;

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

import io.offlinemaps.api.errors.StorageCorruptionException;
import io.offlinemaps.api.region.OfflineRegion;
import io.offlinemaps.api.region.OfflineRegionDefinition;
import io.offlinemaps.api.region.OfflineRegionObserver;
import io.offlinemaps.api.region.OfflineRegionStatus;
import io.offlinemaps.api.region.RegionState;
import io.offlinemaps.api.resource.Resource;
import io.offlinemaps.api.resource.ResourceKey;
import io.offlinemaps.api.resource.ResourceRequest;
import io.offlinemaps.api.transport.ResourceTransport;
import io.offlinemaps.api.transport.ResourceTransports;
import io.offlinemaps.api.transport.TransportOptions;
import io.offlinemaps.core.config.OfflineCacheConfig;
import io.offlinemaps.core.download.Downloader;
import io.offlinemaps.core.manifest.JsonStyleReferenceReader;
import io.offlinemaps.core.manifest.ManifestBuilder;
import io.offlinemaps.core.region.RegionManager;
import io.offlinemaps.core.router.RequestRouter;
import io.offlinemaps.core.store.ResourceStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/// The offline cache: one store directory, its downloader, router and region manager.
///
/// ```java
/// try (OfflineCache cache = OfflineCache.open(OfflineCacheConfig.builder(dir).build())) {
///     OfflineRegion region = cache.createRegion(definition, metadata).join();
///     cache.setRegionObserver(region.id(), observer, executor);
///     cache.setRegionState(region.id(), RegionState.ACTIVE);
/// }
/// ```
///
/// Opening a store that turns out to be corrupt does not fail: the store is reset to empty and
/// the reset is reported once through [#startupCorruption()].
public class OfflineCache implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(OfflineCache.class);

    private final OfflineCacheConfig config;
    private final ResourceStore store;
    private final ResourceTransport transport;
    private final boolean ownsTransport;
    private final Downloader downloader;
    private final RequestRouter router;
    private final RegionManager regions;
    private final StorageCorruptionException startupCorruption;

    private OfflineCache(OfflineCacheConfig config, ResourceTransport transport, boolean ownsTransport, Clock clock) {
        this.config = config;
        this.transport = transport;
        this.ownsTransport = ownsTransport;
        this.store = new ResourceStore(config, clock);
        StorageCorruptionException corruption = null;
        try {
            store.open();
        } catch (StorageCorruptionException e) {
            logger.error("offline store was reset: {}", e.getMessage());
            corruption = e;
        }
        this.startupCorruption = corruption;
        this.downloader = new Downloader(transport, store, config);
        this.router = new RequestRouter(store, downloader, clock);
        this.regions = new RegionManager(store, downloader, router, new JsonStyleReferenceReader(),
            new ManifestBuilder(), config.maxZoom(), config.regionFetchWindow());
    }

    /// Opens a cache that fetches through the transports registered with ServiceLoader.
    public static OfflineCache open(OfflineCacheConfig config) {
        TransportOptions options = TransportOptions.DEFAULTS.withAccessToken(config.accessToken());
        ResourceTransport transport = ResourceTransports.create(options);
        try {
            return new OfflineCache(config, transport, true, Clock.systemUTC());
        } catch (RuntimeException e) {
            transport.close();
            throw e;
        }
    }

    /// Opens a cache that fetches through the given transport. The caller keeps ownership of
    /// the transport.
    public static OfflineCache open(OfflineCacheConfig config, ResourceTransport transport) {
        return open(config, transport, Clock.systemUTC());
    }

    public static OfflineCache open(OfflineCacheConfig config, ResourceTransport transport, Clock clock) {
        return new OfflineCache(config, transport, false, clock);
    }

    /// @return the corruption that forced the store to be reset when it was opened, if any
    public Optional<StorageCorruptionException> startupCorruption() {
        return Optional.ofNullable(startupCorruption);
    }

    public OfflineCacheConfig config() {
        return config;
    }

    // resources

    public CompletableFuture<Resource> resolve(ResourceRequest request) {
        return router.resolve(request);
    }

    public CompletableFuture<Resource> resolve(ResourceKey key) {
        return router.resolve(key);
    }

    // regions

    public CompletableFuture<OfflineRegion> createRegion(OfflineRegionDefinition definition, byte[] metadata) {
        return regions.createRegion(definition, metadata);
    }

    public List<OfflineRegion> listRegions() {
        return regions.listRegions();
    }

    public OfflineRegion getRegion(long regionId) {
        return regions.getRegion(regionId);
    }

    public OfflineRegionStatus getRegionStatus(long regionId) {
        return regions.getRegionStatus(regionId);
    }

    public CompletableFuture<Void> deleteRegion(long regionId) {
        return regions.deleteRegion(regionId);
    }

    public CompletableFuture<OfflineRegion> setRegionState(long regionId, RegionState state) {
        return regions.setRegionState(regionId, state);
    }

    public void setRegionObserver(long regionId, OfflineRegionObserver observer, Executor executor) {
        regions.setRegionObserver(regionId, observer, executor);
    }

    public CompletableFuture<OfflineRegion> updateRegionMetadata(long regionId, byte[] metadata) {
        return regions.updateRegionMetadata(regionId, metadata);
    }

    // limits

    public CompletableFuture<Void> setMaximumAmbientCacheSize(long bytes) {
        return store.setMaximumAmbientCacheSize(bytes);
    }

    public CompletableFuture<Void> setTileCountLimit(long limit) {
        return store.setTileCountLimit(limit);
    }

    /// @return a future completing with the number of bytes freed
    public CompletableFuture<Long> clearAmbientCache() {
        return store.clearAmbientCache();
    }

    public long ambientCacheSize() {
        return store.ambientCacheSize();
    }

    /// @return the number of distinct tiles linked to offline regions
    public long offlineTileCount() {
        return store.linkedTileCount();
    }

    @Override
    public void close() {
        regions.close();
        downloader.close();
        store.close();
        if (ownsTransport) {
            transport.close();
        }
        logger.info("offline cache at {} closed", config.storePath());
    }
}
