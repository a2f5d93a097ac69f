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

import com.google.gson.JsonParseException;
import io.offlinemaps.api.errors.OfflineStorageException;
import io.offlinemaps.api.errors.QuotaExceededException;
import io.offlinemaps.api.errors.RegionNotFoundException;
import io.offlinemaps.api.errors.RegionStateException;
import io.offlinemaps.api.errors.StorageCorruptionException;
import io.offlinemaps.api.region.OfflineRegionDefinition;
import io.offlinemaps.api.region.RegionState;
import io.offlinemaps.api.resource.Resource;
import io.offlinemaps.api.resource.ResourceKey;
import io.offlinemaps.api.resource.ResourceMetadata;
import io.offlinemaps.api.resource.ResourceRequest;
import io.offlinemaps.core.config.OfflineCacheConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/// The durable, crash-consistent resource and region store.
///
/// ## Layout
///
/// ```text
/// <root>/store.json                       format version and region id allocator
/// <root>/resources/<hh>/<sha256>.json     resource commit record
/// <root>/resources/<hh>/<sha256>-<n>.bin  payload, one generation per commit
/// <root>/regions/<id>.json                region commit record
/// <root>/regions/<id>.manifest.json       region manifest
/// ```
///
/// `<sha256>` is the hash of the key's storage form and `<hh>` its first two characters.
///
/// ## Consistency
///
/// A payload is written under a fresh generation name before its record; the atomic rename of
/// the record is the commit point, after which the previous generation is deleted. A region's
/// manifest is written before its record. When the store is opened, temp files, payloads no
/// record references, records whose payload is missing, manifests without a region, and links
/// to regions that no longer exist are all discarded, so a crash at any point leaves either
/// the old or the new state.
///
/// ## Concurrency
///
/// Every mutation runs on a single writer thread and completes a [CompletableFuture]. Reads
/// are served from an immutable-entry index and never block on the writer. Writes that grow
/// the ambient cache or unlink resources are followed, on the writer, by a least-recently-used
/// eviction pass that brings the ambient cache back under its maximum size.
public class ResourceStore implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(ResourceStore.class);

    public static final int FORMAT_VERSION = 1;

    static final String DESCRIPTOR_FILE = "store.json";
    static final String RESOURCES_DIR = "resources";
    static final String REGIONS_DIR = "regions";
    static final String RECORD_SUFFIX = ".json";
    static final String PAYLOAD_SUFFIX = ".bin";
    static final String MANIFEST_SUFFIX = ".manifest.json";

    private final Path root;
    private final Path resourcesDir;
    private final Path regionsDir;
    private final Clock clock;
    private final ExecutorService writer;
    private final AmbientCache ambientCache;
    private final Map<ResourceKey, StoredEntry> entries = new ConcurrentHashMap<>();
    private final Map<Long, StoredRegion> regions = new ConcurrentHashMap<>();
    private final AtomicBoolean opened = new AtomicBoolean();

    private volatile boolean open;
    private volatile long tileCountLimit;
    private volatile long linkedTileCount;

    // writer-confined
    private long nextSequence = 1;
    private long nextRegionId = 1;

    public ResourceStore(Path root, long maximumAmbientCacheSize, long tileCountLimit, Clock clock) {
        if (tileCountLimit < 0) {
            throw new IllegalArgumentException("tile count limit cannot be negative: " + tileCountLimit);
        }
        this.root = root;
        this.resourcesDir = root.resolve(RESOURCES_DIR);
        this.regionsDir = root.resolve(REGIONS_DIR);
        this.clock = clock;
        this.ambientCache = new AmbientCache(maximumAmbientCacheSize);
        this.tileCountLimit = tileCountLimit;
        this.writer = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "offline-store-writer");
            thread.setDaemon(true);
            return thread;
        });
    }

    public ResourceStore(OfflineCacheConfig config, Clock clock) {
        this(config.storePath(), config.maximumAmbientCacheSize(), config.tileCountLimit(), clock);
    }

    /// Opens the store, recovering from any interrupted write.
    ///
    /// If the on-disk state cannot be interpreted, the store's files are deleted, the store is
    /// left open and empty, and [StorageCorruptionException] is thrown to report the reset.
    ///
    /// @throws UncheckedIOException if the store directory cannot be read or created
    public void open() {
        if (!opened.compareAndSet(false, true)) {
            throw new IllegalStateException("store at " + root + " was already opened");
        }
        open = true;
        try {
            submit("open", () -> {
                recover();
                return null;
            }).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof StorageCorruptionException) {
                throw (StorageCorruptionException) e.getCause();
            }
            close();
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    public Path root() {
        return root;
    }

    public boolean isOpen() {
        return open;
    }

    // ---------------------------------------------------------------------------------------
    // Reads

    /// Reads a stored resource.
    ///
    /// A payload that cannot be read or fails verification is treated as a miss: the damaged
    /// entry is discarded in the background and an empty result is returned. Reading an
    /// ambient resource refreshes its access time.
    ///
    /// @param key the key
    /// @return the resource, or empty if it is not stored
    public Optional<Resource> get(ResourceKey key) {
        ensureOpen();
        StoredEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        byte[] payload;
        try {
            payload = readPayload(entry);
        } catch (IOException e) {
            StoredEntry current = entries.get(key);
            if (current == null) {
                return Optional.empty();
            }
            if (current != entry) {
                // replaced by a concurrent commit
                return get(key);
            }
            logger.warn("could not read stored payload for {}, treating it as a miss: {}", key, e.getMessage());
            discardDamaged(entry);
            return Optional.empty();
        }
        Instant accessedAt = entry.accessedAt();
        if (entry.isAmbient()) {
            accessedAt = clock.instant();
            touch(entry, accessedAt);
        }
        return Optional.of(new Resource(key, payload, entry.metadata(), accessedAt));
    }

    /// @return the index entry for a key, without reading its payload
    public Optional<StoredEntry> entry(ResourceKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean contains(ResourceKey key) {
        return entries.containsKey(key);
    }

    public boolean isLinked(long regionId, ResourceKey key) {
        StoredEntry entry = entries.get(key);
        return entry != null && entry.isLinkedTo(regionId);
    }

    /// @return total bytes of unlinked resources
    public long ambientCacheSize() {
        return ambientCache.size();
    }

    public int ambientResourceCount() {
        return ambientCache.count();
    }

    public long maximumAmbientCacheSize() {
        return ambientCache.maximumSize();
    }

    /// @return the number of distinct tiles linked to at least one region
    public long linkedTileCount() {
        return linkedTileCount;
    }

    public long tileCountLimit() {
        return tileCountLimit;
    }

    public int resourceCount() {
        return entries.size();
    }

    // ---------------------------------------------------------------------------------------
    // Resource writes

    /// Stores a resource in the ambient cache, replacing any previous version.
    /// @return a future completing with the stored resource
    public CompletableFuture<Resource> put(ResourceKey key, String url, byte[] payload, ResourceMetadata metadata) {
        return commit(key, url, payload, metadata, Set.of(), true).thenApply(CommitResult::resource);
    }

    /// Commits a fetched resource, linking it to the given regions.
    ///
    /// A tile that is not yet linked to any region may only be linked if the number of linked
    /// tiles stays within the tile count limit. If it would not, the commit links to none of
    /// the requested regions and the result reports the rejection; the payload is then kept as
    /// an ambient resource only if `retainUnlinked` is set. Ids of regions that no longer exist
    /// are ignored.
    ///
    /// @param key the key
    /// @param url the URL the resource was fetched from
    /// @param payload the payload bytes
    /// @param metadata revalidation metadata
    /// @param regionIds the regions to link the resource to
    /// @param retainUnlinked whether to keep the payload if no region link is made
    /// @return a future completing with the commit outcome
    public CompletableFuture<CommitResult> commit(
        ResourceKey key,
        String url,
        byte[] payload,
        ResourceMetadata metadata,
        Set<Long> regionIds,
        boolean retainUnlinked
    ) {
        ensureOpen();
        byte[] bytes = payload.clone();
        Set<Long> requested = Set.copyOf(regionIds);
        return submit("commit " + key, () -> doCommit(key, url, bytes, metadata, requested, retainUnlinked));
    }

    /// Merges the metadata of a not-modified response into a stored resource. An ambient
    /// resource also has its access time refreshed.
    /// @return a future completing with the refreshed resource, or empty if it is no longer stored
    public CompletableFuture<Optional<Resource>> refreshMetadata(ResourceKey key, ResourceMetadata update) {
        ensureOpen();
        return submit("refresh " + key, () -> {
            StoredEntry current = entries.get(key);
            if (current == null) {
                return Optional.<StoredEntry>empty();
            }
            StoredEntry refreshed = current.withMetadata(current.metadata().refreshedBy(update));
            if (refreshed.isAmbient()) {
                refreshed = refreshed.withAccessedAt(clock.instant());
            }
            writeRecord(refreshed);
            replaceEntry(current, refreshed);
            return Optional.of(refreshed);
        }).thenApply(this::readRefreshed);
    }

    private Optional<Resource> readRefreshed(Optional<StoredEntry> refreshed) {
        if (refreshed.isEmpty()) {
            return Optional.empty();
        }
        StoredEntry entry = refreshed.get();
        try {
            return Optional.of(new Resource(entry.key(), readPayload(entry), entry.metadata(), entry.accessedAt()));
        } catch (IOException e) {
            logger.warn("could not read refreshed payload for {}: {}", entry.key(), e.getMessage());
            discardDamaged(entry);
            return Optional.empty();
        }
    }

    /// Links a stored resource to a region.
    /// @return a future completing with true if the resource is now linked, or false if it is
    ///     not stored; it fails with [QuotaExceededException] if linking a tile would exceed
    ///     the tile count limit
    public CompletableFuture<Boolean> link(long regionId, ResourceKey key) {
        ensureOpen();
        return submit("link " + key, () -> {
            requireRegion(regionId);
            StoredEntry current = entries.get(key);
            if (current == null) {
                return false;
            }
            if (current.isLinkedTo(regionId)) {
                return true;
            }
            if (key.isTile() && current.isAmbient() && linkedTileCount + 1 > tileCountLimit) {
                throw new QuotaExceededException(tileCountLimit);
            }
            StoredEntry linked = current.withRegion(regionId);
            writeRecord(linked);
            replaceEntry(current, linked);
            return true;
        });
    }

    /// Removes a region's link to a resource. A resource left with no links joins the ambient
    /// cache and may be evicted.
    /// @return a future completing with true if a link was removed
    public CompletableFuture<Boolean> unlink(long regionId, ResourceKey key) {
        ensureOpen();
        return submit("unlink " + key, () -> {
            StoredEntry current = entries.get(key);
            if (current == null || !current.isLinkedTo(regionId)) {
                return false;
            }
            StoredEntry unlinked = current.withoutRegion(regionId);
            writeRecord(unlinked);
            replaceEntry(current, unlinked);
            evictIfNeeded();
            return true;
        });
    }

    /// Evicts least recently used ambient resources until at least `bytesToFree` bytes have
    /// been reclaimed or the ambient cache is empty. Linked resources are never evicted.
    /// @return a future completing with the number of bytes freed
    public CompletableFuture<Long> evict(long bytesToFree) {
        ensureOpen();
        return submit("evict", () -> evictLeastRecentlyUsed(bytesToFree));
    }

    /// Removes every ambient resource.
    /// @return a future completing with the number of bytes freed
    public CompletableFuture<Long> clearAmbientCache() {
        ensureOpen();
        return submit("clear ambient cache", () -> {
            long freed = evictLeastRecentlyUsed(Long.MAX_VALUE);
            logger.info("cleared ambient cache, freed {} bytes", freed);
            return freed;
        });
    }

    /// Changes the maximum ambient cache size, evicting immediately if the cache is over it.
    public CompletableFuture<Void> setMaximumAmbientCacheSize(long bytes) {
        ensureOpen();
        if (bytes < 0) {
            throw new IllegalArgumentException("maximum ambient cache size cannot be negative: " + bytes);
        }
        return submit("set maximum ambient cache size", () -> {
            ambientCache.setMaximumSize(bytes);
            evictIfNeeded();
            return null;
        });
    }

    /// Changes the tile count limit. Lowering it below the current number of linked tiles
    /// removes nothing; only further links are refused.
    public CompletableFuture<Void> setTileCountLimit(long limit) {
        ensureOpen();
        if (limit < 0) {
            throw new IllegalArgumentException("tile count limit cannot be negative: " + limit);
        }
        return submit("set tile count limit", () -> {
            tileCountLimit = limit;
            logger.debug("tile count limit set to {} ({} tiles linked)", limit, linkedTileCount);
            return null;
        });
    }

    // ---------------------------------------------------------------------------------------
    // Regions

    /// Persists a new, inactive region with its manifest.
    /// @param definition the validated definition
    /// @param metadata opaque application metadata
    /// @param manifest every resource the region requires, without duplicates
    /// @return a future completing with the new region
    public CompletableFuture<StoredRegion> createRegion(
        OfflineRegionDefinition definition,
        byte[] metadata,
        List<ResourceRequest> manifest
    ) {
        ensureOpen();
        byte[] metadataCopy = metadata == null ? new byte[0] : metadata.clone();
        List<ResourceRequest> entriesCopy = List.copyOf(manifest);
        return submit("create region", () -> {
            long id = nextRegionId++;
            writeDescriptor();
            List<ManifestRecord.Entry> records = entriesCopy.stream()
                .map(request -> new ManifestRecord.Entry(request.key().storageKey(), request.url()))
                .collect(Collectors.toList());
            long tiles = entriesCopy.stream().filter(request -> request.key().isTile()).count();
            Path manifestFile = manifestPath(id);
            StoreFiles.writeJson(manifestFile, new ManifestRecord(FORMAT_VERSION, id, records));
            StoredRegion region = new StoredRegion(id, definition, metadataCopy, RegionState.INACTIVE,
                clock.instant(), entriesCopy.size(), tiles, 0, 0, 0, 0, 0);
            try {
                StoreFiles.writeJson(regionPath(id), region.toRecord(FORMAT_VERSION));
            } catch (IOException e) {
                StoreFiles.deleteUnreferenced(manifestFile);
                throw e;
            }
            regions.put(id, region);
            logger.info("created offline region {} with {} resources ({} tiles)", id, entriesCopy.size(), tiles);
            return region;
        });
    }

    public CompletableFuture<StoredRegion> updateRegionState(long regionId, RegionState state) {
        ensureOpen();
        return submit("update region state", () -> rewriteRegion(regionId, region -> region.withState(state)));
    }

    public CompletableFuture<StoredRegion> updateRegionMetadata(long regionId, byte[] metadata) {
        ensureOpen();
        byte[] copy = metadata == null ? new byte[0] : metadata.clone();
        return submit("update region metadata", () -> rewriteRegion(regionId, region -> region.withMetadata(copy)));
    }

    public CompletableFuture<StoredRegion> updateRegionErrors(long regionId, long erroredResourceCount) {
        ensureOpen();
        return submit("update region errors",
            () -> rewriteRegion(regionId, region -> region.withErroredResourceCount(erroredResourceCount)));
    }

    /// Deletes an inactive region. Resources it alone referenced become ambient and are
    /// subject to eviction.
    /// @return a future failing with [RegionStateException] if the region is active, or with
    ///     [RegionNotFoundException] if it does not exist
    public CompletableFuture<Void> deleteRegion(long regionId) {
        ensureOpen();
        return submit("delete region", () -> {
            StoredRegion region = requireRegion(regionId);
            if (region.state() == RegionState.ACTIVE) {
                throw new RegionStateException(regionId, region.state(), "deactivate it before deleting it");
            }
            Files.delete(regionPath(regionId));
            regions.remove(regionId);
            StoreFiles.deleteUnreferenced(manifestPath(regionId));
            int unlinked = 0;
            for (StoredEntry entry : List.copyOf(entries.values())) {
                if (!entry.isLinkedTo(regionId)) {
                    continue;
                }
                StoredEntry updated = entry.withoutRegion(regionId);
                try {
                    writeRecord(updated);
                } catch (IOException e) {
                    logger.warn("could not rewrite record for {}, its link to deleted region {} is dropped on "
                        + "the next open: {}", entry.key(), regionId, e.getMessage());
                }
                replaceEntry(entry, updated);
                unlinked++;
            }
            evictIfNeeded();
            logger.info("deleted offline region {}, released {} resources", regionId, unlinked);
            return null;
        });
    }

    /// @return every region, ordered by creation time
    public List<StoredRegion> regions() {
        ensureOpen();
        List<StoredRegion> list = new ArrayList<>(regions.values());
        list.sort(Comparator.comparing(StoredRegion::createdAt).thenComparingLong(StoredRegion::id));
        return list;
    }

    public Optional<StoredRegion> region(long regionId) {
        ensureOpen();
        return Optional.ofNullable(regions.get(regionId));
    }

    /// Reads a region's manifest.
    /// @throws RegionNotFoundException if the region does not exist
    /// @throws UncheckedIOException if the manifest cannot be read
    public List<ResourceRequest> manifest(long regionId) {
        ensureOpen();
        requireRegion(regionId);
        try {
            ManifestRecord record = StoreFiles.readJson(manifestPath(regionId), ManifestRecord.class);
            List<ResourceRequest> requests = new ArrayList<>(record.entries().size());
            for (ManifestRecord.Entry entry : record.entries()) {
                requests.add(new ResourceRequest(ResourceKey.parse(entry.key()), entry.url()));
            }
            return requests;
        } catch (IOException e) {
            throw new UncheckedIOException("could not read manifest of region " + regionId, e);
        }
    }

    @Override
    public void close() {
        if (!open) {
            return;
        }
        open = false;
        writer.shutdown();
        try {
            if (!writer.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warn("store writer did not finish within 30s, abandoning pending writes");
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writer.shutdownNow();
        }
        logger.debug("closed offline store at {}", root);
    }

    // ---------------------------------------------------------------------------------------
    // Writer-thread internals

    private <T> CompletableFuture<T> submit(String operation, Callable<T> action) {
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            writer.execute(() -> {
                try {
                    result.complete(action.call());
                } catch (OfflineStorageException e) {
                    result.completeExceptionally(e);
                } catch (IOException e) {
                    logger.error("{} failed: {}", operation, e.getMessage(), e);
                    result.completeExceptionally(new UncheckedIOException(operation + " failed", e));
                } catch (Exception e) {
                    logger.error("{} failed", operation, e);
                    result.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new IllegalStateException("store at " + root + " is closed", e));
        }
        return result;
    }

    private CommitResult doCommit(
        ResourceKey key,
        String url,
        byte[] payload,
        ResourceMetadata metadata,
        Set<Long> regionIds,
        boolean retainUnlinked
    ) throws IOException {
        StoredEntry existing = entries.get(key);
        Set<Long> requested = new TreeSet<>();
        for (Long regionId : regionIds) {
            if (regions.containsKey(regionId)) {
                requested.add(regionId);
            }
        }
        boolean quotaRejected = false;
        if (key.isTile() && !requested.isEmpty() && (existing == null || existing.isAmbient())
            && linkedTileCount + 1 > tileCountLimit) {
            quotaRejected = true;
            requested.clear();
        }
        if (quotaRejected && !retainUnlinked) {
            logger.debug("discarded {}: tile count limit {} reached", key, tileCountLimit);
            return new CommitResult(null, Set.of(), true, tileCountLimit);
        }
        if (requested.isEmpty() && !retainUnlinked && existing == null) {
            return new CommitResult(null, Set.of(), quotaRejected, tileCountLimit);
        }

        Set<Long> links = new TreeSet<>(requested);
        if (existing != null) {
            links.addAll(existing.regions());
        }
        long sequence = nextSequence++;
        String stem = StoreFiles.stemOf(key);
        Path bucket = bucketOf(stem);
        Files.createDirectories(bucket);
        String payloadFile = stem + "-" + sequence + PAYLOAD_SUFFIX;
        Path payloadPath = bucket.resolve(payloadFile);
        StoreFiles.writeAtomically(payloadPath, payload);

        StoredEntry entry = new StoredEntry(key, url, metadata, payload.length, StoreFiles.sha256(payload),
            payloadFile, sequence, clock.instant(), links);
        try {
            writeRecord(entry);
        } catch (IOException e) {
            StoreFiles.deleteUnreferenced(payloadPath);
            throw e;
        }
        if (existing != null && !existing.payloadFile().equals(payloadFile)) {
            StoreFiles.deleteUnreferenced(bucket.resolve(existing.payloadFile()));
        }
        replaceEntry(existing, entry);
        logger.trace("committed {} ({} bytes, regions {})", key, payload.length, links);
        evictIfNeeded();
        return new CommitResult(new Resource(key, payload, entry.metadata(), entry.accessedAt()),
            requested, quotaRejected, tileCountLimit);
    }

    /// Updates the index, ambient accounting, linked tile count, and region counters for one
    /// entry transition. Either side may be null.
    private void replaceEntry(StoredEntry previous, StoredEntry current) {
        if (previous != null) {
            if (previous.isAmbient()) {
                ambientCache.remove(previous);
            } else {
                if (previous.key().isTile()) {
                    linkedTileCount--;
                }
                for (Long regionId : previous.regions()) {
                    regions.computeIfPresent(regionId, (id, region) -> region.withCompleted(previous, -1));
                }
            }
        }
        if (current != null) {
            entries.put(current.key(), current);
            if (current.isAmbient()) {
                ambientCache.add(current);
            } else {
                if (current.key().isTile()) {
                    linkedTileCount++;
                }
                for (Long regionId : current.regions()) {
                    regions.computeIfPresent(regionId, (id, region) -> region.withCompleted(current, 1));
                }
            }
        } else if (previous != null) {
            entries.remove(previous.key());
        }
    }

    private void evictIfNeeded() {
        long excess = ambientCache.excess();
        if (excess == 0) {
            return;
        }
        try {
            evictLeastRecentlyUsed(excess);
        } catch (IOException e) {
            logger.error("ambient cache eviction failed, cache remains {} bytes over its limit: {}",
                ambientCache.excess(), e.getMessage(), e);
        }
    }

    private long evictLeastRecentlyUsed(long bytesToFree) throws IOException {
        long freed = 0;
        List<StoredEntry> victims = ambientCache.selectVictims(bytesToFree);
        for (StoredEntry victim : victims) {
            Files.deleteIfExists(recordPath(victim.key()));
            StoreFiles.deleteUnreferenced(payloadPath(victim));
            replaceEntry(victim, null);
            freed += victim.size();
        }
        if (!victims.isEmpty()) {
            logger.debug("evicted {} ambient resources ({} bytes), ambient cache now {} of {} bytes",
                victims.size(), freed, ambientCache.size(), ambientCache.maximumSize());
        }
        return freed;
    }

    private void touch(StoredEntry read, Instant accessedAt) {
        submit("touch " + read.key(), () -> {
            StoredEntry current = entries.get(read.key());
            if (current == null || current.sequence() != read.sequence() || !current.isAmbient()
                || !accessedAt.isAfter(current.accessedAt())) {
                return null;
            }
            StoredEntry touched = current.withAccessedAt(accessedAt);
            writeRecord(touched);
            replaceEntry(current, touched);
            return null;
        }).exceptionally(e -> {
            logger.warn("could not record access time of {}: {}", read.key(), e.getMessage());
            return null;
        });
    }

    private void discardDamaged(StoredEntry damaged) {
        submit("discard " + damaged.key(), () -> {
            if (entries.get(damaged.key()) != damaged) {
                return null;
            }
            Files.deleteIfExists(recordPath(damaged.key()));
            StoreFiles.deleteUnreferenced(payloadPath(damaged));
            replaceEntry(damaged, null);
            logger.info("discarded damaged resource {}", damaged.key());
            return null;
        }).exceptionally(e -> {
            logger.warn("could not discard damaged resource {}: {}", damaged.key(), e.getMessage());
            return null;
        });
    }

    private StoredRegion rewriteRegion(long regionId, UnaryOperator<StoredRegion> change) throws IOException {
        StoredRegion updated = change.apply(requireRegion(regionId));
        StoreFiles.writeJson(regionPath(regionId), updated.toRecord(FORMAT_VERSION));
        regions.put(regionId, updated);
        return updated;
    }

    private StoredRegion requireRegion(long regionId) {
        StoredRegion region = regions.get(regionId);
        if (region == null) {
            throw new RegionNotFoundException(regionId);
        }
        return region;
    }

    private byte[] readPayload(StoredEntry entry) throws IOException {
        byte[] payload = Files.readAllBytes(payloadPath(entry));
        if (payload.length != entry.size() || !StoreFiles.sha256(payload).equals(entry.sha256())) {
            throw new IOException("payload " + entry.payloadFile() + " failed verification");
        }
        return payload;
    }

    private void writeRecord(StoredEntry entry) throws IOException {
        StoreFiles.writeJson(recordPath(entry.key()), entry.toRecord(FORMAT_VERSION));
    }

    private void writeDescriptor() throws IOException {
        StoreFiles.writeJson(root.resolve(DESCRIPTOR_FILE), new StoreDescriptor(FORMAT_VERSION, nextRegionId));
    }

    private Path bucketOf(String stem) {
        return resourcesDir.resolve(stem.substring(0, 2));
    }

    private Path recordPath(ResourceKey key) {
        String stem = StoreFiles.stemOf(key);
        return bucketOf(stem).resolve(stem + RECORD_SUFFIX);
    }

    private Path payloadPath(StoredEntry entry) {
        return bucketOf(StoreFiles.stemOf(entry.key())).resolve(entry.payloadFile());
    }

    private Path regionPath(long regionId) {
        return regionsDir.resolve(regionId + RECORD_SUFFIX);
    }

    private Path manifestPath(long regionId) {
        return regionsDir.resolve(regionId + MANIFEST_SUFFIX);
    }

    private void ensureOpen() {
        if (!open) {
            throw new IllegalStateException("store at " + root + " is not open");
        }
    }

    // ---------------------------------------------------------------------------------------
    // Recovery

    private void recover() throws IOException {
        Files.createDirectories(resourcesDir);
        Files.createDirectories(regionsDir);
        try {
            load();
        } catch (JsonParseException | IllegalArgumentException | DateTimeException e) {
            logger.error("offline store at {} is corrupt, resetting it: {}", root, e.getMessage());
            reset();
            throw new StorageCorruptionException(root, String.valueOf(e.getMessage()), e);
        }
        evictIfNeeded();
        logger.info("opened offline store at {}: {} resources, {} regions, ambient cache {} of {} bytes, "
                + "{} of {} tiles linked", root, entries.size(), regions.size(), ambientCache.size(),
            ambientCache.maximumSize(), linkedTileCount, tileCountLimit);
    }

    private void load() throws IOException {
        Path descriptorFile = root.resolve(DESCRIPTOR_FILE);
        if (Files.exists(descriptorFile)) {
            StoreDescriptor descriptor = StoreFiles.readJson(descriptorFile, StoreDescriptor.class);
            checkVersion(descriptor.version(), descriptorFile);
            nextRegionId = Math.max(1, descriptor.nextRegionId());
        } else {
            writeDescriptor();
        }
        loadRegions();
        loadResources();
        resetInterruptedRegions();
    }

    private void loadRegions() throws IOException {
        Set<Long> manifests = new HashSet<>();
        for (Path file : list(regionsDir)) {
            String name = file.getFileName().toString();
            if (name.endsWith(StoreFiles.TEMP_SUFFIX)) {
                StoreFiles.deleteUnreferenced(file);
            } else if (name.endsWith(MANIFEST_SUFFIX)) {
                manifests.add(Long.parseLong(name.substring(0, name.length() - MANIFEST_SUFFIX.length())));
            } else if (name.endsWith(RECORD_SUFFIX)) {
                RegionRecord record = StoreFiles.readJson(file, RegionRecord.class);
                checkVersion(record.version(), file);
                if (record.definition() == null || record.createdAt() == null) {
                    throw new JsonParseException("incomplete region record " + file);
                }
                regions.put(record.id(), StoredRegion.fromRecord(record));
                nextRegionId = Math.max(nextRegionId, record.id() + 1);
            } else {
                logger.warn("ignoring unexpected file {}", file);
            }
        }
        for (Long regionId : regions.keySet()) {
            if (!manifests.contains(regionId)) {
                throw new JsonParseException("region " + regionId + " has no manifest");
            }
        }
        for (Long manifestId : manifests) {
            if (!regions.containsKey(manifestId)) {
                logger.warn("removing manifest of uncommitted region {}", manifestId);
                StoreFiles.deleteUnreferenced(manifestPath(manifestId));
            }
        }
    }

    private void loadResources() throws IOException {
        List<Path> records = new ArrayList<>();
        List<Path> payloads = new ArrayList<>();
        try (Stream<Path> files = Files.walk(resourcesDir, 2)) {
            for (Path file : (Iterable<Path>) files.filter(Files::isRegularFile)::iterator) {
                String name = file.getFileName().toString();
                if (name.endsWith(StoreFiles.TEMP_SUFFIX)) {
                    StoreFiles.deleteUnreferenced(file);
                } else if (name.endsWith(PAYLOAD_SUFFIX)) {
                    payloads.add(file);
                } else if (name.endsWith(RECORD_SUFFIX)) {
                    records.add(file);
                } else {
                    logger.warn("ignoring unexpected file {}", file);
                }
            }
        }

        Set<Path> referenced = new HashSet<>();
        int dropped = 0;
        for (Path file : records) {
            ResourceRecord record = StoreFiles.readJson(file, ResourceRecord.class);
            checkVersion(record.version(), file);
            if (record.key() == null || record.payloadFile() == null || record.sha256() == null
                || record.accessedAt() == null) {
                throw new JsonParseException("incomplete resource record " + file);
            }
            StoredEntry entry = StoredEntry.fromRecord(record);
            Path payload = file.resolveSibling(entry.payloadFile());
            if (!Files.isRegularFile(payload) || Files.size(payload) != entry.size()) {
                logger.warn("dropping {}: its payload is missing or truncated", entry.key());
                Files.delete(file);
                dropped++;
                continue;
            }
            Set<Long> live = new TreeSet<>(entry.regions());
            live.retainAll(regions.keySet());
            if (live.size() != entry.regions().size()) {
                entry = new StoredEntry(entry.key(), entry.url(), entry.metadata(), entry.size(), entry.sha256(),
                    entry.payloadFile(), entry.sequence(), entry.accessedAt(), live);
                StoreFiles.writeJson(file, entry.toRecord(FORMAT_VERSION));
            }
            referenced.add(payload);
            nextSequence = Math.max(nextSequence, entry.sequence() + 1);
            replaceEntry(null, entry);
        }
        for (Path payload : payloads) {
            if (!referenced.contains(payload)) {
                StoreFiles.deleteUnreferenced(payload);
                dropped++;
            }
        }
        if (dropped > 0) {
            logger.info("recovered offline store at {}, removed {} incomplete files", root, dropped);
        }
    }

    /// A region that was downloading when the process stopped is left inactive; the
    /// application reactivates it to resume.
    private void resetInterruptedRegions() throws IOException {
        for (StoredRegion region : List.copyOf(regions.values())) {
            if (region.state() == RegionState.ACTIVE) {
                logger.info("region {} was active at shutdown, marking it inactive", region.id());
                rewriteRegion(region.id(), stored -> stored.withState(RegionState.INACTIVE));
            }
        }
    }

    private void reset() throws IOException {
        entries.clear();
        regions.clear();
        ambientCache.clear();
        linkedTileCount = 0;
        nextSequence = 1;
        nextRegionId = 1;
        StoreFiles.deleteContents(resourcesDir);
        StoreFiles.deleteContents(regionsDir);
        writeDescriptor();
    }

    private static void checkVersion(int version, Path file) {
        if (version != FORMAT_VERSION) {
            throw new JsonParseException("unsupported format version " + version + " in " + file);
        }
    }

    private static List<Path> list(Path directory) throws IOException {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path file : stream) {
                if (Files.isRegularFile(file)) {
                    files.add(file);
                }
            }
        }
        return files;
    }
}
