package io.offlinemaps.core.download;

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

import io.offlinemaps.api.errors.NetworkException;
import io.offlinemaps.api.errors.OfflineStorageException;
import io.offlinemaps.api.errors.QuotaExceededException;
import io.offlinemaps.api.errors.RegionNotFoundException;
import io.offlinemaps.api.resource.Resource;
import io.offlinemaps.api.resource.ResourceKey;
import io.offlinemaps.api.resource.ResourceMetadata;
import io.offlinemaps.api.resource.ResourceRequest;
import io.offlinemaps.api.transport.FetchRequest;
import io.offlinemaps.api.transport.FetchResponse;
import io.offlinemaps.api.transport.ResourceTransport;
import io.offlinemaps.core.config.OfflineCacheConfig;
import io.offlinemaps.core.store.CommitResult;
import io.offlinemaps.core.store.ResourceStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/// Concurrent, deduplicating, retrying fetch scheduler.
///
/// ```text
///   fetch(key) ──► in-flight task for key? ──yes──► join it (one transfer, fanned out)
///                        │ no
///                        ▼
///               priority work queue ──► worker ──► transport ──► store.commit ──► waiters
///                        ▲                              │
///                        └──── retry scheduler ◄────────┘ transient failure
/// ```
///
/// A fixed pool of workers drains a priority queue in which region fetches precede ambient
/// fetches. Ambient fetches are refused with [RejectedExecutionException] once the queue holds
/// `queueDepth` tasks; region downloads bound their own outstanding fetches and are always
/// accepted. Transient failures are retried per the [RetryPolicy]; permanent failures and
/// exhausted retries fail every waiter with the [NetworkException].
///
/// Tile commits are quota-checked by the store. A tile refused by the tile count limit fails
/// its region waiters with [QuotaExceededException]; the payload is kept as an ambient
/// resource only when an ambient caller also asked for it.
///
/// Cancelling a returned future detaches that caller. A task left without callers is
/// dropped if it has not started; a transfer already under way still commits.
public class Downloader implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(Downloader.class);

    /// How many times a caller is carried over to a fresh task when a commit could not
    /// deliver the resource to it.
    static final int MAX_CARRY_OVERS = 3;

    private final ResourceTransport transport;
    private final ResourceStore store;
    private final RetryPolicy retryPolicy;
    private final int queueDepth;
    private final ThreadPoolExecutor workers;
    private final ScheduledExecutorService retryScheduler;
    private final Object lock = new Object();
    private final Map<ResourceKey, FetchTask> inFlight = new HashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong transfers = new AtomicLong();
    private volatile boolean running = true;

    public Downloader(
        ResourceTransport transport,
        ResourceStore store,
        int workerThreads,
        int queueDepth,
        RetryPolicy retryPolicy
    ) {
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be at least 1, got " + workerThreads);
        }
        if (queueDepth < 1) {
            throw new IllegalArgumentException("queueDepth must be at least 1, got " + queueDepth);
        }
        this.transport = transport;
        this.store = store;
        this.retryPolicy = retryPolicy;
        this.queueDepth = queueDepth;

        AtomicInteger threadIds = new AtomicInteger();
        this.workers = new ThreadPoolExecutor(
            workerThreads, workerThreads,
            60L, TimeUnit.SECONDS,
            new PriorityBlockingQueue<>(),
            r -> {
                Thread t = new Thread(r);
                t.setName("offline-fetch-" + threadIds.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        );
        this.workers.prestartAllCoreThreads();
        this.retryScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("offline-fetch-retry");
            t.setDaemon(true);
            return t;
        });
    }

    public Downloader(ResourceTransport transport, ResourceStore store, OfflineCacheConfig config) {
        this(transport, store, config.workerThreads(), config.queueDepth(), RetryPolicy.from(config));
    }

    /// Fetches a resource for the ambient cache.
    /// @param request the resource to fetch
    /// @return a future completing with the stored resource
    public CompletableFuture<Resource> fetch(ResourceRequest request) {
        return enqueue(request, unconditional(request), null);
    }

    /// Fetches a resource and links it to a region.
    /// @param request the resource to fetch
    /// @param regionId the region that requires it
    /// @return a future completing with the stored resource once it is linked
    public CompletableFuture<Resource> fetchForRegion(ResourceRequest request, long regionId) {
        return enqueue(request, unconditional(request), regionId);
    }

    /// Revalidates a cached resource, conditionally when its metadata carries validators.
    /// @param request the resource to revalidate
    /// @param cached the metadata of the cached copy
    /// @return a future completing with the refreshed or replaced resource
    public CompletableFuture<Resource> revalidate(ResourceRequest request, ResourceMetadata cached) {
        FetchRequest fetchRequest = cached.hasValidators()
            ? FetchRequest.revalidate(request.url(), request.key().kind(), cached)
            : unconditional(request);
        return enqueue(request, fetchRequest, null);
    }

    /// @return the number of transport calls made so far, retries included
    public long transferCount() {
        return transfers.get();
    }

    /// @return the number of keys with an outstanding fetch
    public int inFlightCount() {
        synchronized (lock) {
            return inFlight.size();
        }
    }

    public int queuedCount() {
        return workers.getQueue().size();
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (!running) {
                return;
            }
            running = false;
        }
        retryScheduler.shutdownNow();
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("fetch workers did not stop within 10s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        List<FetchTask.Waiter> orphaned = new ArrayList<>();
        synchronized (lock) {
            for (FetchTask task : inFlight.values()) {
                task.setPhase(FetchTask.Phase.DONE);
                orphaned.addAll(task.drainWaiters());
            }
            inFlight.clear();
        }
        for (FetchTask.Waiter waiter : orphaned) {
            waiter.future().completeExceptionally(new CancellationException("downloader closed"));
        }
        logger.debug("downloader closed after {} transfers, {} pending fetches cancelled", transfers.get(),
            orphaned.size());
    }

    // ---------------------------------------------------------------------------------------

    private CompletableFuture<Resource> enqueue(ResourceRequest request, FetchRequest fetchRequest, Long regionId) {
        CompletableFuture<Resource> future = new CompletableFuture<>();
        attach(request, fetchRequest, new FetchTask.Waiter(future, regionId));
        return future;
    }

    private void attach(ResourceRequest request, FetchRequest fetchRequest, FetchTask.Waiter waiter) {
        FetchPriority priority = waiter.regionId() == null ? FetchPriority.AMBIENT : FetchPriority.REGION;
        RuntimeException refused = null;
        FetchTask task;
        synchronized (lock) {
            task = inFlight.get(request.key());
            if (!running) {
                refused = new RejectedExecutionException("downloader is closed");
            } else if (task == null) {
                if (priority == FetchPriority.AMBIENT && workers.getQueue().size() >= queueDepth) {
                    refused = new RejectedExecutionException(
                        "fetch queue is full (" + queueDepth + " pending), refusing " + request.key());
                } else {
                    task = new FetchTask(this, request, fetchRequest, priority, sequence.incrementAndGet());
                    task.addWaiter(waiter);
                    inFlight.put(request.key(), task);
                    workers.execute(task);
                    logger.trace("queued {}", task);
                }
            } else {
                task.addWaiter(waiter);
                if (priority == FetchPriority.REGION && task.priority() == FetchPriority.AMBIENT) {
                    promote(task);
                }
            }
        }
        if (refused != null) {
            waiter.future().completeExceptionally(refused);
            return;
        }
        FetchTask attached = task;
        waiter.future().whenComplete((resource, error) -> {
            if (waiter.future().isCancelled()) {
                detach(attached, waiter);
            }
        });
    }

    // guarded by lock
    private void promote(FetchTask task) {
        if (task.phase() == FetchTask.Phase.QUEUED && workers.remove(task)) {
            task.setPriority(FetchPriority.REGION);
            workers.execute(task);
        } else {
            task.setPriority(FetchPriority.REGION);
        }
    }

    private void detach(FetchTask task, FetchTask.Waiter waiter) {
        synchronized (lock) {
            if (!task.removeWaiter(waiter)) {
                return;
            }
            boolean drop = task.phase() == FetchTask.Phase.BACKING_OFF
                || (task.phase() == FetchTask.Phase.QUEUED && workers.remove(task));
            if (drop) {
                task.setPhase(FetchTask.Phase.DONE);
                inFlight.remove(task.key(), task);
                logger.debug("dropped fetch of {}, no callers remain", task.key());
            }
        }
    }

    /// Runs one attempt of a task on a worker thread.
    void execute(FetchTask task) {
        FetchRequest fetchRequest;
        int attempt;
        synchronized (lock) {
            if (task.phase() == FetchTask.Phase.DONE) {
                return;
            }
            task.setPhase(FetchTask.Phase.RUNNING);
            attempt = task.recordAttempt();
            fetchRequest = task.fetchRequest();
        }
        FetchResponse response;
        try {
            transfers.incrementAndGet();
            response = transport.fetch(fetchRequest);
        } catch (NetworkException e) {
            onNetworkFailure(task, e, attempt);
            return;
        } catch (RuntimeException e) {
            logger.warn("fetch of {} failed unexpectedly", task.key(), e);
            fail(task, e);
            return;
        }
        try {
            if (response.notModified()) {
                onNotModified(task, response);
            } else {
                commit(task, response);
            }
        } catch (RuntimeException e) {
            fail(task, e);
        }
    }

    private void onNetworkFailure(FetchTask task, NetworkException error, int attempt) {
        if (!retryPolicy.shouldRetry(error, attempt)) {
            if (error.isTransient()) {
                logger.warn("giving up on {} after {} attempts: {}", task.key(), attempt, error.getMessage());
            } else {
                logger.debug("fetch of {} failed permanently: {}", task.key(), error.getMessage());
            }
            fail(task, error);
            return;
        }
        long delay = retryPolicy.delayMillis(attempt);
        logger.warn("fetch of {} failed (attempt {}/{}), retrying in {}ms: {}",
            task.key(), attempt, retryPolicy.maxAttempts(), delay, error.getMessage());
        synchronized (lock) {
            if (task.phase() == FetchTask.Phase.DONE) {
                return;
            }
            task.setPhase(FetchTask.Phase.BACKING_OFF);
            try {
                retryScheduler.schedule(() -> requeue(task), delay, TimeUnit.MILLISECONDS);
                return;
            } catch (RejectedExecutionException e) {
                logger.debug("retry of {} not scheduled, downloader is closing", task.key());
            }
        }
        fail(task, error);
    }

    private void requeue(FetchTask task) {
        synchronized (lock) {
            if (task.phase() == FetchTask.Phase.DONE) {
                return;
            }
            task.setPhase(FetchTask.Phase.QUEUED);
            try {
                workers.execute(task);
                return;
            } catch (RejectedExecutionException e) {
                logger.debug("{} not requeued, downloader is closing", task.key());
            }
        }
        fail(task, new CancellationException("downloader closed"));
    }

    private void onNotModified(FetchTask task, FetchResponse response) {
        logger.debug("{} not modified", task.key());
        store.refreshMetadata(task.key(), response.metadata()).whenComplete((refreshed, error) -> {
            if (error != null) {
                fail(task, unwrap(error));
            } else if (refreshed.isPresent()) {
                finish(task, refreshed.get(), Set.of(), false, store.tileCountLimit());
            } else {
                logger.debug("{} left the store during revalidation, fetching it again", task.key());
                synchronized (lock) {
                    task.dropConditions();
                }
                requeue(task);
            }
        });
    }

    private void commit(FetchTask task, FetchResponse response) {
        Set<Long> regionIds;
        boolean retainUnlinked;
        synchronized (lock) {
            regionIds = task.regionIds();
            retainUnlinked = task.hasAmbientInterest();
        }
        ResourceRequest request = task.request();
        store.commit(request.key(), request.url(), response.payload(), response.metadata(), regionIds, retainUnlinked)
            .whenComplete((result, error) -> {
                if (error != null) {
                    fail(task, unwrap(error));
                } else {
                    onCommitted(task, result);
                }
            });
    }

    private void onCommitted(FetchTask task, CommitResult result) {
        if (result.quotaRejected()) {
            logger.warn("tile count limit of {} reached, {} not linked{}", result.tileCountLimit(), task.key(),
                result.resource() == null ? " and discarded" : "");
        } else {
            logger.debug("fetched {}", task.key());
        }
        finish(task, result.resource(), result.linkedRegions(), result.quotaRejected(), result.tileCountLimit());
    }

    private void finish(FetchTask task, Resource resource, Set<Long> linkedRegions, boolean quotaRejected,
                        long tileCountLimit) {
        List<FetchTask.Waiter> waiters;
        synchronized (lock) {
            task.setPhase(FetchTask.Phase.DONE);
            inFlight.remove(task.key(), task);
            waiters = task.drainWaiters();
        }
        for (FetchTask.Waiter waiter : waiters) {
            if (waiter.future().isDone()) {
                continue;
            }
            Long regionId = waiter.regionId();
            if (regionId == null) {
                if (resource != null) {
                    waiter.future().complete(resource);
                } else {
                    carryOver(task, waiter);
                }
            } else if (linkedRegions.contains(regionId)) {
                waiter.future().complete(resource);
            } else if (quotaRejected) {
                waiter.future().completeExceptionally(new QuotaExceededException(tileCountLimit));
            } else if (resource != null) {
                linkLate(task, waiter, resource);
            } else {
                carryOver(task, waiter);
            }
        }
    }

    /// Moves a caller the finished task could not serve to a new task for the same key. A
    /// region caller whose region is gone fails instead, as does a caller carried over
    /// [#MAX_CARRY_OVERS] times.
    private void carryOver(FetchTask task, FetchTask.Waiter waiter) {
        Long regionId = waiter.regionId();
        if (regionId != null && store.region(regionId).isEmpty()) {
            logger.debug("region {} no longer exists, not fetching {} for it", regionId, task.key());
            waiter.future().completeExceptionally(new RegionNotFoundException(regionId));
            return;
        }
        if (waiter.rounds() >= MAX_CARRY_OVERS) {
            logger.warn("giving up on {} after {} fetches that could not be delivered", task.key(),
                waiter.rounds() + 1);
            waiter.future().completeExceptionally(new OfflineStorageException(
                task.key() + " was fetched " + (waiter.rounds() + 1) + " times but could not be stored"));
            return;
        }
        attach(task.request(), unconditional(task.request()), waiter.nextRound());
    }

    /// Links a resource for a region caller that joined after the commit was issued.
    private void linkLate(FetchTask task, FetchTask.Waiter waiter, Resource resource) {
        store.link(waiter.regionId(), task.key()).whenComplete((linked, error) -> {
            if (error != null) {
                waiter.future().completeExceptionally(unwrap(error));
            } else if (linked) {
                waiter.future().complete(resource);
            } else {
                carryOver(task, waiter);
            }
        });
    }

    private void fail(FetchTask task, Throwable error) {
        List<FetchTask.Waiter> waiters;
        synchronized (lock) {
            task.setPhase(FetchTask.Phase.DONE);
            inFlight.remove(task.key(), task);
            waiters = task.drainWaiters();
        }
        for (FetchTask.Waiter waiter : waiters) {
            waiter.future().completeExceptionally(error);
        }
    }

    private static FetchRequest unconditional(ResourceRequest request) {
        return FetchRequest.unconditional(request.url(), request.key().kind());
    }

    static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
