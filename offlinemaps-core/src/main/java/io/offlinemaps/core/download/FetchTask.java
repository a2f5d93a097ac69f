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

import io.offlinemaps.api.resource.Resource;
import io.offlinemaps.api.resource.ResourceKey;
import io.offlinemaps.api.resource.ResourceRequest;
import io.offlinemaps.api.transport.FetchRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;

/// One in-flight network operation for a key, shared by every caller that asked for the key
/// while it was outstanding.
///
/// Tasks order by priority, then by creation sequence, so the [Downloader]'s work queue runs
/// region fetches first and otherwise preserves arrival order. All mutable state is guarded by
/// the downloader's lock.
final class FetchTask implements Runnable, Comparable<FetchTask> {

    /// A caller waiting on the task. `regionId` is null for ambient callers; `rounds` counts
    /// how many tasks the caller was carried over from.
    record Waiter(CompletableFuture<Resource> future, Long regionId, int rounds) {

        Waiter(CompletableFuture<Resource> future, Long regionId) {
            this(future, regionId, 0);
        }

        Waiter nextRound() {
            return new Waiter(future, regionId, rounds + 1);
        }
    }

    enum Phase {
        /// waiting in the work queue
        QUEUED,
        /// on a worker or committing its result
        RUNNING,
        /// waiting for a retry delay to elapse
        BACKING_OFF,
        /// completed, failed, or abandoned
        DONE
    }

    private final Downloader downloader;
    private final ResourceRequest request;
    private final long sequence;
    private final List<Waiter> waiters = new ArrayList<>();
    private final Set<Long> regionIds = new TreeSet<>();

    private volatile FetchPriority priority;
    private FetchRequest fetchRequest;
    private boolean ambientInterest;
    private Phase phase = Phase.QUEUED;
    private int attempts;

    FetchTask(Downloader downloader, ResourceRequest request, FetchRequest fetchRequest, FetchPriority priority,
              long sequence) {
        this.downloader = downloader;
        this.request = request;
        this.fetchRequest = fetchRequest;
        this.priority = priority;
        this.sequence = sequence;
    }

    @Override
    public void run() {
        downloader.execute(this);
    }

    @Override
    public int compareTo(FetchTask other) {
        int byPriority = priority.compareTo(other.priority);
        return byPriority != 0 ? byPriority : Long.compare(sequence, other.sequence);
    }

    ResourceKey key() {
        return request.key();
    }

    ResourceRequest request() {
        return request;
    }

    FetchPriority priority() {
        return priority;
    }

    void setPriority(FetchPriority priority) {
        this.priority = priority;
    }

    FetchRequest fetchRequest() {
        return fetchRequest;
    }

    void dropConditions() {
        fetchRequest = fetchRequest.withoutConditions();
    }

    void addWaiter(Waiter waiter) {
        waiters.add(waiter);
        if (waiter.regionId() == null) {
            ambientInterest = true;
        } else {
            regionIds.add(waiter.regionId());
        }
    }

    /// @return true if no waiter remains
    boolean removeWaiter(Waiter waiter) {
        waiters.remove(waiter);
        return waiters.isEmpty();
    }

    List<Waiter> drainWaiters() {
        List<Waiter> drained = new ArrayList<>(waiters);
        waiters.clear();
        return drained;
    }

    /// @return the regions that asked for this resource, including cancelled callers
    Set<Long> regionIds() {
        return Set.copyOf(regionIds);
    }

    boolean hasAmbientInterest() {
        return ambientInterest;
    }

    Phase phase() {
        return phase;
    }

    void setPhase(Phase phase) {
        this.phase = phase;
    }

    int recordAttempt() {
        return ++attempts;
    }

    int attempts() {
        return attempts;
    }

    @Override
    public String toString() {
        return "FetchTask{" + request.key() + ", " + priority + ", attempts=" + attempts + "}";
    }
}
