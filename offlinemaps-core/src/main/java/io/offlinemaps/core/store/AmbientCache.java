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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.NavigableSet;
import java.util.TreeSet;

/// Least-recently-used accounting for ambient (unlinked) entries.
///
/// Entries are ordered by access time, with the commit sequence as a tie-breaker, so the
/// first entry is always the eviction candidate. Instances are confined to the store's writer
/// thread; only the byte and entry counts are safe to read from other threads.
public class AmbientCache {

    static final Comparator<StoredEntry> LRU_ORDER =
        Comparator.comparing(StoredEntry::accessedAt).thenComparingLong(StoredEntry::sequence);

    private final NavigableSet<StoredEntry> entries = new TreeSet<>(LRU_ORDER);
    private volatile long size;
    private volatile int count;
    private volatile long maximumSize;

    public AmbientCache(long maximumSize) {
        setMaximumSize(maximumSize);
    }

    void add(StoredEntry entry) {
        if (entries.add(entry)) {
            size += entry.size();
            count = entries.size();
        }
    }

    void remove(StoredEntry entry) {
        if (entries.remove(entry)) {
            size -= entry.size();
            count = entries.size();
        }
    }

    void clear() {
        entries.clear();
        size = 0;
        count = 0;
    }

    /// @return total payload bytes of ambient entries
    public long size() {
        return size;
    }

    public int count() {
        return count;
    }

    public long maximumSize() {
        return maximumSize;
    }

    void setMaximumSize(long bytes) {
        if (bytes < 0) {
            throw new IllegalArgumentException("maximum ambient cache size cannot be negative: " + bytes);
        }
        this.maximumSize = bytes;
    }

    /// @return the number of bytes over the maximum, or zero
    long excess() {
        return Math.max(0, size - maximumSize);
    }

    /// Selects the least recently used entries whose sizes sum to at least `bytesToFree`, or
    /// every entry if the whole cache is smaller.
    /// @param bytesToFree bytes to reclaim
    /// @return victims, least recently used first
    List<StoredEntry> selectVictims(long bytesToFree) {
        List<StoredEntry> victims = new ArrayList<>();
        long freed = 0;
        for (StoredEntry entry : entries) {
            if (freed >= bytesToFree) {
                break;
            }
            victims.add(entry);
            freed += entry.size();
        }
        return victims;
    }

    List<StoredEntry> snapshot() {
        return new ArrayList<>(entries);
    }
}
