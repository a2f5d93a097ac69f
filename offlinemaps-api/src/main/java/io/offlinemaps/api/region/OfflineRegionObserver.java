package io.offlinemaps.api.region;

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

import io.offlinemaps.api.resource.ResourceKey;

/// Receives progress of an offline region's download.
///
/// Delivery is at-least-once: the same status may arrive more than once. Implementations should
/// compare the monotonically increasing counters of [OfflineRegionStatus] rather than count calls.
public interface OfflineRegionObserver {

    /// Called after each resource completes or fails, and once when the download ends.
    /// @param status the region's status at the time of the event
    void statusChanged(OfflineRegionStatus status);

    /// Called when a resource failed permanently; the download continues with its siblings.
    /// @param key the resource that failed
    /// @param error the failure
    default void resourceError(ResourceKey key, Throwable error) {
    }

    /// Called when the download stops because the global tile-count limit was reached.
    /// @param limit the limit in force
    default void tileCountLimitExceeded(long limit) {
    }
}
