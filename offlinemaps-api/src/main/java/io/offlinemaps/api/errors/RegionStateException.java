package io.offlinemaps.api.errors;

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

import io.offlinemaps.api.region.RegionState;

/// Raised when an operation is not allowed in a region's current state, such as deleting a
/// region whose download is active.
public class RegionStateException extends OfflineStorageException {
    private final long regionId;
    private final RegionState state;

    public RegionStateException(long regionId, RegionState state, String message) {
        super("offline region " + regionId + " is " + state + ": " + message);
        this.regionId = regionId;
        this.state = state;
    }

    public long getRegionId() {
        return regionId;
    }

    public RegionState getState() {
        return state;
    }
}
