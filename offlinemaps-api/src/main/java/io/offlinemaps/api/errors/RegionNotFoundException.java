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

/// Raised when an operation names a region id that does not exist.
public class RegionNotFoundException extends OfflineStorageException {
    private final long regionId;

    public RegionNotFoundException(long regionId) {
        super("offline region " + regionId + " does not exist");
        this.regionId = regionId;
    }

    public long getRegionId() {
        return regionId;
    }
}
