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

/// Raised when persisting a tile for an offline region would push the number of region tiles
/// past the configured tile-count limit. The tile is discarded and the region's download halts.
public class QuotaExceededException extends OfflineStorageException {
    private final long tileCountLimit;

    public QuotaExceededException(long tileCountLimit) {
        super("offline tile count limit of " + tileCountLimit + " exceeded");
        this.tileCountLimit = tileCountLimit;
    }

    /// @return the limit in force when the breach was detected
    public long getTileCountLimit() {
        return tileCountLimit;
    }
}
