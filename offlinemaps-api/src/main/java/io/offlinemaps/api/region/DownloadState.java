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

/// The observable phase of an offline region's download.
public enum DownloadState {
    /// The region is inactive
    INACTIVE,
    /// Manifest entries are being fetched
    DOWNLOADING,
    /// Every manifest entry is stored and linked to the region
    COMPLETE,
    /// The manifest was exhausted but some resources failed permanently
    COMPLETE_WITH_ERRORS,
    /// The global tile-count limit stopped the download
    QUOTA_EXCEEDED;

    /// @return true for the phases a download ends in
    public boolean isTerminal() {
        return this == COMPLETE || this == COMPLETE_WITH_ERRORS || this == QUOTA_EXCEEDED;
    }
}
