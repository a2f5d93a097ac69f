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

/// Scheduling priority of a fetch. Region downloads run ahead of ambient misses.
public enum FetchPriority {
    /// a fetch required by an active region download
    REGION,
    /// an ad-hoc miss or revalidation from the request router
    AMBIENT
}
