/// The durable resource and region store and its ambient-cache eviction policy.
///
/// [io.offlinemaps.core.store.ResourceStore] owns every byte on disk. Its index of
/// [io.offlinemaps.core.store.StoredEntry] snapshots serves concurrent reads, while a single
/// writer thread applies mutations in order.
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

