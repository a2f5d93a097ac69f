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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/// Gson configuration for the store's JSON records.
///
/// Records are compact, never HTML-escaped, and omit null fields. The [Gson] instance is
/// thread-safe and shared.
final class StoreGson {

    private static final Gson INSTANCE = new GsonBuilder()
        .disableHtmlEscaping()
        .create();

    private StoreGson() {
    }

    static Gson gson() {
        return INSTANCE;
    }
}
