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

import java.nio.file.Path;

/// Reported once, from opening a store, when persisted data could not be trusted. By the
/// time this is thrown the store has been reset to empty and is open for use.
public class StorageCorruptionException extends OfflineStorageException {
    private final Path storePath;

    public StorageCorruptionException(Path storePath, String message, Throwable cause) {
        super("offline store at " + storePath + " was corrupt and has been reset: " + message, cause);
        this.storePath = storePath;
    }

    public Path getStorePath() {
        return storePath;
    }
}
