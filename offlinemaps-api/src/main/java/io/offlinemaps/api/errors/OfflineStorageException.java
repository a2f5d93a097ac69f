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

/// Base class of every error surfaced by the offline cache to applications.
///
/// The hierarchy is unchecked so that it travels unchanged as the cause of an exceptionally
/// completed [java.util.concurrent.CompletableFuture].
public class OfflineStorageException extends RuntimeException {

    public OfflineStorageException(String message) {
        super(message);
    }

    public OfflineStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
