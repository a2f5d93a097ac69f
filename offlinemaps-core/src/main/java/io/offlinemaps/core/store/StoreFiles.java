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

import com.google.gson.JsonParseException;
import io.offlinemaps.api.resource.ResourceKey;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.stream.Stream;

/// File helpers for the store.
///
/// Every file is written atomically using write-to-temp-then-rename:
///
/// ```text
///   1. Write bytes to <name>.tmp and force them to the device
///   2. Rename the temp file over <name> (atomic on POSIX)
///
///   If interrupted at any point:
///   - the previous <name> (if any) remains intact
///   - a stray .tmp file may exist; it is deleted when the store is next opened
/// ```
final class StoreFiles {
    private static final Logger logger = LogManager.getLogger(StoreFiles.class);

    static final String TEMP_SUFFIX = ".tmp";

    private StoreFiles() {
    }

    static void writeAtomically(Path target, byte[] bytes) throws IOException {
        Path temp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
        try (FileChannel channel = FileChannel.open(temp,
            StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    static void writeJson(Path target, Object value) throws IOException {
        writeAtomically(target, StoreGson.gson().toJson(value).getBytes(StandardCharsets.UTF_8));
    }

    /// Reads a JSON record.
    /// @throws JsonParseException if the file does not hold a record of the given type
    static <T> T readJson(Path source, Class<T> type) throws IOException {
        String json = Files.readString(source, StandardCharsets.UTF_8);
        T value = StoreGson.gson().fromJson(json, type);
        if (value == null) {
            throw new JsonParseException("empty record in " + source);
        }
        return value;
    }

    /// Deletes a file, logging rather than failing if it cannot be removed. Used only for
    /// files that are no longer referenced by any committed record.
    static void deleteUnreferenced(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.warn("could not delete unreferenced file {}: {}", file, e.getMessage());
        }
    }

    static void deleteContents(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            for (Path path : (Iterable<Path>) paths.sorted(Comparator.reverseOrder())::iterator) {
                if (!path.equals(directory)) {
                    Files.delete(path);
                }
            }
        }
    }

    static String sha256(byte[] bytes) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /// @return the file-name stem for a key: the SHA-256 of its storage form
    static String stemOf(ResourceKey key) {
        return sha256(key.storageKey().getBytes(StandardCharsets.UTF_8));
    }
}
