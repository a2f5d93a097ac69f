package io.offlinemaps.core.config;

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

import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Configuration of an offline cache.
///
/// Defaults follow the original mobile client: a 50 MiB ambient cache, a 6000 tile offline
/// limit, and tiles enumerated up to zoom 22.
///
/// @param storePath the directory holding the persistent store
/// @param maximumAmbientCacheSize upper bound in bytes for resources not linked to any region
/// @param tileCountLimit upper bound for tiles linked to offline regions
/// @param workerThreads number of simultaneous transfers
/// @param queueDepth number of queued ambient fetches accepted before new ones are rejected
/// @param maxAttempts attempts per resource before a transient failure becomes terminal
/// @param initialBackoff delay before the first retry
/// @param maxBackoff upper bound of the retry delay
/// @param regionFetchWindow outstanding fetches allowed per active region
/// @param maxZoom highest zoom level a region may request
/// @param accessToken token appended to remote requests, or null
public record OfflineCacheConfig(
    Path storePath,
    long maximumAmbientCacheSize,
    long tileCountLimit,
    int workerThreads,
    int queueDepth,
    int maxAttempts,
    Duration initialBackoff,
    Duration maxBackoff,
    int regionFetchWindow,
    int maxZoom,
    String accessToken
) {
    public static final long DEFAULT_MAXIMUM_AMBIENT_CACHE_SIZE = 50L * 1024 * 1024;
    public static final long DEFAULT_TILE_COUNT_LIMIT = 6000;
    public static final int DEFAULT_MAX_ZOOM = 22;

    /// Location of the optional user configuration file
    public static final Path DEFAULT_CONFIG_FILE =
        Path.of(System.getProperty("user.home"), ".config", "offlinemaps", "offline.yaml");

    private static final Set<String> KEYS = Set.of(
        "store_path", "maximum_ambient_cache_size", "tile_count_limit", "worker_threads",
        "queue_depth", "max_attempts", "initial_backoff_ms", "max_backoff_ms",
        "region_fetch_window", "max_zoom", "access_token"
    );

    public OfflineCacheConfig {
        Objects.requireNonNull(storePath, "store path is required");
        Objects.requireNonNull(initialBackoff, "initial backoff is required");
        Objects.requireNonNull(maxBackoff, "max backoff is required");
        if (maximumAmbientCacheSize < 0) {
            throw new IllegalArgumentException("maximum ambient cache size cannot be negative");
        }
        if (tileCountLimit < 0) {
            throw new IllegalArgumentException("tile count limit cannot be negative");
        }
        if (workerThreads <= 0) throw new IllegalArgumentException("worker threads must be positive");
        if (queueDepth <= 0) throw new IllegalArgumentException("queue depth must be positive");
        if (maxAttempts <= 0) throw new IllegalArgumentException("max attempts must be positive");
        if (regionFetchWindow <= 0) throw new IllegalArgumentException("region fetch window must be positive");
        if (maxZoom < 0 || maxZoom > 30) throw new IllegalArgumentException("max zoom must be within 0..30");
        if (initialBackoff.isNegative() || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("backoff must satisfy 0 <= initial <= max");
        }
    }

    /// Starts a builder with default values for everything but the store path.
    /// @param storePath the directory holding the persistent store
    /// @return a builder
    public static Builder builder(Path storePath) {
        return new Builder(storePath);
    }

    /// Reads a YAML configuration file. Keys use snake case; any key left out keeps its default.
    ///
    /// ```yaml
    /// store_path: ~/.cache/offlinemaps
    /// maximum_ambient_cache_size: 52428800
    /// tile_count_limit: 6000
    /// worker_threads: 8
    /// ```
    ///
    /// @param file the YAML file
    /// @return the configuration
    /// @throws IllegalArgumentException if the file contains unknown keys or invalid values
    public static OfflineCacheConfig load(Path file) {
        Object document;
        try {
            Load yaml = new Load(LoadSettings.builder().build());
            document = yaml.loadFromString(Files.readString(file));
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read " + file, e);
        }
        if (!(document instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException(file + " must contain a mapping of configuration keys");
        }
        for (Object key : map.keySet()) {
            if (!KEYS.contains(String.valueOf(key))) {
                throw new IllegalArgumentException("unknown configuration key '" + key + "' in " + file);
            }
        }
        Object storePath = map.get("store_path");
        if (storePath == null) {
            throw new IllegalArgumentException("store_path is required in " + file);
        }
        Builder builder = builder(expandHome(String.valueOf(storePath)));
        longValue(map, "maximum_ambient_cache_size").ifPresent(builder::maximumAmbientCacheSize);
        longValue(map, "tile_count_limit").ifPresent(builder::tileCountLimit);
        longValue(map, "worker_threads").ifPresent(v -> builder.workerThreads(Math.toIntExact(v)));
        longValue(map, "queue_depth").ifPresent(v -> builder.queueDepth(Math.toIntExact(v)));
        longValue(map, "max_attempts").ifPresent(v -> builder.maxAttempts(Math.toIntExact(v)));
        longValue(map, "initial_backoff_ms").ifPresent(v -> builder.initialBackoff(Duration.ofMillis(v)));
        longValue(map, "max_backoff_ms").ifPresent(v -> builder.maxBackoff(Duration.ofMillis(v)));
        longValue(map, "region_fetch_window").ifPresent(v -> builder.regionFetchWindow(Math.toIntExact(v)));
        longValue(map, "max_zoom").ifPresent(v -> builder.maxZoom(Math.toIntExact(v)));
        Object token = map.get("access_token");
        if (token != null) {
            builder.accessToken(String.valueOf(token));
        }
        return builder.build();
    }

    /// Reads [#DEFAULT_CONFIG_FILE] if it exists.
    /// @return the configuration, or empty if the file does not exist
    public static Optional<OfflineCacheConfig> loadDefault() {
        return Files.exists(DEFAULT_CONFIG_FILE) ? Optional.of(load(DEFAULT_CONFIG_FILE)) : Optional.empty();
    }

    private static Optional<Long> longValue(Map<?, ?> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Number number) {
            return Optional.of(number.longValue());
        }
        throw new IllegalArgumentException("configuration key '" + key + "' must be a number, got '" + value + "'");
    }

    private static Path expandHome(String path) {
        if (path.startsWith("~")) {
            return Path.of(System.getProperty("user.home") + path.substring(1));
        }
        return Path.of(path);
    }

    public Builder toBuilder() {
        return builder(storePath)
            .maximumAmbientCacheSize(maximumAmbientCacheSize)
            .tileCountLimit(tileCountLimit)
            .workerThreads(workerThreads)
            .queueDepth(queueDepth)
            .maxAttempts(maxAttempts)
            .initialBackoff(initialBackoff)
            .maxBackoff(maxBackoff)
            .regionFetchWindow(regionFetchWindow)
            .maxZoom(maxZoom)
            .accessToken(accessToken);
    }

    /// Fluent builder for [OfflineCacheConfig].
    public static final class Builder {
        private final Path storePath;
        private long maximumAmbientCacheSize = DEFAULT_MAXIMUM_AMBIENT_CACHE_SIZE;
        private long tileCountLimit = DEFAULT_TILE_COUNT_LIMIT;
        private int workerThreads = 8;
        private int queueDepth = 1024;
        private int maxAttempts = 5;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(30);
        private int regionFetchWindow = 16;
        private int maxZoom = DEFAULT_MAX_ZOOM;
        private String accessToken;

        private Builder(Path storePath) {
            this.storePath = storePath;
        }

        public Builder maximumAmbientCacheSize(long bytes) {
            this.maximumAmbientCacheSize = bytes;
            return this;
        }

        public Builder tileCountLimit(long limit) {
            this.tileCountLimit = limit;
            return this;
        }

        public Builder workerThreads(int threads) {
            this.workerThreads = threads;
            return this;
        }

        public Builder queueDepth(int depth) {
            this.queueDepth = depth;
            return this;
        }

        public Builder maxAttempts(int attempts) {
            this.maxAttempts = attempts;
            return this;
        }

        public Builder initialBackoff(Duration backoff) {
            this.initialBackoff = backoff;
            return this;
        }

        public Builder maxBackoff(Duration backoff) {
            this.maxBackoff = backoff;
            return this;
        }

        public Builder regionFetchWindow(int window) {
            this.regionFetchWindow = window;
            return this;
        }

        public Builder maxZoom(int zoom) {
            this.maxZoom = zoom;
            return this;
        }

        public Builder accessToken(String token) {
            this.accessToken = token;
            return this;
        }

        public OfflineCacheConfig build() {
            return new OfflineCacheConfig(storePath, maximumAmbientCacheSize, tileCountLimit, workerThreads,
                queueDepth, maxAttempts, initialBackoff, maxBackoff, regionFetchWindow, maxZoom, accessToken);
        }
    }
}
