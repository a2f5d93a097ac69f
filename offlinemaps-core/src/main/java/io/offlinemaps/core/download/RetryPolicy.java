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


import io.offlinemaps.api.errors.NetworkException;
import io.offlinemaps.core.config.OfflineCacheConfig;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/// Exponential backoff for transient transfer failures.
///
/// The delay before retry `n` is `min(initialBackoff * 2^(n-1), maxBackoff)` plus up to 10%
/// random jitter, so that workers retrying the same origin do not stay in lockstep.
///
/// @param maxAttempts total attempts per resource, including the first
/// @param initialBackoff delay before the first retry
/// @param maxBackoff upper bound of the delay before jitter
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(5, Duration.ofSeconds(1), Duration.ofSeconds(30));

    public RetryPolicy {
        Objects.requireNonNull(initialBackoff, "initialBackoff cannot be null");
        Objects.requireNonNull(maxBackoff, "maxBackoff cannot be null");
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        if (initialBackoff.isNegative() || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("backoff must satisfy 0 <= initial <= max");
        }
    }

    public static RetryPolicy from(OfflineCacheConfig config) {
        return new RetryPolicy(config.maxAttempts(), config.initialBackoff(), config.maxBackoff());
    }

    /// @param error the failure of the latest attempt
    /// @param attempts attempts made so far
    /// @return true if another attempt should be scheduled
    public boolean shouldRetry(NetworkException error, int attempts) {
        return error.isTransient() && attempts < maxAttempts;
    }

    /// @param attempt the number of the failed attempt, starting at 1
    /// @return the delay before the next attempt, without jitter
    public long baseDelayMillis(int attempt) {
        double delay = initialBackoff.toMillis() * Math.pow(2, Math.max(attempt - 1, 0));
        return (long) Math.min(delay, maxBackoff.toMillis());
    }

    /// @param attempt the number of the failed attempt, starting at 1
    /// @return the delay before the next attempt, with jitter
    public long delayMillis(int attempt) {
        long base = baseDelayMillis(attempt);
        long jitter = (long) (base * 0.1 * ThreadLocalRandom.current().nextDouble());
        return base + jitter;
    }
}
