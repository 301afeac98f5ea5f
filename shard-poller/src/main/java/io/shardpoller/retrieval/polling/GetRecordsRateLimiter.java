/*
 * Copyright 2019 Amazon.com, Inc. or its affiliates.
 * Licensed under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.shardpoller.retrieval.polling;

import java.time.Duration;
import java.time.Instant;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import io.shardpoller.common.Clock;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps one shard's GetRecords traffic within the per-shard Kinesis limits: a number of calls per second and an
 * average number of bytes read per second.
 * <p>
 * The byte limit is a rate, not a per-call cap. A single call may return more than a second's worth of bytes; the
 * next {@link #acquire()} then sleeps long enough for the average since the byte window started to fall back to the
 * cap. The wait is {@code bytesInWindow / maxBytesPerSecond - elapsed} seconds, never negative: with a 2 MB/s cap,
 * 10 MB read one second into the window means a 4 second wait, and 8 MB read 0.2 seconds in means 3.8 seconds.
 * Not thread safe; each consumer owns its own limiter.
 * </p>
 */
@Slf4j
public class GetRecordsRateLimiter {

    static final Duration CALL_WINDOW = Duration.ofSeconds(1);

    private static final long NANOS_PER_SECOND = Duration.ofSeconds(1).toNanos();

    private final int maxCallsPerSecond;
    private final long maxBytesPerSecond;
    private final Clock clock;

    @Getter(AccessLevel.PACKAGE)
    @Accessors(fluent = true)
    private final PacingWindow window;

    public GetRecordsRateLimiter(final int maxCallsPerSecond, final long maxBytesPerSecond, @NonNull final Clock clock) {
        Preconditions.checkArgument(maxCallsPerSecond > 0, "maxCallsPerSecond must be positive");
        Preconditions.checkArgument(maxBytesPerSecond > 0, "maxBytesPerSecond must be positive");
        this.maxCallsPerSecond = maxCallsPerSecond;
        this.maxBytesPerSecond = maxBytesPerSecond;
        this.clock = clock;
        this.window = new PacingWindow(clock.now());
    }

    public GetRecordsRateLimiter(@NonNull final PollingConfig config, @NonNull final Clock clock) {
        this(config.maxGetRecordsCallsPerSecond(), config.maxBytesPerSecond(), clock);
    }

    /**
     * Called before every GetRecords call. Sleeps off any byte-rate overrun, then claims one call from the current
     * second's budget.
     *
     * @throws LocalThroughputExceededException if the call budget for the current second is spent
     * @throws InterruptedException if interrupted while sleeping
     */
    public void acquire() throws LocalThroughputExceededException, InterruptedException {
        final Duration cooldown = byteCooldown(clock.now());
        if (!cooldown.isZero()) {
            log.debug("Read {} bytes since {}, sleeping {} ms to stay under {} bytes per second",
                    window.bytesInWindow(), window.byteWindowStart(), cooldown.toMillis(), maxBytesPerSecond);
            clock.sleep(cooldown);
            window.resetBytes(clock.now());
        }

        final Instant now = clock.now();
        final Duration callWindowElapsed = Duration.between(window.callWindowStart(), now);
        if (callWindowElapsed.compareTo(CALL_WINDOW) >= 0) {
            window.resetCalls(now);
        } else if (window.callsInWindow() >= maxCallsPerSecond) {
            throw new LocalThroughputExceededException(window.callsInWindow(), CALL_WINDOW.minus(callWindowElapsed));
        }
        window.addCall();
    }

    /**
     * Records the payload bytes returned by a successful GetRecords call.
     *
     * @param bytes total size of the record payloads
     */
    public void recordBytesRead(final long bytes) {
        Preconditions.checkArgument(bytes >= 0, "bytes must not be negative");
        window.addBytes(bytes);
    }

    /**
     * Time to wait before the next call so that the bytes read since the byte window started average out to no more
     * than the byte cap: {@code (bytesInWindow - maxBytesPerSecond * elapsed) / maxBytesPerSecond}. Resets the byte
     * window if it is older than a second and already within the cap.
     */
    @VisibleForTesting
    Duration byteCooldown(final Instant now) {
        Duration elapsed = Duration.between(window.byteWindowStart(), now);
        if (elapsed.isNegative()) {
            elapsed = Duration.ZERO;
        }
        final long bytes = window.bytesInWindow();
        final Duration required = Duration.ofNanos(Math.round((double) bytes / maxBytesPerSecond * NANOS_PER_SECOND));
        final Duration cooldown = required.minus(elapsed);
        if (cooldown.isNegative() || cooldown.isZero()) {
            if (elapsed.compareTo(CALL_WINDOW) >= 0) {
                window.resetBytes(now);
            }
            return Duration.ZERO;
        }
        return cooldown;
    }
}
