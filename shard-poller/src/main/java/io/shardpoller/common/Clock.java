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
package io.shardpoller.common;

import java.time.Duration;
import java.time.Instant;

/**
 * Source of time for anything that has to wait: the GetRecords rate limiter, retry backoff and idle pacing all go
 * through a Clock so that tests can control both what time it is and how long a sleep lasts.
 */
public interface Clock {

    /**
     * @return the current instant.
     */
    Instant now();

    /**
     * @param start an instant previously returned by {@link #now()}
     * @return time elapsed since {@code start}; negative if {@code start} is in the future.
     */
    default Duration since(Instant start) {
        return Duration.between(start, now());
    }

    /**
     * Blocks the calling thread. Zero and negative durations return immediately.
     *
     * @param duration how long to sleep
     * @throws InterruptedException if the thread is interrupted while sleeping
     */
    void sleep(Duration duration) throws InterruptedException;
}
