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

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Thrown by {@link GetRecordsRateLimiter#acquire()} when the shard's GetRecords call budget for the current second is
 * already spent. The caller should skip the cycle and wait {@link #retryAfter()} rather than call Kinesis and be
 * throttled.
 */
public class LocalThroughputExceededException extends Exception {

    private static final long serialVersionUID = 1L;

    @Getter
    @Accessors(fluent = true)
    private final Duration retryAfter;

    public LocalThroughputExceededException(final int callsInWindow, final Duration retryAfter) {
        super("GetRecords call budget exhausted after " + callsInWindow + " calls; next call allowed in "
                + retryAfter.toMillis() + " ms");
        this.retryAfter = retryAfter;
    }
}
