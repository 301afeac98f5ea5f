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

import java.time.Instant;

import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Consumption counters for one shard. Calls are counted per one second window. Bytes accumulate until the average
 * read rate since {@link #byteWindowStart()} is back under the byte cap, so a burst that overran one second is paid
 * off over the following ones.
 */
@Getter
@Accessors(fluent = true)
@ToString
public class PacingWindow {

    private Instant callWindowStart;
    private int callsInWindow;

    private Instant byteWindowStart;
    private long bytesInWindow;

    PacingWindow(final Instant start) {
        this.callWindowStart = start;
        this.byteWindowStart = start;
    }

    void resetCalls(final Instant now) {
        callWindowStart = now;
        callsInWindow = 0;
    }

    void resetBytes(final Instant now) {
        byteWindowStart = now;
        bytesInWindow = 0;
    }

    void addCall() {
        callsInWindow++;
    }

    void addBytes(final long bytes) {
        bytesInWindow += bytes;
    }
}
