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
package io.shardpoller.retrieval;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;

/**
 * Logs GetRecords throttling for one shard. A few throttles in a row are normal and logged at WARN; a run longer than
 * {@code maxConsecutiveWarnThrottles} means the shard is persistently over its limits and is logged at ERROR.
 */
@RequiredArgsConstructor
@Slf4j
public class ThrottlingReporter {

    private final int maxConsecutiveWarnThrottles;
    private final String shardId;

    private int consecutiveThrottles;

    /**
     * @param reason what throttled the call
     */
    public void throttled(final String reason) {
        consecutiveThrottles++;
        final String message = String.format("Shard %s throttled by %s, %d consecutive times", shardId, reason,
                consecutiveThrottles);
        if (consecutiveThrottles <= maxConsecutiveWarnThrottles) {
            getLog().warn(message);
        } else {
            getLog().error(message);
        }
    }

    public void success() {
        consecutiveThrottles = 0;
    }

    protected Logger getLog() {
        return log;
    }
}
