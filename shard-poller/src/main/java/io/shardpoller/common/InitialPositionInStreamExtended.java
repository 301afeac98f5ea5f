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

import java.time.Instant;

import com.google.common.base.Preconditions;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * An {@link InitialPositionInStream} together with the start time it needs when it is
 * {@link InitialPositionInStream#AT_TIMESTAMP}. Built through the two factories, which reject a timestamp-less
 * AT_TIMESTAMP.
 */
@ToString
@EqualsAndHashCode
public class InitialPositionInStreamExtended {

    private final InitialPositionInStream initialPositionInStream;
    private final Instant timestamp;

    private InitialPositionInStreamExtended(final InitialPositionInStream initialPositionInStream,
            final Instant timestamp) {
        this.initialPositionInStream = initialPositionInStream;
        this.timestamp = timestamp;
    }

    public InitialPositionInStream getInitialPositionInStream() {
        return initialPositionInStream;
    }

    /**
     * @return the start time; null unless the position is AT_TIMESTAMP.
     */
    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @param position LATEST or TRIM_HORIZON
     */
    public static InitialPositionInStreamExtended newInitialPosition(final InitialPositionInStream position) {
        Preconditions.checkArgument(position == InitialPositionInStream.LATEST
                        || position == InitialPositionInStream.TRIM_HORIZON,
                "%s needs a timestamp, use newInitialPositionAtTimestamp", position);
        return new InitialPositionInStreamExtended(position, null);
    }

    public static InitialPositionInStreamExtended newInitialPositionAtTimestamp(final Instant timestamp) {
        Preconditions.checkArgument(timestamp != null, "A timestamp is required to start AT_TIMESTAMP");
        return new InitialPositionInStreamExtended(InitialPositionInStream.AT_TIMESTAMP, timestamp);
    }
}
