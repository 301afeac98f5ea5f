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

import java.time.Instant;

import io.shardpoller.checkpoint.SentinelCheckpoint;
import io.shardpoller.common.InitialPositionInStreamExtended;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import lombok.experimental.Accessors;
import org.apache.commons.lang3.StringUtils;
import software.amazon.awssdk.services.kinesis.model.ShardIteratorType;

/**
 * Where in a shard a consumer starts reading. The sequence number is only set for the two sequence number types and
 * the timestamp only for {@link ShardIteratorType#AT_TIMESTAMP}.
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@ToString
public class StartingPosition {
    private final ShardIteratorType type;
    private final String sequenceNumber;
    private final Instant timestamp;

    public static StartingPosition trimHorizon() {
        return new StartingPosition(ShardIteratorType.TRIM_HORIZON, null, null);
    }

    public static StartingPosition latest() {
        return new StartingPosition(ShardIteratorType.LATEST, null, null);
    }

    public static StartingPosition atSequenceNumber(@NonNull final String sequenceNumber) {
        return new StartingPosition(ShardIteratorType.AT_SEQUENCE_NUMBER, sequenceNumber, null);
    }

    public static StartingPosition afterSequenceNumber(@NonNull final String sequenceNumber) {
        return new StartingPosition(ShardIteratorType.AFTER_SEQUENCE_NUMBER, sequenceNumber, null);
    }

    public static StartingPosition atTimestamp(@NonNull final Instant timestamp) {
        return new StartingPosition(ShardIteratorType.AT_TIMESTAMP, null, timestamp);
    }

    /**
     * Resolves the position to resume from given what the lease store has recorded for the shard.
     *
     * @param checkpoint the recorded checkpoint, null or empty if the shard has never been checkpointed
     * @param initialPosition where to start when there is no usable checkpoint
     * @return the position to start reading from
     */
    public static StartingPosition fromCheckpoint(
            final String checkpoint, @NonNull final InitialPositionInStreamExtended initialPosition) {
        if (StringUtils.isEmpty(checkpoint)
                || SentinelCheckpoint.TRIM_HORIZON.matches(checkpoint)
                || SentinelCheckpoint.LATEST.matches(checkpoint)
                || SentinelCheckpoint.AT_TIMESTAMP.matches(checkpoint)) {
            return fromInitialPosition(initialPosition);
        }
        if (SentinelCheckpoint.SHARD_END.matches(checkpoint)) {
            throw new IllegalArgumentException("Cannot start reading a shard that has been checkpointed at SHARD_END");
        }
        return afterSequenceNumber(checkpoint);
    }

    private static StartingPosition fromInitialPosition(final InitialPositionInStreamExtended initialPosition) {
        switch (initialPosition.getInitialPositionInStream()) {
            case TRIM_HORIZON:
                return trimHorizon();
            case AT_TIMESTAMP:
                return atTimestamp(initialPosition.getTimestamp());
            case LATEST:
            default:
                return latest();
        }
    }
}
