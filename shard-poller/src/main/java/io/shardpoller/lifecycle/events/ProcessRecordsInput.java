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
package io.shardpoller.lifecycle.events;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import io.shardpoller.processor.RecordProcessorCheckpointer;
import io.shardpoller.processor.ShardRecordProcessor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;
import software.amazon.awssdk.services.kinesis.model.Record;

/**
 * One batch for {@link ShardRecordProcessor#processRecords(ProcessRecordsInput)}.
 */
@Builder
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@ToString(exclude = "checkpointer")
public class ProcessRecordsInput {
    /**
     * Records in shard order. Empty only when the consumer is configured to deliver empty batches.
     */
    private final List<Record> records;
    /**
     * Lag of the batch behind the tip of the stream, as reported by Kinesis. May be null.
     */
    private final Long millisBehindLatest;
    /**
     * Set on the last batch of a closed shard. The consumer shuts the processor down with SHARD_END right after it.
     */
    private final boolean isAtShardEnd;
    /**
     * Checkpoints this shard. Valid until the consumer stops.
     */
    private final RecordProcessorCheckpointer checkpointer;
    /**
     * When the GetRecords call that returned this batch was issued.
     */
    private final Instant fetchedAt;
    /**
     * When the batch was handed to the processor.
     */
    private final Instant deliveredAt;

    /**
     * @return time between issuing the GetRecords call and handing its records over, zero if either is unknown
     */
    public Duration deliveryLatency() {
        return fetchedAt != null && deliveredAt != null ? Duration.between(fetchedAt, deliveredAt) : Duration.ZERO;
    }
}
