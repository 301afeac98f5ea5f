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
package io.shardpoller.processor;

import io.shardpoller.lifecycle.events.InitializationInput;
import io.shardpoller.lifecycle.events.ProcessRecordsInput;
import io.shardpoller.lifecycle.events.ShutdownInput;

/**
 * Application callback for one shard. A {@link io.shardpoller.lifecycle.PollingShardConsumer} calls
 * {@link #initialize} once, {@link #processRecords} for every batch in shard order, and {@link #shutdown} at most
 * once when it stops.
 */
public interface ShardRecordProcessor {

    /**
     * Invoked before data records are delivered to the ShardRecordProcessor instance (via processRecords).
     *
     * @param initializationInput Provides information related to initialization
     */
    void initialize(InitializationInput initializationInput);

    /**
     * Process data records. Upon fail over, the new instance will get records with sequence number > checkpoint
     * position.
     *
     * @param processRecordsInput Provides the records to be processed as well as information and capabilities related
     *        to them (eg checkpointing).
     */
    void processRecords(ProcessRecordsInput processRecordsInput);

    /**
     * Invoked when the consumer stops. What the processor should do depends on
     * {@link ShutdownInput#shutdownReason()}:
     * <ul>
     * <li>SHARD_END: the shard is closed and every record has been delivered. The processor <b>must</b> call
     * {@link RecordProcessorCheckpointer#checkpoint()} so that child shards can be processed.</li>
     * <li>REQUESTED: the application is stopping; the lease is still held, so this is the last chance to
     * checkpoint.</li>
     * <li>LEASE_LOST: another worker owns the shard. No checkpointer is provided.</li>
     * </ul>
     *
     * @param shutdownInput the reason and, unless the lease was lost, a checkpointer
     */
    void shutdown(ShutdownInput shutdownInput);
}
