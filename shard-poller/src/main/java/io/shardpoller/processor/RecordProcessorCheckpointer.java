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

import io.shardpoller.exceptions.InvalidStateException;
import io.shardpoller.exceptions.KinesisClientLibDependencyException;
import io.shardpoller.exceptions.ShutdownException;
import io.shardpoller.exceptions.ThrottlingException;
import software.amazon.awssdk.services.kinesis.model.Record;

/**
 * Used by RecordProcessors when they want to checkpoint their progress.
 * The consumer passes an object implementing this interface to RecordProcessors, so they can checkpoint their
 * progress.
 */
public interface RecordProcessorCheckpointer {

    /**
     * This method will checkpoint the progress at the last data record that was delivered to the record processor.
     * At the end of a shard this records SHARD_END.
     * Upon fail over (after a successful checkpoint() call), the new/replacement ShardRecordProcessor instance
     * will receive data records whose sequenceNumber > checkpoint position.
     *
     * @throws ThrottlingException Can't store checkpoint. Can be caused by checkpointing too frequently.
     * @throws ShutdownException The consumer has stopped. Another instance may have started processing some of
     *         these records already.
     * @throws InvalidStateException Can't store checkpoint (e.g. the lease table doesn't exist).
     * @throws KinesisClientLibDependencyException Encountered an issue when storing the checkpoint. The application can
     *         backoff and retry.
     */
    void checkpoint()
            throws KinesisClientLibDependencyException, InvalidStateException, ThrottlingException, ShutdownException;

    /**
     * This method will checkpoint the progress at the provided record.
     *
     * @param record A record at which to checkpoint in this shard.
     * @throws ThrottlingException Can't store checkpoint.
     * @throws ShutdownException The consumer has stopped.
     * @throws InvalidStateException Can't store checkpoint.
     * @throws KinesisClientLibDependencyException Encountered an issue when storing the checkpoint.
     */
    void checkpoint(Record record)
            throws KinesisClientLibDependencyException, InvalidStateException, ThrottlingException, ShutdownException;

    /**
     * This method will checkpoint the progress at the provided sequenceNumber. A null sequence number marks the shard
     * as completely processed (SHARD_END), and is only accepted once the shard has been read to its end.
     *
     * @param sequenceNumber A sequence number at which to checkpoint in this shard.
     * @throws ThrottlingException Can't store checkpoint.
     * @throws ShutdownException The consumer has stopped.
     * @throws InvalidStateException Can't store checkpoint.
     * @throws KinesisClientLibDependencyException Encountered an issue when storing the checkpoint.
     * @throws IllegalArgumentException The sequence number is not a valid sequence number, is smaller than the last
     *         checkpoint, or is larger than the greatest sequence number delivered to the record processor. Also
     *         thrown before any record has been delivered, and for a null sequence number while the shard is open.
     */
    void checkpoint(String sequenceNumber)
            throws KinesisClientLibDependencyException, InvalidStateException, ThrottlingException, ShutdownException,
                    IllegalArgumentException;

    /**
     * @return the checkpoint last stored for the shard, or null if there is none.
     */
    String lastCheckpointValue();

    /**
     * @return the greatest sequence number delivered so far, SHARD_END once the shard is closed, or null before the
     *         first record.
     */
    String largestPermittedCheckpointValue();
}
