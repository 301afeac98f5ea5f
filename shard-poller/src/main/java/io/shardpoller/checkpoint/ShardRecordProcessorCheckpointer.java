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
package io.shardpoller.checkpoint;

import java.math.BigInteger;

import io.shardpoller.exceptions.InvalidStateException;
import io.shardpoller.exceptions.KinesisClientLibDependencyException;
import io.shardpoller.exceptions.ShutdownException;
import io.shardpoller.exceptions.ThrottlingException;
import io.shardpoller.leases.LeaseCheckpointStore;
import io.shardpoller.leases.ShardLease;
import io.shardpoller.leases.exceptions.DependencyException;
import io.shardpoller.leases.exceptions.ProvisionedThroughputException;
import io.shardpoller.processor.RecordProcessorCheckpointer;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import software.amazon.awssdk.services.kinesis.model.Record;

/**
 * Binds the lease store to the consumer's shard, so a record processor can checkpoint without knowing which shard or
 * lease it is working on.
 */
@RequiredArgsConstructor
@Slf4j
public class ShardRecordProcessorCheckpointer implements RecordProcessorCheckpointer {
    @NonNull
    private final ShardLease lease;

    @NonNull
    private final LeaseCheckpointStore leaseCheckpointStore;

    @Getter
    @Accessors(fluent = true)
    private String largestPermittedCheckpointValue;

    private boolean shutdown;

    @Override
    public synchronized void checkpoint()
            throws KinesisClientLibDependencyException, InvalidStateException, ThrottlingException, ShutdownException {
        if (largestPermittedCheckpointValue == null) {
            log.debug("Nothing delivered to shard {} yet, not checkpointing", lease.shardId());
            return;
        }
        log.debug("Checkpointing {} at largest permitted value {}", lease.shardId(), largestPermittedCheckpointValue);
        advancePosition(largestPermittedCheckpointValue);
    }

    @Override
    public synchronized void checkpoint(final Record record)
            throws KinesisClientLibDependencyException, InvalidStateException, ThrottlingException, ShutdownException {
        if (record == null) {
            throw new IllegalArgumentException("Could not checkpoint a null record");
        }
        checkpoint(record.sequenceNumber());
    }

    @Override
    public synchronized void checkpoint(final String sequenceNumber)
            throws KinesisClientLibDependencyException, InvalidStateException, ThrottlingException, ShutdownException,
                    IllegalArgumentException {
        if (sequenceNumber == null) {
            if (!SentinelCheckpoint.SHARD_END.matches(largestPermittedCheckpointValue)) {
                throw new IllegalArgumentException("Could not checkpoint shard " + lease.shardId()
                        + " at SHARD_END before the end of the shard was reached");
            }
            advancePosition(SentinelCheckpoint.SHARD_END.name());
            return;
        }
        if (!isDigits(sequenceNumber)) {
            throw new IllegalArgumentException("Could not checkpoint at invalid sequence number " + sequenceNumber);
        }
        if (largestPermittedCheckpointValue == null) {
            throw new IllegalArgumentException("Could not checkpoint shard " + lease.shardId()
                    + " at sequence number " + sequenceNumber + " as no records have been delivered yet");
        }
        final BigInteger newCheckpoint = new BigInteger(sequenceNumber);
        final String lastCheckpoint = lastCheckpointValue();
        if ((isDigits(lastCheckpoint) && newCheckpoint.compareTo(new BigInteger(lastCheckpoint)) < 0)
                || (isDigits(largestPermittedCheckpointValue)
                        && newCheckpoint.compareTo(new BigInteger(largestPermittedCheckpointValue)) > 0)) {
            throw new IllegalArgumentException(String.format(
                    "Could not checkpoint at sequence number %s as it did not fall into acceptable range "
                            + "between the last checkpoint %s and the greatest sequence number passed to this "
                            + "record processor %s",
                    sequenceNumber, lastCheckpoint, largestPermittedCheckpointValue));
        }
        log.debug("Checkpointing {} at specific sequence number {}", lease.shardId(), sequenceNumber);
        advancePosition(sequenceNumber);
    }

    @Override
    public String lastCheckpointValue() {
        return lease.checkpoint();
    }

    /**
     * Called by the consumer as records are delivered, and with SHARD_END once the shard is closed.
     */
    public synchronized void largestPermittedCheckpointValue(final String largestPermittedCheckpointValue) {
        this.largestPermittedCheckpointValue = largestPermittedCheckpointValue;
    }

    /**
     * Stops further checkpoints. Called by the consumer once it no longer holds the lease.
     */
    public synchronized void shutdown() {
        this.shutdown = true;
    }

    private void advancePosition(final String checkpointValue)
            throws KinesisClientLibDependencyException, InvalidStateException, ThrottlingException, ShutdownException {
        if (shutdown) {
            throw new ShutdownException("Can't update checkpoint for shard " + lease.shardId()
                    + " - the consumer has stopped");
        }
        final String previous = lease.checkpoint();
        lease.checkpoint(checkpointValue);
        try {
            leaseCheckpointStore.checkpoint(lease);
        } catch (ProvisionedThroughputException e) {
            lease.checkpoint(previous);
            throw new ThrottlingException("Got throttled while storing checkpoint for shard " + lease.shardId(), e);
        } catch (io.shardpoller.leases.exceptions.InvalidStateException e) {
            lease.checkpoint(previous);
            throw new InvalidStateException("Lease store is in an invalid state for shard " + lease.shardId(), e);
        } catch (DependencyException e) {
            lease.checkpoint(previous);
            throw new KinesisClientLibDependencyException(
                    "Unable to store checkpoint for shard " + lease.shardId(), e);
        }
    }

    private static boolean isDigits(final String value) {
        return StringUtils.isNotEmpty(value) && StringUtils.isNumeric(value);
    }
}
