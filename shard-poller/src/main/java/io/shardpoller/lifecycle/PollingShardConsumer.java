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
package io.shardpoller.lifecycle;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Iterables;
import io.shardpoller.checkpoint.SentinelCheckpoint;
import io.shardpoller.checkpoint.ShardRecordProcessorCheckpointer;
import io.shardpoller.common.Clock;
import io.shardpoller.common.SystemClock;
import io.shardpoller.leases.LeaseCheckpointStore;
import io.shardpoller.leases.ShardLease;
import io.shardpoller.leases.exceptions.LeaseNotAcquiredException;
import io.shardpoller.leases.exceptions.LeasingException;
import io.shardpoller.leases.exceptions.SequenceNumberNotFoundException;
import io.shardpoller.lifecycle.events.InitializationInput;
import io.shardpoller.lifecycle.events.ProcessRecordsInput;
import io.shardpoller.lifecycle.events.ShutdownInput;
import io.shardpoller.processor.ShardRecordProcessor;
import io.shardpoller.retrieval.DataFetcher;
import io.shardpoller.retrieval.StartingPosition;
import io.shardpoller.retrieval.ThrottlingReporter;
import io.shardpoller.retrieval.polling.GetRecordsErrorKind;
import io.shardpoller.retrieval.polling.GetRecordsRateLimiter;
import io.shardpoller.retrieval.polling.GetRecordsRetryPolicy;
import io.shardpoller.retrieval.polling.LocalThroughputExceededException;
import io.shardpoller.retrieval.polling.PollingConfig;
import io.shardpoller.retrieval.polling.RetryDecision;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.kinesis.model.GetRecordsResponse;
import software.amazon.awssdk.services.kinesis.model.Record;

/**
 * Consumes one shard for as long as this worker holds its lease.
 * <p>
 * Precondition: the caller has acquired the lease. The consumer waits for the parent shard to be finished, reads the
 * shard from its last checkpoint and hands every batch to the {@link ShardRecordProcessor} in order. It keeps
 * the lease fresh and stays within the shard's GetRecords limits. It stops when the shard is closed, when
 * {@link #requestShutdown()} is called, when the lease is lost, or on an error it cannot retry. Whatever the reason,
 * the lease is released exactly once, after the record processor has been told about the shutdown.
 * </p>
 * <p>
 * Instances are single use: {@link #call()} may only be invoked once.
 * </p>
 */
@Slf4j
public class PollingShardConsumer implements Callable<TaskResult> {

    private final ShardLease lease;
    private final String shardId;
    private final PollingConfig config;
    private final DataFetcher dataFetcher;
    private final LeaseCheckpointStore leaseCheckpointStore;
    private final ShardRecordProcessor shardRecordProcessor;
    private final Clock clock;

    private final GetRecordsRateLimiter rateLimiter;
    private final GetRecordsRetryPolicy retryPolicy;
    private final ThrottlingReporter throttlingReporter;
    private final ShardRecordProcessorCheckpointer checkpointer;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile boolean shutdownRequested;

    /**
     * Consecutive throttled GetRecords calls since the last successful one.
     */
    @Getter(value = AccessLevel.PACKAGE, onMethod_ = @VisibleForTesting)
    @Accessors(fluent = true)
    private int retriedErrors;

    public PollingShardConsumer(
            ShardLease lease,
            PollingConfig config,
            DataFetcher dataFetcher,
            LeaseCheckpointStore leaseCheckpointStore,
            ShardRecordProcessor shardRecordProcessor) {
        this(lease, config, dataFetcher, leaseCheckpointStore, shardRecordProcessor, SystemClock.INSTANCE);
    }

    public PollingShardConsumer(
            @NonNull ShardLease lease,
            @NonNull PollingConfig config,
            @NonNull DataFetcher dataFetcher,
            @NonNull LeaseCheckpointStore leaseCheckpointStore,
            @NonNull ShardRecordProcessor shardRecordProcessor,
            @NonNull Clock clock) {
        this.lease = lease;
        this.shardId = lease.shardId();
        this.config = config;
        this.dataFetcher = dataFetcher;
        this.leaseCheckpointStore = leaseCheckpointStore;
        this.shardRecordProcessor = shardRecordProcessor;
        this.clock = clock;
        this.rateLimiter = new GetRecordsRateLimiter(config, clock);
        this.retryPolicy = new GetRecordsRetryPolicy(config.maxRetryCount(), clock);
        this.throttlingReporter = new ThrottlingReporter(config.maxConsecutiveWarnThrottles(), shardId);
        this.checkpointer = new ShardRecordProcessorCheckpointer(lease, leaseCheckpointStore);
    }

    /**
     * Asks the consumer to stop. Observed between GetRecords cycles, never in the middle of a call or a sleep.
     */
    public void requestShutdown() {
        log.info("Shutdown requested for shard {}", shardId);
        shutdownRequested = true;
    }

    public boolean isShutdownRequested() {
        return shutdownRequested;
    }

    /**
     * Runs the consumer until it stops.
     *
     * @return the reason the consumer stopped, or the exception that stopped it. Never throws for a failure of the
     *         stream, the lease store or the record processor.
     */
    @Override
    public TaskResult call() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Consumer for shard " + shardId + " has already been started");
        }
        TaskResult result;
        try {
            result = pollShard();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while consuming shard {}", shardId, e);
            result = TaskResult.failed(e);
        } catch (Exception e) {
            log.error("Stopped consuming shard {} because of an error", shardId, e);
            result = TaskResult.failed(e);
        } finally {
            checkpointer.shutdown();
            releaseLease();
        }
        log.info("Finished consuming shard {}: {}", shardId, result);
        return result;
    }

    private TaskResult pollShard() throws LeasingException, InterruptedException {
        if (lease.hasParent() && !waitOnParentShard()) {
            return TaskResult.stopped(ShutdownReason.REQUESTED);
        }

        final String checkpoint = fetchCheckpoint();
        if (SentinelCheckpoint.SHARD_END.matches(checkpoint)) {
            log.info("Shard {} has already been completely processed", shardId);
            return TaskResult.stopped(ShutdownReason.SHARD_END);
        }
        final StartingPosition startingPosition =
                StartingPosition.fromCheckpoint(checkpoint, config.initialPositionInStreamExtended());
        String shardIterator = dataFetcher.getShardIterator(startingPosition);

        log.info("Initializing shard {} from {}", shardId, startingPosition);
        shardRecordProcessor.initialize(InitializationInput.builder()
                .shardId(shardId)
                .checkpoint(checkpoint)
                .startingPosition(startingPosition)
                .build());

        if (shardIterator == null) {
            log.info("Shard {} no longer exists", shardId);
            return shardEnded();
        }

        while (true) {
            if (!refreshLeaseIfNeeded()) {
                return leaseLost();
            }

            try {
                rateLimiter.acquire();
            } catch (LocalThroughputExceededException e) {
                log.debug("Skipping GetRecords for shard {}: {}", shardId, e.getMessage());
                clock.sleep(e.retryAfter());
                continue;
            }

            final Instant callStart = clock.now();
            final GetRecordsResponse response;
            try {
                log.debug("Trying to read {} records from shard {}", config.maxRecords(), shardId);
                response = dataFetcher.getRecords(shardIterator);
            } catch (RuntimeException e) {
                final GetRecordsErrorKind kind = GetRecordsErrorKind.classify(e);
                if (!kind.isRetryable()) {
                    throw e;
                }
                retriedErrors++;
                throttlingReporter.throttled(kind.name());
                final RetryDecision decision = retryPolicy.decide(kind, callStart, retriedErrors);
                if (!decision.shouldRetry()) {
                    log.error("Reached max retry count {} getting records from shard {}",
                            config.maxRetryCount(), shardId);
                    throw e;
                }
                clock.sleep(decision.delay());
                continue;
            }

            retriedErrors = 0;
            throttlingReporter.success();

            final List<Record> records = response.records();
            final String nextShardIterator = response.nextShardIterator();
            rateLimiter.recordBytesRead(payloadBytes(records));
            deliverRecords(records, response.millisBehindLatest(), nextShardIterator == null, callStart);

            if (nextShardIterator == null) {
                log.info("Shard {} closed", shardId);
                return shardEnded();
            }
            shardIterator = nextShardIterator;

            // Only idle when caught up; a consumer that is behind reads again straight away.
            if (records.isEmpty() && millisBehindLatest(response) < config.idleTimeBetweenReadsInMillis()) {
                clock.sleep(Duration.ofMillis(config.idleTimeBetweenReadsInMillis()));
            }

            if (shutdownRequested) {
                return shutdown(ShutdownReason.REQUESTED);
            }
        }
    }

    /**
     * Blocks until the parent shard has been checkpointed at SHARD_END, or its record is gone.
     *
     * @return false if shutdown was requested while waiting
     */
    private boolean waitOnParentShard() throws LeasingException, InterruptedException {
        final String parentShardId = lease.parentShardId();
        while (!shutdownRequested) {
            final String parentCheckpoint;
            try {
                parentCheckpoint = leaseCheckpointStore.fetchCheckpoint(parentShardId);
            } catch (SequenceNumberNotFoundException e) {
                log.info("No checkpoint found for parent shard {} of shard {}. Not blocking on it.",
                        parentShardId, shardId);
                return true;
            }
            if (SentinelCheckpoint.SHARD_END.matches(parentCheckpoint)) {
                log.info("Parent shard {} of shard {} has been completely processed.", parentShardId, shardId);
                return true;
            }
            log.debug("Parent shard {} is not yet done. Its current checkpoint is {}", parentShardId, parentCheckpoint);
            clock.sleep(Duration.ofMillis(config.parentShardPollIntervalMillis()));
        }
        log.info("Shutdown requested while shard {} was waiting on parent shard {}", shardId, parentShardId);
        return false;
    }

    private String fetchCheckpoint() throws LeasingException {
        String checkpoint;
        try {
            checkpoint = leaseCheckpointStore.fetchCheckpoint(shardId);
        } catch (SequenceNumberNotFoundException e) {
            log.debug("No checkpoint recorded for shard {}", shardId);
            checkpoint = null;
        }
        lease.checkpoint(checkpoint);
        return checkpoint;
    }

    /**
     * Renews the lease once it is within the refresh period of its timeout.
     *
     * @return false if another worker has taken the lease
     */
    private boolean refreshLeaseIfNeeded() throws LeasingException {
        final Instant leaseTimeout = lease.leaseTimeout();
        if (leaseTimeout != null
                && !clock.now().isAfter(leaseTimeout.minusMillis(config.leaseRefreshPeriodMillis()))) {
            return true;
        }
        log.debug("Refreshing lease on shard {} for worker {}", shardId, config.workerIdentifier());
        try {
            leaseCheckpointStore.renewLease(lease, config.workerIdentifier());
            return true;
        } catch (LeaseNotAcquiredException e) {
            log.warn("Failed in acquiring lease on shard {} for worker {}", shardId, config.workerIdentifier());
            return false;
        }
    }

    private void deliverRecords(
            final List<Record> records,
            final Long millisBehindLatest,
            final boolean isAtShardEnd,
            final Instant fetchedAt) {
        log.debug("Received {} records from shard {}", records.size(), shardId);
        if (!records.isEmpty()) {
            checkpointer.largestPermittedCheckpointValue(Iterables.getLast(records).sequenceNumber());
        }
        if (records.isEmpty() && !config.callProcessRecordsEvenForEmptyRecordList()) {
            return;
        }
        shardRecordProcessor.processRecords(ProcessRecordsInput.builder()
                .records(records)
                .millisBehindLatest(millisBehindLatest)
                .isAtShardEnd(isAtShardEnd)
                .checkpointer(checkpointer)
                .fetchedAt(fetchedAt)
                .deliveredAt(clock.now())
                .build());
    }

    private TaskResult shardEnded() {
        checkpointer.largestPermittedCheckpointValue(SentinelCheckpoint.SHARD_END.name());
        return shutdown(ShutdownReason.SHARD_END);
    }

    private TaskResult leaseLost() {
        checkpointer.shutdown();
        shardRecordProcessor.shutdown(ShutdownInput.builder().shutdownReason(ShutdownReason.LEASE_LOST).build());
        return TaskResult.stopped(ShutdownReason.LEASE_LOST);
    }

    private TaskResult shutdown(final ShutdownReason reason) {
        log.info("Shutting down record processor for shard {} with reason {}", shardId, reason);
        shardRecordProcessor.shutdown(ShutdownInput.builder()
                .shutdownReason(reason)
                .checkpointer(checkpointer)
                .build());
        return TaskResult.stopped(reason);
    }

    private void releaseLease() {
        log.info("Releasing lease for shard {} held by {}", shardId, config.workerIdentifier());
        try {
            leaseCheckpointStore.releaseLease(lease, config.workerIdentifier());
        } catch (LeasingException | RuntimeException e) {
            log.error("Failed to release lease for shard {}", shardId, e);
        }
        lease.leaseOwner(null);
    }

    private static long millisBehindLatest(final GetRecordsResponse response) {
        return response.millisBehindLatest() == null ? 0L : response.millisBehindLatest();
    }

    private static long payloadBytes(final List<Record> records) {
        long bytes = 0;
        for (Record record : records) {
            if (record.data() != null) {
                bytes += record.data().asByteArrayUnsafe().length;
            }
        }
        return bytes;
    }
}
