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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import io.shardpoller.checkpoint.SentinelCheckpoint;
import io.shardpoller.common.InitialPositionInStream;
import io.shardpoller.common.InitialPositionInStreamExtended;
import io.shardpoller.common.ManualClock;
import io.shardpoller.leases.LeaseCheckpointStore;
import io.shardpoller.leases.ShardLease;
import io.shardpoller.leases.exceptions.DependencyException;
import io.shardpoller.leases.exceptions.LeaseNotAcquiredException;
import io.shardpoller.leases.exceptions.SequenceNumberNotFoundException;
import io.shardpoller.lifecycle.events.InitializationInput;
import io.shardpoller.lifecycle.events.ProcessRecordsInput;
import io.shardpoller.lifecycle.events.ShutdownInput;
import io.shardpoller.processor.ShardRecordProcessor;
import io.shardpoller.retrieval.DataFetcher;
import io.shardpoller.retrieval.StartingPosition;
import io.shardpoller.retrieval.polling.PollingConfig;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.kinesis.model.ExpiredIteratorException;
import software.amazon.awssdk.services.kinesis.model.GetRecordsResponse;
import software.amazon.awssdk.services.kinesis.model.KmsThrottlingException;
import software.amazon.awssdk.services.kinesis.model.ProvisionedThroughputExceededException;
import software.amazon.awssdk.services.kinesis.model.Record;

@RunWith(MockitoJUnitRunner.class)
public class PollingShardConsumerTest {

    private static final String STREAM_NAME = "stream";
    private static final String WORKER_ID = "worker-1";
    private static final String SHARD_ID = "shardId-000000000001";
    private static final String PARENT_SHARD_ID = "shardId-000000000000";

    @Mock
    private DataFetcher dataFetcher;
    @Mock
    private LeaseCheckpointStore leaseCheckpointStore;
    @Mock
    private ShardRecordProcessor shardRecordProcessor;

    private ManualClock clock;
    private PollingConfig config;
    private ShardLease lease;
    private PollingShardConsumer consumer;

    @Before
    public void setup() {
        clock = new ManualClock();
        config = new PollingConfig(STREAM_NAME, WORKER_ID);
        lease = new ShardLease(SHARD_ID);
    }

    private PollingShardConsumer createConsumer() {
        consumer = new PollingShardConsumer(lease, config, dataFetcher, leaseCheckpointStore, shardRecordProcessor,
                clock);
        return consumer;
    }

    private void noCheckpoint() throws Exception {
        when(leaseCheckpointStore.fetchCheckpoint(SHARD_ID))
                .thenThrow(new SequenceNumberNotFoundException("No checkpoint for " + SHARD_ID));
    }

    private void latestIterator(String shardIterator) throws Exception {
        when(dataFetcher.getShardIterator(StartingPosition.latest())).thenReturn(shardIterator);
    }

    private static Record record(String sequenceNumber) {
        return record(sequenceNumber, 10);
    }

    private static Record record(String sequenceNumber, int size) {
        return Record.builder()
                .sequenceNumber(sequenceNumber)
                .partitionKey("pk")
                .data(SdkBytes.fromByteArray(new byte[size]))
                .build();
    }

    private static GetRecordsResponse response(String nextShardIterator, long millisBehindLatest, Record... records) {
        return GetRecordsResponse.builder()
                .records(records)
                .nextShardIterator(nextShardIterator)
                .millisBehindLatest(millisBehindLatest)
                .build();
    }

    private static ProvisionedThroughputExceededException throughputExceeded() {
        return ProvisionedThroughputExceededException.builder().message("Rate exceeded for shard").build();
    }

    private ShutdownInput capturedShutdown() {
        ArgumentCaptor<ShutdownInput> captor = ArgumentCaptor.forClass(ShutdownInput.class);
        verify(shardRecordProcessor).shutdown(captor.capture());
        return captor.getValue();
    }

    @Test
    public void testDeliversBatchesInOrderUntilShardEnd() throws Exception {
        noCheckpoint();
        latestIterator("it-1");
        when(dataFetcher.getRecords("it-1")).thenReturn(response("it-2", 0L, record("1"), record("2")));
        when(dataFetcher.getRecords("it-2")).thenReturn(response(null, 0L, record("3")));

        TaskResult result = createConsumer().call();

        assertThat(result.getShutdownReason(), equalTo(ShutdownReason.SHARD_END));
        assertTrue(result.isShardEndReached());
        assertThat(result.getException(), nullValue());

        InOrder inOrder = inOrder(shardRecordProcessor, leaseCheckpointStore);
        ArgumentCaptor<ProcessRecordsInput> batches = ArgumentCaptor.forClass(ProcessRecordsInput.class);
        inOrder.verify(shardRecordProcessor).initialize(any(InitializationInput.class));
        inOrder.verify(shardRecordProcessor, times(2)).processRecords(batches.capture());
        inOrder.verify(shardRecordProcessor).shutdown(any(ShutdownInput.class));
        inOrder.verify(leaseCheckpointStore).releaseLease(lease, WORKER_ID);

        List<ProcessRecordsInput> delivered = batches.getAllValues();
        assertThat(delivered.get(0).records(), contains(record("1"), record("2")));
        assertFalse(delivered.get(0).isAtShardEnd());
        assertThat(delivered.get(1).records(), contains(record("3")));
        assertTrue(delivered.get(1).isAtShardEnd());

        ShutdownInput shutdownInput = capturedShutdown();
        assertThat(shutdownInput.shutdownReason(), equalTo(ShutdownReason.SHARD_END));
        assertThat(shutdownInput.checkpointer().largestPermittedCheckpointValue(),
                equalTo(SentinelCheckpoint.SHARD_END.name()));
        verify(leaseCheckpointStore, times(1)).releaseLease(lease, WORKER_ID);
    }

    @Test
    public void testResumesAfterStoredCheckpoint() throws Exception {
        when(leaseCheckpointStore.fetchCheckpoint(SHARD_ID)).thenReturn("100");
        when(dataFetcher.getShardIterator(StartingPosition.afterSequenceNumber("100"))).thenReturn("it-1");
        when(dataFetcher.getRecords("it-1")).thenReturn(response(null, 0L));

        TaskResult result = createConsumer().call();

        assertThat(result.getShutdownReason(), equalTo(ShutdownReason.SHARD_END));
        ArgumentCaptor<InitializationInput> captor = ArgumentCaptor.forClass(InitializationInput.class);
        verify(shardRecordProcessor).initialize(captor.capture());
        assertThat(captor.getValue().shardId(), equalTo(SHARD_ID));
        assertThat(captor.getValue().checkpoint(), equalTo("100"));
        assertThat(captor.getValue().startingPosition(), equalTo(StartingPosition.afterSequenceNumber("100")));
        verify(shardRecordProcessor, never()).processRecords(any(ProcessRecordsInput.class));
    }

    @Test
    public void testStartsFromConfiguredInitialPosition() throws Exception {
        config.initialPositionInStreamExtended(
                InitialPositionInStreamExtended.newInitialPosition(InitialPositionInStream.TRIM_HORIZON));
        noCheckpoint();
        when(dataFetcher.getShardIterator(StartingPosition.trimHorizon())).thenReturn(null);

        TaskResult result = createConsumer().call();

        assertThat(result.getShutdownReason(), equalTo(ShutdownReason.SHARD_END));
    }

    @Test
    public void testShardAlreadyCheckpointedAtShardEnd() throws Exception {
        when(leaseCheckpointStore.fetchCheckpoint(SHARD_ID)).thenReturn(SentinelCheckpoint.SHARD_END.name());

        TaskResult result = createConsumer().call();

        assertThat(result.getShutdownReason(), equalTo(ShutdownReason.SHARD_END));
        verifyNoInteractions(dataFetcher, shardRecordProcessor);
        verify(leaseCheckpointStore, times(1)).releaseLease(lease, WORKER_ID);
    }

    @Test
    public void testNullShardIteratorEndsShard() throws Exception {
        noCheckpoint();
        latestIterator(null);

        TaskResult result = createConsumer().call();

        assertThat(result.getShutdownReason(), equalTo(ShutdownReason.SHARD_END));
        verify(shardRecordProcessor).initialize(any(InitializationInput.class));
        assertThat(capturedShutdown().shutdownReason(), equalTo(ShutdownReason.SHARD_END));
        verify(dataFetcher, never()).getRecords(anyString());
        verify(leaseCheckpointStore, times(1)).releaseLease(lease, WORKER_ID);
    }

    @Test
    public void testRetriesThroughputExceededAndResetsRetryCount() throws Exception {
        noCheckpoint();
        latestIterator("it-1");
        when(dataFetcher.getRecords("it-1"))
                .thenThrow(throughputExceeded())
                .thenThrow(throughputExceeded())
                .thenReturn(response(null, 0L, record("1")));
        AtomicInteger retriedErrorsAtDelivery = new AtomicInteger(-1);
        doAnswer(invocation -> {
            retriedErrorsAtDelivery.set(consumer.retriedErrors());
            return null;
        }).when(shardRecordProcessor).processRecords(any(ProcessRecordsInput.class));

        TaskResult result = createConsumer().call();

        assertThat(result.getShutdownReason(), equalTo(ShutdownReason.SHARD_END));
        assertThat(clock.sleeps(), contains(Duration.ofSeconds(1), Duration.ofSeconds(1)));
        assertThat(retriedErrorsAtDelivery.get(), equalTo(0));
        verify(dataFetcher, times(3)).getRecords("it-1");
    }

    @Test
    public void testGivesUpAfterMaxRetryCount() throws Exception {
        config.maxRetryCount(2);
        noCheckpoint();
        latestIterator("it-1");
        ProvisionedThroughputExceededException last = throughputExceeded();
        when(dataFetcher.getRecords("it-1"))
                .thenThrow(throughputExceeded())
                .thenThrow(throughputExceeded())
                .thenThrow(last);

        TaskResult result = createConsumer().call();

        assertThat(result.getShutdownReason(), nullValue());
        assertThat(result.getException(), sameInstance(last));
        verify(dataFetcher, times(3)).getRecords("it-1");
        assertThat(clock.sleeps(), contains(Duration.ofSeconds(1), Duration.ofSeconds(1)));
        verify(shardRecordProcessor, never()).shutdown(any(ShutdownInput.class));
        verify(leaseCheckpointStore, times(1)).releaseLease(lease, WORKER_ID);
    }

    @Test
    public void testKmsThrottlingBacksOffExponentially() throws Exception {
        noCheckpoint();
        latestIterator("it-1");
        KmsThrottlingException kms = KmsThrottlingException.builder().message("KMS throttled").build();
        when(dataFetcher.getRecords("it-1"))
                .thenThrow(kms)
                .thenThrow(kms)
                .thenThrow(kms)
                .thenReturn(response(null, 0L));

        TaskResult result = createConsumer().call();

        assertThat(result.getShutdownReason(), equalTo(ShutdownReason.SHARD_END));
        assertThat(clock.sleeps(),
                contains(Duration.ofMillis(200), Duration.ofMillis(400), Duration.ofMillis(800)));
    }

    @Test
    public void testThrottlingKindsShareOneRetryCount() throws Exception {
        config.maxRetryCount(3);
        noCheckpoint();
        latestIterator("it-1");
        KmsThrottlingException kms = KmsThrottlingException.builder().message("KMS throttled").build();
        ProvisionedThroughputExceededException last = throughputExceeded();
        when(dataFetcher.getRecords("it-1"))
                .thenThrow(kms)
                .thenThrow(throughputExceeded())
                .thenThrow(kms)
                .thenThrow(last);

        TaskResult result = createConsumer().call();

        assertThat(result.getShutdownReason(), nullValue());
        assertThat(result.getException(), sameInstance(last));
        verify(dataFetcher, times(4)).getRecords("it-1");
        assertThat(clock.sleeps(),
                contains(Duration.ofMillis(200), Duration.ofSeconds(1), Duration.ofMillis(800)));
        verify(shardRecordProcessor, never()).shutdown(any(ShutdownInput.class));
        verify(leaseCheckpointStore, times(1)).releaseLease(lease, WORKER_ID);
    }

    @Test
    public void testGivesUpAfterMaxRetryCountOnKmsThrottling() throws Exception {
        config.maxRetryCount(1);
        noCheckpoint();
        latestIterator("it-1");
        KmsThrottlingException last = KmsThrottlingException.builder().message("KMS throttled").build();
        when(dataFetcher.getRecords("it-1"))
                .thenThrow(KmsThrottlingException.builder().message("KMS throttled").build())
                .thenThrow(last);

        TaskResult result = createConsumer().call();

        assertThat(result.getException(), sameInstance(last));
        verify(dataFetcher, times(2)).getRecords("it-1");
        assertThat(clock.sleeps(), contains(Duration.ofMillis(200)));
        verify(leaseCheckpointStore, times(1)).releaseLease(lease, WORKER_ID);
    }

    @Test
    public void testNonThrottlingErrorIsFatal() throws Exception {
        noCheckpoint();
        latestIterator("it-1");
        ExpiredIteratorException expired = ExpiredIteratorException.builder().message("expired").build();
        when(dataFetcher.getRecords("it-1")).thenThrow(expired);

        TaskResult result = createConsumer().call();

        assertThat(result.getException(), sameInstance(expired));
        verify(dataFetcher, times(1)).getRecords("it-1");
        assertThat(clock.sleeps(), empty());
        verify(leaseCheckpointStore, times(1)).releaseLease(lease, WORKER_ID);
    }

    @Test
    public void testIdlesOnlyWhenCaughtUp() throws Exception {
        config.idleTimeBetweenReadsInMillis(1000L);
        noCheckpoint();
        latestIterator("it-1");
        when(dataFetcher.getRecords("it-1")).thenReturn(response("it-2", 0L));
        when(dataFetcher.getRecords("it-2")).thenReturn(response("it-3", 5000L));
        when(dataFetcher.getRecords("it-3")).thenReturn(response(null, 0L));

        TaskResult result = createConsumer().call();

        assertThat(result.getShutdownReason(), equalTo(ShutdownReason.SHARD_END));
        assertThat(clock.sleeps(), contains(Duration.ofMillis(1000)));
        verify(shardRecordProcessor, never()).processRecords(any(ProcessRecordsInput.class));
    }

    @Test
    public void testDeliversEmptyBatchesWhenConfigured() throws Exception {
        config.callProcessRecordsEvenForEmptyRecordList(true);
        noCheckpoint();
        latestIterator("it-1");
        when(dataFetcher.getRecords("it-1")).thenReturn(response(null, 0L));

        createConsumer().call();

        ArgumentCaptor<ProcessRecordsInput> captor = ArgumentCaptor.forClass(ProcessRecordsInput.class);
        verify(shardRecordProcessor).processRecords(captor.capture());
        assertThat(captor.getValue().records(), empty());
        assertTrue(captor.getValue().isAtShardEnd());
    }

    @Test
    public void testShutdownRequestedBetweenCycles() throws Exception {
        noCheckpoint();
        latestIterator("it-1");
        when(dataFetcher.getRecords("it-1")).thenReturn(response("it-2", 0L, record("1")));
        doAnswer(invocation -> {
            consumer.requestShutdown();
            return null;
        }).when(shardRecordProcessor).processRecords(any(ProcessRecordsInput.class));

        TaskResult result = createConsumer().call();

        assertThat(result.getShutdownReason(), equalTo(ShutdownReason.REQUESTED));
        assertTrue(consumer.isShutdownRequested());
        verify(dataFetcher, never()).getRecords("it-2");
        InOrder inOrder = inOrder(shardRecordProcessor, leaseCheckpointStore);
        inOrder.verify(shardRecordProcessor).shutdown(any(ShutdownInput.class));
        inOrder.verify(leaseCheckpointStore).releaseLease(lease, WORKER_ID);
        ShutdownInput shutdownInput = capturedShutdown();
        assertThat(shutdownInput.shutdownReason(), equalTo(ShutdownReason.REQUESTED));
        assertThat(shutdownInput.checkpointer(), notNullValue());
    }

    @Test
    public void testLeaseLost() throws Exception {
        noCheckpoint();
        latestIterator("it-1");
        doThrow(new LeaseNotAcquiredException("Lease taken by worker-2"))
                .when(leaseCheckpointStore).renewLease(lease, WORKER_ID);

        TaskResult result = createConsumer().call();

        assertThat(result.getShutdownReason(), equalTo(ShutdownReason.LEASE_LOST));
        ShutdownInput shutdownInput = capturedShutdown();
        assertThat(shutdownInput.shutdownReason(), equalTo(ShutdownReason.LEASE_LOST));
        assertThat(shutdownInput.checkpointer(), nullValue());
        verify(dataFetcher, never()).getRecords(anyString());
        ArgumentCaptor<String> releasingOwner = ArgumentCaptor.forClass(String.class);
        verify(leaseCheckpointStore, times(1)).releaseLease(eq(lease), releasingOwner.capture());
        assertThat(releasingOwner.getValue(), equalTo(WORKER_ID));
        assertThat(lease.leaseOwner(), nullValue());
        assertThat(lease.leaseOwner(), nullValue());
    }

    @Test
    public void testLeaseNotRenewedOutsideRefreshPeriod() throws Exception {
        lease.leaseTimeout(clock.now().plusSeconds(60));
        noCheckpoint();
        latestIterator("it-1");
        when(dataFetcher.getRecords("it-1")).thenReturn(response(null, 0L));

        createConsumer().call();

        verify(leaseCheckpointStore, never()).renewLease(any(ShardLease.class), anyString());
    }

    @Test
    public void testLeaseRenewedWithinRefreshPeriod() throws Exception {
        lease.leaseTimeout(clock.now().plusSeconds(3));
        noCheckpoint();
        latestIterator("it-1");
        when(dataFetcher.getRecords("it-1")).thenReturn(response(null, 0L));

        createConsumer().call();

        verify(leaseCheckpointStore, times(1)).renewLease(lease, WORKER_ID);
    }

    @Test
    public void testWaitsForParentShardToFinish() throws Exception {
        lease = new ShardLease(SHARD_ID, PARENT_SHARD_ID);
        when(leaseCheckpointStore.fetchCheckpoint(PARENT_SHARD_ID))
                .thenReturn("123")
                .thenReturn("456")
                .thenReturn(SentinelCheckpoint.SHARD_END.name());
        noCheckpoint();
        latestIterator(null);

        TaskResult result = createConsumer().call();

        assertThat(result.getShutdownReason(), equalTo(ShutdownReason.SHARD_END));
        assertThat(clock.sleeps(), contains(Duration.ofSeconds(10), Duration.ofSeconds(10)));
        verify(leaseCheckpointStore, times(3)).fetchCheckpoint(PARENT_SHARD_ID);
    }

    @Test
    public void testMissingParentRecordDoesNotBlock() throws Exception {
        lease = new ShardLease(SHARD_ID, PARENT_SHARD_ID);
        when(leaseCheckpointStore.fetchCheckpoint(PARENT_SHARD_ID))
                .thenThrow(new SequenceNumberNotFoundException("No lease for " + PARENT_SHARD_ID));
        noCheckpoint();
        latestIterator(null);

        TaskResult result = createConsumer().call();

        assertThat(result.getShutdownReason(), equalTo(ShutdownReason.SHARD_END));
        assertThat(clock.sleeps(), empty());
    }

    @Test
    public void testShutdownRequestedWhileWaitingForParent() throws Exception {
        lease = new ShardLease(SHARD_ID, PARENT_SHARD_ID);
        when(leaseCheckpointStore.fetchCheckpoint(PARENT_SHARD_ID)).thenAnswer(invocation -> {
            consumer.requestShutdown();
            return "123";
        });

        TaskResult result = createConsumer().call();

        assertThat(result.getShutdownReason(), equalTo(ShutdownReason.REQUESTED));
        verifyNoInteractions(dataFetcher, shardRecordProcessor);
        verify(leaseCheckpointStore, times(1)).releaseLease(lease, WORKER_ID);
    }

    @Test
    public void testLocalCallBudgetSkipsCycle() throws Exception {
        config.maxGetRecordsCallsPerSecond(1);
        noCheckpoint();
        latestIterator("it-1");
        when(dataFetcher.getRecords("it-1")).thenReturn(response("it-2", 0L, record("1", 0)));
        when(dataFetcher.getRecords("it-2")).thenReturn(response(null, 0L));

        TaskResult result = createConsumer().call();

        assertThat(result.getShutdownReason(), equalTo(ShutdownReason.SHARD_END));
        assertThat(clock.sleeps(), contains(Duration.ofSeconds(1)));
        verify(dataFetcher, times(1)).getRecords("it-2");
    }

    @Test
    public void testByteCapPacesReads() throws Exception {
        config.maxBytesPerSecond(1_000_000L);
        noCheckpoint();
        latestIterator("it-1");
        when(dataFetcher.getRecords("it-1")).thenReturn(response("it-2", 0L, record("1", 3_000_000)));
        when(dataFetcher.getRecords("it-2")).thenReturn(response(null, 0L, record("2")));

        createConsumer().call();

        assertThat(clock.sleeps(), contains(Duration.ofSeconds(3)));
    }

    @Test
    public void testInterruptIsFatal() throws Exception {
        noCheckpoint();
        latestIterator("it-1");
        when(dataFetcher.getRecords("it-1")).thenThrow(new InterruptedException());

        TaskResult result = createConsumer().call();

        assertThat(result.getException(), instanceOf(InterruptedException.class));
        assertTrue(Thread.interrupted());
        verify(leaseCheckpointStore, times(1)).releaseLease(lease, WORKER_ID);
    }

    @Test
    public void testProcessorFailureIsFatal() throws Exception {
        noCheckpoint();
        latestIterator("it-1");
        when(dataFetcher.getRecords("it-1")).thenReturn(response("it-2", 0L, record("1")));
        IllegalStateException failure = new IllegalStateException("processor failed");
        doThrow(failure).when(shardRecordProcessor).processRecords(any(ProcessRecordsInput.class));

        TaskResult result = createConsumer().call();

        assertThat(result.getException(), sameInstance(failure));
        verify(shardRecordProcessor, never()).shutdown(any(ShutdownInput.class));
        verify(leaseCheckpointStore, times(1)).releaseLease(lease, WORKER_ID);
    }

    @Test
    public void testReleaseFailureDoesNotChangeOutcome() throws Exception {
        noCheckpoint();
        latestIterator(null);
        doThrow(new DependencyException("lease table unavailable")).when(leaseCheckpointStore).releaseLease(lease, WORKER_ID);

        TaskResult result = createConsumer().call();

        assertThat(result.getShutdownReason(), equalTo(ShutdownReason.SHARD_END));
        assertThat(result.getException(), nullValue());
    }

    @Test
    public void testCheckpointFromProcessorPersistsThroughStore() throws Exception {
        noCheckpoint();
        latestIterator("it-1");
        when(dataFetcher.getRecords("it-1")).thenReturn(response(null, 0L, record("7")));
        doAnswer(invocation -> {
            ProcessRecordsInput input = invocation.getArgument(0);
            input.checkpointer().checkpoint();
            return null;
        }).when(shardRecordProcessor).processRecords(any(ProcessRecordsInput.class));

        createConsumer().call();

        verify(leaseCheckpointStore).checkpoint(eq(lease));
        assertThat(lease.checkpoint(), equalTo("7"));
    }

    @Test(expected = IllegalStateException.class)
    public void testCannotRunTwice() throws Exception {
        when(leaseCheckpointStore.fetchCheckpoint(SHARD_ID)).thenReturn(SentinelCheckpoint.SHARD_END.name());
        createConsumer();
        consumer.call();
        consumer.call();
    }
}
