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

import java.time.Duration;
import java.util.Collections;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import io.shardpoller.common.FutureUtils;
import io.shardpoller.retrieval.AWSExceptionManager;
import io.shardpoller.retrieval.DataFetcher;
import io.shardpoller.retrieval.IteratorBuilder;
import io.shardpoller.retrieval.RetryableRetrievalException;
import io.shardpoller.retrieval.StartingPosition;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.kinesis.KinesisAsyncClient;
import software.amazon.awssdk.services.kinesis.model.GetRecordsRequest;
import software.amazon.awssdk.services.kinesis.model.GetRecordsResponse;
import software.amazon.awssdk.services.kinesis.model.GetShardIteratorRequest;
import software.amazon.awssdk.services.kinesis.model.KinesisException;
import software.amazon.awssdk.services.kinesis.model.ResourceNotFoundException;

/**
 * {@link DataFetcher} backed by the asynchronous Kinesis client. Each call blocks for at most
 * {@link PollingConfig#kinesisRequestTimeout()}. Holds no iterator state of its own.
 */
@Slf4j
public class KinesisDataFetcher implements DataFetcher {

    // Read-only after class initialization.
    private static final AWSExceptionManager EXCEPTION_MANAGER = new AWSExceptionManager();

    static {
        EXCEPTION_MANAGER.add(ResourceNotFoundException.class, t -> t);
        EXCEPTION_MANAGER.add(KinesisException.class, t -> t);
        EXCEPTION_MANAGER.add(SdkException.class, t -> t);
    }

    private final KinesisAsyncClient kinesisClient;
    private final String shardId;
    private final String streamName;
    private final int limit;
    private final Duration requestTimeout;

    public KinesisDataFetcher(
            @NonNull final KinesisAsyncClient kinesisClient,
            @NonNull final String shardId,
            @NonNull final PollingConfig pollingConfig) {
        this.kinesisClient = kinesisClient;
        this.shardId = shardId;
        this.streamName = pollingConfig.streamName();
        this.limit = pollingConfig.maxRecords();
        this.requestTimeout = pollingConfig.kinesisRequestTimeout();
    }

    @Override
    public String getShardIterator(@NonNull final StartingPosition startingPosition) throws InterruptedException {
        final GetShardIteratorRequest.Builder builder = GetShardIteratorRequest.builder()
                .streamName(streamName)
                .shardId(shardId);
        final GetShardIteratorRequest request = IteratorBuilder.request(builder, startingPosition).build();
        log.debug("Requesting shard iterator: {}", request);
        try {
            return await(kinesisClient.getShardIterator(request)).shardIterator();
        } catch (ResourceNotFoundException e) {
            log.info("Shard {} of stream {} no longer exists, no iterator issued", shardId, streamName, e);
            return null;
        }
    }

    @Override
    public GetRecordsResponse getRecords(@NonNull final String shardIterator) throws InterruptedException {
        final GetRecordsRequest request = GetRecordsRequest.builder()
                .shardIterator(shardIterator)
                .limit(limit)
                .build();
        try {
            return await(kinesisClient.getRecords(request));
        } catch (ResourceNotFoundException e) {
            log.info("Shard {} of stream {} disappeared while reading, treating it as closed", shardId, streamName);
            return GetRecordsResponse.builder()
                    .records(Collections.emptyList())
                    .build();
        }
    }

    private <T> T await(final CompletableFuture<T> future) throws InterruptedException {
        try {
            return FutureUtils.resolveOrCancelFuture(future, requestTimeout);
        } catch (ExecutionException e) {
            throw EXCEPTION_MANAGER.apply(e.getCause());
        } catch (TimeoutException e) {
            throw new RetryableRetrievalException(
                    "No response from Kinesis for shard " + shardId + " within " + requestTimeout, e);
        }
    }
}
