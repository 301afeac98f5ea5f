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

import software.amazon.awssdk.services.kinesis.model.GetRecordsResponse;

/**
 * The two Kinesis calls a polling consumer makes. Implementations throw the service's own exceptions (e.g.
 * {@link software.amazon.awssdk.services.kinesis.model.ProvisionedThroughputExceededException}) unwrapped, so the
 * caller can classify them.
 */
public interface DataFetcher {

    /**
     * Gets a shard iterator pointing at the given position.
     *
     * @param startingPosition where the iterator should point
     * @return the iterator, or null if the shard no longer exists
     * @throws InterruptedException if interrupted while waiting for the response
     */
    String getShardIterator(StartingPosition startingPosition) throws InterruptedException;

    /**
     * Reads the next batch of records.
     *
     * @param shardIterator iterator returned by {@link #getShardIterator(StartingPosition)} or by a previous call
     * @return the response, whose next shard iterator is null once the shard is closed
     * @throws InterruptedException if interrupted while waiting for the response
     */
    GetRecordsResponse getRecords(String shardIterator) throws InterruptedException;
}
