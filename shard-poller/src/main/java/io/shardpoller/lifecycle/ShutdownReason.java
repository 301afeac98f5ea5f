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

/**
 * Why a {@link PollingShardConsumer} stopped. Passed to the record processor's shutdown and returned in the
 * {@link TaskResult}. Only {@link #SHARD_END} and {@link #REQUESTED} come with a checkpointer.
 */
public enum ShutdownReason {
    /**
     * Another worker took the lease. It may already be processing the same records, so nothing is checkpointed.
     */
    LEASE_LOST,

    /**
     * The shard was closed by a split or merge and every record has been delivered. The processor should checkpoint
     * so the child shards can start.
     */
    SHARD_END,

    /**
     * The application called {@link PollingShardConsumer#requestShutdown()}. The lease is still held, so the
     * processor can record its final position.
     */
    REQUESTED
}
