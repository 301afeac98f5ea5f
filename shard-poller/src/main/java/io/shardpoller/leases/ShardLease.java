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
package io.shardpoller.leases;

import java.time.Instant;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * In-memory view of a shard's lease record. The record itself lives in a {@link LeaseCheckpointStore}; a
 * {@link io.shardpoller.lifecycle.PollingShardConsumer} holds this object for the duration of its run and only
 * persists changes through the store.
 */
@Getter
@Setter
@Accessors(fluent = true)
@ToString
@EqualsAndHashCode
public class ShardLease {
    /**
     * Identifies the shard this lease covers.
     */
    private final String shardId;
    /**
     * Shard this one was split or merged from, may be null.
     */
    private final String parentShardId;
    /**
     * Most recently application-supplied checkpoint value: a sequence number or the name of a
     * {@link io.shardpoller.checkpoint.SentinelCheckpoint}. Null for a shard that has never been checkpointed.
     */
    private String checkpoint;
    /**
     * Current owner of the lease, may be null.
     */
    private String leaseOwner;
    /**
     * When the current owner's hold on the lease runs out unless renewed. Null until the store has recorded one.
     */
    private Instant leaseTimeout;

    public ShardLease(@NonNull final String shardId) {
        this(shardId, null);
    }

    public ShardLease(@NonNull final String shardId, final String parentShardId) {
        this.shardId = shardId;
        this.parentShardId = parentShardId;
    }

    public boolean hasParent() {
        return parentShardId != null && !parentShardId.isEmpty();
    }
}
