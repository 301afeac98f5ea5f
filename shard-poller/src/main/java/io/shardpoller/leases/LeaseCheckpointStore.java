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

import io.shardpoller.leases.exceptions.DependencyException;
import io.shardpoller.leases.exceptions.InvalidStateException;
import io.shardpoller.leases.exceptions.LeaseNotAcquiredException;
import io.shardpoller.leases.exceptions.ProvisionedThroughputException;
import io.shardpoller.leases.exceptions.SequenceNumberNotFoundException;

/**
 * Durable store of shard leases and checkpoints. Implementations are shared by every consumer in a worker fleet and
 * must serialize concurrent lease operations themselves.
 */
public interface LeaseCheckpointStore {

    /**
     * Reads the checkpoint recorded for a shard.
     *
     * @param shardId the shard to look up
     * @return the recorded checkpoint, a sequence number or a {@link io.shardpoller.checkpoint.SentinelCheckpoint}
     *         name
     *
     * @throws SequenceNumberNotFoundException if nothing is recorded for the shard
     * @throws InvalidStateException if lease table does not exist
     * @throws ProvisionedThroughputException if the store is out of capacity
     * @throws DependencyException if the store fails in an unexpected way
     */
    String fetchCheckpoint(String shardId) throws SequenceNumberNotFoundException, DependencyException,
            InvalidStateException, ProvisionedThroughputException;

    /**
     * Renews the lease for the given owner. Conditional on the stored owner still being {@code owner}, or the lease
     * having expired. On success the passed-in lease's {@link ShardLease#leaseTimeout()} and
     * {@link ShardLease#leaseOwner()} are updated.
     *
     * @param lease the lease to renew
     * @param owner worker identifier renewing the lease
     *
     * @throws LeaseNotAcquiredException if another worker holds the lease
     * @throws InvalidStateException if lease table does not exist
     * @throws ProvisionedThroughputException if the store is out of capacity
     * @throws DependencyException if the store fails in an unexpected way
     */
    void renewLease(ShardLease lease, String owner) throws LeaseNotAcquiredException, DependencyException,
            InvalidStateException, ProvisionedThroughputException;

    /**
     * Persists {@link ShardLease#checkpoint()}.
     *
     * @param lease the lease whose checkpoint to store
     *
     * @throws InvalidStateException if lease table does not exist
     * @throws ProvisionedThroughputException if the store is out of capacity
     * @throws DependencyException if the store fails in an unexpected way
     */
    void checkpoint(ShardLease lease) throws DependencyException, InvalidStateException,
            ProvisionedThroughputException;

    /**
     * Clears the owner of a shard's lease so another worker can take it straight away. Conditional on the stored owner
     * still being {@code owner}; if another worker has taken the lease in the meantime the call does nothing.
     *
     * @param lease the lease to release
     * @param owner worker identifier that held the lease
     *
     * @throws InvalidStateException if lease table does not exist
     * @throws ProvisionedThroughputException if the store is out of capacity
     * @throws DependencyException if the store fails in an unexpected way
     */
    void releaseLease(ShardLease lease, String owner) throws DependencyException, InvalidStateException,
            ProvisionedThroughputException;
}
