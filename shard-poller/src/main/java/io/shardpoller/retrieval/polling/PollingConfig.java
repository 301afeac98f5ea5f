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

import com.google.common.base.Preconditions;
import io.shardpoller.common.InitialPositionInStream;
import io.shardpoller.common.InitialPositionInStreamExtended;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

/**
 * Settings for one {@link io.shardpoller.lifecycle.PollingShardConsumer}. Setters are fluent and return the config.
 * The throughput defaults are the Kinesis per-shard read limits; lowering them leaves headroom for other consumers of
 * the same stream.
 */
@Getter
@Setter
@Accessors(fluent = true)
@ToString
@EqualsAndHashCode
@Slf4j
public class PollingConfig {

    /**
     * Largest {@code Limit} a GetRecords call accepts.
     */
    public static final int MAX_RECORDS_LIMIT = 10000;

    public static final long MIN_IDLE_MILLIS_BETWEEN_READS = 200L;

    private final String streamName;

    /**
     * Owner name written to the lease on renewal.
     */
    private final String workerIdentifier;

    /**
     * Limit passed to every GetRecords call. 1 to 10000, default 10000.
     */
    @Setter(AccessLevel.NONE)
    private int maxRecords = MAX_RECORDS_LIMIT;

    /**
     * Consecutive throttled GetRecords calls that are retried before the consumer fails. Default 5.
     */
    @Setter(AccessLevel.NONE)
    private int maxRetryCount = 5;

    /**
     * Pause after an empty batch when the consumer is caught up. At least 200, default 1000.
     */
    @Setter(AccessLevel.NONE)
    private long idleTimeBetweenReadsInMillis = 1000L;

    /**
     * The lease is renewed once it is this close to its timeout. Default 5000.
     */
    private long leaseRefreshPeriodMillis = 5000L;

    /**
     * Default 5, the Kinesis per-shard limit.
     */
    @Setter(AccessLevel.NONE)
    private int maxGetRecordsCallsPerSecond = 5;

    /**
     * Average read rate cap. Default 2,000,000, the Kinesis per-shard limit.
     */
    @Setter(AccessLevel.NONE)
    private long maxBytesPerSecond = 2_000_000L;

    /**
     * How often to look at the parent shard's checkpoint while waiting for it to finish. Default 10000.
     */
    private long parentShardPollIntervalMillis = 10000L;

    private boolean callProcessRecordsEvenForEmptyRecordList;

    /**
     * Used when the shard has no checkpoint. Default LATEST.
     */
    @NonNull
    private InitialPositionInStreamExtended initialPositionInStreamExtended =
            InitialPositionInStreamExtended.newInitialPosition(InitialPositionInStream.LATEST);

    /**
     * Longest wait for a single Kinesis call. Default 30 seconds.
     */
    @NonNull
    private Duration kinesisRequestTimeout = Duration.ofSeconds(30);

    /**
     * Consecutive throttles logged at WARN before switching to ERROR. Default 5.
     */
    private int maxConsecutiveWarnThrottles = 5;

    public PollingConfig(@NonNull String streamName, @NonNull String workerIdentifier) {
        this.streamName = streamName;
        this.workerIdentifier = workerIdentifier;
    }

    public PollingConfig maxRecords(int maxRecords) {
        Preconditions.checkArgument(maxRecords >= 1 && maxRecords <= MAX_RECORDS_LIMIT,
                "maxRecords must be between 1 and %s, got %s", MAX_RECORDS_LIMIT, maxRecords);
        this.maxRecords = maxRecords;
        return this;
    }

    public PollingConfig maxRetryCount(int maxRetryCount) {
        Preconditions.checkArgument(maxRetryCount >= 0, "maxRetryCount must not be negative, got %s", maxRetryCount);
        this.maxRetryCount = maxRetryCount;
        return this;
    }

    /**
     * Values below {@link #MIN_IDLE_MILLIS_BETWEEN_READS} are raised to it.
     */
    public PollingConfig idleTimeBetweenReadsInMillis(long idleTimeBetweenReadsInMillis) {
        if (idleTimeBetweenReadsInMillis < MIN_IDLE_MILLIS_BETWEEN_READS) {
            log.warn("idleTimeBetweenReadsInMillis of {} is below the minimum, using {}",
                    idleTimeBetweenReadsInMillis, MIN_IDLE_MILLIS_BETWEEN_READS);
            this.idleTimeBetweenReadsInMillis = MIN_IDLE_MILLIS_BETWEEN_READS;
        } else {
            this.idleTimeBetweenReadsInMillis = idleTimeBetweenReadsInMillis;
        }
        return this;
    }

    public PollingConfig maxGetRecordsCallsPerSecond(int maxGetRecordsCallsPerSecond) {
        Preconditions.checkArgument(maxGetRecordsCallsPerSecond > 0,
                "maxGetRecordsCallsPerSecond must be positive, got %s", maxGetRecordsCallsPerSecond);
        this.maxGetRecordsCallsPerSecond = maxGetRecordsCallsPerSecond;
        return this;
    }

    public PollingConfig maxBytesPerSecond(long maxBytesPerSecond) {
        Preconditions.checkArgument(maxBytesPerSecond > 0, "maxBytesPerSecond must be positive, got %s",
                maxBytesPerSecond);
        this.maxBytesPerSecond = maxBytesPerSecond;
        return this;
    }
}
