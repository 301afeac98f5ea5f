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
 * Outcome of one {@link PollingShardConsumer} run: the reason it stopped, or the exception that stopped it.
 */
public class TaskResult {

    // Why the consumer stopped; null if it failed.
    private final ShutdownReason shutdownReason;

    // Any exception caught while running the consumer.
    private final Exception exception;

    private TaskResult(ShutdownReason shutdownReason, Exception exception) {
        this.shutdownReason = shutdownReason;
        this.exception = exception;
    }

    /**
     * @param shutdownReason why the consumer stopped
     */
    static TaskResult stopped(ShutdownReason shutdownReason) {
        return new TaskResult(shutdownReason, null);
    }

    /**
     * @param e Any exception encountered when running the consumer.
     */
    static TaskResult failed(Exception e) {
        return new TaskResult(null, e);
    }

    /**
     * @return why the consumer stopped, null if it failed
     */
    public ShutdownReason getShutdownReason() {
        return shutdownReason;
    }

    /**
     * @return the exception, null unless the consumer failed
     */
    public Exception getException() {
        return exception;
    }

    /**
     * @return whether we reached the end of the shard (no more records will ever be fetched)
     */
    public boolean isShardEndReached() {
        return shutdownReason == ShutdownReason.SHARD_END;
    }

    @Override
    public String toString() {
        return exception == null ? "TaskResult(" + shutdownReason + ")" : "TaskResult(failed: " + exception + ")";
    }
}
