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

/**
 * Checkpoint values that name a position rather than a record. They are stored by name in place of a sequence number.
 */
public enum SentinelCheckpoint {
    /**
     * Oldest record the stream still retains.
     */
    TRIM_HORIZON,
    /**
     * Just past the newest record.
     */
    LATEST,
    /**
     * Every record of a closed shard has been processed. Child shards wait for their parents to reach this value.
     */
    SHARD_END,
    /**
     * First record that arrived at or after a given time.
     */
    AT_TIMESTAMP;

    /**
     * @param checkpoint a stored checkpoint value, may be null
     * @return true if the value is this sentinel
     */
    public boolean matches(String checkpoint) {
        return name().equals(checkpoint);
    }
}
