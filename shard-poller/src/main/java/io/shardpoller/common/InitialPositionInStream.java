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
package io.shardpoller.common;

/**
 * Where a consumer starts reading a shard for which nothing has been checkpointed yet.
 */
public enum InitialPositionInStream {
    /**
     * Only records written after the consumer starts.
     */
    LATEST,

    /**
     * Everything the stream still retains.
     */
    TRIM_HORIZON,

    /**
     * Records that arrived at or after a given time. The time is carried by {@link InitialPositionInStreamExtended}.
     */
    AT_TIMESTAMP
}
