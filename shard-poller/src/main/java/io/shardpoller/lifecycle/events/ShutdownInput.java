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
package io.shardpoller.lifecycle.events;

import io.shardpoller.lifecycle.ShutdownReason;
import io.shardpoller.processor.RecordProcessorCheckpointer;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Container for the parameters to the ShardRecordProcessor's shutdown method.
 */
@Builder
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@ToString
public class ShutdownInput {
    /**
     * Why the consumer stopped.
     */
    private final ShutdownReason shutdownReason;
    /**
     * Checkpointer for recording final progress. Null when the lease was lost.
     */
    private final RecordProcessorCheckpointer checkpointer;
}
