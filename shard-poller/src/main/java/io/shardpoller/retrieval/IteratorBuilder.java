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

import lombok.NonNull;
import software.amazon.awssdk.services.kinesis.model.GetShardIteratorRequest;

/**
 * Fills in the iterator type and position fields of a GetShardIterator request.
 */
public class IteratorBuilder {

    private IteratorBuilder() {
    }

    /**
     * @param builder          An initial GetShardIteratorRequest builder to be updated.
     * @param startingPosition Where the iterator should point.
     * @return the updated GetShardIteratorRequest.Builder.
     */
    public static GetShardIteratorRequest.Builder request(
            @NonNull final GetShardIteratorRequest.Builder builder, @NonNull final StartingPosition startingPosition) {
        GetShardIteratorRequest.Builder result = builder.shardIteratorType(startingPosition.type());
        switch (startingPosition.type()) {
            case AT_TIMESTAMP:
                return result.timestamp(startingPosition.timestamp());
            case AT_SEQUENCE_NUMBER:
            case AFTER_SEQUENCE_NUMBER:
                return result.startingSequenceNumber(startingPosition.sequenceNumber());
            default:
                return result;
        }
    }
}
