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

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import software.amazon.awssdk.services.kinesis.model.KmsThrottlingException;
import software.amazon.awssdk.services.kinesis.model.ProvisionedThroughputExceededException;

/**
 * How a failed GetRecords call is treated. This is the only place errors are inspected; a new retriable error has to
 * be added here explicitly.
 */
public enum GetRecordsErrorKind {
    /**
     * The shard's read throughput was exceeded. Kinesis rejects further calls for the rest of the second.
     */
    PROVISIONED_THROUGHPUT_EXCEEDED(true),
    /**
     * KMS throttled decryption of the stream's records.
     */
    KMS_THROTTLING(true),
    /**
     * Anything else. Not retried.
     */
    FATAL(false);

    private final boolean retryable;

    GetRecordsErrorKind(final boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public static GetRecordsErrorKind classify(final Throwable error) {
        final Throwable cause = unwrap(error);
        if (cause instanceof ProvisionedThroughputExceededException) {
            return PROVISIONED_THROUGHPUT_EXCEEDED;
        }
        if (cause instanceof KmsThrottlingException) {
            return KMS_THROTTLING;
        }
        return FATAL;
    }

    private static Throwable unwrap(final Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
