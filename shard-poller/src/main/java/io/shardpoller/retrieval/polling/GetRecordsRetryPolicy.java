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
import java.time.Instant;

import com.google.common.math.LongMath;
import io.shardpoller.common.Clock;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Decides whether a failed GetRecords call is retried and after how long.
 * <ul>
 * <li>Provisioned throughput exceeded: Kinesis rejects calls for one second after the limit is hit, so wait out
 * whatever is left of that second measured from the start of the failed call.</li>
 * <li>KMS throttling: exponential backoff, {@code 100ms * 2^attempt}.</li>
 * </ul>
 * Both share one budget of consecutive failures; the caller resets its count after a successful call.
 */
@RequiredArgsConstructor
public class GetRecordsRetryPolicy {

    static final Duration THROUGHPUT_EXCEEDED_COOLDOWN = Duration.ofSeconds(1);
    static final long KMS_BACKOFF_BASE_MILLIS = 100L;

    private final int maxRetryCount;
    @NonNull
    private final Clock clock;

    /**
     * @param kind            classification of the error
     * @param failedCallStart when the failed call was issued
     * @param attempt         consecutive failures so far, including this one
     * @return when to retry, or fatal
     */
    public RetryDecision decide(@NonNull final GetRecordsErrorKind kind, @NonNull final Instant failedCallStart,
            final int attempt) {
        if (!kind.isRetryable() || attempt > maxRetryCount) {
            return RetryDecision.fatal();
        }
        switch (kind) {
            case PROVISIONED_THROUGHPUT_EXCEEDED:
                return RetryDecision.retryAfter(THROUGHPUT_EXCEEDED_COOLDOWN.minus(clock.since(failedCallStart)));
            case KMS_THROTTLING:
                return RetryDecision.retryAfter(kmsBackoff(attempt));
            default:
                return RetryDecision.fatal();
        }
    }

    static Duration kmsBackoff(final int attempt) {
        return Duration.ofMillis(LongMath.saturatedMultiply(KMS_BACKOFF_BASE_MILLIS, LongMath.saturatedPow(2, attempt)));
    }
}
