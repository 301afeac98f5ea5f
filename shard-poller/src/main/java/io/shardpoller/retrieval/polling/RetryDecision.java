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

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Outcome of {@link GetRecordsRetryPolicy#decide}: retry after {@link #delay()}, or give up.
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@ToString
public class RetryDecision {

    private static final RetryDecision FATAL = new RetryDecision(false, Duration.ZERO);

    private final boolean shouldRetry;
    private final Duration delay;

    public static RetryDecision retryAfter(@NonNull final Duration delay) {
        return new RetryDecision(true, delay.isNegative() ? Duration.ZERO : delay);
    }

    public static RetryDecision fatal() {
        return FATAL;
    }
}
