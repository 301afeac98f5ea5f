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

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public final class FutureUtils {

    private FutureUtils() {
    }

    /**
     * Blocks for the result of an SDK call. A call that has not completed within {@code timeout} is cancelled so it
     * does not keep a connection busy.
     *
     * @throws ExecutionException if the call failed; the SDK exception is the cause
     * @throws TimeoutException if the call did not complete in time
     */
    public static <T> T resolveOrCancelFuture(Future<T> future, Duration timeout)
            throws ExecutionException, InterruptedException, TimeoutException {
        boolean completed = false;
        try {
            T result = future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            completed = true;
            return result;
        } catch (ExecutionException e) {
            completed = true;
            throw e;
        } finally {
            if (!completed) {
                future.cancel(true);
            }
        }
    }
}
