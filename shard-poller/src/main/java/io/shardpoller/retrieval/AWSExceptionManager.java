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

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

import lombok.NonNull;

/**
 * Turns the cause of a failed SDK future back into the exception a caller can catch. Handlers are registered per
 * exception class; the most specific registered superclass of the cause wins. Causes with no handler are wrapped in a
 * {@link RuntimeException}.
 * <p>
 * Register everything before sharing an instance; lookups are safe from several threads, registration is not.
 * </p>
 */
public class AWSExceptionManager {

    private final Map<Class<? extends Throwable>, Function<? super Throwable, RuntimeException>> handlers =
            new HashMap<>();

    @SuppressWarnings("unchecked")
    public <T extends Throwable> void add(@NonNull final Class<T> clazz,
            @NonNull final Function<T, RuntimeException> handler) {
        // Only ever applied to instances of clazz, see apply.
        handlers.put(clazz, t -> handler.apply((T) t));
    }

    public RuntimeException apply(@NonNull final Throwable cause) {
        for (Class<?> clazz = cause.getClass(); clazz != null; clazz = clazz.getSuperclass()) {
            final Function<? super Throwable, RuntimeException> handler = handlers.get(clazz);
            if (handler != null) {
                return handler.apply(cause);
            }
        }
        return new RuntimeException(cause);
    }
}
