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
package io.shardpoller.exceptions;

/**
 * Transient checkpoint failures. The processor may back off and call again. Unchecked, so a processor that does not
 * handle them fails its batch.
 */
public abstract class KinesisClientLibRetryableException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public KinesisClientLibRetryableException(String message) {
        super(message);
    }

    public KinesisClientLibRetryableException(String message, Exception cause) {
        super(message, cause);
    }
}
