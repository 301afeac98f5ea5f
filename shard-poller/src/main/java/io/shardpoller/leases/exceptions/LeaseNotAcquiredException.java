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
package io.shardpoller.leases.exceptions;

/**
 * Another worker owns the lease. This is the normal outcome of lease contention, not a failure of the store.
 */
public class LeaseNotAcquiredException extends LeasingException {

    private static final long serialVersionUID = 1L;

    public LeaseNotAcquiredException(String message) {
        super(message);
    }

    public LeaseNotAcquiredException(String message, Throwable cause) {
        super(message, cause);
    }
}
