/*
 * Copyright 2025 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.netflix.podlifetime.common.util.retry;

import java.util.Optional;

/**
 * Immutable retry policy. Each failed attempt moves to the next {@link Retryer} instance by calling {@link #retry()}.
 */
public interface Retryer {

    /**
     * Delay before the next attempt or {@link Optional#empty()} if no more retries are allowed.
     */
    Optional<Long> getDelayMs();

    Retryer retry();
}
