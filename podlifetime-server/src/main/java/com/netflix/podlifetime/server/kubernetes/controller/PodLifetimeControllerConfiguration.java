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

package com.netflix.podlifetime.server.kubernetes.controller;

import com.netflix.archaius.api.annotations.DefaultValue;

public interface PodLifetimeControllerConfiguration {

    /**
     * @return delay before the first retry of a failed pod reconciliation
     */
    @DefaultValue("1000")
    long getRetryInitialDelayMs();

    /**
     * @return upper bound of the exponentially growing retry delay
     */
    @DefaultValue("60000")
    long getRetryMaxDelayMs();
}
