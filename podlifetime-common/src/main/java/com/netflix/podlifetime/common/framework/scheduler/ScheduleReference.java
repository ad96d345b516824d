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

package com.netflix.podlifetime.common.framework.scheduler;

import com.netflix.podlifetime.common.framework.scheduler.model.ScheduleDescriptor;

public interface ScheduleReference {

    String getScheduleId();

    ScheduleDescriptor getDescriptor();

    /**
     * Returns true after {@link #cancel()} is called.
     */
    boolean isClosed();

    /**
     * Stops the schedule. An action that is already running is not interrupted, but it can observe the
     * cancellation via {@link ExecutionContext#isCancelled()}.
     */
    void cancel();
}
