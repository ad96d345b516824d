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

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;

import com.netflix.podlifetime.common.framework.scheduler.model.ScheduleDescriptor;

/**
 * Simple scheduler for running tasks periodically within a JVM process.
 */
public interface LocalScheduler {

    /**
     * Returns references to all schedules that are currently active.
     */
    List<ScheduleReference> getActiveSchedules();

    /**
     * Returns schedule with the given id if it exists or {@link Optional#empty()}.
     */
    Optional<ScheduleReference> findSchedule(String scheduleId);

    /**
     * Schedule an action which is executed synchronously using the provided {@link ExecutorService}. The next
     * execution is scheduled after the previous one completes, so executions of the same schedule never overlap.
     */
    ScheduleReference schedule(ScheduleDescriptor scheduleDescriptor, Consumer<ExecutionContext> action, ExecutorService executorService);

    /**
     * Cancel a schedule with the given id.
     *
     * @throws LocalSchedulerException if a schedule with the given id does not exist.
     */
    void cancel(String scheduleId);
}
