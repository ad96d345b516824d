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

package com.netflix.podlifetime.common.framework.scheduler.internal;

import java.util.concurrent.TimeUnit;

import com.netflix.podlifetime.common.framework.scheduler.model.ScheduleDescriptor;
import com.netflix.spectator.api.Id;
import com.netflix.spectator.api.Registry;

class SchedulerMetrics {

    private static final String ROOT_NAME = "podlifetime.localScheduler.";

    private final Registry registry;
    private final Id executionTimeId;
    private final Id executionId;

    SchedulerMetrics(Registry registry) {
        this.registry = registry;
        this.executionTimeId = registry.createId(ROOT_NAME + "executionTime");
        this.executionId = registry.createId(ROOT_NAME + "executions");
    }

    void onSuccess(ScheduleDescriptor descriptor, long elapsedMs) {
        registry.timer(executionTimeId.withTag("name", descriptor.getName())).record(elapsedMs, TimeUnit.MILLISECONDS);
        registry.counter(executionId.withTag("name", descriptor.getName()).withTag("status", "succeeded")).increment();
    }

    void onFailure(ScheduleDescriptor descriptor, long elapsedMs, Throwable error) {
        registry.timer(executionTimeId.withTag("name", descriptor.getName())).record(elapsedMs, TimeUnit.MILLISECONDS);
        registry.counter(executionId
                .withTag("name", descriptor.getName())
                .withTag("status", "failed")
                .withTag("error", error.getClass().getSimpleName())
        ).increment();
    }
}
