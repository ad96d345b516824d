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

package com.netflix.podlifetime.common.runtime.internal;

import javax.inject.Inject;
import javax.inject.Singleton;

import com.netflix.podlifetime.common.framework.scheduler.LocalScheduler;
import com.netflix.podlifetime.common.framework.scheduler.internal.DefaultLocalScheduler;
import com.netflix.podlifetime.common.runtime.PodLifetimeRuntime;
import com.netflix.podlifetime.common.util.time.Clock;
import com.netflix.podlifetime.common.util.time.Clocks;
import com.netflix.spectator.api.DefaultRegistry;
import com.netflix.spectator.api.Registry;
import reactor.core.scheduler.Schedulers;

@Singleton
public class DefaultPodLifetimeRuntime implements PodLifetimeRuntime {

    private static final String LOCAL_SCHEDULER_THREAD_NAME = "podlifetime-local-scheduler";

    private final Registry registry;
    private final Clock clock;
    private final DefaultLocalScheduler localScheduler;

    @Inject
    public DefaultPodLifetimeRuntime(Registry registry) {
        this(registry, Clocks.system());
    }

    public DefaultPodLifetimeRuntime(Registry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
        this.localScheduler = new DefaultLocalScheduler(Schedulers.newSingle(LOCAL_SCHEDULER_THREAD_NAME, true), clock, registry);
    }

    public void shutdown() {
        localScheduler.shutdown();
    }

    @Override
    public Registry getRegistry() {
        return registry;
    }

    @Override
    public Clock getClock() {
        return clock;
    }

    @Override
    public LocalScheduler getLocalScheduler() {
        return localScheduler;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {

        private Registry registry;
        private Clock clock;

        private Builder() {
        }

        public Builder withRegistry(Registry registry) {
            this.registry = registry;
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public DefaultPodLifetimeRuntime build() {
            return new DefaultPodLifetimeRuntime(
                    registry == null ? new DefaultRegistry() : registry,
                    clock == null ? Clocks.system() : clock
            );
        }
    }
}
