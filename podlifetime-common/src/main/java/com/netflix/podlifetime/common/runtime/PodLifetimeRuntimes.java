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

package com.netflix.podlifetime.common.runtime;

import com.netflix.podlifetime.common.runtime.internal.DefaultPodLifetimeRuntime;
import com.netflix.podlifetime.common.util.time.Clocks;
import com.netflix.podlifetime.common.util.time.TestClock;
import com.netflix.spectator.api.Registry;

public final class PodLifetimeRuntimes {

    private PodLifetimeRuntimes() {
    }

    public static PodLifetimeRuntime internal() {
        return DefaultPodLifetimeRuntime.newBuilder().build();
    }

    public static PodLifetimeRuntime internal(Registry registry) {
        return DefaultPodLifetimeRuntime.newBuilder()
                .withRegistry(registry)
                .build();
    }

    public static PodLifetimeRuntime test() {
        return DefaultPodLifetimeRuntime.newBuilder()
                .withClock(Clocks.test())
                .build();
    }

    public static PodLifetimeRuntime test(TestClock clock) {
        return DefaultPodLifetimeRuntime.newBuilder()
                .withClock(clock)
                .build();
    }
}
