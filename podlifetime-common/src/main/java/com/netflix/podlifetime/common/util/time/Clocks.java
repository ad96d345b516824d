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

package com.netflix.podlifetime.common.util.time;

import com.netflix.podlifetime.common.util.time.internal.DefaultTestClock;
import com.netflix.podlifetime.common.util.time.internal.SystemClock;

public final class Clocks {

    private Clocks() {
    }

    public static Clock system() {
        return SystemClock.INSTANCE;
    }

    public static TestClock test() {
        return new DefaultTestClock();
    }

    public static TestClock test(long startTimeMs) {
        return new DefaultTestClock(startTimeMs);
    }
}
