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

import java.util.function.BooleanSupplier;

import com.google.common.base.Preconditions;

public class ExecutionContext {

    private final String id;
    private final long cycle;
    private final BooleanSupplier cancellationCheck;

    private ExecutionContext(String id, long cycle, BooleanSupplier cancellationCheck) {
        this.id = id;
        this.cycle = cycle;
        this.cancellationCheck = cancellationCheck;
    }

    public String getId() {
        return id;
    }

    /**
     * Sequence number of this execution within its schedule, starting from 0.
     */
    public long getCycle() {
        return cycle;
    }

    /**
     * Returns true if the owning schedule was cancelled. Long running actions should check it between
     * units of work, and return early.
     */
    public boolean isCancelled() {
        return cancellationCheck.getAsBoolean();
    }

    @Override
    public String toString() {
        return "ExecutionContext{" +
                "id='" + id + '\'' +
                ", cycle=" + cycle +
                ", cancelled=" + isCancelled() +
                '}';
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private long cycle;
        private BooleanSupplier cancellationCheck = () -> false;

        private Builder() {
        }

        public Builder withId(String id) {
            this.id = id;
            return this;
        }

        public Builder withCycle(long cycle) {
            this.cycle = cycle;
            return this;
        }

        public Builder withCancellationCheck(BooleanSupplier cancellationCheck) {
            this.cancellationCheck = cancellationCheck;
            return this;
        }

        public ExecutionContext build() {
            Preconditions.checkNotNull(id, "id cannot be null");
            Preconditions.checkNotNull(cancellationCheck, "cancellationCheck cannot be null");
            return new ExecutionContext(id, cycle, cancellationCheck);
        }
    }
}
