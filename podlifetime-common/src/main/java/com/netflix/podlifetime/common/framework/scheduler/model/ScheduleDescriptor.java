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

package com.netflix.podlifetime.common.framework.scheduler.model;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import com.google.common.base.Preconditions;
import com.netflix.podlifetime.common.util.retry.Retryer;
import com.netflix.podlifetime.common.util.retry.Retryers;

public class ScheduleDescriptor {

    private final String name;
    private final String description;
    private final Duration initialDelay;
    private final Duration interval;
    private final Duration timeout;
    private final Supplier<Retryer> retryerSupplier;

    private ScheduleDescriptor(String name,
                               String description,
                               Duration initialDelay,
                               Duration interval,
                               Duration timeout,
                               Supplier<Retryer> retryerSupplier) {
        this.name = name;
        this.description = description;
        this.initialDelay = initialDelay;
        this.interval = interval;
        this.timeout = timeout;
        this.retryerSupplier = retryerSupplier;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public Duration getInterval() {
        return interval;
    }

    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Retry policy applied after a failed execution. The delay it returns replaces the regular interval until
     * the next successful execution.
     */
    public Supplier<Retryer> getRetryerSupplier() {
        return retryerSupplier;
    }

    @Override
    public String toString() {
        return "ScheduleDescriptor{" +
                "name='" + name + '\'' +
                ", description='" + description + '\'' +
                ", initialDelay=" + initialDelay +
                ", interval=" + interval +
                ", timeout=" + timeout +
                '}';
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private String description;
        private Duration initialDelay = Duration.ZERO;
        private Duration interval;
        private Duration timeout;

        private Supplier<Retryer> retryerSupplier = () -> Retryers.exponentialBackoff(1, 5, TimeUnit.SECONDS);

        private Builder() {
        }

        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        public Builder withDescription(String description) {
            this.description = description;
            return this;
        }

        public Builder withInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder withInterval(Duration interval) {
            this.interval = interval;
            return this;
        }

        public Builder withTimeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder withRetryerSupplier(Supplier<Retryer> retryerSupplier) {
            this.retryerSupplier = retryerSupplier;
            return this;
        }

        public ScheduleDescriptor build() {
            Preconditions.checkNotNull(name, "name cannot be null");
            Preconditions.checkNotNull(description, "description cannot be null");
            Preconditions.checkNotNull(initialDelay, "initialDelay cannot be null");
            Preconditions.checkNotNull(interval, "interval cannot be null");
            Preconditions.checkNotNull(timeout, "timeout cannot be null");
            Preconditions.checkNotNull(retryerSupplier, "retryerSupplier cannot be null");
            Preconditions.checkArgument(!interval.isNegative() && !interval.isZero(), "interval must be > 0: %s", interval);

            return new ScheduleDescriptor(name, description, initialDelay, interval, timeout, retryerSupplier);
        }
    }
}
