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

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import com.google.common.base.Preconditions;
import io.kubernetes.client.openapi.models.V1ContainerState;
import io.kubernetes.client.openapi.models.V1ContainerStateRunning;
import io.kubernetes.client.openapi.models.V1ContainerStatus;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1Pod;
import io.kubernetes.client.openapi.models.V1PodStatus;

/**
 * Pod lifetime label and container start time helpers.
 */
public final class PodLifetimes {

    /**
     * Pod label holding the pod lifetime in seconds.
     */
    public static final String LIFETIME_LABEL = "pod.kubernetes.io/lifetime";

    private static final Pattern LIFETIME_VALUE_PATTERN = Pattern.compile("[0-9]+");

    private PodLifetimes() {
    }

    public static Optional<String> findLifetimeLabel(V1Pod pod) {
        V1ObjectMeta metadata = pod.getMetadata();
        if (metadata == null) {
            return Optional.empty();
        }
        Map<String, String> labels = metadata.getLabels();
        return labels == null ? Optional.empty() : Optional.ofNullable(labels.get(LIFETIME_LABEL));
    }

    /**
     * Parses a lifetime label value. Only base-10 digits are accepted (no sign, unit suffix, or fraction).
     *
     * @throws IllegalArgumentException if the value is malformed or does not fit into a long
     */
    public static long parseLifetimeSeconds(String value) {
        Preconditions.checkArgument(
                value != null && LIFETIME_VALUE_PATTERN.matcher(value).matches(),
                "expected a non-negative integer number of seconds, got '%s'", value
        );
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("lifetime value out of range: '" + value + "'", e);
        }
    }

    /**
     * Returns the start time of the most recently started container that is still running. Containers reported
     * as running without a start time are ignored.
     */
    public static Optional<OffsetDateTime> findLatestStartTime(V1Pod pod) {
        V1PodStatus status = pod.getStatus();
        if (status == null || status.getContainerStatuses() == null) {
            return Optional.empty();
        }

        OffsetDateTime latest = null;
        for (V1ContainerStatus containerStatus : status.getContainerStatuses()) {
            V1ContainerState state = containerStatus.getState();
            V1ContainerStateRunning running = state == null ? null : state.getRunning();
            if (running == null || running.getStartedAt() == null) {
                continue;
            }
            if (latest == null || running.getStartedAt().isAfter(latest)) {
                latest = running.getStartedAt();
            }
        }
        return Optional.ofNullable(latest);
    }

    /**
     * Returns the pod expiry time, saturated at {@link Long#MAX_VALUE} for lifetimes too large to represent.
     */
    public static long computeExpiryTimeMs(long startTimeMs, long lifetimeSeconds) {
        try {
            return Math.addExact(startTimeMs, Math.multiplyExact(lifetimeSeconds, 1000L));
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
