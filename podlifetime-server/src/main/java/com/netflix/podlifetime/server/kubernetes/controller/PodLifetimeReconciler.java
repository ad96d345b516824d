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
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.netflix.podlifetime.common.runtime.PodLifetimeRuntime;
import com.netflix.podlifetime.common.util.DateTimeExt;
import com.netflix.podlifetime.common.util.time.Clock;
import com.netflix.podlifetime.runtime.connector.kubernetes.KubeApiException;
import com.netflix.podlifetime.runtime.connector.kubernetes.KubeApiFacade;
import com.netflix.podlifetime.server.MetricConstants;
import com.netflix.spectator.api.Counter;
import com.netflix.spectator.api.Id;
import com.netflix.spectator.api.Registry;
import io.kubernetes.client.openapi.models.V1Pod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deletes a pod once the time elapsed since its most recently started running container exceeds the lifetime given
 * in the {@link PodLifetimes#LIFETIME_LABEL} label. The pod state is re-read on each invocation, and no state is kept
 * between invocations, so it is safe to call it concurrently and repeatedly for the same pod.
 */
@Singleton
public class PodLifetimeReconciler {

    private static final Logger logger = LoggerFactory.getLogger(PodLifetimeReconciler.class);

    private static final String METRIC_OUTCOME = MetricConstants.METRIC_RECONCILER + "outcome";
    private static final String METRIC_INVALID_LIFETIME = MetricConstants.METRIC_RECONCILER + "invalidLifetime";

    private final KubeApiFacade kubeApiFacade;
    private final Clock clock;
    private final Registry registry;

    private final Id outcomeId;
    private final Counter invalidLifetimeCounter;

    @Inject
    public PodLifetimeReconciler(KubeApiFacade kubeApiFacade, PodLifetimeRuntime runtime) {
        this.kubeApiFacade = kubeApiFacade;
        this.clock = runtime.getClock();
        this.registry = runtime.getRegistry();
        this.outcomeId = registry.createId(METRIC_OUTCOME);
        this.invalidLifetimeCounter = registry.counter(METRIC_INVALID_LIFETIME);
    }

    /**
     * Reconciles a single pod.
     *
     * @throws KubeApiException if the delete request failed for a reason other than the pod not being found
     */
    public ReconcileOutcome reconcile(String namespace, String name) throws KubeApiException {
        try {
            ReconcileOutcome outcome = doReconcile(namespace, name);
            registry.counter(outcomeId.withTag("outcome", outcome.name())).increment();
            return outcome;
        } catch (RuntimeException e) {
            registry.counter(outcomeId.withTag("outcome", "FAILED").withTag("error", e.getClass().getSimpleName())).increment();
            throw e;
        }
    }

    private ReconcileOutcome doReconcile(String namespace, String name) {
        Optional<V1Pod> podOpt = kubeApiFacade.findPod(namespace, name);
        if (!podOpt.isPresent()) {
            logger.debug("Pod not found: {}/{}", namespace, name);
            return ReconcileOutcome.NOT_FOUND;
        }
        V1Pod pod = podOpt.get();

        Optional<String> lifetimeLabel = PodLifetimes.findLifetimeLabel(pod);
        if (!lifetimeLabel.isPresent()) {
            logger.debug("Pod does not have lifetime label, skipping: {}/{}", namespace, name);
            return ReconcileOutcome.EXEMPT;
        }

        long lifetimeSeconds;
        try {
            lifetimeSeconds = PodLifetimes.parseLifetimeSeconds(lifetimeLabel.get());
        } catch (IllegalArgumentException e) {
            logger.error("Invalid lifetime label value of pod {}/{}: {}", namespace, name, e.getMessage());
            invalidLifetimeCounter.increment();
            return ReconcileOutcome.INVALID_LIFETIME;
        }

        Optional<OffsetDateTime> latestStartTime = PodLifetimes.findLatestStartTime(pod);
        if (!latestStartTime.isPresent()) {
            logger.debug("Pod has no running containers, skipping: {}/{}", namespace, name);
            return ReconcileOutcome.NOT_RUNNING;
        }

        long startTimeMs = DateTimeExt.toMillis(latestStartTime.get());
        long expiryTimeMs = PodLifetimes.computeExpiryTimeMs(startTimeMs, lifetimeSeconds);
        if (!clock.isPast(expiryTimeMs)) {
            return ReconcileOutcome.NOT_EXPIRED;
        }

        logger.info("Pod lifetime expired, deleting pod: {}/{} (lifetime={}, latestContainerStart={})",
                namespace, name, DateTimeExt.toTimeUnitString(lifetimeSeconds * 1000), DateTimeExt.toUtcDateTimeString(startTimeMs));
        try {
            kubeApiFacade.deleteNamespacedPod(namespace, name);
        } catch (KubeApiException e) {
            if (e.getErrorCode() == KubeApiException.ErrorCode.NOT_FOUND) {
                logger.info("Pod already deleted: {}/{}", namespace, name);
                return ReconcileOutcome.ALREADY_DELETED;
            }
            logger.error("Failed to delete pod: {}/{}", namespace, name, e);
            throw e;
        }
        return ReconcileOutcome.DELETED;
    }
}
