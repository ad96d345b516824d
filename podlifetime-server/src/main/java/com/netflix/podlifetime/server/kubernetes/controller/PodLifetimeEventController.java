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

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import javax.annotation.PreDestroy;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.google.common.annotations.VisibleForTesting;
import com.netflix.podlifetime.common.runtime.PodLifetimeRuntime;
import com.netflix.podlifetime.common.util.ExecutorsExt;
import com.netflix.podlifetime.common.util.retry.Retryer;
import com.netflix.podlifetime.common.util.retry.Retryers;
import com.netflix.podlifetime.runtime.connector.kubernetes.KubeApiFacade;
import com.netflix.podlifetime.runtime.connector.kubernetes.KubeUtil;
import com.netflix.podlifetime.server.MetricConstants;
import com.netflix.spectator.api.Counter;
import com.netflix.spectator.api.Id;
import com.netflix.spectator.api.Registry;
import com.netflix.spectator.api.patterns.PolledMeter;
import io.kubernetes.client.informer.ResourceEventHandler;
import io.kubernetes.client.openapi.models.V1Pod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reconciles a pod each time the pod informer reports a change of it. Pod keys waiting for processing are
 * de-duplicated, and a single worker thread processes them, so at most one reconciliation triggered by pod
 * events runs at any time. A failed reconciliation is retried with an exponential backoff.
 */
@Singleton
public class PodLifetimeEventController {

    private static final Logger logger = LoggerFactory.getLogger(PodLifetimeEventController.class);

    public static final String EVENT_CONTROLLER = "podLifetimeEventController";

    private static final String METRIC_ROOT = MetricConstants.METRIC_KUBERNETES_CONTROLLER + EVENT_CONTROLLER + ".";

    private final KubeApiFacade kubeApiFacade;
    private final PodLifetimeReconciler reconciler;
    private final PodLifetimeControllerConfiguration configuration;
    private final Registry registry;
    private final ScheduledExecutorService executor;

    private final Set<String> pendingKeys = ConcurrentHashMap.newKeySet();
    private final ConcurrentMap<String, Retryer> retryers = new ConcurrentHashMap<>();

    private final Id pendingGaugeId;
    private final Counter eventCounter;
    private final Counter retryCounter;

    private volatile boolean shutdown;

    @Inject
    public PodLifetimeEventController(KubeApiFacade kubeApiFacade,
                                      PodLifetimeReconciler reconciler,
                                      PodLifetimeControllerConfiguration configuration,
                                      PodLifetimeRuntime runtime) {
        this(kubeApiFacade, reconciler, configuration, runtime, ExecutorsExt.namedSingleThreadScheduledExecutor(EVENT_CONTROLLER));
    }

    @VisibleForTesting
    PodLifetimeEventController(KubeApiFacade kubeApiFacade,
                               PodLifetimeReconciler reconciler,
                               PodLifetimeControllerConfiguration configuration,
                               PodLifetimeRuntime runtime,
                               ScheduledExecutorService executor) {
        this.kubeApiFacade = kubeApiFacade;
        this.reconciler = reconciler;
        this.configuration = configuration;
        this.registry = runtime.getRegistry();
        this.executor = executor;

        this.pendingGaugeId = registry.createId(METRIC_ROOT + "pending");
        this.eventCounter = registry.counter(METRIC_ROOT + "events");
        this.retryCounter = registry.counter(METRIC_ROOT + "retries");

        PolledMeter.using(registry).withId(pendingGaugeId).monitorSize(pendingKeys);
    }

    /**
     * Subscribes to pod informer notifications. The informer must be started afterwards.
     */
    public void start() {
        kubeApiFacade.getPodInformer().addEventHandler(new ResourceEventHandler<V1Pod>() {
            @Override
            public void onAdd(V1Pod pod) {
                enqueue(KubeUtil.toPodKey(pod));
            }

            @Override
            public void onUpdate(V1Pod oldPod, V1Pod newPod) {
                enqueue(KubeUtil.toPodKey(newPod));
            }

            @Override
            public void onDelete(V1Pod pod, boolean deletedFinalStateUnknown) {
                enqueue(KubeUtil.toPodKey(pod));
            }
        });
        logger.info("Subscribed to pod informer events");
    }

    @PreDestroy
    public void shutdown() {
        this.shutdown = true;
        executor.shutdownNow();
        PolledMeter.remove(registry, pendingGaugeId);
    }

    /**
     * Adds a pod key to the work queue, unless it is already waiting there.
     */
    public void enqueue(String podKey) {
        eventCounter.increment();
        if (shutdown || !pendingKeys.add(podKey)) {
            return;
        }
        try {
            executor.execute(() -> process(podKey));
        } catch (RejectedExecutionException e) {
            pendingKeys.remove(podKey);
            logger.warn("Event controller not running, dropping pod key: {}", podKey);
        }
    }

    @VisibleForTesting
    int getPendingCount() {
        return pendingKeys.size();
    }

    private void process(String podKey) {
        // Removed before the reconciliation, so changes observed while it runs queue the key again
        pendingKeys.remove(podKey);

        String[] namespaceAndName = KubeUtil.splitPodKey(podKey);
        try {
            ReconcileOutcome outcome = reconciler.reconcile(namespaceAndName[0], namespaceAndName[1]);
            retryers.remove(podKey);
            logger.debug("Reconciled pod {}: {}", podKey, outcome);
        } catch (Exception e) {
            scheduleRetry(podKey, e);
        }
    }

    private void scheduleRetry(String podKey, Exception error) {
        Retryer retryer = retryers.compute(podKey, (key, previous) -> previous == null
                ? Retryers.exponentialBackoff(configuration.getRetryInitialDelayMs(), configuration.getRetryMaxDelayMs(), TimeUnit.MILLISECONDS)
                : previous.retry()
        );
        long delayMs = retryer.getDelayMs().orElse(configuration.getRetryMaxDelayMs());
        logger.warn("Pod reconciliation failed, retrying in {}ms: {}", delayMs, podKey, error);
        retryCounter.increment();
        try {
            executor.schedule(() -> enqueue(podKey), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.warn("Event controller not running, dropping retry of pod key: {}", podKey);
        }
    }
}
