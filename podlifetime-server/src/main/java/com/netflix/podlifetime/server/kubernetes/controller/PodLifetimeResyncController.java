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

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.PreDestroy;
import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Singleton;

import com.google.common.annotations.VisibleForTesting;
import com.netflix.podlifetime.common.framework.scheduler.ExecutionContext;
import com.netflix.podlifetime.common.framework.scheduler.ScheduleReference;
import com.netflix.podlifetime.common.framework.scheduler.model.ScheduleDescriptor;
import com.netflix.podlifetime.common.runtime.PodLifetimeRuntime;
import com.netflix.podlifetime.common.util.Evaluators;
import com.netflix.podlifetime.common.util.ExecutorsExt;
import com.netflix.podlifetime.runtime.connector.kubernetes.KubeApiFacade;
import com.netflix.podlifetime.runtime.connector.kubernetes.KubeUtil;
import com.netflix.podlifetime.server.MetricConstants;
import com.netflix.spectator.api.Counter;
import com.netflix.spectator.api.Gauge;
import io.kubernetes.client.openapi.models.V1Pod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically lists all pods, and reconciles them one by one. It runs independently of
 * {@link PodLifetimeEventController}, and calls {@link PodLifetimeReconciler} directly, outside of the event
 * controller work queue.
 */
@Singleton
public class PodLifetimeResyncController {

    private static final Logger logger = LoggerFactory.getLogger(PodLifetimeResyncController.class);

    public static final String RESYNC_CONTROLLER = "podLifetimeResyncController";
    public static final String RESYNC_CONTROLLER_DESCRIPTION = "Periodically re-evaluates all pods, and deletes the ones with an expired lifetime.";

    private final PodLifetimeRuntime runtime;
    private final KubeApiFacade kubeApiFacade;
    private final PodLifetimeReconciler reconciler;
    private final ControllerConfiguration controllerConfiguration;

    private final String metricRoot;
    private final Gauge totalGauge;
    private final Gauge deletedGauge;
    private final Gauge failuresGauge;
    private final Counter listFailureCounter;

    private ExecutorService executorService;
    private ScheduleReference schedulerRef;

    private final AtomicReference<ResyncState> state = new AtomicReference<>(ResyncState.Idle);

    @Inject
    public PodLifetimeResyncController(PodLifetimeRuntime runtime,
                                       KubeApiFacade kubeApiFacade,
                                       PodLifetimeReconciler reconciler,
                                       @Named(RESYNC_CONTROLLER) ControllerConfiguration controllerConfiguration) {
        this.runtime = runtime;
        this.kubeApiFacade = kubeApiFacade;
        this.reconciler = reconciler;
        this.controllerConfiguration = controllerConfiguration;

        this.metricRoot = MetricConstants.METRIC_KUBERNETES_CONTROLLER + RESYNC_CONTROLLER;
        this.totalGauge = runtime.getRegistry().gauge(metricRoot, "type", "total");
        this.deletedGauge = runtime.getRegistry().gauge(metricRoot, "type", "deleted");
        this.failuresGauge = runtime.getRegistry().gauge(metricRoot, "type", "failures");
        this.listFailureCounter = runtime.getRegistry().counter(metricRoot + ".listFailures");
    }

    public void start() {
        ScheduleDescriptor scheduleDescriptor = ScheduleDescriptor.newBuilder()
                .withName(RESYNC_CONTROLLER)
                .withDescription(RESYNC_CONTROLLER_DESCRIPTION)
                .withInitialDelay(Duration.ofMillis(controllerConfiguration.getControllerInitialDelayMs()))
                .withInterval(Duration.ofMillis(controllerConfiguration.getControllerIntervalMs()))
                .withTimeout(Duration.ofMillis(controllerConfiguration.getControllerTimeoutMs()))
                .build();

        executorService = ExecutorsExt.namedSingleThreadExecutor(RESYNC_CONTROLLER);
        schedulerRef = runtime.getLocalScheduler().schedule(scheduleDescriptor, this::doResync, executorService);
        logger.info("Started {} (interval={}ms)", RESYNC_CONTROLLER, controllerConfiguration.getControllerIntervalMs());
    }

    @PreDestroy
    public void shutdown() {
        state.set(ResyncState.Stopped);
        Evaluators.acceptNotNull(schedulerRef, ScheduleReference::cancel);
        Evaluators.acceptNotNull(executorService, ExecutorService::shutdown);
        resetGauges();
    }

    public ResyncState getState() {
        return state.get();
    }

    public String getMetricRoot() {
        return metricRoot;
    }

    @VisibleForTesting
    void doResync(ExecutionContext context) {
        if (state.get() == ResyncState.Stopped) {
            return;
        }
        if (!controllerConfiguration.isControllerEnabled()) {
            logger.info("Skipping resync execution for: {}", RESYNC_CONTROLLER);
            resetGauges();
            return;
        }

        transitionTo(ResyncState.Listing);
        List<V1Pod> pods;
        try {
            pods = kubeApiFacade.listPods();
        } catch (Exception e) {
            logger.error("Failed to list pods, skipping resync iteration:", e);
            listFailureCounter.increment();
            transitionTo(ResyncState.Idle);
            return;
        }

        transitionTo(ResyncState.Reconciling);
        int total = pods.size();
        int processed = 0;
        int deleted = 0;
        int failures = 0;
        for (V1Pod pod : pods) {
            if (context.isCancelled() || state.get() == ResyncState.Stopped) {
                logger.info("Resync iteration cancelled after processing {} of {} pods", processed, total);
                break;
            }
            String namespace = KubeUtil.getMetadataNamespace(pod.getMetadata());
            String name = KubeUtil.getMetadataName(pod.getMetadata());
            try {
                if (reconciler.reconcile(namespace, name) == ReconcileOutcome.DELETED) {
                    deleted++;
                }
            } catch (Exception e) {
                failures++;
                logger.error("Failed to reconcile pod: {}/{} due to:", namespace, name, e);
            }
            processed++;
        }

        setGauges(total, deleted, failures);
        transitionTo(context.isCancelled() ? ResyncState.Stopped : ResyncState.Idle);
        logger.info("Finished resync iteration total: {}, processed: {}, deleted: {}, failures: {}", total, processed, deleted, failures);
    }

    private void transitionTo(ResyncState next) {
        state.getAndUpdate(current -> current == ResyncState.Stopped ? current : next);
    }

    private void setGauges(int total, int deleted, int failures) {
        totalGauge.set(total);
        deletedGauge.set(deleted);
        failuresGauge.set(failures);
    }

    private void resetGauges() {
        setGauges(0, 0, 0);
    }
}
