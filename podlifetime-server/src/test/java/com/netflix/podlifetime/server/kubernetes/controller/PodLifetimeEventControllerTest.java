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

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.netflix.podlifetime.common.runtime.PodLifetimeRuntime;
import com.netflix.podlifetime.common.runtime.PodLifetimeRuntimes;
import com.netflix.podlifetime.common.util.ExecutorsExt;
import com.netflix.podlifetime.runtime.connector.kubernetes.KubeApiException;
import com.netflix.podlifetime.runtime.connector.kubernetes.KubeApiFacade;
import io.kubernetes.client.informer.ResourceEventHandler;
import io.kubernetes.client.informer.SharedIndexInformer;
import io.kubernetes.client.openapi.models.V1Pod;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static com.netflix.podlifetime.server.kubernetes.controller.PodGenerator.NAMESPACE;
import static com.netflix.podlifetime.server.kubernetes.controller.PodGenerator.pod;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class PodLifetimeEventControllerTest {

    private static final long TIMEOUT_MS = 5_000;

    private final PodLifetimeRuntime runtime = PodLifetimeRuntimes.test();
    private final KubeApiFacade kubeApiFacade = mock(KubeApiFacade.class);
    private final PodLifetimeReconciler reconciler = mock(PodLifetimeReconciler.class);
    private final PodLifetimeControllerConfiguration configuration = mock(PodLifetimeControllerConfiguration.class);
    private final ScheduledExecutorService executor = ExecutorsExt.namedSingleThreadScheduledExecutor("testEventController");

    private PodLifetimeEventController controller;

    @BeforeEach
    void setUp() {
        when(configuration.getRetryInitialDelayMs()).thenReturn(1L);
        when(configuration.getRetryMaxDelayMs()).thenReturn(10L);
        when(reconciler.reconcile(anyString(), anyString())).thenReturn(ReconcileOutcome.NOT_EXPIRED);
        controller = new PodLifetimeEventController(kubeApiFacade, reconciler, configuration, runtime, executor);
    }

    @AfterEach
    void tearDown() {
        controller.shutdown();
    }

    /**
     * Informer add, update and delete notifications are turned into reconciliations of the affected pod.
     */
    @Test
    @SuppressWarnings("unchecked")
    void informerEventsTriggerReconciliation() {
        SharedIndexInformer<V1Pod> informer = mock(SharedIndexInformer.class);
        when(kubeApiFacade.getPodInformer()).thenReturn(informer);
        ArgumentCaptor<ResourceEventHandler<V1Pod>> handlerCaptor = ArgumentCaptor.forClass(ResourceEventHandler.class);

        controller.start();
        verify(informer).addEventHandler(handlerCaptor.capture());
        ResourceEventHandler<V1Pod> handler = handlerCaptor.getValue();

        handler.onAdd(pod("pod1").build());
        verify(reconciler, timeout(TIMEOUT_MS).times(1)).reconcile(NAMESPACE, "pod1");

        handler.onUpdate(pod("pod2").build(), pod("pod2").withLifetime("10").build());
        verify(reconciler, timeout(TIMEOUT_MS).times(1)).reconcile(NAMESPACE, "pod2");

        handler.onDelete(pod("pod3").build(), false);
        verify(reconciler, timeout(TIMEOUT_MS).times(1)).reconcile(NAMESPACE, "pod3");
    }

    /**
     * A pod key already waiting in the queue is not added again.
     */
    @Test
    void pendingKeysAreDeduplicated() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(reconciler.reconcile(NAMESPACE, "blocker")).thenAnswer(invocation -> {
            started.countDown();
            release.await(TIMEOUT_MS, TimeUnit.MILLISECONDS);
            return ReconcileOutcome.NOT_EXPIRED;
        });

        controller.enqueue(NAMESPACE + "/blocker");
        Assertions.assertThat(started.await(TIMEOUT_MS, TimeUnit.MILLISECONDS)).isTrue();

        controller.enqueue(NAMESPACE + "/pod1");
        controller.enqueue(NAMESPACE + "/pod1");
        controller.enqueue(NAMESPACE + "/pod1");
        Assertions.assertThat(controller.getPendingCount()).isEqualTo(1);

        release.countDown();
        verify(reconciler, timeout(TIMEOUT_MS).times(1)).reconcile(NAMESPACE, "pod1");
        verify(reconciler, after(100).times(1)).reconcile(NAMESPACE, "pod1");
    }

    /**
     * At most one reconciliation triggered by events runs at any time.
     */
    @Test
    void reconciliationsAreSerialized() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        AtomicInteger completed = new AtomicInteger();
        when(reconciler.reconcile(anyString(), anyString())).thenAnswer(invocation -> {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            Thread.sleep(2);
            inFlight.decrementAndGet();
            completed.incrementAndGet();
            return ReconcileOutcome.NOT_EXPIRED;
        });

        for (int i = 0; i < 20; i++) {
            controller.enqueue(NAMESPACE + "/pod" + i);
        }

        await().timeout(TIMEOUT_MS, TimeUnit.MILLISECONDS).until(() -> completed.get() == 20);
        Assertions.assertThat(maxInFlight.get()).isEqualTo(1);
    }

    /**
     * A failed reconciliation is retried until it succeeds.
     */
    @Test
    void failedReconciliationIsRetried() {
        when(reconciler.reconcile(NAMESPACE, "pod1"))
                .thenThrow(new KubeApiException("simulated error", new RuntimeException()))
                .thenThrow(new KubeApiException("simulated error", new RuntimeException()))
                .thenReturn(ReconcileOutcome.DELETED);

        controller.enqueue(NAMESPACE + "/pod1");

        verify(reconciler, timeout(TIMEOUT_MS).times(3)).reconcile(NAMESPACE, "pod1");
        verify(reconciler, after(100).times(3)).reconcile(NAMESPACE, "pod1");
        Assertions.assertThat(runtime.getRegistry().counter("podlifetime.kubernetes.controller.podLifetimeEventController.retries").count())
                .isEqualTo(2);
    }

    /**
     * A failure of one pod does not block processing of other pods.
     */
    @Test
    void failureDoesNotStopWorker() {
        when(reconciler.reconcile(NAMESPACE, "bad")).thenThrow(new IllegalStateException("simulated error"));

        controller.enqueue(NAMESPACE + "/bad");
        controller.enqueue(NAMESPACE + "/good");

        verify(reconciler, timeout(TIMEOUT_MS)).reconcile(NAMESPACE, "good");
    }

    @Test
    void eventsAfterShutdownAreIgnored() {
        controller.shutdown();
        controller.enqueue(NAMESPACE + "/pod1");

        verify(reconciler, after(50).never()).reconcile(any(), eq("pod1"));
    }
}
