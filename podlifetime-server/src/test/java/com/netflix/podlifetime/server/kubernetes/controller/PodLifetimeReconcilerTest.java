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
import java.util.Collections;
import java.util.Optional;

import com.netflix.podlifetime.common.runtime.PodLifetimeRuntime;
import com.netflix.podlifetime.common.runtime.PodLifetimeRuntimes;
import com.netflix.podlifetime.common.util.time.Clocks;
import com.netflix.podlifetime.common.util.time.TestClock;
import com.netflix.podlifetime.runtime.connector.kubernetes.KubeApiException;
import com.netflix.podlifetime.runtime.connector.kubernetes.KubeApiFacade;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.models.V1Pod;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

import static com.netflix.podlifetime.server.kubernetes.controller.PodGenerator.NAMESPACE;
import static com.netflix.podlifetime.server.kubernetes.controller.PodGenerator.pod;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class PodLifetimeReconcilerTest {

    private static final String POD_NAME = "pod-name";

    private final TestClock clock = Clocks.test();
    private final PodLifetimeRuntime runtime = PodLifetimeRuntimes.test(clock);
    private final KubeApiFacade kubeApiFacade = mock(KubeApiFacade.class);

    private final PodLifetimeReconciler reconciler = new PodLifetimeReconciler(kubeApiFacade, runtime);

    /**
     * Lifetime of 10 seconds, and the only container started 15 seconds ago. The pod must be deleted.
     */
    @Test
    void expiredPodIsDeleted() {
        givenPod(pod(POD_NAME).withLifetime("10").withRunningContainer(clock.wallTime() - 15_000).build());

        Assertions.assertThat(reconciler.reconcile(NAMESPACE, POD_NAME)).isEqualTo(ReconcileOutcome.DELETED);
        verify(kubeApiFacade, times(1)).deleteNamespacedPod(NAMESPACE, POD_NAME);
        Assertions.assertThat(outcomeCount(ReconcileOutcome.DELETED)).isEqualTo(1);
    }

    /**
     * Lifetime of 10 seconds, and the only container started 5 seconds ago. The pod must be left running.
     */
    @Test
    void unexpiredPodIsNotDeleted() {
        givenPod(pod(POD_NAME).withLifetime("10").withRunningContainer(clock.wallTime() - 5_000).build());

        Assertions.assertThat(reconciler.reconcile(NAMESPACE, POD_NAME)).isEqualTo(ReconcileOutcome.NOT_EXPIRED);
        verify(kubeApiFacade, never()).deleteNamespacedPod(anyString(), anyString());
    }

    /**
     * At exactly start + lifetime the pod is not expired yet. It is one millisecond later.
     */
    @Test
    void expiryBoundaryIsExclusive() {
        long startTime = clock.wallTime();
        givenPod(pod(POD_NAME).withLifetime("10").withRunningContainer(startTime).build());

        clock.advanceTime(Duration.ofSeconds(10));
        Assertions.assertThat(reconciler.reconcile(NAMESPACE, POD_NAME)).isEqualTo(ReconcileOutcome.NOT_EXPIRED);
        verify(kubeApiFacade, never()).deleteNamespacedPod(anyString(), anyString());

        clock.advanceTime(Duration.ofMillis(1));
        Assertions.assertThat(reconciler.reconcile(NAMESPACE, POD_NAME)).isEqualTo(ReconcileOutcome.DELETED);
        verify(kubeApiFacade, times(1)).deleteNamespacedPod(NAMESPACE, POD_NAME);
    }

    /**
     * A zero lifetime expires the pod as soon as any time passes after its latest container start.
     */
    @Test
    void zeroLifetime() {
        givenPod(pod(POD_NAME).withLifetime("0").withRunningContainer(clock.wallTime() - 1).build());

        Assertions.assertThat(reconciler.reconcile(NAMESPACE, POD_NAME)).isEqualTo(ReconcileOutcome.DELETED);
    }

    /**
     * A pod without the lifetime label is never deleted, no matter how old.
     */
    @Test
    void podWithoutLifetimeLabelIsExempt() {
        givenPod(pod(POD_NAME).withLabel("app", "web").withRunningContainer(clock.wallTime() - 3_600_000).build());

        Assertions.assertThat(reconciler.reconcile(NAMESPACE, POD_NAME)).isEqualTo(ReconcileOutcome.EXEMPT);
        verify(kubeApiFacade, never()).deleteNamespacedPod(anyString(), anyString());
    }

    /**
     * A malformed lifetime value is reported, and the pod is left untouched.
     */
    @Test
    void invalidLifetimeIsReportedAndPodNotDeleted() {
        givenPod(pod(POD_NAME).withLifetime("abc").withRunningContainer(clock.wallTime() - 3_600_000).build());

        Assertions.assertThat(reconciler.reconcile(NAMESPACE, POD_NAME)).isEqualTo(ReconcileOutcome.INVALID_LIFETIME);
        verify(kubeApiFacade, never()).deleteNamespacedPod(anyString(), anyString());
        Assertions.assertThat(runtime.getRegistry().counter("podlifetime.reconciler.invalidLifetime").count()).isEqualTo(1);
    }

    /**
     * Negative and fractional values are malformed too.
     */
    @Test
    void negativeAndFractionalLifetimesAreInvalid() {
        givenPod(pod(POD_NAME).withLifetime("-10").withRunningContainer(clock.wallTime() - 3_600_000).build());
        Assertions.assertThat(reconciler.reconcile(NAMESPACE, POD_NAME)).isEqualTo(ReconcileOutcome.INVALID_LIFETIME);

        givenPod(pod(POD_NAME).withLifetime("1.5").withRunningContainer(clock.wallTime() - 3_600_000).build());
        Assertions.assertThat(reconciler.reconcile(NAMESPACE, POD_NAME)).isEqualTo(ReconcileOutcome.INVALID_LIFETIME);

        verify(kubeApiFacade, never()).deleteNamespacedPod(anyString(), anyString());
    }

    /**
     * A pod with no running container is never deleted.
     */
    @Test
    void podWithoutRunningContainersIsNotDeleted() {
        givenPod(pod(POD_NAME).withLifetime("10").withTerminatedContainer(clock.wallTime() - 60_000, clock.wallTime() - 30_000).build());
        Assertions.assertThat(reconciler.reconcile(NAMESPACE, POD_NAME)).isEqualTo(ReconcileOutcome.NOT_RUNNING);

        givenPod(pod(POD_NAME).withLifetime("10").build());
        Assertions.assertThat(reconciler.reconcile(NAMESPACE, POD_NAME)).isEqualTo(ReconcileOutcome.NOT_RUNNING);

        verify(kubeApiFacade, never()).deleteNamespacedPod(anyString(), anyString());
    }

    /**
     * A pod that does not exist is a successful no-op.
     */
    @Test
    void absentPodIsNoOp() {
        when(kubeApiFacade.findPod(NAMESPACE, POD_NAME)).thenReturn(Optional.empty());

        Assertions.assertThat(reconciler.reconcile(NAMESPACE, POD_NAME)).isEqualTo(ReconcileOutcome.NOT_FOUND);
        verify(kubeApiFacade, never()).deleteNamespacedPod(anyString(), anyString());
    }

    /**
     * With two running containers started at T1 < T2, the pod behaves as a single container pod started at T2.
     */
    @Test
    void latestStartedContainerGovernsExpiry() {
        long now = clock.wallTime();
        givenPod(pod(POD_NAME).withLifetime("10")
                .withRunningContainer(now - 60_000)
                .withRunningContainer(now - 5_000)
                .build()
        );
        Assertions.assertThat(reconciler.reconcile(NAMESPACE, POD_NAME)).isEqualTo(ReconcileOutcome.NOT_EXPIRED);

        givenPod(pod(POD_NAME).withLifetime("10").withRunningContainer(now - 5_000).build());
        Assertions.assertThat(reconciler.reconcile(NAMESPACE, POD_NAME)).isEqualTo(ReconcileOutcome.NOT_EXPIRED);

        clock.advanceTime(Duration.ofSeconds(6));
        givenPod(pod(POD_NAME).withLifetime("10")
                .withRunningContainer(now - 60_000)
                .withRunningContainer(now - 5_000)
                .build()
        );
        Assertions.assertThat(reconciler.reconcile(NAMESPACE, POD_NAME)).isEqualTo(ReconcileOutcome.DELETED);
        verify(kubeApiFacade, times(1)).deleteNamespacedPod(NAMESPACE, POD_NAME);
    }

    /**
     * Reconciling twice an expired pod: the first call deletes it, the second one finds it gone. Only one
     * delete request reaches the API server.
     */
    @Test
    void reconciliationIsIdempotent() {
        V1Pod pod = pod(POD_NAME).withLifetime("10").withRunningContainer(clock.wallTime() - 15_000).build();
        when(kubeApiFacade.findPod(NAMESPACE, POD_NAME)).thenReturn(Optional.of(pod), Optional.empty());

        Assertions.assertThat(reconciler.reconcile(NAMESPACE, POD_NAME)).isEqualTo(ReconcileOutcome.DELETED);
        Assertions.assertThat(reconciler.reconcile(NAMESPACE, POD_NAME)).isEqualTo(ReconcileOutcome.NOT_FOUND);
        verify(kubeApiFacade, times(1)).deleteNamespacedPod(NAMESPACE, POD_NAME);
    }

    /**
     * The pod disappears between the read and the delete request. This is a success.
     */
    @Test
    void deleteOfAlreadyRemovedPodSucceeds() {
        givenPod(pod(POD_NAME).withLifetime("10").withRunningContainer(clock.wallTime() - 15_000).build());
        doThrow(new KubeApiException(new ApiException(404, Collections.emptyMap(), "{}")))
                .when(kubeApiFacade).deleteNamespacedPod(NAMESPACE, POD_NAME);

        Assertions.assertThat(reconciler.reconcile(NAMESPACE, POD_NAME)).isEqualTo(ReconcileOutcome.ALREADY_DELETED);
    }

    /**
     * Any other delete error is propagated to the caller.
     */
    @Test
    void deleteErrorIsPropagated() {
        givenPod(pod(POD_NAME).withLifetime("10").withRunningContainer(clock.wallTime() - 15_000).build());
        doThrow(new KubeApiException(new ApiException("Internal Server Error", 500, Collections.emptyMap(), "{}")))
                .when(kubeApiFacade).deleteNamespacedPod(NAMESPACE, POD_NAME);

        assertThatThrownBy(() -> reconciler.reconcile(NAMESPACE, POD_NAME))
                .isInstanceOf(KubeApiException.class)
                .satisfies(e -> Assertions.assertThat(((KubeApiException) e).getErrorCode()).isEqualTo(KubeApiException.ErrorCode.INTERNAL));
        Assertions.assertThat(runtime.getRegistry().counter(runtime.getRegistry().createId("podlifetime.reconciler.outcome")
                .withTag("outcome", "FAILED")
                .withTag("error", "KubeApiException")
        ).count()).isEqualTo(1);
    }

    /**
     * A lifetime too large to represent never expires.
     */
    @Test
    void hugeLifetimeNeverExpires() {
        givenPod(pod(POD_NAME).withLifetime(String.valueOf(Long.MAX_VALUE)).withRunningContainer(clock.wallTime() - 15_000).build());

        Assertions.assertThat(reconciler.reconcile(NAMESPACE, POD_NAME)).isEqualTo(ReconcileOutcome.NOT_EXPIRED);
    }

    private void givenPod(V1Pod pod) {
        when(kubeApiFacade.findPod(NAMESPACE, pod.getMetadata().getName())).thenReturn(Optional.of(pod));
    }

    private long outcomeCount(ReconcileOutcome outcome) {
        return runtime.getRegistry().counter(runtime.getRegistry().createId("podlifetime.reconciler.outcome").withTag("outcome", outcome.name())).count();
    }
}
