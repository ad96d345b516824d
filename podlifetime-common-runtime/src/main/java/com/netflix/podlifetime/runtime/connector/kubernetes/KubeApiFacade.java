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

package com.netflix.podlifetime.runtime.connector.kubernetes;

import java.util.List;
import java.util.Optional;

import io.kubernetes.client.informer.SharedIndexInformer;
import io.kubernetes.client.openapi.models.V1Pod;

/**
 * {@link KubeApiFacade} encapsulates Kube Java, except the entity model and the informer API. The latter is
 * provided as a set of interfaces (unlike ApiClient or CoreV1Api), so it is easy to mock in the test code.
 * <p>
 * Reads are served from the shared pod informer cache. Writes go directly to the API server.
 */
public interface KubeApiFacade {

    /**
     * Returns the current observed state of a pod, or {@link Optional#empty()} if it does not exist.
     */
    Optional<V1Pod> findPod(String namespace, String name);

    /**
     * Returns a snapshot of all pods in the watched scope.
     *
     * @throws KubeApiException if the pod informer has not completed its initial synchronization
     */
    List<V1Pod> listPods() throws KubeApiException;

    /**
     * Requests pod deletion. A pod that does not exist is reported as {@link KubeApiException.ErrorCode#NOT_FOUND}.
     */
    void deleteNamespacedPod(String namespace, String podName) throws KubeApiException;

    SharedIndexInformer<V1Pod> getPodInformer();

    /**
     * Starts all informers created so far. Event handlers should be registered before this call, to
     * observe the initial list of pods.
     */
    void startInformers();

    /**
     * Returns true, if the pod informer completed its initial synchronization.
     */
    boolean isPodInformerSynced();

    /**
     * Stops all informers. The facade cannot be used afterwards.
     */
    void shutdown();
}
