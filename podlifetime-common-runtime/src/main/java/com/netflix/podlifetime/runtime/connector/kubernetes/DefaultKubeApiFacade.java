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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.annotation.PreDestroy;
import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Singleton;

import com.google.common.base.Strings;
import com.netflix.podlifetime.common.runtime.PodLifetimeRuntime;
import com.netflix.podlifetime.common.util.Evaluators;
import io.kubernetes.client.informer.SharedIndexInformer;
import io.kubernetes.client.informer.SharedInformerFactory;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.apis.CoreV1Api;
import io.kubernetes.client.openapi.models.V1Pod;
import io.kubernetes.client.openapi.models.V1PodList;
import io.kubernetes.client.util.CallGeneratorParams;
import okhttp3.Call;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.netflix.podlifetime.runtime.connector.kubernetes.KubeApiClients.INFORMER_API_CLIENT;
import static com.netflix.podlifetime.runtime.connector.kubernetes.KubeApiClients.createSharedInformerFactory;

@Singleton
public class DefaultKubeApiFacade implements KubeApiFacade {

    private static final Logger logger = LoggerFactory.getLogger(DefaultKubeApiFacade.class);

    public static final String BACKGROUND = "Background";

    private final KubeConnectorConfiguration configuration;

    private final ApiClient informerApiClient;
    private final CoreV1Api informerCoreV1Api;
    private final CoreV1Api coreV1Api;
    private final PodLifetimeRuntime runtime;

    private final Object activationLock = new Object();

    private volatile SharedInformerFactory sharedInformerFactory;
    private volatile SharedIndexInformer<V1Pod> podInformer;

    private KubeInformerMetrics<V1Pod> podInformerMetrics;

    private volatile boolean started;
    private volatile boolean deactivated;

    @Inject
    public DefaultKubeApiFacade(KubeConnectorConfiguration configuration,
                                @Named(INFORMER_API_CLIENT) ApiClient informerApiClient,
                                ApiClient apiClient,
                                PodLifetimeRuntime runtime) {
        this.configuration = configuration;
        this.informerApiClient = informerApiClient;
        this.informerCoreV1Api = new CoreV1Api(informerApiClient);
        this.coreV1Api = new CoreV1Api(apiClient);
        this.runtime = runtime;
    }

    @PreDestroy
    @Override
    public void shutdown() {
        synchronized (activationLock) {
            if (deactivated) {
                return;
            }
            this.deactivated = true;
            if (sharedInformerFactory != null) {
                sharedInformerFactory.stopAllRegisteredInformers();
            }
            Evaluators.acceptNotNull(podInformerMetrics, KubeInformerMetrics::shutdown);
        }
        logger.info("Kube informers stopped");
    }

    @Override
    public Optional<V1Pod> findPod(String namespace, String name) {
        activate();
        return Optional.ofNullable(podInformer.getIndexer().getByKey(KubeUtil.toPodKey(namespace, name)));
    }

    @Override
    public List<V1Pod> listPods() throws KubeApiException {
        activate();
        if (!podInformer.hasSynced()) {
            throw KubeApiException.informerNotSynced("pod");
        }
        return new ArrayList<>(podInformer.getIndexer().list());
    }

    @Override
    public void deleteNamespacedPod(String namespace, String podName) throws KubeApiException {
        int deleteGracePeriod = configuration.getDeleteGracePeriodSeconds();
        try {
            coreV1Api.deleteNamespacedPod(
                    podName,
                    namespace,
                    null,
                    null,
                    deleteGracePeriod < 0 ? null : deleteGracePeriod,
                    null,
                    BACKGROUND,
                    null
            );
        } catch (ApiException e) {
            throw new KubeApiException(e);
        }
    }

    @Override
    public SharedIndexInformer<V1Pod> getPodInformer() {
        activate();
        return podInformer;
    }

    @Override
    public void startInformers() {
        activate();
        synchronized (activationLock) {
            if (!started) {
                sharedInformerFactory.startAllRegisteredInformers();
                this.started = true;
                logger.info("Kube pod informer started (namespace={})", describeNamespace());
            }
        }
    }

    @Override
    public boolean isPodInformerSynced() {
        return podInformer != null && podInformer.hasSynced();
    }

    private void activate() {
        synchronized (activationLock) {
            if (deactivated) {
                throw new IllegalStateException("Deactivated");
            }

            if (sharedInformerFactory != null) {
                return;
            }

            try {
                this.sharedInformerFactory = createSharedInformerFactory(
                        "podlifetime-shared-informer-",
                        informerApiClient,
                        runtime
                );
                this.podInformer = createPodInformer(sharedInformerFactory);
                this.podInformerMetrics = new KubeInformerMetrics<>("pod", podInformer, runtime);

                logger.info("Kube pod informer created");
            } catch (Exception e) {
                logger.error("Could not initialize Kube client shared informer", e);
                sharedInformerFactory = null;
                podInformer = null;
                throw e;
            }
        }
    }

    private SharedIndexInformer<V1Pod> createPodInformer(SharedInformerFactory sharedInformerFactory) {
        return sharedInformerFactory.sharedIndexInformerFor(
                this::listPodsCall,
                V1Pod.class,
                V1PodList.class,
                configuration.getInformerResyncIntervalMs()
        );
    }

    private Call listPodsCall(CallGeneratorParams params) {
        String namespace = configuration.getNamespace();
        try {
            if (Strings.isNullOrEmpty(namespace)) {
                return informerCoreV1Api.listPodForAllNamespacesCall(
                        null,
                        null,
                        null,
                        null,
                        null,
                        null,
                        params.resourceVersion,
                        null,
                        params.timeoutSeconds,
                        params.watch,
                        null
                );
            }
            return informerCoreV1Api.listNamespacedPodCall(
                    namespace,
                    null,
                    null,
                    null,
                    null,
                    null,
                    null,
                    params.resourceVersion,
                    null,
                    params.timeoutSeconds,
                    params.watch,
                    null
            );
        } catch (ApiException e) {
            throw new IllegalStateException("listPodCall error", e);
        }
    }

    private String describeNamespace() {
        return Strings.isNullOrEmpty(configuration.getNamespace()) ? "<all>" : configuration.getNamespace();
    }
}
