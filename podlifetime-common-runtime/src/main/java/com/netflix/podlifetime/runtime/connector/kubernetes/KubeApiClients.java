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

import java.io.IOException;
import java.util.Collections;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Strings;
import com.netflix.podlifetime.common.runtime.PodLifetimeRuntime;
import com.netflix.podlifetime.common.util.ExecutorsExt;
import com.netflix.podlifetime.runtime.connector.kubernetes.okhttp.OkHttpMetricsInterceptor;
import io.kubernetes.client.informer.SharedInformerFactory;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.util.Config;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;

public final class KubeApiClients {

    /**
     * Name of the {@link ApiClient} binding used by the shared informers. Informer watches are long polls, and
     * {@link SharedInformerFactory} rejects a client with a non-zero read timeout.
     */
    public static final String INFORMER_API_CLIENT = "informerApiClient";

    private static final String METRICS_NAME_PREFIX = "podlifetime.kubeClient.";

    private KubeApiClients() {
    }

    public static ApiClient createApiClient(KubeConnectorConfiguration configuration, PodLifetimeRuntime runtime) {
        return createApiClient(
                configuration.getKubeApiServerUrl(),
                configuration.getKubeConfigPath(),
                runtime,
                configuration.getReadTimeoutMs()
        );
    }

    public static ApiClient createInformerApiClient(KubeConnectorConfiguration configuration, PodLifetimeRuntime runtime) {
        return createApiClient(
                configuration.getKubeApiServerUrl(),
                configuration.getKubeConfigPath(),
                runtime,
                0
        );
    }

    /**
     * Creates an {@link ApiClient}. A read timeout of zero disables it, which is what the informer client needs. If the API server URL is not set, the client is configured from the kube config
     * file, or if that one is not set either, with the default discovery (KUBECONFIG, ~/.kube/config, in-cluster).
     */
    public static ApiClient createApiClient(String kubeApiServerUrl,
                                            String kubeConfigPath,
                                            PodLifetimeRuntime runtime,
                                            long readTimeoutMs) {
        OkHttpMetricsInterceptor metricsInterceptor = new OkHttpMetricsInterceptor(
                METRICS_NAME_PREFIX,
                runtime.getRegistry(),
                runtime.getClock(),
                OkHttpMetricsInterceptor::toUriTemplate
        );

        ApiClient client;
        if (Strings.isNullOrEmpty(kubeApiServerUrl)) {
            try {
                if (Strings.isNullOrEmpty(kubeConfigPath)) {
                    client = Config.defaultClient();
                } else {
                    client = Config.fromConfig(kubeConfigPath);
                }
            } catch (IOException e) {
                throw new IllegalStateException("Cannot create Kube API client", e);
            }
        } else {
            client = Config.fromUrl(kubeApiServerUrl);
        }

        OkHttpClient.Builder newBuilder = client.getHttpClient().newBuilder();

        // See: https://github.com/kubernetes-client/java/pull/960
        newBuilder.protocols(Collections.singletonList(Protocol.HTTP_1_1))
                .addInterceptor(metricsInterceptor)
                .readTimeout(readTimeoutMs, TimeUnit.MILLISECONDS);

        client.setHttpClient(newBuilder.build());
        return client;
    }

    public static SharedInformerFactory createSharedInformerFactory(String threadNamePrefix, ApiClient apiClient, PodLifetimeRuntime runtime) {
        ExecutorService threadPool = ExecutorsExt.instrumentedCachedThreadPool(runtime.getRegistry(), threadNamePrefix);
        return new SharedInformerFactory(apiClient, threadPool);
    }
}
