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

package com.netflix.podlifetime.server;

import javax.inject.Named;
import javax.inject.Singleton;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.netflix.archaius.api.Config;
import com.netflix.podlifetime.common.runtime.PodLifetimeRuntime;
import com.netflix.podlifetime.common.runtime.internal.DefaultPodLifetimeRuntime;
import com.netflix.podlifetime.common.util.archaius2.Archaius2Ext;
import com.netflix.podlifetime.runtime.connector.kubernetes.DefaultKubeApiFacade;
import com.netflix.podlifetime.runtime.connector.kubernetes.KubeApiClients;
import com.netflix.podlifetime.runtime.connector.kubernetes.KubeApiFacade;
import com.netflix.podlifetime.runtime.connector.kubernetes.KubeConnectorConfiguration;
import com.netflix.podlifetime.server.kubernetes.controller.ControllerConfiguration;
import com.netflix.podlifetime.server.kubernetes.controller.PodLifetimeControllerConfiguration;
import com.netflix.spectator.api.DefaultRegistry;
import com.netflix.spectator.api.Registry;
import io.kubernetes.client.openapi.ApiClient;

import static com.netflix.podlifetime.server.kubernetes.controller.PodLifetimeResyncController.RESYNC_CONTROLLER;

public class PodLifetimeModule extends AbstractModule {

    public static final String KUBERNETES_CONFIG_PREFIX = "podlifetime.kubernetes";
    public static final String CONTROLLER_CONFIG_PREFIX = "podlifetime.controller";
    public static final String EVENT_CONTROLLER_CONFIG_PREFIX = "podlifetime.eventController";

    private final Config config;

    public PodLifetimeModule(Config config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        bind(Registry.class).toInstance(new DefaultRegistry());
        bind(PodLifetimeRuntime.class).to(DefaultPodLifetimeRuntime.class);
        bind(KubeApiFacade.class).to(DefaultKubeApiFacade.class);
    }

    @Provides
    @Singleton
    public KubeConnectorConfiguration getKubeConnectorConfiguration() {
        return Archaius2Ext.newConfiguration(KubeConnectorConfiguration.class, KUBERNETES_CONFIG_PREFIX, config);
    }

    @Provides
    @Singleton
    @Named(RESYNC_CONTROLLER)
    public ControllerConfiguration getResyncControllerConfiguration() {
        return Archaius2Ext.newConfiguration(ControllerConfiguration.class, CONTROLLER_CONFIG_PREFIX, config);
    }

    @Provides
    @Singleton
    public PodLifetimeControllerConfiguration getPodLifetimeControllerConfiguration() {
        return Archaius2Ext.newConfiguration(PodLifetimeControllerConfiguration.class, EVENT_CONTROLLER_CONFIG_PREFIX, config);
    }

    @Provides
    @Singleton
    public ApiClient getApiClient(KubeConnectorConfiguration configuration, PodLifetimeRuntime runtime) {
        return KubeApiClients.createApiClient(configuration, runtime);
    }

    @Provides
    @Singleton
    @Named(KubeApiClients.INFORMER_API_CLIENT)
    public ApiClient getInformerApiClient(KubeConnectorConfiguration configuration, PodLifetimeRuntime runtime) {
        return KubeApiClients.createInformerApiClient(configuration, runtime);
    }
}
