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

import com.netflix.archaius.api.annotations.DefaultValue;

public interface KubeConnectorConfiguration {

    /**
     * Explicit API server URL. If not set, the kube config file or the in-cluster configuration is used.
     */
    String getKubeApiServerUrl();

    /**
     * Path to a kube config file. Used only if the API server URL is not set.
     */
    String getKubeConfigPath();

    /**
     * Namespace to watch. Empty value means all namespaces.
     */
    String getNamespace();

    /**
     * @return how often the pod informer re-delivers its full cache content
     */
    @DefaultValue("300000" /* 5 min */)
    long getInformerResyncIntervalMs();

    @DefaultValue("60000")
    long getReadTimeoutMs();

    /**
     * Grace period passed with a pod delete request. A negative value means the pod's own termination grace period.
     */
    @DefaultValue("-1")
    int getDeleteGracePeriodSeconds();
}
