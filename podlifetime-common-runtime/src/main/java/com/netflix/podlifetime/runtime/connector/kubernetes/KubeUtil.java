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

import com.google.common.base.Strings;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1Pod;

public final class KubeUtil {

    private KubeUtil() {
    }

    /**
     * Get Kube object name
     */
    public static String getMetadataName(V1ObjectMeta metadata) {
        if (metadata == null) {
            return "";
        }

        return metadata.getName();
    }

    /**
     * Get Kube object namespace
     */
    public static String getMetadataNamespace(V1ObjectMeta metadata) {
        if (metadata == null) {
            return "";
        }

        return Strings.nullToEmpty(metadata.getNamespace());
    }

    /**
     * Cache key of a pod, in the same format as used by the informer indexer (namespace/name).
     */
    public static String toPodKey(String namespace, String name) {
        return Strings.isNullOrEmpty(namespace) ? name : namespace + '/' + name;
    }

    public static String toPodKey(V1Pod pod) {
        return toPodKey(getMetadataNamespace(pod.getMetadata()), getMetadataName(pod.getMetadata()));
    }

    /**
     * Splits a pod key into its namespace and name parts. A key without a namespace part yields an empty namespace.
     */
    public static String[] splitPodKey(String key) {
        int idx = key.indexOf('/');
        if (idx < 0) {
            return new String[]{"", key};
        }
        return new String[]{key.substring(0, idx), key.substring(idx + 1)};
    }
}
