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

import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1Pod;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class KubeUtilTest {

    @Test
    void testPodKey() {
        V1Pod pod = new V1Pod().metadata(new V1ObjectMeta().namespace("default").name("pod1"));
        assertThat(KubeUtil.toPodKey(pod)).isEqualTo("default/pod1");
        assertThat(KubeUtil.toPodKey("", "pod1")).isEqualTo("pod1");
        assertThat(KubeUtil.toPodKey(null, "pod1")).isEqualTo("pod1");
    }

    @Test
    void testSplitPodKey() {
        assertThat(KubeUtil.splitPodKey("default/pod1")).containsExactly("default", "pod1");
        assertThat(KubeUtil.splitPodKey("pod1")).containsExactly("", "pod1");
    }

    @Test
    void testMissingMetadata() {
        assertThat(KubeUtil.getMetadataName(null)).isEmpty();
        assertThat(KubeUtil.getMetadataNamespace(null)).isEmpty();
        assertThat(KubeUtil.getMetadataNamespace(new V1ObjectMeta().name("pod1"))).isEmpty();
    }
}
