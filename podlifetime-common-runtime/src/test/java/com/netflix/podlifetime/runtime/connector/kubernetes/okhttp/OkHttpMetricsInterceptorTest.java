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

package com.netflix.podlifetime.runtime.connector.kubernetes.okhttp;

import okhttp3.Request;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class OkHttpMetricsInterceptorTest {

    @Test
    void testUriTemplate() {
        assertThat(OkHttpMetricsInterceptor.toUriTemplate(request("https://kube:443/api/v1/namespaces/default/pods/pod1")))
                .isEqualTo("/api/v1/namespaces/{namespace}/pods/{name}");
        assertThat(OkHttpMetricsInterceptor.toUriTemplate(request("https://kube:443/api/v1/pods")))
                .isEqualTo("/api/v1/pods");
    }

    private static Request request(String url) {
        return new Request.Builder().url(url).build();
    }
}
