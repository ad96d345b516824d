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

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import com.netflix.podlifetime.common.util.time.Clock;
import com.netflix.spectator.api.Id;
import com.netflix.spectator.api.Registry;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records a request counter and a latency timer for each Kube API call, tagged with the HTTP method, the request
 * path template, and the response status (or the error type).
 */
public class OkHttpMetricsInterceptor implements Interceptor {

    private static final Logger logger = LoggerFactory.getLogger(OkHttpMetricsInterceptor.class);

    private final Registry registry;
    private final Clock clock;
    private final Function<Request, String> uriMapper;

    private final Id requestsId;
    private final Id latencyId;

    public OkHttpMetricsInterceptor(String metricNamePrefix, Registry registry, Clock clock, Function<Request, String> uriMapper) {
        this.registry = registry;
        this.clock = clock;
        this.uriMapper = uriMapper;
        this.requestsId = registry.createId(metricNamePrefix + "requests");
        this.latencyId = registry.createId(metricNamePrefix + "latency");
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();

        String method = request.method();
        String uri = getUri(request);

        long startTimeMs = clock.wallTime();
        try {
            Response response = chain.proceed(request);
            record(method, uri, "status", String.valueOf(response.code()), startTimeMs);
            return response;
        } catch (IOException | RuntimeException e) {
            record(method, uri, "error", e.getClass().getSimpleName(), startTimeMs);
            throw e;
        }
    }

    private void record(String method, String uri, String resultTag, String resultValue, long startTimeMs) {
        registry.counter(requestsId.withTag("method", method).withTag("uri", uri).withTag(resultTag, resultValue)).increment();
        registry.timer(latencyId.withTag("method", method).withTag("uri", uri).withTag(resultTag, resultValue))
                .record(clock.wallTime() - startTimeMs, TimeUnit.MILLISECONDS);
    }

    private String getUri(Request request) {
        try {
            return uriMapper.apply(request);
        } catch (Exception e) {
            logger.debug("Cannot map request URI: {}", request.url(), e);
        }
        return "unknown";
    }

    /**
     * Replaces namespace and object name path segments with placeholders, to keep the metric cardinality bounded.
     */
    public static String toUriTemplate(Request request) {
        List<String> segments = request.url().pathSegments();
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < segments.size(); i++) {
            String segment = segments.get(i);
            if (i > 0 && "namespaces".equals(segments.get(i - 1))) {
                segment = "{namespace}";
            } else if (i > 0 && "pods".equals(segments.get(i - 1))) {
                segment = "{name}";
            }
            sb.append('/').append(segment);
        }
        return sb.length() == 0 ? "/" : sb.toString();
    }
}
