/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
package dev.mars.tracelog.vertx;

import dev.mars.tracelog.api.propagation.InboundRequest;
import io.vertx.core.MultiMap;
import io.vertx.core.http.HttpServerRequest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link InboundRequest} view of a Vert.x {@link HttpServerRequest}.
 */
public final class VertxInboundRequest implements InboundRequest {

    private final HttpServerRequest request;

    public VertxInboundRequest(HttpServerRequest request) {
        this.request = Objects.requireNonNull(request, "request");
    }

    @Override
    public String method() {
        return request.method() == null ? "" : request.method().name();
    }

    @Override
    public String path() {
        return request.path();
    }

    @Override
    public Map<String, List<String>> headers() {
        MultiMap headers = request.headers();
        if (headers == null) {
            return Collections.emptyMap();
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        for (String name : headers.names()) {
            copy.put(name, headers.getAll(name));
        }
        return copy;
    }

    @Override
    public String header(String name) {
        return request.getHeader(name);
    }
}
