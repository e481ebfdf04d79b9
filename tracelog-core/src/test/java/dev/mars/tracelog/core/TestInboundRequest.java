package dev.mars.tracelog.core;

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

import dev.mars.tracelog.api.propagation.InboundRequest;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal {@link InboundRequest} for tests.
 */
class TestInboundRequest implements InboundRequest {

    private final String method;
    private final String path;
    private final Map<String, List<String>> headers = new LinkedHashMap<>();

    TestInboundRequest(String method, String path) {
        this.method = method;
        this.path = path;
    }

    TestInboundRequest header(String name, String... values) {
        headers.put(name, List.of(values));
        return this;
    }

    @Override
    public String method() {
        return method;
    }

    @Override
    public String path() {
        return path;
    }

    @Override
    public Map<String, List<String>> headers() {
        return headers;
    }
}
