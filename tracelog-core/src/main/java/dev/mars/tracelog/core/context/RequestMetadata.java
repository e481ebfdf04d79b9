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
package dev.mars.tracelog.core.context;

import dev.mars.tracelog.api.record.RecordFields;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only description of the inbound request a log context belongs to.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-16
 * @version 1.0
 */
public final class RequestMetadata {

    private static final RequestMetadata EMPTY = new RequestMetadata("", "", Collections.emptyMap(), "");

    private final String method;
    private final String path;
    private final Map<String, List<String>> headers;
    private final String prevSpanId;

    private RequestMetadata(String method, String path, Map<String, List<String>> headers, String prevSpanId) {
        this.method = method == null ? "" : method;
        this.path = path == null ? "" : path;
        this.headers = headers == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.prevSpanId = prevSpanId == null ? "" : prevSpanId;
    }

    public static RequestMetadata of(String method, String path, Map<String, List<String>> headers, String prevSpanId) {
        return new RequestMetadata(method, path, headers, prevSpanId);
    }

    public static RequestMetadata of(String method, String path) {
        return new RequestMetadata(method, path, null, null);
    }

    public static RequestMetadata empty() {
        return EMPTY;
    }

    public RequestMetadata withHeaders(Map<String, List<String>> headers) {
        return new RequestMetadata(method, path, headers, prevSpanId);
    }

    public RequestMetadata withPrevSpanId(String prevSpanId) {
        return new RequestMetadata(method, path, headers, prevSpanId);
    }

    public String getMethod() { return method; }
    public String getPath() { return path; }
    public Map<String, List<String>> getHeaders() { return headers; }
    public String getPrevSpanId() { return prevSpanId; }

    public boolean hasPrevSpanId() {
        return !prevSpanId.isEmpty();
    }

    /**
     * @return the value logged under the {@code request} field
     */
    public Map<String, Object> toFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("method", method);
        fields.put("path", path);
        if (hasPrevSpanId()) {
            fields.put(RecordFields.PREV_SPAN_ID, prevSpanId);
        }
        fields.put("headers", headers);
        return fields;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RequestMetadata)) return false;
        RequestMetadata that = (RequestMetadata) o;
        return method.equals(that.method) && path.equals(that.path)
                && headers.equals(that.headers) && prevSpanId.equals(that.prevSpanId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(method, path, headers, prevSpanId);
    }

    @Override
    public String toString() {
        return method + " " + path + " prev_span_id: " + prevSpanId + " headers: " + headers;
    }
}
