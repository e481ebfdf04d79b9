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
package dev.mars.tracelog.core;

import dev.mars.tracelog.api.LogLevel;
import dev.mars.tracelog.api.caller.LoggingFacade;
import dev.mars.tracelog.api.propagation.HeaderSetter;
import dev.mars.tracelog.api.propagation.TraceHeaders;
import dev.mars.tracelog.api.record.RecordFields;
import dev.mars.tracelog.core.context.DuplicateContextKeyException;
import dev.mars.tracelog.core.context.LogContext;
import dev.mars.tracelog.core.context.RequestMetadata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link LogContext} bound to a {@link ServiceLogger}. Not thread-safe.
 */
@LoggingFacade
final class RequestLogContext implements LogContext {

    static final String REQUEST_RECEIVED = "Request Received";
    static final String REQUEST_COMPLETE = "Request Complete";

    private final ServiceLogger serviceLogger;
    private final String traceId;
    private final String spanId;
    private final RequestMetadata request;
    private final Map<String, Object> context = new LinkedHashMap<>();
    private boolean completed;

    RequestLogContext(ServiceLogger serviceLogger, String traceId, String spanId, RequestMetadata request) {
        this.serviceLogger = serviceLogger;
        this.traceId = traceId;
        this.spanId = spanId;
        this.request = request;
    }

    @Override
    public String traceId() {
        return traceId;
    }

    @Override
    public String spanId() {
        return spanId;
    }

    @Override
    public String prevSpanId() {
        return request.getPrevSpanId();
    }

    @Override
    public RequestMetadata request() {
        return request;
    }

    @Override
    public Map<String, Object> contextValues() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    @Override
    public boolean isActive() {
        return !completed;
    }

    @Override
    public void addContext(String key, Object value) {
        if (completed) {
            return;
        }
        Objects.requireNonNull(key, "key");
        if (context.containsKey(key)) {
            throw new DuplicateContextKeyException(key);
        }
        context.put(key, value);
    }

    @Override
    public void setContext(String key, Object value) {
        if (completed) {
            return;
        }
        Objects.requireNonNull(key, "key");
        context.put(key, value);
    }

    @Override
    public void propagateTo(HeaderSetter outbound) {
        outbound.setHeader(TraceHeaders.TRACE_ID, traceId);
        outbound.setHeader(TraceHeaders.SPAN_ID, spanId);
    }

    @Override
    public LogContext child() {
        return new RequestLogContext(serviceLogger, traceId, serviceLogger.newSpanId(),
                request.withPrevSpanId(spanId));
    }

    @Override
    public void emit(LogLevel level, String message, Map<String, ?> details, Throwable error) {
        if (completed || !serviceLogger.isEnabled(level)) {
            return;
        }
        Map<String, Object> fields = requestFields();
        if (details != null && !details.isEmpty()) {
            fields.put(RecordFields.DETAILS, new LinkedHashMap<>(details));
        }
        if (error != null) {
            fields.put(RecordFields.ERROR, error);
        }
        serviceLogger.dispatch(level, message, fields);
    }

    @Override
    public void requestReceived() {
        if (completed || !serviceLogger.isEnabled(LogLevel.INFO)) {
            return;
        }
        Map<String, Object> fields = requestFields();
        fields.put(RecordFields.REQUEST, request.toFields());
        serviceLogger.dispatch(LogLevel.INFO, REQUEST_RECEIVED, fields);
    }

    @Override
    public void requestComplete() {
        if (completed) {
            return;
        }
        completed = true;
        if (!serviceLogger.isEnabled(LogLevel.INFO)) {
            return;
        }
        Map<String, Object> fields = requestFields();
        fields.put(RecordFields.CONTEXT, new LinkedHashMap<>(context));
        fields.put(RecordFields.REQUEST, request.toFields());
        serviceLogger.dispatch(LogLevel.INFO, REQUEST_COMPLETE, fields);
    }

    private Map<String, Object> requestFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(RecordFields.TRACE_ID, traceId);
        fields.put(RecordFields.SPAN_ID, spanId);
        if (request.hasPrevSpanId()) {
            fields.put(RecordFields.PREV_SPAN_ID, request.getPrevSpanId());
        }
        fields.put(RecordFields.FUNCTION_NAME, serviceLogger.resolveCaller());
        return fields;
    }

    @Override
    public String toString() {
        return "RequestLogContext{traceId='" + traceId + "', spanId='" + spanId + "', completed=" + completed + "}";
    }
}
