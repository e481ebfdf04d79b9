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

import dev.mars.tracelog.api.LogLevel;
import dev.mars.tracelog.api.propagation.HeaderSetter;

import java.util.Collections;
import java.util.Map;

/**
 * Inert {@link LogContext}: emits nothing, stores nothing and propagates nothing.
 */
final class NoopLogContext implements LogContext {

    static final NoopLogContext INSTANCE = new NoopLogContext();

    private NoopLogContext() {
    }

    @Override
    public String traceId() {
        return "";
    }

    @Override
    public String spanId() {
        return "";
    }

    @Override
    public String prevSpanId() {
        return "";
    }

    @Override
    public RequestMetadata request() {
        return RequestMetadata.empty();
    }

    @Override
    public Map<String, Object> contextValues() {
        return Collections.emptyMap();
    }

    @Override
    public boolean isActive() {
        return false;
    }

    @Override
    public void addContext(String key, Object value) {
    }

    @Override
    public void setContext(String key, Object value) {
    }

    @Override
    public void propagateTo(HeaderSetter outbound) {
    }

    @Override
    public LogContext child() {
        return this;
    }

    @Override
    public void emit(LogLevel level, String message, Map<String, ?> details, Throwable error) {
    }

    @Override
    public void requestReceived() {
    }

    @Override
    public void requestComplete() {
    }

    @Override
    public String toString() {
        return "LogContext.noop()";
    }
}
