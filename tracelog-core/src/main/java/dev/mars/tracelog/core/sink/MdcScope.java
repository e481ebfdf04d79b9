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
package dev.mars.tracelog.core.sink;

import org.slf4j.MDC;

/**
 * Places the trace and span ids in the SLF4J MDC and restores the previous values on close.
 *
 * <pre>{@code
 * try (MdcScope scope = MdcScope.open(traceId, spanId)) {
 *     logger.info(line);
 * }
 * }</pre>
 */
public final class MdcScope implements AutoCloseable {

    public static final String MDC_TRACE_ID = "traceId";
    public static final String MDC_SPAN_ID = "spanId";

    private final String previousTraceId;
    private final String previousSpanId;

    private MdcScope(String traceId, String spanId) {
        this.previousTraceId = MDC.get(MDC_TRACE_ID);
        this.previousSpanId = MDC.get(MDC_SPAN_ID);
        put(MDC_TRACE_ID, traceId);
        put(MDC_SPAN_ID, spanId);
    }

    /**
     * @param traceId the trace id, or null to leave the current value
     * @param spanId  the span id, or null to leave the current value
     */
    public static MdcScope open(String traceId, String spanId) {
        return new MdcScope(traceId, spanId);
    }

    @Override
    public void close() {
        restore(MDC_TRACE_ID, previousTraceId);
        restore(MDC_SPAN_ID, previousSpanId);
    }

    private static void put(String key, String value) {
        if (value != null && !value.isEmpty()) {
            MDC.put(key, value);
        }
    }

    private static void restore(String key, String previous) {
        if (previous == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, previous);
        }
    }
}
