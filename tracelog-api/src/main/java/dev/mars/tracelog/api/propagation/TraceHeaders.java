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
package dev.mars.tracelog.api.propagation;

/**
 * Header names carrying trace identity between services.
 * <p>
 * An inbound {@value #TRACE_ID} is reused verbatim for the whole call chain. An inbound
 * {@value #SPAN_ID} names the caller's span and becomes the receiver's previous span id; the
 * receiver always mints its own span id and sends that on outbound calls.
 * </p>
 */
public final class TraceHeaders {

    public static final String TRACE_ID = "trace-id";
    public static final String SPAN_ID = "span-id";

    private TraceHeaders() {
        // Constants class - prevent instantiation
    }
}
