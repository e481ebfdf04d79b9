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
package dev.mars.tracelog.api.record;

/**
 * Field names used in structured records.
 */
public final class RecordFields {

    public static final String SERVICE_NAME = "service_name";
    public static final String TRACE_ID = "trace_id";
    public static final String SPAN_ID = "span_id";
    public static final String PREV_SPAN_ID = "prev_span_id";
    public static final String FUNCTION_NAME = "function_name";
    public static final String CONTEXT = "context";
    public static final String DETAILS = "details";
    public static final String ERROR = "error";
    public static final String REQUEST = "request";
    public static final String STATUS_CODE = "status_code";

    // Added by formatters
    public static final String TIMESTAMP = "timestamp";
    public static final String LEVEL = "level";
    public static final String MESSAGE = "message";

    private RecordFields() {
        // Constants class - prevent instantiation
    }
}
