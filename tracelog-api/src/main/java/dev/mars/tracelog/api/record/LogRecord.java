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

import dev.mars.tracelog.api.LogLevel;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One structured log record, ready to be written by a {@link RecordSink}.
 *
 * @param timestamp When the record was produced
 * @param level     Severity of the record
 * @param message   Human-readable message
 * @param fields    Structured fields in insertion order (see {@link RecordFields})
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-14
 * @version 1.0
 */
public record LogRecord(Instant timestamp, LogLevel level, String message, Map<String, Object> fields) {

    public LogRecord {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(level, "level");
        message = message == null ? "" : message;
        fields = fields == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * @return the value of a field, or null if the record does not carry it
     */
    public Object field(String name) {
        return fields.get(name);
    }

    public boolean hasField(String name) {
        return fields.containsKey(name);
    }
}
