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
package dev.mars.tracelog.core.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.tracelog.api.record.LogRecord;
import dev.mars.tracelog.api.record.RecordFields;

/**
 * Renders records as one JSON object per line:
 * <pre>{@code
 * {"timestamp":"2026-01-16T10:15:30Z","level":"info","message":"Request Complete",
 *  "service_name":"orders","trace_id":"...","span_id":"...","function_name":"...","context":{...}}
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-17
 * @version 1.0
 */
public class JsonRecordFormatter implements RecordFormatter {

    private final ObjectMapper objectMapper;

    public JsonRecordFormatter() {
        this(RecordValues.createObjectMapper());
    }

    public JsonRecordFormatter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String format(LogRecord record) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put(RecordFields.TIMESTAMP, record.timestamp().toString());
        node.put(RecordFields.LEVEL, record.level().label());
        node.put(RecordFields.MESSAGE, record.message());
        record.fields().forEach((name, value) -> node.set(name, RecordValues.toTree(objectMapper, value)));
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to format log record: " + record.message(), e);
        }
    }
}
