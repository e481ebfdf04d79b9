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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.tracelog.api.record.LogRecord;
import dev.mars.tracelog.api.record.RecordFields;

/**
 * Renders records as space separated {@code key=value} pairs. Scalar values are written bare
 * unless they contain whitespace, quotes or {@code =}; nested values are written as quoted JSON.
 * Line breaks and tabs inside quoted values are escaped so every record stays on one line.
 * <pre>
 * timestamp=2026-01-16T10:15:30Z level=info message="Request Received" service_name=orders ...
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-17
 * @version 1.0
 */
public class TextRecordFormatter implements RecordFormatter {

    private final ObjectMapper objectMapper;

    public TextRecordFormatter() {
        this(RecordValues.createObjectMapper());
    }

    public TextRecordFormatter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String format(LogRecord record) {
        StringBuilder line = new StringBuilder();
        append(line, RecordFields.TIMESTAMP, record.timestamp().toString());
        append(line, RecordFields.LEVEL, record.level().label());
        append(line, RecordFields.MESSAGE, record.message());
        record.fields().forEach((name, value) -> append(line, name, render(value)));
        return line.toString();
    }

    private String render(Object value) {
        JsonNode node = RecordValues.toTree(objectMapper, value);
        if (node.isValueNode()) {
            return node.isNull() ? "" : node.asText();
        }
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to format log record field", e);
        }
    }

    private static void append(StringBuilder line, String key, String value) {
        if (line.length() > 0) {
            line.append(' ');
        }
        line.append(key).append('=');
        if (needsQuoting(value)) {
            line.append('"').append(escape(value)).append('"');
        } else {
            line.append(value);
        }
    }

    private static String escape(String value) {
        StringBuilder escaped = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\':
                    escaped.append("\\\\");
                    break;
                case '"':
                    escaped.append("\\\"");
                    break;
                case '\n':
                    escaped.append("\\n");
                    break;
                case '\r':
                    escaped.append("\\r");
                    break;
                case '\t':
                    escaped.append("\\t");
                    break;
                default:
                    escaped.append(c);
            }
        }
        return escaped.toString();
    }

    private static boolean needsQuoting(String value) {
        if (value.isEmpty()) {
            return true;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isWhitespace(c) || c == '"' || c == '=') {
                return true;
            }
        }
        return false;
    }
}
