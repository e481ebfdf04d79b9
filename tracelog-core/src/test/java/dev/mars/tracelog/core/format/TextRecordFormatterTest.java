package dev.mars.tracelog.core.format;

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

import dev.mars.tracelog.api.LogLevel;
import dev.mars.tracelog.api.record.LogRecord;
import dev.mars.tracelog.test.categories.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
@DisplayName("Text Record Formatter Tests")
class TextRecordFormatterTest {

    private final TextRecordFormatter formatter = new TextRecordFormatter();

    @Test
    @DisplayName("Scalars are bare unless they need quoting")
    void testScalars() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("service_name", "orders");
        fields.put("status_code", 404);
        fields.put("function_name", "");

        String line = formatter.format(new LogRecord(Instant.parse("2026-01-16T10:15:30Z"), LogLevel.WARN,
                "Request Received", fields));

        assertEquals("timestamp=2026-01-16T10:15:30Z level=warn message=\"Request Received\" "
                + "service_name=orders status_code=404 function_name=\"\"", line);
    }

    @Test
    @DisplayName("Nested values are written as quoted JSON")
    void testNestedValues() {
        String line = formatter.format(new LogRecord(Instant.parse("2026-01-16T10:15:30Z"), LogLevel.INFO, "m",
                Map.of("headers", Map.of("Accept", List.of("a=b")))));

        assertTrue(line.endsWith("headers=\"{\\\"Accept\\\":[\\\"a=b\\\"]}\""), line);
    }

    @Test
    @DisplayName("Line breaks and tabs are escaped so a record stays on one line")
    void testControlCharactersEscaped() {
        String line = formatter.format(new LogRecord(Instant.parse("2026-01-16T10:15:30Z"), LogLevel.INFO,
                "line one\nlevel=error message=forged", Map.of("input", "a\r\nb\tc")));

        assertEquals(1, line.lines().count(), line);
        assertEquals("timestamp=2026-01-16T10:15:30Z level=info message=\"line one\\nlevel=error message=forged\" "
                + "input=\"a\\r\\nb\\tc\"", line);
    }

    @Test
    @DisplayName("Errors are written as their description")
    void testErrors() {
        String line = formatter.format(new LogRecord(Instant.parse("2026-01-16T10:15:30Z"), LogLevel.ERROR, "m",
                Map.of("error", new IllegalArgumentException("bad input"))));

        assertTrue(line.endsWith("error=\"bad input\""), line);
    }
}
