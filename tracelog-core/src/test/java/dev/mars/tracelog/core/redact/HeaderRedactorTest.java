package dev.mars.tracelog.core.redact;

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

import dev.mars.tracelog.core.config.LoggerConfiguration;
import dev.mars.tracelog.test.categories.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
@DisplayName("Header Redactor Tests")
class HeaderRedactorTest {

    private final HeaderRedactor redactor = HeaderRedactor.from(LoggerConfiguration.builder("svc").build());

    @Test
    @DisplayName("Sensitive headers keep their name with the marker as the only value")
    void testRedactsSensitiveHeaders() {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        headers.put("authorization", List.of("Bearer secret"));
        headers.put("CSRF", List.of("token-1", "token-2"));
        headers.put("Accept", List.of("application/json"));

        Map<String, List<String>> redacted = redactor.redact(headers);

        assertEquals(List.of("---"), redacted.get("authorization"));
        assertEquals(List.of("---"), redacted.get("CSRF"));
        assertEquals(List.of("application/json"), redacted.get("Accept"));
        assertEquals(List.of("authorization", "CSRF", "Accept"), List.copyOf(redacted.keySet()));
    }

    @Test
    @DisplayName("Header values containing null are copied without failing")
    void testNullHeaderValue() {
        List<String> values = new ArrayList<>();
        values.add("gzip");
        values.add(null);
        Map<String, List<String>> headers = new LinkedHashMap<>();
        headers.put("Accept-Encoding", values);

        Map<String, List<String>> redacted = redactor.redact(headers);

        assertEquals(Arrays.asList("gzip", null), redacted.get("Accept-Encoding"));
        assertThrows(UnsupportedOperationException.class, () -> redacted.get("Accept-Encoding").add("br"));
    }

    @Test
    @DisplayName("Input map is not modified")
    void testInputUntouched() {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        headers.put("Authorization", List.of("Bearer secret"));

        redactor.redact(headers);

        assertEquals(List.of("Bearer secret"), headers.get("Authorization"));
    }

    @Test
    @DisplayName("Absent headers redact to an empty map")
    void testNullHeaders() {
        assertTrue(redactor.redact(null).isEmpty());
        assertFalse(redactor.isSensitive(null));
    }

    @Test
    @DisplayName("Custom marker is used")
    void testCustomMarker() {
        HeaderRedactor custom = new HeaderRedactor(List.of("X-Api-Key"), "***");

        assertEquals(List.of("***"), custom.redact(Map.of("x-api-key", List.of("k"))).get("x-api-key"));
        assertFalse(custom.isSensitive("Authorization"));
    }
}
