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
package dev.mars.tracelog.core.redact;

import dev.mars.tracelog.core.config.LoggerConfiguration;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Replaces the values of sensitive headers with a fixed marker before they are logged.
 * Header names match case-insensitively and a redacted header is kept, never dropped.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-16
 * @version 1.0
 */
public final class HeaderRedactor {

    private final Set<String> sensitiveHeaders;
    private final String marker;

    public HeaderRedactor(Collection<String> sensitiveHeaders, String marker) {
        this.sensitiveHeaders = sensitiveHeaders.stream()
                .map(h -> h.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.marker = marker;
    }

    public static HeaderRedactor from(LoggerConfiguration configuration) {
        return new HeaderRedactor(configuration.getSensitiveHeaders(), configuration.getRedactionMarker());
    }

    public boolean isSensitive(String headerName) {
        return headerName != null && sensitiveHeaders.contains(headerName.toLowerCase(Locale.ROOT));
    }

    /**
     * Returns a read-only copy of {@code headers} in which every sensitive header carries the
     * single value of the marker. Header order is preserved.
     *
     * @param headers the inbound headers, may be null
     */
    public Map<String, List<String>> redact(Map<String, List<String>> headers) {
        if (headers == null || headers.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, List<String>> redacted = new LinkedHashMap<>();
        headers.forEach((name, values) -> {
            if (isSensitive(name)) {
                redacted.put(name, List.of(marker));
            } else {
                redacted.put(name, values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values)));
            }
        });
        return Collections.unmodifiableMap(redacted);
    }

    public String getMarker() {
        return marker;
    }
}
