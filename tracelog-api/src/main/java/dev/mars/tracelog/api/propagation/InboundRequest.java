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

import java.util.List;
import java.util.Map;

/**
 * Read-only view of an inbound request, as much of it as request logging needs.
 * Transport integrations adapt their native request type to this interface.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-14
 * @version 1.0
 */
public interface InboundRequest {

    String method();

    String path();

    /**
     * @return every header with all of its values, keyed by the header name as received
     */
    Map<String, List<String>> headers();

    /**
     * Returns the first value of a header, matching the name case-insensitively.
     *
     * @param name the header name
     * @return the value, or null if the header is absent
     */
    default String header(String name) {
        for (Map.Entry<String, List<String>> entry : headers().entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name) && !entry.getValue().isEmpty()) {
                return entry.getValue().get(0);
            }
        }
        return null;
    }
}
