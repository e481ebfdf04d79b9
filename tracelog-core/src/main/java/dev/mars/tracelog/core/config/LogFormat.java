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
package dev.mars.tracelog.core.config;

import java.util.Locale;
import java.util.Optional;

/**
 * Output format of emitted records.
 */
public enum LogFormat {
    /** One JSON object per line. */
    JSON,
    /** Space separated {@code key=value} pairs. */
    TEXT;

    public static Optional<LogFormat> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "json":
                return Optional.of(JSON);
            case "text":
                return Optional.of(TEXT);
            default:
                return Optional.empty();
        }
    }
}
