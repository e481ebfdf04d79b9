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
package dev.mars.tracelog.api;

import java.util.Locale;
import java.util.Optional;

/**
 * Severity of a log record, lowest first.
 */
public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR;

    /**
     * @return true if a record at this level passes a threshold of {@code minimum}
     */
    public boolean isAtLeast(LogLevel minimum) {
        return compareTo(minimum) >= 0;
    }

    /**
     * Lower-case name as written into records.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a level name case-insensitively ("info", "Info", "INFO").
     *
     * @param level the name, may be null
     * @return the level, or empty if the name is not a known level
     */
    public static Optional<LogLevel> fromString(String level) {
        if (level == null) {
            return Optional.empty();
        }
        String normalized = level.trim().toUpperCase(Locale.ROOT);
        for (LogLevel candidate : values()) {
            if (candidate.name().equals(normalized)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
