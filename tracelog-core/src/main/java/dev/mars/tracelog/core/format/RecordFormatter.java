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

import dev.mars.tracelog.api.record.LogRecord;
import dev.mars.tracelog.core.config.LogFormat;

/**
 * Renders a record as a single line.
 */
public interface RecordFormatter {

    /**
     * @throws IllegalStateException if the record cannot be rendered
     */
    String format(LogRecord record);

    static RecordFormatter forFormat(LogFormat format) {
        switch (format) {
            case TEXT:
                return new TextRecordFormatter();
            case JSON:
            default:
                return new JsonRecordFormatter();
        }
    }
}
