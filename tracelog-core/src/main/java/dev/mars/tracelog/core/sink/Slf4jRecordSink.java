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
package dev.mars.tracelog.core.sink;

import dev.mars.tracelog.api.record.LogRecord;
import dev.mars.tracelog.api.record.RecordFields;
import dev.mars.tracelog.api.record.RecordSink;
import dev.mars.tracelog.core.config.LoggerConfiguration;
import dev.mars.tracelog.core.format.RecordFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Writes formatted records to an SLF4J logger at the record's level, with the trace and span ids
 * in the MDC for the duration of the write.
 *
 * <p>The default target logger is named {@code tracelog.<service name>} so backends can route
 * records separately from ordinary application logging.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-17
 * @version 1.0
 */
public class Slf4jRecordSink implements RecordSink {

    public static final String LOGGER_PREFIX = "tracelog.";

    private final RecordFormatter formatter;
    private final Logger target;

    public Slf4jRecordSink(RecordFormatter formatter, Logger target) {
        this.formatter = Objects.requireNonNull(formatter, "formatter");
        this.target = Objects.requireNonNull(target, "target");
    }

    public static Slf4jRecordSink forConfiguration(LoggerConfiguration configuration) {
        return new Slf4jRecordSink(RecordFormatter.forFormat(configuration.getFormat()),
                LoggerFactory.getLogger(LOGGER_PREFIX + configuration.getServiceName()));
    }

    @Override
    public void write(LogRecord record) {
        String line = formatter.format(record);
        try (MdcScope scope = MdcScope.open(stringField(record, RecordFields.TRACE_ID),
                stringField(record, RecordFields.SPAN_ID))) {
            switch (record.level()) {
                case DEBUG:
                    target.debug(line);
                    break;
                case INFO:
                    target.info(line);
                    break;
                case WARN:
                    target.warn(line);
                    break;
                case ERROR:
                default:
                    target.error(line);
                    break;
            }
        }
    }

    private static String stringField(LogRecord record, String name) {
        Object value = record.field(name);
        return value == null ? null : value.toString();
    }
}
