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
package dev.mars.tracelog.core;

import dev.mars.tracelog.api.LogLevel;
import dev.mars.tracelog.api.caller.CallerNameResolver;
import dev.mars.tracelog.api.caller.LoggingFacade;
import dev.mars.tracelog.api.caller.StackWalkerCallerNameResolver;
import dev.mars.tracelog.api.id.IdGenerator;
import dev.mars.tracelog.api.id.UuidIdGenerator;
import dev.mars.tracelog.api.message.Messages;
import dev.mars.tracelog.api.propagation.InboundRequest;
import dev.mars.tracelog.api.propagation.TraceHeaders;
import dev.mars.tracelog.api.record.LogRecord;
import dev.mars.tracelog.api.record.RecordFields;
import dev.mars.tracelog.api.record.RecordSink;
import dev.mars.tracelog.core.config.LoggerConfiguration;
import dev.mars.tracelog.core.context.LogContext;
import dev.mars.tracelog.core.context.RequestMetadata;
import dev.mars.tracelog.core.redact.HeaderRedactor;
import dev.mars.tracelog.core.sink.Slf4jRecordSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point of the library for one service. Creates request log contexts and emits
 * service-level records that carry no request identity.
 *
 * <p>Every record carries {@code service_name}. Records below the configured minimum level are
 * dropped before they are built. A failing sink never reaches the caller: the failure is
 * reported at WARN through this class's own logger and the record is lost.</p>
 *
 * <pre>{@code
 * ServiceLogger serviceLogger = ServiceLogger.create(LoggerConfiguration.load("orders"));
 *
 * LogContext log = serviceLogger.newRequestLog(inbound);
 * log.requestReceived();
 * ...
 * log.requestComplete();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-16
 * @version 1.0
 */
@LoggingFacade
public final class ServiceLogger {
    private static final Logger logger = LoggerFactory.getLogger(ServiceLogger.class);

    private final LoggerConfiguration configuration;
    private final RecordSink sink;
    private final IdGenerator idGenerator;
    private final CallerNameResolver callerNameResolver;
    private final HeaderRedactor redactor;
    private final Clock clock;

    private ServiceLogger(Builder builder) {
        this.configuration = builder.configuration;
        this.sink = builder.sink != null ? builder.sink : Slf4jRecordSink.forConfiguration(builder.configuration);
        this.idGenerator = builder.idGenerator;
        this.callerNameResolver = builder.callerNameResolver;
        this.redactor = HeaderRedactor.from(builder.configuration);
        this.clock = builder.clock;
    }

    public static ServiceLogger create(LoggerConfiguration configuration) {
        return builder(configuration).build();
    }

    public static Builder builder(LoggerConfiguration configuration) {
        return new Builder(configuration);
    }

    /**
     * Creates a log context.
     *
     * @param traceId the trace id to continue, or null/empty to start a new trace
     * @param request the request being handled, or null; sensitive headers are redacted
     */
    public LogContext newLog(String traceId, RequestMetadata request) {
        String resolvedTraceId = traceId == null || traceId.isEmpty() ? idGenerator.newId() : traceId;
        RequestMetadata metadata = request == null
                ? RequestMetadata.empty()
                : request.withHeaders(redactor.redact(request.getHeaders()));
        return new RequestLogContext(this, resolvedTraceId, idGenerator.newId(), metadata);
    }

    public LogContext newLog(String traceId) {
        return newLog(traceId, RequestMetadata.empty());
    }

    /**
     * Creates a log context for an inbound request, continuing its {@code trace-id} and recording
     * its {@code span-id} as the previous span.
     *
     * @param inbound the request, or null for a context with generated ids and no metadata
     */
    public LogContext newRequestLog(InboundRequest inbound) {
        if (inbound == null) {
            return newLog(null, RequestMetadata.empty());
        }
        RequestMetadata metadata = RequestMetadata.of(inbound.method(), inbound.path(), inbound.headers(),
                inbound.header(TraceHeaders.SPAN_ID));
        return newLog(inbound.header(TraceHeaders.TRACE_ID), metadata);
    }

    public boolean isEnabled(LogLevel level) {
        return level.isAtLeast(configuration.getMinimumLevel());
    }

    public void debug(String message) {
        log(LogLevel.DEBUG, message, null);
    }

    public void debug(String format, Object... args) {
        log(LogLevel.DEBUG, Messages.format(format, args), null);
    }

    public void debugWithFields(String message, Map<String, ?> fields) {
        log(LogLevel.DEBUG, message, fields);
    }

    public void info(String message) {
        log(LogLevel.INFO, message, null);
    }

    public void info(String format, Object... args) {
        log(LogLevel.INFO, Messages.format(format, args), null);
    }

    public void infoWithFields(String message, Map<String, ?> fields) {
        log(LogLevel.INFO, message, fields);
    }

    public void warn(String message) {
        log(LogLevel.WARN, message, null);
    }

    public void warn(String format, Object... args) {
        log(LogLevel.WARN, Messages.format(format, args), null);
    }

    public void warnWithFields(String message, Map<String, ?> fields) {
        log(LogLevel.WARN, message, fields);
    }

    public void error(String message) {
        log(LogLevel.ERROR, message, null);
    }

    public void error(String format, Object... args) {
        log(LogLevel.ERROR, Messages.format(format, args), null);
    }

    public void errorWithFields(String message, Map<String, ?> fields) {
        log(LogLevel.ERROR, message, fields);
    }

    public LoggerConfiguration getConfiguration() {
        return configuration;
    }

    private void log(LogLevel level, String message, Map<String, ?> fields) {
        if (!isEnabled(level)) {
            return;
        }
        Map<String, Object> recordFields = new LinkedHashMap<>();
        if (fields != null) {
            recordFields.putAll(fields);
        }
        dispatch(level, message, recordFields);
    }

    String newSpanId() {
        return idGenerator.newId();
    }

    String resolveCaller() {
        return callerNameResolver.resolveCaller();
    }

    void dispatch(LogLevel level, String message, Map<String, Object> fields) {
        Map<String, Object> recordFields = new LinkedHashMap<>();
        recordFields.put(RecordFields.SERVICE_NAME, configuration.getServiceName());
        // service_name is never overridden by caller fields
        fields.forEach(recordFields::putIfAbsent);
        LogRecord record = new LogRecord(clock.instant(), level, message, recordFields);
        try {
            sink.write(record);
        } catch (RuntimeException e) {
            logger.warn("Dropping {} record '{}' of service {}: {}", level, message,
                    configuration.getServiceName(), e.getMessage(), e);
        }
    }

    /**
     * Builder for {@link ServiceLogger}. Every collaborator except the configuration has a
     * production default.
     */
    public static final class Builder {
        private final LoggerConfiguration configuration;
        private RecordSink sink;
        private IdGenerator idGenerator = UuidIdGenerator.getInstance();
        private CallerNameResolver callerNameResolver = StackWalkerCallerNameResolver.getInstance();
        private Clock clock = Clock.systemUTC();

        private Builder(LoggerConfiguration configuration) {
            this.configuration = Objects.requireNonNull(configuration, "configuration");
        }

        /**
         * Defaults to an {@link Slf4jRecordSink} using the configured format.
         */
        public Builder sink(RecordSink sink) {
            this.sink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        public Builder idGenerator(IdGenerator idGenerator) {
            this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
            return this;
        }

        public Builder callerNameResolver(CallerNameResolver callerNameResolver) {
            this.callerNameResolver = Objects.requireNonNull(callerNameResolver, "callerNameResolver");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public ServiceLogger build() {
            return new ServiceLogger(this);
        }
    }
}
