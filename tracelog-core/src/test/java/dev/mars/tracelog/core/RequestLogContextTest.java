package dev.mars.tracelog.core;

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
import dev.mars.tracelog.api.error.ErrorContext;
import dev.mars.tracelog.api.error.TracedError;
import dev.mars.tracelog.api.message.ActionStatus;
import dev.mars.tracelog.api.message.ActionType;
import dev.mars.tracelog.api.message.DataStatus;
import dev.mars.tracelog.api.message.DataType;
import dev.mars.tracelog.api.message.FieldArgs;
import dev.mars.tracelog.api.record.LogRecord;
import dev.mars.tracelog.api.record.RecordFields;
import dev.mars.tracelog.core.config.LoggerConfiguration;
import dev.mars.tracelog.core.context.DuplicateContextKeyException;
import dev.mars.tracelog.core.context.LogContext;
import dev.mars.tracelog.test.FixedCallerNameResolver;
import dev.mars.tracelog.test.SequenceIdGenerator;
import dev.mars.tracelog.test.categories.TestCategories;
import dev.mars.tracelog.test.sink.CapturingRecordSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.FileNotFoundException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
@DisplayName("Request Log Context Tests")
class RequestLogContextTest {

    private CapturingRecordSink sink;
    private ServiceLogger serviceLogger;
    private LogContext log;

    @BeforeEach
    void setUp() {
        sink = new CapturingRecordSink();
        serviceLogger = newServiceLogger(LogLevel.INFO);
        log = serviceLogger.newRequestLog(new TestInboundRequest("GET", "/users/42")
                .header("span-id", "caller-span")
                .header("Authorization", "Bearer secret"));
    }

    private ServiceLogger newServiceLogger(LogLevel level) {
        return ServiceLogger.builder(LoggerConfiguration.builder("users").minimumLevel(level).build())
                .sink(sink)
                .idGenerator(new SequenceIdGenerator())
                .callerNameResolver(new FixedCallerNameResolver("shop.UserHandler.get"))
                .build();
    }

    @Test
    @DisplayName("Records carry trace identity and the resolved caller")
    void testRecordFields() {
        log.info("loading user");

        LogRecord record = sink.last();
        assertEquals("loading user", record.message());
        assertEquals("users", record.field(RecordFields.SERVICE_NAME));
        assertEquals("id-1", record.field(RecordFields.TRACE_ID));
        assertEquals("id-2", record.field(RecordFields.SPAN_ID));
        assertEquals("caller-span", record.field(RecordFields.PREV_SPAN_ID));
        assertEquals("shop.UserHandler.get", record.field(RecordFields.FUNCTION_NAME));
        assertFalse(record.hasField(RecordFields.CONTEXT));
    }

    @Test
    @DisplayName("Duplicate key insertion fails and leaves the stored value")
    void testAddContextDuplicate() {
        log.addContext("user_id", 42);

        DuplicateContextKeyException e = assertThrows(DuplicateContextKeyException.class,
                () -> log.addContext("user_id", 43));

        assertEquals("user_id", e.getKey());
        assertEquals(42, log.contextValues().get("user_id"));
    }

    @Test
    @DisplayName("setContext overwrites unconditionally")
    void testSetContextOverwrites() {
        log.addContext("attempt", 1);
        log.setContext("attempt", 2);
        log.setContext("fresh", "yes");

        assertEquals(Map.of("attempt", 2, "fresh", "yes"), log.contextValues());
    }

    @Test
    @DisplayName("Emitting does not clear the context")
    void testEmitKeepsContext() {
        log.addContext("k", "v");
        log.info("first");
        log.warn("second");

        assertEquals(Map.of("k", "v"), log.contextValues());
    }

    @Test
    @DisplayName("Outbound requests carry the trace id and this span id")
    void testPropagateTo() {
        Map<String, String> outbound = new LinkedHashMap<>();

        log.propagateTo(outbound::put);

        assertEquals(Map.of("trace-id", log.traceId(), "span-id", log.spanId()), outbound);
    }

    @Test
    @DisplayName("Details and formatted messages")
    void testDetailsAndFormatting() {
        log.infoWithDetails("cache miss", Map.of("key", "user:42"));
        log.warn("retry {} of {}", 1, 3);

        assertEquals(Map.of("key", "user:42"), sink.records().get(0).field(RecordFields.DETAILS));
        assertEquals("retry 1 of 3", sink.last().message());
        assertEquals(LogLevel.WARN, sink.last().level());
    }

    @Test
    @DisplayName("Records below the minimum level are dropped")
    void testThreshold() {
        log.debug("hidden");
        log.debugWithDetails("hidden", Map.of("a", 1));

        assertTrue(sink.isEmpty());

        LogContext verbose = newServiceLogger(LogLevel.DEBUG).newLog(null);
        verbose.debug("shown");
        assertEquals("shown", sink.last().message());
    }

    @Test
    @DisplayName("logError records the error and returns message with error")
    void testLogError() {
        TracedError error = TracedError.wrap(new FileNotFoundException("file not found"),
                ErrorContext.of("loading config"));

        String result = log.logError("handling request", error);

        assertEquals("handling request: loading config: file not found", result);
        LogRecord record = sink.last();
        assertEquals(LogLevel.ERROR, record.level());
        assertEquals("handling request", record.message());
        assertSame(error, record.field(RecordFields.ERROR));
    }

    @Test
    @DisplayName("Data and action messages are logged at the requested level and returned")
    void testDataAndActionMessages() {
        String data = log.logData(LogLevel.WARN, DataStatus.MISSING, DataType.QUERY_PARAM, FieldArgs.of("name", "id"));
        String action = log.logAction(LogLevel.INFO, ActionStatus.SUCCESS, ActionType.FIND, DataType.of("user"),
                FieldArgs.of("id", 42));

        assertEquals("Missing query param: name=id", data);
        assertEquals("Success finding user for id=42", action);
        assertEquals(LogLevel.WARN, sink.records().get(0).level());
        assertEquals(action, sink.last().message());
    }

    @Test
    @DisplayName("Data and action errors delegate to logError")
    void testErrorDataAndAction() {
        RuntimeException cause = new RuntimeException("timeout");

        assertEquals("Invalid request body: timeout", log.errorData(DataStatus.INVALID, DataType.REQUEST_BODY, cause));
        assertEquals("Error saving user: timeout", log.errorAction(ActionType.SAVE, DataType.of("user"), cause));
        assertEquals("Error saving user", sink.last().message());
        assertSame(cause, sink.last().field(RecordFields.ERROR));
    }

    @Test
    @DisplayName("Request Received carries redacted request metadata")
    void testRequestReceived() {
        log.requestReceived();

        LogRecord record = sink.last();
        assertEquals("Request Received", record.message());
        @SuppressWarnings("unchecked")
        Map<String, Object> request = (Map<String, Object>) record.field(RecordFields.REQUEST);
        assertEquals("GET", request.get("method"));
        assertEquals("/users/42", request.get("path"));
        assertEquals("caller-span", request.get(RecordFields.PREV_SPAN_ID));
        @SuppressWarnings("unchecked")
        Map<String, List<String>> headers = (Map<String, List<String>>) request.get("headers");
        assertEquals(List.of("---"), headers.get("Authorization"));
    }

    @Test
    @DisplayName("Request Complete is emitted once and completes the context")
    void testRequestComplete() {
        log.addContext("user_id", 42);
        log.setContext("status_code", 200);

        log.requestComplete();
        log.requestComplete();

        assertEquals(1, sink.withMessage("Request Complete").size());
        assertEquals(Map.of("user_id", 42, "status_code", 200), sink.last().field(RecordFields.CONTEXT));
        assertFalse(log.isActive());
    }

    @Test
    @DisplayName("Completed context ignores mutators and emitters")
    void testCompletedContextIsInert() {
        log.requestComplete();
        int before = sink.size();

        assertDoesNotThrow(() -> log.addContext("late", 1));
        log.setContext("late", 2);
        log.info("late record");
        log.requestReceived();
        String message = log.logError("late failure", new RuntimeException("boom"));

        assertEquals(before, sink.size());
        assertTrue(log.contextValues().isEmpty());
        assertEquals("late failure: boom", message);
    }

    @Test
    @DisplayName("Completed context ignores mutators even with a null key")
    void testCompletedContextIgnoresNullKey() {
        log.requestComplete();

        assertDoesNotThrow(() -> log.addContext(null, 1));
        assertDoesNotThrow(() -> log.setContext(null, 1));
        assertTrue(log.contextValues().isEmpty());
    }

    @Test
    @DisplayName("Context completes even when its terminal record is below the threshold")
    void testCompleteBelowThreshold() {
        LogContext quiet = newServiceLogger(LogLevel.ERROR).newLog(null);

        quiet.requestComplete();

        assertFalse(quiet.isActive());
        assertTrue(sink.isEmpty());
    }

    @Test
    @DisplayName("Child context shares the trace and links back to its parent span")
    void testChild() {
        log.addContext("parent_only", true);

        LogContext child = log.child();
        child.info("fan-out");

        assertEquals(log.traceId(), child.traceId());
        assertNotEquals(log.spanId(), child.spanId());
        assertEquals(log.spanId(), child.prevSpanId());
        assertEquals(log.request().getPath(), child.request().getPath());
        assertTrue(child.contextValues().isEmpty());
        assertEquals(log.spanId(), sink.last().field(RecordFields.PREV_SPAN_ID));
    }

    @Test
    @DisplayName("Function name resolves to the caller of the logging API")
    void testFunctionNameResolvesToCaller() {
        ServiceLogger stackWalking = ServiceLogger.builder(LoggerConfiguration.builder("users").build())
                .sink(sink)
                .build();
        LogContext context = stackWalking.newLog(null);

        context.info("direct");
        context.logData(LogLevel.INFO, DataStatus.FOUND, DataType.ARG, null);

        String expected = RequestLogContextTest.class.getName() + ".testFunctionNameResolvesToCaller";
        assertEquals(expected, sink.records().get(0).field(RecordFields.FUNCTION_NAME));
        assertEquals(expected, sink.last().field(RecordFields.FUNCTION_NAME));
    }
}
