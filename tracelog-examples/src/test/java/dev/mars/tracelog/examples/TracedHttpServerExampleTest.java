package dev.mars.tracelog.examples;

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
import dev.mars.tracelog.api.record.RecordFields;
import dev.mars.tracelog.core.ServiceLogger;
import dev.mars.tracelog.core.config.LoggerConfiguration;
import dev.mars.tracelog.test.categories.TestCategories;
import dev.mars.tracelog.test.sink.CapturingRecordSink;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.RequestOptions;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.INTEGRATION)
@DisplayName("Traced HTTP Server Example Tests")
class TracedHttpServerExampleTest {

    private static final String COMPLETE = "Request Complete";

    private Vertx vertx;
    private HttpClient client;
    private CapturingRecordSink sink;
    private TracedHttpServerExample example;
    private int port;

    @BeforeEach
    void setUp() throws Exception {
        vertx = Vertx.vertx();
        client = vertx.createHttpClient();
        sink = new CapturingRecordSink();
        ServiceLogger serviceLogger = ServiceLogger.builder(LoggerConfiguration.builder("orders").build())
                .sink(sink)
                .build();

        example = new TracedHttpServerExample(vertx, serviceLogger);
        example.orders().put("1", "keyboard");
        example.start(0).toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
        port = example.actualPort();
    }

    @AfterEach
    void tearDown() throws Exception {
        example.stop().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
        vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    private static final class Reply {
        final int status;
        final String body;

        Reply(int status, String body) {
            this.status = status;
            this.body = body;
        }
    }

    private Reply get(String uri, Map<String, String> headers) throws Exception {
        RequestOptions options = new RequestOptions()
                .setMethod(HttpMethod.GET)
                .setHost("localhost")
                .setPort(port)
                .setURI(uri);
        headers.forEach(options::putHeader);
        return client.request(options)
                .compose(request -> request.send())
                .compose(response -> response.body().map(body -> new Reply(response.statusCode(), body.toString())))
                .toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    // The terminal record may be written just after the response is flushed
    private List<LogRecord> awaitRecords(Predicate<LogRecord> filter, int expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        List<LogRecord> matching = List.of();
        while (System.currentTimeMillis() < deadline) {
            matching = sink.records().stream().filter(filter).collect(Collectors.toList());
            if (matching.size() >= expected) {
                return matching;
            }
            Thread.sleep(20);
        }
        fail("Expected " + expected + " records but found " + matching.size());
        return matching;
    }

    @Test
    @DisplayName("Inbound trace id is continued through to the terminal record")
    void testFoundOrder() throws Exception {
        Reply reply = get("/orders/1", Map.of("trace-id", "trace-123", "Authorization", "Bearer secret"));

        assertEquals(200, reply.status);
        assertEquals("keyboard", new JsonObject(reply.body).getString("item"));

        LogRecord complete = awaitRecords(r -> r.message().equals(COMPLETE), 1).get(0);
        assertEquals("trace-123", complete.field(RecordFields.TRACE_ID));
        assertEquals(Map.of("order_id", "1", "status_code", 200), complete.field(RecordFields.CONTEXT));

        LogRecord received = sink.withMessage("Request Received").get(0);
        @SuppressWarnings("unchecked")
        Map<String, Object> request = (Map<String, Object>) received.field(RecordFields.REQUEST);
        @SuppressWarnings("unchecked")
        Map<String, List<String>> headers = (Map<String, List<String>>) request.get("headers");
        assertEquals(List.of("---"), headers.get("Authorization"));
    }

    @Test
    @DisplayName("Unknown order answers 404 without details")
    void testMissingOrder() throws Exception {
        Reply reply = get("/orders/9", Map.of());

        assertEquals(404, reply.status);
        assertEquals("404 - order not found", reply.body);

        awaitRecords(r -> r.message().equals(COMPLETE), 1);
        LogRecord failure = sink.records(LogLevel.ERROR).get(0);
        assertEquals("404 - order not found", failure.message());
        assertTrue(failure.field(RecordFields.FUNCTION_NAME).toString().endsWith("TracedHttpServerExample.getOrder"));
    }

    @Test
    @DisplayName("Downstream call continues the trace from a child span")
    void testSummaryPropagatesTrace() throws Exception {
        Reply reply = get("/orders/1/summary", Map.of("trace-id", "trace-abc"));

        assertEquals(200, reply.status);
        assertEquals("order 1: keyboard", reply.body);

        List<LogRecord> completes = awaitRecords(r -> r.message().equals(COMPLETE), 2);
        assertTrue(completes.stream().allMatch(r -> "trace-abc".equals(r.field(RecordFields.TRACE_ID))));

        LogRecord outboundCall = sink.withMessage("calling order lookup for 1").get(0);
        LogRecord downstreamReceived = sink.withMessage("Request Received").stream()
                .filter(r -> r.hasField(RecordFields.PREV_SPAN_ID))
                .findFirst()
                .orElseThrow();
        assertEquals(outboundCall.field(RecordFields.SPAN_ID), downstreamReceived.field(RecordFields.PREV_SPAN_ID));
    }

    @Test
    @DisplayName("Downstream 404 surfaces as a 404 summary failure")
    void testSummaryOfMissingOrder() throws Exception {
        Reply reply = get("/orders/9/summary", Map.of());

        assertEquals(404, reply.status);
        assertEquals("404 - Error getting order summary", reply.body);
    }

    @Test
    @DisplayName("Unknown routes answer 404")
    void testNoRoute() throws Exception {
        Reply reply = get("/customers", Map.of());

        assertEquals(404, reply.status);
        assertEquals("404 - no route", reply.body);
    }
}
