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

import dev.mars.tracelog.api.error.ErrorContext;
import dev.mars.tracelog.api.error.ErrorFactory;
import dev.mars.tracelog.api.error.TracedError;
import dev.mars.tracelog.api.error.TracedErrors;
import dev.mars.tracelog.api.message.ActionType;
import dev.mars.tracelog.api.message.DataStatus;
import dev.mars.tracelog.api.message.DataType;
import dev.mars.tracelog.api.message.FieldArgs;
import dev.mars.tracelog.core.ServiceLogger;
import dev.mars.tracelog.core.config.LoggerConfiguration;
import dev.mars.tracelog.core.context.LogContext;
import dev.mars.tracelog.vertx.VertxRequestLogs;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientResponse;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Vert.x HTTP server whose requests are logged with per-request trace and span ids.
 *
 * <ul>
 *   <li>{@code GET /orders/{id}} - looks an order up; unknown ids answer 404</li>
 *   <li>{@code GET /orders/{id}/summary} - calls {@code /orders/{id}} on this server from a child
 *       context, so the downstream request continues the same trace</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-19
 * @version 1.0
 */
public class TracedHttpServerExample {

    private static final Logger logger = LoggerFactory.getLogger(TracedHttpServerExample.class);

    static final String ORDERS_PREFIX = "/orders/";
    static final String SUMMARY_SUFFIX = "/summary";
    static final String NOT_FOUND_TAG = "not-found";

    private final Vertx vertx;
    private final ServiceLogger serviceLogger;
    private final OrderStore orders = new OrderStore();
    private HttpServer server;
    private HttpClient client;

    public TracedHttpServerExample(Vertx vertx, ServiceLogger serviceLogger) {
        this.vertx = vertx;
        this.serviceLogger = serviceLogger;
    }

    public OrderStore orders() {
        return orders;
    }

    /**
     * Starts listening. Port 0 picks a free port; see {@link #actualPort()}.
     */
    public Future<HttpServer> start(int port) {
        client = vertx.createHttpClient();
        return vertx.createHttpServer()
                .requestHandler(this::handle)
                .listen(port)
                .onSuccess(s -> {
                    server = s;
                    logger.info("Traced HTTP server listening on port {}", s.actualPort());
                });
    }

    public int actualPort() {
        return server.actualPort();
    }

    public Future<Void> stop() {
        Future<Void> clientClosed = client == null ? Future.succeededFuture() : client.close();
        Future<Void> serverClosed = server == null ? Future.succeededFuture() : server.close();
        return Future.all(clientClosed, serverClosed).mapEmpty();
    }

    void handle(HttpServerRequest request) {
        LogContext log = VertxRequestLogs.newRequestLog(serviceLogger, request);
        log.requestReceived();

        String path = request.path();
        if (!HttpMethod.GET.equals(request.method()) || path == null || !path.startsWith(ORDERS_PREFIX)) {
            VertxRequestLogs.requestError(log, request.response(), "no route", null, 404, true);
            log.requestComplete();
            return;
        }

        String rest = path.substring(ORDERS_PREFIX.length());
        if (rest.endsWith(SUMMARY_SUFFIX)) {
            summarise(log, request, rest.substring(0, rest.length() - SUMMARY_SUFFIX.length()));
        } else {
            getOrder(log, request, rest);
        }
    }

    private void getOrder(LogContext log, HttpServerRequest request, String id) {
        log.addContext("order_id", id);
        try {
            String item = orders.find(id);
            log.setContext("status_code", 200);
            request.response()
                    .putHeader("content-type", "application/json")
                    .end(new JsonObject().put("id", id).put("item", item).encode());
        } catch (TracedError e) {
            if (TracedErrors.hasTag(e, NOT_FOUND_TAG)) {
                VertxRequestLogs.requestError(log, request.response(), "order not found", e, 404, true);
            } else {
                VertxRequestLogs.requestError(log, request.response(), "order lookup failed", e, 500, true);
            }
        } finally {
            log.requestComplete();
        }
    }

    private void summarise(LogContext log, HttpServerRequest request, String id) {
        log.addContext("order_id", id);
        LogContext downstream = log.child();
        int port = actualPort();

        client.request(HttpMethod.GET, port, "localhost", ORDERS_PREFIX + id)
                .compose(outbound -> {
                    VertxRequestLogs.propagateTo(downstream, outbound);
                    downstream.info("calling order lookup for {}", id);
                    return outbound.send();
                })
                .compose(response -> readBody(response, id))
                .onComplete(ar -> {
                    if (ar.succeeded()) {
                        JsonObject order = new JsonObject(ar.result());
                        log.setContext("status_code", 200);
                        request.response()
                                .putHeader("content-type", "text/plain; charset=utf-8")
                                .end("order " + order.getString("id") + ": " + order.getString("item"));
                    } else {
                        int code = TracedErrors.hasTag(ar.cause(), NOT_FOUND_TAG) ? 404 : 502;
                        VertxRequestLogs.requestErrorAction(log, request.response(), ActionType.GET,
                                DataType.of("order summary"), ar.cause(), code, true);
                    }
                    log.requestComplete();
                });
    }

    private Future<String> readBody(HttpClientResponse response, String id) {
        return response.body().compose(body -> {
            if (response.statusCode() == 200) {
                return Future.succeededFuture(body.toString());
            }
            TracedError error = ErrorFactory.defaults()
                    .errorAction(ActionType.READ, DataType.RESPONSE, FieldArgs.of("status", response.statusCode()));
            if (response.statusCode() == 404) {
                error = error.addTag(NOT_FOUND_TAG);
            }
            return Future.failedFuture(error.wrap(ErrorContext.of("summarising order " + id)));
        });
    }

    /**
     * In-memory order storage.
     */
    public static class OrderStore {
        private final Map<String, String> items = new ConcurrentHashMap<>();
        private final ErrorFactory errors = ErrorFactory.defaults();

        public void put(String id, String item) {
            items.put(id, item);
        }

        public String find(String id) {
            String item = items.get(id);
            if (item == null) {
                throw errors.errorData(DataStatus.MISSING, DataType.of("order"), FieldArgs.of("id", id))
                        .addTag(NOT_FOUND_TAG);
            }
            return item;
        }
    }

    public static void main(String[] args) {
        Vertx vertx = Vertx.vertx();
        ServiceLogger serviceLogger = ServiceLogger.create(LoggerConfiguration.load("orders-example"));
        TracedHttpServerExample example = new TracedHttpServerExample(vertx, serviceLogger);
        example.orders().put("1", "keyboard");
        example.orders().put("2", "monitor");

        example.start(8080).onFailure(e -> {
            logger.error("Failed to start server", e);
            vertx.close();
        });
    }
}
