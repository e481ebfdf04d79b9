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
package dev.mars.tracelog.vertx;

import dev.mars.tracelog.api.caller.LoggingFacade;
import dev.mars.tracelog.api.message.ActionStatus;
import dev.mars.tracelog.api.message.ActionType;
import dev.mars.tracelog.api.message.DataStatus;
import dev.mars.tracelog.api.message.DataType;
import dev.mars.tracelog.api.message.Messages;
import dev.mars.tracelog.api.record.RecordFields;
import dev.mars.tracelog.core.ServiceLogger;
import dev.mars.tracelog.core.context.LogContext;
import io.vertx.core.MultiMap;
import io.vertx.core.http.HttpClientRequest;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.http.HttpServerResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds log contexts to Vert.x HTTP requests and responses.
 *
 * <pre>{@code
 * server.requestHandler(request -> {
 *     LogContext log = VertxRequestLogs.newRequestLog(serviceLogger, request);
 *     log.requestReceived();
 *     orders.place(log, request).onComplete(ar -> {
 *         if (ar.failed()) {
 *             VertxRequestLogs.requestError(log, request.response(), "placing order", ar.cause(), 500, true);
 *         } else {
 *             request.response().end(ar.result());
 *         }
 *         log.requestComplete();
 *     });
 * });
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-18
 * @version 1.0
 */
@LoggingFacade
public final class VertxRequestLogs {
    private static final Logger logger = LoggerFactory.getLogger(VertxRequestLogs.class);

    static final String CONTENT_TYPE = "text/plain; charset=utf-8";

    private VertxRequestLogs() {
        // Utility class - prevent instantiation
    }

    /**
     * Creates the log context of an inbound request, continuing its {@code trace-id} and
     * recording its {@code span-id} as the previous span.
     *
     * @param request the request, or null for a context with generated ids and no metadata
     */
    public static LogContext newRequestLog(ServiceLogger serviceLogger, HttpServerRequest request) {
        return serviceLogger.newRequestLog(request == null ? null : new VertxInboundRequest(request));
    }

    /**
     * Sets the trace headers on a request to another service.
     */
    public static void propagateTo(LogContext context, HttpClientRequest outbound) {
        context.propagateTo((name, value) -> outbound.putHeader(name, value));
    }

    public static void propagateTo(LogContext context, MultiMap outboundHeaders) {
        context.propagateTo((name, value) -> outboundHeaders.set(name, value));
    }

    /**
     * Logs an error and sends it as the HTTP response.
     *
     * <p>{@code status_code} is set in the context and {@code "<code> - <message>"} is logged at
     * error level with the error. The response body is {@code "<code> - <message>"} when
     * {@code hideDetails} is set, otherwise it also carries the error description.</p>
     *
     * @param message     the error message
     * @param error       the error received from the application, may be null
     * @param code        the HTTP status code
     * @param hideDetails true to keep the error description out of the response body
     */
    public static void requestError(LogContext context, HttpServerResponse response, String message,
                                    Throwable error, int code, boolean hideDetails) {
        context.setContext(RecordFields.STATUS_CODE, code);

        String statusMessage = code + " - " + message;
        String detailMessage = context.logError(statusMessage, error);

        if (response.ended()) {
            logger.warn("Response already ended, cannot send error: {}", statusMessage);
            return;
        }
        response.setStatusCode(code)
                .putHeader("content-type", CONTENT_TYPE)
                .putHeader("x-content-type-options", "nosniff")
                .end(hideDetails ? statusMessage : detailMessage);
    }

    /**
     * {@link #requestError} with a message describing a data element.
     */
    public static void requestErrorData(LogContext context, HttpServerResponse response, DataStatus status,
                                        DataType dataType, Throwable error, int code, boolean hideDetails) {
        requestError(context, response, Messages.data(status, dataType, null), error, code, hideDetails);
    }

    /**
     * {@link #requestError} with a message describing a failed action.
     */
    public static void requestErrorAction(LogContext context, HttpServerResponse response, ActionType action,
                                          DataType dataType, Throwable error, int code, boolean hideDetails) {
        requestError(context, response, Messages.action(ActionStatus.ERROR, action, dataType, null), error,
                code, hideDetails);
    }
}
