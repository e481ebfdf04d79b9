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
package dev.mars.tracelog.core.context;

import dev.mars.tracelog.api.LogLevel;
import dev.mars.tracelog.api.caller.LoggingFacade;
import dev.mars.tracelog.api.error.TracedErrors;
import dev.mars.tracelog.api.message.ActionStatus;
import dev.mars.tracelog.api.message.ActionType;
import dev.mars.tracelog.api.message.DataStatus;
import dev.mars.tracelog.api.message.DataType;
import dev.mars.tracelog.api.message.MessageArgs;
import dev.mars.tracelog.api.message.Messages;
import dev.mars.tracelog.api.propagation.HeaderSetter;

import java.util.Map;

/**
 * Per-request logging state: trace and span identity, request metadata and a free-form context
 * map that is written once, with the terminal "Request Complete" record.
 *
 * <p>A context moves from <i>active</i> to <i>completed</i> when {@link #requestComplete()} is
 * called. Once completed, every mutator and emitter does nothing. {@link #noop()} returns a
 * context that behaves like a completed one from the start, for code paths with no request.</p>
 *
 * <p>A context is confined to the thread handling its request. Work fanned out to other threads
 * should use {@link #child()}.</p>
 *
 * <pre>{@code
 * LogContext log = serviceLogger.newRequestLog(inbound);
 * log.requestReceived();
 * try {
 *     log.addContext("order_id", orderId);
 *     ...
 * } catch (TracedError e) {
 *     log.logError("placing order", e);
 * } finally {
 *     log.requestComplete();
 * }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-16
 * @version 1.0
 */
@LoggingFacade
public interface LogContext {

    /**
     * @return the inert context used where no request is being handled
     */
    static LogContext noop() {
        return NoopLogContext.INSTANCE;
    }

    String traceId();

    String spanId();

    /**
     * @return the span id of the calling service, or an empty string
     */
    String prevSpanId();

    RequestMetadata request();

    /**
     * @return a read-only snapshot of the context map
     */
    Map<String, Object> contextValues();

    /**
     * @return true until {@link #requestComplete()} is called; always false for {@link #noop()}
     */
    boolean isActive();

    /**
     * Adds a context entry.
     *
     * @throws DuplicateContextKeyException if {@code key} is already present
     */
    void addContext(String key, Object value);

    /**
     * Adds or overwrites a context entry.
     */
    void setContext(String key, Object value);

    /**
     * Writes the trace and span headers for a call to another service.
     */
    void propagateTo(HeaderSetter outbound);

    /**
     * Derives a context for work fanned out from this one: same trace id and request, a new span
     * id, this span as the previous span, and an empty context map.
     */
    LogContext child();

    /**
     * Emits one record carrying the trace identity and resolved caller.
     *
     * @param level   the record level; records below the configured minimum are dropped
     * @param message the record message
     * @param details extra fields logged under {@code details}, or null
     * @param error   logged under {@code error}, or null
     */
    void emit(LogLevel level, String message, Map<String, ?> details, Throwable error);

    /**
     * Emits the "Request Received" record with the request metadata.
     */
    void requestReceived();

    /**
     * Emits the terminal "Request Complete" record with the context map, then completes the
     * context. Later calls do nothing.
     */
    void requestComplete();

    default void emit(LogLevel level, String message) {
        emit(level, message, null, null);
    }

    default void debug(String message) {
        emit(LogLevel.DEBUG, message, null, null);
    }

    default void debug(String format, Object... args) {
        emit(LogLevel.DEBUG, Messages.format(format, args), null, null);
    }

    default void debugWithDetails(String message, Map<String, ?> details) {
        emit(LogLevel.DEBUG, message, details, null);
    }

    default void info(String message) {
        emit(LogLevel.INFO, message, null, null);
    }

    default void info(String format, Object... args) {
        emit(LogLevel.INFO, Messages.format(format, args), null, null);
    }

    default void infoWithDetails(String message, Map<String, ?> details) {
        emit(LogLevel.INFO, message, details, null);
    }

    default void warn(String message) {
        emit(LogLevel.WARN, message, null, null);
    }

    default void warn(String format, Object... args) {
        emit(LogLevel.WARN, Messages.format(format, args), null, null);
    }

    default void warnWithDetails(String message, Map<String, ?> details) {
        emit(LogLevel.WARN, message, details, null);
    }

    /**
     * Prefer {@link #logError(String, Throwable)} when an error is at hand.
     */
    default void error(String message) {
        emit(LogLevel.ERROR, message, null, null);
    }

    default void error(String format, Object... args) {
        emit(LogLevel.ERROR, Messages.format(format, args), null, null);
    }

    default void errorWithDetails(String message, Map<String, ?> details) {
        emit(LogLevel.ERROR, message, details, null);
    }

    /**
     * Logs {@code message} at error level with {@code error} in the record.
     *
     * @return {@code "message: <error>"}, also when nothing was logged
     */
    default String logError(String message, Throwable error) {
        emit(LogLevel.ERROR, message, null, error);
        return message + ": " + TracedErrors.describe(error);
    }

    /**
     * Logs a data message at {@code level}.
     *
     * @param args arguments to include, or null if none
     * @return the message
     */
    default String logData(LogLevel level, DataStatus status, DataType dataType, MessageArgs args) {
        String message = Messages.data(status, dataType, args);
        emit(level, message, null, null);
        return message;
    }

    /**
     * Logs an action message at {@code level}.
     *
     * @param args arguments to include, or null if none
     * @return the message
     */
    default String logAction(LogLevel level, ActionStatus status, ActionType action, DataType dataType,
                             MessageArgs args) {
        String message = Messages.action(status, action, dataType, args);
        emit(level, message, null, null);
        return message;
    }

    /**
     * Logs a data message with {@code error} at error level.
     *
     * @return the same value as {@link #logError(String, Throwable)}
     */
    default String errorData(DataStatus status, DataType dataType, Throwable error) {
        return logError(Messages.data(status, dataType, null), error);
    }

    /**
     * Logs a failed action with {@code error} at error level.
     *
     * @return the same value as {@link #logError(String, Throwable)}
     */
    default String errorAction(ActionType action, DataType dataType, Throwable error) {
        return logError(Messages.action(ActionStatus.ERROR, action, dataType, null), error);
    }
}
