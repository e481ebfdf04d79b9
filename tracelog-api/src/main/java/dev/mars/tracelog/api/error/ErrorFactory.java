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
package dev.mars.tracelog.api.error;

import dev.mars.tracelog.api.caller.CallerNameResolver;
import dev.mars.tracelog.api.caller.LoggingFacade;
import dev.mars.tracelog.api.caller.StackWalkerCallerNameResolver;
import dev.mars.tracelog.api.message.ActionStatus;
import dev.mars.tracelog.api.message.ActionType;
import dev.mars.tracelog.api.message.DataStatus;
import dev.mars.tracelog.api.message.DataType;
import dev.mars.tracelog.api.message.MessageArgs;
import dev.mars.tracelog.api.message.Messages;

import java.util.Locale;
import java.util.Objects;

/**
 * Creates traced errors whose frames are attributed to the calling function.
 * <p>
 * Every message is lower-cased so error chains read as one sentence when rendered. The caller
 * label of each frame is the method that called into the factory, as reported by the configured
 * {@link CallerNameResolver}.
 * </p>
 *
 * <pre>{@code
 * ErrorFactory errors = ErrorFactory.defaults();
 *
 * try {
 *     return repository.load(id);
 * } catch (IOException e) {
 *     throw errors.wrapErrorAction(ActionType.FIND, DataType.of("user"), FieldArgs.of("id", id), e);
 * }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-13
 * @version 1.0
 */
@LoggingFacade
public final class ErrorFactory {

    private static final ErrorFactory DEFAULT = new ErrorFactory(StackWalkerCallerNameResolver.getInstance());

    private final CallerNameResolver callerNameResolver;

    public ErrorFactory(CallerNameResolver callerNameResolver) {
        this.callerNameResolver = Objects.requireNonNull(callerNameResolver, "callerNameResolver");
    }

    /**
     * @return a factory that labels frames using stack inspection
     */
    public static ErrorFactory defaults() {
        return DEFAULT;
    }

    public TracedError newError(String message) {
        return TracedError.of(context(lower(message)));
    }

    public TracedError newError(String format, Object... args) {
        return TracedError.of(context(formatLowered(format, args)));
    }

    public TracedError wrapError(String message, Throwable cause) {
        return TracedError.wrap(cause, context(lower(message)));
    }

    public TracedError wrapError(String format, Throwable cause, Object... args) {
        return TracedError.wrap(cause, context(formatLowered(format, args)));
    }

    /**
     * Creates an error for a data element.
     *
     * @param status   the status of the data
     * @param dataType the data type the error concerns
     * @param args     arguments to include, or null if none
     */
    public TracedError errorData(DataStatus status, DataType dataType, MessageArgs args) {
        return TracedError.of(context(lower(Messages.data(status, dataType, args))));
    }

    /**
     * Wraps {@code cause} with a frame describing a data element.
     */
    public TracedError wrapErrorData(DataStatus status, DataType dataType, MessageArgs args, Throwable cause) {
        return TracedError.wrap(cause, context(lower(Messages.data(status, dataType, args))));
    }

    /**
     * Creates an error for a failed action.
     *
     * @param action   the action that was occurring
     * @param dataType the data type the action was occurring on
     * @param args     arguments to include, or null if none
     */
    public TracedError errorAction(ActionType action, DataType dataType, MessageArgs args) {
        return TracedError.of(context(lower(Messages.action(ActionStatus.ERROR, action, dataType, args))));
    }

    /**
     * Wraps {@code cause} with a frame describing the failed action.
     */
    public TracedError wrapErrorAction(ActionType action, DataType dataType, MessageArgs args, Throwable cause) {
        return TracedError.wrap(cause, context(lower(Messages.action(ActionStatus.ERROR, action, dataType, args))));
    }

    private ErrorContext context(String message) {
        return ErrorContext.of(message, callerNameResolver.resolveCaller());
    }

    private static String lower(String message) {
        return message == null ? "" : message.toLowerCase(Locale.ROOT);
    }

    // Arguments keep their case, only the pattern is lowered
    private static String formatLowered(String format, Object... args) {
        return Messages.format(lower(format), args);
    }
}
