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

import java.util.List;

/**
 * Null-safe helpers over {@link TracedError}.
 * <p>
 * Upstream code frequently renders errors that may not exist. Every method here accepts a null
 * error and degrades to an empty result instead of failing.
 * </p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-12
 * @version 1.0
 */
public final class TracedErrors {

    private TracedErrors() {
        // Utility class - prevent instantiation
    }

    /**
     * Wraps a possibly absent error with a new frame.
     *
     * @param error   the existing traced error, or null
     * @param context the frame to append
     * @return a new traced error; never null
     */
    public static TracedError wrap(TracedError error, ErrorContext context) {
        if (error == null) {
            return TracedError.of(context);
        }
        return error.wrap(context);
    }

    public static String root(TracedError error) {
        return error == null ? "" : error.root();
    }

    public static String rootWithCause(TracedError error) {
        return error == null ? "" : error.rootWithCause();
    }

    public static String trace(TracedError error) {
        return error == null ? "" : error.trace();
    }

    public static String traceWithContext(TracedError error) {
        return error == null ? "" : error.traceWithContext();
    }

    public static boolean hasTag(TracedError error, String tag) {
        return error != null && error.hasTag(tag);
    }

    public static List<String> tags(TracedError error) {
        return error == null ? List.of() : error.getTags();
    }

    /**
     * Returns true if {@code error} is a traced error carrying {@code tag}. Any other throwable,
     * or null, reports false.
     */
    public static boolean hasTag(Throwable error, String tag) {
        return error instanceof TracedError && ((TracedError) error).hasTag(tag);
    }

    /**
     * Describes any throwable as a single line: the labelled trace of a traced error, otherwise the
     * throwable's message, falling back to {@link Throwable#toString()} when it has none.
     *
     * @param error the error to describe, may be null
     * @return the description, or an empty string for null
     */
    public static String describe(Throwable error) {
        if (error == null) {
            return "";
        }
        if (error instanceof TracedError) {
            return ((TracedError) error).traceWithContext();
        }
        String message = error.getMessage();
        return message != null ? message : error.toString();
    }
}
