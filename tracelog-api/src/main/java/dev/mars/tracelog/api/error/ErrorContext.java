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

/**
 * One frame of explanation attached to an error at one layer of the call stack.
 *
 * @param message     Human-readable description of what the layer was doing
 * @param callerLabel Fully-qualified name of the function that added the frame, or empty
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-12
 * @version 1.0
 */
public record ErrorContext(String message, String callerLabel) {

    public ErrorContext {
        message = message == null ? "" : message;
        callerLabel = callerLabel == null ? "" : callerLabel;
    }

    /**
     * Creates a context without a caller label.
     */
    public static ErrorContext of(String message) {
        return new ErrorContext(message, "");
    }

    /**
     * Creates a context attributed to the given caller.
     */
    public static ErrorContext of(String message, String callerLabel) {
        return new ErrorContext(message, callerLabel);
    }

    /**
     * @return true if this context carries no message and therefore adds nothing to a trace
     */
    public boolean isEmpty() {
        return message.isEmpty();
    }

    public boolean hasCallerLabel() {
        return !callerLabel.isEmpty();
    }

    /**
     * Renders the frame as {@code label() message}, or just the message when unlabelled.
     */
    @Override
    public String toString() {
        if (hasCallerLabel()) {
            return callerLabel + "() " + message;
        }
        return message;
    }
}
