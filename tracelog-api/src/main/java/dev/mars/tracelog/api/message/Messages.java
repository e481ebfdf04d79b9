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
package dev.mars.tracelog.api.message;

import org.slf4j.helpers.MessageFormatter;

/**
 * Builds the standard wording for data and action messages so every service describes the same
 * situation the same way.
 *
 * <pre>{@code
 * Messages.data(DataStatus.MISSING, DataType.QUERY_PARAM, StringArgs.of("id"));
 * // "Missing query param: id"
 *
 * Messages.action(ActionStatus.ERROR, ActionType.FIND, DataType.of("user"), FieldArgs.of("id", 7));
 * // "Error finding user for id=7"
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-13
 * @version 1.0
 */
public final class Messages {

    private Messages() {
        // Utility class - prevent instantiation
    }

    /**
     * Generates a message for a data element.
     *
     * @param status   the status of the data
     * @param dataType the data type
     * @param args     arguments to include, or null if none
     * @return {@code "<status> <type>"}, followed by {@code ": <args>"} when args render non-empty
     */
    public static String data(DataStatus status, DataType dataType, MessageArgs args) {
        String argStr = render(args);
        if (!argStr.isEmpty()) {
            argStr = ": " + argStr;
        }
        return status + " " + dataType + argStr;
    }

    /**
     * Generates a message for an action.
     *
     * @param status   the status of the action
     * @param action   the action that is occurring
     * @param dataType the data type the action is occurring on
     * @param args     arguments to include, or null if none
     * @return {@code "<status> <action> <type>"}, followed by {@code " for <args>"} when args render non-empty
     */
    public static String action(ActionStatus status, ActionType action, DataType dataType, MessageArgs args) {
        String argStr = render(args);
        if (!argStr.isEmpty()) {
            argStr = " for " + argStr;
        }
        return status + " " + action + " " + dataType + argStr;
    }

    /**
     * Substitutes SLF4J style {@code {}} placeholders, so formatted messages read the same as the
     * rest of the service's logging.
     */
    public static String format(String pattern, Object... args) {
        if (pattern == null) {
            return "";
        }
        if (args == null || args.length == 0) {
            return pattern;
        }
        return MessageFormatter.arrayFormat(pattern, args).getMessage();
    }

    private static String render(MessageArgs args) {
        if (args == null) {
            return "";
        }
        String rendered = args.render();
        return rendered == null ? "" : rendered;
    }
}
