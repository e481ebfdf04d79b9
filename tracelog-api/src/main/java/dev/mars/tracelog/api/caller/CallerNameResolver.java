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
package dev.mars.tracelog.api.caller;

/**
 * Resolves the textual identity of the code that called into the logging API.
 * <p>
 * The name is used for the {@code function_name} field of every record and as the caller label
 * of error frames. Implementations must never fail: when no caller can be determined they
 * return an empty string.
 * </p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-12
 * @version 1.0
 */
@FunctionalInterface
public interface CallerNameResolver {

    /**
     * Returns the fully-qualified name ({@code com.example.Type.method}) of the immediate caller
     * of the public logging API.
     *
     * @return the caller name, or an empty string
     */
    String resolveCaller();

    /**
     * A resolver that never attributes anything.
     */
    static CallerNameResolver none() {
        return () -> "";
    }
}
