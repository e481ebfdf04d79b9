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

/**
 * Thrown by {@link LogContext#addContext(String, Object)} when the key is already present.
 * The stored value is left unchanged.
 */
public class DuplicateContextKeyException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String key;

    public DuplicateContextKeyException(String key) {
        super("error adding context: " + key + " already exists");
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
