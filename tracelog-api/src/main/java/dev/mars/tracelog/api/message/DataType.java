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

import java.util.Objects;

/**
 * The kind of data a message refers to. Services define their own types with {@link #of(String)};
 * the constants cover the request/response plumbing every service shares.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-13
 * @version 1.0
 */
public final class DataType {

    public static final DataType REQUEST = new DataType("request");
    public static final DataType REQUEST_BODY = new DataType("request body");
    public static final DataType RESPONSE = new DataType("response");
    public static final DataType RESPONSE_BODY = new DataType("response body");
    public static final DataType QUERY_PARAM = new DataType("query param");
    public static final DataType ARG = new DataType("arg");

    private final String name;

    private DataType(String name) {
        this.name = name;
    }

    public static DataType of(String name) {
        return new DataType(Objects.requireNonNull(name, "name"));
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return name.equals(((DataType) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}
