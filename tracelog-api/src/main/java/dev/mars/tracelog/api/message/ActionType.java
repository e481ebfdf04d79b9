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
 * The action a message refers to, phrased as a present participle ("finding", "saving").
 * Services define their own actions with {@link #of(String)}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-13
 * @version 1.0
 */
public final class ActionType {

    // Request/response
    public static final ActionType MAKE = new ActionType("making");
    public static final ActionType READ = new ActionType("reading");

    // Encoding
    public static final ActionType MARSHAL = new ActionType("marshalling");
    public static final ActionType UNMARSHAL = new ActionType("unmarshalling");
    public static final ActionType VALIDATE = new ActionType("validating");
    public static final ActionType CAST = new ActionType("casting to");

    // Operations
    public static final ActionType GET = new ActionType("getting");
    public static final ActionType CREATE = new ActionType("creating");
    public static final ActionType UPDATE = new ActionType("updating");
    public static final ActionType DELETE = new ActionType("deleting");

    // Storage
    public static final ActionType FIND = new ActionType("finding");
    public static final ActionType INSERT = new ActionType("inserting");
    public static final ActionType REPLACE = new ActionType("replacing");
    public static final ActionType SAVE = new ActionType("saving");
    public static final ActionType COUNT = new ActionType("counting");

    private final String name;

    private ActionType(String name) {
        this.name = name;
    }

    public static ActionType of(String name) {
        return new ActionType(Objects.requireNonNull(name, "name"));
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
        return name.equals(((ActionType) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}
