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

import java.util.List;

/**
 * A list of values rendered as {@code a, b, c}.
 */
public final class ListArgs implements MessageArgs {

    private final List<String> values;

    private ListArgs(List<String> values) {
        this.values = values;
    }

    public static ListArgs of(String... values) {
        return new ListArgs(List.of(values));
    }

    public static ListArgs of(List<String> values) {
        return new ListArgs(values == null ? List.of() : List.copyOf(values));
    }

    @Override
    public String render() {
        return String.join(", ", values);
    }

    @Override
    public String toString() {
        return render();
    }
}
