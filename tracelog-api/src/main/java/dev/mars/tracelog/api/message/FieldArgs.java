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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Key/value arguments rendered as {@code k1=v1, k2=v2}. A key mapped to null renders as the bare
 * key. Insertion order is preserved.
 */
public final class FieldArgs implements MessageArgs {

    private final Map<String, Object> fields;

    private FieldArgs(Map<String, Object> fields) {
        this.fields = fields;
    }

    public static FieldArgs of(Map<String, ?> fields) {
        return new FieldArgs(fields == null ? new LinkedHashMap<>() : new LinkedHashMap<>(fields));
    }

    public static FieldArgs of(String key, Object value) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(key, value);
        return new FieldArgs(fields);
    }

    /**
     * Returns a copy with one more field.
     */
    public FieldArgs and(String key, Object value) {
        Map<String, Object> next = new LinkedHashMap<>(fields);
        next.put(key, value);
        return new FieldArgs(next);
    }

    public Map<String, Object> fields() {
        return Collections.unmodifiableMap(fields);
    }

    @Override
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(entry.getKey());
            if (entry.getValue() != null) {
                sb.append('=').append(entry.getValue());
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return render();
    }
}
