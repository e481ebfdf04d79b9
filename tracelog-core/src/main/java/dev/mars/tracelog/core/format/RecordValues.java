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
package dev.mars.tracelog.core.format;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.tracelog.api.error.TracedErrors;

import java.io.IOException;

/**
 * Converts arbitrary field values into JSON trees. Throwables render as their one-line
 * description wherever they appear, including inside maps and collections, and values Jackson cannot serialise fall back to {@link String#valueOf(Object)}.
 */
final class RecordValues {

    private RecordValues() {
        // Utility class - prevent instantiation
    }

    static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        SimpleModule errors = new SimpleModule("tracelog-errors");
        errors.addSerializer(Throwable.class, new ThrowableSerializer());
        mapper.registerModule(errors);
        return mapper;
    }

    static JsonNode toTree(ObjectMapper mapper, Object value) {
        if (value == null) {
            return NullNode.getInstance();
        }
        if (value instanceof Throwable) {
            return TextNode.valueOf(TracedErrors.describe((Throwable) value));
        }
        try {
            return mapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            return TextNode.valueOf(String.valueOf(value));
        }
    }

    static final class ThrowableSerializer extends StdSerializer<Throwable> {

        private static final long serialVersionUID = 1L;

        ThrowableSerializer() {
            super(Throwable.class);
        }

        @Override
        public void serialize(Throwable value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(TracedErrors.describe(value));
        }
    }
}
