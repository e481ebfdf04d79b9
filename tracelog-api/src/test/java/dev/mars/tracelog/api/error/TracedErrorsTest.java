package dev.mars.tracelog.api.error;

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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("core")
@DisplayName("Null-safe Traced Error Helper Tests")
class TracedErrorsTest {

    @Test
    @DisplayName("Every renderer returns an empty string for an absent error")
    void testRenderersOnNull() {
        assertEquals("", TracedErrors.root(null));
        assertEquals("", TracedErrors.rootWithCause(null));
        assertEquals("", TracedErrors.trace(null));
        assertEquals("", TracedErrors.traceWithContext(null));
    }

    @Test
    @DisplayName("Tag queries on an absent error report false and no tags")
    void testTagsOnNull() {
        assertFalse(TracedErrors.hasTag((TracedError) null, "not-found"));
        assertFalse(TracedErrors.hasTag((Throwable) null, "not-found"));
        assertTrue(TracedErrors.tags(null).isEmpty());
    }

    @Test
    @DisplayName("Tag query on a foreign throwable reports false")
    void testTagOnForeignThrowable() {
        Throwable error = new IllegalArgumentException("bad");

        assertFalse(TracedErrors.hasTag(error, "bad"));
    }

    @Test
    @DisplayName("Tag query on a traced error seen as Throwable dispatches to it")
    void testTagOnTracedThrowable() {
        Throwable error = TracedError.of(ErrorContext.of("missing")).addTag("not-found");

        assertTrue(TracedErrors.hasTag(error, "not-found"));
    }

    @Test
    @DisplayName("Wrapping an absent error starts a new one")
    void testWrapNull() {
        TracedError error = TracedErrors.wrap(null, ErrorContext.of("first"));

        assertEquals("first", error.root());
        assertEquals("second: first", TracedErrors.wrap(error, ErrorContext.of("second")).trace());
    }

    @Test
    @DisplayName("Describe renders traced, plain and message-less throwables")
    void testDescribe() {
        assertEquals("", TracedErrors.describe(null));
        assertEquals("plain", TracedErrors.describe(new RuntimeException("plain")));
        assertEquals("java.lang.IllegalStateException", TracedErrors.describe(new IllegalStateException()));
        assertEquals("outer: inner",
                TracedErrors.describe(TracedError.of(ErrorContext.of("inner")).wrap(ErrorContext.of("outer"))));
    }
}
