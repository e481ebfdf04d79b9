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
package dev.mars.tracelog.api.id;

import java.util.UUID;

/**
 * Generates random (version 4) UUIDs in their canonical 36 character form.
 */
public final class UuidIdGenerator implements IdGenerator {

    private static final UuidIdGenerator INSTANCE = new UuidIdGenerator();

    private UuidIdGenerator() {
    }

    public static UuidIdGenerator getInstance() {
        return INSTANCE;
    }

    @Override
    public String newId() {
        return UUID.randomUUID().toString();
    }
}
