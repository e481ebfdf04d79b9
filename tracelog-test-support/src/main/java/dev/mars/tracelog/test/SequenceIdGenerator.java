package dev.mars.tracelog.test;

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

import dev.mars.tracelog.api.id.IdGenerator;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic {@link IdGenerator} producing {@code prefix-1}, {@code prefix-2}, ...
 */
public class SequenceIdGenerator implements IdGenerator {

    private final String prefix;
    private final AtomicInteger counter = new AtomicInteger();

    public SequenceIdGenerator() {
        this("id");
    }

    public SequenceIdGenerator(String prefix) {
        this.prefix = prefix;
    }

    @Override
    public String newId() {
        return prefix + "-" + counter.incrementAndGet();
    }

    /**
     * @return how many ids have been handed out
     */
    public int issued() {
        return counter.get();
    }
}
