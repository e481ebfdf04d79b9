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

import java.util.Optional;

/**
 * {@link CallerNameResolver} backed by {@link StackWalker}.
 * <p>
 * The walk skips this class and every class annotated with {@link LoggingFacade}, then reports
 * the first remaining frame as {@code declaringClass.method}. There is no depth offset to tune:
 * adding another internal hop inside an annotated class does not change the result.
 * </p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-12
 * @version 1.0
 */
@LoggingFacade
public final class StackWalkerCallerNameResolver implements CallerNameResolver {

    private static final StackWalker WALKER = StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);

    private static final StackWalkerCallerNameResolver INSTANCE = new StackWalkerCallerNameResolver();

    private static final ClassValue<Boolean> FACADE_CLASSES = new ClassValue<>() {
        @Override
        protected Boolean computeValue(Class<?> type) {
            for (Class<?> c = type; c != null; c = c.getEnclosingClass()) {
                if (c.isAnnotationPresent(LoggingFacade.class)) {
                    return true;
                }
            }
            return false;
        }
    };

    private StackWalkerCallerNameResolver() {
    }

    public static StackWalkerCallerNameResolver getInstance() {
        return INSTANCE;
    }

    @Override
    public String resolveCaller() {
        Optional<String> caller = WALKER.walk(frames -> frames
                .filter(frame -> !FACADE_CLASSES.get(frame.getDeclaringClass()))
                .map(frame -> frame.getClassName() + "." + frame.getMethodName())
                .findFirst());
        return caller.orElse("");
    }
}
