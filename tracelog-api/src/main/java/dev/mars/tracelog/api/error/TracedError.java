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
package dev.mars.tracelog.api.error;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An error that accumulates context frames as it is passed up through the layers of a service.
 *
 * <p>A traced error carries:</p>
 * <ul>
 *   <li>the <b>root</b> context, the first non-empty frame ever attached (never replaced)</li>
 *   <li>an optional <b>cause</b>, the external failure being wrapped</li>
 *   <li>the ordered <b>trace</b> of every frame, oldest first</li>
 *   <li><b>tags</b> used to classify the error without matching on message text</li>
 * </ul>
 *
 * <p>Instances are immutable. {@link #wrap(ErrorContext)} and {@link #addTag(String)} return new
 * values, so an error handed to several recovery paths cannot be altered by any one of them.
 * Every copy carries the stack trace of the first traced error in the chain.</p>
 *
 * <p>{@link #getMessage()} renders {@link #traceWithContext()}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-12
 * @version 1.0
 */
public final class TracedError extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorContext root;
    private final List<ErrorContext> trace;
    private final List<String> tags;

    private TracedError(ErrorContext root, Throwable cause, List<ErrorContext> trace, List<String> tags,
                        StackTraceElement[] origin) {
        super(null, cause, true, true);
        this.root = root;
        this.trace = Collections.unmodifiableList(trace);
        this.tags = Collections.unmodifiableList(tags);
        if (origin != null) {
            setStackTrace(origin);
        }
    }

    /**
     * Creates an error with no root, cause or frames. All renderers return an empty string.
     */
    public static TracedError empty() {
        return new TracedError(null, null, new ArrayList<>(), new ArrayList<>(), null);
    }

    /**
     * Creates an error whose root is the given context.
     */
    public static TracedError of(ErrorContext context) {
        return empty().wrap(context);
    }

    /**
     * Wraps an arbitrary failure with a context frame.
     * <p>
     * A {@code TracedError} is wrapped directly so traced errors never nest. Any other throwable
     * becomes the cause of a new traced error rooted at {@code context}.
     * </p>
     *
     * @param cause   the failure to wrap, may be null
     * @param context the frame describing the current layer
     * @return a new traced error
     */
    public static TracedError wrap(Throwable cause, ErrorContext context) {
        if (cause instanceof TracedError) {
            return ((TracedError) cause).wrap(context);
        }
        TracedError base = new TracedError(null, cause, new ArrayList<>(), new ArrayList<>(), null);
        return base.wrap(context);
    }

    /**
     * Returns a copy with {@code context} appended to the trace. The root is set to
     * {@code context} only if this error has no root yet. An empty or null context yields an
     * unchanged copy.
     */
    public TracedError wrap(ErrorContext context) {
        List<ErrorContext> nextTrace = new ArrayList<>(trace);
        ErrorContext nextRoot = root;
        if (context != null && !context.isEmpty()) {
            if (nextRoot == null) {
                nextRoot = context;
            }
            nextTrace.add(context);
        }
        return new TracedError(nextRoot, getCause(), nextTrace, new ArrayList<>(tags), getStackTrace());
    }

    /**
     * Returns a copy with {@code tag} appended. Duplicates are kept; check {@link #hasTag(String)}
     * first when set semantics are needed.
     */
    public TracedError addTag(String tag) {
        List<String> nextTags = new ArrayList<>(tags);
        nextTags.add(tag);
        return new TracedError(root, getCause(), new ArrayList<>(trace), nextTags, getStackTrace());
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }

    public List<String> getTags() {
        return tags;
    }

    /**
     * @return every frame in the order it was added, oldest first
     */
    public List<ErrorContext> getTrace() {
        return trace;
    }

    /**
     * @return the root context, or null if no non-empty context was ever attached
     */
    public ErrorContext getRootContext() {
        return root;
    }

    /**
     * @return the message of the root context
     */
    public String root() {
        if (root == null) {
            return "";
        }
        return root.message();
    }

    /**
     * @return the root message followed by the cause's message, when a cause is attached
     */
    public String rootWithCause() {
        if (root == null) {
            return "";
        }
        return appendCause(root.message());
    }

    /**
     * Folds the trace from the root outwards: the most recent frame is leftmost and the root
     * rightmost, each joined by {@code ": "}.
     */
    public String trace() {
        if (root == null) {
            return "";
        }
        String rendered = root.message();
        for (int i = 1; i < trace.size(); i++) {
            rendered = trace.get(i).message() + ": " + rendered;
        }
        return rendered;
    }

    /**
     * Same fold as {@link #trace()} but starting from the labelled root and its cause. Labelled
     * frames render as {@code label() message: [rest]}.
     */
    public String traceWithContext() {
        if (root == null) {
            return "";
        }
        String rendered = appendCause(root.toString());
        for (int i = 1; i < trace.size(); i++) {
            ErrorContext frame = trace.get(i);
            if (frame.hasCallerLabel()) {
                rendered = frame + ": [" + rendered + "]";
            } else {
                rendered = frame.message() + ": " + rendered;
            }
        }
        return rendered;
    }

    @Override
    public String getMessage() {
        return traceWithContext();
    }

    private String appendCause(String rendered) {
        Throwable cause = getCause();
        if (cause == null) {
            return rendered;
        }
        return rendered + ": " + TracedErrors.describe(cause);
    }

    @Override
    public String toString() {
        return "TracedError{root='" + root() + "', frames=" + trace.size() + ", tags=" + tags
                + ", cause=" + (getCause() != null ? getCause().getClass().getName() : "none") + "}";
    }
}
