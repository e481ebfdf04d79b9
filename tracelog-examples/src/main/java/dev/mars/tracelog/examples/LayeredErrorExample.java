package dev.mars.tracelog.examples;

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

import dev.mars.tracelog.api.error.ErrorContext;
import dev.mars.tracelog.api.error.TracedError;
import dev.mars.tracelog.core.ServiceLogger;
import dev.mars.tracelog.core.config.LoggerConfiguration;
import dev.mars.tracelog.core.context.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Shows an error travelling up three layers of a service, each adding its own context frame,
 * and the request log context recording it.
 *
 * <pre>
 * handleRequest  -&gt; "handling request"
 *   validateInput  -&gt; "validating input"
 *     loadConfig     -&gt; "loading config" wrapping the I/O failure
 * </pre>
 *
 * The final error renders as
 * {@code handling request: validating input: loading config: file not found}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-19
 * @version 1.0
 */
public class LayeredErrorExample {

    private static final Logger logger = LoggerFactory.getLogger(LayeredErrorExample.class);

    /**
     * Source of raw configuration text.
     */
    @FunctionalInterface
    public interface ConfigSource {
        String read(String name) throws IOException;
    }

    private final ConfigSource configSource;

    public LayeredErrorExample(ConfigSource configSource) {
        this.configSource = configSource;
    }

    /**
     * Reads configuration from the classpath.
     */
    public static ConfigSource classpath() {
        return name -> {
            try (InputStream is = LayeredErrorExample.class.getResourceAsStream("/" + name)) {
                if (is == null) {
                    throw new FileNotFoundException("file not found");
                }
                return new String(is.readAllBytes(), StandardCharsets.UTF_8);
            }
        };
    }

    /**
     * Outermost layer. Logs the failure against the request and returns it, or returns null when
     * the request succeeded.
     */
    public TracedError handleRequest(LogContext log, String configName) {
        log.requestReceived();
        try {
            String config = validateInput(configName);
            log.addContext("config_length", config.length());
            log.info("configuration accepted");
            return null;
        } catch (TracedError e) {
            TracedError handled = e.wrap(ErrorContext.of("handling request"));
            log.logError("request failed", handled);
            return handled;
        } finally {
            log.requestComplete();
        }
    }

    String validateInput(String configName) {
        String config;
        try {
            config = loadConfig(configName);
        } catch (TracedError e) {
            throw e.wrap(ErrorContext.of("validating input"));
        }
        if (config.isBlank()) {
            throw TracedError.of(ErrorContext.of("config is empty")).wrap(ErrorContext.of("validating input"));
        }
        return config;
    }

    String loadConfig(String configName) {
        try {
            return configSource.read(configName);
        } catch (IOException e) {
            throw TracedError.wrap(e, ErrorContext.of("loading config"));
        }
    }

    public static void main(String[] args) {
        ServiceLogger serviceLogger = ServiceLogger.create(LoggerConfiguration.load("layered-example"));
        LayeredErrorExample example = new LayeredErrorExample(classpath());

        LogContext log = serviceLogger.newLog(null);
        TracedError error = example.handleRequest(log, args.length > 0 ? args[0] : "missing.properties");

        if (error != null) {
            logger.info("Trace with context: {}", error.traceWithContext());
            logger.info("Root with cause:    {}", error.rootWithCause());
        } else {
            logger.info("Request {} succeeded", log.traceId());
        }
    }
}
