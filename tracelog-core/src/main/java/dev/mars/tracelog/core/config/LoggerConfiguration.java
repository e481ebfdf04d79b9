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
package dev.mars.tracelog.core.config;

import dev.mars.tracelog.api.LogLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Immutable configuration shared by every log context of a service.
 *
 * <p>Properties are resolved in this order, later sources winning:</p>
 * <ol>
 *   <li>{@code /tracelog-default.properties} on the classpath</li>
 *   <li>{@code /tracelog-<profile>.properties} on the classpath, when a profile other than
 *       {@code default} is active</li>
 *   <li>{@code TRACELOG_*} environment variables ({@code TRACELOG_SENSITIVE_HEADERS} becomes
 *       {@code tracelog.sensitive-headers})</li>
 *   <li>{@code tracelog.*} system properties</li>
 * </ol>
 *
 * <p>Headers listed in {@code tracelog.sensitive-headers} are added to the built-in
 * {@code Authorization} and {@code Csrf}; the defaults can never be removed.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-16
 * @version 1.0
 */
public final class LoggerConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(LoggerConfiguration.class);

    public static final String PROFILE = "tracelog.profile";
    public static final String FORMAT = "tracelog.format";
    public static final String LEVEL = "tracelog.level";
    public static final String SENSITIVE_HEADERS = "tracelog.sensitive-headers";
    public static final String REDACTION_MARKER = "tracelog.redaction-marker";

    public static final List<String> DEFAULT_SENSITIVE_HEADERS = List.of("Authorization", "Csrf");
    public static final String DEFAULT_REDACTION_MARKER = "---";

    private static final String DEFAULT_PROFILE = "default";
    private static final String ENV_PREFIX = "TRACELOG_";
    private static final String PROPERTY_PREFIX = "tracelog.";

    private final String serviceName;
    private final String profile;
    private final LogFormat format;
    private final LogLevel minimumLevel;
    private final List<String> sensitiveHeaders;
    private final String redactionMarker;

    private LoggerConfiguration(Builder builder) {
        this.serviceName = builder.serviceName;
        this.profile = builder.profile;
        this.format = builder.format;
        this.minimumLevel = builder.minimumLevel;
        this.sensitiveHeaders = Collections.unmodifiableList(new ArrayList<>(builder.sensitiveHeaders));
        this.redactionMarker = builder.redactionMarker;
    }

    /**
     * Loads the configuration for the active profile, taken from the {@code tracelog.profile}
     * system property or the {@code TRACELOG_PROFILE} environment variable.
     *
     * @throws IllegalStateException if any property is invalid
     */
    public static LoggerConfiguration load(String serviceName) {
        return load(serviceName, getActiveProfile());
    }

    public static LoggerConfiguration load(String serviceName, String profile) {
        String activeProfile = profile == null || profile.isBlank() ? DEFAULT_PROFILE : profile;
        Properties properties = loadProperties(activeProfile);
        LoggerConfiguration configuration = fromProperties(serviceName, activeProfile, properties);
        logger.info("Loaded tracelog configuration for service '{}' with profile: {}", serviceName, activeProfile);
        return configuration;
    }

    /**
     * Builds a configuration from already resolved properties. Missing keys take their defaults.
     *
     * @throws IllegalStateException listing every invalid property
     */
    public static LoggerConfiguration fromProperties(String serviceName, String profile, Properties properties) {
        List<String> errors = new ArrayList<>();
        Builder builder = builder(serviceName).profile(profile);

        String formatValue = properties.getProperty(FORMAT);
        if (formatValue != null && !formatValue.isBlank()) {
            Optional<LogFormat> format = LogFormat.fromString(formatValue);
            if (format.isPresent()) {
                builder.format(format.get());
            } else {
                errors.add("Unsupported log format: " + formatValue);
            }
        }

        String levelValue = properties.getProperty(LEVEL);
        if (levelValue != null && !levelValue.isBlank()) {
            Optional<LogLevel> level = LogLevel.fromString(levelValue);
            if (level.isPresent()) {
                builder.minimumLevel(level.get());
            } else {
                errors.add("Unknown log level: " + levelValue);
            }
        }

        String headers = properties.getProperty(SENSITIVE_HEADERS);
        if (headers != null) {
            Arrays.stream(headers.split(","))
                    .map(String::trim)
                    .filter(h -> !h.isEmpty())
                    .forEach(builder::addSensitiveHeader);
        }

        String marker = properties.getProperty(REDACTION_MARKER);
        if (marker != null) {
            builder.redactionMarker(marker.trim());
        }

        errors.addAll(builder.validate());
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", errors));
        }
        return new LoggerConfiguration(builder);
    }

    public static Builder builder(String serviceName) {
        return new Builder(serviceName);
    }

    private static String getActiveProfile() {
        String fromEnv = System.getenv("TRACELOG_PROFILE");
        return System.getProperty(PROFILE, fromEnv != null ? fromEnv : DEFAULT_PROFILE);
    }

    private static Properties loadProperties(String profile) {
        Properties props = new Properties();

        loadPropertiesFromResource(props, "/tracelog-default.properties");

        if (!DEFAULT_PROFILE.equals(profile)) {
            loadPropertiesFromResource(props, "/tracelog-" + profile + ".properties");
        }

        applyEnvironment(props, System.getenv());

        // System properties last so -D overrides win over the environment
        System.getProperties().forEach((key, value) -> {
            String keyStr = key.toString();
            if (keyStr.startsWith(PROPERTY_PREFIX)) {
                props.setProperty(keyStr, value.toString());
            }
        });

        return props;
    }

    static void applyEnvironment(Properties props, Map<String, String> environment) {
        environment.forEach((key, value) -> {
            if (key.startsWith(ENV_PREFIX)) {
                String propKey = PROPERTY_PREFIX
                        + key.substring(ENV_PREFIX.length()).toLowerCase(Locale.ROOT).replace('_', '-');
                props.setProperty(propKey, value);
            }
        });
    }

    private static void loadPropertiesFromResource(Properties props, String resourcePath) {
        try (InputStream is = LoggerConfiguration.class.getResourceAsStream(resourcePath)) {
            if (is != null) {
                props.load(is);
                logger.debug("Loaded properties from: {}", resourcePath);
            } else {
                logger.debug("Properties file not found: {}", resourcePath);
            }
        } catch (IOException e) {
            logger.warn("Failed to load properties from: {}", resourcePath, e);
        }
    }

    public String getServiceName() { return serviceName; }
    public String getProfile() { return profile; }
    public LogFormat getFormat() { return format; }
    public LogLevel getMinimumLevel() { return minimumLevel; }
    public List<String> getSensitiveHeaders() { return sensitiveHeaders; }
    public String getRedactionMarker() { return redactionMarker; }

    @Override
    public String toString() {
        return "LoggerConfiguration{" +
                "serviceName='" + serviceName + '\'' +
                ", profile='" + profile + '\'' +
                ", format=" + format +
                ", minimumLevel=" + minimumLevel +
                ", sensitiveHeaders=" + sensitiveHeaders +
                ", redactionMarker='" + redactionMarker + '\'' +
                '}';
    }

    /**
     * Builder for programmatic configuration.
     */
    public static final class Builder {
        private final String serviceName;
        private String profile = DEFAULT_PROFILE;
        private LogFormat format = LogFormat.JSON;
        private LogLevel minimumLevel = LogLevel.INFO;
        private final List<String> sensitiveHeaders = new ArrayList<>(DEFAULT_SENSITIVE_HEADERS);
        private String redactionMarker = DEFAULT_REDACTION_MARKER;

        private Builder(String serviceName) {
            this.serviceName = serviceName;
        }

        public Builder profile(String profile) {
            this.profile = profile;
            return this;
        }

        public Builder format(LogFormat format) {
            this.format = Objects.requireNonNull(format, "format");
            return this;
        }

        public Builder minimumLevel(LogLevel minimumLevel) {
            this.minimumLevel = Objects.requireNonNull(minimumLevel, "minimumLevel");
            return this;
        }

        public Builder addSensitiveHeader(String header) {
            boolean present = sensitiveHeaders.stream().anyMatch(h -> h.equalsIgnoreCase(header));
            if (!present) {
                sensitiveHeaders.add(header);
            }
            return this;
        }

        public Builder redactionMarker(String redactionMarker) {
            this.redactionMarker = redactionMarker;
            return this;
        }

        /**
         * @throws IllegalStateException if the service name or redaction marker is missing
         */
        public LoggerConfiguration build() {
            List<String> errors = validate();
            if (!errors.isEmpty()) {
                throw new IllegalStateException("Configuration validation failed: " + String.join(", ", errors));
            }
            return new LoggerConfiguration(this);
        }

        private List<String> validate() {
            List<String> errors = new ArrayList<>();
            if (serviceName == null || serviceName.isBlank()) {
                errors.add("Service name is required");
            }
            if (redactionMarker == null || redactionMarker.isEmpty()) {
                errors.add("Redaction marker must not be empty");
            }
            if (profile == null || profile.isBlank()) {
                errors.add("Profile is required");
            }
            return errors;
        }
    }
}
