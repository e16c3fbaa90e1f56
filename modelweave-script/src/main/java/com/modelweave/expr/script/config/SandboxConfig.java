/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.script.config;

import java.io.FileInputStream;
import java.io.InputStream;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Settings for the script constraint sandbox.
 *
 * <h2>Configuration sources (in order of precedence)</h2>
 * <ol>
 *   <li>Environment variables ({@code SCRIPT_SANDBOX_*})</li>
 *   <li>Properties file ({@code script-sandbox.properties})</li>
 *   <li>Builder defaults</li>
 * </ol>
 *
 * <h2>Environment variables</h2>
 * <pre>
 * SCRIPT_SANDBOX_ENABLED=true
 * SCRIPT_SANDBOX_TIMEOUT_MILLIS=2000
 * SCRIPT_SANDBOX_MAX_STATEMENTS=100000
 * SCRIPT_SANDBOX_ECMASCRIPT_VERSION=2021
 * </pre>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * SandboxConfig config = SandboxConfig.loadDefault();
 *
 * SandboxConfig strict = SandboxConfig.builder()
 *     .timeoutMillis(500)
 *     .maxStatements(10_000)
 *     .build();
 * }</pre>
 */
public final class SandboxConfig {
    private static final Logger logger = Logger.getLogger(SandboxConfig.class.getName());

    public static final String DEFAULT_PROPERTIES = "script-sandbox.properties";

    private static final String ENV_ENABLED = "SCRIPT_SANDBOX_ENABLED";
    private static final String ENV_TIMEOUT_MILLIS = "SCRIPT_SANDBOX_TIMEOUT_MILLIS";
    private static final String ENV_MAX_STATEMENTS = "SCRIPT_SANDBOX_MAX_STATEMENTS";
    private static final String ENV_ECMASCRIPT_VERSION = "SCRIPT_SANDBOX_ECMASCRIPT_VERSION";

    private final boolean enabled;
    private final long timeoutMillis;
    private final long maxStatements;
    private final String ecmascriptVersion;

    private SandboxConfig(Builder builder) {
        this.enabled = builder.enabled;
        this.timeoutMillis = builder.timeoutMillis;
        this.maxStatements = builder.maxStatements;
        this.ecmascriptVersion = builder.ecmascriptVersion;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    public long getMaxStatements() {
        return maxStatements;
    }

    public String getEcmascriptVersion() {
        return ecmascriptVersion;
    }

    /**
     * Defaults plus environment overrides, without reading any file.
     */
    public static SandboxConfig fromEnvironment() {
        return builder().build();
    }

    public static SandboxConfig loadDefault() {
        return loadFromProperties(DEFAULT_PROPERTIES);
    }

    /**
     * Load configuration from a properties file, searched on the classpath
     * first and then on the file system. Environment variables override the
     * file's values.
     */
    public static SandboxConfig loadFromProperties(String propertiesPath) {
        logger.info("Loading sandbox configuration from: " + propertiesPath);

        Properties props = new Properties();

        try (InputStream is = SandboxConfig.class.getClassLoader().getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded " + props.size() + " properties from classpath: " + propertiesPath);
            }
        } catch (Exception e) {
            logger.fine("Could not load from classpath: " + propertiesPath);
        }

        if (props.isEmpty()) {
            try (FileInputStream fis = new FileInputStream(propertiesPath)) {
                props.load(fis);
                logger.info("Loaded " + props.size() + " properties from file: " + propertiesPath);
            } catch (Exception e) {
                logger.warning("Could not load properties file: " + propertiesPath + ". Using defaults.");
            }
        }

        return builderFromProperties(props).applyEnvironmentVariables().build();
    }

    private static Builder builderFromProperties(Properties props) {
        Builder builder = new Builder();

        String enabled = props.getProperty("sandbox.enabled");
        if (enabled != null) {
            builder.enabled(parseBoolean(enabled));
        }
        parseLong("sandbox.timeout.millis", props.getProperty("sandbox.timeout.millis"))
                .ifPresent(builder::timeoutMillis);
        parseLong("sandbox.max.statements", props.getProperty("sandbox.max.statements"))
                .ifPresent(builder::maxStatements);
        String version = props.getProperty("sandbox.ecmascript.version");
        if (version != null && !version.isBlank()) {
            builder.ecmascriptVersion(version.trim());
        }
        return builder;
    }

    /**
     * Builder with environment overrides already applied. Values set on the
     * builder afterwards win over the environment.
     */
    public static Builder builder() {
        return new Builder().applyEnvironmentVariables();
    }

    public Builder toBuilder() {
        return new Builder()
                .enabled(enabled)
                .timeoutMillis(timeoutMillis)
                .maxStatements(maxStatements)
                .ecmascriptVersion(ecmascriptVersion);
    }

    @Override
    public String toString() {
        return "SandboxConfig{enabled=" + enabled
                + ", timeoutMillis=" + timeoutMillis
                + ", maxStatements=" + maxStatements
                + ", ecmascriptVersion=" + ecmascriptVersion + "}";
    }

    private static boolean parseBoolean(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return "true".equals(normalized) || "1".equals(normalized) || "yes".equals(normalized);
    }

    private static Optional<Long> parseLong(String key, String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            logger.warning("Invalid long value for " + key + ": " + value);
            return Optional.empty();
        }
    }

    public static final class Builder {
        private boolean enabled = true;
        private long timeoutMillis = 2_000;
        private long maxStatements = 100_000;
        private String ecmascriptVersion = "2021";

        private Builder() {
        }

        private Builder applyEnvironmentVariables() {
            getEnv(ENV_ENABLED).ifPresent(val -> this.enabled = parseBoolean(val));
            getEnv(ENV_TIMEOUT_MILLIS).flatMap(val -> parseLong(ENV_TIMEOUT_MILLIS, val))
                    .ifPresent(val -> this.timeoutMillis = val);
            getEnv(ENV_MAX_STATEMENTS).flatMap(val -> parseLong(ENV_MAX_STATEMENTS, val))
                    .ifPresent(val -> this.maxStatements = val);
            getEnv(ENV_ECMASCRIPT_VERSION).ifPresent(val -> this.ecmascriptVersion = val.trim());
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder timeoutMillis(long timeoutMillis) {
            this.timeoutMillis = timeoutMillis;
            return this;
        }

        public Builder maxStatements(long maxStatements) {
            this.maxStatements = maxStatements;
            return this;
        }

        public Builder ecmascriptVersion(String ecmascriptVersion) {
            this.ecmascriptVersion = ecmascriptVersion;
            return this;
        }

        public SandboxConfig build() {
            if (timeoutMillis <= 0) {
                throw new IllegalArgumentException("timeoutMillis must be positive, got: " + timeoutMillis);
            }
            if (maxStatements <= 0) {
                throw new IllegalArgumentException("maxStatements must be positive, got: " + maxStatements);
            }
            if (ecmascriptVersion == null || ecmascriptVersion.isBlank()) {
                throw new IllegalArgumentException("ecmascriptVersion must not be blank");
            }
            return new SandboxConfig(this);
        }

        private static Optional<String> getEnv(String key) {
            String value = System.getenv(key);
            if (value != null && !value.isBlank()) {
                logger.fine("Environment override " + key + "=" + value);
                return Optional.of(value);
            }
            return Optional.empty();
        }
    }
}
