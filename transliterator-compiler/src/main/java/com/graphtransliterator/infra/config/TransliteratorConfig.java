/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.infra.config;

import com.graphtransliterator.api.TransliteratorVersion;

import java.io.FileInputStream;
import java.io.InputStream;
import java.util.Optional;
import java.util.Properties;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Options applied when a transliterator is compiled.
 *
 * <p><b>Environment Variable Override:</b>
 * Every property can be overridden via environment variables:
 * <pre>
 * TRANSLITERATOR_CHECK_AMBIGUITY=false
 * TRANSLITERATOR_IGNORE_ERRORS=true
 * TRANSLITERATOR_VERSION=1.0.0
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * // Defaults with env override
 * TransliteratorConfig config = TransliteratorConfig.builder().build();
 *
 * // Lenient config for noisy input
 * TransliteratorConfig config = TransliteratorConfig.builder()
 *     .ignoreErrors(true)
 *     .build();
 *
 * // From transliterator.properties on the classpath
 * TransliteratorConfig config = TransliteratorConfig.loadDefault();
 * }</pre>
 */
public final class TransliteratorConfig {
    private static final Logger logger = Logger.getLogger(TransliteratorConfig.class.getName());

    // ========================================================================
    // PROPERTY AND ENVIRONMENT VARIABLE KEYS
    // ========================================================================

    public static final String DEFAULT_PROPERTIES = "transliterator.properties";

    static final String PROP_CHECK_AMBIGUITY = "transliterator.check.ambiguity";
    static final String PROP_IGNORE_ERRORS = "transliterator.ignore.errors";
    static final String PROP_VERSION = "transliterator.version";

    static final String ENV_CHECK_AMBIGUITY = "TRANSLITERATOR_CHECK_AMBIGUITY";
    static final String ENV_IGNORE_ERRORS = "TRANSLITERATOR_IGNORE_ERRORS";
    static final String ENV_VERSION = "TRANSLITERATOR_VERSION";

    // ========================================================================
    // CONFIGURATION FIELDS
    // ========================================================================

    private final boolean checkAmbiguity;
    private final boolean ignoreErrors;
    private final String version;

    private TransliteratorConfig(Builder builder) {
        this.checkAmbiguity = builder.checkAmbiguity;
        this.ignoreErrors = builder.ignoreErrors;
        this.version = builder.version;
        validate();
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    /**
     * Defaults: ambiguity checked, errors raised, current version.
     * Environment variables are not consulted.
     */
    public static TransliteratorConfig defaults() {
        return new Builder(key -> null).build();
    }

    /**
     * Create configuration from environment variables only.
     */
    public static TransliteratorConfig fromEnvironment() {
        return builder().build();
    }

    /**
     * Load configuration from {@value #DEFAULT_PROPERTIES}.
     */
    public static TransliteratorConfig loadDefault() {
        return loadFromProperties(DEFAULT_PROPERTIES);
    }

    /**
     * Load configuration from a properties file, looked up on the classpath first
     * and then on the file system. Falls back to defaults if neither is found.
     *
     * <p>Environment variables override properties file values.
     *
     * <p><b>Example transliterator.properties:</b>
     * <pre>
     * transliterator.check.ambiguity=true
     * transliterator.ignore.errors=false
     * </pre>
     */
    public static TransliteratorConfig loadFromProperties(String propertiesPath) {
        return loadFromProperties(propertiesPath, System::getenv);
    }

    static TransliteratorConfig loadFromProperties(String propertiesPath, UnaryOperator<String> environment) {
        logger.info("Loading transliterator configuration from: " + propertiesPath);

        Properties props = new Properties();

        // Try classpath first
        try (InputStream is = TransliteratorConfig.class.getClassLoader()
                .getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded " + props.size() + " properties from classpath: " + propertiesPath);
            }
        } catch (Exception e) {
            logger.fine("Could not load from classpath: " + propertiesPath);
        }

        // Try file system if not found in classpath
        if (props.isEmpty()) {
            try (InputStream fis = new FileInputStream(propertiesPath)) {
                props.load(fis);
                logger.info("Loaded " + props.size() + " properties from file: " + propertiesPath);
            } catch (Exception e) {
                logger.warning("Could not load properties file: " + propertiesPath + ". Using defaults.");
            }
        }

        Builder builder = new Builder(environment, false);
        builder.applyProperties(props);
        builder.applyEnvironment();
        return builder.build();
    }

    public static Builder builder() {
        return new Builder(System::getenv);
    }

    public Builder toBuilder() {
        return new Builder(key -> null)
                .checkAmbiguity(checkAmbiguity)
                .ignoreErrors(ignoreErrors)
                .version(version);
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    public boolean checkAmbiguity() {
        return checkAmbiguity;
    }

    public boolean ignoreErrors() {
        return ignoreErrors;
    }

    public String version() {
        return version;
    }

    @Override
    public String toString() {
        return "TransliteratorConfig{checkAmbiguity=" + checkAmbiguity
                + ", ignoreErrors=" + ignoreErrors
                + ", version='" + version + "'}";
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static class Builder {

        private final UnaryOperator<String> environment;

        // Defaults (can be overridden by env vars or builder methods)
        private boolean checkAmbiguity = true;
        private boolean ignoreErrors = false;
        private String version = TransliteratorVersion.CURRENT;

        Builder(UnaryOperator<String> environment) {
            this(environment, true);
        }

        private Builder(UnaryOperator<String> environment, boolean loadEnvironment) {
            this.environment = environment;
            if (loadEnvironment) {
                applyEnvironment();
            }
        }

        public Builder checkAmbiguity(boolean checkAmbiguity) {
            this.checkAmbiguity = checkAmbiguity;
            return this;
        }

        public Builder ignoreErrors(boolean ignoreErrors) {
            this.ignoreErrors = ignoreErrors;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public TransliteratorConfig build() {
            return new TransliteratorConfig(this);
        }

        private void applyProperties(Properties props) {
            parseBoolean(PROP_CHECK_AMBIGUITY, props.getProperty(PROP_CHECK_AMBIGUITY))
                    .ifPresent(val -> this.checkAmbiguity = val);
            parseBoolean(PROP_IGNORE_ERRORS, props.getProperty(PROP_IGNORE_ERRORS))
                    .ifPresent(val -> this.ignoreErrors = val);
            String value = props.getProperty(PROP_VERSION);
            if (value != null && !value.isBlank()) {
                this.version = value.trim();
            }
        }

        private void applyEnvironment() {
            getEnvBoolean(ENV_CHECK_AMBIGUITY).ifPresent(val -> this.checkAmbiguity = val);
            getEnvBoolean(ENV_IGNORE_ERRORS).ifPresent(val -> this.ignoreErrors = val);
            getEnv(ENV_VERSION).ifPresent(val -> this.version = val);
        }

        // ====================================================================
        // ENVIRONMENT VARIABLE HELPERS
        // ====================================================================

        private Optional<String> getEnv(String key) {
            String value = environment.apply(key);
            if (value != null && !value.trim().isEmpty()) {
                logger.fine("Loaded env var: " + key + "=" + value);
                return Optional.of(value.trim());
            }
            return Optional.empty();
        }

        private Optional<Boolean> getEnvBoolean(String key) {
            return getEnv(key).flatMap(val -> parseBoolean(key, val));
        }

        private static Optional<Boolean> parseBoolean(String key, String value) {
            if (value == null || value.isBlank()) {
                return Optional.empty();
            }
            String normalized = value.trim().toLowerCase();
            if ("true".equals(normalized) || "1".equals(normalized) || "yes".equals(normalized)) {
                return Optional.of(Boolean.TRUE);
            }
            if ("false".equals(normalized) || "0".equals(normalized) || "no".equals(normalized)) {
                return Optional.of(Boolean.FALSE);
            }
            logger.warning("Invalid boolean value for " + key + ": " + value);
            return Optional.empty();
        }
    }

    // ========================================================================
    // VALIDATION
    // ========================================================================

    private void validate() {
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("version must not be blank");
        }
    }
}
