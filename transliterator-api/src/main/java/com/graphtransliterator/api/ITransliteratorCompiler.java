/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.api;

import com.graphtransliterator.api.model.EasyReadingSettings;
import com.graphtransliterator.api.model.TransliteratorSettings;
import com.graphtransliterator.runtime.model.TransliteratorModel;

import io.opentelemetry.api.trace.Tracer;

/**
 * Contract for compiling transliterator settings into an executable model.
 */
public interface ITransliteratorCompiler {

    /**
     * Compiles direct-format settings.
     *
     * @param settings the settings to compile
     * @return compiled model
     * @throws com.graphtransliterator.api.exceptions.InvalidSettingsException if validation fails
     * @throws com.graphtransliterator.api.exceptions.AmbiguousRulesException if ambiguity
     *         checking is enabled and unresolved ambiguities exist
     */
    TransliteratorModel compile(TransliteratorSettings settings);

    /**
     * Compiles easy-reading settings.
     *
     * @param settings the settings to compile
     * @return compiled model
     */
    TransliteratorModel compile(EasyReadingSettings settings);

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }

    /**
     * Sets a compilation listener for tracking compilation progress.
     *
     * @param listener the compilation listener (null to disable)
     */
    default void setCompilationListener(CompilationListener listener) {
    }
}
