/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.api.exceptions;

import java.util.List;

/**
 * Settings failed validation. Carries every problem found, not just the first.
 */
public class InvalidSettingsException extends TransliteratorException {

    private final List<String> errors;

    public InvalidSettingsException(List<String> errors) {
        super("Invalid transliterator settings:\n  " + String.join("\n  ", errors));
        this.errors = List.copyOf(errors);
    }

    public InvalidSettingsException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of(message);
    }

    public List<String> getErrors() {
        return errors;
    }
}
