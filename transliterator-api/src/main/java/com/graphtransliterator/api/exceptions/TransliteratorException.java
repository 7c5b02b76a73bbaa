/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.api.exceptions;

/**
 * Base class for all transliterator failures.
 *
 * This is a RuntimeException so that transliteration calls stay free of checked
 * exception handling; callers that care catch the concrete subclasses.
 */
public class TransliteratorException extends RuntimeException {

    public TransliteratorException(String message) {
        super(message);
    }

    public TransliteratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
