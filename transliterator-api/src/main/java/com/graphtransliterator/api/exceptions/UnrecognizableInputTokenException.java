/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.api.exceptions;

/**
 * No declared token matches the input at {@link #getOffset()}.
 */
public class UnrecognizableInputTokenException extends TransliteratorException {

    private final String input;
    private final int offset;

    public UnrecognizableInputTokenException(String input, int offset) {
        super(String.format("Unrecognizable token at offset %d: \"%s\" in \"%s\"",
                offset, input.substring(offset, Math.min(offset + 1, input.length())), input));
        this.input = input;
        this.offset = offset;
    }

    public String getInput() {
        return input;
    }

    public int getOffset() {
        return offset;
    }
}
