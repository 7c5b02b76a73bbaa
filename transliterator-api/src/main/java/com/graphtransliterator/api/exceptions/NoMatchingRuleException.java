/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.api.exceptions;

import java.util.List;

/**
 * No rule matches the token sequence at {@link #getIndex()}.
 */
public class NoMatchingRuleException extends TransliteratorException {

    private final List<String> tokens;
    private final int index;

    public NoMatchingRuleException(List<String> tokens, int index) {
        super(String.format("No matching transliteration rule at token index %d (%s) of %s",
                index, tokens.get(index), tokens));
        this.tokens = List.copyOf(tokens);
        this.index = index;
    }

    public List<String> getTokens() {
        return tokens;
    }

    public int getIndex() {
        return index;
    }
}
