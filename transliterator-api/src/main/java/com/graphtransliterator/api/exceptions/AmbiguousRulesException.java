/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.api.exceptions;

import java.util.List;

/**
 * Two or more rules of equal cost can match the same input and no cheaper rule
 * covers their overlap.
 */
public class AmbiguousRulesException extends TransliteratorException {

    private final List<String> ambiguities;

    public AmbiguousRulesException(List<String> ambiguities) {
        super("Ambiguous rules found (" + ambiguities.size() + "):\n" + String.join("\n", ambiguities));
        this.ambiguities = List.copyOf(ambiguities);
    }

    public List<String> getAmbiguities() {
        return ambiguities;
    }
}
