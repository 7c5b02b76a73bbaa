/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.compiler;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Builds the regular expression that splits input text into tokens.
 *
 * The pattern is an alternation of every token, longest first so that no token
 * is shadowed by one of its prefixes. Equally long tokens keep their declaration
 * order.
 */
public final class TokenizerPatternBuilder {

    private TokenizerPatternBuilder() {
    }

    public static String patternOf(Collection<String> tokens) {
        List<String> ordered = new ArrayList<>(tokens);
        // List.sort is stable
        ordered.sort(Comparator.comparingInt(String::length).reversed());
        return ordered.stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("|", "(", ")"));
    }

    public static Pattern compile(Collection<String> tokens) {
        return compilePattern(patternOf(tokens));
    }

    public static Pattern compilePattern(String pattern) {
        return Pattern.compile(pattern, Pattern.DOTALL);
    }
}
