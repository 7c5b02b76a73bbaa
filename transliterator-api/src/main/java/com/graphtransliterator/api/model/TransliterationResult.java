/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.api.model;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.List;

/**
 * Outcome of a single transliteration call.
 *
 * @param output      the transliterated string
 * @param inputTokens the tokenized input, including the whitespace at both ends
 * @param ruleKeys    keys of the rules applied, in input order
 */
public record TransliterationResult(
        String output,
        List<String> inputTokens,
        IntList ruleKeys
) {

    public static final TransliterationResult EMPTY = new TransliterationResult("", List.of(), IntLists.emptyList());

    public TransliterationResult {
        inputTokens = List.copyOf(inputTokens);
        ruleKeys = IntLists.unmodifiable(new IntArrayList(ruleKeys));
    }

    public int matchCount() {
        return ruleKeys.size();
    }
}
