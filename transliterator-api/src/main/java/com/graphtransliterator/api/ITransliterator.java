/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.api;

import com.graphtransliterator.api.model.TransliterationResult;

import java.util.List;

/**
 * Contract for transliterating input strings with a compiled rule set.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ITransliterator transliterator = GraphTransliterator.fromYaml(yaml);
 *
 * String output = transliterator.transliterate("aab");
 *
 * TransliterationResult result = transliterator.transliterateWithDetails("aab");
 * result.ruleKeys().forEach(k -> System.out.println(transliterator.rules().get(k)));
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations must be thread-safe. The same transliterator instance
 * can be used concurrently from multiple threads.
 */
public interface ITransliterator {

    /**
     * Splits the input into tokens, surrounded by the default whitespace token.
     *
     * @param input the input string (must not be null)
     * @return the token list
     * @throws com.graphtransliterator.api.exceptions.UnrecognizableInputTokenException
     *         if part of the input is not a declared token and errors are not ignored
     */
    List<String> tokenize(String input);

    /**
     * Transliterates the input string.
     *
     * @param input the input string (must not be null)
     * @return the transliteration
     * @throws com.graphtransliterator.api.exceptions.NoMatchingRuleException
     *         if some token is matched by no rule and errors are not ignored
     */
    String transliterate(String input);

    /**
     * Transliterates the input string and reports the rules applied.
     *
     * @param input the input string (must not be null)
     * @return the output together with input tokens and matched rule keys
     */
    TransliterationResult transliterateWithDetails(String input);
}
