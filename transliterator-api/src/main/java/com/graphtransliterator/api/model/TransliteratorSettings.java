/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Settings in direct format: every rule spelled out field by field.
 *
 * <p>Token order is significant. It breaks ties between equally long tokens
 * during tokenization, so callers should pass an insertion-ordered map.
 */
public record TransliteratorSettings(
        @JsonProperty("tokens") Map<String, List<String>> tokens,
        @JsonProperty("rules") List<RuleDefinition> rules,
        @JsonProperty("whitespace") WhitespaceSettings whitespace,
        @JsonProperty("onmatch_rules") List<OnMatchRule> onMatchRules,
        @JsonProperty("metadata") Map<String, Object> metadata
) {

    public static TransliteratorSettings of(Map<String, List<String>> tokens,
                                            List<RuleDefinition> rules,
                                            WhitespaceSettings whitespace) {
        return new TransliteratorSettings(tokens, rules, whitespace, null, null);
    }

    @Override
    public List<OnMatchRule> onMatchRules() {
        return onMatchRules != null ? onMatchRules : List.of();
    }

    @Override
    public Map<String, Object> metadata() {
        return metadata != null ? metadata : Map.of();
    }
}
