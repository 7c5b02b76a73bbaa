/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Direct-format JSON representation of a transliteration rule.
 * This is a simple Data Transfer Object (DTO) used only for loading; see
 * {@link TransliterationRule} for the compiled form.
 */
public record RuleDefinition(
        @JsonProperty("production") String production,
        @JsonProperty("prev_classes") List<String> prevClasses,
        @JsonProperty("prev_tokens") List<String> prevTokens,
        @JsonProperty("tokens") List<String> tokens,
        @JsonProperty("next_tokens") List<String> nextTokens,
        @JsonProperty("next_classes") List<String> nextClasses
) {

    /**
     * Shorthand for a rule without context constraints.
     */
    public static RuleDefinition of(String production, String... tokens) {
        return new RuleDefinition(production, null, null, List.of(tokens), null, null);
    }

    // Absent constraints read as empty lists

    @Override
    public List<String> prevClasses() {
        return prevClasses != null ? prevClasses : List.of();
    }

    @Override
    public List<String> prevTokens() {
        return prevTokens != null ? prevTokens : List.of();
    }

    @Override
    public List<String> tokens() {
        return tokens != null ? tokens : List.of();
    }

    @Override
    public List<String> nextTokens() {
        return nextTokens != null ? nextTokens : List.of();
    }

    @Override
    public List<String> nextClasses() {
        return nextClasses != null ? nextClasses : List.of();
    }
}
