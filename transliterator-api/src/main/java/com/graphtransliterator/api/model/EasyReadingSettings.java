/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Settings in "easy reading" format, as typically written by hand in YAML.
 *
 * <p>Rules map a rule string such as {@code "(<consonant> b) a <vowel>"} to its
 * production. On-match rules are single-entry maps such as
 * {@code "<vowel> + <vowel>": ","}.
 */
public record EasyReadingSettings(
        @JsonProperty("tokens") Map<String, List<String>> tokens,
        @JsonProperty("rules") Map<String, String> rules,
        @JsonProperty("whitespace") WhitespaceSettings whitespace,
        @JsonProperty("onmatch_rules") List<Map<String, String>> onMatchRules,
        @JsonProperty("metadata") Map<String, Object> metadata
) {

    @Override
    public List<Map<String, String>> onMatchRules() {
        return onMatchRules != null ? onMatchRules : List.of();
    }

    @Override
    public Map<String, Object> metadata() {
        return metadata != null ? metadata : Map.of();
    }
}
