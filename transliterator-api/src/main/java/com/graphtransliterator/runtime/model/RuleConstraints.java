/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.runtime.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.graphtransliterator.api.model.TransliterationRule;

import java.util.List;

/**
 * Context a rule requires around its matched tokens.
 * Checked against the token list once the graph walk reaches a rule node.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record RuleConstraints(
        @JsonProperty("prev_classes") List<String> prevClasses,
        @JsonProperty("prev_tokens") List<String> prevTokens,
        @JsonProperty("next_tokens") List<String> nextTokens,
        @JsonProperty("next_classes") List<String> nextClasses
) {

    public static final RuleConstraints NONE = new RuleConstraints(List.of(), List.of(), List.of(), List.of());

    public RuleConstraints {
        prevClasses = prevClasses == null ? List.of() : List.copyOf(prevClasses);
        prevTokens = prevTokens == null ? List.of() : List.copyOf(prevTokens);
        nextTokens = nextTokens == null ? List.of() : List.copyOf(nextTokens);
        nextClasses = nextClasses == null ? List.of() : List.copyOf(nextClasses);
    }

    public static RuleConstraints of(TransliterationRule rule) {
        if (!rule.hasContext()) {
            return NONE;
        }
        return new RuleConstraints(rule.prevClasses(), rule.prevTokens(), rule.nextTokens(), rule.nextClasses());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return prevClasses.isEmpty() && prevTokens.isEmpty() && nextTokens.isEmpty() && nextClasses.isEmpty();
    }
}
