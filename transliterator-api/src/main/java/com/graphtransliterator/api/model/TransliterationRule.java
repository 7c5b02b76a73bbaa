/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A compiled transliteration rule.
 *
 * <p>A rule matches the token sequence {@link #tokens()} when the tokens immediately
 * before the match equal {@link #prevTokens()} and carry {@link #prevClasses()} (further
 * back), and the tokens after the match equal {@link #nextTokens()} and carry
 * {@link #nextClasses()} (further forward). Absent constraints are empty lists.
 *
 * <p>{@link #cost()} is derived from the total number of constraints: the more a rule
 * specifies, the lower its cost and the higher its priority. Rules are immutable and
 * are referenced elsewhere by their index in the cost-sorted rule list (the "rule key").
 */
@JsonPropertyOrder({"production", "prev_classes", "prev_tokens", "tokens", "next_tokens", "next_classes", "cost"})
public record TransliterationRule(
        @JsonProperty("production") String production,
        @JsonProperty("prev_classes") List<String> prevClasses,
        @JsonProperty("prev_tokens") List<String> prevTokens,
        @JsonProperty("tokens") List<String> tokens,
        @JsonProperty("next_tokens") List<String> nextTokens,
        @JsonProperty("next_classes") List<String> nextClasses,
        @JsonProperty("cost") double cost
) {

    /**
     * Orders rules from most to least specific.
     */
    public static final Comparator<TransliterationRule> BY_COST =
            Comparator.comparingDouble(TransliterationRule::cost);

    @JsonCreator
    public TransliterationRule {
        Objects.requireNonNull(production, "production");
        Objects.requireNonNull(tokens, "tokens");
        if (tokens.isEmpty()) {
            throw new IllegalArgumentException("Transliteration rule requires at least one token");
        }
        prevClasses = copyOf(prevClasses);
        prevTokens = copyOf(prevTokens);
        tokens = List.copyOf(tokens);
        nextTokens = copyOf(nextTokens);
        nextClasses = copyOf(nextClasses);
    }

    /**
     * Creates a rule whose cost is computed from its constraints.
     */
    public static TransliterationRule of(String production,
                                         List<String> prevClasses,
                                         List<String> prevTokens,
                                         List<String> tokens,
                                         List<String> nextTokens,
                                         List<String> nextClasses) {
        int count = size(prevClasses) + size(prevTokens) + size(tokens) + size(nextTokens) + size(nextClasses);
        return new TransliterationRule(production, prevClasses, prevTokens, tokens,
                nextTokens, nextClasses, costOf(count));
    }

    /**
     * Creates a rule from its direct-format definition.
     */
    public static TransliterationRule of(RuleDefinition definition) {
        return of(definition.production(), definition.prevClasses(), definition.prevTokens(),
                definition.tokens(), definition.nextTokens(), definition.nextClasses());
    }

    /**
     * Cost of a rule with the given total number of constraints.
     *
     * <p>Strictly decreasing in {@code constraintCount}: one token costs ~0.585,
     * two tokens ~0.415.
     */
    public static double costOf(int constraintCount) {
        return Math.log(1.0 + 1.0 / (1.0 + constraintCount)) / Math.log(2.0);
    }

    /**
     * Number of tokens and classes preceding the match.
     */
    public int prevCount() {
        return prevClasses.size() + prevTokens.size();
    }

    /**
     * Number of tokens matched plus the tokens and classes following them.
     */
    public int currentAndNextCount() {
        return tokens.size() + nextTokens.size() + nextClasses.size();
    }

    /**
     * Total number of constraints of this rule.
     */
    public int constraintCount() {
        return prevCount() + currentAndNextCount();
    }

    public boolean hasContext() {
        return !prevClasses.isEmpty() || !prevTokens.isEmpty()
                || !nextTokens.isEmpty() || !nextClasses.isEmpty();
    }

    private static int size(List<String> values) {
        return values == null ? 0 : values.size();
    }

    private static List<String> copyOf(List<String> values) {
        return values == null ? List.of() : List.copyOf(values);
    }
}
