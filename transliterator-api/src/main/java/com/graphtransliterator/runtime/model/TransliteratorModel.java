/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.runtime.model;

import com.graphtransliterator.api.TransliteratorVersion;
import com.graphtransliterator.api.model.OnMatchRule;
import com.graphtransliterator.api.model.TransliterationRule;
import com.graphtransliterator.api.model.WhitespaceSettings;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * The compiled, executable representation of a transliterator.
 *
 * This class holds everything a transliteration call needs: the token table,
 * the cost-sorted rules, the matching graph, the on-match index and the
 * tokenizer pattern. It is immutable and thread-safe.
 *
 * Rules are addressed by their index in {@link #getRules()} (the rule key).
 * Because rules are sorted by ascending cost, a lower key always means a
 * more specific rule.
 */
public final class TransliteratorModel {

    // --- Token Table ---
    private final Map<String, Set<String>> tokens; // Map[token -> classes], declaration order
    private final Map<String, Set<String>> tokensByClass; // Map[class -> tokens]

    // --- Rules ---
    private final List<TransliterationRule> rules; // Sorted by cost
    private final List<OnMatchRule> onMatchRules;
    private final WhitespaceSettings whitespace;

    // --- Compiled Structures ---
    private final MatchingGraph graph;
    private final OnMatchIndex onMatchIndex;
    private final Pattern tokenizerPattern;

    // --- Metadata & Options ---
    private final Map<String, Object> metadata;
    private final String version;
    private final boolean ignoreErrors;
    private final boolean checkAmbiguity;

    private TransliteratorModel(Builder builder) {
        this.tokens = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tokens));
        Map<String, Set<String>> byClass = new LinkedHashMap<>();
        builder.tokensByClass.forEach((k, v) -> byClass.put(k, Collections.unmodifiableSet(new LinkedHashSet<>(v))));
        this.tokensByClass = Collections.unmodifiableMap(byClass);
        this.rules = List.copyOf(builder.rules);
        this.onMatchRules = List.copyOf(builder.onMatchRules);
        this.whitespace = Objects.requireNonNull(builder.whitespace, "whitespace");
        this.graph = Objects.requireNonNull(builder.graph, "graph");
        this.onMatchIndex = builder.onMatchIndex;
        this.tokenizerPattern = Objects.requireNonNull(builder.tokenizerPattern, "tokenizerPattern");
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.version = builder.version;
        this.ignoreErrors = builder.ignoreErrors;
        this.checkAmbiguity = builder.checkAmbiguity;
    }

    // --- Public Accessors ---

    /**
     * @return Map[token -> classes], in declaration order.
     */
    public Map<String, Set<String>> getTokens() {
        return tokens;
    }

    /**
     * @return Map[class -> tokens carrying it].
     */
    public Map<String, Set<String>> getTokensByClass() {
        return tokensByClass;
    }

    public boolean hasClass(String token, String tokenClass) {
        Set<String> classes = tokens.get(token);
        return classes != null && classes.contains(tokenClass);
    }

    /**
     * @return The rules, sorted by ascending cost.
     */
    public List<TransliterationRule> getRules() {
        return rules;
    }

    public TransliterationRule getRule(int ruleKey) {
        return rules.get(ruleKey);
    }

    public List<OnMatchRule> getOnMatchRules() {
        return onMatchRules;
    }

    public WhitespaceSettings getWhitespace() {
        return whitespace;
    }

    public MatchingGraph getGraph() {
        return graph;
    }

    public OnMatchIndex getOnMatchIndex() {
        return onMatchIndex;
    }

    public Pattern getTokenizerPattern() {
        return tokenizerPattern;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public String getVersion() {
        return version;
    }

    public boolean isIgnoreErrors() {
        return ignoreErrors;
    }

    public boolean isCheckAmbiguity() {
        return checkAmbiguity;
    }

    /**
     * @return A copy of this model with a different error policy.
     */
    public TransliteratorModel withIgnoreErrors(boolean ignoreErrors) {
        return toBuilder().ignoreErrors(ignoreErrors).build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .rules(rules)
                .onMatchRules(onMatchRules)
                .whitespace(whitespace)
                .graph(graph)
                .onMatchIndex(onMatchIndex)
                .tokenizerPattern(tokenizerPattern)
                .metadata(metadata)
                .version(version)
                .ignoreErrors(ignoreErrors)
                .checkAmbiguity(checkAmbiguity);
        tokens.forEach((token, classes) -> builder.token(token, List.copyOf(classes)));
        return builder;
    }

    @Override
    public String toString() {
        return String.format("TransliteratorModel[tokens=%d, rules=%d, onMatchRules=%d, nodes=%d, version=%s]",
                tokens.size(), rules.size(), onMatchRules.size(), graph.nodeCount(), version);
    }

    /**
     * Builder for {@link TransliteratorModel}. Not thread-safe.
     */
    public static class Builder {
        private final Map<String, Set<String>> tokens = new LinkedHashMap<>();
        private final Map<String, Set<String>> tokensByClass = new LinkedHashMap<>();
        private List<TransliterationRule> rules = List.of();
        private List<OnMatchRule> onMatchRules = List.of();
        private WhitespaceSettings whitespace;
        private MatchingGraph graph;
        private OnMatchIndex onMatchIndex = OnMatchIndex.EMPTY;
        private Pattern tokenizerPattern;
        private Map<String, Object> metadata = Map.of();
        private String version = TransliteratorVersion.CURRENT;
        private boolean ignoreErrors;
        private boolean checkAmbiguity = true;

        /**
         * Declares a token and its classes. Order of declaration is preserved.
         */
        public Builder token(String token, List<String> classes) {
            Set<String> classSet = Collections.unmodifiableSet(new LinkedHashSet<>(classes));
            tokens.put(token, classSet);
            for (String tokenClass : classSet) {
                tokensByClass.computeIfAbsent(tokenClass, k -> new LinkedHashSet<>()).add(token);
            }
            return this;
        }

        public Builder tokens(Map<String, List<String>> tokenClasses) {
            tokenClasses.forEach(this::token);
            return this;
        }

        public Builder rules(List<TransliterationRule> rules) {
            this.rules = rules;
            return this;
        }

        public Builder onMatchRules(List<OnMatchRule> onMatchRules) {
            this.onMatchRules = onMatchRules;
            return this;
        }

        public Builder whitespace(WhitespaceSettings whitespace) {
            this.whitespace = whitespace;
            return this;
        }

        public Builder graph(MatchingGraph graph) {
            this.graph = graph;
            return this;
        }

        public Builder onMatchIndex(OnMatchIndex onMatchIndex) {
            this.onMatchIndex = onMatchIndex;
            return this;
        }

        public Builder tokenizerPattern(Pattern tokenizerPattern) {
            this.tokenizerPattern = tokenizerPattern;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder ignoreErrors(boolean ignoreErrors) {
            this.ignoreErrors = ignoreErrors;
            return this;
        }

        public Builder checkAmbiguity(boolean checkAmbiguity) {
            this.checkAmbiguity = checkAmbiguity;
            return this;
        }

        public TransliteratorModel build() {
            return new TransliteratorModel(this);
        }
    }
}
