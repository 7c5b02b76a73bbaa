/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.runtime.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.graphtransliterator.api.TransliteratorVersion;
import com.graphtransliterator.api.exceptions.InvalidSettingsException;
import com.graphtransliterator.api.model.OnMatchRule;
import com.graphtransliterator.api.model.TransliterationRule;
import com.graphtransliterator.api.model.WhitespaceSettings;
import com.graphtransliterator.compiler.settings.SettingsValidator;
import com.graphtransliterator.runtime.model.GraphNode;
import com.graphtransliterator.runtime.model.MatchingGraph;
import com.graphtransliterator.runtime.model.NodeType;
import com.graphtransliterator.runtime.model.OnMatchIndex;
import com.graphtransliterator.runtime.model.RuleConstraints;
import com.graphtransliterator.runtime.model.TransliteratorModel;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Converts a compiled model to and from a map of plain values, and JSON.
 *
 * <p>The dumped form holds every derived structure (matching graph, on-match lookup,
 * tokenizer pattern), so loading needs no compilation and never re-checks ambiguity.
 *
 * <p>Graph nodes are dumped as {@code {type, token?, min_rule_key?, rule_key?, accepting?,
 * match_length?, constraints?, ordered_children?}}. Rule children of a branch are listed
 * under the reserved {@value #RULES_KEY} key of {@code ordered_children}.
 */
public class TransliteratorSerializer {
    private static final Logger logger = LoggerFactory.getLogger(TransliteratorSerializer.class);

    public static final String RULES_KEY = SettingsValidator.RESERVED_TOKEN;

    static final String TOKENS = "tokens";
    static final String RULES = "rules";
    static final String WHITESPACE = "whitespace";
    static final String ONMATCH_RULES = "onmatch_rules";
    static final String METADATA = "metadata";
    static final String IGNORE_ERRORS = "ignore_errors";
    static final String ONMATCH_RULES_LOOKUP = "onmatch_rules_lookup";
    static final String TOKENS_BY_CLASS = "tokens_by_class";
    static final String GRAPH = "graph";
    static final String TOKENIZER_PATTERN = "tokenizer_pattern";
    static final String VERSION = "graphtransliterator_version";
    static final String CHECK_AMBIGUITY = "check_ambiguity";

    private static final String NODE = "node";

    private final ObjectMapper objectMapper = new ObjectMapper();

    // ========================================================================
    // DUMP
    // ========================================================================

    public Map<String, Object> dump(TransliteratorModel model) {
        Map<String, Object> out = new LinkedHashMap<>();

        Map<String, List<String>> tokens = new LinkedHashMap<>();
        model.getTokens().forEach((token, classes) -> tokens.put(token, List.copyOf(classes)));
        out.put(TOKENS, tokens);

        List<Map<String, Object>> rules = new ArrayList<>(model.getRules().size());
        for (TransliterationRule rule : model.getRules()) {
            rules.add(dumpRule(rule));
        }
        out.put(RULES, rules);

        WhitespaceSettings whitespace = model.getWhitespace();
        Map<String, Object> ws = new LinkedHashMap<>();
        ws.put("default", whitespace.defaultToken());
        ws.put("token_class", whitespace.tokenClass());
        ws.put("consolidate", whitespace.consolidate());
        out.put(WHITESPACE, ws);

        if (!model.getOnMatchRules().isEmpty()) {
            List<Map<String, Object>> onMatch = new ArrayList<>();
            for (OnMatchRule rule : model.getOnMatchRules()) {
                Map<String, Object> m = new LinkedHashMap<>();
                m.put("prev_classes", rule.prevClasses());
                m.put("next_classes", rule.nextClasses());
                m.put("production", rule.production());
                onMatch.add(m);
            }
            out.put(ONMATCH_RULES, onMatch);
        }
        if (!model.getMetadata().isEmpty()) {
            out.put(METADATA, model.getMetadata());
        }
        out.put(IGNORE_ERRORS, model.isIgnoreErrors());
        out.put(CHECK_AMBIGUITY, model.isCheckAmbiguity());

        if (!model.getOnMatchIndex().isEmpty()) {
            Map<String, Map<String, List<Integer>>> lookup = new LinkedHashMap<>();
            model.getOnMatchIndex().asMap().forEach((curr, byPrev) -> {
                Map<String, List<Integer>> inner = new LinkedHashMap<>();
                byPrev.forEach((prev, indices) -> inner.put(prev, new ArrayList<>(indices)));
                lookup.put(curr, inner);
            });
            out.put(ONMATCH_RULES_LOOKUP, lookup);
        }

        Map<String, List<String>> byClass = new LinkedHashMap<>();
        model.getTokensByClass().forEach((tokenClass, members) -> byClass.put(tokenClass, List.copyOf(members)));
        out.put(TOKENS_BY_CLASS, byClass);

        List<Map<String, Object>> nodes = new ArrayList<>(model.getGraph().nodeCount());
        for (GraphNode node : model.getGraph().nodes()) {
            nodes.add(dumpNode(node));
        }
        out.put(GRAPH, Map.of(NODE, nodes));

        out.put(TOKENIZER_PATTERN, model.getTokenizerPattern().pattern());
        out.put(VERSION, model.getVersion());
        return out;
    }

    public String dumps(TransliteratorModel model) {
        try {
            return objectMapper.writeValueAsString(dump(model));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize transliterator", e);
        }
    }

    private Map<String, Object> dumpRule(TransliterationRule rule) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("production", rule.production());
        putIfPresent(m, "prev_classes", rule.prevClasses());
        putIfPresent(m, "prev_tokens", rule.prevTokens());
        m.put("tokens", rule.tokens());
        putIfPresent(m, "next_tokens", rule.nextTokens());
        putIfPresent(m, "next_classes", rule.nextClasses());
        m.put("cost", rule.cost());
        return m;
    }

    private Map<String, Object> dumpNode(GraphNode node) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", node.type().label());
        if (node instanceof GraphNode.Token token) {
            m.put("token", token.token());
            m.put("min_rule_key", token.minRuleKey());
        }
        if (node instanceof GraphNode.Branch branch) {
            Map<String, List<Integer>> children = new LinkedHashMap<>();
            branch.tokenChildren().forEach((t, child) -> children.put(t, List.of(child)));
            if (!branch.ruleChildren().isEmpty()) {
                children.put(RULES_KEY, new ArrayList<>(branch.ruleChildren()));
            }
            m.put("ordered_children", children);
        } else if (node instanceof GraphNode.Rule rule) {
            m.put("rule_key", rule.ruleKey());
            m.put("accepting", true);
            m.put("match_length", rule.matchLength());
            if (!rule.constraints().isEmpty()) {
                Map<String, Object> constraints = new LinkedHashMap<>();
                putIfPresent(constraints, "prev_classes", rule.constraints().prevClasses());
                putIfPresent(constraints, "prev_tokens", rule.constraints().prevTokens());
                putIfPresent(constraints, "next_tokens", rule.constraints().nextTokens());
                putIfPresent(constraints, "next_classes", rule.constraints().nextClasses());
                m.put("constraints", constraints);
            }
        }
        return m;
    }

    private static void putIfPresent(Map<String, Object> m, String key, List<String> values) {
        if (!values.isEmpty()) {
            m.put(key, values);
        }
    }

    // ========================================================================
    // LOAD
    // ========================================================================

    /**
     * Rebuilds a model from its dumped form.
     *
     * @throws InvalidSettingsException if a required entry is missing or malformed
     */
    public TransliteratorModel load(Map<String, ?> settings) {
        try {
            TransliteratorModel.Builder builder = new TransliteratorModel.Builder();

            Map<String, List<String>> tokens = convert(require(settings, TOKENS),
                    new TypeReference<Map<String, List<String>>>() { });
            tokens.forEach(builder::token);

            List<TransliterationRule> rules = convert(require(settings, RULES),
                    new TypeReference<List<TransliterationRule>>() { });
            builder.rules(rules);
            builder.whitespace(convert(require(settings, WHITESPACE), new TypeReference<WhitespaceSettings>() { }));

            if (settings.get(ONMATCH_RULES) != null) {
                builder.onMatchRules(convert(settings.get(ONMATCH_RULES), new TypeReference<List<OnMatchRule>>() { }));
            }
            if (settings.get(METADATA) != null) {
                builder.metadata(convert(settings.get(METADATA), new TypeReference<Map<String, Object>>() { }));
            }
            builder.ignoreErrors(Boolean.TRUE.equals(settings.get(IGNORE_ERRORS)));
            builder.checkAmbiguity(!Boolean.FALSE.equals(settings.get(CHECK_AMBIGUITY)));

            if (settings.get(ONMATCH_RULES_LOOKUP) != null) {
                Map<String, Map<String, List<Integer>>> lookup =
                        convert(settings.get(ONMATCH_RULES_LOOKUP),
                                new TypeReference<Map<String, Map<String, List<Integer>>>>() { });
                Map<String, Map<String, IntList>> index = new LinkedHashMap<>();
                lookup.forEach((curr, byPrev) -> {
                    Map<String, IntList> inner = new LinkedHashMap<>();
                    byPrev.forEach((prev, indices) -> inner.put(prev, new IntArrayList(indices)));
                    index.put(curr, inner);
                });
                builder.onMatchIndex(new OnMatchIndex(index));
            }

            Map<String, Object> graph = convert(require(settings, GRAPH), new TypeReference<Map<String, Object>>() { });
            List<Map<String, Object>> nodes = convert(require(graph, NODE),
                    new TypeReference<List<Map<String, Object>>>() { });
            builder.graph(loadGraph(nodes, rules.size()));

            builder.tokenizerPattern(Pattern.compile((String) require(settings, TOKENIZER_PATTERN), Pattern.DOTALL));

            Object version = settings.get(VERSION);
            String loadedVersion = version != null ? version.toString() : TransliteratorVersion.CURRENT;
            if (!TransliteratorVersion.CURRENT.equals(loadedVersion)) {
                logger.warn("Loading transliterator dumped by version {} into version {}",
                        loadedVersion, TransliteratorVersion.CURRENT);
            }
            builder.version(loadedVersion);
            return builder.build();
        } catch (IllegalArgumentException | ClassCastException e) {
            throw new InvalidSettingsException("Malformed serialized transliterator: " + e.getMessage(), e);
        }
    }

    public TransliteratorModel loads(String json) {
        try {
            Map<String, Object> settings = objectMapper.readValue(json,
                    new TypeReference<Map<String, Object>>() { });
            return load(settings);
        } catch (JsonProcessingException e) {
            throw new InvalidSettingsException("Failed to parse serialized transliterator: "
                    + e.getOriginalMessage(), e);
        }
    }

    private MatchingGraph loadGraph(List<Map<String, Object>> dumped, int ruleCount) {
        List<GraphNode> nodes = new ArrayList<>(dumped.size());
        for (Map<String, Object> m : dumped) {
            NodeType type = NodeType.fromLabel((String) require(m, "type"));
            switch (type) {
                case RULE -> {
                    int ruleKey = ((Number) require(m, "rule_key")).intValue();
                    if (ruleKey < 0 || ruleKey >= ruleCount) {
                        throw new IllegalArgumentException("Rule node references unknown rule key " + ruleKey);
                    }
                    int matchLength = ((Number) require(m, "match_length")).intValue();
                    RuleConstraints constraints = m.get("constraints") == null
                            ? RuleConstraints.NONE
                            : objectMapper.convertValue(m.get("constraints"), RuleConstraints.class);
                    nodes.add(new GraphNode.Rule(ruleKey, matchLength, constraints));
                }
                case START -> {
                    Children children = loadChildren(m);
                    nodes.add(new GraphNode.Start(children.tokens(), children.rules()));
                }
                case TOKEN -> {
                    Children children = loadChildren(m);
                    nodes.add(new GraphNode.Token((String) require(m, "token"),
                            ((Number) require(m, "min_rule_key")).intValue(),
                            children.tokens(), children.rules()));
                }
            }
        }
        return new MatchingGraph(nodes);
    }

    private Children loadChildren(Map<String, Object> node) {
        Object2IntMap<String> tokens = new Object2IntLinkedOpenHashMap<>();
        tokens.defaultReturnValue(-1);
        IntArrayList rules = new IntArrayList();
        Map<String, List<Integer>> children = node.get("ordered_children") == null
                ? Map.of()
                : convert(node.get("ordered_children"), new TypeReference<Map<String, List<Integer>>>() { });
        children.forEach((key, indices) -> {
            if (RULES_KEY.equals(key)) {
                rules.addAll(indices);
            } else if (indices.size() == 1) {
                tokens.put(key, (int) indices.get(0));
            } else {
                throw new IllegalArgumentException("Token edge '" + key + "' must have exactly one child");
            }
        });
        return new Children(tokens, rules);
    }

    private record Children(Object2IntMap<String> tokens, IntList rules) {
    }

    private <T> T convert(Object value, TypeReference<T> type) {
        return objectMapper.convertValue(value, type);
    }

    private static Object require(Map<String, ?> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            throw new IllegalArgumentException("missing '" + key + "'");
        }
        return value;
    }
}
