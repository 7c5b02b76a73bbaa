/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.compiler.settings;

import com.graphtransliterator.api.exceptions.InvalidSettingsException;
import com.graphtransliterator.api.model.OnMatchRule;
import com.graphtransliterator.api.model.RuleDefinition;
import com.graphtransliterator.api.model.TransliteratorSettings;
import com.graphtransliterator.api.model.WhitespaceSettings;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks direct settings for structural and referential errors.
 *
 * All errors are collected before reporting, so a single run lists every problem
 * in the settings.
 */
public class SettingsValidator {

    /**
     * Token name reserved for the rule children of a dumped graph node.
     */
    public static final String RESERVED_TOKEN = "__rules__";

    /**
     * @return every error found, in document order; empty if the settings are valid
     */
    public List<String> validate(TransliteratorSettings settings) {
        List<String> errors = new ArrayList<>();
        if (settings == null) {
            errors.add("Settings are missing");
            return errors;
        }

        Map<String, List<String>> tokens = settings.tokens();
        Set<String> classes = new HashSet<>();
        if (tokens == null || tokens.isEmpty()) {
            errors.add("tokens must declare at least one token");
            tokens = Map.of();
        }
        for (Map.Entry<String, List<String>> entry : tokens.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isEmpty()) {
                errors.add("Token must be a non-empty string");
            } else if (RESERVED_TOKEN.equals(entry.getKey())) {
                errors.add("Token name '" + RESERVED_TOKEN + "' is reserved");
            }
            if (entry.getValue() == null) {
                errors.add("Token '" + entry.getKey() + "' has no class list");
                continue;
            }
            classes.addAll(entry.getValue());
        }

        validateWhitespace(settings.whitespace(), tokens, classes, errors);

        List<RuleDefinition> rules = settings.rules();
        if (rules == null) {
            errors.add("rules are missing");
            rules = List.of();
        }
        for (int i = 0; i < rules.size(); i++) {
            validateRule(i, rules.get(i), tokens, classes, errors);
        }

        List<OnMatchRule> onMatchRules = settings.onMatchRules();
        for (int i = 0; i < onMatchRules.size(); i++) {
            OnMatchRule rule = onMatchRules.get(i);
            if (rule.prevClasses().isEmpty() || rule.nextClasses().isEmpty()) {
                errors.add("On-match rule " + i + " needs both preceding and following classes");
            }
            checkClasses("On-match rule " + i, rule.prevClasses(), classes, errors);
            checkClasses("On-match rule " + i, rule.nextClasses(), classes, errors);
        }
        return errors;
    }

    /**
     * @throws InvalidSettingsException listing every error, if any were found
     */
    public void validateOrThrow(TransliteratorSettings settings) {
        List<String> errors = validate(settings);
        if (!errors.isEmpty()) {
            throw new InvalidSettingsException(errors);
        }
    }

    private void validateWhitespace(WhitespaceSettings whitespace, Map<String, List<String>> tokens,
                                    Set<String> classes, List<String> errors) {
        if (whitespace == null) {
            errors.add("whitespace settings are missing");
            return;
        }
        if (whitespace.defaultToken() == null || !tokens.containsKey(whitespace.defaultToken())) {
            errors.add("Whitespace default '" + whitespace.defaultToken() + "' is not a declared token");
        }
        if (whitespace.tokenClass() == null || !classes.contains(whitespace.tokenClass())) {
            errors.add("Whitespace class '" + whitespace.tokenClass() + "' is not attached to any token");
        }
    }

    private void validateRule(int index, RuleDefinition rule, Map<String, List<String>> tokens,
                              Set<String> classes, List<String> errors) {
        String label = "Rule " + index;
        if (rule == null) {
            errors.add(label + " is null");
            return;
        }
        if (rule.production() == null) {
            errors.add(label + " has no production");
        }
        if (rule.tokens().isEmpty()) {
            errors.add(label + " must match at least one token");
        }
        checkTokens(label, rule.prevTokens(), tokens, errors);
        checkTokens(label, rule.tokens(), tokens, errors);
        checkTokens(label, rule.nextTokens(), tokens, errors);
        checkClasses(label, rule.prevClasses(), classes, errors);
        checkClasses(label, rule.nextClasses(), classes, errors);
    }

    private void checkTokens(String label, List<String> referenced, Map<String, List<String>> tokens,
                             List<String> errors) {
        for (String token : referenced) {
            if (!tokens.containsKey(token)) {
                errors.add(label + " references unknown token '" + token + "'");
            }
        }
    }

    private void checkClasses(String label, List<String> referenced, Set<String> classes, List<String> errors) {
        for (String tokenClass : referenced) {
            if (!classes.contains(tokenClass)) {
                errors.add(label + " references unknown class '" + tokenClass + "'");
            }
        }
    }
}
