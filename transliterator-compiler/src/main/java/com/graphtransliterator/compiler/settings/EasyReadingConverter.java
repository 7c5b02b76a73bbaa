/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.compiler.settings;

import com.graphtransliterator.api.exceptions.InvalidSettingsException;
import com.graphtransliterator.api.model.EasyReadingSettings;
import com.graphtransliterator.api.model.OnMatchRule;
import com.graphtransliterator.api.model.RuleDefinition;
import com.graphtransliterator.api.model.TransliteratorSettings;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts easy-reading settings into direct settings.
 *
 * Rule order and token order are carried over unchanged. Every malformed rule
 * string is reported, not just the first.
 */
public final class EasyReadingConverter {

    private EasyReadingConverter() {
    }

    public static TransliteratorSettings toDirect(EasyReadingSettings settings) {
        if (settings == null) {
            throw new InvalidSettingsException(List.of("Settings are missing"));
        }
        List<String> errors = new ArrayList<>();

        List<RuleDefinition> rules = new ArrayList<>();
        if (settings.rules() != null) {
            for (Map.Entry<String, String> entry : settings.rules().entrySet()) {
                try {
                    rules.add(RuleNotation.parseRule(entry.getKey(), entry.getValue()));
                } catch (IllegalArgumentException e) {
                    errors.add(e.getMessage());
                }
            }
        }

        List<OnMatchRule> onMatchRules = new ArrayList<>();
        for (Map<String, String> entry : settings.onMatchRules()) {
            if (entry == null || entry.size() != 1) {
                errors.add("On-match rule must be a single \"<classes> + <classes>: production\" entry: " + entry);
                continue;
            }
            Map.Entry<String, String> onMatch = entry.entrySet().iterator().next();
            try {
                onMatchRules.add(RuleNotation.parseOnMatch(onMatch.getKey(), onMatch.getValue()));
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new InvalidSettingsException(errors);
        }
        return new TransliteratorSettings(settings.tokens(), rules, settings.whitespace(),
                onMatchRules, settings.metadata());
    }
}
