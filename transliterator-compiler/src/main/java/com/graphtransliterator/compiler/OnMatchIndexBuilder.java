/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.compiler;

import com.graphtransliterator.api.model.OnMatchRule;
import com.graphtransliterator.runtime.model.OnMatchIndex;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Indexes on-match rules by the pair of tokens at a match boundary.
 *
 * A rule is filed under every (current, previous) pair where the current token
 * carries the rule's first following class and the previous token carries its
 * last preceding class. The remaining classes are checked at transliteration time.
 */
public class OnMatchIndexBuilder {

    public OnMatchIndex build(List<OnMatchRule> onMatchRules, Map<String, Set<String>> tokensByClass) {
        if (onMatchRules.isEmpty()) {
            return OnMatchIndex.EMPTY;
        }
        Map<String, Map<String, IntList>> lookup = new LinkedHashMap<>();
        for (int i = 0; i < onMatchRules.size(); i++) {
            OnMatchRule rule = onMatchRules.get(i);
            Set<String> currTokens = tokensByClass.getOrDefault(rule.firstNextClass(), Set.of());
            Set<String> prevTokens = tokensByClass.getOrDefault(rule.lastPrevClass(), Set.of());
            for (String curr : currTokens) {
                Map<String, IntList> byPrev = lookup.computeIfAbsent(curr, k -> new LinkedHashMap<>());
                for (String prev : prevTokens) {
                    byPrev.computeIfAbsent(prev, k -> new IntArrayList()).add(i);
                }
            }
        }
        return new OnMatchIndex(lookup);
    }
}
