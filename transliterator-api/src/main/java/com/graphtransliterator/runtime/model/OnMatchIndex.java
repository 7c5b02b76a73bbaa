/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.runtime.model;

import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Map[current token -> Map[previous token -> on-match rule indices]].
 *
 * A pair of tokens is present only when at least one on-match rule could apply
 * at a boundary between them. Indices keep the declaration order of the on-match rules.
 */
public final class OnMatchIndex {

    public static final OnMatchIndex EMPTY = new OnMatchIndex(Map.of());

    private final Map<String, Map<String, IntList>> lookup;

    public OnMatchIndex(Map<String, Map<String, IntList>> lookup) {
        Map<String, Map<String, IntList>> copy = new LinkedHashMap<>();
        lookup.forEach((curr, byPrev) -> {
            Map<String, IntList> inner = new LinkedHashMap<>();
            byPrev.forEach((prev, indices) -> inner.put(prev, IntLists.unmodifiable(indices)));
            copy.put(curr, Collections.unmodifiableMap(inner));
        });
        this.lookup = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns candidate on-match rule indices for a boundary between {@code prevToken}
     * and {@code currToken}, or an empty list.
     */
    public IntList candidates(String currToken, String prevToken) {
        Map<String, IntList> byPrev = lookup.get(currToken);
        if (byPrev == null) {
            return IntLists.emptyList();
        }
        IntList indices = byPrev.get(prevToken);
        return indices != null ? indices : IntLists.emptyList();
    }

    public boolean isEmpty() {
        return lookup.isEmpty();
    }

    public Map<String, Map<String, IntList>> asMap() {
        return lookup;
    }
}
