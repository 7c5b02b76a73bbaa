/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.compiler.analysis;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.List;

/**
 * Encodes tokens to dense integer IDs so token sets can be held in bitmaps.
 * IDs follow encoding order.
 */
public class TokenDictionary {

    private final Object2IntMap<String> tokenToId = new Object2IntOpenHashMap<>();
    private final List<String> idToToken = new ArrayList<>();

    public TokenDictionary() {
        tokenToId.defaultReturnValue(-1);
    }

    /**
     * Encodes a token, adding it if not yet present.
     *
     * @param token The token to encode.
     * @return The integer ID for the token.
     */
    public int encode(String token) {
        return tokenToId.computeIfAbsent(token, (String t) -> {
            int id = idToToken.size();
            idToToken.add(t);
            return id;
        });
    }

    /**
     * @return The token for an ID, or null if the ID is unknown.
     */
    public String decode(int id) {
        if (id >= 0 && id < idToToken.size()) {
            return idToToken.get(id);
        }
        return null;
    }

    /**
     * @return The ID of a token, or -1 if not encoded.
     */
    public int getId(String token) {
        return tokenToId.getInt(token);
    }

    public int size() {
        return idToToken.size();
    }
}
