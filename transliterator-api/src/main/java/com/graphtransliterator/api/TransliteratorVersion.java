/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.api;

/**
 * Version stamped into compiled transliterators and their serialized form.
 */
public final class TransliteratorVersion {

    public static final String CURRENT = "1.0.0";

    private TransliteratorVersion() {
    }
}
