/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Whitespace policy.
 *
 * @param defaultToken token implicitly added at the start and end of every input
 * @param tokenClass   class shared by all whitespace tokens
 * @param consolidate  collapse runs of whitespace and drop it at the edges of the input
 */
@JsonPropertyOrder({"default", "token_class", "consolidate"})
public record WhitespaceSettings(
        @JsonProperty("default") String defaultToken,
        @JsonProperty("token_class") String tokenClass,
        @JsonProperty("consolidate") boolean consolidate
) {
}
