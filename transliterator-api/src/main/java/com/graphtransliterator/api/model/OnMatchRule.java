/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Inserts {@link #production()} between two consecutive matches when the tokens
 * ending at the boundary carry {@link #prevClasses()} and the tokens starting at it
 * carry {@link #nextClasses()}.
 */
@JsonPropertyOrder({"prev_classes", "next_classes", "production"})
public record OnMatchRule(
        @JsonProperty("prev_classes") List<String> prevClasses,
        @JsonProperty("next_classes") List<String> nextClasses,
        @JsonProperty("production") String production
) {

    @JsonCreator
    public OnMatchRule {
        prevClasses = prevClasses == null ? List.of() : List.copyOf(prevClasses);
        nextClasses = nextClasses == null ? List.of() : List.copyOf(nextClasses);
        Objects.requireNonNull(production, "production");
    }

    /**
     * Class required of the last token before the boundary.
     */
    public String lastPrevClass() {
        return prevClasses.get(prevClasses.size() - 1);
    }

    /**
     * Class required of the first token after the boundary.
     */
    public String firstNextClass() {
        return nextClasses.get(0);
    }
}
