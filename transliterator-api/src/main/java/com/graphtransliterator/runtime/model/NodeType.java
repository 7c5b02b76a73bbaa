/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.runtime.model;

/**
 * Kind of a {@link GraphNode}, with its serialized name.
 */
public enum NodeType {
    START("Start"),
    TOKEN("token"),
    RULE("rule");

    private final String label;

    NodeType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static NodeType fromLabel(String label) {
        for (NodeType type : values()) {
            if (type.label.equals(label)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown node type: " + label);
    }
}
