/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.runtime.model;

import it.unimi.dsi.fastutil.ints.IntList;

import java.util.List;

/**
 * Arena of {@link GraphNode}s rooted at node 0.
 *
 * Immutable and thread-safe. Construction validates that the root is a
 * {@link GraphNode.Start} node and that every edge points inside the arena.
 */
public final class MatchingGraph {

    public static final int ROOT = 0;

    private final List<GraphNode> nodes;
    private final int edgeCount;

    public MatchingGraph(List<GraphNode> nodes) {
        if (nodes.isEmpty() || !(nodes.get(ROOT) instanceof GraphNode.Start)) {
            throw new IllegalArgumentException("Matching graph must start with a Start node");
        }
        this.nodes = List.copyOf(nodes);
        int edges = 0;
        for (int i = 0; i < this.nodes.size(); i++) {
            GraphNode node = this.nodes.get(i);
            if (node instanceof GraphNode.Branch branch) {
                for (int child : branch.tokenChildren().values()) {
                    checkEdge(i, child, NodeType.TOKEN);
                    edges++;
                }
                IntList rules = branch.ruleChildren();
                for (int r = 0; r < rules.size(); r++) {
                    checkEdge(i, rules.getInt(r), NodeType.RULE);
                    edges++;
                }
            } else if (i == ROOT) {
                throw new IllegalArgumentException("Root node must be a branch");
            }
        }
        this.edgeCount = edges;
    }

    private void checkEdge(int from, int to, NodeType expected) {
        if (to <= ROOT || to >= nodes.size()) {
            throw new IllegalArgumentException(
                    String.format("Edge %d -> %d points outside the graph (size %d)", from, to, nodes.size()));
        }
        if (nodes.get(to).type() != expected) {
            throw new IllegalArgumentException(
                    String.format("Edge %d -> %d expected a %s node but found %s",
                            from, to, expected, nodes.get(to).type()));
        }
    }

    public GraphNode node(int index) {
        return nodes.get(index);
    }

    public GraphNode.Start root() {
        return (GraphNode.Start) nodes.get(ROOT);
    }

    public List<GraphNode> nodes() {
        return nodes;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edgeCount;
    }
}
