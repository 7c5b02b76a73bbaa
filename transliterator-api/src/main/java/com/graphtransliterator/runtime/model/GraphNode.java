/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.runtime.model;

import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntMaps;

/**
 * Node of the matching graph. Nodes reference each other by their index in
 * {@link MatchingGraph#nodes()}.
 *
 * <p>The graph is a prefix tree over rule tokens. {@link Start} is the root,
 * each {@link Token} node consumes one input token, and each {@link Rule} node
 * is a leaf accepting the rule whose tokens spell the path to it.
 */
public sealed interface GraphNode permits GraphNode.Branch, GraphNode.Rule {

    NodeType type();

    /**
     * Node with outgoing edges.
     */
    sealed interface Branch extends GraphNode permits Start, Token {

        /**
         * Map[token -> child node index], in insertion order.
         */
        Object2IntMap<String> tokenChildren();

        /**
         * Indices of accepting rule children, ordered by ascending rule key.
         */
        IntList ruleChildren();
    }

    record Start(Object2IntMap<String> tokenChildren, IntList ruleChildren) implements Branch {

        public Start {
            tokenChildren = Object2IntMaps.unmodifiable(tokenChildren);
            ruleChildren = IntLists.unmodifiable(ruleChildren);
        }

        @Override
        public NodeType type() {
            return NodeType.START;
        }
    }

    /**
     * @param token      the token consumed on entering this node
     * @param minRuleKey lowest rule key reachable below this node
     */
    record Token(String token, int minRuleKey,
                 Object2IntMap<String> tokenChildren, IntList ruleChildren) implements Branch {

        public Token {
            tokenChildren = Object2IntMaps.unmodifiable(tokenChildren);
            ruleChildren = IntLists.unmodifiable(ruleChildren);
        }

        @Override
        public NodeType type() {
            return NodeType.TOKEN;
        }
    }

    /**
     * @param ruleKey     index of the accepted rule in the cost-sorted rule list
     * @param matchLength number of tokens the rule consumes
     * @param constraints context the rule requires
     */
    record Rule(int ruleKey, int matchLength, RuleConstraints constraints) implements GraphNode {

        @Override
        public NodeType type() {
            return NodeType.RULE;
        }
    }
}
