/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.runtime.evaluation;

import com.graphtransliterator.runtime.model.GraphNode;
import com.graphtransliterator.runtime.model.MatchingGraph;
import com.graphtransliterator.runtime.model.TransliteratorModel;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.Object2IntMap;

import java.util.List;
import java.util.OptionalInt;

/**
 * Finds the rules matching a token list at a position by walking the matching graph.
 *
 * <h2>Traversal</h2>
 * <p>Depth-first, driven by an explicit stack of (node, token position) pairs. At a
 * branch node the candidates are the token child for the next input token and every
 * rule child ending at this position. Each candidate has a bound: its rule key for a
 * rule node, the lowest rule key below it for a token node. Candidates are pushed so
 * that the lowest bound is popped first.
 *
 * <p>In single-match mode the best rule key found so far prunes every entry whose bound
 * is not lower, so the result is the cheapest matching rule even when a more specific
 * path fails its context constraints deep in the graph.
 *
 * <p>Thread-safe: all traversal state is local to the call.
 */
public final class GraphMatcher {

    private static final int NO_MATCH = -1;

    private final MatchingGraph graph;
    private final TokenWindowMatcher windows;

    public GraphMatcher(TransliteratorModel model) {
        this.graph = model.getGraph();
        this.windows = new TokenWindowMatcher(model);
    }

    /**
     * @param position index of the first token to match
     * @param tokens   token list bounded by whitespace sentinels
     * @return key of the cheapest matching rule, or empty if none matches
     */
    public OptionalInt matchAt(int position, List<String> tokens) {
        int best = search(position, tokens, null);
        return best == NO_MATCH ? OptionalInt.empty() : OptionalInt.of(best);
    }

    /**
     * @param position index of the first token to match
     * @param tokens   token list bounded by whitespace sentinels
     * @return keys of every matching rule, most specific first
     */
    public IntList matchAllAt(int position, List<String> tokens) {
        IntArrayList matches = new IntArrayList();
        search(position, tokens, matches);
        matches.sort(null);
        return matches;
    }

    /**
     * @param all collects every match when non-null; otherwise only the best is kept
     * @return the best rule key, or {@link #NO_MATCH}
     */
    private int search(int position, List<String> tokens, IntArrayList all) {
        if (position < 0 || position >= tokens.size()) {
            throw new IndexOutOfBoundsException("Position " + position + " outside tokens of size " + tokens.size());
        }
        int best = Integer.MAX_VALUE;
        IntArrayList stack = new IntArrayList();
        pushChildren(graph.root(), position, tokens, stack);

        while (!stack.isEmpty()) {
            int pos = stack.popInt();
            int nodeIndex = stack.popInt();
            GraphNode node = graph.node(nodeIndex);
            if (all == null && bound(node) >= best) {
                continue;
            }
            if (node instanceof GraphNode.Rule rule) {
                if (windows.satisfies(rule.constraints(), pos - rule.matchLength(), pos, tokens)) {
                    if (all != null) {
                        all.add(rule.ruleKey());
                    } else {
                        best = rule.ruleKey();
                    }
                }
            } else if (node instanceof GraphNode.Branch branch) {
                pushChildren(branch, pos, tokens, stack);
            }
        }
        return best == Integer.MAX_VALUE ? NO_MATCH : best;
    }

    /**
     * Pushes the candidates of a branch node, highest bound first.
     */
    private void pushChildren(GraphNode.Branch branch, int pos, List<String> tokens, IntArrayList stack) {
        IntList rules = branch.ruleChildren();
        int r = rules.size() - 1;

        int tokenChild = NO_MATCH;
        if (pos < tokens.size()) {
            Object2IntMap<String> children = branch.tokenChildren();
            String next = tokens.get(pos);
            if (children.containsKey(next)) {
                tokenChild = children.getInt(next);
            }
        }

        if (tokenChild != NO_MATCH) {
            int childBound = bound(graph.node(tokenChild));
            // Rule children costlier than the token child go beneath it
            while (r >= 0 && bound(graph.node(rules.getInt(r))) > childBound) {
                push(stack, rules.getInt(r--), pos);
            }
            push(stack, tokenChild, pos + 1);
        }
        while (r >= 0) {
            push(stack, rules.getInt(r--), pos);
        }
    }

    private static void push(IntArrayList stack, int node, int pos) {
        stack.add(node);
        stack.add(pos);
    }

    private static int bound(GraphNode node) {
        if (node instanceof GraphNode.Rule rule) {
            return rule.ruleKey();
        }
        if (node instanceof GraphNode.Token token) {
            return token.minRuleKey();
        }
        return Integer.MIN_VALUE;
    }
}
