/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.compiler;

import com.graphtransliterator.api.model.TransliterationRule;
import com.graphtransliterator.runtime.model.GraphNode;
import com.graphtransliterator.runtime.model.MatchingGraph;
import com.graphtransliterator.runtime.model.RuleConstraints;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the {@link MatchingGraph} from the cost-sorted rule list.
 *
 * Each rule's tokens are inserted as a path from the root, reusing nodes for
 * shared prefixes, and terminated by a rule node holding the rule's context
 * constraints. Rules are inserted in rule key order, so sibling rule nodes end
 * up in ascending key (ascending cost) order, and the first rule to pass through
 * a token node is its cheapest descendant.
 */
public class GraphBuilder {

    /**
     * @param rules rules sorted by ascending cost
     */
    public MatchingGraph build(List<TransliterationRule> rules) {
        List<Draft> drafts = new ArrayList<>();
        drafts.add(new Draft(null, Integer.MAX_VALUE));

        for (int ruleKey = 0; ruleKey < rules.size(); ruleKey++) {
            TransliterationRule rule = rules.get(ruleKey);
            int current = MatchingGraph.ROOT;
            for (String token : rule.tokens()) {
                Draft parent = drafts.get(current);
                int child = parent.tokenChildren.getInt(token);
                if (child < 0) {
                    child = drafts.size();
                    drafts.add(new Draft(token, ruleKey));
                    parent.tokenChildren.put(token, child);
                }
                current = child;
            }
            int ruleNode = drafts.size();
            Draft leaf = new Draft(null, ruleKey);
            leaf.rule = new GraphNode.Rule(ruleKey, rule.tokens().size(), RuleConstraints.of(rule));
            drafts.add(leaf);
            drafts.get(current).ruleChildren.add(ruleNode);
        }

        List<GraphNode> nodes = new ArrayList<>(drafts.size());
        for (int i = 0; i < drafts.size(); i++) {
            nodes.add(drafts.get(i).freeze(i == MatchingGraph.ROOT));
        }
        return new MatchingGraph(nodes);
    }

    // Mutable node used during construction
    private static final class Draft {
        final String token;
        final int minRuleKey;
        final Object2IntMap<String> tokenChildren = new Object2IntLinkedOpenHashMap<>();
        final IntArrayList ruleChildren = new IntArrayList();
        GraphNode.Rule rule;

        Draft(String token, int minRuleKey) {
            this.token = token;
            this.minRuleKey = minRuleKey;
            this.tokenChildren.defaultReturnValue(-1);
        }

        GraphNode freeze(boolean root) {
            if (rule != null) {
                return rule;
            }
            if (root) {
                return new GraphNode.Start(tokenChildren, ruleChildren);
            }
            return new GraphNode.Token(token, minRuleKey, tokenChildren, ruleChildren);
        }
    }
}
