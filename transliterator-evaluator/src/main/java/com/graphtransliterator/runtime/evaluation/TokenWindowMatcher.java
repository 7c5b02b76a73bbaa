/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.runtime.evaluation;

import com.graphtransliterator.api.model.OnMatchRule;
import com.graphtransliterator.runtime.model.RuleConstraints;
import com.graphtransliterator.runtime.model.TransliteratorModel;

import java.util.List;

/**
 * Compares windows of the token list with literal tokens or token classes.
 *
 * <p>For a match of tokens {@code [matchStart, matchEnd)}, the windows are laid out as
 * {@code prev_classes | prev_tokens | matched tokens | next_tokens | next_classes}.
 * A window that reaches outside the token list never matches.
 */
public final class TokenWindowMatcher {

    private final TransliteratorModel model;

    public TokenWindowMatcher(TransliteratorModel model) {
        this.model = model;
    }

    /**
     * @param constraints the rule's context constraints
     * @param matchStart  index of the first matched token
     * @param matchEnd    index just after the last matched token
     * @param tokens      the token list
     * @return true if every present constraint holds
     */
    public boolean satisfies(RuleConstraints constraints, int matchStart, int matchEnd, List<String> tokens) {
        List<String> prevTokens = constraints.prevTokens();
        List<String> prevClasses = constraints.prevClasses();
        List<String> nextTokens = constraints.nextTokens();
        List<String> nextClasses = constraints.nextClasses();

        if (!prevTokens.isEmpty()
                && !matchesTokens(tokens, matchStart - prevTokens.size(), prevTokens)) {
            return false;
        }
        if (!prevClasses.isEmpty()
                && !matchesClasses(tokens, matchStart - prevTokens.size() - prevClasses.size(), prevClasses)) {
            return false;
        }
        if (!nextTokens.isEmpty() && !matchesTokens(tokens, matchEnd, nextTokens)) {
            return false;
        }
        return nextClasses.isEmpty() || matchesClasses(tokens, matchEnd + nextTokens.size(), nextClasses);
    }

    /**
     * Checks an on-match rule at the boundary just before {@code boundary}.
     */
    public boolean applies(OnMatchRule rule, int boundary, List<String> tokens) {
        return matchesClasses(tokens, boundary - rule.prevClasses().size(), rule.prevClasses())
                && matchesClasses(tokens, boundary, rule.nextClasses());
    }

    public boolean matchesTokens(List<String> tokens, int start, List<String> required) {
        if (start < 0 || start + required.size() > tokens.size()) {
            return false;
        }
        for (int i = 0; i < required.size(); i++) {
            if (!tokens.get(start + i).equals(required.get(i))) {
                return false;
            }
        }
        return true;
    }

    public boolean matchesClasses(List<String> tokens, int start, List<String> classes) {
        if (start < 0 || start + classes.size() > tokens.size()) {
            return false;
        }
        for (int i = 0; i < classes.size(); i++) {
            if (!model.hasClass(tokens.get(start + i), classes.get(i))) {
                return false;
            }
        }
        return true;
    }
}
