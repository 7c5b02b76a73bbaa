/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.compiler.analysis;

import com.graphtransliterator.api.exceptions.AmbiguousRulesException;
import com.graphtransliterator.api.model.TransliterationRule;
import com.graphtransliterator.compiler.settings.RuleNotation;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Detects pairs of equally specific rules that can match the same tokens.
 *
 * <h2>Method</h2>
 * <p>Every rule is laid out as a row of token sets over a common set of columns,
 * aligned on the start of the matched tokens: preceding classes and tokens to
 * the left, matched tokens, following tokens and classes to the right. A literal
 * token contributes a singleton, a class contributes all of its tokens, and
 * unconstrained columns hold every token.
 *
 * <p>Rules with the same number of constraints have the same cost. For each such
 * pair the rows are intersected column by column. An empty column means the
 * rules can never both match. Otherwise the overlap is ambiguous unless some
 * third rule, at most as costly, matches everything in it; that rule is reached
 * first and settles the overlap.
 *
 * <p>Token sets are {@link RoaringBitmap}s over {@link TokenDictionary} IDs.
 *
 * <h2>Usage</h2>
 * <pre>
 * AmbiguityChecker checker = new AmbiguityChecker();
 * AmbiguityReport report = checker.analyze(rules, tokens, tokensByClass);
 * for (RuleAmbiguity ambiguity : report.ambiguities()) {
 *     System.out.println(ambiguity.describe());
 * }
 * </pre>
 */
public class AmbiguityChecker {
    private static final Logger logger = Logger.getLogger(AmbiguityChecker.class.getName());

    /**
     * Analyzes rules for unresolved ambiguities.
     *
     * @param rules         rules sorted by ascending cost
     * @param tokens        every declared token
     * @param tokensByClass Map[class -> tokens carrying it]
     * @return report of every ambiguous pair
     */
    public AmbiguityReport analyze(List<TransliterationRule> rules,
                                   Collection<String> tokens,
                                   Map<String, ? extends Collection<String>> tokensByClass) {
        TokenDictionary dictionary = new TokenDictionary();
        tokens.forEach(dictionary::encode);

        RoaringBitmap universe = new RoaringBitmap();
        universe.add(0L, (long) dictionary.size());

        Map<String, RoaringBitmap> classSets = new LinkedHashMap<>();
        tokensByClass.forEach((tokenClass, members) -> {
            RoaringBitmap set = new RoaringBitmap();
            members.forEach(t -> set.add(dictionary.encode(t)));
            classSets.put(tokenClass, set);
        });

        int maxPrev = 0;
        int maxCurrentAndNext = 0;
        for (TransliterationRule rule : rules) {
            maxPrev = Math.max(maxPrev, rule.prevCount());
            maxCurrentAndNext = Math.max(maxCurrentAndNext, rule.currentAndNextCount());
        }
        int width = maxPrev + maxCurrentAndNext;

        List<RoaringBitmap[]> rows = new ArrayList<>(rules.size());
        for (TransliterationRule rule : rules) {
            rows.add(row(rule, maxPrev, width, universe, classSets, dictionary));
        }

        // Rules of equal constraint count have equal cost
        Map<Integer, IntList> groups = new LinkedHashMap<>();
        for (int key = 0; key < rules.size(); key++) {
            groups.computeIfAbsent(rules.get(key).constraintCount(), k -> new IntArrayList()).add(key);
        }

        List<RuleAmbiguity> ambiguities = new ArrayList<>();
        int pairsCompared = 0;
        for (IntList group : groups.values()) {
            for (int a = 0; a < group.size(); a++) {
                for (int b = a + 1; b < group.size(); b++) {
                    int i = group.getInt(a);
                    int j = group.getInt(b);
                    pairsCompared++;

                    RoaringBitmap[] intersection = intersect(rows.get(i), rows.get(j));
                    if (intersection == null) {
                        continue;
                    }
                    if (isCovered(intersection, i, j, rules, rows)) {
                        continue;
                    }
                    ambiguities.add(new RuleAmbiguity(
                            i, j,
                            decode(intersection, dictionary),
                            RuleNotation.format(rules.get(i)),
                            RuleNotation.format(rules.get(j))));
                }
            }
        }
        return new AmbiguityReport(ambiguities, rules.size(), pairsCompared);
    }

    /**
     * Analyzes rules and fails if any ambiguity is found.
     * Each ambiguity is logged as a warning before failing.
     *
     * @throws AmbiguousRulesException if the report is not empty
     */
    public AmbiguityReport check(List<TransliterationRule> rules,
                                 Collection<String> tokens,
                                 Map<String, ? extends Collection<String>> tokensByClass) {
        AmbiguityReport report = analyze(rules, tokens, tokensByClass);
        if (report.hasAmbiguities()) {
            List<String> descriptions = new ArrayList<>(report.ambiguityCount());
            for (RuleAmbiguity ambiguity : report.ambiguities()) {
                logger.warning(ambiguity.describe());
                descriptions.add(ambiguity.describe());
            }
            throw new AmbiguousRulesException(descriptions);
        }
        return report;
    }

    private RoaringBitmap[] row(TransliterationRule rule, int maxPrev, int width, RoaringBitmap universe,
                                Map<String, RoaringBitmap> classSets, TokenDictionary dictionary) {
        RoaringBitmap[] row = new RoaringBitmap[width];
        int column = 0;
        for (int pad = maxPrev - rule.prevCount(); pad > 0; pad--) {
            row[column++] = universe;
        }
        for (String tokenClass : rule.prevClasses()) {
            row[column++] = classSets.getOrDefault(tokenClass, new RoaringBitmap());
        }
        for (String token : rule.prevTokens()) {
            row[column++] = RoaringBitmap.bitmapOf(dictionary.encode(token));
        }
        for (String token : rule.tokens()) {
            row[column++] = RoaringBitmap.bitmapOf(dictionary.encode(token));
        }
        for (String token : rule.nextTokens()) {
            row[column++] = RoaringBitmap.bitmapOf(dictionary.encode(token));
        }
        for (String tokenClass : rule.nextClasses()) {
            row[column++] = classSets.getOrDefault(tokenClass, new RoaringBitmap());
        }
        while (column < width) {
            row[column++] = universe;
        }
        return row;
    }

    /**
     * @return the column-wise intersection, or null if some column is empty
     */
    private RoaringBitmap[] intersect(RoaringBitmap[] left, RoaringBitmap[] right) {
        RoaringBitmap[] result = new RoaringBitmap[left.length];
        for (int c = 0; c < left.length; c++) {
            result[c] = RoaringBitmap.and(left[c], right[c]);
            if (result[c].isEmpty()) {
                return null;
            }
        }
        return result;
    }

    private boolean isCovered(RoaringBitmap[] intersection, int i, int j,
                              List<TransliterationRule> rules, List<RoaringBitmap[]> rows) {
        double cost = rules.get(i).cost();
        for (int r = 0; r < rules.size(); r++) {
            if (r == i || r == j || rules.get(r).cost() > cost) {
                continue;
            }
            RoaringBitmap[] row = rows.get(r);
            boolean covers = true;
            for (int c = 0; c < intersection.length && covers; c++) {
                covers = RoaringBitmap.andNotCardinality(intersection[c], row[c]) == 0;
            }
            if (covers) {
                return true;
            }
        }
        return false;
    }

    private List<Set<String>> decode(RoaringBitmap[] columns, TokenDictionary dictionary) {
        List<Set<String>> decoded = new ArrayList<>(columns.length);
        for (RoaringBitmap column : columns) {
            Set<String> tokens = new LinkedHashSet<>();
            column.forEach((int id) -> tokens.add(dictionary.decode(id)));
            decoded.add(tokens);
        }
        return decoded;
    }

    /**
     * Report of unresolved ambiguities.
     *
     * @param ambiguities   ambiguous rule pairs, in rule key order
     * @param ruleCount     number of rules analyzed
     * @param pairsCompared number of equal-cost pairs compared
     */
    public record AmbiguityReport(
        List<RuleAmbiguity> ambiguities,
        int ruleCount,
        int pairsCompared
    ) {

        public AmbiguityReport {
            ambiguities = List.copyOf(ambiguities);
        }

        public boolean hasAmbiguities() {
            return !ambiguities.isEmpty();
        }

        public int ambiguityCount() {
            return ambiguities.size();
        }
    }

    /**
     * Two equal-cost rules that can match the same tokens.
     *
     * @param ruleKey1     key of the first rule
     * @param ruleKey2     key of the second rule
     * @param intersection tokens both rules accept, per column
     * @param rule1        first rule in easy-reading notation
     * @param rule2        second rule in easy-reading notation
     */
    public record RuleAmbiguity(
        int ruleKey1,
        int ruleKey2,
        List<Set<String>> intersection,
        String rule1,
        String rule2
    ) {

        /**
         * Returns a human-readable description of this ambiguity.
         */
        public String describe() {
            return String.format("The pattern %s can be matched by both:\n  %s\n  %s\n",
                    intersection, rule1, rule2);
        }
    }
}
