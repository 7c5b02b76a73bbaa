/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.compiler.settings;

import com.graphtransliterator.api.model.OnMatchRule;
import com.graphtransliterator.api.model.RuleDefinition;
import com.graphtransliterator.api.model.TransliterationRule;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Parses and formats the compact "easy reading" rule notation.
 *
 * <pre>
 * rule     := [prev] token+ [next]
 * prev     := class+ | "(" class* token+ ")"
 * next     := class+ | "(" token+ class* ")"
 * onmatch  := class+ "+" class+
 * class    := "&lt;" name "&gt;"
 * </pre>
 *
 * Elements are separated by whitespace. A rule string made only of whitespace
 * denotes that whitespace token. A word consisting of a single parenthesis is a
 * token, not a group delimiter.
 */
public final class RuleNotation {

    private static final Pattern CLASS_REF = Pattern.compile("<([^<>\\s]+)>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String ONMATCH_SEPARATOR = "+";

    private RuleNotation() {
    }

    /**
     * Parses a rule string into a direct-format rule definition.
     *
     * @throws IllegalArgumentException if the rule string is malformed
     */
    public static RuleDefinition parseRule(String ruleString, String production) {
        if (ruleString == null || ruleString.isEmpty()) {
            throw new IllegalArgumentException("Empty rule string");
        }
        if (ruleString.isBlank()) {
            return RuleDefinition.of(production, ruleString);
        }

        List<String> words = Arrays.asList(WHITESPACE.split(ruleString.trim()));
        int start = 0;
        int end = words.size();

        List<String> prevClasses = new ArrayList<>();
        List<String> prevTokens = new ArrayList<>();
        List<String> nextTokens = new ArrayList<>();
        List<String> nextClasses = new ArrayList<>();

        // Preceding context
        if (opensGroup(words.get(0))) {
            int close = findClose(words, 0, end);
            if (close < 0) {
                throw malformed(ruleString, "unclosed '('");
            }
            List<String> group = groupWords(words, 0, close);
            int i = 0;
            while (i < group.size() && isClass(group.get(i))) {
                prevClasses.add(className(group.get(i++)));
            }
            while (i < group.size()) {
                String word = group.get(i++);
                if (isClass(word)) {
                    throw malformed(ruleString, "class " + word + " after a token in preceding group");
                }
                prevTokens.add(word);
            }
            start = close + 1;
        } else {
            while (start < end && isClass(words.get(start))) {
                prevClasses.add(className(words.get(start++)));
            }
        }

        // Following context
        if (start < end && closesGroup(words.get(end - 1))) {
            int open = findOpen(words, start, end - 1);
            if (open < 0) {
                throw malformed(ruleString, "unopened ')'");
            }
            List<String> group = groupWords(words, open, end - 1);
            int i = 0;
            while (i < group.size() && !isClass(group.get(i))) {
                nextTokens.add(group.get(i++));
            }
            while (i < group.size()) {
                String word = group.get(i++);
                if (!isClass(word)) {
                    throw malformed(ruleString, "token " + word + " after a class in following group");
                }
                nextClasses.add(className(word));
            }
            end = open;
        } else {
            int firstClass = end;
            while (firstClass > start && isClass(words.get(firstClass - 1))) {
                firstClass--;
            }
            for (int i = firstClass; i < end; i++) {
                nextClasses.add(className(words.get(i)));
            }
            end = firstClass;
        }

        List<String> tokens = new ArrayList<>();
        for (int i = start; i < end; i++) {
            String word = words.get(i);
            if (isClass(word)) {
                throw malformed(ruleString, "class " + word + " among matched tokens");
            }
            if (opensGroup(word) || closesGroup(word)) {
                throw malformed(ruleString, "misplaced group " + word);
            }
            tokens.add(word);
        }
        if (tokens.isEmpty()) {
            throw malformed(ruleString, "no tokens to match");
        }
        return new RuleDefinition(production, prevClasses, prevTokens, tokens, nextTokens, nextClasses);
    }

    /**
     * Parses an on-match string such as {@code "<vowel> + <vowel>"}.
     *
     * @throws IllegalArgumentException if the string is malformed
     */
    public static OnMatchRule parseOnMatch(String onMatchString, String production) {
        if (onMatchString == null || onMatchString.isBlank()) {
            throw new IllegalArgumentException("Empty on-match rule string");
        }
        List<String> words = Arrays.asList(WHITESPACE.split(onMatchString.trim()));
        int separator = words.indexOf(ONMATCH_SEPARATOR);
        if (separator < 0 || separator != words.lastIndexOf(ONMATCH_SEPARATOR)) {
            throw new IllegalArgumentException(
                    "Malformed on-match rule \"" + onMatchString + "\": expected exactly one '+'");
        }
        List<String> prev = classNames(onMatchString, words.subList(0, separator));
        List<String> next = classNames(onMatchString, words.subList(separator + 1, words.size()));
        return new OnMatchRule(prev, next, production);
    }

    /**
     * Formats a rule in easy-reading notation, e.g. {@code (<consonant> b) a <vowel>}.
     */
    public static String format(TransliterationRule rule) {
        StringBuilder out = new StringBuilder();
        if (!rule.prevClasses().isEmpty() && !rule.prevTokens().isEmpty()) {
            out.append('(').append(classes(rule.prevClasses())).append(' ')
                    .append(tokens(rule.prevTokens())).append(") ");
        } else if (!rule.prevClasses().isEmpty()) {
            out.append(classes(rule.prevClasses())).append(' ');
        } else if (!rule.prevTokens().isEmpty()) {
            out.append('(').append(tokens(rule.prevTokens())).append(") ");
        }

        out.append(tokens(rule.tokens()));

        if (!rule.nextTokens().isEmpty() && !rule.nextClasses().isEmpty()) {
            out.append(" (").append(tokens(rule.nextTokens())).append(' ')
                    .append(classes(rule.nextClasses())).append(')');
        } else if (!rule.nextTokens().isEmpty()) {
            out.append(" (").append(tokens(rule.nextTokens())).append(')');
        } else if (!rule.nextClasses().isEmpty()) {
            out.append(' ').append(classes(rule.nextClasses()));
        }
        return out.toString();
    }

    public static String format(OnMatchRule rule) {
        return classes(rule.prevClasses()) + " + " + classes(rule.nextClasses());
    }

    private static boolean isClass(String word) {
        return CLASS_REF.matcher(word).matches();
    }

    private static String className(String word) {
        Matcher m = CLASS_REF.matcher(word);
        if (!m.matches()) {
            throw new IllegalArgumentException("Not a class reference: " + word);
        }
        return m.group(1);
    }

    private static List<String> classNames(String source, List<String> words) {
        if (words.isEmpty()) {
            throw new IllegalArgumentException("Malformed on-match rule \"" + source + "\": missing classes");
        }
        List<String> names = new ArrayList<>(words.size());
        for (String word : words) {
            if (!isClass(word)) {
                throw new IllegalArgumentException(
                        "Malformed on-match rule \"" + source + "\": " + word + " is not a class");
            }
            names.add(className(word));
        }
        return names;
    }

    private static boolean opensGroup(String word) {
        return word.length() > 1 && word.charAt(0) == '(';
    }

    private static boolean closesGroup(String word) {
        return word.length() > 1 && word.charAt(word.length() - 1) == ')';
    }

    private static int findClose(List<String> words, int from, int to) {
        for (int i = from; i < to; i++) {
            String word = words.get(i);
            if (i == from ? word.length() > 2 && word.endsWith(")") : closesGroup(word)) {
                return i;
            }
        }
        return -1;
    }

    private static int findOpen(List<String> words, int from, int to) {
        for (int i = to; i >= from; i--) {
            String word = words.get(i);
            if (i == to ? word.length() > 2 && word.startsWith("(") : opensGroup(word)) {
                return i;
            }
        }
        return -1;
    }

    // Words of a parenthesised group, delimiters stripped
    private static List<String> groupWords(List<String> words, int open, int close) {
        List<String> group = new ArrayList<>(words.subList(open, close + 1));
        group.set(0, group.get(0).substring(1));
        int last = group.size() - 1;
        group.set(last, group.get(last).substring(0, group.get(last).length() - 1));
        group.removeIf(String::isEmpty);
        return group;
    }

    private static IllegalArgumentException malformed(String ruleString, String reason) {
        return new IllegalArgumentException("Malformed rule \"" + ruleString + "\": " + reason);
    }

    private static String tokens(List<String> tokens) {
        return String.join(" ", tokens);
    }

    private static String classes(List<String> classes) {
        return classes.stream().map(c -> "<" + c + ">").collect(Collectors.joining(" "));
    }
}
