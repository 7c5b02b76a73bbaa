/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.runtime;

import com.graphtransliterator.api.ITransliterator;
import com.graphtransliterator.api.exceptions.NoMatchingRuleException;
import com.graphtransliterator.api.model.EasyReadingSettings;
import com.graphtransliterator.api.model.OnMatchRule;
import com.graphtransliterator.api.model.TransliterationResult;
import com.graphtransliterator.api.model.TransliterationRule;
import com.graphtransliterator.api.model.TransliteratorSettings;
import com.graphtransliterator.api.model.WhitespaceSettings;
import com.graphtransliterator.compiler.TransliteratorCompiler;
import com.graphtransliterator.infra.config.TransliteratorConfig;
import com.graphtransliterator.runtime.evaluation.GraphMatcher;
import com.graphtransliterator.runtime.evaluation.TokenWindowMatcher;
import com.graphtransliterator.runtime.model.MatchingGraph;
import com.graphtransliterator.runtime.model.OnMatchIndex;
import com.graphtransliterator.runtime.model.TransliteratorModel;
import com.graphtransliterator.runtime.serialization.TransliteratorSerializer;
import com.graphtransliterator.runtime.tokenize.Tokenizer;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Transliterates text with a compiled, context-sensitive rule set.
 *
 * <h2>Algorithm</h2>
 * <p>The input is tokenized and bracketed by whitespace sentinels. Scanning
 * the tokens between the sentinels from left to right, the cheapest rule
 * matching at the current position is applied: any on-match production for the
 * boundary is emitted first, then the rule's production, and the position
 * advances past the rule's tokens.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * GraphTransliterator gt = GraphTransliterator.fromYaml("""
 *     tokens:
 *       a: [vowel]
 *       ' ': [wb]
 *     rules:
 *       a: A
 *       ' ': ' '
 *     whitespace:
 *       default: ' '
 *       token_class: wb
 *       consolidate: false
 *     """);
 * gt.transliterate("a a"); // "A A"
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Instances are immutable apart from the last-call record, which is replaced
 * as a whole after each call. Concurrent calls are safe; the last-call accessors
 * then reflect whichever call finished last. Prefer
 * {@link #transliterateWithDetails(String)} for per-call details.
 */
public final class GraphTransliterator implements ITransliterator {
    private static final Logger logger = LoggerFactory.getLogger(GraphTransliterator.class);

    private static final Tracer NOOP_TRACER = OpenTelemetry.noop().getTracer("graph-transliterator");

    private final TransliteratorModel model;
    private final Tracer tracer;
    private final Tokenizer tokenizer;
    private final GraphMatcher matcher;
    private final TokenWindowMatcher windows;

    // Record of the most recent call, published whole
    private volatile TransliterationResult lastResult = TransliterationResult.EMPTY;

    public GraphTransliterator(TransliteratorModel model) {
        this(model, NOOP_TRACER);
    }

    public GraphTransliterator(TransliteratorModel model, Tracer tracer) {
        this.model = Objects.requireNonNull(model, "model");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.tokenizer = new Tokenizer(model);
        this.matcher = new GraphMatcher(model);
        this.windows = new TokenWindowMatcher(model);
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // FACTORIES
    // ════════════════════════════════════════════════════════════════════════════════

    public static GraphTransliterator fromSettings(TransliteratorSettings settings) {
        return fromSettings(settings, TransliteratorConfig.defaults());
    }

    public static GraphTransliterator fromSettings(TransliteratorSettings settings, TransliteratorConfig config) {
        return new GraphTransliterator(new TransliteratorCompiler(NOOP_TRACER, config).compile(settings));
    }

    public static GraphTransliterator fromEasyReading(EasyReadingSettings settings) {
        return fromEasyReading(settings, TransliteratorConfig.defaults());
    }

    public static GraphTransliterator fromEasyReading(EasyReadingSettings settings, TransliteratorConfig config) {
        return new GraphTransliterator(new TransliteratorCompiler(NOOP_TRACER, config).compile(settings));
    }

    public static GraphTransliterator fromYaml(String yaml) {
        return fromYaml(yaml, TransliteratorConfig.defaults());
    }

    public static GraphTransliterator fromYaml(String yaml, TransliteratorConfig config) {
        return new GraphTransliterator(new TransliteratorCompiler(NOOP_TRACER, config).compileYaml(yaml));
    }

    public static GraphTransliterator fromYamlFile(Path path) throws IOException {
        return fromYamlFile(path, TransliteratorConfig.defaults());
    }

    public static GraphTransliterator fromYamlFile(Path path, TransliteratorConfig config) throws IOException {
        return new GraphTransliterator(new TransliteratorCompiler(NOOP_TRACER, config).compile(path));
    }

    /**
     * Restores a transliterator from {@link #dump()} output without recompiling.
     */
    public static GraphTransliterator load(Map<String, ?> dumped) {
        return new GraphTransliterator(new TransliteratorSerializer().load(dumped));
    }

    /**
     * Restores a transliterator from {@link #dumps()} output without recompiling.
     */
    public static GraphTransliterator loads(String json) {
        return new GraphTransliterator(new TransliteratorSerializer().loads(json));
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // TRANSLITERATION
    // ════════════════════════════════════════════════════════════════════════════════

    @Override
    public List<String> tokenize(String input) {
        Objects.requireNonNull(input, "input");
        return tokenizer.tokenize(input, model.isIgnoreErrors());
    }

    @Override
    public String transliterate(String input) {
        return transliterateWithDetails(input).output();
    }

    @Override
    public TransliterationResult transliterateWithDetails(String input) {
        Objects.requireNonNull(input, "input");
        Span span = tracer.spanBuilder("transliterate").startSpan();
        List<String> tokens = List.of();
        StringBuilder output = new StringBuilder();
        IntArrayList ruleKeys = new IntArrayList();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("inputLength", input.length());

            tokens = tokenize(input);
            boolean hasOnMatchRules = !model.getOnMatchRules().isEmpty();

            int i = 1;
            while (i < tokens.size() - 1) {
                OptionalInt match = matcher.matchAt(i, tokens);
                if (match.isEmpty()) {
                    logger.warn("No matching transliteration rule at token index {} ({}) of {}",
                            i, tokens.get(i), tokens);
                    if (model.isIgnoreErrors()) {
                        i++;
                        continue;
                    }
                    throw new NoMatchingRuleException(tokens, i);
                }
                int ruleKey = match.getAsInt();
                TransliterationRule rule = model.getRule(ruleKey);
                if (hasOnMatchRules) {
                    appendOnMatch(output, tokens, i);
                }
                output.append(rule.production());
                ruleKeys.add(ruleKey);
                i += rule.tokens().size();
            }

            TransliterationResult result = new TransliterationResult(output.toString(), tokens, ruleKeys);
            lastResult = result;
            span.setAttribute("tokenCount", tokens.size());
            span.setAttribute("matchCount", result.matchCount());
            return result;
        } catch (RuntimeException e) {
            // A failed call still replaces the last-call record, with what it got through
            lastResult = new TransliterationResult(output.toString(), tokens, ruleKeys);
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Emits the production of the first on-match rule applying at the boundary
     * before {@code boundary}, if any.
     */
    private void appendOnMatch(StringBuilder output, List<String> tokens, int boundary) {
        IntList candidates = model.getOnMatchIndex().candidates(tokens.get(boundary), tokens.get(boundary - 1));
        for (int c = 0; c < candidates.size(); c++) {
            OnMatchRule onMatch = model.getOnMatchRules().get(candidates.getInt(c));
            if (windows.applies(onMatch, boundary, tokens)) {
                output.append(onMatch.production());
                return;
            }
        }
    }

    /**
     * @param position index of the first token to match
     * @param tokens   token list bounded by whitespace sentinels, as from {@link #tokenize(String)}
     * @return key of the cheapest rule matching at {@code position}, or empty
     */
    public OptionalInt matchAt(int position, List<String> tokens) {
        return matcher.matchAt(position, tokens);
    }

    /**
     * @return keys of every rule matching at {@code position}, most specific first
     */
    public IntList matchAllAt(int position, List<String> tokens) {
        return matcher.matchAllAt(position, tokens);
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // DERIVED INSTANCES
    // ════════════════════════════════════════════════════════════════════════════════

    /**
     * Returns a new transliterator without the rules producing any of {@code productions}.
     * The rule set is recompiled; ambiguity is checked if it was for this instance.
     */
    public GraphTransliterator prunedOf(Collection<String> productions) {
        Set<String> pruned = new HashSet<>(productions);
        List<TransliterationRule> kept = new ArrayList<>();
        for (TransliterationRule rule : model.getRules()) {
            if (!pruned.contains(rule.production())) {
                kept.add(rule);
            }
        }
        logger.debug("Pruning {} of {} rules", model.getRules().size() - kept.size(), model.getRules().size());
        TransliteratorModel prunedModel = new TransliteratorCompiler(tracer).recompile(model, kept);
        return new GraphTransliterator(prunedModel, tracer);
    }

    /**
     * Returns a transliterator sharing this compiled rule set with a different error policy.
     */
    public GraphTransliterator withIgnoreErrors(boolean ignoreErrors) {
        if (ignoreErrors == model.isIgnoreErrors()) {
            return this;
        }
        return new GraphTransliterator(model.withIgnoreErrors(ignoreErrors), tracer);
    }

    public Map<String, Object> dump() {
        return new TransliteratorSerializer().dump(model);
    }

    public String dumps() {
        return new TransliteratorSerializer().dumps(model);
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // ACCESSORS
    // ════════════════════════════════════════════════════════════════════════════════

    public TransliteratorModel model() {
        return model;
    }

    public List<TransliterationRule> rules() {
        return model.getRules();
    }

    public Map<String, Set<String>> tokens() {
        return model.getTokens();
    }

    public Map<String, Set<String>> tokensByClass() {
        return model.getTokensByClass();
    }

    /**
     * @return rule productions in rule key order
     */
    public List<String> productions() {
        return model.getRules().stream().map(TransliterationRule::production).toList();
    }

    public WhitespaceSettings whitespace() {
        return model.getWhitespace();
    }

    public List<OnMatchRule> onMatchRules() {
        return model.getOnMatchRules();
    }

    public OnMatchIndex onMatchIndex() {
        return model.getOnMatchIndex();
    }

    public Map<String, Object> metadata() {
        return model.getMetadata();
    }

    public MatchingGraph graph() {
        return model.getGraph();
    }

    public String tokenizerPattern() {
        return model.getTokenizerPattern().pattern();
    }

    public String version() {
        return model.getVersion();
    }

    public boolean ignoreErrors() {
        return model.isIgnoreErrors();
    }

    public boolean checkAmbiguity() {
        return model.isCheckAmbiguity();
    }

    /**
     * @return rules applied by the most recent call, in input order
     */
    public List<TransliterationRule> lastMatchedRules() {
        TransliterationResult result = lastResult;
        List<TransliterationRule> rules = new ArrayList<>(result.matchCount());
        for (int i = 0; i < result.ruleKeys().size(); i++) {
            rules.add(model.getRule(result.ruleKeys().getInt(i)));
        }
        return rules;
    }

    /**
     * @return tokens of each rule applied by the most recent call, in input order
     */
    public List<List<String>> lastMatchedRuleTokens() {
        return lastMatchedRules().stream().map(TransliterationRule::tokens).toList();
    }

    /**
     * @return tokens of the most recent call's input, including sentinels
     */
    public List<String> lastInputTokens() {
        return lastResult.inputTokens();
    }

    @Override
    public String toString() {
        return "GraphTransliterator[" + model + "]";
    }
}
