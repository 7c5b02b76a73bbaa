/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.compiler;

import com.graphtransliterator.api.CompilationListener;
import com.graphtransliterator.api.ITransliteratorCompiler;
import com.graphtransliterator.api.exceptions.TransliteratorException;
import com.graphtransliterator.api.model.EasyReadingSettings;
import com.graphtransliterator.api.model.OnMatchRule;
import com.graphtransliterator.api.model.RuleDefinition;
import com.graphtransliterator.api.model.TransliterationRule;
import com.graphtransliterator.api.model.TransliteratorSettings;
import com.graphtransliterator.compiler.analysis.AmbiguityChecker;
import com.graphtransliterator.compiler.settings.EasyReadingConverter;
import com.graphtransliterator.compiler.settings.SettingsReader;
import com.graphtransliterator.compiler.settings.SettingsValidator;
import com.graphtransliterator.infra.config.TransliteratorConfig;
import com.graphtransliterator.runtime.model.MatchingGraph;
import com.graphtransliterator.runtime.model.OnMatchIndex;
import com.graphtransliterator.runtime.model.TransliteratorModel;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Compiles transliterator settings into an executable {@link TransliteratorModel}.
 *
 * The compilation process involves several steps:
 * 1. Validating token, class and rule references (all errors collected).
 * 2. Computing rule costs and stably sorting rules by cost.
 * 3. Building the tokenizer pattern and the matching graph.
 * 4. Indexing on-match rules by boundary tokens.
 * 5. Checking equal-cost rules for ambiguity, unless disabled.
 *
 * Instances are stateless apart from the tracer, listener and configuration,
 * and may be reused.
 */
public class TransliteratorCompiler implements ITransliteratorCompiler {
    private static final Logger logger = Logger.getLogger(TransliteratorCompiler.class.getName());

    static final String STAGE_VALIDATION = "VALIDATION";
    static final String STAGE_RULE_ORDERING = "RULE_ORDERING";
    static final String STAGE_GRAPH_BUILDING = "GRAPH_BUILDING";
    static final String STAGE_ONMATCH_INDEXING = "ONMATCH_INDEXING";
    static final String STAGE_AMBIGUITY_CHECK = "AMBIGUITY_CHECK";
    private static final int TOTAL_STAGES = 5;

    private final SettingsReader settingsReader = new SettingsReader();
    private final SettingsValidator validator = new SettingsValidator();
    private final GraphBuilder graphBuilder = new GraphBuilder();
    private final OnMatchIndexBuilder onMatchIndexBuilder = new OnMatchIndexBuilder();
    private final AmbiguityChecker ambiguityChecker = new AmbiguityChecker();
    private final TransliteratorConfig config;
    private Tracer tracer;
    private CompilationListener listener;

    public TransliteratorCompiler() {
        this(OpenTelemetry.noop().getTracer("graph-transliterator"), TransliteratorConfig.defaults());
    }

    public TransliteratorCompiler(Tracer tracer) {
        this(tracer, TransliteratorConfig.defaults());
    }

    public TransliteratorCompiler(Tracer tracer, TransliteratorConfig config) {
        this.tracer = tracer;
        this.config = config;
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public void setCompilationListener(CompilationListener listener) {
        this.listener = listener;
    }

    public TransliteratorConfig getConfig() {
        return config;
    }

    /**
     * Compiles easy-reading settings from a YAML file.
     *
     * @throws IOException If the file cannot be read.
     */
    public TransliteratorModel compile(Path yamlFile) throws IOException {
        return compile(settingsReader.readYamlFile(yamlFile));
    }

    /**
     * Compiles easy-reading settings from a YAML string.
     */
    public TransliteratorModel compileYaml(String yaml) {
        return compile(settingsReader.readYaml(yaml));
    }

    @Override
    public TransliteratorModel compile(EasyReadingSettings settings) {
        return compile(EasyReadingConverter.toDirect(settings));
    }

    @Override
    public TransliteratorModel compile(TransliteratorSettings settings) {
        Span span = tracer.spanBuilder("compile-transliterator").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long startTime = System.nanoTime();

            runStage(STAGE_VALIDATION, 1, () -> {
                validate(settings);
                return Map.of("tokenCount", settings.tokens().size(), "ruleCount", settings.rules().size());
            });

            List<TransliterationRule> rules = runStage(STAGE_RULE_ORDERING, 2, () -> orderRules(settings.rules()),
                    sorted -> Map.of("ruleCount", sorted.size()));
            span.setAttribute("ruleCount", rules.size());

            TransliteratorModel model = assemble(settings.tokens(), rules, settings.onMatchRules(),
                    new TransliteratorModel.Builder()
                    .whitespace(settings.whitespace())
                    .metadata(settings.metadata())
                    .checkAmbiguity(config.checkAmbiguity())
                    .ignoreErrors(config.ignoreErrors())
                    .version(config.version()));

            long compilationTime = System.nanoTime() - startTime;
            span.setAttribute("compilationTimeMs", TimeUnit.NANOSECONDS.toMillis(compilationTime));
            logger.fine(() -> "Compiled " + model + " in " + TimeUnit.NANOSECONDS.toMillis(compilationTime) + " ms");
            return model;
        } catch (TransliteratorException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Rebuilds a model from an already compiled one, keeping its tokens, whitespace,
     * on-match rules, metadata and options, with a different rule list.
     * Settings are not validated again.
     *
     * @param base  the model to derive from
     * @param rules the new rules, in any order; they are sorted by cost
     */
    public TransliteratorModel recompile(TransliteratorModel base, List<TransliterationRule> rules) {
        Span span = tracer.spanBuilder("recompile-transliterator").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("ruleCount", rules.size());
            List<TransliterationRule> sorted = new ArrayList<>(rules);
            sorted.sort(TransliterationRule.BY_COST);

            Map<String, List<String>> tokens = new LinkedHashMap<>();
            base.getTokens().forEach((token, classes) -> tokens.put(token, List.copyOf(classes)));

            return assemble(tokens, sorted, base.getOnMatchRules(),
                    new TransliteratorModel.Builder()
                    .whitespace(base.getWhitespace())
                    .metadata(base.getMetadata())
                    .checkAmbiguity(base.isCheckAmbiguity())
                    .ignoreErrors(base.isIgnoreErrors())
                    .version(base.getVersion()));
        } catch (TransliteratorException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private void validate(TransliteratorSettings settings) {
        Span span = tracer.spanBuilder("validate-settings").startSpan();
        try (Scope scope = span.makeCurrent()) {
            validator.validateOrThrow(settings);
        } finally {
            span.end();
        }
    }

    /**
     * Computes rule costs and sorts by ascending cost. The sort is stable, so
     * rules of equal cost keep their declaration order.
     */
    static List<TransliterationRule> orderRules(List<RuleDefinition> definitions) {
        List<TransliterationRule> rules = new ArrayList<>(definitions.size());
        for (RuleDefinition definition : definitions) {
            rules.add(TransliterationRule.of(definition));
        }
        rules.sort(TransliterationRule.BY_COST);
        return rules;
    }

    private TransliteratorModel assemble(Map<String, List<String>> tokens,
                                         List<TransliterationRule> rules,
                                         List<OnMatchRule> onMatchRules,
                                         TransliteratorModel.Builder builder) {
        builder.tokens(tokens).rules(rules).onMatchRules(onMatchRules);
        Map<String, Set<String>> tokensByClass = indexByClass(tokens);

        MatchingGraph graph = runStage(STAGE_GRAPH_BUILDING, 3, () -> {
            builder.tokenizerPattern(TokenizerPatternBuilder.compile(tokens.keySet()));
            return buildGraph(rules);
        }, g -> Map.of("nodeCount", g.nodeCount(), "edgeCount", g.edgeCount()));
        builder.graph(graph);

        OnMatchIndex onMatchIndex = runStage(STAGE_ONMATCH_INDEXING, 4,
                () -> buildOnMatchIndex(onMatchRules, tokensByClass),
                index -> Map.of("indexedTokens", index.asMap().size()));
        builder.onMatchIndex(onMatchIndex);

        TransliteratorModel model = builder.build();
        if (model.isCheckAmbiguity()) {
            runStage(STAGE_AMBIGUITY_CHECK, 5, () -> checkAmbiguity(rules, tokens, tokensByClass),
                    report -> Map.of("pairsCompared", report.pairsCompared()));
        } else {
            logger.fine("Ambiguity check disabled");
        }
        return model;
    }

    private MatchingGraph buildGraph(List<TransliterationRule> rules) {
        Span span = tracer.spanBuilder("build-graph").startSpan();
        try (Scope scope = span.makeCurrent()) {
            MatchingGraph graph = graphBuilder.build(rules);
            span.setAttribute("nodeCount", graph.nodeCount());
            return graph;
        } finally {
            span.end();
        }
    }

    private OnMatchIndex buildOnMatchIndex(List<OnMatchRule> onMatchRules, Map<String, Set<String>> tokensByClass) {
        Span span = tracer.spanBuilder("build-onmatch-index").startSpan();
        try (Scope scope = span.makeCurrent()) {
            return onMatchIndexBuilder.build(onMatchRules, tokensByClass);
        } finally {
            span.end();
        }
    }

    private AmbiguityChecker.AmbiguityReport checkAmbiguity(List<TransliterationRule> rules,
                                                            Map<String, List<String>> tokens,
                                                            Map<String, Set<String>> tokensByClass) {
        Span span = tracer.spanBuilder("check-ambiguity").startSpan();
        try (Scope scope = span.makeCurrent()) {
            AmbiguityChecker.AmbiguityReport report = ambiguityChecker.check(rules, tokens.keySet(), tokensByClass);
            span.setAttribute("pairsCompared", report.pairsCompared());
            return report;
        } catch (TransliteratorException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    static Map<String, Set<String>> indexByClass(Map<String, List<String>> tokens) {
        Map<String, Set<String>> byClass = new LinkedHashMap<>();
        tokens.forEach((token, classes) -> {
            for (String tokenClass : classes) {
                byClass.computeIfAbsent(tokenClass, k -> new LinkedHashSet<>()).add(token);
            }
        });
        return byClass;
    }

    private void runStage(String stageName, int stageNumber, Supplier<Map<String, Object>> stage) {
        runStage(stageName, stageNumber, stage, metrics -> metrics);
    }

    private <T> T runStage(String stageName, int stageNumber, Supplier<T> stage,
                           Function<T, Map<String, Object>> metrics) {
        if (listener != null) {
            listener.onStageStart(stageName, stageNumber, TOTAL_STAGES);
        }
        long start = System.nanoTime();
        T result;
        try {
            result = stage.get();
        } catch (RuntimeException e) {
            if (listener != null) {
                listener.onError(stageName, e);
            }
            throw e;
        }
        long duration = System.nanoTime() - start;
        logger.fine(() -> String.format("Stage %s completed in %d us", stageName, duration / 1_000));
        if (listener != null) {
            listener.onStageComplete(stageName,
                    new CompilationListener.StageResult(stageName, duration, metrics.apply(result)));
        }
        return result;
    }
}
