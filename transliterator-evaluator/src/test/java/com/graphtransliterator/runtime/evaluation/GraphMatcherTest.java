package com.graphtransliterator.runtime.evaluation;

import com.graphtransliterator.compiler.TransliteratorCompiler;
import com.graphtransliterator.infra.config.TransliteratorConfig;
import com.graphtransliterator.runtime.model.TransliteratorModel;
import com.graphtransliterator.runtime.tokenize.Tokenizer;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphMatcherTest {

    private GraphMatcher matcher;
    private Tokenizer tokenizer;

    @BeforeEach
    void setUp() {
        // "<marker> a" and "a b" overlap on "x a b"; ambiguity checking is off so both stay
        TransliteratorCompiler compiler = new TransliteratorCompiler(OpenTelemetry.noop().getTracer("test"),
                TransliteratorConfig.defaults().toBuilder().checkAmbiguity(false).build());
        TransliteratorModel model = compiler.compileYaml("""
                tokens:
                  a: [vowel]
                  b: [consonant]
                  x: [consonant, marker]
                  ' ': [wb]
                rules:
                  <marker> a: A_AFTER_X
                  a b: AB
                  a: A
                  b: B
                  x: X
                  ' ': ' '
                whitespace:
                  default: ' '
                  token_class: wb
                  consolidate: true
                """);
        matcher = new GraphMatcher(model);
        tokenizer = new Tokenizer(model);
    }

    @Test
    @DisplayName("Should fall back to a longer path when a cheaper rule fails its context")
    void shouldFindCheapestSatisfiedRule() {
        List<String> tokens = tokenizer.tokenize("ab", false);

        assertThat(matcher.matchAt(1, tokens)).hasValue(1);
        assertThat(matcher.matchAllAt(1, tokens).toIntArray()).containsExactly(1, 2);
    }

    @Test
    @DisplayName("Should prefer the cheapest rule when several match")
    void shouldPreferCheapestRule() {
        List<String> tokens = tokenizer.tokenize("xab", false);

        assertThat(matcher.matchAt(2, tokens)).hasValue(0);
        assertThat(matcher.matchAllAt(2, tokens).toIntArray()).containsExactly(0, 1, 2);
        assertThat(matcher.matchAt(1, tokens)).hasValue(4);
    }

    @Test
    @DisplayName("Should match the whitespace sentinels")
    void shouldMatchSentinels() {
        List<String> tokens = tokenizer.tokenize("a", false);

        assertThat(matcher.matchAt(0, tokens)).hasValue(5);
        assertThat(matcher.matchAt(2, tokens)).hasValue(5);
    }

    @Test
    @DisplayName("Should report no match for a token without rules")
    void shouldReportNoMatch() {
        List<String> tokens = List.of(" ", "zz", " ");

        assertThat(matcher.matchAt(1, tokens)).isEqualTo(OptionalInt.empty());
        assertThat(matcher.matchAllAt(1, tokens).toIntArray()).isEmpty();
    }

    @Test
    @DisplayName("Should reject positions outside the token list")
    void shouldRejectOutOfRangePosition() {
        List<String> tokens = tokenizer.tokenize("a", false);

        assertThatThrownBy(() -> matcher.matchAt(3, tokens)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> matcher.matchAllAt(-1, tokens)).isInstanceOf(IndexOutOfBoundsException.class);
    }
}
