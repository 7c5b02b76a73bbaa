package com.graphtransliterator.runtime;

import com.graphtransliterator.api.exceptions.AmbiguousRulesException;
import com.graphtransliterator.api.exceptions.InvalidSettingsException;
import com.graphtransliterator.api.exceptions.NoMatchingRuleException;
import com.graphtransliterator.api.exceptions.UnrecognizableInputTokenException;
import com.graphtransliterator.api.model.OnMatchRule;
import com.graphtransliterator.api.model.RuleDefinition;
import com.graphtransliterator.api.model.TransliterationResult;
import com.graphtransliterator.api.model.TransliterationRule;
import com.graphtransliterator.api.model.TransliteratorSettings;
import com.graphtransliterator.api.model.WhitespaceSettings;
import com.graphtransliterator.infra.config.TransliteratorConfig;
import com.graphtransliterator.runtime.model.NodeType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphTransliteratorTest {

    static final String CONTEXT_YAML = """
            tokens:
              a: [class_a]
              b: [class_b]
              c: [class_c]
              ' ': [wb]
              Aa: [constrained_rule]
            rules:
              a: A
              b: B
              <class_c> a: A(AFTER_CLASS_C)
              (<class_c> b) a: A(AFTER_B_AND_CLASS_C)
              (<class_c> b b) a: A(AFTER_BB_AND_CLASS_C)
              a <class_c>: A(BEFORE_CLASS_C)
              a (c <class_b>): A(BEFORE_C_AND_CLASS_B)
              c: C
              c c: C*2
              a (b b): A(BEFORE_B_B)
              (b b) a: A(AFTER_B_B)
              <wb> Aa: A(ONLY_A_CONSTRAINED_RULE)
            onmatch_rules:
              - <class_a> <class_b> + <class_a> <class_b>: '!'
              - <class_a> + <class_b>: ','
            whitespace:
              default: ' '
              token_class: wb
              consolidate: true
            """;

    static final TransliteratorConfig UNCHECKED =
            TransliteratorConfig.defaults().toBuilder().checkAmbiguity(false).build();

    static GraphTransliterator contextTransliterator() {
        return GraphTransliterator.fromYaml(CONTEXT_YAML, UNCHECKED);
    }

    @Nested
    @DisplayName("Context-sensitive transliteration")
    class ContextRules {

        private final GraphTransliterator gt = contextTransliterator();

        @ParameterizedTest(name = "\"{0}\" -> \"{1}\"")
        @CsvSource(delimiter = '|', value = {
                "a    | A",
                "aa   | AA",
                "cc   | C*2",
                "ca   | CA(AFTER_CLASS_C)",
                "cba  | CBA(AFTER_B_AND_CLASS_C)",
                "cbba | CBBA(AFTER_BB_AND_CLASS_C)",
                "ac   | A(BEFORE_CLASS_C)C",
                "acb  | A(BEFORE_C_AND_CLASS_B)CB",
                "ab   | A,B",
                "Aa   | A(ONLY_A_CONSTRAINED_RULE)",
                "abab | A,B!A,B"
        })
        @DisplayName("Should apply the most specific matching rule")
        void shouldTransliterate(String input, String expected) {
            assertThat(gt.transliterate(input)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Should ignore whitespace at the edges when consolidating")
        void shouldConsolidateEdges() {
            assertThat(gt.transliterate(" a")).isEqualTo("A");
            assertThat(gt.transliterate("a ")).isEqualTo("A");
            assertThat(gt.transliterate("")).isEmpty();
        }

        @Test
        @DisplayName("Should record the rules applied by the last call")
        void shouldRecordLastMatches() {
            gt.transliterate("abab");

            assertThat(gt.lastMatchedRuleTokens())
                    .containsExactly(List.of("a"), List.of("b"), List.of("a"), List.of("b"));
            assertThat(gt.lastMatchedRules()).hasSize(4)
                    .extracting(TransliterationRule::production)
                    .containsExactly("A", "B", "A", "B");
            assertThat(gt.lastInputTokens()).containsExactly(" ", "a", "b", "a", "b", " ");
        }

        @Test
        @DisplayName("Should return per-call details")
        void shouldReturnDetails() {
            TransliterationResult result = gt.transliterateWithDetails("cbba");

            assertThat(result.output()).isEqualTo("CBBA(AFTER_BB_AND_CLASS_C)");
            assertThat(result.matchCount()).isEqualTo(4);
            assertThat(gt.rules().get(result.ruleKeys().getInt(3)).production())
                    .isEqualTo("A(AFTER_BB_AND_CLASS_C)");
        }

        @Test
        @DisplayName("Should order rules from most to least specific")
        void shouldOrderRulesByCost() {
            List<TransliterationRule> rules = gt.rules();

            assertThat(rules.get(0).production()).isEqualTo("A(AFTER_BB_AND_CLASS_C)");
            for (int i = 1; i < rules.size(); i++) {
                assertThat(rules.get(i - 1).cost()).isLessThanOrEqualTo(rules.get(i).cost());
            }
            assertThat(gt.productions()).hasSize(12).endsWith("A", "B", "C");
        }

        @Test
        @DisplayName("Compiling these rules with ambiguity checking should fail")
        void shouldBeAmbiguous() {
            assertThatThrownBy(() -> GraphTransliterator.fromYaml(CONTEXT_YAML))
                    .isInstanceOf(AmbiguousRulesException.class)
                    .hasMessageContaining("<class_c> a")
                    .hasMessageContaining("a <class_c>");
        }
    }

    @Test
    @DisplayName("On-match productions should be inserted between matches")
    void shouldInsertOnMatchProductions() {
        Map<String, List<String>> tokens = new LinkedHashMap<>();
        tokens.put("a", List.of("class1"));
        tokens.put("b", List.of("class2"));
        tokens.put(" ", List.of("wb"));
        TransliteratorSettings settings = new TransliteratorSettings(tokens,
                List.of(RuleDefinition.of("A", "a"),
                        RuleDefinition.of("B", "b"),
                        RuleDefinition.of(" ", " "),
                        new RuleDefinition("A*", List.of("class2"), List.of("a"), List.of("a"),
                                List.of("a"), List.of("class2"))),
                new WhitespaceSettings(" ", "wb", false),
                List.of(new OnMatchRule(List.of("class1"), List.of("class1"), ",")),
                Map.of("source", "example"));

        GraphTransliterator gt = GraphTransliterator.fromSettings(settings);

        assertThat(gt.transliterate("baaab")).isEqualTo("BA,A*,AB");
        assertThat(gt.metadata()).containsEntry("source", "example");
        assertThat(gt.checkAmbiguity()).isTrue();
    }

    @Test
    @DisplayName("On-match productions should not apply across whitespace")
    void shouldNotInsertOnMatchAcrossWhitespace() {
        GraphTransliterator gt = GraphTransliterator.fromYaml("""
                tokens:
                  a: [class1]
                  b: [class2]
                  ' ': [wb]
                rules:
                  a: A
                  b: B
                  ' ': ' '
                onmatch_rules:
                  - <class1> + <class2>: ','
                whitespace:
                  default: ' '
                  token_class: wb
                  consolidate: false
                """);

        assertThat(gt.transliterate("a b")).isEqualTo("A B");
        assertThat(gt.transliterate("ab")).isEqualTo("A,B");
    }

    @Test
    @DisplayName("Should resolve Unicode character names in YAML files")
    void shouldLoadYamlFile(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("settings.yaml");
        Files.writeString(file, """
                tokens:
                  a: [token, class1]
                  b: [token, class2]
                  u: [token]
                  ' ': [wb]
                rules:
                  a: A
                  b: B
                  <wb> u: \\N{DEVANAGARI LETTER U}
                onmatch_rules:
                  - <class1> + <class2>: ','
                  - <class1> + <token>: \\N{DEVANAGARI SIGN VIRAMA}
                whitespace:
                  default: ' '
                  token_class: wb
                  consolidate: true
                """);

        GraphTransliterator gt = GraphTransliterator.fromYamlFile(file);

        assertThat(gt.tokens().keySet()).containsExactly("a", "b", "u", " ");
        assertThat(gt.onMatchRules().get(1).production()).isEqualTo("्");
        assertThat(gt.transliterate("ab")).isEqualTo("A,B");
        assertThat(gt.transliterate("u")).isEqualTo("उ");
        assertThat(gt.whitespace().consolidate()).isTrue();
    }

    @Test
    @DisplayName("Should report validation errors when building from settings")
    void shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> GraphTransliterator.fromYaml("""
                tokens:
                  a: [vowel]
                  ' ': [wb]
                rules:
                  b: B
                  <consonant> a: A
                whitespace:
                  default: ' '
                  token_class: wb
                  consolidate: true
                """))
                .isInstanceOf(InvalidSettingsException.class)
                .hasMessageContaining("unknown token 'b'")
                .hasMessageContaining("unknown class 'consonant'");
    }

    @Nested
    @DisplayName("Error handling")
    class Errors {

        private static final String YAML = """
                tokens:
                  a: [class1]
                  b: [class1]
                  ' ': [wb]
                rules:
                  a a: B2
                  b: b
                whitespace:
                  default: ' '
                  consolidate: true
                  token_class: wb
                """;

        @Test
        @DisplayName("Should fail when no rule matches")
        void shouldFailWithoutMatchingRule() {
            GraphTransliterator gt = GraphTransliterator.fromYaml(YAML);

            assertThatThrownBy(() -> gt.transliterate("a"))
                    .isInstanceOf(NoMatchingRuleException.class)
                    .satisfies(e -> {
                        NoMatchingRuleException ex = (NoMatchingRuleException) e;
                        assertThat(ex.getIndex()).isEqualTo(1);
                        assertThat(ex.getTokens()).containsExactly(" ", "a", " ");
                    });
        }

        @Test
        @DisplayName("A failed call should replace the last-call record")
        void shouldReplaceLastMatchesOnFailure() {
            GraphTransliterator gt = GraphTransliterator.fromYaml(YAML);
            assertThat(gt.transliterate("bb")).isEqualTo("bb");
            assertThat(gt.lastMatchedRules()).hasSize(2);

            assertThatThrownBy(() -> gt.transliterate("ba"))
                    .isInstanceOf(NoMatchingRuleException.class);
            assertThat(gt.lastInputTokens()).containsExactly(" ", "b", "a", " ");
            assertThat(gt.lastMatchedRuleTokens()).containsExactly(List.of("b"));

            assertThatThrownBy(() -> gt.transliterate("!"))
                    .isInstanceOf(UnrecognizableInputTokenException.class);
            assertThat(gt.lastInputTokens()).isEmpty();
            assertThat(gt.lastMatchedRules()).isEmpty();
        }

        @Test
        @DisplayName("Should fail on unrecognizable input")
        void shouldFailOnUnrecognizableInput() {
            GraphTransliterator gt = GraphTransliterator.fromYaml(YAML);

            assertThatThrownBy(() -> gt.transliterate("!"))
                    .isInstanceOf(UnrecognizableInputTokenException.class);
            assertThatThrownBy(() -> gt.transliterate("b!"))
                    .isInstanceOf(UnrecognizableInputTokenException.class);
        }

        @Test
        @DisplayName("Should skip unmatched and unrecognizable input when ignoring errors")
        void shouldSkipWhenIgnoringErrors() {
            GraphTransliterator gt = GraphTransliterator.fromYaml(YAML,
                    TransliteratorConfig.defaults().toBuilder().ignoreErrors(true).build());

            assertThat(gt.ignoreErrors()).isTrue();
            assertThat(gt.transliterate("a")).isEmpty();
            assertThat(gt.transliterate("b!")).isEqualTo("b");
            assertThat(gt.transliterate("aab")).isEqualTo("B2b");
        }

        @Test
        @DisplayName("Switching the error policy should share the compiled rules")
        void shouldSwitchErrorPolicy() {
            GraphTransliterator strict = GraphTransliterator.fromYaml(YAML);
            GraphTransliterator lenient = strict.withIgnoreErrors(true);

            assertThat(strict.withIgnoreErrors(false)).isSameAs(strict);
            assertThat(lenient.ignoreErrors()).isTrue();
            assertThat(lenient.graph()).isSameAs(strict.graph());
            assertThat(lenient.transliterate("a!")).isEmpty();
            assertThat(strict.ignoreErrors()).isFalse();
        }
    }

    @Nested
    @DisplayName("Matching")
    class Matching {

        private final GraphTransliterator gt = GraphTransliterator.fromYaml("""
                tokens:
                  a: [class_a]
                  ' ': [wb]
                rules:
                  a: <A>
                  a a: <AA>
                whitespace:
                  default: ' '
                  consolidate: true
                  token_class: wb
                """);

        @Test
        @DisplayName("Should expose the best and all matches at a position")
        void shouldMatchAtPosition() {
            List<String> tokens = gt.tokenize("aa");

            assertThat(tokens).containsExactly(" ", "a", "a", " ");
            assertThat(gt.rules().get(0).cost()).isLessThan(gt.rules().get(1).cost());
            assertThat(gt.matchAt(1, tokens)).hasValue(0);
            assertThat(gt.matchAllAt(1, tokens).toIntArray()).containsExactly(0, 1);
            assertThat(gt.matchAt(2, tokens)).hasValue(1);
            assertThat(gt.transliterate("aaa")).isEqualTo("<AA><A>");
        }

        @Test
        @DisplayName("Should expose the compiled graph and tokenizer pattern")
        void shouldExposeCompiledStructures() {
            assertThat(gt.graph().root().type()).isEqualTo(NodeType.START);
            assertThat(gt.tokenizerPattern()).isEqualTo("(\\Qa\\E|\\Q \\E)");
            assertThat(gt.tokensByClass()).containsEntry("wb", Set.of(" "));
            assertThat(gt.onMatchIndex().isEmpty()).isTrue();
            assertThat(gt.version()).isEqualTo("1.0.0");
        }
    }

    @Nested
    @DisplayName("Pruning")
    class Pruning {

        private final GraphTransliterator gt = GraphTransliterator.fromYaml("""
                tokens:
                  a: [class1]
                  b: [class2]
                  ' ': [wb]
                rules:
                  a: A
                  b: B
                whitespace:
                  default: ' '
                  consolidate: true
                  token_class: wb
                """);

        @Test
        @DisplayName("Should drop rules producing the given productions")
        void shouldPruneProductions() {
            GraphTransliterator pruned = gt.prunedOf(List.of("B"));

            assertThat(gt.rules()).hasSize(2);
            assertThat(pruned.rules()).hasSize(1);
            assertThat(pruned.rules().get(0).production()).isEqualTo("A");
            assertThat(pruned.transliterate("a")).isEqualTo("A");
            assertThatThrownBy(() -> pruned.transliterate("b")).isInstanceOf(NoMatchingRuleException.class);
        }

        @Test
        @DisplayName("Unknown productions should leave the rules unchanged")
        void shouldKeepRulesForUnknownProductions() {
            assertThat(gt.prunedOf(List.of("Z")).productions()).isEqualTo(gt.productions());
        }

        @Test
        @DisplayName("Pruning every production should leave nothing to match")
        void shouldPruneEverything() {
            GraphTransliterator empty = gt.prunedOf(List.of("A", "B"));

            assertThat(empty.rules()).isEmpty();
            assertThat(empty.tokens()).isEqualTo(gt.tokens());
            assertThatThrownBy(() -> empty.transliterate("a")).isInstanceOf(NoMatchingRuleException.class);
        }

        @Test
        @DisplayName("Pruning should keep the error policy")
        void shouldKeepErrorPolicy() {
            GraphTransliterator pruned = gt.withIgnoreErrors(true).prunedOf(Set.of("A"));

            assertThat(pruned.ignoreErrors()).isTrue();
            assertThat(pruned.transliterate("ab")).isEqualTo("B");
        }
    }
}
