package com.graphtransliterator.compiler.settings;

import com.graphtransliterator.api.exceptions.InvalidSettingsException;
import com.graphtransliterator.api.model.OnMatchRule;
import com.graphtransliterator.api.model.RuleDefinition;
import com.graphtransliterator.api.model.TransliteratorSettings;
import com.graphtransliterator.api.model.WhitespaceSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SettingsValidatorTest {

    private SettingsValidator validator;
    private Map<String, List<String>> tokens;
    private WhitespaceSettings whitespace;

    @BeforeEach
    void setUp() {
        validator = new SettingsValidator();
        tokens = new LinkedHashMap<>();
        tokens.put("a", List.of("vowel"));
        tokens.put("b", List.of("consonant"));
        tokens.put(" ", List.of("wb"));
        whitespace = new WhitespaceSettings(" ", "wb", false);
    }

    @Test
    @DisplayName("Should accept valid settings")
    void shouldAcceptValidSettings() {
        TransliteratorSettings settings = new TransliteratorSettings(tokens,
                List.of(RuleDefinition.of("A", "a"),
                        new RuleDefinition("B", List.of("vowel"), null, List.of("b"), null, null)),
                whitespace,
                List.of(new OnMatchRule(List.of("vowel"), List.of("consonant"), ",")),
                null);

        assertThat(validator.validate(settings)).isEmpty();
    }

    @Test
    @DisplayName("Should collect every unknown token and class")
    void shouldCollectAllReferenceErrors() {
        TransliteratorSettings settings = TransliteratorSettings.of(tokens,
                List.of(new RuleDefinition("X", List.of("nasal"), List.of("z"), List.of("a", "q"),
                        List.of("y"), List.of("liquid"))),
                whitespace);

        List<String> errors = validator.validate(settings);

        assertThat(errors).containsExactly(
                "Rule 0 references unknown token 'z'",
                "Rule 0 references unknown token 'q'",
                "Rule 0 references unknown token 'y'",
                "Rule 0 references unknown class 'nasal'",
                "Rule 0 references unknown class 'liquid'");
    }

    @Test
    @DisplayName("Should require a production and at least one token per rule")
    void shouldRequireProductionAndTokens() {
        TransliteratorSettings settings = TransliteratorSettings.of(tokens,
                List.of(new RuleDefinition(null, null, null, List.of(), null, null)), whitespace);

        assertThat(validator.validate(settings)).containsExactly(
                "Rule 0 has no production",
                "Rule 0 must match at least one token");
    }

    @Test
    @DisplayName("Should validate the whitespace default token and class")
    void shouldValidateWhitespace() {
        TransliteratorSettings settings = TransliteratorSettings.of(tokens,
                List.of(RuleDefinition.of("A", "a")), new WhitespaceSettings("_", "space", true));

        assertThat(validator.validate(settings)).containsExactly(
                "Whitespace default '_' is not a declared token",
                "Whitespace class 'space' is not attached to any token");
    }

    @Test
    @DisplayName("Should require tokens, rules and whitespace")
    void shouldRequireSections() {
        TransliteratorSettings settings = new TransliteratorSettings(null, null, null, null, null);

        assertThat(validator.validate(settings)).containsExactly(
                "tokens must declare at least one token",
                "whitespace settings are missing",
                "rules are missing");
    }

    @Test
    @DisplayName("Should validate on-match classes")
    void shouldValidateOnMatchRules() {
        TransliteratorSettings settings = new TransliteratorSettings(tokens,
                List.of(RuleDefinition.of("A", "a")), whitespace,
                List.of(new OnMatchRule(List.of(), List.of("glide"), "-")), null);

        assertThat(validator.validate(settings)).containsExactly(
                "On-match rule 0 needs both preceding and following classes",
                "On-match rule 0 references unknown class 'glide'");
    }

    @Test
    @DisplayName("Should reject the reserved token name")
    void shouldRejectReservedTokenName() {
        tokens.put(SettingsValidator.RESERVED_TOKEN, List.of("vowel"));
        TransliteratorSettings settings = TransliteratorSettings.of(tokens,
                List.of(RuleDefinition.of("A", "a"), RuleDefinition.of("R", "__rules__")), whitespace);

        assertThat(validator.validate(settings)).containsExactly("Token name '__rules__' is reserved");
    }

    @Test
    @DisplayName("validateOrThrow should report all errors in one exception")
    void validateOrThrowShouldCarryAllErrors() {
        TransliteratorSettings settings = TransliteratorSettings.of(tokens,
                List.of(RuleDefinition.of("X", "x"), RuleDefinition.of("Y", "y")), whitespace);

        assertThatThrownBy(() -> validator.validateOrThrow(settings))
                .isInstanceOf(InvalidSettingsException.class)
                .satisfies(e -> assertThat(((InvalidSettingsException) e).getErrors()).hasSize(2))
                .hasMessageContaining("unknown token 'x'")
                .hasMessageContaining("unknown token 'y'");
    }
}
