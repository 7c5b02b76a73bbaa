package com.graphtransliterator.compiler.settings;

import com.graphtransliterator.api.exceptions.InvalidSettingsException;
import com.graphtransliterator.api.model.EasyReadingSettings;
import com.graphtransliterator.api.model.TransliteratorSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SettingsReaderTest {

    private static final String YAML = """
            tokens:
              a: [vowel]
              b: [consonant]
              ' ': [wb]
            rules:
              b: B
              a: A
              <consonant> a: AFTER_CONSONANT
              ' ': ' '
            onmatch_rules:
              - <vowel> + <consonant>: ','
            whitespace:
              default: ' '
              token_class: wb
              consolidate: true
            metadata:
              name: sample
            """;

    private SettingsReader reader;

    @BeforeEach
    void setUp() {
        reader = new SettingsReader();
    }

    @Test
    @DisplayName("Should read easy-reading YAML keeping token and rule order")
    void shouldReadYaml() {
        EasyReadingSettings settings = reader.readYaml(YAML);

        assertThat(settings.tokens().keySet()).containsExactly("a", "b", " ");
        assertThat(settings.rules().keySet()).containsExactly("b", "a", "<consonant> a", " ");
        assertThat(settings.onMatchRules()).containsExactly(Map.of("<vowel> + <consonant>", ","));
        assertThat(settings.whitespace().consolidate()).isTrue();
        assertThat(settings.metadata()).containsEntry("name", "sample");
    }

    @Test
    @DisplayName("Should convert easy-reading settings to direct settings")
    void shouldConvertToDirect() {
        TransliteratorSettings direct = EasyReadingConverter.toDirect(reader.readYaml(YAML));

        assertThat(direct.rules()).hasSize(4);
        assertThat(direct.rules().get(2).prevClasses()).containsExactly("consonant");
        assertThat(direct.rules().get(2).tokens()).containsExactly("a");
        assertThat(direct.onMatchRules()).hasSize(1);
        assertThat(direct.onMatchRules().get(0).production()).isEqualTo(",");
    }

    @Test
    @DisplayName("Conversion should report every malformed rule string")
    void conversionShouldCollectErrors() {
        String yaml = """
                tokens:
                  a: [vowel]
                  ' ': [wb]
                rules:
                  <vowel>: X
                  (a: Y
                onmatch_rules:
                  - <vowel> <vowel>: ','
                whitespace:
                  default: ' '
                  token_class: wb
                  consolidate: false
                """;

        assertThatThrownBy(() -> EasyReadingConverter.toDirect(reader.readYaml(yaml)))
                .isInstanceOf(InvalidSettingsException.class)
                .satisfies(e -> assertThat(((InvalidSettingsException) e).getErrors()).hasSize(3));
    }

    @Test
    @DisplayName("Should replace Unicode character name escapes before parsing")
    void shouldUnescapeCharacterNames() {
        String yaml = """
                tokens:
                  \\N{LATIN SMALL LETTER A}: [vowel]
                  ' ': [wb]
                rules:
                  a: \\N{GREEK SMALL LETTER ALPHA}
                whitespace:
                  default: ' '
                  token_class: wb
                  consolidate: false
                """;

        EasyReadingSettings settings = reader.readYaml(yaml);

        assertThat(settings.tokens()).containsKey("a");
        assertThat(settings.rules()).containsEntry("a", "α");
    }

    @Test
    @DisplayName("Should reject unknown Unicode character names")
    void shouldRejectUnknownCharacterName() {
        assertThatThrownBy(() -> SettingsReader.unescapeCharNames("x\\N{NOT A REAL NAME}"))
                .isInstanceOf(InvalidSettingsException.class)
                .hasMessageContaining("NOT A REAL NAME");
    }

    @Test
    @DisplayName("Should read settings from a YAML file")
    void shouldReadYamlFile() throws IOException {
        Path file = Files.createTempFile("transliterator", ".yaml");
        try {
            Files.writeString(file, YAML);
            assertThat(reader.readYamlFile(file).rules()).hasSize(4);
        } finally {
            Files.deleteIfExists(file);
        }
    }

    @Test
    @DisplayName("Should read direct settings from JSON")
    void shouldReadDirectJson() {
        String json = """
                {
                  "tokens": {"a": ["vowel"], " ": ["wb"]},
                  "rules": [{"production": "A", "tokens": ["a"], "next_classes": ["wb"]}],
                  "whitespace": {"default": " ", "token_class": "wb", "consolidate": false}
                }
                """;

        TransliteratorSettings settings = reader.readDirectJson(json);

        assertThat(settings.rules()).hasSize(1);
        assertThat(settings.rules().get(0).nextClasses()).containsExactly("wb");
        assertThat(settings.rules().get(0).prevTokens()).isEmpty();
        assertThat(settings.onMatchRules()).isEmpty();
    }

    @Test
    @DisplayName("Should wrap parse failures and reject empty input")
    void shouldRejectBadInput() {
        assertThatThrownBy(() -> reader.readYaml("tokens: [unclosed"))
                .isInstanceOf(InvalidSettingsException.class)
                .hasMessageContaining("Failed to parse settings YAML");
        assertThatThrownBy(() -> reader.readYaml("  "))
                .isInstanceOf(InvalidSettingsException.class)
                .hasMessageContaining("empty");
    }
}
