/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.compiler.settings;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.graphtransliterator.api.exceptions.InvalidSettingsException;
import com.graphtransliterator.api.model.EasyReadingSettings;
import com.graphtransliterator.api.model.TransliteratorSettings;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads transliterator settings from YAML or JSON.
 *
 * {@code \N{UNICODE CHARACTER NAME}} escapes in the raw text are replaced with
 * the named character before parsing.
 */
public class SettingsReader {
    private static final Logger logger = Logger.getLogger(SettingsReader.class.getName());

    private static final Pattern CHARNAME_ESCAPE = Pattern.compile("\\\\N\\{([A-Z0-9 \\-]+)}");

    private final ObjectMapper yamlMapper;
    private final ObjectMapper jsonMapper;

    public SettingsReader() {
        this.yamlMapper = YAMLMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
        this.jsonMapper = new ObjectMapper()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public EasyReadingSettings readYaml(String yaml) {
        return parse(yamlMapper, yaml, EasyReadingSettings.class, "YAML");
    }

    public EasyReadingSettings readYamlFile(Path path) throws IOException {
        logger.fine("Reading transliterator settings from: " + path);
        return readYaml(Files.readString(path, StandardCharsets.UTF_8));
    }

    public EasyReadingSettings readEasyReadingJson(String json) {
        return parse(jsonMapper, json, EasyReadingSettings.class, "JSON");
    }

    public TransliteratorSettings readDirectJson(String json) {
        return parse(jsonMapper, json, TransliteratorSettings.class, "JSON");
    }

    private <T> T parse(ObjectMapper mapper, String text, Class<T> type, String format) {
        if (text == null || text.isBlank()) {
            throw new InvalidSettingsException(List.of("Settings " + format + " is empty"));
        }
        try {
            T settings = mapper.readValue(unescapeCharNames(text), type);
            if (settings == null) {
                throw new InvalidSettingsException(List.of("Settings " + format + " is empty"));
            }
            return settings;
        } catch (JsonProcessingException e) {
            throw new InvalidSettingsException("Failed to parse settings " + format + ": " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Replaces {@code \N{NAME}} escapes with the named Unicode character.
     *
     * @throws InvalidSettingsException if a name is not a Unicode character name
     */
    public static String unescapeCharNames(String input) {
        Matcher m = CHARNAME_ESCAPE.matcher(input);
        StringBuilder out = new StringBuilder(input.length());
        while (m.find()) {
            String name = m.group(1);
            int codePoint;
            try {
                codePoint = Character.codePointOf(name);
            } catch (IllegalArgumentException e) {
                throw new InvalidSettingsException("Unknown Unicode character name: " + name, e);
            }
            m.appendReplacement(out, Matcher.quoteReplacement(new String(Character.toChars(codePoint))));
        }
        m.appendTail(out);
        return out.toString();
    }
}
