/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.runtime.tokenize;

import com.graphtransliterator.api.exceptions.UnrecognizableInputTokenException;
import com.graphtransliterator.api.model.WhitespaceSettings;
import com.graphtransliterator.runtime.model.TransliteratorModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits input text into declared tokens using the model's tokenizer pattern.
 *
 * <p>The returned list always starts and ends with the default whitespace token.
 * With whitespace consolidation, runs of whitespace collapse to their first token
 * and whitespace at either edge of the input is dropped.
 *
 * <p>Thread-safe: each call uses its own {@link Matcher}.
 */
public final class Tokenizer {
    private static final Logger logger = LoggerFactory.getLogger(Tokenizer.class);

    private final TransliteratorModel model;
    private final Pattern pattern;
    private final WhitespaceSettings whitespace;

    public Tokenizer(TransliteratorModel model) {
        this.model = model;
        this.pattern = model.getTokenizerPattern();
        this.whitespace = model.getWhitespace();
    }

    /**
     * @param input        the text to tokenize
     * @param ignoreErrors skip unrecognizable characters instead of failing
     * @throws UnrecognizableInputTokenException if a character starts no token and
     *                                           errors are not ignored
     */
    public List<String> tokenize(String input, boolean ignoreErrors) {
        List<String> tokens = new ArrayList<>(input.length() + 2);
        tokens.add(whitespace.defaultToken());

        boolean consolidate = whitespace.consolidate();
        boolean prevWhitespace = true;
        Matcher matcher = pattern.matcher(input);
        int offset = 0;
        while (offset < input.length()) {
            matcher.region(offset, input.length());
            if (matcher.lookingAt() && matcher.end() > offset) {
                String token = matcher.group();
                offset = matcher.end();
                if (consolidate) {
                    boolean isWhitespace = isWhitespace(token);
                    if (isWhitespace && prevWhitespace) {
                        continue;
                    }
                    prevWhitespace = isWhitespace;
                }
                tokens.add(token);
            } else {
                logger.warn("Unrecognizable token at offset {} of \"{}\"", offset, input);
                if (!ignoreErrors) {
                    throw new UnrecognizableInputTokenException(input, offset);
                }
                offset += Character.charCount(input.codePointAt(offset));
            }
        }

        if (consolidate) {
            // Leading sentinel stays
            while (tokens.size() > 1 && isWhitespace(tokens.get(tokens.size() - 1))) {
                tokens.remove(tokens.size() - 1);
            }
        }
        tokens.add(whitespace.defaultToken());
        return tokens;
    }

    public boolean isWhitespace(String token) {
        return model.hasClass(token, whitespace.tokenClass());
    }
}
