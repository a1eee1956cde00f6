/* Copyright (C) 2024-2026 The SubsetLib Authors
 * This file is part of SubsetLib.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.subsetlib.serialization.textual;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

import de.subsetlib.api.exception.InconsistentAutomatonException;
import de.subsetlib.datastructure.automaton.ExplicitAutomaton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads automata from their line-based textual description:
 * <pre>
 * a b          (line 1: input symbols)
 * q0 q1        (line 2: states)
 * q1           (line 3: accepting states)
 * q0           (line 4: initial state)
 * q0 a q1      (line 5 onwards: one "origin symbol destination" transition per line)
 * q1 b q1
 * </pre>
 * Repeating an (origin, symbol) pair with another destination expresses nondeterminism. A transition line that does
 * not consist of exactly three tokens is skipped and reported as a {@link LineDiagnostic}; a {@link #strict() strict}
 * parser rejects such input instead.
 *
 * @author SubsetLib developers
 */
public class TextualAutomatonParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(TextualAutomatonParser.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int HEADER_LINES = 4;

    private final boolean strict;

    public TextualAutomatonParser() {
        this(false);
    }

    private TextualAutomatonParser(boolean strict) {
        this.strict = strict;
    }

    public static TextualAutomatonParser strict() {
        return new TextualAutomatonParser(true);
    }

    public boolean isStrict() {
        return strict;
    }

    public ParseResult<String, String> parse(Path path) throws IOException, AutomatonFormatException {
        try (Reader r = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(r);
        }
    }

    public ParseResult<String, String> parse(InputStream is) throws IOException, AutomatonFormatException {
        return parse(new InputStreamReader(is, StandardCharsets.UTF_8));
    }

    public ParseResult<String, String> parse(Reader reader) throws IOException, AutomatonFormatException {
        List<String> lines = readLines(reader);
        if (lines.size() < HEADER_LINES) {
            throw new AutomatonFormatException("Expected a header of " + HEADER_LINES + " lines, but found only " +
                                               lines.size());
        }

        String initial = lines.get(3).trim();
        if (initial.isEmpty()) {
            throw new AutomatonFormatException("Line 4: missing initial state");
        }

        ExplicitAutomaton.Builder<String, String> builder = ExplicitAutomaton.builder();
        builder.withInputs(tokenize(lines.get(0)))
               .withStates(tokenize(lines.get(1)))
               .withAccepting(tokenize(lines.get(2)))
               .withInitial(initial);

        List<LineDiagnostic> diagnostics = new ArrayList<>();
        for (int i = HEADER_LINES; i < lines.size(); i++) {
            String line = lines.get(i);
            List<String> tokens = tokenize(line);
            if (tokens.size() == 3) {
                builder.addTransition(tokens.get(0), tokens.get(1), tokens.get(2));
            } else {
                LineDiagnostic diagnostic = new LineDiagnostic(i + 1, line, tokens.size());
                LOGGER.warn("Skipping malformed transition, {}", diagnostic);
                diagnostics.add(diagnostic);
            }
        }

        if (strict && !diagnostics.isEmpty()) {
            throw new AutomatonFormatException("Malformed transition at " + diagnostics.get(0));
        }

        try {
            return new ParseResult<>(builder.create(), diagnostics);
        } catch (InconsistentAutomatonException ex) {
            throw new AutomatonFormatException("Inconsistent automaton description: " + ex.getMessage(), ex);
        }
    }

    private static List<String> readLines(Reader reader) throws IOException {
        BufferedReader br = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        List<String> lines = new ArrayList<>();
        String line;
        while ((line = br.readLine()) != null) {
            lines.add(line);
        }
        return lines;
    }

    private static List<String> tokenize(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return Collections.emptyList();
        }
        return Arrays.asList(WHITESPACE.split(trimmed));
    }
}
