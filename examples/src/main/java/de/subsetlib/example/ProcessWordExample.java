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
package de.subsetlib.example;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import de.subsetlib.algorithm.determinization.Determinizers;
import de.subsetlib.algorithm.simulation.WordProcessor;
import de.subsetlib.api.Verdict;
import de.subsetlib.api.automaton.FiniteAutomaton;
import de.subsetlib.api.exception.StateLimitException;
import de.subsetlib.api.setting.SubsetLibProperty;
import de.subsetlib.api.setting.SubsetLibSettings;
import de.subsetlib.datastructure.automaton.ExplicitAutomaton;
import de.subsetlib.datastructure.automaton.StateSet;
import de.subsetlib.serialization.textual.AutomatonFormatException;
import de.subsetlib.serialization.textual.ParseResult;
import de.subsetlib.serialization.textual.TextualAutomatonParser;
import de.subsetlib.serialization.textual.TextualAutomatonWriter;
import net.automatalib.words.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads an automaton from a file, processes a single word with it and prints the determinized automaton.
 * <p>
 * Usage: {@code ProcessWordExample [automaton-file [word]]}. Every character of the word is one input symbol. Missing
 * arguments are taken from the {@code subsetlib.example.file} and {@code subsetlib.example.word} settings.
 *
 * @author SubsetLib developers
 */
public final class ProcessWordExample {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessWordExample.class);

    private ProcessWordExample() {
        // prevent instantiation
    }

    public static void main(String[] args) {
        StringBuilder out = new StringBuilder();
        int status = execute(args, out);
        System.out.print(out);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Runs the example for the given command line arguments.
     *
     * @return the exit status, {@code 0} on success and {@code 1} if the automaton could not be processed
     */
    static int execute(String[] args, Appendable out) {
        SubsetLibSettings settings = SubsetLibSettings.getInstance();

        String file = args.length > 0 ? args[0] : settings.getProperty(SubsetLibProperty.EXAMPLE_FILE);
        String word = args.length > 1 ? args[1] : settings.getString(SubsetLibProperty.EXAMPLE_WORD, "");

        if (file == null || file.isEmpty()) {
            LOGGER.error("No automaton file given, pass it as first argument or set '{}'",
                         SubsetLibProperty.EXAMPLE_FILE);
            return 1;
        }

        try {
            run(Paths.get(file), toWord(word), out);
            return 0;
        } catch (IOException | AutomatonFormatException ex) {
            LOGGER.error("Could not process automaton '{}'", file, ex);
            return 1;
        } catch (StateLimitException ex) {
            LOGGER.error("Could not determinize automaton '{}'", file, ex);
            return 1;
        }
    }

    /**
     * Processes the given word with the automaton stored at the given path and appends the verdict as well as the
     * determinized automaton to {@code out}.
     *
     * @return the verdict for the given word
     */
    public static Verdict run(Path file, Word<String> word, Appendable out)
            throws IOException, AutomatonFormatException {
        ParseResult<String, String> result = new TextualAutomatonParser().parse(file);
        if (!result.isClean()) {
            LOGGER.info("Skipped {} malformed transition line(s) in '{}'", result.diagnostics.size(), file);
        }

        ExplicitAutomaton<String, String> automaton = result.model;
        Verdict verdict = WordProcessor.process(automaton, word);
        out.append(word.toString()).append(": ").append(verdict.toString()).append('\n');

        FiniteAutomaton<StateSet<String>, String> dfa = Determinizers.determinize(automaton);
        out.append('\n');
        TextualAutomatonWriter.write(dfa, out);

        return verdict;
    }

    static Word<String> toWord(String word) {
        List<String> symbols = new ArrayList<>(word.length());
        for (int i = 0; i < word.length(); i++) {
            symbols.add(String.valueOf(word.charAt(i)));
        }
        return Word.fromList(symbols);
    }
}
