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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import de.subsetlib.api.automaton.FiniteAutomaton;
import net.automatalib.commons.util.Pair;

/**
 * Writes automata in the format understood by {@link TextualAutomatonParser}. States and symbols are rendered via
 * {@link Object#toString()}, so the rendering of each of them must be non-empty and free of whitespace.
 *
 * @author SubsetLib developers
 */
public final class TextualAutomatonWriter {

    private static final Pattern WHITESPACE = Pattern.compile("\\s");

    private TextualAutomatonWriter() {
        // prevent instantiation
    }

    public static <S, I> void write(FiniteAutomaton<S, I> automaton, Appendable out) throws IOException {
        writeLine(automaton.getInputAlphabet(), out);
        writeLine(automaton.getStates(), out);
        writeLine(automaton.getAcceptingStates(), out);
        out.append(token(automaton.getInitialState())).append('\n');

        for (Map.Entry<Pair<S, I>, Set<S>> e : automaton.getTransitionRelation().entrySet()) {
            String origin = token(e.getKey().getFirst());
            String symbol = token(e.getKey().getSecond());
            for (S dest : e.getValue()) {
                out.append(origin).append(' ').append(symbol).append(' ').append(token(dest)).append('\n');
            }
        }
    }

    public static <S, I> String toString(FiniteAutomaton<S, I> automaton) {
        StringBuilder sb = new StringBuilder();
        try {
            write(automaton, sb);
        } catch (IOException ex) {
            // StringBuilder does not throw
            throw new UncheckedIOException(ex);
        }
        return sb.toString();
    }

    private static void writeLine(Iterable<?> elements, Appendable out) throws IOException {
        Iterator<?> it = elements.iterator();
        while (it.hasNext()) {
            out.append(token(it.next()));
            if (it.hasNext()) {
                out.append(' ');
            }
        }
        out.append('\n');
    }

    private static String token(Object element) {
        String token = String.valueOf(element);
        if (token.isEmpty() || WHITESPACE.matcher(token).find()) {
            throw new IllegalArgumentException("Cannot write '" + token + "' as a single token");
        }
        return token;
    }
}
