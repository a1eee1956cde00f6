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
package de.subsetlib.algorithm.simulation;

import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

import de.subsetlib.api.Verdict;
import de.subsetlib.api.automaton.FiniteAutomaton;
import net.automatalib.words.Alphabet;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs words through a (possibly nondeterministic) finite automaton by tracking the set of all simultaneously reachable
 * states.
 * <p>
 * A word containing a symbol outside the input alphabet is {@link Verdict#INVALID invalid}; processing stops at the
 * first such symbol. Otherwise the word is {@link Verdict#ACCEPTED accepted} iff at least one state reached after
 * consuming the whole word is accepting. A missing transition removes the respective branch; once no branch is left,
 * the remaining symbols are still checked against the alphabet but the word can no longer be accepted.
 *
 * @param <S>
 *         state type
 * @param <I>
 *         input symbol type
 *
 * @author SubsetLib developers
 */
public final class WordProcessor<S, I> {

    private static final Logger LOGGER = LoggerFactory.getLogger(WordProcessor.class);

    private final FiniteAutomaton<S, I> automaton;

    public WordProcessor(FiniteAutomaton<S, I> automaton) {
        this.automaton = Objects.requireNonNull(automaton);
    }

    /**
     * Convenience method for processing a single word without keeping a processor instance.
     *
     * @param automaton
     *         the automaton to run the word through
     * @param word
     *         the input word
     * @param <S>
     *         state type
     * @param <I>
     *         input symbol type
     *
     * @return the verdict for the given word
     */
    public static <S, I> Verdict process(FiniteAutomaton<S, I> automaton, Iterable<? extends I> word) {
        return new WordProcessor<>(automaton).process(word);
    }

    public Verdict process(Iterable<? extends I> word) {
        Set<S> current = reachableStates(word);
        if (current == null) {
            return Verdict.INVALID;
        }
        return Verdict.fromAcceptance(automaton.isAccepting(current));
    }

    public boolean accepts(Iterable<? extends I> word) {
        return process(word) == Verdict.ACCEPTED;
    }

    /**
     * Computes the set of states the automaton may be in after reading the given word.
     *
     * @param word
     *         the input word
     *
     * @return the reachable states (possibly empty), or {@code null} if the word contains a symbol outside the input
     * alphabet
     */
    public @Nullable Set<S> reachableStates(Iterable<? extends I> word) {
        Alphabet<I> alphabet = automaton.getInputAlphabet();
        Set<S> current = Collections.singleton(automaton.getInitialState());

        int pos = 0;
        for (I sym : word) {
            if (!alphabet.contains(sym)) {
                LOGGER.debug("Symbol '{}' at position {} is not part of the input alphabet", sym, pos);
                return null;
            }
            Set<S> next = new HashSet<>();
            for (S s : current) {
                next.addAll(automaton.getSuccessors(s, sym));
            }
            LOGGER.trace("{} --{}--> {}", current, sym, next);
            current = next;
            pos++;
        }

        return current;
    }
}
