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
package de.subsetlib.algorithm.determinization;

import de.subsetlib.api.automaton.FiniteAutomaton;
import de.subsetlib.datastructure.automaton.StateSet;

/**
 * Converts a nondeterministic finite automaton into a deterministic one that accepts the same language. Each state of
 * the result is a set of states of the source automaton.
 * <p>
 * Implementations never modify the source automaton, and the returned automaton shares no mutable structure with it.
 *
 * @author SubsetLib developers
 */
public interface Determinizer {

    /**
     * Determinizes the given automaton.
     *
     * @param nfa
     *         the (possibly nondeterministic) source automaton
     * @param <S>
     *         state type of the source automaton
     * @param <I>
     *         input symbol type
     *
     * @return a deterministic automaton accepting the same language, with exactly one successor for every state and
     * every symbol of the input alphabet
     *
     * @throws de.subsetlib.api.exception.StateLimitException
     *         if the result would exceed the configured maximum number of states
     */
    <S, I> FiniteAutomaton<StateSet<S>, I> determinize(FiniteAutomaton<S, I> nfa);

}
