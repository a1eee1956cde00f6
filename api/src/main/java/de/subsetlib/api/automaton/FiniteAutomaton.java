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
package de.subsetlib.api.automaton;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Set;

import net.automatalib.automata.concepts.InputAlphabetHolder;
import net.automatalib.automata.fsa.NFA;
import net.automatalib.commons.util.Pair;
import net.automatalib.words.Alphabet;

/**
 * A (possibly nondeterministic) finite automaton with a single initial state and a fixed input alphabet.
 * <p>
 * As an {@link NFA}, every implementation can be handed to AutomataLib's algorithms directly, e.g. for computing
 * {@link #powersetView() powerset views}. Absent transitions are not an error: {@link #getSuccessors(Object, Object)}
 * simply returns an empty set for every (state, input) pair that has no transition defined. Implementations are
 * expected to be immutable, so that the same instance can be shared between threads without further coordination.
 *
 * @param <S>
 *         state type
 * @param <I>
 *         input symbol type
 *
 * @author SubsetLib developers
 */
public interface FiniteAutomaton<S, I> extends NFA<S, I>, InputAlphabetHolder<I> {

    /**
     * Returns the declared states of this automaton.
     *
     * @return the (unmodifiable) set of states
     */
    @Override
    Set<S> getStates();

    @Override
    Alphabet<I> getInputAlphabet();

    /**
     * Returns the successors of the given state for the given input.
     *
     * @param state
     *         the source state
     * @param input
     *         the input symbol
     *
     * @return the (unmodifiable, possibly empty) set of successor states
     */
    @Override
    Set<S> getSuccessors(S state, I input);

    S getInitialState();

    Set<S> getAcceptingStates();

    /**
     * Returns the complete transition relation of this automaton. Only (state, input) pairs with at least one successor
     * are contained in the returned map.
     *
     * @return the (unmodifiable) transition relation
     */
    Map<Pair<S, I>, Set<S>> getTransitionRelation();

    @Override
    default Set<S> getInitialStates() {
        return Collections.singleton(getInitialState());
    }

    @Override
    default Collection<S> getTransitions(S state, I input) {
        return getSuccessors(state, input);
    }

    @Override
    default S getSuccessor(S transition) {
        return transition;
    }

    @Override
    default boolean isAccepting(S state) {
        return getAcceptingStates().contains(state);
    }

    /**
     * Checks whether every (state, input) pair of this automaton has at most one successor.
     *
     * @return {@code true} if this automaton is deterministic, {@code false} otherwise
     */
    default boolean isDeterministic() {
        for (Set<S> succs : getTransitionRelation().values()) {
            if (succs.size() > 1) {
                return false;
            }
        }
        return true;
    }
}
