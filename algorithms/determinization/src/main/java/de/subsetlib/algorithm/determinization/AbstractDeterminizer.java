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

import java.util.Objects;

import de.subsetlib.api.automaton.FiniteAutomaton;
import de.subsetlib.api.exception.StateLimitException;
import de.subsetlib.datastructure.automaton.ExplicitAutomaton;
import de.subsetlib.datastructure.automaton.StateSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared skeleton of the subset-construction based determinizers. Subclasses decide which subsets are materialized;
 * this class takes care of the state limits and of assembling the resulting automaton.
 */
abstract class AbstractDeterminizer implements Determinizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractDeterminizer.class);

    private final int maxStates;
    private final int warnStates;

    AbstractDeterminizer(int maxStates, int warnStates) {
        if (maxStates <= 0) {
            throw new IllegalArgumentException("Maximum number of states must be positive, was " + maxStates);
        }
        this.maxStates = maxStates;
        this.warnStates = warnStates;
    }

    @Override
    public final <S, I> FiniteAutomaton<StateSet<S>, I> determinize(FiniteAutomaton<S, I> nfa) {
        Objects.requireNonNull(nfa);

        DeclarationOrder<S> order = new DeclarationOrder<>(nfa.getStates());
        ExplicitAutomaton.Builder<StateSet<S>, I> builder = ExplicitAutomaton.builder();
        builder.withInputs(nfa.getInputAlphabet());
        builder.withInitial(order.toStateSet(nfa.getInitialStates()));

        int numStates = construct(nfa, order, builder);
        LOGGER.debug("Determinized automaton with {} states into automaton with {} states", nfa.size(), numStates);

        return builder.create();
    }

    /**
     * Adds the states and transitions of the determinized automaton to the given builder. The initial state has
     * already been set.
     *
     * @return the number of constructed states
     */
    abstract <S, I> int construct(FiniteAutomaton<S, I> nfa,
                                  DeclarationOrder<S> order,
                                  ExplicitAutomaton.Builder<StateSet<S>, I> builder);

    /**
     * Declares the given subset as a state of the result.
     *
     * @param numStates
     *         the number of states of the result including the new one
     */
    <S, I> void addState(ExplicitAutomaton.Builder<StateSet<S>, I> builder,
                         StateSet<S> state,
                         boolean accepting,
                         int numStates) {
        if (numStates > maxStates) {
            throw new StateLimitException("Determinization exceeds the maximum number of " + maxStates + " states");
        }
        if (numStates == warnStates + 1) {
            LOGGER.warn("Determinization has constructed more than {} states (limit is {})", warnStates, maxStates);
        }

        builder.withStates(state);
        if (accepting) {
            builder.withAccepting(state);
        }
    }

    public int getMaxStates() {
        return maxStates;
    }

    public int getWarnStates() {
        return warnStates;
    }
}
