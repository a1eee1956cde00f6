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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import de.subsetlib.api.automaton.FiniteAutomaton;
import de.subsetlib.api.exception.StateLimitException;
import de.subsetlib.datastructure.automaton.ExplicitAutomaton;
import de.subsetlib.datastructure.automaton.StateSet;

/**
 * Textbook subset construction that materializes every subset of the declared states, including the empty one, no
 * matter whether it is reachable from the initial state.
 * <p>
 * The result always has {@code 2^n} states for a source automaton with {@code n} states, which makes this determinizer
 * unsuitable for anything but small automata. It mainly serves as a reference for {@link
 * SubsetConstructionDeterminizer}, with which it agrees on every word.
 *
 * @author SubsetLib developers
 */
public class PowersetDeterminizer extends AbstractDeterminizer {

    private static final int MAX_SOURCE_STATES = 30;

    public PowersetDeterminizer() {
        this(Determinizers.DEFAULT_MAX_STATES, Determinizers.DEFAULT_WARN_STATES);
    }

    public PowersetDeterminizer(int maxStates, int warnStates) {
        super(maxStates, warnStates);
    }

    @Override
    <S, I> int construct(FiniteAutomaton<S, I> nfa,
                         DeclarationOrder<S> order,
                         ExplicitAutomaton.Builder<StateSet<S>, I> builder) {
        List<S> states = order.getStates();
        int n = states.size();
        if (n > MAX_SOURCE_STATES || (1 << n) > getMaxStates()) {
            throw new StateLimitException("The powerset of " + n + " states exceeds the maximum number of " +
                                          getMaxStates() + " states");
        }

        int numSubsets = 1 << n;
        List<StateSet<S>> subsets = new ArrayList<>(numSubsets);

        for (int mask = 0; mask < numSubsets; mask++) {
            StateSet<S> subset = order.toStateSet(membersOf(states, mask));
            addState(builder, subset, nfa.isAccepting(subset.asSet()), mask + 1);
            subsets.add(subset);
        }

        for (StateSet<S> subset : subsets) {
            for (I sym : nfa.getInputAlphabet()) {
                StateSet<S> succ =
                        order.toStateSet(nfa.getSuccessors(subset.asSet(), Collections.singletonList(sym)));
                builder.addTransition(subset, sym, succ);
            }
        }

        return numSubsets;
    }

    private static <S> List<S> membersOf(List<S> states, int mask) {
        List<S> members = new ArrayList<>(Integer.bitCount(mask));
        for (int i = 0; i < states.size(); i++) {
            if ((mask & (1 << i)) != 0) {
                members.add(states.get(i));
            }
        }
        return members;
    }
}
