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

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

import de.subsetlib.api.automaton.FiniteAutomaton;
import de.subsetlib.datastructure.automaton.ExplicitAutomaton;
import de.subsetlib.datastructure.automaton.StateSet;
import net.automatalib.ts.acceptors.AcceptorPowersetViewTS;
import net.automatalib.words.Alphabet;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Subset construction restricted to the subsets that are reachable from the initial state.
 * <p>
 * The construction explores the {@link FiniteAutomaton#powersetView() powerset view} of the source automaton with a
 * work queue, starting from the singleton set of the initial state. Each discovered subset receives exactly one
 * successor per input symbol; the empty subset is added as the dead state only if some reachable subset has no
 * successor for some symbol. The result accepts the same language as the source automaton and is the smallest
 * automaton the subset construction can produce.
 *
 * @author SubsetLib developers
 */
public class SubsetConstructionDeterminizer extends AbstractDeterminizer {

    public SubsetConstructionDeterminizer() {
        this(Determinizers.DEFAULT_MAX_STATES, Determinizers.DEFAULT_WARN_STATES);
    }

    public SubsetConstructionDeterminizer(int maxStates, int warnStates) {
        super(maxStates, warnStates);
    }

    @Override
    <S, I> int construct(FiniteAutomaton<S, I> nfa,
                         DeclarationOrder<S> order,
                         ExplicitAutomaton.Builder<StateSet<S>, I> builder) {
        return explore(nfa.powersetView(), nfa.getInputAlphabet(), order, builder);
    }

    private <SI, S, I> int explore(AcceptorPowersetViewTS<SI, I, S> powerset,
                                   Alphabet<I> inputs,
                                   DeclarationOrder<S> order,
                                   ExplicitAutomaton.Builder<StateSet<S>, I> builder) {
        Set<StateSet<S>> visited = new HashSet<>();
        Deque<DeterminizeRecord<SI, S>> queue = new ArrayDeque<>();

        SI init = powerset.getInitialState();
        DeterminizeRecord<SI, S> initRecord = new DeterminizeRecord<>(init, toStateSet(powerset, order, init));
        visited.add(initRecord.outputState);
        addState(builder, initRecord.outputState, init != null && powerset.isAccepting(init), 1);
        queue.add(initRecord);

        while (!queue.isEmpty()) {
            DeterminizeRecord<SI, S> curr = queue.poll();

            for (I sym : inputs) {
                // a missing view state stands for the empty subset, which only leads to itself
                SI succ = curr.inputState == null ? null : powerset.getSuccessor(curr.inputState, sym);
                StateSet<S> succState = toStateSet(powerset, order, succ);

                if (visited.add(succState)) {
                    addState(builder, succState, succ != null && powerset.isAccepting(succ), visited.size());
                    queue.add(new DeterminizeRecord<>(succ, succState));
                }
                builder.addTransition(curr.outputState, sym, succState);
            }
        }

        return visited.size();
    }

    private static <SI, S> StateSet<S> toStateSet(AcceptorPowersetViewTS<SI, ?, S> powerset,
                                                  DeclarationOrder<S> order,
                                                  @Nullable SI state) {
        Collection<S> originals = state == null ? Collections.emptySet() : powerset.getOriginalStates(state);
        return order.toStateSet(originals);
    }

    private static final class DeterminizeRecord<SI, S> {

        private final @Nullable SI inputState;
        private final StateSet<S> outputState;

        DeterminizeRecord(@Nullable SI inputState, StateSet<S> outputState) {
            this.inputState = inputState;
            this.outputState = outputState;
        }
    }
}
