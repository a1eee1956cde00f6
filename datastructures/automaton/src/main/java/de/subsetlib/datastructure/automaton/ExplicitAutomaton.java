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
package de.subsetlib.datastructure.automaton;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import de.subsetlib.api.automaton.FiniteAutomaton;
import de.subsetlib.api.exception.InconsistentAutomatonException;
import net.automatalib.commons.util.Pair;
import net.automatalib.words.Alphabet;
import net.automatalib.words.impl.Alphabets;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable, explicitly enumerated implementation of a {@link FiniteAutomaton}.
 * <p>
 * Instances are created through a {@link Builder}, which collapses duplicate declarations and accumulates multiple
 * destinations of the same (state, input) pair. On {@link Builder#create() creation}, the structure is validated:
 * the initial state, all accepting states and all transition endpoints have to be declared states. Transitions on
 * inputs outside the alphabet are kept, but can never be taken by a simulation and are ignored by the subset
 * construction.
 *
 * @param <S>
 *         state type
 * @param <I>
 *         input symbol type
 *
 * @author SubsetLib developers
 */
public final class ExplicitAutomaton<S, I> implements FiniteAutomaton<S, I> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExplicitAutomaton.class);

    private final Set<S> states;
    private final Alphabet<I> inputAlphabet;
    private final Map<Pair<S, I>, Set<S>> transitions;
    private final S initialState;
    private final Set<S> acceptingStates;

    private ExplicitAutomaton(Set<S> states,
                              Alphabet<I> inputAlphabet,
                              Map<Pair<S, I>, Set<S>> transitions,
                              S initialState,
                              Set<S> acceptingStates) {
        this.states = states;
        this.inputAlphabet = inputAlphabet;
        this.transitions = transitions;
        this.initialState = initialState;
        this.acceptingStates = acceptingStates;
    }

    public static <S, I> Builder<S, I> builder() {
        return new Builder<>();
    }

    @Override
    public Set<S> getStates() {
        return states;
    }

    @Override
    public Alphabet<I> getInputAlphabet() {
        return inputAlphabet;
    }

    @Override
    public Set<S> getSuccessors(S state, I input) {
        return transitions.getOrDefault(Pair.of(state, input), Collections.emptySet());
    }

    @Override
    public S getInitialState() {
        return initialState;
    }

    @Override
    public Set<S> getAcceptingStates() {
        return acceptingStates;
    }

    @Override
    public Map<Pair<S, I>, Set<S>> getTransitionRelation() {
        return transitions;
    }

    @Override
    public String toString() {
        return "ExplicitAutomaton{states=" + states.size() + ", inputs=" + inputAlphabet.size() + ", transitions=" +
               transitions.size() + '}';
    }

    /**
     * Collects the components of an {@link ExplicitAutomaton}. A builder can be reused; every call to
     * {@link #create()} returns an independent automaton.
     *
     * @param <S>
     *         state type
     * @param <I>
     *         input symbol type
     */
    public static final class Builder<S, I> {

        private final Set<S> states = new LinkedHashSet<>();
        private final Set<I> inputs = new LinkedHashSet<>();
        private final Set<S> accepting = new LinkedHashSet<>();
        private final Map<Pair<S, I>, Set<S>> transitions = new LinkedHashMap<>();
        private @Nullable S initial;

        Builder() {}

        @SafeVarargs
        public final Builder<S, I> withStates(S... states) {
            return withStates(Arrays.asList(states));
        }

        public Builder<S, I> withStates(Collection<? extends S> states) {
            this.states.addAll(states);
            return this;
        }

        @SafeVarargs
        public final Builder<S, I> withInputs(I... inputs) {
            return withInputs(Arrays.asList(inputs));
        }

        public Builder<S, I> withInputs(Collection<? extends I> inputs) {
            this.inputs.addAll(inputs);
            return this;
        }

        @SafeVarargs
        public final Builder<S, I> withAccepting(S... accepting) {
            return withAccepting(Arrays.asList(accepting));
        }

        public Builder<S, I> withAccepting(Collection<? extends S> accepting) {
            this.accepting.addAll(accepting);
            return this;
        }

        public Builder<S, I> withInitial(S initial) {
            this.initial = Objects.requireNonNull(initial);
            return this;
        }

        /**
         * Adds a single destination to the successors of the given (state, input) pair.
         *
         * @param origin
         *         the source state
         * @param input
         *         the input symbol
         * @param destination
         *         the destination state
         *
         * @return this builder
         */
        public Builder<S, I> addTransition(S origin, I input, S destination) {
            transitions.computeIfAbsent(Pair.of(origin, input), k -> new LinkedHashSet<>())
                       .add(Objects.requireNonNull(destination));
            return this;
        }

        /**
         * Validates the collected components and creates the automaton.
         *
         * @return the created automaton
         *
         * @throws InconsistentAutomatonException
         *         if no initial state is set or if a referenced state has not been declared
         */
        public ExplicitAutomaton<S, I> create() {
            validate();

            Map<Pair<S, I>, Set<S>> transitionsCopy = new LinkedHashMap<>(transitions.size() * 4 / 3 + 1);
            for (Map.Entry<Pair<S, I>, Set<S>> e : transitions.entrySet()) {
                transitionsCopy.put(e.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(e.getValue())));
            }

            return new ExplicitAutomaton<>(Collections.unmodifiableSet(new LinkedHashSet<>(states)),
                                           Alphabets.fromCollection(inputs),
                                           Collections.unmodifiableMap(transitionsCopy),
                                           initial,
                                           Collections.unmodifiableSet(new LinkedHashSet<>(accepting)));
        }

        private void validate() {
            if (initial == null) {
                throw new InconsistentAutomatonException("No initial state has been specified");
            }
            if (!states.contains(initial)) {
                throw new InconsistentAutomatonException("Initial state '" + initial + "' is not a declared state");
            }
            for (S acc : accepting) {
                if (!states.contains(acc)) {
                    throw new InconsistentAutomatonException("Accepting state '" + acc + "' is not a declared state");
                }
            }
            for (Map.Entry<Pair<S, I>, Set<S>> e : transitions.entrySet()) {
                S origin = e.getKey().getFirst();
                I input = e.getKey().getSecond();
                if (!states.contains(origin)) {
                    throw new InconsistentAutomatonException(
                            "Transition origin '" + origin + "' (on '" + input + "') is not a declared state");
                }
                for (S dest : e.getValue()) {
                    if (!states.contains(dest)) {
                        throw new InconsistentAutomatonException(
                                "Transition destination '" + dest + "' (from '" + origin + "' on '" + input +
                                "') is not a declared state");
                    }
                }
                if (!inputs.contains(input)) {
                    LOGGER.warn("Transition from '{}' on '{}' uses a symbol outside the alphabet and will never be taken",
                                origin,
                                input);
                }
            }
        }
    }
}
