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
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import de.subsetlib.api.exception.InconsistentAutomatonException;
import de.subsetlib.datastructure.automaton.StateSet;

/**
 * Orders subsets of states by the position of each state in the declared state set of the source automaton, so that
 * the same subset is always rendered the same way.
 *
 * @param <S>
 *         state type
 */
final class DeclarationOrder<S> {

    private final List<S> states;
    private final Map<S, Integer> index;

    DeclarationOrder(Collection<? extends S> states) {
        this.states = new ArrayList<>(states);
        this.index = new HashMap<>();
        for (int i = 0; i < this.states.size(); i++) {
            index.put(this.states.get(i), i);
        }
    }

    List<S> getStates() {
        return states;
    }

    StateSet<S> toStateSet(Collection<? extends S> members) {
        List<S> sorted = new ArrayList<>(members);
        for (S s : sorted) {
            if (!index.containsKey(s)) {
                throw new InconsistentAutomatonException("State '" + s + "' is referenced but not declared");
            }
        }
        sorted.sort((s1, s2) -> Integer.compare(index.get(s1), index.get(s2)));
        return StateSet.copyOf(sorted);
    }
}
