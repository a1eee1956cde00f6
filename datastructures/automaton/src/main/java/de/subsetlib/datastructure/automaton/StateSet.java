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
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * An immutable set of states, used as the state type of automata obtained by the subset construction.
 * <p>
 * Two instances are equal iff they contain the same elements, regardless of the order in which the elements were
 * given. Iteration (and thus {@link #toString()}) follows the order of construction, so builders that insert elements
 * in a fixed order get a stable textual representation.
 *
 * @param <S>
 *         element (state) type
 *
 * @author SubsetLib developers
 */
public final class StateSet<S> implements Iterable<S> {

    private static final StateSet<?> EMPTY = new StateSet<>(Collections.emptySet());

    private final Set<S> states;
    private final int hashCode;

    private StateSet(Set<S> states) {
        this.states = states;
        this.hashCode = states.hashCode();
    }

    @SuppressWarnings("unchecked")
    public static <S> StateSet<S> empty() {
        return (StateSet<S>) EMPTY;
    }

    @SafeVarargs
    public static <S> StateSet<S> of(S... states) {
        return copyOf(Arrays.asList(states));
    }

    public static <S> StateSet<S> copyOf(Collection<? extends S> states) {
        if (states.isEmpty()) {
            return empty();
        }
        return new StateSet<>(Collections.unmodifiableSet(new LinkedHashSet<>(states)));
    }

    public boolean contains(Object state) {
        return states.contains(state);
    }

    /**
     * Checks whether this set shares at least one element with the given collection.
     *
     * @param other
     *         the collection to check against
     *
     * @return {@code true} if the intersection is non-empty, {@code false} otherwise
     */
    public boolean intersects(Collection<?> other) {
        for (S s : states) {
            if (other.contains(s)) {
                return true;
            }
        }
        return false;
    }

    public int size() {
        return states.size();
    }

    public boolean isEmpty() {
        return states.isEmpty();
    }

    public Set<S> asSet() {
        return states;
    }

    @Override
    public Iterator<S> iterator() {
        return states.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StateSet)) {
            return false;
        }
        StateSet<?> that = (StateSet<?>) o;
        return hashCode == that.hashCode && states.equals(that.states);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        Iterator<S> it = states.iterator();
        while (it.hasNext()) {
            sb.append(it.next());
            if (it.hasNext()) {
                sb.append(',');
            }
        }
        return sb.append('}').toString();
    }
}
