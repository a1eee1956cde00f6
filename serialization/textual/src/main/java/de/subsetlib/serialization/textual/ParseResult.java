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

import java.util.Collections;
import java.util.List;

import de.subsetlib.datastructure.automaton.ExplicitAutomaton;

/**
 * The outcome of parsing a textual automaton description: the automaton itself and the transition lines that had to be
 * skipped.
 *
 * @param <S>
 *         state type
 * @param <I>
 *         input symbol type
 */
public final class ParseResult<S, I> {

    public final ExplicitAutomaton<S, I> model;
    public final List<LineDiagnostic> diagnostics;

    ParseResult(ExplicitAutomaton<S, I> model, List<LineDiagnostic> diagnostics) {
        this.model = model;
        this.diagnostics = Collections.unmodifiableList(diagnostics);
    }

    public boolean isClean() {
        return diagnostics.isEmpty();
    }
}
