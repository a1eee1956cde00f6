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
import de.subsetlib.api.setting.SubsetLibProperty;
import de.subsetlib.api.setting.SubsetLibSettings;
import de.subsetlib.datastructure.automaton.StateSet;

/**
 * Static access to the determinizers of this module, configured through {@link SubsetLibSettings}.
 *
 * @author SubsetLib developers
 */
public final class Determinizers {

    public static final int DEFAULT_MAX_STATES = 65536;
    public static final int DEFAULT_WARN_STATES = 4096;

    private Determinizers() {
        // prevent instantiation
    }

    /**
     * Determinizes the given automaton with the default determinizer.
     *
     * @see #getDefault()
     */
    public static <S, I> FiniteAutomaton<StateSet<S>, I> determinize(FiniteAutomaton<S, I> nfa) {
        return getDefault().determinize(nfa);
    }

    /**
     * Returns a determinizer for the strategy configured via {@link SubsetLibProperty#DETERMINIZER_STRATEGY}, {@link
     * DeterminizationStrategy#LAZY} if unset.
     *
     * @return the configured determinizer
     */
    public static Determinizer getDefault() {
        SubsetLibSettings settings = SubsetLibSettings.getInstance();
        return forStrategy(settings.getEnumValue(SubsetLibProperty.DETERMINIZER_STRATEGY,
                                                 DeterminizationStrategy.class,
                                                 DeterminizationStrategy.LAZY));
    }

    public static Determinizer forStrategy(DeterminizationStrategy strategy) {
        SubsetLibSettings settings = SubsetLibSettings.getInstance();
        int maxStates = settings.getInt(SubsetLibProperty.DETERMINIZER_MAX_STATES, DEFAULT_MAX_STATES);
        int warnStates = settings.getInt(SubsetLibProperty.DETERMINIZER_WARN_STATES, DEFAULT_WARN_STATES);

        switch (strategy) {
            case LAZY:
                return new SubsetConstructionDeterminizer(maxStates, warnStates);
            case POWERSET:
                return new PowersetDeterminizer(maxStates, warnStates);
            default:
                throw new IllegalArgumentException("Unknown strategy: " + strategy);
        }
    }
}
