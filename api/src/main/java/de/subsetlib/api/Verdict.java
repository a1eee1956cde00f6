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
package de.subsetlib.api;

/**
 * The outcome of running a word through a finite automaton.
 *
 * @author SubsetLib developers
 */
public enum Verdict {

    /**
     * The word was consumed completely and at least one reached state is accepting.
     */
    ACCEPTED,

    /**
     * The word was consumed completely but none of the reached states is accepting.
     */
    REJECTED,

    /**
     * The word contains a symbol that does not belong to the input alphabet of the automaton.
     */
    INVALID;

    public static Verdict fromAcceptance(boolean accepting) {
        return accepting ? ACCEPTED : REJECTED;
    }
}
