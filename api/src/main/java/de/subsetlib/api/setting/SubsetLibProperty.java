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
package de.subsetlib.api.setting;

/**
 * Configuration keys understood by {@link SubsetLibSettings}.
 *
 * @author SubsetLib developers
 */
public enum SubsetLibProperty {

    /**
     * The default determinization strategy, either {@code LAZY} or {@code POWERSET}.
     */
    DETERMINIZER_STRATEGY("determinizer.strategy"),

    /**
     * Upper bound on the number of states a determinizer may construct.
     */
    DETERMINIZER_MAX_STATES("determinizer.maxStates"),

    /**
     * Number of constructed states after which determinizers log a warning.
     */
    DETERMINIZER_WARN_STATES("determinizer.warnStates"),

    EXAMPLE_FILE("example.file"),

    EXAMPLE_WORD("example.word");

    private final String key;

    SubsetLibProperty(String key) {
        this.key = "subsetlib." + key;
    }

    @Override
    public String toString() {
        return key;
    }

}
