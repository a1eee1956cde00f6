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

/**
 * Describes a transition line that has been skipped because it does not consist of exactly three tokens.
 */
public final class LineDiagnostic {

    private final int lineNumber;
    private final String line;
    private final int tokenCount;

    public LineDiagnostic(int lineNumber, String line, int tokenCount) {
        this.lineNumber = lineNumber;
        this.line = line;
        this.tokenCount = tokenCount;
    }

    /**
     * Returns the 1-based number of the offending line.
     */
    public int getLineNumber() {
        return lineNumber;
    }

    public String getLine() {
        return line;
    }

    public int getTokenCount() {
        return tokenCount;
    }

    @Override
    public String toString() {
        return "line " + lineNumber + ": expected 3 tokens but found " + tokenCount + " in '" + line + '\'';
    }
}
