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

import java.io.IOException;
import java.io.StringReader;

import de.subsetlib.algorithm.determinization.PowersetDeterminizer;
import de.subsetlib.algorithm.determinization.SubsetConstructionDeterminizer;
import de.subsetlib.algorithm.simulation.WordProcessor;
import de.subsetlib.api.automaton.FiniteAutomaton;
import de.subsetlib.datastructure.automaton.ExplicitAutomaton;
import de.subsetlib.datastructure.automaton.StateSet;
import net.automatalib.words.Word;
import org.testng.Assert;
import org.testng.annotations.Test;

public class TextualAutomatonWriterTest {

    private static final String FORK = "a b\n" + "q0 q1 q2\n" + "q2\n" + "q0\n" + "q0 a q1\n" + "q0 a q2\n" +
                                       "q1 b q2\n" + "q2 b q1\n";

    @Test
    public void testWriteNondeterministic() throws IOException, AutomatonFormatException {
        ExplicitAutomaton<String, String> nfa = new TextualAutomatonParser().parse(new StringReader(FORK)).model;

        Assert.assertEquals(TextualAutomatonWriter.toString(nfa), FORK);
    }

    @Test
    public void testWriteDeterminized() throws IOException, AutomatonFormatException {
        ExplicitAutomaton<String, String> nfa = new TextualAutomatonParser().parse(new StringReader(FORK)).model;
        FiniteAutomaton<StateSet<String>, String> dfa = new SubsetConstructionDeterminizer().determinize(nfa);

        String expected = "a b\n" + "{q0} {q1,q2} {}\n" + "{q1,q2}\n" + "{q0}\n" + "{q0} a {q1,q2}\n" +
                          "{q0} b {}\n" + "{q1,q2} a {}\n" + "{q1,q2} b {q1,q2}\n" + "{} a {}\n" + "{} b {}\n";
        Assert.assertEquals(TextualAutomatonWriter.toString(dfa), expected);
    }

    @Test
    public void testDeterminizedRoundTripKeepsLanguage() throws IOException, AutomatonFormatException {
        ExplicitAutomaton<String, String> nfa = new TextualAutomatonParser().parse(new StringReader(FORK)).model;
        FiniteAutomaton<StateSet<String>, String> dfa = new PowersetDeterminizer().determinize(nfa);

        String text = TextualAutomatonWriter.toString(dfa);
        ParseResult<String, String> reread = TextualAutomatonParser.strict().parse(new StringReader(text));

        Assert.assertEquals(reread.model.size(), 8);
        WordProcessor<String, String> expected = new WordProcessor<>(nfa);
        WordProcessor<String, String> actual = new WordProcessor<>(reread.model);
        String[][] words = {{}, {"a"}, {"b"}, {"a", "b"}, {"a", "b", "b"}, {"a", "a"}, {"b", "a", "b"}};
        for (String[] symbols : words) {
            Word<String> word = Word.fromSymbols(symbols);
            Assert.assertEquals(actual.process(word), expected.process(word), "Mismatch on " + word);
        }
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testRejectsWhitespaceInTokens() {
        ExplicitAutomaton<String, String> automaton = ExplicitAutomaton.<String, String>builder()
                                                                       .withInputs("a")
                                                                       .withStates("state zero")
                                                                       .withInitial("state zero")
                                                                       .create();
        TextualAutomatonWriter.toString(automaton);
    }
}
