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

import java.util.Collections;
import java.util.Random;

import de.subsetlib.algorithm.simulation.WordProcessor;
import de.subsetlib.api.Verdict;
import de.subsetlib.api.automaton.FiniteAutomaton;
import de.subsetlib.api.exception.StateLimitException;
import de.subsetlib.datastructure.automaton.ExplicitAutomaton;
import de.subsetlib.datastructure.automaton.StateSet;
import net.automatalib.automata.fsa.impl.compact.CompactDFA;
import net.automatalib.util.automata.fsa.NFAs;
import net.automatalib.words.Word;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class DeterminizerTest {

    @DataProvider(name = "determinizers")
    public static Object[][] determinizers() {
        return new Object[][] {{new SubsetConstructionDeterminizer()}, {new PowersetDeterminizer()}};
    }

    @Test(dataProvider = "determinizers")
    public void testForkIsMerged(Determinizer determinizer) {
        FiniteAutomaton<StateSet<String>, String> dfa = determinizer.determinize(DeterminizationFixtures.forkOnA());

        StateSet<String> init = StateSet.of("q0");
        StateSet<String> fork = StateSet.of("q1", "q2");

        Assert.assertEquals(dfa.getInitialState(), init);
        Assert.assertEquals(dfa.getSuccessors(init, "a"), Collections.singleton(fork));
        Assert.assertEquals(dfa.getSuccessors(fork, "b"), Collections.singleton(fork));
        Assert.assertEquals(dfa.getSuccessors(init, "b"), Collections.singleton(StateSet.<String>empty()));
        Assert.assertTrue(dfa.isAccepting(fork));
        Assert.assertFalse(dfa.isAccepting(StateSet.<String>empty()));
        Assert.assertEquals(WordProcessor.process(dfa, Word.fromSymbols("a", "b", "b")), Verdict.ACCEPTED);
    }

    @Test(dataProvider = "determinizers")
    public void testResultIsCompleteAndDeterministic(Determinizer determinizer) {
        FiniteAutomaton<StateSet<String>, String> dfa = determinizer.determinize(DeterminizationFixtures.secondToLastIsA());

        Assert.assertTrue(dfa.isDeterministic());
        for (StateSet<String> state : dfa.getStates()) {
            for (String sym : dfa.getInputAlphabet()) {
                Assert.assertEquals(dfa.getSuccessors(state, sym).size(), 1, state + " on " + sym);
            }
        }
    }

    @Test(dataProvider = "determinizers")
    public void testLanguageIsPreserved(Determinizer determinizer) {
        ExplicitAutomaton<String, String> nfa = DeterminizationFixtures.secondToLastIsA();
        WordProcessor<String, String> expected = new WordProcessor<>(nfa);
        WordProcessor<StateSet<String>, String> actual = new WordProcessor<>(determinizer.determinize(nfa));

        for (Word<String> word : DeterminizationFixtures.wordsUpTo(nfa.getInputAlphabet(), 7)) {
            Assert.assertEquals(actual.process(word), expected.process(word), "Mismatch on " + word);
        }
    }

    @Test(dataProvider = "determinizers")
    public void testLanguageIsPreservedOnRandomAutomata(Determinizer determinizer) {
        Random random = new Random(1337);

        for (int round = 0; round < 25; round++) {
            ExplicitAutomaton<Integer, Integer> nfa = DeterminizationFixtures.random(random, 1 + random.nextInt(6), 2);
            WordProcessor<Integer, Integer> expected = new WordProcessor<>(nfa);
            WordProcessor<StateSet<Integer>, Integer> actual = new WordProcessor<>(determinizer.determinize(nfa));

            for (Word<Integer> word : DeterminizationFixtures.wordsUpTo(nfa.getInputAlphabet(), 6)) {
                Assert.assertNotEquals(expected.process(word), Verdict.INVALID);
                Assert.assertEquals(actual.process(word), expected.process(word), "Round " + round + ", " + word);
            }
        }
    }

    @Test(dataProvider = "determinizers")
    public void testInvalidWordsStayInvalid(Determinizer determinizer) {
        FiniteAutomaton<StateSet<String>, String> dfa = determinizer.determinize(DeterminizationFixtures.forkOnA());

        Assert.assertEquals(WordProcessor.process(dfa, Word.fromSymbols("a", "c")), Verdict.INVALID);
        Assert.assertEquals(WordProcessor.process(dfa, Word.fromSymbols("c")), Verdict.INVALID);
    }

    @Test(dataProvider = "determinizers")
    public void testDeterminizationIsIdempotentUpToRelabeling(Determinizer determinizer) {
        ExplicitAutomaton<String, String> nfa = DeterminizationFixtures.secondToLastIsA();
        FiniteAutomaton<StateSet<String>, String> once = determinizer.determinize(nfa);
        FiniteAutomaton<StateSet<StateSet<String>>, String> twice =
                new SubsetConstructionDeterminizer().determinize(once);

        WordProcessor<StateSet<String>, String> onceProcessor = new WordProcessor<>(once);
        WordProcessor<StateSet<StateSet<String>>, String> twiceProcessor = new WordProcessor<>(twice);
        for (Word<String> word : DeterminizationFixtures.wordsUpTo(nfa.getInputAlphabet(), 6)) {
            Assert.assertEquals(twiceProcessor.process(word), onceProcessor.process(word), "Mismatch on " + word);
        }
    }

    @Test(dataProvider = "determinizers")
    public void testStartWithoutTransitions(Determinizer determinizer) {
        ExplicitAutomaton<String, String> nfa = ExplicitAutomaton.<String, String>builder()
                                                                 .withInputs("a")
                                                                 .withStates("q0")
                                                                 .withAccepting("q0")
                                                                 .withInitial("q0")
                                                                 .create();
        FiniteAutomaton<StateSet<String>, String> dfa = determinizer.determinize(nfa);

        Assert.assertEquals(dfa.getInitialState(), StateSet.of("q0"));
        Assert.assertEquals(WordProcessor.process(dfa, Word.<String>epsilon()), Verdict.ACCEPTED);
        Assert.assertEquals(WordProcessor.process(dfa, Word.fromSymbols("a")), Verdict.REJECTED);
    }

    @Test
    public void testAgreesWithAutomataLib() {
        Random random = new Random(7);

        for (int round = 0; round < 25; round++) {
            ExplicitAutomaton<Integer, Integer> nfa = DeterminizationFixtures.random(random, 2 + random.nextInt(5), 3);
            CompactDFA<Integer> oracle = NFAs.determinize(nfa, nfa.getInputAlphabet());
            WordProcessor<Integer, Integer> expected = new WordProcessor<>(nfa);
            WordProcessor<StateSet<Integer>, Integer> actual =
                    new WordProcessor<>(new SubsetConstructionDeterminizer().determinize(nfa));

            for (Word<Integer> word : DeterminizationFixtures.wordsUpTo(nfa.getInputAlphabet(), 5)) {
                Assert.assertNotEquals(expected.process(word), Verdict.INVALID);
                Assert.assertEquals(actual.accepts(word), oracle.accepts(word), "Round " + round + ", " + word);
                Assert.assertEquals(nfa.accepts(word), oracle.accepts(word), "Round " + round + ", " + word);
            }
        }
    }

    @Test(dataProvider = "determinizers")
    public void testSubsetsFollowDeclarationOrder(Determinizer determinizer) {
        ExplicitAutomaton<String, String> nfa = ExplicitAutomaton.<String, String>builder()
                                                                 .withInputs("a")
                                                                 .withStates("z", "y", "x")
                                                                 .withAccepting("x")
                                                                 .withInitial("z")
                                                                 .addTransition("z", "a", "x")
                                                                 .addTransition("z", "a", "y")
                                                                 .create();
        FiniteAutomaton<StateSet<String>, String> dfa = determinizer.determinize(nfa);
        StateSet<String> succ = dfa.getSuccessors(StateSet.of("z"), "a").iterator().next();

        Assert.assertEquals(succ.toString(), "{y,x}");
        Assert.assertTrue(dfa.isAccepting(succ));
    }

    @Test
    public void testPowersetContainsEverySubset() {
        FiniteAutomaton<StateSet<String>, String> dfa = new PowersetDeterminizer().determinize(DeterminizationFixtures.forkOnA());

        Assert.assertEquals(dfa.size(), 8);
        Assert.assertTrue(dfa.getStates().contains(StateSet.<String>empty()));
        Assert.assertTrue(dfa.getStates().contains(StateSet.of("q0", "q1", "q2")));
        // every subset containing the accepting q2 is accepting, not only {q2} itself
        Assert.assertEquals(dfa.getAcceptingStates().size(), 4);
        Assert.assertTrue(dfa.isAccepting(StateSet.of("q0", "q2")));
        Assert.assertFalse(dfa.isAccepting(StateSet.of("q0", "q1")));
    }

    @Test
    public void testLazyConstructsOnlyReachableSubsets() {
        FiniteAutomaton<StateSet<String>, String> dfa =
                new SubsetConstructionDeterminizer().determinize(DeterminizationFixtures.forkOnA());

        // {q0}, {q1,q2}, {}
        Assert.assertEquals(dfa.size(), 3);
        Assert.assertFalse(dfa.getStates().contains(StateSet.of("q0", "q1", "q2")));
    }

    @Test
    public void testLazyIsNeverLargerThanPowerset() {
        Random random = new Random(99);

        for (int round = 0; round < 10; round++) {
            ExplicitAutomaton<Integer, Integer> nfa = DeterminizationFixtures.random(random, 1 + random.nextInt(6), 2);
            int lazy = new SubsetConstructionDeterminizer().determinize(nfa).size();
            int powerset = new PowersetDeterminizer().determinize(nfa).size();

            Assert.assertEquals(powerset, 1 << nfa.size());
            Assert.assertTrue(lazy <= powerset);
        }
    }

    @Test(expectedExceptions = StateLimitException.class)
    public void testPowersetLimit() {
        new PowersetDeterminizer(4, 2).determinize(DeterminizationFixtures.forkOnA());
    }

    @Test(expectedExceptions = StateLimitException.class)
    public void testLazyLimit() {
        new SubsetConstructionDeterminizer(2, 1).determinize(DeterminizationFixtures.forkOnA());
    }

    @Test
    public void testLazyLimitIsInclusive() {
        Assert.assertEquals(new SubsetConstructionDeterminizer(3, 1).determinize(DeterminizationFixtures.forkOnA()).size(), 3);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNonPositiveLimit() {
        new SubsetConstructionDeterminizer(0, 0);
    }

    @Test
    public void testSourceIsLeftUntouched() {
        ExplicitAutomaton<String, String> nfa = DeterminizationFixtures.forkOnA();
        int transitions = nfa.getTransitionRelation().size();

        new SubsetConstructionDeterminizer().determinize(nfa);
        new PowersetDeterminizer().determinize(nfa);

        Assert.assertEquals(nfa.getTransitionRelation().size(), transitions);
        Assert.assertEquals(nfa.getSuccessors("q0", "a").size(), 2);
        Assert.assertFalse(nfa.isDeterministic());
    }
}
