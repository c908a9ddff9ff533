package FSA;

import FSA.Model.Automaton;
import FSA.Model.AutomatonBuilder;
import it.unimi.dsi.fastutil.ints.IntList;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.BitSet;
import java.util.List;

public class NFATrimTest {
  private static Automaton<Integer> threeAccepting() {
    AutomatonBuilder<Integer> b = Automaton.builder(Alphabets.integers(0,1));
    b.addInitialState(true);
    b.addState(true);
    b.addState(true);
    b.addTransition(0, 0, 1);
    return b.build();
  }

  @Test
  void testSmallTrim() {
    Automaton<Integer> myNFA = threeAccepting();
    Assertions.assertEquals(3, myNFA.size());

    Automaton<Integer> myNFA2 = NFATrim.trim(myNFA);
    Assertions.assertEquals(2, myNFA2.size()); // state 2 isn't reachable
    Assertions.assertEquals(IntList.of(1), myNFA2.getSuccessors(0, 0));

    myNFA2 = NFATrim.trim(myNFA2);
    Assertions.assertEquals(2, myNFA2.size()); // no difference
  }

  @Test
  void testDeadStates() {
    AutomatonBuilder<String> b = Automaton.<String>builder(TestAutomata.ab()).deterministic(true);
    b.addInitialState(false);
    b.addState(true);
    b.addState(false); // dead
    b.addTransition(0, "a", 1);
    b.addTransition(0, "b", 2);
    b.addTransition(2, "a", 2);
    Automaton<String> dfa = b.build();

    Assertions.assertEquals(BitSetUtils.convertListToBitSet(List.of(0, 1, 2)), NFATrim.reachableStates(dfa));
    Assertions.assertEquals(BitSetUtils.convertListToBitSet(List.of(0, 1)), NFATrim.liveStates(dfa));

    Automaton<String> trimmed = NFATrim.trim(dfa);
    Assertions.assertEquals(2, trimmed.size());
    Assertions.assertEquals(1, trimmed.transitionCount());
    Assertions.assertTrue(trimmed.isDeterministic()); // declaration survives
    Assertions.assertSame(trimmed, NFATrim.trim(trimmed)); // already trim
  }

  @Test
  void testEpsilonReachability() {
    Automaton<String> nfa = TestAutomata.epsilonExample();
    Assertions.assertEquals(6, NFATrim.reachableStates(nfa).cardinality());
    Assertions.assertEquals(6, NFATrim.liveStates(nfa).cardinality());
    Assertions.assertSame(nfa, NFATrim.trim(nfa));
  }

  @Test
  void testEmptyLanguage() {
    // the only accepting state is unreachable
    AutomatonBuilder<String> b = Automaton.builder(TestAutomata.ab());
    b.addInitialState(false);
    b.addState(true);
    b.addTransition(0, "a", 0);
    Automaton<String> nfa = b.build();

    Automaton<String> trimmed = NFATrim.trim(nfa);
    Assertions.assertEquals(NFATrim.emptyLanguage(TestAutomata.ab()), trimmed);
    Assertions.assertEquals(1, trimmed.size());
    Assertions.assertFalse(trimmed.isAccepting(0));
    Assertions.assertTrue(trimmed.isComplete());
    Assertions.assertTrue(trimmed.isDeterministic());
    Assertions.assertTrue(Equivalence.languageEquals(nfa, trimmed));
  }

  @Test
  void testRestrict() {
    Automaton<Integer> myNFA = threeAccepting();
    BitSet keep = BitSetUtils.convertListToBitSet(List.of(0, 2));
    Automaton<Integer> restricted = NFATrim.restrict(myNFA, keep);
    Assertions.assertEquals(2, restricted.size());
    Assertions.assertEquals(0, restricted.transitionCount()); // 0 -> 1 was dropped

    Assertions.assertThrows(IllegalArgumentException.class,
        () -> NFATrim.restrict(myNFA, BitSetUtils.convertListToBitSet(List.of(1, 2))));
  }

  @Test
  void testReverseNFA() {
    Automaton<Integer> myNFA = threeAccepting();

    Automaton<Integer> myNFA2 = NFATrim.reverse(myNFA);
    Assertions.assertEquals(4, myNFA2.size()); // fresh initial state
    Assertions.assertEquals(3, myNFA2.getInitialState());
    // initial and final states flip
    Assertions.assertEquals(BitSetUtils.convertListToBitSet(List.of(0)), myNFA2.getAcceptingStates());
    Assertions.assertEquals(IntList.of(0, 1, 2), myNFA2.getEpsilonSuccessors(3));
    Assertions.assertEquals(IntList.of(0), myNFA2.getSuccessors(1, 0));
    Assertions.assertTrue(myNFA2.getSuccessors(0, 0).isEmpty());
  }

  @Test
  void testReverseLanguage() {
    // reversal of "words ending in b" is "words starting with b"
    Automaton<String> reversed = NFATrim.reverse(TestAutomata.endsWithB());
    Alphabet<String> ab = TestAutomata.ab();
    for (List<String> word : TestAutomata.allWords(ab, 5)) {
      boolean startsWithB = !word.isEmpty() && word.get(0).equals("b");
      Assertions.assertEquals(startsWithB, Equivalence.accepts(reversed, word), word.toString());
    }
  }
}
