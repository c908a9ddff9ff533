package FSA.Model;

import FSA.BitSetUtils;
import FSA.TestAutomata;
import it.unimi.dsi.fastutil.ints.IntList;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.BitSet;
import java.util.List;

public class AutomatonTest {
  @Test
  void testAccessors() {
    Automaton<String> nfa = TestAutomata.endsWithB();
    Assertions.assertEquals(2, nfa.size());
    Assertions.assertEquals(2, nfa.numInputs());
    Assertions.assertEquals(IntList.of(0, 1), nfa.getStates());
    Assertions.assertEquals(0, nfa.getInitialState());
    Assertions.assertFalse(nfa.isAccepting(0));
    Assertions.assertTrue(nfa.isAccepting(1));
    Assertions.assertEquals(BitSetUtils.convertListToBitSet(List.of(1)), nfa.getAcceptingStates());
    Assertions.assertFalse(nfa.isDeterministic());
    Assertions.assertFalse(nfa.isComplete()); // state 1 has no successors
    Assertions.assertFalse(nfa.hasEpsilonTransitions());
    Assertions.assertEquals(3, nfa.transitionCount());

    // destinations are sorted, whatever the insertion order
    Assertions.assertEquals(IntList.of(0, 1), nfa.getSuccessors(0, "b"));
    Assertions.assertEquals(IntList.of(0), nfa.getSuccessors(0, "a"));
    Assertions.assertTrue(nfa.getSuccessors(1, 0).isEmpty());
    Assertions.assertEquals(-1, nfa.getSuccessor(1, 0));

    List<Transition<String>> transitions = nfa.getTransitions(0);
    Assertions.assertEquals(List.of(new Transition<>(0, "a", 0), new Transition<>(0, "b", 0),
                                    new Transition<>(0, "b", 1)), transitions);
  }

  @Test
  void testEpsilonTransitions() {
    Automaton<String> nfa = TestAutomata.epsilonExample();
    Assertions.assertEquals(6, nfa.size());
    Assertions.assertTrue(nfa.hasEpsilonTransitions());
    Assertions.assertEquals(IntList.of(2, 3), nfa.getEpsilonSuccessors(0));
    Transition<String> first = nfa.getTransitions(0).get(0);
    Assertions.assertTrue(first.isEpsilon());
    Assertions.assertNull(first.symbol());
    Assertions.assertEquals(7, nfa.transitionCount());
  }

  @Test
  void testImmutability() {
    Automaton<String> nfa = TestAutomata.endsWithB();
    BitSet accepting = nfa.getAcceptingStates();
    accepting.set(0);
    Assertions.assertFalse(nfa.isAccepting(0)); // copy was modified, not the automaton
    Assertions.assertThrows(UnsupportedOperationException.class, () -> nfa.getSuccessors(0, "b").add(1));
  }

  @Test
  void testDuplicateTransitionsCollapse() {
    AutomatonBuilder<String> b = Automaton.builder(TestAutomata.ab());
    b.addInitialState(true);
    b.addTransition(0, "a", 0);
    b.addTransition(0, "a", 0);
    Automaton<String> a = b.build();
    Assertions.assertEquals(1, a.transitionCount());
  }

  @Test
  void testMalformed() {
    final Alphabet<String> ab = TestAutomata.ab();

    // no states at all
    Assertions.assertThrows(MalformedAutomatonException.class, () -> Automaton.builder(ab).build());

    // transition to an unknown state
    AutomatonBuilder<String> b1 = Automaton.builder(ab);
    b1.addInitialState(false);
    b1.addTransition(0, "a", 5);
    Assertions.assertThrows(MalformedAutomatonException.class, b1::build);

    // symbol outside the alphabet
    AutomatonBuilder<String> b2 = Automaton.builder(ab);
    b2.addInitialState(false);
    b2.addTransition(0, "c", 0);
    Assertions.assertThrows(MalformedAutomatonException.class, b2::build);

    // initial state out of range
    AutomatonBuilder<String> b3 = Automaton.builder(ab);
    b3.addState(false);
    b3.setInitial(3);
    Assertions.assertThrows(MalformedAutomatonException.class, b3::build);

    // accepting state out of range
    AutomatonBuilder<String> b4 = Automaton.builder(ab);
    b4.addInitialState(false);
    b4.setAccepting(2, true);
    Assertions.assertThrows(MalformedAutomatonException.class, b4::build);
  }

  @Test
  void testDeterministicDeclaration() {
    AutomatonBuilder<String> b1 = Automaton.<String>builder(TestAutomata.ab()).deterministic(true);
    b1.addInitialState(false);
    b1.addState(true);
    b1.addTransition(0, "a", 0);
    b1.addTransition(0, "a", 1);
    Assertions.assertThrows(MalformedAutomatonException.class, b1::build);

    AutomatonBuilder<String> b2 = Automaton.<String>builder(TestAutomata.ab()).deterministic(true);
    b2.addInitialState(false);
    b2.addState(true);
    b2.addEpsilonTransition(0, 1);
    Assertions.assertThrows(MalformedAutomatonException.class, b2::build);

    Automaton<String> dfa = TestAutomata.startsWithA();
    Assertions.assertTrue(dfa.isDeterministic());
    Assertions.assertEquals(1, dfa.getSuccessor(0, 0));
    Assertions.assertEquals(-1, dfa.getSuccessor(0, 1));
  }

  @Test
  void testEquality() {
    Assertions.assertEquals(TestAutomata.endsWithB(), TestAutomata.endsWithB());
    Assertions.assertEquals(TestAutomata.endsWithB().hashCode(), TestAutomata.endsWithB().hashCode());
    Assertions.assertNotEquals(TestAutomata.endsWithB(), TestAutomata.startsWithA());

    // declaration is not part of the structure
    AutomatonBuilder<String> b = Automaton.builder(TestAutomata.ab());
    b.addInitialState(false);
    b.addState(true);
    b.addTransition(0, "a", 1);
    b.addTransition(1, "a", 1);
    b.addTransition(1, "b", 1);
    Automaton<String> undeclared = b.build();
    Assertions.assertFalse(undeclared.isDeterministic());
    Assertions.assertEquals(TestAutomata.startsWithA(), undeclared);

    // same symbols in another order is another structure
    AutomatonBuilder<String> reordered = Automaton.builder(Alphabets.fromCollection(List.of("b", "a")));
    reordered.addInitialState(false);
    reordered.addState(true);
    reordered.addTransition(0, "a", 1);
    reordered.addTransition(1, "a", 1);
    reordered.addTransition(1, "b", 1);
    Assertions.assertNotEquals(undeclared, reordered.build());
  }

  @Test
  void testExceptions() {
    SymbolNotInAlphabetException e = new SymbolNotInAlphabetException("z", 3);
    Assertions.assertEquals("z", e.getSymbol());
    Assertions.assertEquals(3, e.getPosition());
    Assertions.assertTrue(e.getMessage().contains("z"));

    AlphabetMismatchException mismatch = new AlphabetMismatchException(List.of("a"), List.of("b"));
    Assertions.assertInstanceOf(AutomatonException.class, mismatch);
  }
}
