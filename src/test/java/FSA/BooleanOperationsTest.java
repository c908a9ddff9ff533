package FSA;

import FSA.Model.AlphabetMismatchException;
import FSA.Model.Automaton;
import FSA.Model.AutomatonBuilder;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

public class BooleanOperationsTest {
  private interface Language {
    boolean contains(List<String> word);
  }

  private static final Language ENDS_WITH_B = w -> !w.isEmpty() && w.get(w.size() - 1).equals("b");
  private static final Language STARTS_WITH_A = w -> !w.isEmpty() && w.get(0).equals("a");

  private static void assertLanguage(Language expected, Automaton<String> actual) {
    for (List<String> word : TestAutomata.allWords(TestAutomata.ab(), 6)) {
      Assertions.assertEquals(expected.contains(word), Equivalence.accepts(actual, word), word.toString());
    }
  }

  @Test
  void testUnion() {
    Automaton<String> union = BooleanOperations.union(TestAutomata.endsWithB(), TestAutomata.startsWithA());
    assertLanguage(w -> ENDS_WITH_B.contains(w) || STARTS_WITH_A.contains(w), union);
    Assertions.assertTrue(union.isDeterministic());
  }

  @Test
  void testIntersection() {
    Automaton<String> intersection =
        BooleanOperations.intersection(TestAutomata.endsWithB(), TestAutomata.startsWithA());
    assertLanguage(w -> ENDS_WITH_B.contains(w) && STARTS_WITH_A.contains(w), intersection);
    // a.*b needs three states and nothing else once trimmed
    Assertions.assertEquals(3, intersection.size());
  }

  @Test
  void testDifference() {
    Automaton<String> difference =
        BooleanOperations.difference(TestAutomata.endsWithB(), TestAutomata.startsWithA());
    assertLanguage(w -> ENDS_WITH_B.contains(w) && !STARTS_WITH_A.contains(w), difference);

    Automaton<String> self = BooleanOperations.difference(TestAutomata.endsWithB(), TestAutomata.endsWithB());
    Assertions.assertEquals(NFATrim.emptyLanguage(TestAutomata.ab()), self);
  }

  @Test
  void testComplement() {
    Automaton<String> complement = BooleanOperations.complement(TestAutomata.endsWithB());
    assertLanguage(w -> !ENDS_WITH_B.contains(w), complement);

    Automaton<String> twice = BooleanOperations.complement(complement);
    Assertions.assertTrue(Equivalence.languageEquals(TestAutomata.endsWithB(), twice));

    // complement of the empty language is everything
    Automaton<String> all = BooleanOperations.complement(NFATrim.emptyLanguage(TestAutomata.ab()));
    Assertions.assertEquals(1, all.size());
    Assertions.assertTrue(all.isAccepting(0));
  }

  @Test
  void testDeMorgan() {
    Automaton<String> a = TestAutomata.endsWithB();
    Automaton<String> b = TestAutomata.startsWithA();
    Automaton<String> left = BooleanOperations.complement(BooleanOperations.union(a, b));
    Automaton<String> right = BooleanOperations.intersection(BooleanOperations.complement(a),
                                                             BooleanOperations.complement(b));
    Assertions.assertTrue(Equivalence.languageEquals(left, right));
    Assertions.assertEquals(left, right); // both canonical
  }

  @Test
  void testResultsAreTrimmedAndMinimal() {
    Automaton<String> union = BooleanOperations.union(TestAutomata.endsWithB(), TestAutomata.startsWithA());
    Assertions.assertSame(union, NFATrim.trim(union));
    Assertions.assertEquals(union, Minimizer.minimize(union)); // complete, so nothing was trimmed
  }

  @Test
  void testAlphabetOrderIgnored() {
    // startsWithA over (b, a)
    Alphabet<String> ba = Alphabets.fromCollection(List.of("b", "a"));
    AutomatonBuilder<String> builder = Automaton.<String>builder(ba).deterministic(true);
    builder.addInitialState(false);
    builder.addState(true);
    builder.addTransition(0, "a", 1);
    builder.addTransition(1, "a", 1);
    builder.addTransition(1, "b", 1);
    Automaton<String> reordered = builder.build();

    Automaton<String> intersection = BooleanOperations.intersection(TestAutomata.endsWithB(), reordered);
    assertLanguage(w -> ENDS_WITH_B.contains(w) && STARTS_WITH_A.contains(w), intersection);
    Assertions.assertEquals(List.of("a", "b"), new ArrayList<>(intersection.getInputAlphabet())); // left operand's order
  }

  @Test
  void testAlphabetMismatch() {
    AutomatonBuilder<String> builder = Automaton.builder(Alphabets.fromCollection(List.of("a", "c")));
    builder.addInitialState(true);
    Automaton<String> other = builder.build();

    Assertions.assertThrows(AlphabetMismatchException.class,
        () -> BooleanOperations.union(TestAutomata.endsWithB(), other));
    Assertions.assertThrows(AlphabetMismatchException.class,
        () -> BooleanOperations.intersection(TestAutomata.endsWithB(), other));
    Assertions.assertThrows(AlphabetMismatchException.class,
        () -> BooleanOperations.difference(TestAutomata.endsWithB(), other));
  }

  @Test
  void testCustomCombination() {
    // symmetric difference
    Automaton<String> xor = BooleanOperations.combine(TestAutomata.endsWithB(), TestAutomata.startsWithA(),
                                                      (l, r) -> l != r);
    assertLanguage(w -> ENDS_WITH_B.contains(w) != STARTS_WITH_A.contains(w), xor);
  }
}
