package FSA;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import FSA.Model.Automaton;
import FSA.Model.SymbolNotInAlphabetException;
import net.automatalib.alphabet.Alphabet;

/**
 * Acceptance and language equivalence queries.
 */
public class Equivalence {

    /**
     * Simulate the automaton on a word, tracking the epsilon-closed set of current states.
     * @param automaton - deterministic or not
     * @param word - symbols of the automaton's alphabet
     * @return whether the word is accepted
     * @throws SymbolNotInAlphabetException if any symbol of the word is not in the alphabet
     */
    public static <I> boolean accepts(Automaton<I> automaton, Iterable<? extends I> word) {
        final Alphabet<I> alphabet = automaton.getInputAlphabet();
        final List<Integer> indices = new ArrayList<>();
        int position = 0;
        for (I symbol : word) {
            if (!alphabet.contains(symbol)) {
                throw new SymbolNotInAlphabetException(symbol, position);
            }
            indices.add(alphabet.getSymbolIndex(symbol));
            position++;
        }

        BitSet current = new BitSet();
        current.set(automaton.getInitialState());
        PowersetDeterminizer.epsilonClosure(automaton, current);
        for (int a : indices) {
            if (current.isEmpty()) {
                return false; // no run left
            }
            current = PowersetDeterminizer.successor(automaton, current, a);
        }
        return current.intersects(automaton.getAcceptingStates());
    }

    @SafeVarargs
    public static <I> boolean accepts(Automaton<I> automaton, I... word) {
        return accepts(automaton, Arrays.asList(word));
    }

    /**
     * Decide language equality by comparing the trimmed minimal automata up to isomorphism.
     */
    public static <I> boolean languageEquals(Automaton<I> left, Automaton<I> right) {
        BooleanOperations.checkAlphabets(left.getInputAlphabet(), right.getInputAlphabet());
        final Automaton<I> canonicalLeft = NFATrim.trim(Minimizer.minimize(left));
        final Automaton<I> canonicalRight = NFATrim.trim(Minimizer.minimize(right));
        return isomorphic(canonicalLeft, canonicalRight);
    }

    /**
     * Decide language equality through the emptiness of both differences.
     */
    public static <I> boolean languageEqualsByDifference(Automaton<I> left, Automaton<I> right) {
        return isSubsetOf(left, right) && isSubsetOf(right, left);
    }

    /**
     * Language inclusion of {@code left} in {@code right}.
     */
    public static <I> boolean isSubsetOf(Automaton<I> left, Automaton<I> right) {
        return isEmpty(BooleanOperations.difference(left, right));
    }

    /**
     * Whether no accepting state is reachable.
     */
    public static <I> boolean isEmpty(Automaton<I> automaton) {
        return !NFATrim.reachableStates(automaton).intersects(automaton.getAcceptingStates());
    }

    /**
     * Isomorphism of deterministic automata: a bijection between the reachable states mapping initial to initial,
     * accepting to accepting and respecting every transition. Symbols are matched by value.
     * Unreachable states must not exist; trimmed or minimized automata satisfy this.
     */
    public static <I> boolean isomorphic(Automaton<I> left, Automaton<I> right) {
        if (!left.isDeterministic() || !right.isDeterministic()) {
            throw new IllegalArgumentException("Isomorphism is only decided for deterministic automata");
        }
        if (left.size() != right.size() || left.transitionCount() != right.transitionCount()) {
            return false;
        }
        final Alphabet<I> alphabet = left.getInputAlphabet();
        final Alphabet<I> rightAlphabet = right.getInputAlphabet();
        if (alphabet.size() != rightAlphabet.size()) {
            return false;
        }
        final int[] rightIndex = new int[alphabet.size()];
        for (int a = 0; a < alphabet.size(); a++) {
            final I symbol = alphabet.getSymbol(a);
            if (!rightAlphabet.contains(symbol)) {
                return false;
            }
            rightIndex[a] = rightAlphabet.getSymbolIndex(symbol);
        }

        final int[] mapping = new int[left.size()];
        final int[] inverse = new int[right.size()];
        Arrays.fill(mapping, -1);
        Arrays.fill(inverse, -1);
        final Deque<Integer> queue = new ArrayDeque<>();

        mapping[left.getInitialState()] = right.getInitialState();
        inverse[right.getInitialState()] = left.getInitialState();
        queue.add(left.getInitialState());

        int mapped = 1;
        while (!queue.isEmpty()) {
            final int p = queue.poll();
            final int q = mapping[p];
            if (left.isAccepting(p) != right.isAccepting(q)) {
                return false;
            }
            for (int a = 0; a < alphabet.size(); a++) {
                final int ps = left.getSuccessor(p, a);
                final int qs = right.getSuccessor(q, rightIndex[a]);
                if (ps < 0 || qs < 0) {
                    if (ps < 0 && qs < 0) {
                        continue; // undefined on both sides
                    }
                    return false;
                }
                if (mapping[ps] < 0 && inverse[qs] < 0) {
                    mapping[ps] = qs;
                    inverse[qs] = ps;
                    mapped++;
                    queue.add(ps);
                } else if (mapping[ps] != qs || inverse[qs] != ps) {
                    return false;
                }
            }
        }
        return mapped == left.size();
    }

    /**
     * Shortest accepted word; among words of equal length the first in alphabet order.
     * @return the word, or empty if the language is empty
     */
    public static <I> Optional<List<I>> shortestAcceptedWord(Automaton<I> automaton) {
        final Automaton<I> dfa = automaton.isDeterministic()
            ? automaton : PowersetDeterminizer.determinize(automaton, false);
        final Alphabet<I> alphabet = dfa.getInputAlphabet();

        // breadth-first search in symbol order visits the shortest, alphabetically first path to every state
        final int[] parent = new int[dfa.size()];
        final int[] parentSymbol = new int[dfa.size()];
        Arrays.fill(parent, -1);
        final BitSet visited = new BitSet(dfa.size());
        final Deque<Integer> queue = new ArrayDeque<>();
        visited.set(dfa.getInitialState());
        queue.add(dfa.getInitialState());

        while (!queue.isEmpty()) {
            final int q = queue.poll();
            if (dfa.isAccepting(q)) {
                final List<I> word = new ArrayList<>();
                for (int s = q; parent[s] >= 0; s = parent[s]) {
                    word.add(alphabet.getSymbol(parentSymbol[s]));
                }
                Collections.reverse(word);
                return Optional.of(word);
            }
            for (int a = 0; a < alphabet.size(); a++) {
                final int succ = dfa.getSuccessor(q, a);
                if (succ >= 0 && !visited.get(succ)) {
                    visited.set(succ);
                    parent[succ] = q;
                    parentSymbol[succ] = a;
                    queue.add(succ);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Shortest word accepted by exactly one of the two automata.
     * @return the word, or empty if the languages are equal
     */
    public static <I> Optional<List<I>> findSeparatingWord(Automaton<I> left, Automaton<I> right) {
        final Automaton<I> symmetricDifference =
            BooleanOperations.union(BooleanOperations.difference(left, right), BooleanOperations.difference(right, left));
        return shortestAcceptedWord(symmetricDifference);
    }
}
