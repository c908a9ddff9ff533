package FSA;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;

import FSA.Model.AlphabetMismatchException;
import FSA.Model.Automaton;
import FSA.Model.AutomatonBuilder;
import it.unimi.dsi.fastutil.ints.IntIntImmutablePair;
import it.unimi.dsi.fastutil.ints.IntIntPair;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;

/**
 * Boolean combinations of regular languages through product automata. Every result is trimmed and minimized.
 */
public class BooleanOperations {
    private static final int MISSING_ELEMENT = -1;

    /**
     * Acceptance of a product state from the acceptance of its components.
     */
    @FunctionalInterface
    public interface Combination {
        Combination UNION = (left, right) -> left || right;
        Combination INTERSECTION = (left, right) -> left && right;

        boolean accepts(boolean left, boolean right);
    }

    public static <I> Automaton<I> union(Automaton<I> left, Automaton<I> right) {
        return combine(left, right, Combination.UNION);
    }

    public static <I> Automaton<I> intersection(Automaton<I> left, Automaton<I> right) {
        return combine(left, right, Combination.INTERSECTION);
    }

    public static <I> Automaton<I> difference(Automaton<I> left, Automaton<I> right) {
        checkAlphabets(left.getInputAlphabet(), right.getInputAlphabet());
        return intersection(left, complement(right));
    }

    /**
     * Language complement with respect to the automaton's alphabet.
     */
    public static <I> Automaton<I> complement(Automaton<I> automaton) {
        final Automaton<I> dfa = Minimizer.minimize(automaton); // complete and deterministic
        final AutomatonBuilder<I> out = Automaton.<I>builder(dfa.getInputAlphabet()).deterministic(true);
        out.addStates(dfa.size());
        out.setInitial(dfa.getInitialState());
        for (int q = 0; q < dfa.size(); q++) {
            out.setAccepting(q, !dfa.isAccepting(q));
            for (int a = 0; a < dfa.numInputs(); a++) {
                out.addIndexedTransition(q, a, dfa.getSuccessor(q, a));
            }
        }
        return NFATrim.trim(Minimizer.minimize(out.build()));
    }

    /**
     * Product construction. Only pairs reachable from the initial pair are built.
     * @param left - first operand, any automaton
     * @param right - second operand, over the same symbols as {@code left} (in any order)
     * @param combination - acceptance of a pair
     * @return trimmed minimal automaton over the alphabet of {@code left}
     */
    public static <I> Automaton<I> combine(Automaton<I> left, Automaton<I> right, Combination combination) {
        final Alphabet<I> alphabet = left.getInputAlphabet();
        checkAlphabets(alphabet, right.getInputAlphabet());

        final Automaton<I> a1 = Minimizer.minimize(left);
        final Automaton<I> a2 = Minimizer.minimize(right);
        final int numInputs = alphabet.size();

        // symbol index in the right operand for every symbol index of the left one
        final int[] rightIndex = new int[numInputs];
        for (int a = 0; a < numInputs; a++) {
            rightIndex[a] = a2.getInputAlphabet().getSymbolIndex(alphabet.getSymbol(a));
        }

        final AutomatonBuilder<I> out = Automaton.<I>builder(alphabet).deterministic(true);
        final Object2IntMap<IntIntPair> outStateMap = new Object2IntOpenHashMap<>();
        outStateMap.defaultReturnValue(MISSING_ELEMENT);
        final Deque<IntIntPair> queue = new ArrayDeque<>();

        final IntIntPair init = new IntIntImmutablePair(a1.getInitialState(), a2.getInitialState());
        outStateMap.put(init, out.addInitialState(accepts(a1, a2, init, combination)));
        queue.add(init);

        while (!queue.isEmpty()) {
            final IntIntPair curr = queue.poll();
            final int outState = outStateMap.getInt(curr);
            for (int a = 0; a < numInputs; a++) {
                final IntIntPair succ = new IntIntImmutablePair(a1.getSuccessor(curr.leftInt(), a),
                                                                a2.getSuccessor(curr.rightInt(), rightIndex[a]));
                int outSucc = outStateMap.getInt(succ);
                if (outSucc == MISSING_ELEMENT) {
                    outSucc = out.addState(accepts(a1, a2, succ, combination));
                    outStateMap.put(succ, outSucc);
                    queue.add(succ);
                }
                out.addIndexedTransition(outState, a, outSucc);
            }
        }

        if (PowersetDeterminizer.DEBUG) {
            System.out.println("DEBUG: Product of " + a1.size() + " x " + a2.size() + " states: "
                + out.size() + " reachable pairs");
        }
        return NFATrim.trim(Minimizer.minimize(out.build()));
    }

    private static <I> boolean accepts(Automaton<I> a1, Automaton<I> a2, IntIntPair pair, Combination combination) {
        return combination.accepts(a1.isAccepting(pair.leftInt()), a2.isAccepting(pair.rightInt()));
    }

    static void checkAlphabets(Alphabet<?> left, Alphabet<?> right) {
        if (left.size() != right.size() || !new HashSet<>(left).equals(new HashSet<>(right))) {
            throw new AlphabetMismatchException(left, right);
        }
    }
}
