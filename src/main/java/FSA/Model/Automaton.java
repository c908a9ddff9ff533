package FSA.Model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.concept.FiniteRepresentation;
import net.automatalib.automaton.concept.InputAlphabetHolder;

/**
 * Immutable finite automaton over a finite alphabet, possibly non-deterministic and possibly with epsilon
 * transitions.
 * <p>
 * States are the dense indices {@code 0..size()-1}. Transitions are kept per state and per symbol index as sorted,
 * duplicate-free arrays of destinations; epsilon transitions are kept in a separate relation. Instances are created by
 * {@link AutomatonBuilder} and never change afterwards; every algorithm returns a new instance.
 *
 * @param <I> input symbol type
 */
public final class Automaton<I> implements FiniteRepresentation, InputAlphabetHolder<I> {
    static final int[] NO_STATES = new int[0];

    private final Alphabet<I> alphabet;
    private final int size;
    private final int initial;
    private final BitSet accepting;
    private final int[][][] successors; // [state][symbol index] -> sorted destinations
    private final int[][] epsilonSuccessors; // [state] -> sorted destinations
    private final boolean deterministic;

    // arrays are handed over by the builder and not shared with anybody else
    Automaton(Alphabet<I> alphabet, int size, int initial, BitSet accepting,
              int[][][] successors, int[][] epsilonSuccessors, boolean deterministic) {
        this.alphabet = alphabet;
        this.size = size;
        this.initial = initial;
        this.accepting = accepting;
        this.successors = successors;
        this.epsilonSuccessors = epsilonSuccessors;
        this.deterministic = deterministic;
    }

    public static <I> AutomatonBuilder<I> builder(Alphabet<I> alphabet) {
        return new AutomatonBuilder<>(alphabet);
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public Alphabet<I> getInputAlphabet() {
        return alphabet;
    }

    public int numInputs() {
        return alphabet.size();
    }

    public IntList getStates() {
        final IntArrayList states = new IntArrayList(size);
        for (int q = 0; q < size; q++) {
            states.add(q);
        }
        return IntLists.unmodifiable(states);
    }

    public int getInitialState() {
        return initial;
    }

    public boolean isAccepting(int state) {
        checkState(state);
        return accepting.get(state);
    }

    /**
     * @return a copy of the accepting states
     */
    public BitSet getAcceptingStates() {
        return (BitSet) accepting.clone();
    }

    /**
     * Whether this automaton was declared deterministic. A declared deterministic automaton has at most one
     * destination per (state, symbol) and no epsilon transitions; it is not necessarily complete.
     */
    public boolean isDeterministic() {
        return deterministic;
    }

    /**
     * Whether every state has at least one successor for every symbol.
     */
    public boolean isComplete() {
        for (int q = 0; q < size; q++) {
            for (int[] dest : successors[q]) {
                if (dest.length == 0) {
                    return false;
                }
            }
        }
        return true;
    }

    public boolean hasEpsilonTransitions() {
        for (int[] dest : epsilonSuccessors) {
            if (dest.length > 0) {
                return true;
            }
        }
        return false;
    }

    public IntList getSuccessors(int state, int symbolIndex) {
        checkState(state);
        return IntLists.unmodifiable(IntArrayList.wrap(successors[state][symbolIndex]));
    }

    public IntList getSuccessors(int state, I symbol) {
        return getSuccessors(state, alphabet.getSymbolIndex(symbol));
    }

    /**
     * Deterministic lookup.
     * @return the single successor, or -1 if the transition is undefined
     */
    public int getSuccessor(int state, int symbolIndex) {
        checkState(state);
        final int[] dest = successors[state][symbolIndex];
        return dest.length == 0 ? -1 : dest[0];
    }

    public IntList getEpsilonSuccessors(int state) {
        checkState(state);
        return IntLists.unmodifiable(IntArrayList.wrap(epsilonSuccessors[state]));
    }

    /**
     * All outgoing transitions of a state, epsilon transitions first, then by symbol index and destination.
     */
    public List<Transition<I>> getTransitions(int state) {
        checkState(state);
        final List<Transition<I>> result = new ArrayList<>();
        for (int t : epsilonSuccessors[state]) {
            result.add(new Transition<>(state, null, t));
        }
        for (int a = 0; a < successors[state].length; a++) {
            final I symbol = alphabet.getSymbol(a);
            for (int t : successors[state][a]) {
                result.add(new Transition<>(state, symbol, t));
            }
        }
        return result;
    }

    public int transitionCount() {
        int count = 0;
        for (int q = 0; q < size; q++) {
            count += epsilonSuccessors[q].length;
            for (int[] dest : successors[q]) {
                count += dest.length;
            }
        }
        return count;
    }

    private void checkState(int state) {
        if (state < 0 || state >= size) {
            throw new IndexOutOfBoundsException("State " + state + " not in [0," + size + ")");
        }
    }

    /**
     * Structural equality: same alphabet (in the same order), same numbering, same initial and accepting states and
     * the same transitions. The deterministic declaration is not compared.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Automaton<?> other)) {
            return false;
        }
        return size == other.size
            && initial == other.initial
            && accepting.equals(other.accepting)
            && sameSymbols(alphabet, other.alphabet)
            && Arrays.deepEquals(successors, other.successors)
            && Arrays.deepEquals(epsilonSuccessors, other.epsilonSuccessors);
    }

    private static boolean sameSymbols(Alphabet<?> a, Alphabet<?> b) {
        if (a.size() != b.size()) {
            return false;
        }
        Iterator<?> it = b.iterator();
        for (Object symbol : a) {
            if (!Objects.equals(symbol, it.next())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(size, initial, accepting);
        result = 31 * result + Arrays.deepHashCode(successors);
        return 31 * result + Arrays.deepHashCode(epsilonSuccessors);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        sb.append(deterministic ? "DFA" : "NFA")
          .append(" states=").append(size)
          .append(" initial=").append(initial)
          .append(" accepting=").append(accepting)
          .append(" alphabet=").append(new ArrayList<>(alphabet));
        for (int q = 0; q < size; q++) {
            for (Transition<I> t : getTransitions(q)) {
                sb.append('\n').append(t);
            }
        }
        return sb.toString();
    }
}
