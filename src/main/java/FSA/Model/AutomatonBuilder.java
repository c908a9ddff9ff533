package FSA.Model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import net.automatalib.alphabet.Alphabet;

/**
 * Collects states and transitions and validates them into an immutable {@link Automaton}.
 * <p>
 * Nothing is checked while adding; {@link #build()} reports the first violation it finds as a
 * {@link MalformedAutomatonException}. A builder may be built more than once.
 */
public final class AutomatonBuilder<I> {
    private static final int EPSILON = -1;

    private final Alphabet<I> alphabet;
    private final BitSet accepting = new BitSet();
    private final List<PendingTransition<I>> transitions = new ArrayList<>();
    private int size;
    private int initial = -1;
    private boolean deterministic;

    AutomatonBuilder(Alphabet<I> alphabet) {
        this.alphabet = alphabet;
    }

    public Alphabet<I> getInputAlphabet() {
        return alphabet;
    }

    public int size() {
        return size;
    }

    public int addState(boolean accept) {
        final int state = size++;
        accepting.set(state, accept);
        return state;
    }

    public int addInitialState(boolean accept) {
        final int state = addState(accept);
        initial = state;
        return state;
    }

    /**
     * Adds {@code count} non-accepting states.
     * @return the index of the first added state
     */
    public int addStates(int count) {
        final int first = size;
        size += count;
        return first;
    }

    public AutomatonBuilder<I> setInitial(int state) {
        this.initial = state;
        return this;
    }

    public AutomatonBuilder<I> setAccepting(int state, boolean accept) {
        if (state < 0) {
            throw new MalformedAutomatonException("Accepting state " + state + " is not a state");
        }
        accepting.set(state, accept);
        return this;
    }

    public AutomatonBuilder<I> addTransition(int source, I symbol, int target) {
        transitions.add(new PendingTransition<>(source, symbol, -2, target));
        return this;
    }

    public AutomatonBuilder<I> addIndexedTransition(int source, int symbolIndex, int target) {
        transitions.add(new PendingTransition<>(source, null, symbolIndex, target));
        return this;
    }

    public AutomatonBuilder<I> addEpsilonTransition(int source, int target) {
        transitions.add(new PendingTransition<>(source, null, EPSILON, target));
        return this;
    }

    /**
     * Declares the automaton deterministic, which makes {@link #build()} enforce at most one destination per
     * (state, symbol) and no epsilon transitions.
     */
    public AutomatonBuilder<I> deterministic(boolean deterministic) {
        this.deterministic = deterministic;
        return this;
    }

    public Automaton<I> build() {
        if (initial < 0 || initial >= size) {
            throw new MalformedAutomatonException("Initial state " + initial + " is outside the state set of size " + size);
        }
        if (accepting.length() > size) {
            throw new MalformedAutomatonException("Accepting state " + (accepting.length() - 1) + " is not a state");
        }

        final int numInputs = alphabet.size();
        final IntArrayList[][] succ = new IntArrayList[size][numInputs];
        final IntArrayList[] eps = new IntArrayList[size];

        for (PendingTransition<I> t : transitions) {
            checkEndpoint(t.source(), t);
            checkEndpoint(t.target(), t);
            final int symbolIndex = resolveSymbol(t);
            if (symbolIndex == EPSILON) {
                if (deterministic) {
                    throw new MalformedAutomatonException("Epsilon transition " + describe(t) + " in a deterministic automaton");
                }
                if (eps[t.source()] == null) {
                    eps[t.source()] = new IntArrayList(2);
                }
                eps[t.source()].add(t.target());
            } else {
                IntArrayList list = succ[t.source()][symbolIndex];
                if (list == null) {
                    list = new IntArrayList(2);
                    succ[t.source()][symbolIndex] = list;
                }
                list.add(t.target());
            }
        }

        final int[][][] successors = new int[size][numInputs][];
        final int[][] epsilonSuccessors = new int[size][];
        for (int q = 0; q < size; q++) {
            for (int a = 0; a < numInputs; a++) {
                successors[q][a] = sortedUnique(succ[q][a]);
                if (deterministic && successors[q][a].length > 1) {
                    throw new MalformedAutomatonException("State " + q + " has " + successors[q][a].length
                        + " transitions on '" + alphabet.getSymbol(a) + "' in a deterministic automaton");
                }
            }
            epsilonSuccessors[q] = sortedUnique(eps[q]);
        }

        return new Automaton<>(alphabet, size, initial, (BitSet) accepting.clone(),
                               successors, epsilonSuccessors, deterministic);
    }

    private void checkEndpoint(int state, PendingTransition<I> t) {
        if (state < 0 || state >= size) {
            throw new MalformedAutomatonException("Transition " + describe(t) + " references unknown state " + state);
        }
    }

    private int resolveSymbol(PendingTransition<I> t) {
        if (t.symbolIndex() == -2) {
            if (t.symbol() == null || !alphabet.contains(t.symbol())) {
                throw new MalformedAutomatonException("Transition " + describe(t) + " uses a symbol outside the alphabet");
            }
            return alphabet.getSymbolIndex(t.symbol());
        }
        if (t.symbolIndex() != EPSILON && (t.symbolIndex() < 0 || t.symbolIndex() >= alphabet.size())) {
            throw new MalformedAutomatonException("Transition " + describe(t) + " uses symbol index "
                + t.symbolIndex() + " outside the alphabet");
        }
        return t.symbolIndex();
    }

    private static String describe(PendingTransition<?> t) {
        final Object label;
        if (t.symbolIndex() == -2) {
            label = t.symbol();
        } else if (t.symbolIndex() == EPSILON) {
            label = "eps";
        } else {
            label = "#" + t.symbolIndex();
        }
        return t.source() + " -" + label + "-> " + t.target();
    }

    private static int[] sortedUnique(IntArrayList list) {
        if (list == null || list.isEmpty()) {
            return Automaton.NO_STATES;
        }
        final int[] values = list.toIntArray();
        Arrays.sort(values);
        int n = 1;
        for (int i = 1; i < values.length; i++) {
            if (values[i] != values[n - 1]) {
                values[n++] = values[i];
            }
        }
        return n == values.length ? values : Arrays.copyOf(values, n);
    }

    // symbolIndex: -2 = resolve symbol, -1 = epsilon, otherwise the index
    private record PendingTransition<I>(int source, I symbol, int symbolIndex, int target) { }
}
