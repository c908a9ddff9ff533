package FSA;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;

import FSA.Model.Automaton;
import FSA.Model.AutomatonBuilder;
import FSA.Model.Determinization;
import FSA.Model.DeterminizeRecord;
import FSA.Model.EmptyAlphabetException;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Subset construction. DFA states are numbered in breadth-first discovery order, symbols in alphabet order, so the
 * output only depends on the input.
 */
public class PowersetDeterminizer {
    public static boolean DEBUG = false;
    private static final int MISSING_ELEMENT = -1;

    public static <I> Automaton<I> determinize(Automaton<I> nfa) {
        return determinize(nfa, true);
    }

    /**
     * @param nfa - input automaton, possibly with epsilon transitions
     * @param complete - if true, the empty state set becomes an explicit non-accepting sink; otherwise transitions
     *                 to it are omitted
     * @return deterministic automaton recognizing the same language
     */
    public static <I> Automaton<I> determinize(Automaton<I> nfa, boolean complete) {
        final BitSet init = new BitSet();
        init.set(nfa.getInitialState());
        return determinize(nfa, init, complete);
    }

    /**
     * Subset construction starting from an arbitrary set of states instead of the initial state.
     * @param nfa - input automaton
     * @param initialStates - states of {@code nfa} forming the initial DFA state before epsilon closure; not modified
     * @param complete - whether the empty set becomes an explicit sink
     */
    public static <I> Automaton<I> determinize(Automaton<I> nfa, BitSet initialStates, boolean complete) {
        return construct(nfa, initialStates, complete, null);
    }

    /**
     * Subset construction that also keeps, for every DFA state, the set of NFA states it stands for.
     */
    public static <I> Determinization<I> determinizeWithSubsets(Automaton<I> nfa, boolean complete) {
        final BitSet init = new BitSet();
        init.set(nfa.getInitialState());
        final List<BitSet> subsets = new ArrayList<>();
        final Automaton<I> dfa = construct(nfa, init, complete, subsets);
        return new Determinization<>(dfa, subsets);
    }

    // subsets, if not null, receives the state set of every output state in output order
    private static <I> Automaton<I> construct(Automaton<I> nfa, BitSet initialStates, boolean complete,
                                              List<BitSet> subsets) {
        final int numInputs = nfa.numInputs();
        if (numInputs == 0 && nfa.transitionCount() > 0) {
            throw new EmptyAlphabetException("Automaton with " + nfa.transitionCount()
                + " transitions declares no symbols");
        }
        final BitSet accepting = nfa.getAcceptingStates();

        final AutomatonBuilder<I> out = Automaton.<I>builder(nfa.getInputAlphabet()).deterministic(true);
        final Object2IntMap<BitSet> outStateMap = new Object2IntOpenHashMap<>();
        outStateMap.defaultReturnValue(MISSING_ELEMENT);
        final Deque<DeterminizeRecord> queue = new ArrayDeque<>();

        final BitSet init = epsilonClosure(nfa, (BitSet) initialStates.clone());
        final int initOut = out.addInitialState(init.intersects(accepting));
        outStateMap.put(init, initOut);
        if (subsets != null) {
            subsets.add(init);
        }
        queue.add(new DeterminizeRecord(init, initOut));

        while (!queue.isEmpty()) {
            final DeterminizeRecord curr = queue.poll();
            final BitSet inState = curr.inputState();
            final int outState = curr.outputState();

            for (int a = 0; a < numInputs; a++) {
                final BitSet succ = successor(nfa, inState, a);
                if (succ.isEmpty() && !complete) {
                    continue;
                }
                int outSucc = outStateMap.getInt(succ);
                if (outSucc == MISSING_ELEMENT) {
                    // add new state to DFA and to queue
                    outSucc = out.addState(succ.intersects(accepting));
                    outStateMap.put(succ, outSucc);
                    if (subsets != null) {
                        subsets.add(succ);
                    }
                    queue.add(new DeterminizeRecord(succ, outSucc));
                }
                out.addIndexedTransition(outState, a, outSucc);
            }
        }

        if (DEBUG) {
            System.out.println("DEBUG: Subset construction: " + nfa.size() + " -> " + out.size() + " states");
        }
        return out.build();
    }

    /**
     * Epsilon-closed union of the successors of every state in {@code states}.
     */
    static <I> BitSet successor(Automaton<I> nfa, BitSet states, int symbolIndex) {
        final BitSet result = new BitSet();
        for (int q = states.nextSetBit(0); q >= 0; q = states.nextSetBit(q + 1)) {
            for (int t : nfa.getSuccessors(q, symbolIndex)) {
                result.set(t);
            }
        }
        return epsilonClosure(nfa, result);
    }

    /**
     * Close {@code states} under epsilon transitions, in place.
     * @return the argument, for chaining
     */
    public static <I> BitSet epsilonClosure(Automaton<I> nfa, BitSet states) {
        final Deque<Integer> stack = new ArrayDeque<>();
        for (int q = states.nextSetBit(0); q >= 0; q = states.nextSetBit(q + 1)) {
            stack.push(q);
        }
        while (!stack.isEmpty()) {
            int q = stack.pop();
            for (int t : nfa.getEpsilonSuccessors(q)) {
                if (!states.get(t)) {
                    states.set(t);
                    stack.push(t);
                }
            }
        }
        return states;
    }

    /**
     * Make a deterministic automaton total by routing every undefined transition to a new non-accepting sink.
     * @return the input itself if it is already complete
     */
    public static <I> Automaton<I> complete(Automaton<I> dfa) {
        if (!dfa.isDeterministic()) {
            throw new IllegalArgumentException("Only deterministic automata can be completed");
        }
        if (dfa.isComplete()) {
            return dfa;
        }
        final AutomatonBuilder<I> out = Automaton.<I>builder(dfa.getInputAlphabet()).deterministic(true);
        out.addStates(dfa.size());
        out.setInitial(dfa.getInitialState());
        final int sink = out.addState(false);
        for (int q = 0; q < dfa.size(); q++) {
            out.setAccepting(q, dfa.isAccepting(q));
            for (int a = 0; a < dfa.numInputs(); a++) {
                final int succ = dfa.getSuccessor(q, a);
                out.addIndexedTransition(q, a, succ < 0 ? sink : succ);
            }
        }
        for (int a = 0; a < dfa.numInputs(); a++) {
            out.addIndexedTransition(sink, a, sink);
        }
        return out.build();
    }
}
