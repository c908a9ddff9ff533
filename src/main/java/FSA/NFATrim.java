package FSA;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;

import FSA.Model.Automaton;
import FSA.Model.AutomatonBuilder;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import net.automatalib.alphabet.Alphabet;

public class NFATrim {

    /**
     * Remove unreachable and dead states.
     * @param automaton - input automaton, not modified
     * @return automaton restricted to states that are both reachable and live, or the canonical empty-language
     * automaton if the initial state is not live
     */
    public static <I> Automaton<I> trim(Automaton<I> automaton) {
        final BitSet states = reachableStates(automaton);
        states.and(liveStates(automaton));

        if (!states.get(automaton.getInitialState())) {
            return emptyLanguage(automaton.getInputAlphabet());
        }
        if (states.cardinality() == automaton.size()) {
            return automaton; // already trim, and instances are immutable
        }
        return restrict(automaton, states);
    }

    /**
     * Forward search from the initial state, following symbol and epsilon transitions.
     */
    public static <I> BitSet reachableStates(Automaton<I> automaton) {
        final BitSet visited = new BitSet(automaton.size());
        final Deque<Integer> stack = new ArrayDeque<>();
        visited.set(automaton.getInitialState());
        stack.push(automaton.getInitialState());

        final int numInputs = automaton.numInputs();
        while (!stack.isEmpty()) {
            int q = stack.pop();
            for (int t : automaton.getEpsilonSuccessors(q)) {
                if (!visited.get(t)) {
                    visited.set(t);
                    stack.push(t);
                }
            }
            for (int a = 0; a < numInputs; a++) {
                for (int t : automaton.getSuccessors(q, a)) {
                    if (!visited.get(t)) {
                        visited.set(t);
                        stack.push(t);
                    }
                }
            }
        }
        return visited;
    }

    /**
     * Backward search from every accepting state.
     */
    public static <I> BitSet liveStates(Automaton<I> automaton) {
        final IntArrayList[] predecessors = predecessors(automaton);
        final BitSet visited = automaton.getAcceptingStates();
        final Deque<Integer> stack = new ArrayDeque<>();
        for (int q = visited.nextSetBit(0); q >= 0; q = visited.nextSetBit(q + 1)) {
            stack.push(q);
        }

        while (!stack.isEmpty()) {
            int q = stack.pop();
            if (predecessors[q] == null) {
                continue;
            }
            for (int p : predecessors[q]) {
                if (!visited.get(p)) {
                    visited.set(p);
                    stack.push(p);
                }
            }
        }
        return visited;
    }

    private static <I> IntArrayList[] predecessors(Automaton<I> automaton) {
        final IntArrayList[] predecessors = new IntArrayList[automaton.size()];
        for (int q = 0; q < automaton.size(); q++) {
            for (int t : automaton.getEpsilonSuccessors(q)) {
                addPredecessor(predecessors, t, q);
            }
            for (int a = 0; a < automaton.numInputs(); a++) {
                for (int t : automaton.getSuccessors(q, a)) {
                    addPredecessor(predecessors, t, q);
                }
            }
        }
        return predecessors;
    }

    private static void addPredecessor(IntArrayList[] predecessors, int state, int pred) {
        if (predecessors[state] == null) {
            predecessors[state] = new IntArrayList(2);
        }
        predecessors[state].add(pred);
    }

    /**
     * Keep only the given states, renumbered in ascending order. Transitions touching a removed state are dropped.
     * @param automaton - input automaton
     * @param states - states to keep; must contain the initial state
     */
    public static <I> Automaton<I> restrict(Automaton<I> automaton, BitSet states) {
        if (!states.get(automaton.getInitialState())) {
            throw new IllegalArgumentException("Restriction must keep the initial state " + automaton.getInitialState());
        }
        final AutomatonBuilder<I> out = Automaton.<I>builder(automaton.getInputAlphabet())
                .deterministic(automaton.isDeterministic());
        final int[] mapping = new int[automaton.size()];
        for (int q = states.nextSetBit(0); q >= 0 && q < automaton.size(); q = states.nextSetBit(q + 1)) {
            mapping[q] = out.addState(automaton.isAccepting(q));
        }
        out.setInitial(mapping[automaton.getInitialState()]);

        for (int q = states.nextSetBit(0); q >= 0 && q < automaton.size(); q = states.nextSetBit(q + 1)) {
            for (int t : automaton.getEpsilonSuccessors(q)) {
                if (states.get(t)) {
                    out.addEpsilonTransition(mapping[q], mapping[t]);
                }
            }
            for (int a = 0; a < automaton.numInputs(); a++) {
                for (int t : automaton.getSuccessors(q, a)) {
                    if (states.get(t)) {
                        out.addIndexedTransition(mapping[q], a, mapping[t]);
                    }
                }
            }
        }
        return out.build();
    }

    /**
     * The canonical automaton of the empty language: a single non-accepting state looping on every symbol.
     */
    public static <I> Automaton<I> emptyLanguage(Alphabet<I> alphabet) {
        final AutomatonBuilder<I> out = Automaton.<I>builder(alphabet).deterministic(true);
        final int sink = out.addInitialState(false);
        for (int a = 0; a < alphabet.size(); a++) {
            out.addIndexedTransition(sink, a, sink);
        }
        return out.build();
    }

    /**
     * Reverse all transitions. The result gets a fresh initial state (the last one) with epsilon transitions to the
     * formerly accepting states; the former initial state is the only accepting state.
     */
    public static <I> Automaton<I> reverse(Automaton<I> automaton) {
        final AutomatonBuilder<I> out = Automaton.builder(automaton.getInputAlphabet());
        out.addStates(automaton.size());
        out.setAccepting(automaton.getInitialState(), true);

        // reverse transitions
        for (int q = 0; q < automaton.size(); q++) {
            for (int t : automaton.getEpsilonSuccessors(q)) {
                out.addEpsilonTransition(t, q);
            }
            for (int a = 0; a < automaton.numInputs(); a++) {
                for (int t : automaton.getSuccessors(q, a)) {
                    out.addIndexedTransition(t, a, q);
                }
            }
        }

        // Accepting are initial states and vice versa
        final int init = out.addInitialState(false);
        final BitSet accepting = automaton.getAcceptingStates();
        for (int q = accepting.nextSetBit(0); q >= 0; q = accepting.nextSetBit(q + 1)) {
            out.addEpsilonTransition(init, q);
        }
        return out.build();
    }
}
