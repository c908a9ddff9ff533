package FSA.Model;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.DFA;
import net.automatalib.automaton.fsa.NFA;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * Conversions between {@link Automaton} and AutomataLib's compact automata. Used by the BA format bridge and by
 * tests that check results against AutomataLib's own algorithms.
 */
public final class AutomataLibAdapter {

    private AutomataLibAdapter() {}

    public static <I> CompactNFA<I> toCompactNFA(Automaton<I> automaton) {
        if (automaton.hasEpsilonTransitions()) {
            throw new IllegalArgumentException("AutomataLib NFAs have no epsilon transitions; determinize first");
        }
        final Alphabet<I> alphabet = automaton.getInputAlphabet();
        final CompactNFA<I> nfa = new CompactNFA<>(alphabet, automaton.size());
        for (int q = 0; q < automaton.size(); q++) {
            nfa.addState(automaton.isAccepting(q));
        }
        nfa.setInitial(automaton.getInitialState(), true);
        for (int q = 0; q < automaton.size(); q++) {
            for (int a = 0; a < alphabet.size(); a++) {
                final I symbol = alphabet.getSymbol(a);
                for (int t : automaton.getSuccessors(q, a)) {
                    nfa.addTransition(q, symbol, t);
                }
            }
        }
        return nfa;
    }

    public static <I> CompactDFA<I> toCompactDFA(Automaton<I> automaton) {
        if (!automaton.isDeterministic()) {
            throw new IllegalArgumentException("Automaton is not declared deterministic");
        }
        final Alphabet<I> alphabet = automaton.getInputAlphabet();
        final CompactDFA<I> dfa = new CompactDFA<>(alphabet, automaton.size());
        for (int q = 0; q < automaton.size(); q++) {
            if (q == automaton.getInitialState()) {
                dfa.addInitialState(automaton.isAccepting(q));
            } else {
                dfa.addState(automaton.isAccepting(q));
            }
        }
        for (int q = 0; q < automaton.size(); q++) {
            for (int a = 0; a < alphabet.size(); a++) {
                final int succ = automaton.getSuccessor(q, a);
                if (succ >= 0) {
                    dfa.setTransition(q, alphabet.getSymbol(a), Integer.valueOf(succ));
                }
            }
        }
        return dfa;
    }

    /**
     * Converts an AutomataLib NFA. Several initial states are folded into a fresh initial state with epsilon
     * transitions to each of them; no initial state yields a single non-accepting state without transitions.
     */
    public static <S, I> Automaton<I> fromNFA(NFA<S, I> nfa, Alphabet<I> inputs) {
        final Alphabet<I> alphabet = fixed(inputs);
        final AutomatonBuilder<I> builder = Automaton.builder(alphabet);
        final Map<S, Integer> mapping = new HashMap<>();
        for (S s : nfa.getStates()) {
            mapping.put(s, builder.addState(nfa.isAccepting(s)));
        }

        final Set<S> inits = nfa.getInitialStates();
        if (inits.size() == 1) {
            builder.setInitial(mapping.get(inits.iterator().next()));
        } else {
            final int fresh = builder.addInitialState(false);
            for (S s : inits) {
                builder.addEpsilonTransition(fresh, mapping.get(s));
            }
        }

        for (S s : nfa.getStates()) {
            for (I i : alphabet) {
                for (S t : nfa.getTransitions(s, i)) {
                    builder.addTransition(mapping.get(s), i, mapping.get(t));
                }
            }
        }
        return builder.build();
    }

    public static <S, I> Automaton<I> fromDFA(DFA<S, I> dfa, Alphabet<I> inputs) {
        final Alphabet<I> alphabet = fixed(inputs);
        final S init = dfa.getInitialState();
        if (init == null) {
            throw new IllegalArgumentException("DFA has no initial state");
        }
        final AutomatonBuilder<I> builder = Automaton.<I>builder(alphabet).deterministic(true);
        final Map<S, Integer> mapping = new HashMap<>();
        for (S s : dfa.getStates()) {
            mapping.put(s, builder.addState(dfa.isAccepting(s)));
        }
        builder.setInitial(mapping.get(init));
        for (S s : dfa.getStates()) {
            for (I i : alphabet) {
                final S t = dfa.getSuccessor(s, i);
                if (t != null) {
                    builder.addTransition(mapping.get(s), i, mapping.get(t));
                }
            }
        }
        return builder.build();
    }

    /**
     * Snapshot of the symbols; AutomataLib alphabets may be growing ones, while an {@link Automaton} sizes its
     * transition table once.
     */
    private static <I> Alphabet<I> fixed(Alphabet<I> alphabet) {
        return Alphabets.fromCollection(new ArrayList<>(alphabet));
    }
}
