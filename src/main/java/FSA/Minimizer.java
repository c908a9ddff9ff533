package FSA;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Deque;

import FSA.Model.Automaton;
import FSA.Model.AutomatonBuilder;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * DFA minimization.
 * <p>
 * Incomplete automata are completed with an explicit sink before minimizing, so the result is always the minimal
 * complete DFA. Output states are numbered in breadth-first discovery order from the initial state, symbols taken in
 * alphabet order; the result therefore only depends on the language and the alphabet order.
 */
public class Minimizer {
    private static final int MISSING_ELEMENT = -1;

    /**
     * Moore-style partition refinement.
     * @param automaton - any automaton; non-deterministic input is determinized first
     * @return minimal complete DFA
     */
    public static <I> Automaton<I> minimize(Automaton<I> automaton) {
        Automaton<I> dfa = automaton;
        if (!dfa.isDeterministic()) {
            dfa = PowersetDeterminizer.determinize(dfa, true);
        } else {
            final BitSet reachable = NFATrim.reachableStates(dfa);
            if (reachable.cardinality() < dfa.size()) {
                dfa = NFATrim.restrict(dfa, reachable);
            }
            dfa = PowersetDeterminizer.complete(dfa);
        }

        final int[] blockOf = refine(dfa);
        final Automaton<I> result = extract(dfa, blockOf);
        if (PowersetDeterminizer.DEBUG) {
            System.out.println("DEBUG: Partition refinement: " + dfa.size() + " -> " + result.size() + " states");
        }
        return result;
    }

    /**
     * Brzozowski's double-reversal algorithm. Produces the same automaton as {@link #minimize(Automaton)}.
     */
    public static <I> Automaton<I> brzozowski(Automaton<I> automaton) {
        final Automaton<I> step1 = determinizeReverse(automaton);
        return determinizeReverse(step1);
    }

    /**
     * Subset construction on the reversal, starting from the formerly accepting states. Starting there instead of
     * at the fresh initial state of {@link NFATrim#reverse(Automaton)} keeps that state out of every subset.
     */
    private static <I> Automaton<I> determinizeReverse(Automaton<I> automaton) {
        final Automaton<I> reversed = NFATrim.reverse(automaton);
        return PowersetDeterminizer.determinize(reversed, automaton.getAcceptingStates(), true);
    }

    /**
     * Compute the coarsest stable partition of a complete DFA.
     * @return block index for every state
     */
    static <I> int[] refine(Automaton<I> dfa) {
        final int numStates = dfa.size();
        final int numInputs = dfa.numInputs();

        // initial partition: block ids by first appearance, accepting vs. rejecting
        int[] blockOf = new int[numStates];
        int numBlocks = 0;
        int acceptBlock = MISSING_ELEMENT;
        int rejectBlock = MISSING_ELEMENT;
        for (int q = 0; q < numStates; q++) {
            if (dfa.isAccepting(q)) {
                if (acceptBlock == MISSING_ELEMENT) {
                    acceptBlock = numBlocks++;
                }
                blockOf[q] = acceptBlock;
            } else {
                if (rejectBlock == MISSING_ELEMENT) {
                    rejectBlock = numBlocks++;
                }
                blockOf[q] = rejectBlock;
            }
        }

        int rounds = 0;
        while (true) {
            // signature: own block followed by the successor block per symbol
            final Object2IntMap<IntArrayList> signatures = new Object2IntOpenHashMap<>(numBlocks * 2);
            signatures.defaultReturnValue(MISSING_ELEMENT);
            final int[] next = new int[numStates];
            int count = 0;
            for (int q = 0; q < numStates; q++) {
                final IntArrayList signature = new IntArrayList(numInputs + 1);
                signature.add(blockOf[q]);
                for (int a = 0; a < numInputs; a++) {
                    signature.add(blockOf[successor(dfa, q, a)]);
                }
                int block = signatures.getInt(signature);
                if (block == MISSING_ELEMENT) {
                    block = count++;
                    signatures.put(signature, block);
                }
                next[q] = block;
            }
            rounds++;
            // the new partition refines the old one, so an unchanged count means no split happened
            if (count == numBlocks) {
                break;
            }
            blockOf = next;
            numBlocks = count;
        }

        if (PowersetDeterminizer.DEBUG) {
            System.out.println("DEBUG: Refinement stable after " + rounds + " rounds, " + numBlocks + " blocks");
        }
        return blockOf;
    }

    private static <I> int successor(Automaton<I> dfa, int state, int symbolIndex) {
        final int succ = dfa.getSuccessor(state, symbolIndex);
        if (succ < 0) {
            throw new IllegalStateException("Partition refinement requires a complete DFA; state " + state
                + " has no successor on symbol #" + symbolIndex);
        }
        return succ;
    }

    /**
     * Build the quotient automaton, numbering blocks in breadth-first order from the initial block.
     */
    static <I> Automaton<I> extract(Automaton<I> dfa, int[] blockOf) {
        final int numInputs = dfa.numInputs();
        final int numBlocks = Arrays.stream(blockOf).max().orElse(-1) + 1;

        // lowest state of each block is its representative
        final int[] representative = new int[numBlocks];
        Arrays.fill(representative, MISSING_ELEMENT);
        for (int q = 0; q < dfa.size(); q++) {
            if (representative[blockOf[q]] == MISSING_ELEMENT) {
                representative[blockOf[q]] = q;
            }
        }
        checkStable(dfa, blockOf, representative);

        final AutomatonBuilder<I> out = Automaton.<I>builder(dfa.getInputAlphabet()).deterministic(true);
        final int[] outState = new int[numBlocks];
        Arrays.fill(outState, MISSING_ELEMENT);
        final Deque<Integer> queue = new ArrayDeque<>();

        final int initBlock = blockOf[dfa.getInitialState()];
        outState[initBlock] = out.addInitialState(dfa.isAccepting(representative[initBlock]));
        queue.add(initBlock);

        while (!queue.isEmpty()) {
            final int block = queue.poll();
            final int rep = representative[block];
            for (int a = 0; a < numInputs; a++) {
                final int succBlock = blockOf[successor(dfa, rep, a)];
                if (outState[succBlock] == MISSING_ELEMENT) {
                    outState[succBlock] = out.addState(dfa.isAccepting(representative[succBlock]));
                    queue.add(succBlock);
                }
                out.addIndexedTransition(outState[block], a, outState[succBlock]);
            }
        }
        return out.build();
    }

    /**
     * At the fixed point all members of a block agree with the representative on acceptance and on the destination
     * block of every symbol.
     */
    private static <I> void checkStable(Automaton<I> dfa, int[] blockOf, int[] representative) {
        for (int q = 0; q < dfa.size(); q++) {
            final int rep = representative[blockOf[q]];
            if (dfa.isAccepting(q) != dfa.isAccepting(rep)) {
                throw new IllegalStateException("Block " + blockOf[q] + " mixes accepting and rejecting states");
            }
            for (int a = 0; a < dfa.numInputs(); a++) {
                if (blockOf[successor(dfa, q, a)] != blockOf[successor(dfa, rep, a)]) {
                    throw new IllegalStateException("States " + q + " and " + rep + " share block " + blockOf[q]
                        + " but disagree on symbol #" + a);
                }
            }
        }
    }
}
