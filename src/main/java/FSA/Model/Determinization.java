package FSA.Model;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashSet;
import java.util.List;
import java.util.StringJoiner;

/**
 * Result of a subset construction: the DFA and, for every DFA state, the set of input states it stands for.
 */
public record Determinization<I>(Automaton<I> automaton, List<BitSet> subsets) {
    public static final String SINK_LABEL = "!";

    /**
     * Name every DFA state after its subset, e.g. {@code {q0,q1}}; the empty subset is {@value #SINK_LABEL}.
     * If two labels collide (input names containing commas or braces), input state indices are used instead.
     * @param inputNames - names of the input automaton's states, by index
     */
    public List<String> labels(List<String> inputNames) {
        final List<String> labels = label(inputNames);
        if (new HashSet<>(labels).size() == labels.size()) {
            return labels;
        }
        return label(null);
    }

    private List<String> label(List<String> inputNames) {
        final List<String> labels = new ArrayList<>(subsets.size());
        for (BitSet subset : subsets) {
            if (subset.isEmpty()) {
                labels.add(SINK_LABEL);
                continue;
            }
            final StringJoiner joiner = new StringJoiner(",", "{", "}");
            for (int q = subset.nextSetBit(0); q >= 0; q = subset.nextSetBit(q + 1)) {
                joiner.add(inputNames == null ? String.valueOf(q) : inputNames.get(q));
            }
            labels.add(joiner.toString());
        }
        return labels;
    }
}
