package FSA.Model;

/**
 * A single outgoing transition. A {@code null} symbol stands for an epsilon transition.
 */
public record Transition<I>(int source, I symbol, int target) {

    public boolean isEpsilon() {
        return symbol == null;
    }

    @Override
    public String toString() {
        return source + " -" + (symbol == null ? "eps" : symbol) + "-> " + target;
    }
}
