package FSA.Model;

/**
 * Structural invariant violation found while building an {@link Automaton}.
 */
public class MalformedAutomatonException extends AutomatonException {
    public MalformedAutomatonException(String message) {
        super(message);
    }
}
