package FSA.Model;

/**
 * Base class of the errors the automaton algorithms report for input they cannot process.
 * These are deterministic input errors; callers are expected to fix the input, not retry.
 */
public class AutomatonException extends RuntimeException {
    public AutomatonException(String message) {
        super(message);
    }
}
