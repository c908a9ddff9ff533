package FSA.Model;

import java.util.Collection;

/**
 * Two automata were combined or compared although their alphabets differ.
 */
public class AlphabetMismatchException extends AutomatonException {
    public AlphabetMismatchException(Collection<?> left, Collection<?> right) {
        super("Alphabets differ: " + left + " vs. " + right);
    }
}
