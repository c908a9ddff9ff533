package FSA.Model;

public class EmptyAlphabetException extends AutomatonException {
    public EmptyAlphabetException(String message) {
        super(message);
    }
}
