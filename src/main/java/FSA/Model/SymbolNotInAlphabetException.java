package FSA.Model;

/**
 * A word handed to a simulation contains a symbol the automaton does not declare.
 */
public class SymbolNotInAlphabetException extends AutomatonException {
    private final Object symbol;
    private final int position;

    public SymbolNotInAlphabetException(Object symbol, int position) {
        super("Symbol '" + symbol + "' at position " + position + " is not in the alphabet");
        this.symbol = symbol;
        this.position = position;
    }

    public Object getSymbol() {
        return symbol;
    }

    public int getPosition() {
        return position;
    }
}
