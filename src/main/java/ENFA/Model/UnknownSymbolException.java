package ENFA.Model;

/**
 * Thrown when a symbol is not part of a graph's alphabet.
 */
public class UnknownSymbolException extends IllegalArgumentException {
    private final Object symbol;

    public UnknownSymbolException(Object symbol) {
        super("Unknown symbol: " + symbol);
        this.symbol = symbol;
    }

    public Object getSymbol() {
        return symbol;
    }
}
