package dumb.symbolic;

import dumb.symbolic.Element.Symbol;

/** A definition or attribute change was attempted on a {@code Protected} or {@code Locked} symbol. */
public class ProtectedException extends EvaluationException {

    private final Symbol symbol;

    public ProtectedException(Symbol symbol, String message) {
        super(message);
        this.symbol = symbol;
    }

    public Symbol symbol() {
        return symbol;
    }
}
