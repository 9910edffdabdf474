package dumb.symbolic;

public class RecursionLimitException extends EvaluationException {

    private final int limit;

    public RecursionLimitException(int limit, Element expr) {
        super("Recursion depth of " + limit + " exceeded while evaluating " + expr);
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }
}
