package dumb.symbolic;

public class IterationLimitException extends EvaluationException {

    private final int limit;

    public IterationLimitException(int limit, Element expr) {
        super("Iteration limit of " + limit + " exceeded; last expression " + expr);
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }
}
