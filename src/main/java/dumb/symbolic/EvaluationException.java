package dumb.symbolic;

/** Evaluation could not complete. Fatal to the top-level call that raised it. */
public class EvaluationException extends RuntimeException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
