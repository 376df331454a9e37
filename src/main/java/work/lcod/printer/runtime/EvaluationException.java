package work.lcod.printer.runtime;

/**
 * Raised by the evaluator when forcing a value (or resolving a derivation's store path) fails.
 * The printer renders it inline and keeps going.
 */
public class EvaluationException extends RuntimeException {
    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Text shown between the error marker's guillemets.
     */
    public String displayMessage() {
        String message = getMessage();
        if (message == null || message.isBlank()) {
            return getClass().getSimpleName();
        }
        return message;
    }
}
