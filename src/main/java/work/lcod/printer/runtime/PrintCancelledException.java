package work.lcod.printer.runtime;

/**
 * Aborts a print call once cancellation was requested. Output written so far stays in the sink.
 */
public final class PrintCancelledException extends RuntimeException {
    public PrintCancelledException(String message) {
        super(message);
    }
}
