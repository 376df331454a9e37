package work.lcod.printer.runtime;

/**
 * Cooperative cancellation flag, safe to set from another thread.
 */
public final class CancellationToken {
    private volatile boolean cancelled = false;

    public void cancel() {
        this.cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void ensureNotCancelled() {
        if (cancelled) {
            throw new PrintCancelledException("Printing cancelled");
        }
    }
}
