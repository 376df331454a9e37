package work.lcod.printer.runtime;

/**
 * A value reached a renderer that does not know its variant. This is a programming error and is
 * never rendered as output.
 */
public final class PrinterFaultException extends IllegalStateException {
    public PrinterFaultException(String message) {
        super(message);
    }
}
