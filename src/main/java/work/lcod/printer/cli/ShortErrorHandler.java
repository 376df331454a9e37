package work.lcod.printer.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.UncheckedIOException;
import picocli.CommandLine;
import work.lcod.printer.runtime.PrintCancelledException;

/**
 * Reports a failed print in one line: unreadable documents, broken output streams and
 * cancellation each get their own wording.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    /** Conventional status of a process stopped by an interrupt. */
    static final int EXIT_CANCELLED = 130;

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        commandLine.getErr().println(commandLine.getColorScheme().errorText(describe(ex)));
        if (Boolean.getBoolean("lcod.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        if (ex instanceof PrintCancelledException) {
            return EXIT_CANCELLED;
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static String describe(Exception ex) {
        if (ex instanceof PrintCancelledException) {
            return "Cancelled; output is incomplete";
        }
        if (ex instanceof JsonProcessingException json) {
            var location = json.getLocation();
            String where = location == null ? "" : " (line " + location.getLineNr() + ", column " + location.getColumnNr() + ")";
            return "Invalid document: " + json.getOriginalMessage() + where;
        }
        if (ex instanceof UncheckedIOException io) {
            return "Cannot write output: " + messageOf(io.getCause());
        }
        return messageOf(ex);
    }

    private static String messageOf(Throwable ex) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            return ex.getClass().getSimpleName();
        }
        return message;
    }
}
