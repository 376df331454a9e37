package work.lcod.printer.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.printer.api.LogLevel;
import work.lcod.printer.api.PrintOptions;
import work.lcod.printer.api.PrintOptionsLoader;
import work.lcod.printer.api.ValuePrinter;
import work.lcod.printer.document.DocumentFormat;
import work.lcod.printer.document.DocumentValues;
import work.lcod.printer.runtime.DefaultEvaluator;
import work.lcod.printer.value.SymbolTable;
import work.lcod.printer.value.Value;

@CommandLine.Command(
    name = "lcod-print",
    description = "Render a JSON, YAML or TOML document the way the evaluator displays values.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class PrintCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(
        index = "0",
        arity = "0..1",
        paramLabel = "FILE|-",
        description = "Document to print; '-' or no argument reads stdin."
    )
    private String source;

    @CommandLine.Option(
        names = {"-f", "--format"},
        description = "Document format (json|yaml|toml); detected from the file extension when omitted.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String formatRaw;

    @CommandLine.Option(
        names = "--config",
        paramLabel = "TOML",
        description = "TOML file with a [print] table of options.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String config;

    @CommandLine.Option(names = "--max-depth", description = "Nesting depth to expand (count or 'unbounded').",
        defaultValue = CommandLine.Option.NULL_VALUE)
    private String maxDepth;

    @CommandLine.Option(names = "--max-attrs", description = "Attributes to print in total (count or 'unbounded').",
        defaultValue = CommandLine.Option.NULL_VALUE)
    private String maxAttrs;

    @CommandLine.Option(names = "--max-list-items", description = "List items to print in total (count or 'unbounded').",
        defaultValue = CommandLine.Option.NULL_VALUE)
    private String maxListItems;

    @CommandLine.Option(names = "--max-string-length", description = "Characters to print per string (count or 'unbounded').",
        defaultValue = CommandLine.Option.NULL_VALUE)
    private String maxStringLength;

    @CommandLine.Option(names = "--color", description = "Colorize output with ANSI escapes.")
    private boolean color;

    @CommandLine.Option(names = "--no-track-repeated", description = "Do not detect shared or cyclic containers.")
    private boolean noTrackRepeated;

    @CommandLine.Option(
        names = "--log-level",
        description = "Diagnostic threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @Override
    public Integer call() throws Exception {
        LogLevel logLevel = LogLevel.from(logLevelRaw);
        PrintOptions options = resolveOptions(logLevel);
        DocumentFormat format = resolveFormat();

        var symbols = new SymbolTable();
        Value value = new DocumentValues(symbols).parse(readSource(), format);
        log(logLevel, LogLevel.DEBUG, "Parsed %s document from %s", format.name().toLowerCase(Locale.ROOT), describeSource());

        PrintWriter out = spec.commandLine().getOut();
        new ValuePrinter(new DefaultEvaluator(symbols)).print(value, options, out);
        out.println();
        out.flush();
        return 0;
    }

    private PrintOptions resolveOptions(LogLevel logLevel) throws IOException {
        PrintOptions base = PrintOptions.defaults();
        if (config != null) {
            Path configPath = Paths.get(config).toAbsolutePath().normalize();
            try {
                base = PrintOptionsLoader.load(configPath, base);
            } catch (IllegalArgumentException ex) {
                throw new CommandLine.ParameterException(spec.commandLine(), configPath + ": " + ex.getMessage());
            } catch (NoSuchFileException ex) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Print options file not found: " + configPath);
            }
            log(logLevel, LogLevel.INFO, "Loaded print options from %s", configPath);
        }
        var builder = base.toBuilder();
        try {
            if (maxDepth != null) {
                builder.maxDepth(PrintOptionsLoader.parseCount("--max-depth", maxDepth));
            }
            if (maxAttrs != null) {
                builder.maxAttrs(PrintOptionsLoader.parseCount("--max-attrs", maxAttrs));
            }
            if (maxListItems != null) {
                builder.maxListItems(PrintOptionsLoader.parseCount("--max-list-items", maxListItems));
            }
            if (maxStringLength != null) {
                builder.maxStringLength(PrintOptionsLoader.parseCount("--max-string-length", maxStringLength));
            }
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
        if (color) {
            builder.ansiColors(true);
        }
        if (noTrackRepeated) {
            builder.trackRepeated(false);
        }
        PrintOptions options = builder.build();
        log(logLevel, LogLevel.TRACE, "Effective print options: %s", options);
        return options;
    }

    private DocumentFormat resolveFormat() {
        if (formatRaw == null) {
            return readsStdin() ? DocumentFormat.JSON : DocumentFormat.detect(Paths.get(source));
        }
        try {
            return DocumentFormat.from(formatRaw);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }

    private String readSource() {
        if (readsStdin()) {
            return readStdin();
        }
        Path path = Paths.get(source).toAbsolutePath().normalize();
        if (!Files.isRegularFile(path)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Document not found: " + path);
        }
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CommandLine.ExecutionException(spec.commandLine(), "Cannot read document: " + path, ex);
        }
    }

    private boolean readsStdin() {
        return source == null || "-".equals(source);
    }

    private String describeSource() {
        return readsStdin() ? "stdin" : source;
    }

    private String readStdin() {
        try {
            InputStream stdin = System.in;
            return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CommandLine.ExecutionException(spec.commandLine(), "Unable to read stdin: " + ex.getMessage(), ex);
        }
    }

    private void log(LogLevel threshold, LogLevel level, String format, Object... args) {
        if (threshold.enables(level)) {
            spec.commandLine().getErr().printf(format + "%n", args);
        }
    }
}
