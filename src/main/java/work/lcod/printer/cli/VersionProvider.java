package work.lcod.printer.cli;

import picocli.CommandLine;
import work.lcod.printer.api.PrintOptions;
import work.lcod.printer.api.ValuePrinter;

/**
 * Version banner: the printer library version from the jar manifest, its default depth bound and
 * the running JVM.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String libraryVersion = ValuePrinter.class.getPackage().getImplementationVersion();
        return new String[] {
            "lcod-print " + (libraryVersion == null ? "development" : libraryVersion),
            "default max-depth " + PrintOptions.DEFAULT_MAX_DEPTH,
            "JVM " + Runtime.version()
        };
    }
}
