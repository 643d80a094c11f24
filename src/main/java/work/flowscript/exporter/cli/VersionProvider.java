package work.flowscript.exporter.cli;

import picocli.CommandLine;
import work.flowscript.exporter.compiler.DefaultGenerators;

/**
 * Version from the jar manifest, plus the size of the built-in module catalog.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        var implementationVersion = Main.class.getPackage().getImplementationVersion();
        var version = implementationVersion == null ? "development" : implementationVersion;
        int modules = DefaultGenerators.create().entries().size();
        return new String[] {
            "flowscript-export " + version,
            modules + " module types, Python Playwright (async API) output"
        };
    }
}
