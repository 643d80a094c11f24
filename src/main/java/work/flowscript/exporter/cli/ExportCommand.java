package work.flowscript.exporter.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.flowscript.exporter.api.ExportConfiguration;
import work.flowscript.exporter.api.ExportConfigurationLoader;
import work.flowscript.exporter.api.ExportResult;
import work.flowscript.exporter.api.WorkflowExporter;
import work.flowscript.exporter.api.WorkflowSource;
import work.flowscript.exporter.compiler.DefaultGenerators;
import work.flowscript.exporter.shared.DurationParser;

@CommandLine.Command(
    name = "flowscript-export",
    description = "Compile a visual workflow into a standalone Playwright script.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class ExportCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-w", "--workflow"},
        paramLabel = "PATH|URL",
        description = "Workflow document (JSON or YAML), local path or HTTP(S) URL."
    )
    private String workflow;

    @CommandLine.Option(
        names = {"-o", "--output"},
        paramLabel = "PATH",
        description = "Script file or directory to write (default: stdout)."
    )
    private Path output;

    @CommandLine.Option(
        names = "--config",
        paramLabel = "PATH",
        description = "TOML file with an [export] table."
    )
    private Path config;

    @CommandLine.Option(
        names = "--browser",
        description = "Browser engine the script launches (chromium|firefox|webkit)."
    )
    private String browser;

    @CommandLine.Option(
        names = "--headless",
        negatable = true,
        description = "Launch the browser headless."
    )
    private Boolean headless;

    @CommandLine.Option(
        names = "--timeout",
        description = "Default element timeout (e.g. 500ms, 30s, 1m)."
    )
    private String timeoutRaw;

    @CommandLine.Option(
        names = "--no-timestamp",
        description = "Omit the generation time from the script header."
    )
    private boolean noTimestamp;

    @CommandLine.Option(
        names = "--diagnostics",
        description = "Print compilation diagnostics to stderr."
    )
    private boolean diagnostics;

    @CommandLine.Option(
        names = "--json",
        description = "Print the full result as JSON instead of the bare script."
    )
    private boolean json;

    @CommandLine.Option(
        names = "--list-modules",
        description = "List supported module types and exit."
    )
    private boolean listModules;

    @Override
    public Integer call() throws Exception {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();
        if (listModules) {
            for (var entry : new TreeMap<>(DefaultGenerators.create().entries()).values()) {
                var description = entry.description() == null ? "" : entry.description();
                out.printf("%-18s %s%n", entry.moduleType(), description);
            }
            out.flush();
            return 0;
        }
        if (workflow == null || workflow.isBlank()) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Missing required option: '--workflow=PATH|URL'");
        }

        var exporter = new WorkflowExporter(resolveConfiguration());
        ExportResult result = exporter.export(WorkflowSource.parse(workflow));
        if (result.status() == ExportResult.Status.FAILURE) {
            err.println(spec.commandLine().getColorScheme().errorText(result.error()));
            err.flush();
            return result.status().exitCode();
        }
        if (diagnostics) {
            for (var diagnostic : result.diagnostics()) {
                var where = diagnostic.nodeId() == null ? "" : " (node " + diagnostic.nodeId() + ")";
                err.println(diagnostic.severity() + " " + diagnostic.code() + ": " + diagnostic.message() + where);
            }
            err.flush();
        }
        if (output != null) {
            var target = Files.isDirectory(output) ? output.resolve(result.fileName()) : output;
            writeScript(target, result.code());
            out.println(json ? result.toPrettyJson() : "Wrote " + target);
        } else {
            out.print(json ? result.toPrettyJson() + System.lineSeparator() : result.code());
        }
        out.flush();
        return result.status().exitCode();
    }

    private ExportConfiguration resolveConfiguration() {
        var base = config == null ? ExportConfiguration.defaults() : ExportConfigurationLoader.load(config);
        var builder = base.toBuilder();
        if (browser != null) {
            builder.browser(browser);
        }
        if (headless != null) {
            builder.headless(headless);
        }
        if (timeoutRaw != null) {
            DurationParser.parse(timeoutRaw).ifPresent(builder::defaultTimeout);
        }
        if (noTimestamp) {
            builder.withoutTimestamp();
        }
        return builder.build();
    }

    private static void writeScript(Path target, String code) throws IOException {
        var parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, code, StandardCharsets.UTF_8);
    }
}
