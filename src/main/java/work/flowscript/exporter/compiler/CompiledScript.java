package work.flowscript.exporter.compiler;

import java.util.List;
import java.util.Objects;

/**
 * Output of one compilation: the script text, its suggested filename and what was degraded.
 */
public record CompiledScript(String code, String fileName, List<ExportDiagnostic> diagnostics) {
    public CompiledScript {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(fileName, "fileName");
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public boolean hasWarnings() {
        return diagnostics.stream().anyMatch(d -> d.severity() == ExportDiagnostic.Severity.WARN);
    }
}
