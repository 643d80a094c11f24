package work.flowscript.exporter.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.flowscript.exporter.compiler.CompiledScript;
import work.flowscript.exporter.compiler.ExportDiagnostic;

/**
 * Outcome of a {@link WorkflowExporter} call (usable by the CLI and embedding apps).
 */
public record ExportResult(
    Status status,
    String source,
    Optional<CompiledScript> script,
    String error,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public static ExportResult success(String source, CompiledScript script, Instant startedAt) {
        return new ExportResult(Status.SUCCESS, source, Optional.of(script), null, startedAt, Instant.now());
    }

    public static ExportResult failure(String source, String message, Instant startedAt) {
        return new ExportResult(Status.FAILURE, source, Optional.empty(), message, startedAt, Instant.now());
    }

    public String code() {
        return script.map(CompiledScript::code).orElse("");
    }

    public String fileName() {
        return script.map(CompiledScript::fileName).orElse("");
    }

    public List<ExportDiagnostic> diagnostics() {
        return script.map(CompiledScript::diagnostics).orElse(List.of());
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase());
        serializable.put("source", source);
        script.ifPresent(compiled -> {
            serializable.put("fileName", compiled.fileName());
            serializable.put("code", compiled.code());
            var diagnostics = new ArrayList<Map<String, Object>>();
            for (var diagnostic : compiled.diagnostics()) {
                diagnostics.add(diagnostic.toMap());
            }
            serializable.put("diagnostics", diagnostics);
        });
        if (error != null) {
            serializable.put("error", error);
        }
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        serializable.put("elapsedMs", elapsed().toMillis());
        return serializable;
    }

    public Duration elapsed() {
        return Duration.between(startedAt, finishedAt);
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Could not serialize export result for " + source, ex);
        }
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
