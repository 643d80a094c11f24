package work.flowscript.exporter.compiler;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Non-fatal finding recorded while compiling (dropped edge, unsupported module, ...).
 */
public record ExportDiagnostic(Severity severity, String code, String message, String nodeId) {
    public static final String DANGLING_EDGE = "dangling-edge";
    public static final String DUPLICATE_SUBFLOW = "duplicate-subflow";
    public static final String SUBFLOW_NAME_COLLISION = "subflow-name-collision";
    public static final String CYCLIC_RESIDUE = "cyclic-residue";
    public static final String UNSUPPORTED_MODULE = "unsupported-module";
    public static final String MISSING_SUBFLOW = "missing-subflow";
    public static final String LOOP_CONTROL_OUTSIDE_LOOP = "loop-control-outside-loop";
    public static final String GENERATOR_FAILURE = "generator-failure";

    public ExportDiagnostic {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(code, "code");
        message = message == null ? code : message;
    }

    public static ExportDiagnostic info(String code, String message, String nodeId) {
        return new ExportDiagnostic(Severity.INFO, code, message, nodeId);
    }

    public static ExportDiagnostic warn(String code, String message, String nodeId) {
        return new ExportDiagnostic(Severity.WARN, code, message, nodeId);
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("severity", severity.name().toLowerCase());
        map.put("code", code);
        map.put("message", message);
        if (nodeId != null) {
            map.put("nodeId", nodeId);
        }
        return map;
    }

    public enum Severity {
        INFO,
        WARN
    }
}
