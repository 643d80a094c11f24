package work.flowscript.exporter.graph;

import java.util.Objects;

/**
 * Variable declared on the workflow, initialised before the main routine runs.
 */
public record WorkflowVariable(String name, Object value, VariableType type, String scope) {
    public WorkflowVariable {
        Objects.requireNonNull(name, "name");
        type = type == null ? VariableType.STRING : type;
        scope = scope == null || scope.isBlank() ? "global" : scope;
    }

    public static WorkflowVariable of(String name, Object value, VariableType type) {
        return new WorkflowVariable(name, value, type, null);
    }
}
