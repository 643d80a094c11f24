package work.flowscript.exporter.graph;

import java.util.Objects;

/**
 * Directed connection between two nodes, optionally tagged with the named output it leaves from.
 */
public record WorkflowEdge(String id, String source, String target, String sourceHandle, String targetHandle) {
    public static final String DEFAULT_HANDLE = "default";

    public WorkflowEdge {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        id = id == null ? source + "->" + target : id;
    }

    public static WorkflowEdge of(String source, String target) {
        return new WorkflowEdge(null, source, target, null, null);
    }

    public static WorkflowEdge of(String source, String handle, String target) {
        return new WorkflowEdge(null, source, target, handle, null);
    }

    /**
     * Handle used for adjacency lookups; edges without one share {@link #DEFAULT_HANDLE}.
     */
    public String handle() {
        return sourceHandle == null || sourceHandle.isBlank() ? DEFAULT_HANDLE : sourceHandle;
    }
}
