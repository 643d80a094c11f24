package work.flowscript.exporter.graph;

import java.util.List;
import java.util.Objects;

/**
 * Root compiler input: the editor document with its nodes, edges and declared variables.
 */
public record Workflow(String name, List<WorkflowNode> nodes, List<WorkflowEdge> edges, List<WorkflowVariable> variables) {
    public static final String DEFAULT_NAME = "Untitled workflow";

    public Workflow {
        name = name == null || name.isBlank() ? DEFAULT_NAME : name;
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
        variables = variables == null ? List.of() : List.copyOf(variables);
    }

    public Workflow(String name, List<WorkflowNode> nodes, List<WorkflowEdge> edges) {
        this(name, nodes, edges, List.of());
    }

    /**
     * Suggested script filename derived from the display name.
     */
    public String scriptFileName() {
        Objects.requireNonNull(name, "name");
        return name.replace(' ', '_').replace('/', '_').replace('\\', '_') + "_playwright.py";
    }
}
