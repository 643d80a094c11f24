package work.flowscript.exporter.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Lookup-friendly view over a workflow: node-by-id and targets-by-node-and-handle.
 * Built in one pass; edges whose endpoints do not resolve are kept aside instead of failing.
 */
public final class GraphIndex {
    private final Map<String, WorkflowNode> nodes;
    private final Map<String, Map<String, List<String>>> adjacency;
    private final List<WorkflowEdge> edges;
    private final List<WorkflowEdge> droppedEdges;

    private GraphIndex(
        Map<String, WorkflowNode> nodes,
        Map<String, Map<String, List<String>>> adjacency,
        List<WorkflowEdge> edges,
        List<WorkflowEdge> droppedEdges
    ) {
        this.nodes = nodes;
        this.adjacency = adjacency;
        this.edges = edges;
        this.droppedEdges = droppedEdges;
    }

    public static GraphIndex build(Workflow workflow) {
        Objects.requireNonNull(workflow, "workflow");
        return build(workflow.nodes(), workflow.edges());
    }

    public static GraphIndex build(Collection<WorkflowNode> rawNodes, Collection<WorkflowEdge> rawEdges) {
        var nodes = new LinkedHashMap<String, WorkflowNode>();
        for (var node : rawNodes) {
            if (node != null) {
                nodes.put(node.id(), node);
            }
        }
        var adjacency = new LinkedHashMap<String, Map<String, List<String>>>();
        var kept = new ArrayList<WorkflowEdge>();
        var dropped = new ArrayList<WorkflowEdge>();
        for (var edge : rawEdges) {
            if (edge == null) continue;
            if (!nodes.containsKey(edge.source()) || !nodes.containsKey(edge.target())) {
                dropped.add(edge);
                continue;
            }
            kept.add(edge);
            adjacency
                .computeIfAbsent(edge.source(), ignored -> new LinkedHashMap<>())
                .computeIfAbsent(edge.handle(), ignored -> new ArrayList<>())
                .add(edge.target());
        }
        return new GraphIndex(
            Collections.unmodifiableMap(nodes),
            adjacency,
            Collections.unmodifiableList(kept),
            Collections.unmodifiableList(dropped)
        );
    }

    public WorkflowNode node(String id) {
        return id == null ? null : nodes.get(id);
    }

    public boolean contains(String id) {
        return id != null && nodes.containsKey(id);
    }

    /**
     * All nodes in document order.
     */
    public Collection<WorkflowNode> nodes() {
        return nodes.values();
    }

    /**
     * Retained edges in document order.
     */
    public List<WorkflowEdge> edges() {
        return edges;
    }

    public List<WorkflowEdge> droppedEdges() {
        return droppedEdges;
    }

    public List<String> targets(String nodeId, String handle) {
        var byHandle = adjacency.get(nodeId);
        if (byHandle == null) {
            return List.of();
        }
        var targets = byHandle.get(handle);
        return targets == null ? List.of() : Collections.unmodifiableList(targets);
    }

    /**
     * Targets of the first handle alias that has any edges; editors spell some handles two ways.
     */
    public List<String> firstTargets(String nodeId, String... handleAliases) {
        for (var handle : handleAliases) {
            var targets = targets(nodeId, handle);
            if (!targets.isEmpty()) {
                return targets;
            }
        }
        return List.of();
    }

    /**
     * Outgoing handles of a node with their targets, in first-seen edge order.
     */
    public Map<String, List<String>> outgoing(String nodeId) {
        var byHandle = adjacency.get(nodeId);
        return byHandle == null ? Map.of() : Collections.unmodifiableMap(byHandle);
    }
}
