package work.flowscript.exporter.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Objects;

/**
 * Partitions nodes into sub-procedures using the group markers set by the editor.
 */
public final class SubflowExtractor {
    private SubflowExtractor() {}

    public static SubflowTable extract(GraphIndex index) {
        Objects.requireNonNull(index, "index");
        var byName = new LinkedHashMap<String, Subflow>();
        var duplicates = new ArrayList<String>();
        for (var node : index.nodes()) {
            var name = subflowName(node);
            if (name == null) continue;
            var members = new ArrayList<WorkflowNode>();
            for (var candidate : index.nodes()) {
                if (node.id().equals(candidate.parentId())) {
                    members.add(candidate);
                }
            }
            if (byName.put(name, new Subflow(name, node.id(), members)) != null) {
                duplicates.add(name);
            }
        }
        return new SubflowTable(byName, duplicates);
    }

    /**
     * Declared sub-procedure name of a group node, or {@code null} when the node is not one.
     */
    static String subflowName(WorkflowNode node) {
        if (!node.isGroup() || !Boolean.TRUE.equals(node.data().get("isSubflow"))) {
            return null;
        }
        Object raw = node.data().get("subflowName");
        if (raw == null || String.valueOf(raw).isBlank()) {
            return null;
        }
        return String.valueOf(raw);
    }

    public static boolean isSubflowGroup(WorkflowNode node) {
        return node != null && node.isGroup() && Boolean.TRUE.equals(node.data().get("isSubflow"));
    }
}
