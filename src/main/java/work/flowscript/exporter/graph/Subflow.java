package work.flowscript.exporter.graph;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A named sub-procedure: the defining group node and the nodes placed inside it.
 */
public record Subflow(String name, String groupId, List<WorkflowNode> members) {
    public Subflow {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(groupId, "groupId");
        members = members == null ? List.of() : List.copyOf(members);
    }

    public Set<String> memberIds() {
        var ids = new LinkedHashSet<String>();
        for (var member : members) {
            ids.add(member.id());
        }
        return ids;
    }
}
