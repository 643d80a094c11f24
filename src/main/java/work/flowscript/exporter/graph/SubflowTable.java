package work.flowscript.exporter.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Sub-procedures keyed by declared name, in declaration order.
 */
public final class SubflowTable {
    private final Map<String, Subflow> byName;
    private final List<String> duplicateNames;

    SubflowTable(Map<String, Subflow> byName, List<String> duplicateNames) {
        this.byName = Collections.unmodifiableMap(byName);
        this.duplicateNames = List.copyOf(duplicateNames);
    }

    public Subflow get(String name) {
        return name == null ? null : byName.get(name);
    }

    public boolean contains(String name) {
        return name != null && byName.containsKey(name);
    }

    public Collection<Subflow> all() {
        return byName.values();
    }

    public boolean isEmpty() {
        return byName.isEmpty();
    }

    /**
     * Names declared by more than one group; the last declaration won.
     */
    public List<String> duplicateNames() {
        return duplicateNames;
    }

    /**
     * Ids owned by sub-procedures: every member plus every defining group.
     */
    public Set<String> claimedIds() {
        var claimed = new HashSet<String>();
        for (var subflow : byName.values()) {
            claimed.add(subflow.groupId());
            claimed.addAll(subflow.memberIds());
        }
        return claimed;
    }

    /**
     * Main-flow node ids in document order.
     */
    public List<String> mainFlow(GraphIndex index) {
        var claimed = claimedIds();
        var main = new ArrayList<String>();
        for (var node : index.nodes()) {
            if (!claimed.contains(node.id())) {
                main.add(node.id());
            }
        }
        return main;
    }
}
