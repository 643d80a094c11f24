package work.flowscript.exporter.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Orders a node subset along its edges (Kahn's algorithm with a FIFO queue).
 * Nodes left over by a cycle are appended in their original order, so the output is always a
 * permutation of the input.
 */
public final class TopologicalScheduler {
    private final GraphIndex index;

    public TopologicalScheduler(GraphIndex index) {
        this.index = Objects.requireNonNull(index, "index");
    }

    public List<String> order(Collection<String> ids) {
        return schedule(ids).order();
    }

    public Schedule schedule(Collection<String> ids) {
        var members = new LinkedHashSet<String>(ids);
        var inDegree = new HashMap<String, Integer>();
        var successors = new HashMap<String, List<String>>();
        for (var id : members) {
            inDegree.put(id, 0);
        }
        for (var edge : index.edges()) {
            if (!members.contains(edge.source()) || !members.contains(edge.target())) continue;
            successors.computeIfAbsent(edge.source(), ignored -> new ArrayList<>()).add(edge.target());
            inDegree.merge(edge.target(), 1, Integer::sum);
        }

        var queue = new ArrayDeque<String>();
        for (var id : members) {
            if (inDegree.get(id) == 0) {
                queue.add(id);
            }
        }
        var emitted = new LinkedHashSet<String>();
        while (!queue.isEmpty()) {
            var id = queue.poll();
            emitted.add(id);
            for (var next : successors.getOrDefault(id, List.of())) {
                int remaining = inDegree.merge(next, -1, Integer::sum);
                if (remaining == 0) {
                    queue.add(next);
                }
            }
        }

        var residue = new ArrayList<String>();
        for (var id : members) {
            if (!emitted.contains(id)) {
                residue.add(id);
            }
        }
        var order = new ArrayList<String>(emitted);
        order.addAll(residue);
        return new Schedule(List.copyOf(order), List.copyOf(residue));
    }

    /**
     * Scheduling outcome; {@code residue} lists the nodes appended because of a cycle.
     */
    public record Schedule(List<String> order, List<String> residue) {
        public boolean hasResidue() {
            return !residue.isEmpty();
        }
    }
}
