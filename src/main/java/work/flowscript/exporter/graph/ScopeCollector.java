package work.flowscript.exporter.graph;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Computes the node set of one control-flow region (a branch or a loop body).
 *
 * <p>The region is everything reachable from {@code frontier} that is not also reachable from
 * {@code excluded}. Nodes behind the barrier (already generated, or the control node that owns the
 * region) are never entered, so a loop body cannot flow back through its owner onto the exit edge.
 * Join points reachable from both sides stay outside both regions.
 */
public final class ScopeCollector {
    private final GraphIndex index;
    private final Set<String> barrier;

    public ScopeCollector(GraphIndex index) {
        this(index, Set.of());
    }

    /**
     * @param barrier live view of node ids the traversal must not enter
     */
    public ScopeCollector(GraphIndex index, Set<String> barrier) {
        this.index = Objects.requireNonNull(index, "index");
        this.barrier = barrier == null ? Set.of() : Collections.unmodifiableSet(barrier);
    }

    public Set<String> collect(List<String> frontier, List<String> excluded) {
        return collect(frontier, excluded, null);
    }

    /**
     * Same as {@link #collect(List, List)} but never leaves {@code bounds}, the node set of the
     * enclosing region; {@code null} means unbounded.
     */
    public Set<String> collect(List<String> frontier, List<String> excluded, Set<String> bounds) {
        var withheld = reach(excluded == null ? List.of() : excluded, Set.of(), bounds);
        return reach(frontier == null ? List.of() : frontier, withheld, bounds);
    }

    private Set<String> reach(Collection<String> start, Set<String> refused, Set<String> bounds) {
        var collected = new LinkedHashSet<String>();
        var toVisit = new ArrayDeque<String>(start);
        while (!toVisit.isEmpty()) {
            var id = toVisit.poll();
            if (!index.contains(id) || collected.contains(id) || refused.contains(id) || barrier.contains(id)) {
                continue;
            }
            if (bounds != null && !bounds.contains(id)) {
                continue;
            }
            collected.add(id);
            for (var targets : index.outgoing(id).values()) {
                for (var target : targets) {
                    if (!collected.contains(target)) {
                        toVisit.add(target);
                    }
                }
            }
        }
        return collected;
    }
}
