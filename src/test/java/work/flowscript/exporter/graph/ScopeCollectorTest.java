package work.flowscript.exporter.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.flowscript.exporter.support.WorkflowFixtures.edge;
import static work.flowscript.exporter.support.WorkflowFixtures.node;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ScopeCollectorTest {
    private static GraphIndex diamond() {
        return GraphIndex.build(
            List.of(node("if", "condition"), node("t1", "wait"), node("t2", "wait"), node("f1", "wait"), node("join", "wait")),
            List.of(
                edge("if", "true", "t1"),
                edge("if", "false", "f1"),
                edge("t1", "t2"),
                edge("t2", "join"),
                edge("f1", "join")
            )
        );
    }

    @Test
    void branchesAreExclusiveAndJoinBelongsToNeither() {
        var collector = new ScopeCollector(diamond(), Set.of("if"));

        var trueScope = collector.collect(List.of("t1"), List.of("f1"));
        var falseScope = collector.collect(List.of("f1"), List.of("t1"));

        assertEquals(List.of("t1", "t2"), List.copyOf(trueScope));
        assertEquals(Set.of("f1"), falseScope);
        assertTrue(Collections.disjoint(trueScope, falseScope));
    }

    @Test
    void loopBodyStopsAtExitAndOwner() {
        var index = GraphIndex.build(
            List.of(node("loop", "loop"), node("body", "click_element"), node("after", "close_page")),
            List.of(
                edge("loop", "loop", "body"),
                edge("loop", "done", "after"),
                edge("body", "loop")
            )
        );
        var collector = new ScopeCollector(index, Set.of("loop"));

        var body = collector.collect(List.of("body"), List.of("after"));

        assertEquals(Set.of("body"), body);
    }

    @Test
    void barrierIsALiveView() {
        var processed = new HashSet<String>();
        var collector = new ScopeCollector(diamond(), processed);
        assertTrue(collector.collect(List.of("t1"), List.of()).contains("join"));

        processed.add("join");
        assertFalse(collector.collect(List.of("t1"), List.of()).contains("join"));
    }

    @Test
    void boundsLimitTraversal() {
        var collector = new ScopeCollector(diamond());
        var scope = collector.collect(List.of("t1"), List.of(), Set.of("t1", "t2"));
        assertEquals(Set.of("t1", "t2"), scope);
    }

    @Test
    void unknownFrontierIdsAreIgnored() {
        var collector = new ScopeCollector(diamond());
        assertTrue(collector.collect(List.of("ghost"), List.of()).isEmpty());
    }
}
