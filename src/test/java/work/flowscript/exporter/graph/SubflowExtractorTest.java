package work.flowscript.exporter.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.flowscript.exporter.support.WorkflowFixtures.child;
import static work.flowscript.exporter.support.WorkflowFixtures.data;
import static work.flowscript.exporter.support.WorkflowFixtures.node;
import static work.flowscript.exporter.support.WorkflowFixtures.subflowGroup;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SubflowExtractorTest {
    @Test
    void collectsMembersByParentId() {
        var index = GraphIndex.build(List.of(
            node("start", "open_page"),
            subflowGroup("g1", "Login"),
            child("m1", "input_text", "g1"),
            child("m2", "click_element", "g1"),
            node("end", "close_page")
        ), List.of());

        var table = SubflowExtractor.extract(index);

        var login = table.get("Login");
        assertNotNull(login);
        assertEquals("g1", login.groupId());
        assertEquals(Set.of("m1", "m2"), login.memberIds());
        assertEquals(List.of("start", "end"), table.mainFlow(index));
    }

    @Test
    void plainGroupsAndUnnamedSubflowsAreNotSubflows() {
        var index = GraphIndex.build(List.of(
            new WorkflowNode("g", WorkflowNode.GROUP_TYPE, data("label", "Just a box"), null),
            new WorkflowNode("u", WorkflowNode.GROUP_TYPE, data("isSubflow", true, "subflowName", " "), null),
            child("m", "wait", "g")
        ), List.of());

        var table = SubflowExtractor.extract(index);

        assertTrue(table.isEmpty());
        assertEquals(List.of("g", "u", "m"), table.mainFlow(index));
    }

    @Test
    void duplicateNamesKeepLastDeclaration() {
        var index = GraphIndex.build(List.of(
            subflowGroup("g1", "Shared"),
            child("a", "wait", "g1"),
            subflowGroup("g2", "Shared"),
            child("b", "wait", "g2")
        ), List.of());

        var table = SubflowExtractor.extract(index);

        assertEquals(1, table.all().size());
        assertEquals("g2", table.get("Shared").groupId());
        assertEquals(List.of("Shared"), table.duplicateNames());
        assertFalse(table.claimedIds().contains("g1"));
    }
}
