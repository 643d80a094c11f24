package work.flowscript.exporter.flow;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.flowscript.exporter.support.WorkflowFixtures.compile;
import static work.flowscript.exporter.support.WorkflowFixtures.data;
import static work.flowscript.exporter.support.WorkflowFixtures.edge;
import static work.flowscript.exporter.support.WorkflowFixtures.indentOf;
import static work.flowscript.exporter.support.WorkflowFixtures.lineOf;
import static work.flowscript.exporter.support.WorkflowFixtures.node;
import static work.flowscript.exporter.support.WorkflowFixtures.strippedLines;
import static work.flowscript.exporter.support.WorkflowFixtures.workflow;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.flowscript.exporter.compiler.NodeConfig;

class FlowGeneratorsTest {
    @Test
    void comparisonOperatorsRenderPythonConditions() {
        assertEquals(
            "float(variables.get(\"n\", \"\") or 0) >= float(5 or 0)",
            FlowGenerators.conditionExpression(new NodeConfig(data("variableName", "n", "operator", "greater_equal", "compareValue", 5)))
        );
        assertEquals(
            "str(\"x\") in str(variables.get(\"s\", \"\"))",
            FlowGenerators.conditionExpression(new NodeConfig(data("variableName", "s", "operator", "contains", "compareValue", "x")))
        );
        assertEquals(
            "str(variables.get(\"s\", \"\")) == str(\"\")",
            FlowGenerators.conditionExpression(new NodeConfig(data("variableName", "s")))
        );
        assertEquals(
            "str(variables.get(\"s\", \"\")) == \"\"",
            FlowGenerators.conditionExpression(new NodeConfig(data("variableName", "s", "operator", "is_empty")))
        );
    }

    @Test
    void blankExpressionIsAlwaysTrue() {
        assertEquals("True", FlowGenerators.conditionExpression(new NodeConfig(data("conditionMode", "expression"))));
    }

    @Test
    void multiLineExpressionStaysOnTheIfHeader() {
        var config = new NodeConfig(data("conditionMode", "expression", "expression", "{count} > 1 and\r\n{name} != ''\n"));
        assertEquals(
            "variables.get(\"count\", \"\") > 1 and variables.get(\"name\", \"\") != ''",
            FlowGenerators.conditionExpression(config)
        );

        var code = compile(workflow(
            List.of(node("c", "condition", "conditionMode", "expression", "expression", "{a}\n  or {b}"), node("t", "wait")),
            List.of(edge("c", "true", "t"))
        )).code();
        assertTrue(strippedLines(code).contains("if variables.get(\"a\", \"\") or variables.get(\"b\", \"\"):"), code);
    }

    @Test
    void conditionWithoutEdgesGetsEmptyTrueBranchOnly() {
        var code = compile(workflow(List.of(node("c", "condition", "variableName", "v")), List.of())).code();
        int header = lineOf(code, "if str(variables.get(\"v\", \"\"))");
        assertTrue(header > 0);
        assertEquals("pass", strippedLines(code).get(header + 1));
        assertFalse(code.contains("else:"));
    }

    @Test
    void rangeAndWhileLoopHeaders() {
        var range = compile(workflow(
            List.of(node("l", "loop", "loopMode", "range", "startValue", 1, "endValue", "{last}", "stepValue", 2, "indexVariable", "i")),
            List.of()
        )).code();
        assertTrue(range.contains(
            "for _v_i in range(int(1), int(variables.get(\"last\", \"\")) + 1, int(2)):"), range);
        assertTrue(range.contains("variables[\"i\"] = _v_i"));

        var loopWhile = compile(workflow(
            List.of(node("l", "loop", "loopMode", "while", "conditionVariable", "keep going")),
            List.of()
        )).code();
        assertTrue(loopWhile.contains("while variables.get(\"keep_going\", False):"), loopWhile);
        assertFalse(loopWhile.contains("loop_index"));
    }

    @Test
    void continueInsideForeachBody() {
        var code = compile(workflow(
            List.of(
                node("each", "foreach", "sourceVariable", "rows", "itemVariable", "row", "indexVariable", "n"),
                node("skip", "continue_loop")
            ),
            List.of(edge("each", "loop", "skip"))
        )).code();

        assertTrue(code.contains("_foreach_list = variables.get(\"rows\", [])"));
        assertTrue(code.contains("for _v_n, _v_row in enumerate(_foreach_list):"));
        assertTrue(code.contains("variables[\"row\"] = _v_row"));
        assertTrue(strippedLines(code).contains("continue"));
        assertTrue(indentOf(code, "continue") > indentOf(code, "for n, row"));
    }

    @Test
    void subflowCallUsesSanitizedFunctionName() {
        assertEquals("subflow_Fetch_data", FlowGenerators.functionName("Fetch data"));
    }
}
