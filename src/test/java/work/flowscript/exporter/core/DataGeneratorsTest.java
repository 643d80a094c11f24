package work.flowscript.exporter.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.flowscript.exporter.support.WorkflowFixtures.compile;
import static work.flowscript.exporter.support.WorkflowFixtures.lineOf;
import static work.flowscript.exporter.support.WorkflowFixtures.node;
import static work.flowscript.exporter.support.WorkflowFixtures.strippedLines;
import static work.flowscript.exporter.support.WorkflowFixtures.workflow;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.flowscript.exporter.graph.WorkflowNode;

class DataGeneratorsTest {
    private static String emit(WorkflowNode node) {
        return compile(workflow(List.of(node), List.of())).code();
    }

    @Test
    void setVariableWritesSanitizedKey() {
        assertTrue(emit(node("s", "set_variable", "variableName", "2nd value", "variableValue", 7))
            .contains("variables[\"var_2nd_value\"] = 7"));
    }

    @Test
    void missingTargetVariableEmitsNoAssignment() {
        var code = emit(node("s", "string_case", "inputText", "abc"));
        assertFalse(code.contains(".upper()"));
    }

    @Test
    void printLogPrefixesLevel() {
        assertTrue(emit(node("p", "print_log", "logMessage", "{count} items", "logLevel", "error"))
            .contains("print(\"[ERROR] \" + str(f'{variables.get(\"count\", \"\")} items'))"));
    }

    @Test
    void stringTransformations() {
        assertTrue(emit(node("c", "string_concat", "string1", "a", "string2", "{b}", "variableName", "ab"))
            .contains("variables[\"ab\"] = str(\"a\") + str(variables.get(\"b\", \"\"))"));
        assertTrue(emit(node("r", "string_replace", "inputText", "{s}", "searchValue", "\\d+", "replaceValue", "#",
                "replaceMode", "regex", "replaceAll", false, "variableName", "out"))
            .contains("variables[\"out\"] = re.sub(str(\"\\\\d+\"), str(\"#\"), str(variables.get(\"s\", \"\")), count=1)"));
        assertTrue(emit(node("t", "string_trim", "inputText", " x ", "trimMode", "all", "variableName", "t"))
            .contains("variables[\"t\"] = \"\".join(str(\" x \").split())"));
        assertTrue(emit(node("c", "string_case", "inputText", "x", "caseMode", "title", "variableName", "c"))
            .contains("variables[\"c\"] = str(\"x\").title()"));
    }

    @Test
    void regexExtractPrefersFirstGroup() {
        var code = emit(node("r", "regex_extract", "sourceText", "{page}", "pattern", "id=(\\d+)", "variableName", "id"));
        assertTrue(code.contains("_match = re.search(str(\"id=(\\\\d+)\"), str(variables.get(\"page\", \"\")))"), code);
        assertTrue(code.contains("variables[\"id\"] = _match.group(1) if _match and _match.groups() else (_match.group(0) if _match else \"\")"));
    }

    @Test
    void listOperationsInitialiseTheList() {
        var code = emit(node("l", "list_operation", "listVariable", "seen", "operation", "remove", "value", "{item}"));
        int guard = lineOf(code, "if \"seen\" not in variables:");
        assertTrue(guard > 0);
        assertEquals("variables[\"seen\"] = []", strippedLines(code).get(guard + 1));
        assertTrue(code.contains("if variables.get(\"item\", \"\") in variables[\"seen\"]:"));
        assertTrue(code.contains("variables[\"seen\"].remove(variables.get(\"item\", \"\"))"));
    }

    @Test
    void listAndDictReads() {
        var get = emit(node("g", "list_get", "listVariable", "rows", "index", -1, "variableName", "last"));
        assertTrue(get.contains("_list = variables.get(\"rows\", [])"));
        assertTrue(get.contains("_idx = int(-1)"));
        assertTrue(get.contains("variables[\"last\"] = _list[_idx] if -len(_list) <= _idx < len(_list) else None"));

        assertTrue(emit(node("n", "list_length", "listVariable", "rows", "variableName", "count"))
            .contains("variables[\"count\"] = len(variables.get(\"rows\", []))"));
        assertTrue(emit(node("d", "dict_get", "dictVariable", "cfg", "dictKey", "k", "variableName", "v", "defaultValue", "none"))
            .contains("variables[\"v\"] = variables.get(\"cfg\", {}).get(\"k\", \"none\")"));
    }

    @Test
    void dictOperationSetsKeys() {
        var code = emit(node("d", "dict_operation", "dictVariable", "cfg", "dictKey", "{k}", "dictValue", 1));
        assertTrue(code.contains("if \"cfg\" not in variables:"));
        assertTrue(code.contains("variables[\"cfg\"][variables.get(\"k\", \"\")] = 1"));
    }

    @Test
    void randomAndTime() {
        assertTrue(emit(node("r", "random_number", "minValue", 1, "maxValue", "{max}", "variableName", "n"))
            .contains("variables[\"n\"] = random.randint(int(1), int(variables.get(\"max\", \"\")))"));
        assertTrue(emit(node("t", "get_time", "format", "%H:%M", "variableName", "now"))
            .contains("variables[\"now\"] = datetime.now().strftime(\"%H:%M\")"));
    }

    @Test
    void noteBecomesComments() {
        var code = emit(node("n", "note", "content", "first line\nsecond line"));
        assertTrue(code.contains("# first line\n"));
        assertTrue(code.contains("# second line\n"));
    }

    @Test
    void splitJoinAndSubstring() {
        assertTrue(emit(node("s", "string_split", "inputText", "{csv}", "variableName", "parts"))
            .contains("variables[\"parts\"] = str(variables.get(\"csv\", \"\")).split(str(\",\"))"));
        assertTrue(emit(node("s", "string_split", "inputText", "a b c", "separator", " ", "maxSplit", 1, "variableName", "p"))
            .contains("variables[\"p\"] = str(\"a b c\").split(str(\" \"), int(1))"));

        var join = emit(node("j", "string_join", "listVariable", "parts", "separator", ";", "variableName", "joined"));
        assertTrue(join.contains("_list = variables.get(\"parts\", [])"));
        assertTrue(join.contains("variables[\"joined\"] = str(\";\").join(str(x) for x in _list)"));

        assertTrue(emit(node("t", "string_substring", "inputText", "{s}", "startIndex", 2, "variableName", "tail"))
            .contains("variables[\"tail\"] = str(variables.get(\"s\", \"\"))[int(2):]"));
        assertTrue(emit(node("t", "string_substring", "inputText", "{s}", "startIndex", 0, "endIndex", "{n}", "variableName", "head"))
            .contains("variables[\"head\"] = str(variables.get(\"s\", \"\"))[int(0):int(variables.get(\"n\", \"\"))]"));
    }

    @Test
    void jsonParseWalksThePath() {
        var code = emit(node("j", "json_parse", "sourceVariable", "body", "jsonPath", "$.data.items[0].name", "variableName", "first"));
        var lines = strippedLines(code);
        int load = lines.indexOf("_json_data = variables.get(\"body\", {})");
        assertTrue(load > 0, code);
        assertEquals("if isinstance(_json_data, str):", lines.get(load + 1));
        assertTrue(code.contains("except (ValueError, TypeError):"));
        int start = lines.indexOf("_result = _json_data");
        assertEquals(List.of(
            "_result = _result.get(\"data\") if isinstance(_result, dict) else None",
            "_result = _result.get(\"items\") if isinstance(_result, dict) else None",
            "_result = _result[0] if isinstance(_result, list) and len(_result) > 0 else None",
            "_result = _result.get(\"name\") if isinstance(_result, dict) else None",
            "variables[\"first\"] = _result"
        ), lines.subList(start + 1, start + 6));

        var whole = emit(node("j", "json_parse", "sourceVariable", "body", "variableName", "doc"));
        assertTrue(whole.contains("variables[\"doc\"] = _json_data"));
        assertFalse(whole.contains("_result"));
    }

    @Test
    void base64Operations() {
        assertTrue(emit(node("b", "base64", "inputText", "{secret}", "variableName", "enc"))
            .contains("variables[\"enc\"] = base64.b64encode(str(variables.get(\"secret\", \"\")).encode()).decode()"));
        assertTrue(emit(node("b", "base64", "operation", "decode", "inputBase64", "aGk=", "variableName", "dec"))
            .contains("variables[\"dec\"] = base64.b64decode(str(\"aGk=\")).decode()"));

        var toFile = emit(node("b", "base64", "operation", "base64_to_file", "inputBase64", "{blob}",
            "outputPath", "out", "fileName", "a.png"));
        assertTrue(toFile.contains("_output_path = os.path.join(\"out\", \"a.png\")"), toFile);
        assertTrue(toFile.contains("with open(_output_path, \"wb\") as _f:"));
        assertTrue(toFile.contains("_f.write(base64.b64decode(str(variables.get(\"blob\", \"\"))))"));
    }

    @Test
    void dictKeysValuesAndItems() {
        assertTrue(emit(node("k", "dict_keys", "dictVariable", "cfg", "variableName", "keys"))
            .contains("variables[\"keys\"] = list(variables.get(\"cfg\", {}).keys())"));
        assertTrue(emit(node("k", "dict_keys", "dictVariable", "cfg", "keyType", "items", "variableName", "pairs"))
            .contains("variables[\"pairs\"] = list(variables.get(\"cfg\", {}).items())"));
    }
}
