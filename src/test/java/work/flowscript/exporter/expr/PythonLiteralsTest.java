package work.flowscript.exporter.expr;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.LinkedHashMap;
import java.util.List;
import org.junit.jupiter.api.Test;

class PythonLiteralsTest {
    @Test
    void escapesStrings() {
        assertEquals("\"a\\\"b\\n\\\\\"", PythonLiterals.string("a\"b\n\\"));
        assertEquals("\"\\x00\"", PythonLiterals.string("\u0000"));
    }

    @Test
    void rendersNestedStructures() {
        var map = new LinkedHashMap<String, Object>();
        map.put("k", List.of(1, true));
        map.put("n", null);
        assertEquals("{\"k\": [1, True], \"n\": None}", PythonLiterals.value(map));
    }

    @Test
    void rendersFloatsAsPython() {
        assertEquals("1.5", PythonLiterals.number(1.5));
        assertEquals("float(\"nan\")", PythonLiterals.number(Double.NaN));
        assertEquals("-float(\"inf\")", PythonLiterals.number(Double.NEGATIVE_INFINITY));
        assertEquals("7", PythonLiterals.number(7L));
    }
}
