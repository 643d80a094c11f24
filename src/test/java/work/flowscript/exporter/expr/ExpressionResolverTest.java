package work.flowscript.exporter.expr;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class ExpressionResolverTest {
    @Test
    void plainTextIsALiteral() {
        assertEquals("\"https://example.test\"", ExpressionResolver.resolve("https://example.test"));
    }

    @Test
    void singleTokenIsALookup() {
        assertEquals("variables.get(\"greeting\", \"\")", ExpressionResolver.resolve("{greeting}"));
    }

    @Test
    void mixedTextBecomesAnFString() {
        assertEquals(
            "f'Hello {variables.get(\"my_var\", \"\")}!'",
            ExpressionResolver.resolve("Hello {my var}!")
        );
    }

    @Test
    void literalBracesAreEscapedInFStrings() {
        assertEquals(
            "f'use {{}} and {variables.get(\"x\", \"\")}'",
            ExpressionResolver.resolve("use {} and {x}")
        );
        assertEquals("\"json {}\"", ExpressionResolver.resolve("json {}"));
    }

    @Test
    void quotesInFStringFragmentsAreEscaped() {
        assertEquals("f'it\\'s {variables.get(\"who\", \"\")}'", ExpressionResolver.resolve("it's {who}"));
    }

    @Test
    void nonStringsRenderAsPythonLiterals() {
        assertEquals("42", ExpressionResolver.resolve(42));
        assertEquals("True", ExpressionResolver.resolve(true));
        assertEquals("\"\"", ExpressionResolver.resolve(null));
        assertEquals("[1, \"a\"]", ExpressionResolver.resolve(List.of(1, "a")));
    }

    @Test
    void codeInlinesLookupsWithoutQuoting() {
        assertEquals("int(variables.get(\"count\", \"\")) > 3", ExpressionResolver.code("int({count}) > 3"));
        assertEquals("True", ExpressionResolver.code("True"));
    }

    @Test
    void slotsAndKeysAreSanitized() {
        assertEquals("variables[\"my_var\"]", ExpressionResolver.slot("my var"));
        assertEquals("variables.get(\"var_1x\", [])", ExpressionResolver.lookup("1x", "[]"));
    }

    @Test
    void parserSplitsTokensAndText() {
        var expr = TemplateParser.parse("a{b}c");
        var concat = assertInstanceOf(TemplateExpr.Concat.class, expr);
        assertEquals(3, concat.parts().size());
        assertEquals(new TemplateExpr.Lookup("b", "b"), concat.parts().get(1));
        assertTrue(TemplateParser.hasTokens("{x}"));
        assertFalse(TemplateParser.hasTokens("{ unterminated"));
        assertFalse(TemplateParser.hasTokens("{}"));
    }
}
