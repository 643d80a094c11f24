package work.flowscript.exporter.expr;

import java.util.ArrayList;
import java.util.List;

/**
 * Scans {@code {name}} interpolation tokens. A token is a non-empty run of characters other than
 * braces enclosed in braces; any other brace is literal text.
 */
public final class TemplateParser {
    private TemplateParser() {}

    public static TemplateExpr parse(String raw) {
        if (raw == null || raw.isEmpty()) {
            return new TemplateExpr.Literal("");
        }
        var parts = new ArrayList<TemplateExpr>();
        var literal = new StringBuilder();
        int i = 0;
        while (i < raw.length()) {
            char c = raw.charAt(i);
            int close = c == '{' ? tokenEnd(raw, i) : -1;
            if (close < 0) {
                literal.append(c);
                i++;
                continue;
            }
            if (literal.length() > 0) {
                parts.add(new TemplateExpr.Literal(literal.toString()));
                literal.setLength(0);
            }
            var name = raw.substring(i + 1, close);
            parts.add(new TemplateExpr.Lookup(name, IdentifierSanitizer.variable(name)));
            i = close + 1;
        }
        if (literal.length() > 0) {
            parts.add(new TemplateExpr.Literal(literal.toString()));
        }
        return collapse(parts);
    }

    public static boolean hasTokens(String raw) {
        return !(parse(raw) instanceof TemplateExpr.Literal);
    }

    private static int tokenEnd(String raw, int open) {
        for (int j = open + 1; j < raw.length(); j++) {
            char c = raw.charAt(j);
            if (c == '}') {
                return j == open + 1 ? -1 : j;
            }
            if (c == '{') {
                return -1;
            }
        }
        return -1;
    }

    private static TemplateExpr collapse(List<TemplateExpr> parts) {
        if (parts.size() == 1) {
            return parts.get(0);
        }
        return new TemplateExpr.Concat(parts);
    }
}
